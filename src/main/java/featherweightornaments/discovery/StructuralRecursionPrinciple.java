// This file is part of the Featherweight Ornaments Library (fwo).
//
// The Featherweight Ornaments Library is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The Featherweight Ornaments Library is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the Featherweight Ornaments Library. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package featherweightornaments.discovery;

import featherweightornaments.core.Syntax.Binding;
import featherweightornaments.core.Syntax.Term;
import featherweightornaments.core.Telescope;
import featherweightornaments.core.Terms;
import featherweightornaments.core.TypeDeclaration;

/**
 * The signature of the structural recursion principle (i.e. eliminator) of an
 * inductive type. For lists this is:
 *
 * <pre>
 * forall (T : Type) (P : list T -> Type),
 *   P (nil T) ->
 *   (forall (x : T) (l : list T), P l -> P (cons T x l)) ->
 *   forall (l : list T), P l
 * </pre>
 *
 * The motive type lives in the context of the parameters, whilst each case
 * type lives in the context of the parameters and the motive
 * <code>P</code>. Within each case, every recursive argument is immediately
 * followed by its inductive hypothesis.
 *
 * @author David J. Pearce
 *
 */
public class StructuralRecursionPrinciple {
	private final TypeDeclaration declaration;
	private final Term motiveType;
	private final Term[] cases;

	public StructuralRecursionPrinciple(TypeDeclaration declaration, Term motiveType, Term[] cases) {
		this.declaration = declaration;
		this.motiveType = motiveType;
		this.cases = cases;
	}

	public TypeDeclaration declaration() {
		return declaration;
	}

	public int parameterCount() {
		return declaration.parameters().length;
	}

	public int indexCount() {
		return declaration.indices().length;
	}

	/**
	 * Get the type of the motive, in the context of the parameters.
	 *
	 * @return
	 */
	public Term motiveType() {
		return motiveType;
	}

	/**
	 * Get the type of the <code>i</code>th case, in the context of the
	 * parameters and the motive.
	 *
	 * @param i
	 * @return
	 */
	public Term caseType(int i) {
		return cases[i];
	}

	public Term[] caseTypes() {
		return cases;
	}

	/**
	 * Get the conclusion of the principle, in the context of the parameters and
	 * the motive. This maps every value of the type to the motive applied to
	 * it.
	 *
	 * @return
	 */
	public Term conclusion() {
		int np = parameterCount();
		int k = indexCount();
		Binding[] indices = declaration.indices();
		Binding[] binders = new Binding[k + 1];
		for (int i = 0; i != k; ++i) {
			// skip over the motive
			binders[i] = new Binding(indices[i].name(), Terms.shift(indices[i].type(), 1, i));
		}
		Term self = declaration.apply(Terms.variables(np, k + 1), Terms.variables(k, 0));
		binders[k] = new Binding("x", self);
		Term body = Terms.apply(new Term.Variable(k + 1), Terms.append(Terms.variables(k, 1), new Term.Variable(0)));
		return Telescope.products(binders, body);
	}

	/**
	 * Get the full type of this principle.
	 *
	 * @return
	 */
	public Term type() {
		Term body = Terms.shift(conclusion(), cases.length);
		for (int i = cases.length - 1; i >= 0; --i) {
			body = new Term.Pi("f" + i, Terms.shift(cases[i], i), body);
		}
		body = new Term.Pi("P", motiveType, body);
		return Telescope.products(declaration.parameters(), body);
	}

	/**
	 * Instantiate the <code>i</code>th case type with concrete parameters and
	 * motive, both of which live in the target context. Beta redexes arising
	 * from applying the motive are contracted.
	 *
	 * @param i
	 * @param parameters
	 * @param motive
	 * @return
	 */
	public Term instantiateCase(int i, Term[] parameters, Term motive) {
		return Terms.beta(Terms.instantiate(cases[i], Terms.append(parameters, motive)));
	}

	@Override
	public String toString() {
		return declaration.name() + "_rect : " + type();
	}
}
