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
 * Helpers for building applications of structural recursion principles,
 * shared by the synthesizers and the lifting engine. Throughout, the
 * <em>target context</em> is the context in which the eliminator being built
 * will live, and all parameters supplied are terms valid in that context.
 *
 * @author David J. Pearce
 *
 */
public class Eliminators {

	/**
	 * Instantiate the index telescope of a declaration with given parameters.
	 * The <code>j</code>th binding lives in the target context extended with
	 * the <code>j</code> bindings before it.
	 *
	 * @param declaration
	 * @param parameters
	 * @return
	 */
	public static Binding[] indexBinders(TypeDeclaration declaration, Term[] parameters) {
		Binding[] indices = declaration.indices();
		int np = parameters.length;
		Binding[] r = new Binding[indices.length];
		for (int j = 0; j != indices.length; ++j) {
			Term[] locals = new Term[j + np];
			for (int k = 0; k != j; ++k) {
				locals[k] = new Term.Variable(k);
			}
			for (int m = 0; m != np; ++m) {
				locals[j + m] = Terms.shift(parameters[np - 1 - m], j);
			}
			r[j] = new Binding(indices[j].name(), Terms.substitute(indices[j].type(), locals, j));
		}
		return r;
	}

	/**
	 * Construct a motive <code>fun is (x : D ps is) => body</code> for a given
	 * declaration. The body lives in the target context extended with the
	 * indices and the value.
	 *
	 * @param declaration
	 * @param parameters
	 * @param body
	 * @return
	 */
	public static Term motive(TypeDeclaration declaration, Term[] parameters, Term body) {
		int k = declaration.indices().length;
		Term self = declaration.apply(Terms.shift(parameters, k), Terms.variables(k, 0));
		return Telescope.lambdas(indexBinders(declaration, parameters), new Term.Lambda("x", self, body));
	}

	/**
	 * Get the slots of a case for given parameters and motive, which are the
	 * bindings a term handling this case must abstract over.
	 *
	 * @param principle
	 * @param constructor
	 * @param parameters
	 * @param motive
	 * @param slots       The number of slots in the case.
	 * @return
	 */
	public static Telescope slots(StructuralRecursionPrinciple principle, int constructor, Term[] parameters,
			Term motive, int slots) {
		return Telescope.ofProducts(principle.instantiateCase(constructor, parameters, motive), slots);
	}

	/**
	 * Move a term from the context of a case (i.e. the parameters, the motive
	 * and the case's slots) into the target context extended with some number
	 * of further binders. Each slot is replaced with a given value.
	 *
	 * @param term
	 * @param slotValues The value of each slot (outermost first), valid in the
	 *                   extended target context.
	 * @param motive     The motive, valid in the target context.
	 * @param parameters The parameters, valid in the target context.
	 * @param extension  The number of binders extending the target context.
	 * @return
	 */
	public static Term relocate(Term term, Term[] slotValues, Term motive, Term[] parameters, int extension) {
		int n = slotValues.length;
		int np = parameters.length;
		Term[] locals = new Term[n + 1 + np];
		for (int k = 0; k != n; ++k) {
			locals[k] = slotValues[n - 1 - k];
		}
		locals[n] = Terms.shift(motive, extension);
		for (int m = 0; m != np; ++m) {
			locals[n + 1 + m] = Terms.shift(parameters[np - 1 - m], extension);
		}
		return Terms.substitute(term, locals, extension);
	}

	/**
	 * Get the index arguments of an application of a declaration.
	 *
	 * @param declaration
	 * @param type
	 * @return
	 */
	public static Term[] indicesOf(TypeDeclaration declaration, Term type) {
		Term[] args = Terms.arguments(type);
		int np = declaration.parameters().length;
		Term[] r = new Term[args.length - np];
		System.arraycopy(args, np, r, 0, r.length);
		return r;
	}

	/**
	 * Get the parameter arguments of an application of a declaration.
	 *
	 * @param declaration
	 * @param type
	 * @return
	 */
	public static Term[] parametersOf(TypeDeclaration declaration, Term type) {
		Term[] args = Terms.arguments(type);
		Term[] r = new Term[declaration.parameters().length];
		System.arraycopy(args, 0, r, 0, r.length);
		return r;
	}
}
