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
 * Extracts structural information from inductive type declarations. In
 * particular, this derives the signature of a declaration's structural
 * recursion principle.
 *
 * @author David J. Pearce
 *
 */
public class TypeIntrospection {

	/**
	 * Derive the structural recursion principle of a given declaration.
	 *
	 * @param declaration
	 * @return
	 */
	public static StructuralRecursionPrinciple principle(TypeDeclaration declaration) {
		Term[] cases = new Term[declaration.constructors().length];
		for (int i = 0; i != cases.length; ++i) {
			cases[i] = caseType(declaration, i);
		}
		return new StructuralRecursionPrinciple(declaration, motiveType(declaration), cases);
	}

	/**
	 * Construct the type of the motive, which is a function from the indices
	 * and a value of the type into a sort.
	 *
	 * @param declaration
	 * @return
	 */
	private static Term motiveType(TypeDeclaration declaration) {
		int np = declaration.parameters().length;
		int k = declaration.indices().length;
		Term self = declaration.apply(Terms.variables(np, k), Terms.variables(k, 0));
		Term body = new Term.Pi("x", self, Term.Sort.TYPE);
		return Telescope.products(declaration.indices(), body);
	}

	/**
	 * Construct the type of the case for a given constructor. Since inductive
	 * hypotheses are inserted after each recursive argument, variables in the
	 * constructor's argument types are remapped to account for them.
	 *
	 * @param declaration
	 * @param j
	 * @return
	 */
	private static Term caseType(TypeDeclaration declaration, int j) {
		TypeDeclaration.Constructor c = declaration.constructor(j);
		int np = declaration.parameters().length;
		Binding[] args = c.arguments();
		int m = args.length;
		// Determine the slot occupied by each argument
		int[] slotOf = new int[m + 1];
		int slots = 0;
		for (int i = 0; i != m; ++i) {
			slotOf[i] = slots;
			slots += declaration.isRecursive(j, i) ? 2 : 1;
		}
		slotOf[m] = slots;
		// Construct the conclusion
		Term[] argVars = new Term[m];
		for (int a = 0; a != m; ++a) {
			argVars[a] = new Term.Variable(slots - 1 - slotOf[a]);
		}
		Term value = declaration.construct(j, Terms.variables(np, slots + 1), argVars);
		Term[] indices = remap(c.indices(), m, slotOf);
		Term body = Terms.apply(new Term.Variable(slots), Terms.append(indices, value));
		// Wrap the arguments and hypotheses
		for (int a = m - 1; a >= 0; --a) {
			Term type = args[a].type();
			if (declaration.isRecursive(j, a)) {
				Term[] targs = Terms.arguments(type);
				Term[] recIndices = new Term[targs.length - np];
				System.arraycopy(targs, np, recIndices, 0, recIndices.length);
				recIndices = Terms.shift(remap(recIndices, a, slotOf), 1);
				Term hypothesis = Terms.apply(new Term.Variable(slotOf[a] + 1),
						Terms.append(recIndices, new Term.Variable(0)));
				body = new Term.Pi("IH" + args[a].name(), hypothesis, body);
			}
			body = new Term.Pi(args[a].name(), remap(type, a, slotOf), body);
		}
		return body;
	}

	/**
	 * Move a term from the context of the parameters and the first
	 * <code>a</code> constructor arguments into the context of the parameters,
	 * the motive and the slots preceding argument <code>a</code>.
	 *
	 * @param term
	 * @param a
	 * @param slotOf
	 * @return
	 */
	private static Term remap(Term term, int a, int[] slotOf) {
		return Terms.substitute(term, locals(a, slotOf), slotOf[a] + 1);
	}

	private static Term[] remap(Term[] terms, int a, int[] slotOf) {
		return Terms.substitute(terms, locals(a, slotOf), slotOf[a] + 1);
	}

	private static Term[] locals(int a, int[] slotOf) {
		Term[] locals = new Term[a];
		for (int k = 0; k != a; ++k) {
			locals[k] = new Term.Variable(slotOf[a] - 1 - slotOf[a - 1 - k]);
		}
		return locals;
	}
}
