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

import featherweightornaments.core.Packing;
import featherweightornaments.core.Syntax.Term;
import featherweightornaments.core.Telescope;
import featherweightornaments.core.Terms;
import featherweightornaments.core.TypeDeclaration;

/**
 * Describes where and how a declaration <code>B</code> inserts a new index
 * into a declaration <code>A</code>. This records the position of the new index
 * amongst the indices of <code>B</code>, its type and, for each pair of
 * corresponding constructors, how their arguments line up.
 *
 * The index type lives in the context of the parameters followed by the
 * indices of <code>A</code> which precede the new index.
 *
 * @author David J. Pearce
 *
 */
public class IndexDescriptor {
	private final TypeDeclaration before;
	private final TypeDeclaration after;
	private final int position;
	private final Term type;
	private final CaseAlignment[] alignments;

	public IndexDescriptor(TypeDeclaration before, TypeDeclaration after, int position, Term type,
			CaseAlignment[] alignments) {
		this.before = before;
		this.after = after;
		this.position = position;
		this.type = type;
		this.alignments = alignments;
	}

	public TypeDeclaration before() {
		return before;
	}

	public TypeDeclaration after() {
		return after;
	}

	public int position() {
		return position;
	}

	public Term type() {
		return type;
	}

	public CaseAlignment alignment(int constructor) {
		return alignments[constructor];
	}

	/**
	 * Instantiate the index type for given parameters and indices of
	 * <code>A</code>, all of which live in the target context.
	 *
	 * @param parameters
	 * @param indices
	 * @return
	 */
	public Term indexType(Term[] parameters, Term[] indices) {
		Term[] prefix = new Term[position];
		System.arraycopy(indices, 0, prefix, 0, position);
		return Terms.instantiate(type, Terms.append(parameters, prefix));
	}

	/**
	 * Construct the type family <code>fun (i : I) => B ps (insert i is)</code>
	 * for given parameters and indices of <code>A</code>.
	 *
	 * @param parameters
	 * @param indices
	 * @return
	 */
	public Term family(Term[] parameters, Term[] indices) {
		Term[] ps = Terms.shift(parameters, 1);
		Term[] is = Terms.insert(Terms.shift(indices, 1), position, new Term.Variable(0));
		return new Term.Lambda("i", indexType(parameters, indices), after.apply(ps, is));
	}

	/**
	 * Construct the packed type <code>Sigma I (fun i => B ps (insert i is))</code>
	 * corresponding to <code>A ps is</code>.
	 *
	 * @param parameters
	 * @param indices
	 * @return
	 */
	public Term packedType(Term[] parameters, Term[] indices) {
		return Packing.sigma(indexType(parameters, indices), family(parameters, indices));
	}

	/**
	 * Pack a value of <code>B ps (insert index is)</code> with its index.
	 *
	 * @param parameters
	 * @param indices
	 * @param index
	 * @param value
	 * @return
	 */
	public Term pack(Term[] parameters, Term[] indices, Term index, Term value) {
		return Packing.pack(indexType(parameters, indices), family(parameters, indices), index, value);
	}

	@Override
	public String toString() {
		return before.name() + " -> " + after.name() + " @ " + position + " : " + type;
	}

	/**
	 * Describes how the slots (i.e. arguments and inductive hypotheses) of a
	 * case of <code>B</code>'s recursion principle line up with those of the
	 * corresponding case of <code>A</code>'s. Every slot of <code>A</code> has
	 * exactly one partner in <code>B</code>, whilst slots of <code>B</code> which
	 * hold the new index of a recursive argument have none. Instead, their
	 * partner is the recursive argument in <code>A</code> whose index they
	 * hold.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class CaseAlignment {
		public enum Role {
			ARGUMENT, RECURSIVE, HYPOTHESIS, INDEX
		}

		private final Telescope before;
		private final Telescope after;
		private final Role[] beforeRoles;
		private final int[] beforePartners;
		private final Role[] afterRoles;
		private final int[] afterPartners;

		public CaseAlignment(Telescope before, Telescope after, Role[] beforeRoles, int[] beforePartners,
				Role[] afterRoles, int[] afterPartners) {
			this.before = before;
			this.after = after;
			this.beforeRoles = beforeRoles;
			this.beforePartners = beforePartners;
			this.afterRoles = afterRoles;
			this.afterPartners = afterPartners;
		}

		/**
		 * Get the case of <code>A</code> split into its slots and conclusion.
		 *
		 * @return
		 */
		public Telescope before() {
			return before;
		}

		/**
		 * Get the case of <code>B</code> split into its slots and conclusion.
		 *
		 * @return
		 */
		public Telescope after() {
			return after;
		}

		public Role beforeRole(int slot) {
			return beforeRoles[slot];
		}

		public int beforePartner(int slot) {
			return beforePartners[slot];
		}

		public Role afterRole(int slot) {
			return afterRoles[slot];
		}

		public int afterPartner(int slot) {
			return afterPartners[slot];
		}

		/**
		 * Get the slot holding the inductive hypothesis for a recursive slot.
		 * Hypotheses always immediately follow their recursive argument.
		 *
		 * @param slot
		 * @return
		 */
		public static int hypothesisOf(int slot) {
			return slot + 1;
		}

		/**
		 * Map each constructor argument of <code>B</code> to the constructor
		 * argument of <code>A</code> it is derived from. For an index argument,
		 * this is the recursive argument whose index it holds.
		 *
		 * @return
		 */
		public int[] afterArgumentSources() {
			int[] beforeArgs = argumentNumbers(beforeRoles);
			int n = count(afterRoles);
			int[] r = new int[n];
			for (int s = 0, k = 0; s != afterRoles.length; ++s) {
				if (afterRoles[s] != Role.HYPOTHESIS) {
					r[k++] = beforeArgs[afterPartners[s]];
				}
			}
			return r;
		}

		/**
		 * Get the role of each constructor argument of <code>B</code>.
		 *
		 * @return
		 */
		public Role[] afterArgumentRoles() {
			Role[] r = new Role[count(afterRoles)];
			for (int s = 0, k = 0; s != afterRoles.length; ++s) {
				if (afterRoles[s] != Role.HYPOTHESIS) {
					r[k++] = afterRoles[s];
				}
			}
			return r;
		}

		/**
		 * Map each constructor argument of <code>A</code> to the constructor
		 * argument of <code>B</code> it corresponds to.
		 *
		 * @return
		 */
		public int[] beforeArgumentTargets() {
			int[] afterArgs = argumentNumbers(afterRoles);
			int[] r = new int[count(beforeRoles)];
			for (int s = 0, k = 0; s != beforeRoles.length; ++s) {
				if (beforeRoles[s] != Role.HYPOTHESIS) {
					r[k++] = afterArgs[beforePartners[s]];
				}
			}
			return r;
		}

		private static int[] argumentNumbers(Role[] roles) {
			int[] r = new int[roles.length];
			for (int s = 0, k = 0; s != roles.length; ++s) {
				r[s] = roles[s] == Role.HYPOTHESIS ? -1 : k++;
			}
			return r;
		}

		private static int count(Role[] roles) {
			int n = 0;
			for (Role r : roles) {
				if (r != Role.HYPOTHESIS) {
					n++;
				}
			}
			return n;
		}
	}
}
