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
package featherweightornaments.core;

import featherweightornaments.core.Syntax.Binding;
import featherweightornaments.core.Syntax.Term;

/**
 * Wraps and unwraps dependent pairs (for algebraic ornaments) and plain pairs
 * (for curried records). A packed value bundles an index with a value of the
 * indexed type, as in <code>pack I (fun i => vector T i) n v</code>.
 *
 * Projections out of a pair literal are reduced as soon as they are built,
 * and also by {@link Reduction}, so rewriting can always recognise the parts of
 * a freshly packed value syntactically.
 *
 * @author David J. Pearce
 *
 */
public class Packing {
	public static final String SIGMA = "Sigma";
	public static final String PACK = "pack";
	public static final String PROD = "Prod";
	public static final String PAIR = "pair";

	/**
	 * <pre>
	 * Inductive Sigma (A : Type) (P : A -> Type) : Type :=
	 *   | pack : forall (a : A) (b : P a), Sigma A P.
	 * </pre>
	 */
	public static final TypeDeclaration SIGMA_DECLARATION = new TypeDeclaration(SIGMA,
			new Binding[] { new Binding("A", Term.Sort.TYPE),
					new Binding("P", new Term.Pi("_", new Term.Variable(0), Term.Sort.TYPE)) },
			new Binding[0], Term.Sort.TYPE,
			new TypeDeclaration.Constructor(PACK,
					new Binding[] { new Binding("a", new Term.Variable(1)),
							new Binding("b", new Term.Application(new Term.Variable(1),
									new Term[] { new Term.Variable(0) })) },
					new Term[0]));

	/**
	 * <pre>
	 * Inductive Prod (A : Type) (B : Type) : Type :=
	 *   | pair : forall (a : A) (b : B), Prod A B.
	 * </pre>
	 */
	public static final TypeDeclaration PROD_DECLARATION = new TypeDeclaration(PROD,
			new Binding[] { new Binding("A", Term.Sort.TYPE), new Binding("B", Term.Sort.TYPE) }, new Binding[0],
			Term.Sort.TYPE, new TypeDeclaration.Constructor(PAIR, new Binding[] {
					new Binding("a", new Term.Variable(1)), new Binding("b", new Term.Variable(1)) }, new Term[0]));

	// ========================================================================
	// Dependent Pairs
	// ========================================================================

	public static Term sigma(Term indexType, Term family) {
		return new Term.Application(new Term.Global(SIGMA), new Term[] { indexType, family });
	}

	public static Term pack(Term indexType, Term family, Term index, Term value) {
		return new Term.Construct(SIGMA, 0, PACK, new Term[] { indexType, family, index, value });
	}

	public static Term projectIndex(Term packed) {
		return project(packed, 0);
	}

	public static Term projectValue(Term packed) {
		return project(packed, 1);
	}

	public static boolean isSigma(Term term) {
		return Terms.isApplicationOf(term, SIGMA) && Terms.arguments(term).length == 2;
	}

	public static boolean isPack(Term term) {
		return term instanceof Term.Construct && ((Term.Construct) term).type().equals(SIGMA);
	}

	/**
	 * Get the index type of a dependent pair type.
	 *
	 * @param sigma
	 * @return
	 */
	public static Term indexType(Term sigma) {
		return Terms.arguments(sigma)[0];
	}

	/**
	 * Get the type family of a dependent pair type.
	 *
	 * @param sigma
	 * @return
	 */
	public static Term family(Term sigma) {
		return Terms.arguments(sigma)[1];
	}

	// ========================================================================
	// Plain Pairs
	// ========================================================================

	public static Term prod(Term first, Term second) {
		return new Term.Application(new Term.Global(PROD), new Term[] { first, second });
	}

	public static Term pair(Term firstType, Term secondType, Term first, Term second) {
		return new Term.Construct(PROD, 0, PAIR, new Term[] { firstType, secondType, first, second });
	}

	public static boolean isProd(Term term) {
		return Terms.isApplicationOf(term, PROD) && Terms.arguments(term).length == 2;
	}

	public static boolean isPair(Term term) {
		return term instanceof Term.Construct && ((Term.Construct) term).type().equals(PROD);
	}

	/**
	 * Group one or more types into right-nested pairs, such that
	 * <code>[A, B, C]</code> becomes <code>Prod A (Prod B C)</code>.
	 *
	 * @param types
	 * @return
	 */
	public static Term nest(Term[] types) {
		return nest(types, 0);
	}

	private static Term nest(Term[] types, int from) {
		if (from == types.length - 1) {
			return types[from];
		}
		return prod(types[from], nest(types, from + 1));
	}

	/**
	 * Group values into right-nested pair literals matching
	 * {@link #nest(Term[])}.
	 *
	 * @param types
	 * @param values
	 * @return
	 */
	public static Term nest(Term[] types, Term[] values) {
		return nest(types, values, 0);
	}

	private static Term nest(Term[] types, Term[] values, int from) {
		if (from == values.length - 1) {
			return values[from];
		}
		return pair(types[from], nest(types, from + 1), values[from], nest(types, values, from + 1));
	}

	/**
	 * Project each of <code>n</code> components out of right-nested pairs.
	 *
	 * @param nested
	 * @param n
	 * @return
	 */
	public static Term[] unnest(Term nested, int n) {
		Term[] r = new Term[n];
		for (int i = 0; i != n - 1; ++i) {
			r[i] = project(nested, 0);
			nested = project(nested, 1);
		}
		r[n - 1] = nested;
		return r;
	}

	// ========================================================================
	// Projections
	// ========================================================================

	/**
	 * Project a component out of a pair, reducing immediately when the pair is
	 * a literal.
	 *
	 * @param pair
	 * @param field
	 * @return
	 */
	public static Term project(Term pair, int field) {
		Term r = field(pair, field);
		return r != null ? r : new Term.Project(field, pair);
	}

	/**
	 * Get a component of a pair literal, or <code>null</code> if the term is
	 * not a pair literal.
	 *
	 * @param term
	 * @param field
	 * @return
	 */
	public static Term field(Term term, int field) {
		if (isPack(term) || isPair(term)) {
			return ((Term.Construct) term).arguments()[2 + field];
		}
		return null;
	}

	// ========================================================================
	// Repacking
	// ========================================================================

	/**
	 * Re-wrap a value of a pair type whose syntactic form is not a pair literal,
	 * naming it once so that its components are not recomputed:
	 *
	 * <pre>
	 * let s : Sigma I F := e in pack I F s.1 s.2
	 * </pre>
	 *
	 * @param value
	 * @param type  Either a dependent pair or a plain pair type.
	 * @return
	 */
	public static Term repack(Term value, Term type) {
		Term[] args = Terms.shift(Terms.arguments(type), 1);
		Term first = new Term.Project(0, new Term.Variable(0));
		Term second = new Term.Project(1, new Term.Variable(0));
		Term body = isSigma(type) ? pack(args[0], args[1], first, second) : pair(args[0], args[1], first, second);
		return new Term.Let("s", value, type, body);
	}

	/**
	 * Check whether a term has the shape produced by
	 * {@link #repack(Term, Term)}.
	 *
	 * @param term
	 * @return
	 */
	public static boolean isRepack(Term term) {
		if (term instanceof Term.Let) {
			Term body = ((Term.Let) term).body();
			if (isPack(body) || isPair(body)) {
				Term[] args = ((Term.Construct) body).arguments();
				Term v = new Term.Variable(0);
				return args[2].equals(new Term.Project(0, v)) && args[3].equals(new Term.Project(1, v));
			}
		}
		return false;
	}
}
