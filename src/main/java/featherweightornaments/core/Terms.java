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

import java.util.Arrays;

import featherweightornaments.core.Syntax.Term;
import featherweightornaments.util.AbstractTransformer;

/**
 * Operations over terms which are sensitive to de Bruijn indices, such as
 * shifting and substitution, along with a few helpers for manipulating
 * applications and argument lists. All operations are pure and total on
 * well-scoped terms.
 *
 * @author David J. Pearce
 *
 */
public class Terms {

	// ========================================================================
	// Shifting
	// ========================================================================

	/**
	 * Shift all free variables of a term by a given amount. A negative amount
	 * moves a term out from underneath binders it does not depend upon.
	 *
	 * @param term
	 * @param amount
	 * @return
	 */
	public static Term shift(Term term, int amount) {
		return shift(term, amount, 0);
	}

	/**
	 * Shift all variables of a term which are at least <code>cutoff</code> by a
	 * given amount.
	 *
	 * @param term
	 * @param amount
	 * @param cutoff
	 * @return
	 */
	public static Term shift(Term term, int amount, int cutoff) {
		if (amount == 0) {
			return term;
		}
		return new Shifter(amount).apply(cutoff, term);
	}

	public static Term[] shift(Term[] terms, int amount) {
		if (amount == 0) {
			return terms;
		}
		return new Shifter(amount).apply(0, terms);
	}

	private static class Shifter extends AbstractTransformer<Integer> {
		private final int amount;

		public Shifter(int amount) {
			this.amount = amount;
		}

		@Override
		protected Integer enter(Integer cutoff, String name, Term type, Term value) {
			return cutoff + 1;
		}

		@Override
		protected Term apply(Integer cutoff, Term.Variable term) {
			int i = term.index();
			if (i < cutoff) {
				return term;
			} else if (i + amount < cutoff) {
				throw new IllegalArgumentException("cannot shift variable #" + i + " by " + amount);
			}
			return new Term.Variable(i + amount, term.attributes());
		}
	}

	// ========================================================================
	// Substitution
	// ========================================================================

	/**
	 * Substitute the innermost free variables of a term. More specifically,
	 * variable <code>j</code> (for <code>j &lt; locals.length</code>) is
	 * replaced by <code>locals[j]</code>, whilst every other free variable
	 * <code>j</code> becomes <code>j - locals.length + outer</code>. The
	 * replacement terms live in the target context, and are shifted
	 * appropriately when substituted underneath binders.
	 *
	 * @param term
	 * @param locals Replacements for the innermost free variables (innermost
	 *               first).
	 * @param outer  Number of binders the target context adds on top of the
	 *               remaining free variables.
	 * @return
	 */
	public static Term substitute(Term term, Term[] locals, int outer) {
		return new Substitution(locals, outer).apply(0, term);
	}

	public static Term[] substitute(Term[] terms, Term[] locals, int outer) {
		return new Substitution(locals, outer).apply(0, terms);
	}

	/**
	 * Instantiate the outermost binders of a body with the given values (outer
	 * to inner). That is, given a term which lives underneath
	 * <code>values.length</code> binders, replace the binders by their values.
	 *
	 * @param body
	 * @param values
	 * @return
	 */
	public static Term instantiate(Term body, Term... values) {
		return substitute(body, reverse(values), 0);
	}

	public static Term[] instantiate(Term[] bodies, Term... values) {
		return substitute(bodies, reverse(values), 0);
	}

	private static class Substitution extends AbstractTransformer<Integer> {
		private final Term[] locals;
		private final int outer;

		public Substitution(Term[] locals, int outer) {
			this.locals = locals;
			this.outer = outer;
		}

		@Override
		protected Integer enter(Integer depth, String name, Term type, Term value) {
			return depth + 1;
		}

		@Override
		protected Term apply(Integer depth, Term.Variable term) {
			int i = term.index();
			if (i < depth) {
				return term;
			}
			int j = i - depth;
			if (j < locals.length) {
				return shift(locals[j], depth);
			} else if (j - locals.length + outer == j) {
				return term;
			} else {
				return new Term.Variable(j - locals.length + outer + depth, term.attributes());
			}
		}
	}

	// ========================================================================
	// Occurrences
	// ========================================================================

	/**
	 * Check whether a given free variable occurs in a term.
	 *
	 * @param term
	 * @param index
	 * @return
	 */
	public static boolean occurs(Term term, int index) {
		Occurrences o = new Occurrences(index, null);
		o.apply(0, term);
		return o.found;
	}

	/**
	 * Check whether a term refers to a given global, inductive type or any of
	 * its constructors.
	 *
	 * @param term
	 * @param name
	 * @return
	 */
	public static boolean mentions(Term term, String name) {
		Occurrences o = new Occurrences(-1, name);
		o.apply(0, term);
		return o.found;
	}

	private static class Occurrences extends AbstractTransformer<Integer> {
		private final int index;
		private final String name;
		private boolean found;

		public Occurrences(int index, String name) {
			this.index = index;
			this.name = name;
		}

		@Override
		public Term apply(Integer depth, Term term) {
			return found ? term : super.apply(depth, term);
		}

		@Override
		protected Integer enter(Integer depth, String name, Term type, Term value) {
			return depth + 1;
		}

		@Override
		protected Term apply(Integer depth, Term.Variable term) {
			found |= index >= 0 && term.index() == index + depth;
			return term;
		}

		@Override
		protected Term apply(Integer depth, Term.Global term) {
			found |= term.name().equals(name);
			return term;
		}

		@Override
		protected Term apply(Integer depth, Term.Construct term) {
			found |= term.type().equals(name);
			return super.apply(depth, term);
		}

		@Override
		protected Term apply(Integer depth, Term.Eliminate term) {
			found |= term.type().equals(name);
			return super.apply(depth, term);
		}

		@Override
		protected Term apply(Integer depth, Term.Case term) {
			found |= term.type().equals(name);
			return super.apply(depth, term);
		}
	}

	// ========================================================================
	// Simplification
	// ========================================================================

	/**
	 * Contract all beta redexes in a term, along with projections out of pair
	 * literals. This does not unfold any definitions, and is used to tidy up
	 * terms produced by synthesis and lifting.
	 *
	 * @param term
	 * @return
	 */
	public static Term beta(Term term) {
		return SIMPLIFIER.apply(0, term);
	}

	private static final Simplifier SIMPLIFIER = new Simplifier();

	private static class Simplifier extends AbstractTransformer<Integer> {
		@Override
		protected Integer enter(Integer depth, String name, Term type, Term value) {
			return depth + 1;
		}

		@Override
		protected Term apply(Integer depth, Term.Application term) {
			Term function = apply(depth, term.function());
			Term[] arguments = apply(depth, term.arguments());
			int i = 0;
			while (function instanceof Term.Lambda && i < arguments.length) {
				Term.Lambda l = (Term.Lambda) function;
				function = apply(depth, instantiate(l.body(), arguments[i++]));
			}
			if (i == 0 && function == term.function() && arguments == term.arguments()) {
				return term;
			}
			return Terms.apply(function, Arrays.copyOfRange(arguments, i, arguments.length));
		}

		@Override
		protected Term apply(Integer depth, Term.Project term) {
			Term target = apply(depth, term.target());
			Term field = Packing.field(target, term.field());
			if (field != null) {
				return field;
			} else if (target == term.target()) {
				return term;
			}
			return new Term.Project(term.field(), target, term.attributes());
		}
	}

	// ========================================================================
	// Applications
	// ========================================================================

	/**
	 * Apply a function to zero or more arguments, flattening nested
	 * applications.
	 *
	 * @param function
	 * @param arguments
	 * @return
	 */
	public static Term apply(Term function, Term... arguments) {
		if (arguments.length == 0) {
			return function;
		} else if (function instanceof Term.Application) {
			Term.Application a = (Term.Application) function;
			return new Term.Application(a.function(), append(a.arguments(), arguments));
		}
		return new Term.Application(function, arguments);
	}

	/**
	 * Get the head of a (possibly nested) application.
	 *
	 * @param term
	 * @return
	 */
	public static Term head(Term term) {
		while (term instanceof Term.Application) {
			term = ((Term.Application) term).function();
		}
		return term;
	}

	/**
	 * Get the arguments of an application, or an empty array if the term is not
	 * an application.
	 *
	 * @param term
	 * @return
	 */
	public static Term[] arguments(Term term) {
		if (term instanceof Term.Application) {
			Term.Application a = (Term.Application) term;
			Term[] inner = arguments(a.function());
			return inner.length == 0 ? a.arguments() : append(inner, a.arguments());
		}
		return new Term[0];
	}

	/**
	 * Check whether a term is an application of a given global (or the global
	 * itself).
	 *
	 * @param term
	 * @param name
	 * @return
	 */
	public static boolean isApplicationOf(Term term, String name) {
		Term head = head(term);
		return head instanceof Term.Global && ((Term.Global) head).name().equals(name);
	}

	/**
	 * Construct the variables bound by the last <code>n</code> binders of a
	 * context, outermost first, as seen from underneath a further
	 * <code>offset</code> binders.
	 *
	 * @param n
	 * @param offset
	 * @return
	 */
	public static Term[] variables(int n, int offset) {
		Term[] vars = new Term[n];
		for (int i = 0; i != n; ++i) {
			vars[i] = new Term.Variable(n - 1 - i + offset);
		}
		return vars;
	}

	// ========================================================================
	// Argument Lists
	// ========================================================================

	public static Term[] append(Term[] lhs, Term... rhs) {
		Term[] r = Arrays.copyOf(lhs, lhs.length + rhs.length);
		System.arraycopy(rhs, 0, r, lhs.length, rhs.length);
		return r;
	}

	public static Term[] insert(Term[] terms, int position, Term term) {
		Term[] r = new Term[terms.length + 1];
		System.arraycopy(terms, 0, r, 0, position);
		r[position] = term;
		System.arraycopy(terms, position, r, position + 1, terms.length - position);
		return r;
	}

	public static Term[] remove(Term[] terms, int position) {
		Term[] r = new Term[terms.length - 1];
		System.arraycopy(terms, 0, r, 0, position);
		System.arraycopy(terms, position + 1, r, position, terms.length - position - 1);
		return r;
	}

	public static Term[] reverse(Term[] terms) {
		Term[] r = new Term[terms.length];
		for (int i = 0; i != terms.length; ++i) {
			r[i] = terms[terms.length - 1 - i];
		}
		return r;
	}

	// ========================================================================
	// Matching
	// ========================================================================

	/**
	 * Match a term against a pattern whose outermost <code>n</code> free
	 * variables are unknowns, filling in their instantiation (outer to inner).
	 * Other free variables of the pattern are not permitted. Returns
	 * <code>false</code> when the term does not match.
	 *
	 * @param pattern
	 * @param term
	 * @param unknowns
	 * @return
	 */
	public static boolean match(Term pattern, Term term, Term[] unknowns) {
		return match(pattern, term, unknowns, 0);
	}

	private static boolean match(Term pattern, Term term, Term[] unknowns, int depth) {
		if (pattern instanceof Term.Variable) {
			int i = ((Term.Variable) pattern).index();
			if (i < depth) {
				return pattern.equals(term);
			}
			int k = unknowns.length - 1 - (i - depth);
			if (k < 0 || occursBelow(term, depth)) {
				return false;
			}
			Term value = shift(term, -depth);
			if (unknowns[k] == null) {
				unknowns[k] = value;
				return true;
			}
			return unknowns[k].equals(value);
		} else if (pattern instanceof Term.Application && term instanceof Term.Application) {
			Term.Application p = (Term.Application) pattern;
			Term.Application t = (Term.Application) term;
			return match(p.function(), t.function(), unknowns, depth)
					&& match(p.arguments(), t.arguments(), unknowns, depth);
		} else if (pattern instanceof Term.Construct && term instanceof Term.Construct) {
			Term.Construct p = (Term.Construct) pattern;
			Term.Construct t = (Term.Construct) term;
			return p.type().equals(t.type()) && p.index() == t.index()
					&& match(p.arguments(), t.arguments(), unknowns, depth);
		} else if (pattern instanceof Term.Pi && term instanceof Term.Pi
				|| pattern instanceof Term.Lambda && term instanceof Term.Lambda) {
			Term.Binder p = (Term.Binder) pattern;
			Term.Binder t = (Term.Binder) term;
			return match(p.type(), t.type(), unknowns, depth) && match(p.body(), t.body(), unknowns, depth + 1);
		}
		return pattern.equals(term);
	}

	private static boolean match(Term[] patterns, Term[] terms, Term[] unknowns, int depth) {
		if (patterns.length != terms.length) {
			return false;
		}
		for (int i = 0; i != patterns.length; ++i) {
			if (!match(patterns[i], terms[i], unknowns, depth)) {
				return false;
			}
		}
		return true;
	}

	private static boolean occursBelow(Term term, int depth) {
		for (int i = 0; i != depth; ++i) {
			if (occurs(term, i)) {
				return true;
			}
		}
		return false;
	}
}
