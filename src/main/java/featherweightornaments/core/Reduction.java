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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import featherweightornaments.core.Syntax.Term;
import featherweightornaments.util.AbstractTransformer;

/**
 * Encodes the reduction rules of the calculus. This provides weak head
 * normalisation, full normalisation (i.e. reducing underneath binders) and a
 * convertibility check based on comparing normal forms. Reduction is only
 * guaranteed to terminate on well-typed terms.
 *
 * @author David J. Pearce
 *
 */
public class Reduction {
	private final Environment environment;
	/**
	 * Determines whether or not global definitions are unfolded.
	 */
	private final boolean delta;

	public Reduction(Environment environment) {
		this(environment, true);
	}

	public Reduction(Environment environment, boolean delta) {
		this.environment = environment;
		this.delta = delta;
	}

	/**
	 * Reduce a term until its head is no longer reducible.
	 *
	 * @param term
	 * @return
	 */
	public Term whnf(Term term) {
		while (true) {
			switch (term.getOpcode()) {
			case Syntax.TERM_application: {
				Term.Application a = (Term.Application) term;
				Term next = reduceApplication(a);
				if (next == null) {
					Term f = whnf(a.function());
					return f == a.function() ? term : Terms.apply(f, a.arguments());
				}
				term = next;
				break;
			}
			case Syntax.TERM_global: {
				Environment.Definition d = environment.definition(((Term.Global) term).name());
				if (!delta || d == null || d.isAxiom()) {
					return term;
				}
				// Rule R-Delta
				term = d.body();
				break;
			}
			case Syntax.TERM_let: {
				// Rule R-Zeta
				Term.Let l = (Term.Let) term;
				term = Terms.instantiate(l.body(), l.value());
				break;
			}
			case Syntax.TERM_cast:
				term = ((Term.Cast) term).term();
				break;
			case Syntax.TERM_eliminate: {
				Term.Eliminate e = (Term.Eliminate) term;
				Term s = whnfScrutinee(e.scrutinee());
				if (!(s instanceof Term.Construct) || !((Term.Construct) s).type().equals(e.type())) {
					return s == e.scrutinee() ? term
							: new Term.Eliminate(e.type(), e.parameters(), e.motive(), e.cases(), e.indices(), s);
				}
				term = reduceEliminate(e, (Term.Construct) s);
				break;
			}
			case Syntax.TERM_case: {
				Term.Case c = (Term.Case) term;
				Term s = whnfScrutinee(c.scrutinee());
				if (!(s instanceof Term.Construct) || !((Term.Construct) s).type().equals(c.type())) {
					return s == c.scrutinee() ? term : new Term.Case(c.type(), c.motive(), s, c.branches());
				}
				term = reduceCase(c, (Term.Construct) s);
				break;
			}
			case Syntax.TERM_project: {
				Term.Project p = (Term.Project) term;
				Term s = whnfScrutinee(p.target());
				if (!(s instanceof Term.Construct)) {
					return s == p.target() ? term : new Term.Project(p.field(), s);
				}
				// Rule R-Proj
				Term.Construct c = (Term.Construct) s;
				int np = environment.getDeclaration(c.type()).parameters().length;
				term = c.arguments()[np + p.field()];
				break;
			}
			default:
				return term;
			}
		}
	}

	/**
	 * Fully normalise a term, including underneath binders.
	 *
	 * @param term
	 * @return
	 */
	public Term normalise(Term term) {
		return normaliser.apply(0, term);
	}

	/**
	 * Check whether two terms are convertible, which holds when they have the
	 * same normal form (ignoring binder names).
	 *
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public boolean convertible(Term lhs, Term rhs) {
		return lhs.equals(rhs) || normalise(lhs).equals(normalise(rhs));
	}

	private final AbstractTransformer<Integer> normaliser = new AbstractTransformer<Integer>() {
		@Override
		public Term apply(Integer depth, Term term) {
			return super.apply(depth, whnf(term));
		}

		@Override
		protected Integer enter(Integer depth, String name, Term type, Term value) {
			return depth + 1;
		}
	};

	/**
	 * Apply rule R-Beta or R-Fix to an application, returning <code>null</code>
	 * if neither applies.
	 *
	 * @param a
	 * @return
	 */
	private Term reduceApplication(Term.Application a) {
		Term f = whnf(a.function());
		Term[] args = a.arguments();
		if (f instanceof Term.Application) {
			args = Terms.append(((Term.Application) f).arguments(), args);
			f = ((Term.Application) f).function();
		}
		if (f instanceof Term.Lambda) {
			// Rule R-Beta
			Term body = Terms.instantiate(((Term.Lambda) f).body(), args[0]);
			return Terms.apply(body, Arrays.copyOfRange(args, 1, args.length));
		} else if (f instanceof Term.Fix) {
			// Rule R-Fix
			Term.Fix fix = (Term.Fix) f;
			int k = fix.decreasing();
			if (k < args.length) {
				Term d = whnfScrutinee(args[k]);
				if (d instanceof Term.Construct) {
					args = args.clone();
					args[k] = d;
					return Terms.apply(Terms.instantiate(fix.body(), fix), args);
				}
			}
		}
		return null;
	}

	/**
	 * Reduce a term which is about to be scrutinised. This additionally
	 * unfolds corecursive definitions in head position (Rule R-CoFix).
	 *
	 * @param term
	 * @return
	 */
	private Term whnfScrutinee(Term term) {
		term = whnf(term);
		while (Terms.head(term) instanceof Term.CoFix) {
			Term.CoFix cofix = (Term.CoFix) Terms.head(term);
			term = whnf(Terms.apply(Terms.instantiate(cofix.body(), cofix), Terms.arguments(term)));
		}
		return term;
	}

	/**
	 * Rule R-Iota. An eliminator applied to a constructor reduces to the
	 * corresponding case applied to the constructor's arguments, where every
	 * recursive argument is followed by the eliminator applied to it.
	 *
	 * @param e
	 * @param c
	 * @return
	 */
	private Term reduceEliminate(Term.Eliminate e, Term.Construct c) {
		TypeDeclaration decl = environment.getDeclaration(e.type());
		int np = decl.parameters().length;
		TypeDeclaration.Constructor ctor = decl.constructor(c.index());
		Term[] args = Arrays.copyOfRange(c.arguments(), np, c.arguments().length);
		List<Term> actuals = new ArrayList<>();
		for (int i = 0; i != args.length; ++i) {
			actuals.add(args[i]);
			if (decl.isRecursive(c.index(), i)) {
				Term type = ctor.arguments()[i].type();
				Term[] context = Terms.append(e.parameters(), Arrays.copyOfRange(args, 0, i));
				Term[] indices = Arrays.copyOfRange(Terms.arguments(type), np, Terms.arguments(type).length);
				indices = Terms.instantiate(indices, context);
				actuals.add(new Term.Eliminate(e.type(), e.parameters(), e.motive(), e.cases(), indices, args[i]));
			}
		}
		return Terms.apply(e.cases()[c.index()], actuals.toArray(new Term[actuals.size()]));
	}

	/**
	 * Rule R-Case. A case split over a constructor reduces to the corresponding
	 * branch applied to the constructor's (non-parameter) arguments.
	 *
	 * @param s
	 * @param c
	 * @return
	 */
	private Term reduceCase(Term.Case s, Term.Construct c) {
		int np = environment.getDeclaration(c.type()).parameters().length;
		Term[] args = Arrays.copyOfRange(c.arguments(), np, c.arguments().length);
		return Terms.apply(s.branches()[c.index()], args);
	}
}
