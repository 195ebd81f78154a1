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
package featherweightornaments.lifting;

import java.util.Arrays;

import featherweightornaments.core.Context;
import featherweightornaments.core.Packing;
import featherweightornaments.core.Syntax.Term;
import featherweightornaments.core.Telescope;
import featherweightornaments.core.Terms;
import featherweightornaments.core.TypeDeclaration;
import featherweightornaments.discovery.Eliminators;
import featherweightornaments.discovery.StructuralRecursionPrinciple;
import featherweightornaments.discovery.TypeIntrospection;

/**
 * Lifting rules for a correspondence between a record <code>R ps</code> with
 * fields of types <code>T1 .. Tn</code> and the nested pairs
 * <code>Prod T1 (Prod T2 .. Tn)</code>. Lifting backward, nested pairs are
 * recognised by matching them against the field types, with the parameters
 * as unknowns.
 *
 * @author David J. Pearce
 *
 */
public class CurryRecordRules extends LiftingRules {
	private final TypeDeclaration record;
	private final StructuralRecursionPrinciple principle;
	private final Term[] fields;
	private final Term pattern;
	private final int np;
	private final int n;
	private final Term equivalence;
	private final Term internalize;

	public CurryRecordRules(LiftingConfiguration configuration) {
		super(configuration);
		this.record = correspondence.before();
		this.principle = TypeIntrospection.principle(record);
		this.fields = correspondence.fields();
		this.pattern = Packing.nest(fields);
		this.np = record.parameters().length;
		this.n = fields.length;
		Term self = record.apply(Terms.variables(np, 0), new Term[0]);
		if (configuration.isForward()) {
			this.equivalence = Telescope.lambdas(record.parameters(), pattern);
			this.internalize = Telescope.lambdas(record.parameters(),
					new Term.Lambda("r", pattern, new Term.Variable(0)));
		} else {
			this.equivalence = null;
			this.internalize = Telescope.lambdas(record.parameters(),
					new Term.Lambda("r", self, new Term.Variable(0)));
		}
	}

	@Override
	public LiftRule classify(Context context, Term term) {
		if (configuration.isForward()) {
			return classifyForward(context, term);
		} else {
			return classifyBackward(context, term);
		}
	}

	private LiftRule classifyForward(Context context, Term term) {
		if (term instanceof Term.Construct && ((Term.Construct) term).type().equals(record.name())
				&& ((Term.Construct) term).arguments().length == np + n) {
			return LiftRule.CONSTRUCTOR;
		} else if (term instanceof Term.Eliminate && ((Term.Eliminate) term).type().equals(record.name())) {
			return LiftRule.ELIMINATOR;
		} else if (applies(term, record.name())) {
			return LiftRule.template(LiftRule.Kind.EQUIVALENCE, equivalence);
		} else if (term instanceof Term.Project) {
			Term.Project p = (Term.Project) term;
			if (p.field() < n && record.isApplication(configuration.typeOf(context, p.target()))) {
				return LiftRule.COHERENCE;
			}
		}
		return internalize(term, internalize);
	}

	private LiftRule classifyBackward(Context context, Term term) {
		if (Packing.isPair(term) && match(typeOfPair((Term.Construct) term)) != null) {
			return LiftRule.CONSTRUCTOR;
		} else if (term instanceof Term.Eliminate && ((Term.Eliminate) term).type().equals(Packing.PROD)
				&& match(Packing.prod(((Term.Eliminate) term).parameters()[0],
						((Term.Eliminate) term).parameters()[1])) != null) {
			return LiftRule.ELIMINATOR;
		} else if (match(term) != null) {
			return LiftRule.EQUIVALENCE;
		} else if (term instanceof Term.Project && projection(context, (Term.Project) term) != null) {
			return LiftRule.COHERENCE;
		} else if (Packing.isRepack(term) && match(((Term.Let) term).type()) != null) {
			return LiftRule.UNPACK;
		}
		return internalize(term, internalize);
	}

	@Override
	public boolean isBeforeType(Term type) {
		if (configuration.isForward()) {
			return record.isApplication(type);
		} else {
			return match(type) != null;
		}
	}

	@Override
	public Term apply(LiftRule rule, Context context, Term term, TermLifter lifter) {
		boolean forward = configuration.isForward();
		switch (rule.kind()) {
		case CONSTRUCTOR:
			return forward ? curryConstructor(context, (Term.Construct) term, lifter)
					: uncurryPair(context, (Term.Construct) term, lifter);
		case ELIMINATOR:
			return forward ? curryEliminator(context, (Term.Eliminate) term, lifter)
					: uncurryEliminator(context, (Term.Eliminate) term, lifter);
		case EQUIVALENCE:
			// Prod T1 (Prod .. Tn) ~> R ps
			return record.apply(lifter.lift(context, match(term)), new Term[0]);
		case COHERENCE:
			return forward ? curryProjection(context, (Term.Project) term, lifter)
					: uncurryProjection(context, (Term.Project) term, lifter);
		case UNPACK:
			// let s := e in pair s.1 s.2 ~> e
			return lifter.lift(context, ((Term.Let) term).value());
		default:
			throw new IllegalArgumentException("Invalid rule encountered: " + rule);
		}
	}

	// ========================================================================
	// Forward
	// ========================================================================

	/**
	 * <code>mk ps f1 .. fn ~> pair f1 (pair f2 .. fn)</code>
	 */
	private Term curryConstructor(Context context, Term.Construct term, TermLifter lifter) {
		Term[] args = lifter.lift(context, term.arguments());
		Term[] ps = Arrays.copyOfRange(args, 0, np);
		return Packing.nest(Terms.instantiate(fields, ps), Arrays.copyOfRange(args, np, args.length));
	}

	/**
	 * <code>r.i ~> p.2 .. .2.1</code>
	 */
	private Term curryProjection(Context context, Term.Project term, TermLifter lifter) {
		Term target = lifter.lift(context, term.target());
		return Packing.unnest(target, n)[term.field()];
	}

	/**
	 * Lift an eliminator of the record to one of the outermost pair. The case
	 * receives the first field and the remaining pairs, which it projects into
	 * the remaining fields.
	 *
	 * @param context
	 * @param term
	 * @param lifter
	 * @return
	 */
	private Term curryEliminator(Context context, Term.Eliminate term, TermLifter lifter) {
		Term[] ps = lifter.lift(context, term.parameters());
		Term motive = lifter.lift(context, term.motive());
		Term kase = lifter.lift(context, term.cases()[0]);
		Term scrutinee = lifter.lift(context, term.scrutinee());
		Term[] types = Terms.instantiate(fields, ps);
		Term first = types[0];
		Term rest = Packing.nest(Arrays.copyOfRange(types, 1, n));
		Term lifted = new Term.Lambda("x", Packing.prod(first, rest),
				Terms.beta(Terms.apply(Terms.shift(motive, 1), new Term.Variable(0))));
		Term[] values = Terms.append(new Term[] { new Term.Variable(1) }, Packing.unnest(new Term.Variable(0), n - 1));
		Term body = Terms.beta(Terms.apply(Terms.shift(kase, 2), values));
		Term lcase = new Term.Lambda("a", first, new Term.Lambda("b", Terms.shift(rest, 1), body));
		return new Term.Eliminate(Packing.PROD, new Term[] { first, rest }, lifted, new Term[] { lcase },
				new Term[0], scrutinee);
	}

	// ========================================================================
	// Backward
	// ========================================================================

	/**
	 * <code>pair f1 (pair f2 .. fn) ~> mk ps f1 .. fn</code>
	 */
	private Term uncurryPair(Context context, Term.Construct term, TermLifter lifter) {
		Term[] ps = lifter.lift(context, match(typeOfPair(term)));
		Term[] args = term.arguments();
		Term first = lifter.lift(context, args[2]);
		Term rest = lifter.lift(context, args[3]);
		Term[] values = Terms.append(new Term[] { first }, Packing.unnest(rest, n - 1));
		return record.construct(0, ps, values);
	}

	/**
	 * <code>p.2 .. .2.1 ~> r.i</code>, where a partial chain of second
	 * projections gives the remaining fields regrouped into pairs.
	 */
	private Term uncurryProjection(Context context, Term.Project term, TermLifter lifter) {
		int[] projection = projection(context, term);
		Term target = term;
		while (target instanceof Term.Project) {
			target = ((Term.Project) target).target();
		}
		Term[] ps = lifter.lift(context, match(configuration.typeOf(context, target)));
		Term r = lifter.lift(context, target);
		int field = projection[0];
		if (projection[1] == 1) {
			return new Term.Project(field, r);
		}
		Term[] types = Terms.instantiate(Arrays.copyOfRange(fields, field, n), ps);
		Term[] values = new Term[n - field];
		for (int i = 0; i != values.length; ++i) {
			values[i] = new Term.Project(field + i, r);
		}
		return Packing.nest(types, values);
	}

	/**
	 * Lift an eliminator of the outermost pair back to one of the record. The
	 * case receives all fields, and regroups all but the first into pairs.
	 *
	 * @param context
	 * @param term
	 * @param lifter
	 * @return
	 */
	private Term uncurryEliminator(Context context, Term.Eliminate term, TermLifter lifter) {
		Term[] original = term.parameters();
		Term[] ps = lifter.lift(context, match(Packing.prod(original[0], original[1])));
		Term motive = lifter.lift(context, term.motive());
		Term kase = lifter.lift(context, term.cases()[0]);
		Term scrutinee = lifter.lift(context, term.scrutinee());
		Term self = record.apply(ps, new Term[0]);
		Term lifted = new Term.Lambda("x", self,
				Terms.beta(Terms.apply(Terms.shift(motive, 1), new Term.Variable(0))));
		Telescope slots = Eliminators.slots(principle, 0, ps, lifted, n);
		Term[] types = Terms.instantiate(Arrays.copyOfRange(fields, 1, n), Terms.shift(ps, n));
		Term[] rest = Arrays.copyOfRange(Terms.variables(n, 0), 1, n);
		Term[] values = new Term[] { new Term.Variable(n - 1), Packing.nest(types, rest) };
		Term body = Terms.beta(Terms.apply(Terms.shift(kase, n), values));
		Term lcase = Telescope.lambdas(slots.bindings(), body);
		return new Term.Eliminate(record.name(), ps, lifted, new Term[] { lcase }, new Term[0], scrutinee);
	}

	// ========================================================================
	// Helpers
	// ========================================================================

	/**
	 * Match a type against the nested pairs of field types, returning the
	 * parameters if it matches and <code>null</code> otherwise.
	 *
	 * @param type
	 * @return
	 */
	private Term[] match(Term type) {
		if (!Packing.isProd(type)) {
			return null;
		}
		Term[] ps = new Term[np];
		if (!Terms.match(pattern, type, ps)) {
			return null;
		}
		for (Term p : ps) {
			if (p == null) {
				return null;
			}
		}
		return ps;
	}

	private static Term typeOfPair(Term.Construct pair) {
		Term[] args = pair.arguments();
		return Packing.prod(args[0], args[1]);
	}

	/**
	 * Determine which field a chain of projections out of nested pairs
	 * denotes. This returns the field along with <code>1</code> when it
	 * denotes exactly that field, or <code>0</code> when it denotes the pairs
	 * holding that field and all later ones. Otherwise, <code>null</code> is
	 * returned.
	 *
	 * @param context
	 * @param term
	 * @return
	 */
	private int[] projection(Context context, Term.Project term) {
		boolean first = term.field() == 0;
		Term target = first ? term.target() : term;
		int seconds = 0;
		while (target instanceof Term.Project && ((Term.Project) target).field() == 1) {
			target = ((Term.Project) target).target();
			seconds++;
		}
		if (target instanceof Term.Project || match(configuration.typeOf(context, target)) == null) {
			return null;
		} else if (first && seconds < n - 1) {
			return new int[] { seconds, 1 };
		} else if (!first && seconds == n - 1) {
			return new int[] { seconds, 1 };
		} else if (!first && seconds < n - 1) {
			return new int[] { seconds, 0 };
		}
		return null;
	}
}
