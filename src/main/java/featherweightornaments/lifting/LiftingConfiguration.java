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

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import featherweightornaments.core.Context;
import featherweightornaments.core.Environment;
import featherweightornaments.core.Reduction;
import featherweightornaments.core.Syntax.Term;
import featherweightornaments.core.Telescope;
import featherweightornaments.core.TypeInference;
import featherweightornaments.discovery.CorrespondenceDescriptor;

/**
 * Bundles everything needed for a single lifting request: the
 * correspondence, the direction, the cache, the set of opaque globals and the
 * registry of earlier liftings. This also classifies each term visited during
 * lifting, determining which rule applies to it.
 *
 * @author David J. Pearce
 *
 */
public class LiftingConfiguration {
	public enum Direction {
		/**
		 * From the original type to the new one.
		 */
		FORWARD,
		/**
		 * From the new type back to the original one.
		 */
		BACKWARD;

		public Direction opposite() {
			return this == FORWARD ? BACKWARD : FORWARD;
		}
	}

	private final Environment environment;
	private final CorrespondenceDescriptor correspondence;
	private final Direction direction;
	private final LiftingCache cache;
	private final Set<String> opaque;
	private final LiftingRegistry registry;
	private final TypeInference typing;
	private final Reduction reduction;
	private final LiftingRules rules;

	public LiftingConfiguration(Environment environment, CorrespondenceDescriptor correspondence,
			Direction direction) {
		this(environment, correspondence, direction, new LiftingCache(), Collections.<String>emptySet(),
				new LiftingRegistry());
	}

	public LiftingConfiguration(Environment environment, CorrespondenceDescriptor correspondence, Direction direction,
			LiftingCache cache, Set<String> opaque, LiftingRegistry registry) {
		this.environment = environment;
		this.correspondence = correspondence;
		this.direction = direction;
		this.cache = cache;
		this.opaque = new HashSet<>(opaque);
		this.registry = registry;
		this.typing = new TypeInference(environment);
		this.reduction = new Reduction(environment);
		if (correspondence.isAlgebraic()) {
			this.rules = new AlgebraicRules(this);
		} else {
			this.rules = new CurryRecordRules(this);
		}
	}

	public Environment environment() {
		return environment;
	}

	public CorrespondenceDescriptor correspondence() {
		return correspondence;
	}

	public Direction direction() {
		return direction;
	}

	public boolean isForward() {
		return direction == Direction.FORWARD;
	}

	public LiftingCache cache() {
		return cache;
	}

	public Set<String> opaque() {
		return Collections.unmodifiableSet(opaque);
	}

	public LiftingRegistry registry() {
		return registry;
	}

	public LiftingRules rules() {
		return rules;
	}

	/**
	 * Infer the type of a term in a given context, reduced to weak head normal
	 * form.
	 *
	 * @param context
	 * @param term
	 * @return
	 */
	public Term typeOf(Context context, Term term) {
		return reduction.whnf(typing.infer(context, term));
	}

	/**
	 * Determine which rule applies to a given term. Rules are tried in order
	 * of priority: the cache, opaque references, the rules specific to the
	 * kind of correspondence, unliftable terms, applications, constants and,
	 * finally, generic structural lifting.
	 *
	 * @param context
	 * @param term
	 * @return
	 */
	public LiftRule classify(Context context, Term term) {
		Term cached = cache.get(context, term, direction);
		if (cached != null) {
			return LiftRule.cacheHit(cached);
		} else if (term instanceof Term.Global && opaque.contains(((Term.Global) term).name())) {
			return LiftRule.OPAQUE;
		}
		LiftRule rule = rules.classify(context, term);
		if (rule != null) {
			return rule;
		} else if (isUnliftable(context, term)) {
			return LiftRule.UNLIFTABLE;
		} else if (term instanceof Term.Application) {
			return LiftRule.APPLICATION;
		} else if (term instanceof Term.Global) {
			return LiftRule.CONSTANT;
		} else {
			return LiftRule.GENERIC;
		}
	}

	/**
	 * Check whether a term directly scrutinises a value of the type being
	 * lifted without going through its eliminator. That is, a case split over
	 * such a value, a fixpoint whose decreasing argument is such a value, or a
	 * cofixpoint producing one.
	 *
	 * @param context
	 * @param term
	 * @return
	 */
	private boolean isUnliftable(Context context, Term term) {
		if (term instanceof Term.Case) {
			Term.Case c = (Term.Case) term;
			return rules.isBeforeType(typeOf(context, c.scrutinee()));
		} else if (term instanceof Term.Fix) {
			Term.Fix f = (Term.Fix) term;
			Telescope t = Telescope.ofProducts(f.type());
			return f.decreasing() < t.size() && rules.isBeforeType(t.get(f.decreasing()).type());
		} else if (term instanceof Term.CoFix) {
			Term.CoFix f = (Term.CoFix) term;
			return rules.isBeforeType(Telescope.ofProducts(f.type()).body());
		}
		return false;
	}
}
