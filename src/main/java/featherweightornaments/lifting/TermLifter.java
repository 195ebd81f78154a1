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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import featherweightornaments.core.Context;
import featherweightornaments.core.Environment;
import featherweightornaments.core.Packing;
import featherweightornaments.core.Syntax.Term;
import featherweightornaments.core.Terms;
import featherweightornaments.util.AbstractTransformer;
import featherweightornaments.util.OrnamentError;

/**
 * Lifts terms along a correspondence. This is a single structural traversal
 * which classifies every term it visits and then dispatches on the resulting
 * rule. The binder context threaded through the traversal holds the original
 * (i.e. unlifted) binder types, such that the types of original subterms can
 * be inferred when classifying them.
 *
 * @author David J. Pearce
 *
 */
public class TermLifter extends AbstractTransformer<Context> {
	private static final Logger log = LoggerFactory.getLogger(TermLifter.class);

	// Error messages
	public final static String UNLIFTABLE_TERM = "term must be expressed using an eliminator";

	private final LiftingConfiguration configuration;
	private final LiftingCache cache;
	private final LiftingRegistry registry;
	private final Environment environment;

	public TermLifter(LiftingConfiguration configuration) {
		this.configuration = configuration;
		this.cache = configuration.cache();
		this.registry = configuration.registry();
		this.environment = configuration.environment();
	}

	/**
	 * Lift a closed term.
	 *
	 * @param term
	 * @return
	 */
	public Term lift(Term term) {
		return apply(Context.EMPTY, term);
	}

	/**
	 * Lift a term in a given binder context.
	 *
	 * @param context
	 * @param term
	 * @return
	 */
	public Term lift(Context context, Term term) {
		return apply(context, term);
	}

	public Term[] lift(Context context, Term[] terms) {
		return apply(context, terms);
	}

	@Override
	public Term apply(Context context, Term term) {
		LiftRule rule = configuration.classify(context, term);
		log.trace("lifting {} by {}", term, rule);
		Term lifted;
		switch (rule.kind()) {
		case CACHE_HIT:
			return rule.result();
		case OPAQUE:
			lifted = term;
			break;
		case APPLICATION:
			lifted = repack(context, term, liftApplication(context, (Term.Application) term));
			break;
		case CONSTANT:
			lifted = repack(context, term, liftConstant((Term.Global) term));
			break;
		case ELIMINATOR:
			lifted = repack(context, term, configuration.rules().apply(rule, context, term, this));
			break;
		case UNLIFTABLE:
			throw new OrnamentError.UnliftableNode(UNLIFTABLE_TERM, term);
		case GENERIC:
			lifted = super.apply(context, term);
			break;
		default:
			if (rule.template() != null) {
				lifted = liftTemplate(context, rule.template(), term);
			} else {
				lifted = configuration.rules().apply(rule, context, term, this);
			}
		}
		if (!(term instanceof Term.Variable) && !(term instanceof Term.Sort)) {
			cache.put(context, term, configuration.direction(), lifted);
		}
		return lifted;
	}

	@Override
	protected Context enter(Context context, String name, Term type, Term value) {
		if (value == null) {
			return context.bind(name, type);
		} else {
			return context.define(name, type, value);
		}
	}

	/**
	 * Lift the function and arguments of an application. When nothing
	 * changes, the original application is retained.
	 *
	 * @param context
	 * @param term
	 * @return
	 */
	private Term liftApplication(Context context, Term.Application term) {
		Term function = apply(context, term.function());
		Term[] arguments = apply(context, term.arguments());
		if (function == term.function() && arguments == term.arguments()) {
			return term;
		}
		return Terms.apply(function, arguments);
	}

	/**
	 * Lift a global reference. A reference lifted by an earlier request is
	 * replaced by its lifted name. Otherwise, the definition is unfolded and
	 * lifted, though the reference is kept when lifting its body changes
	 * nothing.
	 *
	 * @param term
	 * @return
	 */
	private Term liftConstant(Term.Global term) {
		String renamed = registry.lookupLifting(configuration.correspondence(), configuration.direction(),
				term.name());
		if (renamed != null) {
			return new Term.Global(renamed, term.attributes());
		}
		Environment.Definition d = environment.definition(term.name());
		if (d == null || d.isAxiom()) {
			return term;
		}
		Term body = apply(Context.EMPTY, d.body());
		return body == d.body() ? term : body;
	}

	/**
	 * Lift a reference to (or application of) a global by applying a closed
	 * template to the lifted arguments.
	 *
	 * @param context
	 * @param template
	 * @param term
	 * @return
	 */
	private Term liftTemplate(Context context, Term template, Term term) {
		Term[] arguments = apply(context, Terms.arguments(term));
		return Terms.beta(Terms.apply(template, arguments));
	}

	/**
	 * Re-wrap a lifted term whose original type is the type being lifted from,
	 * but which is not syntactically a pair. This only applies when lifting
	 * forward, and names the term once so that it is not recomputed for each
	 * component.
	 *
	 * @param context
	 * @param term
	 * @param lifted
	 * @return
	 */
	private Term repack(Context context, Term term, Term lifted) {
		if (!configuration.isForward() || lifted == term || Packing.isPack(lifted) || Packing.isPair(lifted)
				|| Packing.isRepack(lifted)) {
			return lifted;
		}
		Term type = configuration.typeOf(context, term);
		if (!configuration.rules().isBeforeType(type)) {
			return lifted;
		}
		Term ltype = apply(context, type);
		if (!Packing.isSigma(ltype) && !Packing.isProd(ltype)) {
			return lifted;
		}
		return Packing.repack(lifted, ltype);
	}

	// ========================================================================
	// Renaming
	// ========================================================================

	@Override
	protected Term apply(Context context, Term.Construct term) {
		Term.Construct r = (Term.Construct) super.apply(context, term);
		String type = rename(term.type());
		if (type == null) {
			return r;
		}
		String name = rename(term.name());
		return new Term.Construct(type, term.index(), name == null ? term.name() : name, r.arguments(),
				term.attributes());
	}

	@Override
	protected Term apply(Context context, Term.Eliminate term) {
		Term.Eliminate r = (Term.Eliminate) super.apply(context, term);
		String type = rename(term.type());
		if (type == null) {
			return r;
		}
		return new Term.Eliminate(type, r.parameters(), r.motive(), r.cases(), r.indices(), r.scrutinee(),
				term.attributes());
	}

	@Override
	protected Term apply(Context context, Term.Case term) {
		Term.Case r = (Term.Case) super.apply(context, term);
		String type = rename(term.type());
		if (type == null) {
			return r;
		}
		return new Term.Case(type, r.motive(), r.scrutinee(), r.branches(), term.attributes());
	}

	private String rename(String name) {
		return registry.lookupLifting(configuration.correspondence(), configuration.direction(), name);
	}
}
