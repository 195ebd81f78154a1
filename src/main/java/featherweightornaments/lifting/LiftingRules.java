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

import featherweightornaments.core.Context;
import featherweightornaments.core.Syntax.Term;
import featherweightornaments.core.Terms;
import featherweightornaments.discovery.CorrespondenceDescriptor;

/**
 * The lifting rules specific to one kind of correspondence. These recognise
 * the terms which mention the types being related in a way the generic
 * traversal cannot handle, and rewrite them.
 *
 * @author David J. Pearce
 *
 */
public abstract class LiftingRules {
	protected final LiftingConfiguration configuration;
	protected final CorrespondenceDescriptor correspondence;

	protected LiftingRules(LiftingConfiguration configuration) {
		this.configuration = configuration;
		this.correspondence = configuration.correspondence();
	}

	/**
	 * Determine the rule which applies to a given term, or <code>null</code>
	 * if no rule specific to this kind of correspondence applies.
	 *
	 * @param context
	 * @param term
	 * @return
	 */
	public abstract LiftRule classify(Context context, Term term);

	/**
	 * Apply a rule previously determined by {@link #classify(Context, Term)}
	 * which has no template.
	 *
	 * @param rule
	 * @param context
	 * @param term
	 * @param lifter
	 * @return
	 */
	public abstract Term apply(LiftRule rule, Context context, Term term, TermLifter lifter);

	/**
	 * Check whether a type is the type being lifted from, in the current
	 * direction.
	 *
	 * @param type
	 * @return
	 */
	public abstract boolean isBeforeType(Term type);

	/**
	 * Check whether a term is a reference to, or application of, a given
	 * closed term.
	 *
	 * @param term
	 * @param function
	 * @return
	 */
	protected static boolean applies(Term term, Term function) {
		if (function == null || !(term instanceof Term.Global || term instanceof Term.Application)) {
			return false;
		}
		return Terms.head(term).equals(function);
	}

	/**
	 * Check whether a term is a reference to, or application of, a given
	 * global.
	 *
	 * @param term
	 * @param name
	 * @return
	 */
	protected static boolean applies(Term term, String name) {
		return (term instanceof Term.Global || term instanceof Term.Application) && Terms.isApplicationOf(term, name);
	}

	/**
	 * Recognise applications of promote or forget. Lifting either function in
	 * either direction gives the identity on the lifted type, so the
	 * application is replaced by its (lifted) final argument.
	 *
	 * @param term
	 * @param template The identity on the lifted type, abstracted over the
	 *                 parameters and indices.
	 * @return
	 */
	protected LiftRule internalize(Term term, Term template) {
		if (applies(term, correspondence.promote()) || applies(term, correspondence.forget())) {
			return LiftRule.template(LiftRule.Kind.INTERNALIZE, template);
		}
		return null;
	}
}
