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
package featherweightornaments.util;

import featherweightornaments.core.Syntax;
import featherweightornaments.core.Syntax.Term;

/**
 * A generic structural transformation over terms. Each syntactic form is
 * dispatched to its own overloaded <code>apply</code> method whose default
 * implementation simply transforms all children. A node is only rebuilt when
 * at least one of its children actually changed, so transformers which leave
 * a term untouched return the very same object. This is relied upon by
 * identity-keyed caches.
 *
 * The state is threaded through binders using <code>enter()</code>, which is
 * invoked whenever the traversal moves underneath a binder. For example, a
 * transformer tracking the binder context extends the context here, whilst
 * one only counting binders increments a depth.
 *
 * @author David J. Pearce
 *
 * @param <T> The state being threaded through the traversal (e.g. a binder
 *            context or depth).
 */
public abstract class AbstractTransformer<T> {

	public Term apply(T state, Term term) {
		switch (term.getOpcode()) {
		case Syntax.TERM_variable:
			return apply(state, (Term.Variable) term);
		case Syntax.TERM_global:
			return apply(state, (Term.Global) term);
		case Syntax.TERM_construct:
			return apply(state, (Term.Construct) term);
		case Syntax.TERM_application:
			return apply(state, (Term.Application) term);
		case Syntax.TERM_lambda:
			return apply(state, (Term.Lambda) term);
		case Syntax.TERM_let:
			return apply(state, (Term.Let) term);
		case Syntax.TERM_pi:
			return apply(state, (Term.Pi) term);
		case Syntax.TERM_case:
			return apply(state, (Term.Case) term);
		case Syntax.TERM_eliminate:
			return apply(state, (Term.Eliminate) term);
		case Syntax.TERM_fix:
			return apply(state, (Term.Fix) term);
		case Syntax.TERM_cofix:
			return apply(state, (Term.CoFix) term);
		case Syntax.TERM_project:
			return apply(state, (Term.Project) term);
		case Syntax.TERM_cast:
			return apply(state, (Term.Cast) term);
		case Syntax.TERM_sort:
			return apply(state, (Term.Sort) term);
		}
		// Give up
		throw new IllegalArgumentException("Invalid term encountered: " + term);
	}

	/**
	 * Construct the state which holds underneath a binder.
	 *
	 * @param state The state outside the binder.
	 * @param name  The name of the binder (for display only).
	 * @param type  The declared type of the binder, as it appears in the
	 *              original term.
	 * @param value The value bound by a let, or <code>null</code>.
	 * @return
	 */
	protected abstract T enter(T state, String name, Term type, Term value);

	protected Term apply(T state, Term.Variable term) {
		return term;
	}

	protected Term apply(T state, Term.Global term) {
		return term;
	}

	protected Term apply(T state, Term.Sort term) {
		return term;
	}

	protected Term apply(T state, Term.Construct term) {
		Term[] arguments = apply(state, term.arguments());
		if (arguments == term.arguments()) {
			return term;
		}
		return new Term.Construct(term.type(), term.index(), term.name(), arguments, term.attributes());
	}

	protected Term apply(T state, Term.Application term) {
		Term function = apply(state, term.function());
		Term[] arguments = apply(state, term.arguments());
		if (function == term.function() && arguments == term.arguments()) {
			return term;
		}
		return new Term.Application(function, arguments, term.attributes());
	}

	protected Term apply(T state, Term.Lambda term) {
		Term type = apply(state, term.type());
		Term body = apply(enter(state, term.name(), term.type(), null), term.body());
		if (type == term.type() && body == term.body()) {
			return term;
		}
		return new Term.Lambda(term.name(), type, body, term.attributes());
	}

	protected Term apply(T state, Term.Pi term) {
		Term type = apply(state, term.type());
		Term body = apply(enter(state, term.name(), term.type(), null), term.body());
		if (type == term.type() && body == term.body()) {
			return term;
		}
		return new Term.Pi(term.name(), type, body, term.attributes());
	}

	protected Term apply(T state, Term.Let term) {
		Term value = apply(state, term.value());
		Term type = apply(state, term.type());
		Term body = apply(enter(state, term.name(), term.type(), term.value()), term.body());
		if (value == term.value() && type == term.type() && body == term.body()) {
			return term;
		}
		return new Term.Let(term.name(), value, type, body, term.attributes());
	}

	protected Term apply(T state, Term.Case term) {
		Term motive = apply(state, term.motive());
		Term scrutinee = apply(state, term.scrutinee());
		Term[] branches = apply(state, term.branches());
		if (motive == term.motive() && scrutinee == term.scrutinee() && branches == term.branches()) {
			return term;
		}
		return new Term.Case(term.type(), motive, scrutinee, branches, term.attributes());
	}

	protected Term apply(T state, Term.Eliminate term) {
		Term[] parameters = apply(state, term.parameters());
		Term motive = apply(state, term.motive());
		Term[] cases = apply(state, term.cases());
		Term[] indices = apply(state, term.indices());
		Term scrutinee = apply(state, term.scrutinee());
		if (parameters == term.parameters() && motive == term.motive() && cases == term.cases()
				&& indices == term.indices() && scrutinee == term.scrutinee()) {
			return term;
		}
		return new Term.Eliminate(term.type(), parameters, motive, cases, indices, scrutinee, term.attributes());
	}

	protected Term apply(T state, Term.Fix term) {
		Term type = apply(state, term.type());
		Term body = apply(enter(state, term.name(), term.type(), null), term.body());
		if (type == term.type() && body == term.body()) {
			return term;
		}
		return new Term.Fix(term.name(), type, body, term.decreasing(), term.attributes());
	}

	protected Term apply(T state, Term.CoFix term) {
		Term type = apply(state, term.type());
		Term body = apply(enter(state, term.name(), term.type(), null), term.body());
		if (type == term.type() && body == term.body()) {
			return term;
		}
		return new Term.CoFix(term.name(), type, body, term.attributes());
	}

	protected Term apply(T state, Term.Project term) {
		Term target = apply(state, term.target());
		if (target == term.target()) {
			return term;
		}
		return new Term.Project(term.field(), target, term.attributes());
	}

	protected Term apply(T state, Term.Cast term) {
		Term t = apply(state, term.term());
		Term type = apply(state, term.type());
		if (t == term.term() && type == term.type()) {
			return term;
		}
		return new Term.Cast(t, type, term.attributes());
	}

	/**
	 * Transform an array of terms, returning the original array if no element
	 * changed.
	 *
	 * @param state
	 * @param terms
	 * @return
	 */
	public Term[] apply(T state, Term[] terms) {
		Term[] result = terms;
		for (int i = 0; i != terms.length; ++i) {
			Term t = apply(state, terms[i]);
			if (t != terms[i]) {
				if (result == terms) {
					result = terms.clone();
				}
				result[i] = t;
			}
		}
		return result;
	}
}
