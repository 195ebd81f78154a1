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
import java.util.List;

import featherweightornaments.core.Syntax.Binding;
import featherweightornaments.core.Syntax.Term;

/**
 * A sequence of binders (i.e. a telescope) followed by a body, as obtained by
 * peeling the leading products off a type or the leading abstractions off a
 * function. Each binder type lives in the context extended by all earlier
 * binders, and the body lives in the context extended by all of them.
 *
 * @author David J. Pearce
 *
 */
public class Telescope {
	private final Binding[] bindings;
	private final Term body;

	public Telescope(Binding[] bindings, Term body) {
		this.bindings = bindings;
		this.body = body;
	}

	public Binding[] bindings() {
		return bindings;
	}

	public Binding get(int i) {
		return bindings[i];
	}

	public int size() {
		return bindings.length;
	}

	public Term body() {
		return body;
	}

	/**
	 * Peel off all leading products of a given type.
	 *
	 * @param type
	 * @return
	 */
	public static Telescope ofProducts(Term type) {
		return ofProducts(type, Integer.MAX_VALUE);
	}

	/**
	 * Peel off at most <code>n</code> leading products of a given type.
	 *
	 * @param type
	 * @param n
	 * @return
	 */
	public static Telescope ofProducts(Term type, int n) {
		List<Binding> bindings = new ArrayList<>();
		while (type instanceof Term.Pi && bindings.size() < n) {
			Term.Pi p = (Term.Pi) type;
			bindings.add(new Binding(p.name(), p.type()));
			type = p.body();
		}
		return new Telescope(bindings.toArray(new Binding[bindings.size()]), type);
	}

	/**
	 * Peel off at most <code>n</code> leading abstractions of a given term.
	 *
	 * @param term
	 * @param n
	 * @return
	 */
	public static Telescope ofLambdas(Term term, int n) {
		List<Binding> bindings = new ArrayList<>();
		while (term instanceof Term.Lambda && bindings.size() < n) {
			Term.Lambda l = (Term.Lambda) term;
			bindings.add(new Binding(l.name(), l.type()));
			term = l.body();
		}
		return new Telescope(bindings.toArray(new Binding[bindings.size()]), term);
	}

	/**
	 * Close a body over the given bindings using dependent products.
	 *
	 * @param bindings
	 * @param body
	 * @return
	 */
	public static Term products(Binding[] bindings, Term body) {
		for (int i = bindings.length - 1; i >= 0; --i) {
			body = new Term.Pi(bindings[i].name(), bindings[i].type(), body);
		}
		return body;
	}

	/**
	 * Close a body over the given bindings using abstractions.
	 *
	 * @param bindings
	 * @param body
	 * @return
	 */
	public static Term lambdas(Binding[] bindings, Term body) {
		for (int i = bindings.length - 1; i >= 0; --i) {
			body = new Term.Lambda(bindings[i].name(), bindings[i].type(), body);
		}
		return body;
	}

	/**
	 * Extend a context with all bindings of this telescope.
	 *
	 * @param context
	 * @return
	 */
	public Context extend(Context context) {
		for (Binding b : bindings) {
			context = context.bind(b.name(), b.type());
		}
		return context;
	}

	@Override
	public String toString() {
		String r = "";
		for (Binding b : bindings) {
			r += b + " ";
		}
		return r + ": " + body;
	}
}
