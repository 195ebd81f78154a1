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

import featherweightornaments.core.Syntax.Term;

/**
 * The outcome of classifying a term during lifting. Exactly one rule applies
 * to each term, and the lifting engine dispatches on its kind. Some rules
 * carry a payload: a cache hit carries the cached result, whilst rules which
 * rewrite a global reference carry a closed <em>template</em> to be applied
 * to the (lifted) arguments of that reference.
 *
 * @author David J. Pearce
 *
 */
public class LiftRule {
	public enum Kind {
		/**
		 * The term was already lifted in this context.
		 */
		CACHE_HIT,
		/**
		 * The term is a reference which must be left untouched.
		 */
		OPAQUE,
		/**
		 * The term is a constructor of the type being lifted.
		 */
		CONSTRUCTOR,
		/**
		 * The term eliminates a value of the type being lifted.
		 */
		ELIMINATOR,
		/**
		 * The term is (an application of) the type being lifted.
		 */
		EQUIVALENCE,
		/**
		 * The term computes the index (or a field) of a value being lifted.
		 */
		COHERENCE,
		/**
		 * The term applies one of the correspondence's own functions.
		 */
		INTERNALIZE,
		/**
		 * The term unwraps, or is a wrapped, value of the new type.
		 */
		UNPACK,
		/**
		 * An application to which no more specific rule applies.
		 */
		APPLICATION,
		/**
		 * A global reference which may be lifted by unfolding it.
		 */
		CONSTANT,
		/**
		 * A term which scrutinises the type being lifted without using its
		 * eliminator.
		 */
		UNLIFTABLE,
		/**
		 * Any other term, which is lifted structurally.
		 */
		GENERIC
	}

	public static final LiftRule OPAQUE = new LiftRule(Kind.OPAQUE, null);
	public static final LiftRule CONSTRUCTOR = new LiftRule(Kind.CONSTRUCTOR, null);
	public static final LiftRule ELIMINATOR = new LiftRule(Kind.ELIMINATOR, null);
	public static final LiftRule EQUIVALENCE = new LiftRule(Kind.EQUIVALENCE, null);
	public static final LiftRule COHERENCE = new LiftRule(Kind.COHERENCE, null);
	public static final LiftRule UNPACK = new LiftRule(Kind.UNPACK, null);
	public static final LiftRule APPLICATION = new LiftRule(Kind.APPLICATION, null);
	public static final LiftRule CONSTANT = new LiftRule(Kind.CONSTANT, null);
	public static final LiftRule UNLIFTABLE = new LiftRule(Kind.UNLIFTABLE, null);
	public static final LiftRule GENERIC = new LiftRule(Kind.GENERIC, null);

	private final Kind kind;
	private final Term payload;

	private LiftRule(Kind kind, Term payload) {
		this.kind = kind;
		this.payload = payload;
	}

	public static LiftRule cacheHit(Term result) {
		return new LiftRule(Kind.CACHE_HIT, result);
	}

	/**
	 * Construct a rule which rewrites a global reference by applying a closed
	 * template to its lifted arguments.
	 *
	 * @param kind
	 * @param template
	 * @return
	 */
	public static LiftRule template(Kind kind, Term template) {
		return new LiftRule(kind, template);
	}

	public Kind kind() {
		return kind;
	}

	/**
	 * Get the cached result of a cache hit.
	 *
	 * @return
	 */
	public Term result() {
		return kind == Kind.CACHE_HIT ? payload : null;
	}

	/**
	 * Get the template of this rule, or <code>null</code> if it has none.
	 *
	 * @return
	 */
	public Term template() {
		return kind == Kind.CACHE_HIT ? null : payload;
	}

	@Override
	public String toString() {
		return kind.toString();
	}
}
