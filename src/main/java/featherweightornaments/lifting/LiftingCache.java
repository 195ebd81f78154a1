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

import java.util.HashMap;
import java.util.Map;

import featherweightornaments.core.Context;
import featherweightornaments.core.Syntax.Term;

/**
 * Memoises lifted terms within a single lifting request. Entries are keyed by
 * the identity of the term and of the binder context in which it was lifted,
 * along with the direction. Structurally equal terms are deliberately not
 * shared, since the same subterm may need a different rewrite under
 * different binders.
 *
 * @author David J. Pearce
 *
 */
public class LiftingCache {
	private final Map<Key, Term> entries = new HashMap<>();
	private int hits;

	/**
	 * Get the lifted form of a term, or <code>null</code> if it was not lifted
	 * before.
	 *
	 * @param context
	 * @param term
	 * @param direction
	 * @return
	 */
	public Term get(Context context, Term term, LiftingConfiguration.Direction direction) {
		Term r = entries.get(new Key(context, term, direction));
		if (r != null) {
			hits++;
		}
		return r;
	}

	public void put(Context context, Term term, LiftingConfiguration.Direction direction, Term lifted) {
		entries.put(new Key(context, term, direction), lifted);
	}

	public int size() {
		return entries.size();
	}

	/**
	 * Drop all entries, such as after a failed request whose entries may
	 * refer to names which were never declared.
	 */
	public void clear() {
		entries.clear();
	}

	/**
	 * Get the number of lookups which found an entry.
	 *
	 * @return
	 */
	public int hits() {
		return hits;
	}

	private static final class Key {
		private final Context context;
		private final Term term;
		private final LiftingConfiguration.Direction direction;

		public Key(Context context, Term term, LiftingConfiguration.Direction direction) {
			this.context = context;
			this.term = term;
			this.direction = direction;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Key) {
				Key k = (Key) o;
				return context == k.context && term == k.term && direction == k.direction;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return System.identityHashCode(context) ^ System.identityHashCode(term) ^ direction.hashCode();
		}
	}
}
