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

import featherweightornaments.core.Syntax.Term;

/**
 * A persistent stack of binders which is threaded through every traversal
 * that moves underneath binders. Each entry records the name, declared type
 * and (for let binders) the value. Types and values are stored in the context
 * in which they were declared, and are shifted on lookup so that they make
 * sense at the point of use.
 *
 * Contexts are immutable. Extending a context produces a new context which
 * shares its tail with the original, so contexts can be compared by identity.
 *
 * @author David J. Pearce
 *
 */
public final class Context {
	public static final Context EMPTY = new Context(null, null, null, null);

	private final Context parent;
	private final String name;
	private final Term type;
	private final Term value;
	private final int size;

	private Context(Context parent, String name, Term type, Term value) {
		this.parent = parent;
		this.name = name;
		this.type = type;
		this.value = value;
		this.size = parent == null ? 0 : parent.size + 1;
	}

	/**
	 * Extend this context with a fresh binder of the given type.
	 *
	 * @param name
	 * @param type
	 * @return
	 */
	public Context bind(String name, Term type) {
		return new Context(this, name, type, null);
	}

	/**
	 * Extend this context with a local definition.
	 *
	 * @param name
	 * @param type
	 * @param value
	 * @return
	 */
	public Context define(String name, Term type, Term value) {
		return new Context(this, name, type, value);
	}

	public int size() {
		return size;
	}

	/**
	 * Get the type of the variable with a given de Bruijn index, valid in this
	 * context.
	 *
	 * @param index
	 * @return
	 */
	public Term typeOf(int index) {
		return Terms.shift(entry(index).type, index + 1);
	}

	/**
	 * Get the value of a let-bound variable with the given index, or
	 * <code>null</code> if the variable is not let-bound.
	 *
	 * @param index
	 * @return
	 */
	public Term valueOf(int index) {
		Context e = entry(index);
		return e.value == null ? null : Terms.shift(e.value, index + 1);
	}

	private Context entry(int index) {
		if (index < 0 || index >= size) {
			throw new IllegalArgumentException("unbound variable #" + index);
		}
		Context c = this;
		for (int i = 0; i != index; ++i) {
			c = c.parent;
		}
		return c;
	}

	@Override
	public String toString() {
		String r = "";
		for (Context c = this; c.parent != null; c = c.parent) {
			r = "(" + c.name + " : " + c.type + ")" + (r.isEmpty() ? "" : " ") + r;
		}
		return "[" + r + "]";
	}
}
