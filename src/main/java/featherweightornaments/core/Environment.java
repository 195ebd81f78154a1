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

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import featherweightornaments.core.Syntax.Term;

/**
 * The global environment in which terms are interpreted. This holds the
 * declared inductive types (and their constructors), along with the global
 * definitions. A definition without a body is an axiom, and is never unfolded.
 * Every environment begins with the built-in pair types provided by
 * {@link Packing}.
 *
 * @author David J. Pearce
 *
 */
public class Environment {
	private final Map<String, TypeDeclaration> declarations = new LinkedHashMap<>();
	private final Map<String, Definition> definitions = new LinkedHashMap<>();
	private final Map<String, TypeDeclaration> constructors = new HashMap<>();

	public Environment() {
		declare(Packing.SIGMA_DECLARATION);
		declare(Packing.PROD_DECLARATION);
	}

	/**
	 * Add a new inductive type declaration to this environment.
	 *
	 * @param declaration
	 */
	public void declare(TypeDeclaration declaration) {
		checkFresh(declaration.name());
		for (TypeDeclaration.Constructor c : declaration.constructors()) {
			checkFresh(c.name());
		}
		declarations.put(declaration.name(), declaration);
		for (TypeDeclaration.Constructor c : declaration.constructors()) {
			constructors.put(c.name(), declaration);
		}
	}

	/**
	 * Add a new global definition to this environment.
	 *
	 * @param name
	 * @param type
	 * @param body The body, or <code>null</code> for an axiom.
	 * @return
	 */
	public Definition define(String name, Term type, Term body) {
		checkFresh(name);
		Definition d = new Definition(name, type, body);
		definitions.put(name, d);
		return d;
	}

	public boolean isDeclared(String name) {
		return declarations.containsKey(name) || definitions.containsKey(name) || constructors.containsKey(name);
	}

	/**
	 * Get the inductive type declaration of a given name, or <code>null</code>.
	 *
	 * @param name
	 * @return
	 */
	public TypeDeclaration declaration(String name) {
		return declarations.get(name);
	}

	/**
	 * Get the inductive type declaration of a given name, failing if there is
	 * none.
	 *
	 * @param name
	 * @return
	 */
	public TypeDeclaration getDeclaration(String name) {
		TypeDeclaration d = declarations.get(name);
		if (d == null) {
			throw new IllegalArgumentException("unknown inductive type: " + name);
		}
		return d;
	}

	/**
	 * Get the definition of a given name, or <code>null</code>.
	 *
	 * @param name
	 * @return
	 */
	public Definition definition(String name) {
		return definitions.get(name);
	}

	/**
	 * Get the declaration which owns a constructor of the given name, or
	 * <code>null</code>.
	 *
	 * @param name
	 * @return
	 */
	public TypeDeclaration ownerOf(String constructor) {
		return constructors.get(constructor);
	}

	public Collection<TypeDeclaration> declarations() {
		return declarations.values();
	}

	public Collection<Definition> definitions() {
		return definitions.values();
	}

	/**
	 * Get the type of a global reference.
	 *
	 * @param name
	 * @return
	 */
	public Term typeOf(String name) {
		Definition d = definitions.get(name);
		if (d != null) {
			return d.type();
		}
		return getDeclaration(name).type();
	}

	private void checkFresh(String name) {
		if (isDeclared(name)) {
			throw new IllegalArgumentException("name already declared: " + name);
		}
	}

	/**
	 * A named global definition.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Definition {
		private final String name;
		private final Term type;
		private final Term body;

		public Definition(String name, Term type, Term body) {
			this.name = name;
			this.type = type;
			this.body = body;
		}

		public String name() {
			return name;
		}

		public Term type() {
			return type;
		}

		/**
		 * Get the body of this definition, or <code>null</code> if it is an
		 * axiom.
		 *
		 * @return
		 */
		public Term body() {
			return body;
		}

		public boolean isAxiom() {
			return body == null;
		}

		@Override
		public String toString() {
			return "Definition " + name + " : " + type + (body == null ? "" : " := " + body);
		}
	}
}
