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

import featherweightornaments.core.Syntax.Binding;
import featherweightornaments.core.Syntax.Term;

/**
 * Describes an inductive (or coinductive) type declaration. Parameters are
 * fixed for the whole type, whilst indices may vary between values. For
 * example, the declaration of length-indexed vectors has one parameter (the
 * element type) and one index (the length):
 *
 * <pre>
 * Inductive vector (T : Type) : forall (n : nat), Type :=
 *   | vnil : vector T 0
 *   | vcons : forall (x : T) (n : nat) (v : vector T n), vector T (S n).
 * </pre>
 *
 * Index types live in the context of the parameters and earlier indices.
 *
 * @author David J. Pearce
 *
 */
public class TypeDeclaration {
	public enum Finiteness {
		INDUCTIVE, COINDUCTIVE
	}

	private final String name;
	private final Binding[] parameters;
	private final Binding[] indices;
	private final Term.Sort sort;
	private final Constructor[] constructors;
	private final Finiteness finiteness;
	private final int blockSize;

	public TypeDeclaration(String name, Binding[] parameters, Binding[] indices, Term.Sort sort,
			Constructor... constructors) {
		this(name, parameters, indices, sort, Finiteness.INDUCTIVE, 1, constructors);
	}

	public TypeDeclaration(String name, Binding[] parameters, Binding[] indices, Term.Sort sort,
			Finiteness finiteness, int blockSize, Constructor... constructors) {
		this.name = name;
		this.parameters = parameters;
		this.indices = indices;
		this.sort = sort;
		this.finiteness = finiteness;
		this.blockSize = blockSize;
		this.constructors = constructors;
		for (Constructor c : constructors) {
			if (c.indices.length != indices.length) {
				throw new IllegalArgumentException("constructor " + c.name + " has wrong number of indices");
			}
		}
	}

	public String name() {
		return name;
	}

	public Binding[] parameters() {
		return parameters;
	}

	public Binding[] indices() {
		return indices;
	}

	public Term.Sort sort() {
		return sort;
	}

	public Constructor[] constructors() {
		return constructors;
	}

	public Constructor constructor(int i) {
		return constructors[i];
	}

	public Finiteness finiteness() {
		return finiteness;
	}

	/**
	 * Get the number of declarations in the mutually recursive block this
	 * declaration belongs to (one when it is not mutually recursive).
	 *
	 * @return
	 */
	public int blockSize() {
		return blockSize;
	}

	/**
	 * Check whether this is a record, which is a type with exactly one
	 * constructor and no indices.
	 *
	 * @return
	 */
	public boolean isRecord() {
		return constructors.length == 1 && indices.length == 0;
	}

	/**
	 * Get the type of this declaration, which is a product over the parameters
	 * and indices.
	 *
	 * @return
	 */
	public Term type() {
		return Telescope.products(parameters, Telescope.products(indices, sort));
	}

	/**
	 * Construct this type applied to the given parameters and indices.
	 *
	 * @param parameters
	 * @param indices
	 * @return
	 */
	public Term apply(Term[] parameters, Term[] indices) {
		return Terms.apply(new Term.Global(name), Terms.append(parameters, indices));
	}

	/**
	 * Check whether a term is this type applied to some arguments.
	 *
	 * @param term
	 * @return
	 */
	public boolean isApplication(Term term) {
		return Terms.isApplicationOf(term, name);
	}

	/**
	 * Construct the <code>i</code>th constructor of this type for the given
	 * parameters and arguments.
	 *
	 * @param i
	 * @param parameters
	 * @param arguments
	 * @return
	 */
	public Term.Construct construct(int i, Term[] parameters, Term[] arguments) {
		return new Term.Construct(name, i, constructors[i].name(), Terms.append(parameters, arguments));
	}

	/**
	 * Get the full type of the <code>i</code>th constructor, including its
	 * parameters.
	 *
	 * @param i
	 * @return
	 */
	public Term constructorType(int i) {
		Constructor c = constructors[i];
		Term[] ps = Terms.variables(parameters.length, c.arguments.length);
		Term conclusion = apply(ps, c.indices);
		return Telescope.products(parameters, Telescope.products(c.arguments, conclusion));
	}

	/**
	 * Check whether a given argument of a given constructor is recursive.
	 *
	 * @param constructor
	 * @param argument
	 * @return
	 */
	public boolean isRecursive(int constructor, int argument) {
		return isApplication(constructors[constructor].arguments[argument].type());
	}

	@Override
	public String toString() {
		String r = "Inductive " + name;
		for (Binding b : parameters) {
			r += " " + b;
		}
		r += " : " + Telescope.products(indices, sort) + " :=";
		for (int i = 0; i != constructors.length; ++i) {
			Constructor c = constructors[i];
			r += " | " + c.name + " : " + Telescope.products(c.arguments,
					apply(Terms.variables(parameters.length, c.arguments.length), c.indices));
		}
		return r;
	}

	/**
	 * A constructor of an inductive type. Each argument type lives in the
	 * context of the parameters and the earlier arguments, as do the index
	 * values the constructor produces.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Constructor {
		private final String name;
		private final Binding[] arguments;
		private final Term[] indices;

		public Constructor(String name, Binding[] arguments, Term[] indices) {
			this.name = name;
			this.arguments = arguments;
			this.indices = indices;
		}

		public String name() {
			return name;
		}

		public Binding[] arguments() {
			return arguments;
		}

		/**
		 * Get the index values of this constructor's conclusion.
		 *
		 * @return
		 */
		public Term[] indices() {
			return indices;
		}
	}
}
