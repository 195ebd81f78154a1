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
package featherweightornaments.testing;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;

import featherweightornaments.core.Environment;
import featherweightornaments.core.Syntax.Term;
import featherweightornaments.io.Lexer;
import featherweightornaments.io.Parser;

/**
 * Common declarations shared by the test cases, along with helpers for
 * reading sentences and terms into an environment.
 *
 * @author David J. Pearce
 *
 */
public class Prelude {
	public static final String NAT = "Inductive nat : Type := | O : nat | S : nat -> nat.\n";

	public static final String BOOL = "Inductive bool : Type := | true : bool | false : bool.\n";

	public static final String LIST = "Inductive list (T : Type) : Type := | nil : list T | cons : T -> list T -> list T.\n";

	public static final String VECTOR = "Inductive vector (T : Type) : nat -> Type :=\n"
			+ "  | vnil : vector T O\n"
			+ "  | vcons : forall (n : nat), T -> vector T n -> vector T (S n).\n";

	public static final String ADD = "Definition add (a b : nat) : nat :=\n"
			+ "  elim nat [] (fun (x : nat) => nat) { b | fun (m r : nat) => S r } [] a.\n";

	public static final String HD_DEFAULT = "Definition hd_default (T : Type) (d : T) (l : list T) : T :=\n"
			+ "  elim list [T] (fun (x : list T) => T) { d | fun (t : T) (r : list T) (ih : T) => t } [] l.\n";

	public static final String APPEND = "Definition append (T : Type) (l1 l2 : list T) : list T :=\n"
			+ "  elim list [T] (fun (x : list T) => list T) { l2 | fun (t : T) (r : list T) (ih : list T) => cons T t ih } [] l1.\n";

	public static final String LENGTH = "Definition length (T : Type) (l : list T) : nat :=\n"
			+ "  elim list [T] (fun (x : list T) => nat) { O | fun (t : T) (r : list T) (ih : nat) => S ih } [] l.\n";

	public static final String STANDARD = NAT + BOOL + LIST + VECTOR + ADD;

	/**
	 * Construct an environment holding the standard declarations, followed by
	 * some additional sentences.
	 *
	 * @param sentences
	 * @return
	 */
	public static Environment environment(String... sentences) {
		Environment environment = new Environment();
		read(environment, STANDARD);
		for (String s : sentences) {
			read(environment, s);
		}
		return environment;
	}

	/**
	 * Read zero or more sentences into a given environment.
	 *
	 * @param environment
	 * @param input
	 */
	public static void read(Environment environment, String input) {
		try {
			new Parser(null, new Lexer(new StringReader(input)).scan(), environment).parseSentences();
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	/**
	 * Read a closed term against a given environment.
	 *
	 * @param environment
	 * @param input
	 * @return
	 */
	public static Term term(Environment environment, String input) {
		try {
			return new Parser(null, new Lexer(new StringReader(input)).scan(), environment).parseClosedTerm();
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}
}
