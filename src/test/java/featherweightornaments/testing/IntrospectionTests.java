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

import static org.junit.Assert.assertEquals;

import org.junit.Test;

import featherweightornaments.core.Environment;
import featherweightornaments.core.Syntax.Term;
import featherweightornaments.core.TypeDeclaration;
import featherweightornaments.discovery.StructuralRecursionPrinciple;
import featherweightornaments.discovery.TypeIntrospection;

/**
 * Test cases for deriving the structural recursion principle of an inductive
 * type. Each test compares the derived principle against one written out by
 * hand.
 *
 * @author David J. Pearce
 *
 */
public class IntrospectionTests {

	// ==============================================================
	// Full Principles
	// ==============================================================

	@Test
	public void test_0x0001() {
		check("nat", "forall (P : nat -> Type), P O -> (forall (n : nat), P n -> P (S n)) -> forall (x : nat), P x");
	}

	@Test
	public void test_0x0002() {
		check("bool", "forall (P : bool -> Type), P true -> P false -> forall (x : bool), P x");
	}

	@Test
	public void test_0x0003() {
		check("list", "forall (T : Type) (P : list T -> Type), P (nil T) ->"
				+ " (forall (x : T) (l : list T), P l -> P (cons T x l)) -> forall (l : list T), P l");
	}

	@Test
	public void test_0x0004() {
		check("vector", "forall (T : Type) (P : forall (n : nat), vector T n -> Type), P O (vnil T) ->"
				+ " (forall (n : nat) (t : T) (v : vector T n), P n v -> P (S n) (vcons T n t v)) ->"
				+ " forall (n : nat) (v : vector T n), P n v");
	}

	// ==============================================================
	// Components
	// ==============================================================

	@Test
	public void test_0x0010() {
		Environment env = Prelude.environment();
		TypeDeclaration list = env.getDeclaration("list");
		StructuralRecursionPrinciple principle = TypeIntrospection.principle(list);
		assertEquals(1, principle.parameterCount());
		assertEquals(0, principle.indexCount());
		assertEquals(2, principle.caseTypes().length);
		// P (nil T), with P innermost
		Term nil = list.construct(0, new Term[] { new Term.Variable(1) }, new Term[0]);
		TermTests.check(new Term.Application(new Term.Variable(0), new Term[] { nil }), principle.caseType(0));
	}

	@Test
	public void test_0x0011() {
		Environment env = Prelude.environment();
		StructuralRecursionPrinciple principle = TypeIntrospection.principle(env.getDeclaration("vector"));
		// forall (n : nat), vector T n -> Type, with T innermost
		Term self = new Term.Application(new Term.Global("vector"),
				new Term[] { new Term.Variable(1), new Term.Variable(0) });
		Term expected = new Term.Pi("n", new Term.Global("nat"), new Term.Pi("x", self, Term.Sort.TYPE));
		TermTests.check(expected, principle.motiveType());
		assertEquals(1, principle.indexCount());
	}

	@Test
	public void test_0x0012() {
		// Arguments after a recursive one see its hypothesis
		Environment env = Prelude.environment(
				"Inductive tree : Type := | leaf : tree | node : tree -> nat -> tree -> tree.");
		check(env, "tree", "forall (P : tree -> Type), P leaf ->"
				+ " (forall (l : tree), P l -> forall (n : nat) (r : tree), P r -> P (node l n r)) ->"
				+ " forall (x : tree), P x");
	}

	@Test
	public void test_0x0013() {
		Environment env = Prelude.environment();
		TermTests.check(Prelude.term(env, "forall (T : Type), T -> list T -> list T"),
				env.getDeclaration("list").constructorType(1));
		TermTests.check(Prelude.term(env, "forall (T : Type) (n : nat), T -> vector T n -> vector T (S n)"),
				env.getDeclaration("vector").constructorType(1));
	}

	public static void check(String name, String expected) {
		check(Prelude.environment(), name, expected);
	}

	public static void check(Environment env, String name, String expected) {
		StructuralRecursionPrinciple principle = TypeIntrospection.principle(env.getDeclaration(name));
		TermTests.check(Prelude.term(env, expected), principle.type());
	}
}
