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

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import featherweightornaments.Ornaments;
import featherweightornaments.core.Context;
import featherweightornaments.core.Environment;
import featherweightornaments.core.Reduction;
import featherweightornaments.core.Syntax;
import featherweightornaments.core.Syntax.Term;
import featherweightornaments.core.Terms;
import featherweightornaments.core.TypeInference;
import featherweightornaments.discovery.CorrespondenceDescriptor;
import featherweightornaments.discovery.IndexDescriptor;
import featherweightornaments.util.OrnamentError;

/**
 * Test cases for synthesizing the indexer, promote and forget functions of an
 * algebraic ornament. Each test discovers the ornament, and then evaluates the
 * synthesized functions on concrete values.
 *
 * @author David J. Pearce
 *
 */
public class SynthesisTests {
	private static final String L12 = "(cons nat 1 (cons nat 2 (nil nat)))";
	private static final String V12 = "(pack nat (fun (n : nat) => vector nat n) 2 (vcons nat 1 1 (vcons nat 0 2 (vnil nat))))";

	// ==============================================================
	// Discovery
	// ==============================================================

	@Test
	public void test_0x0001() {
		Environment env = Prelude.environment();
		CorrespondenceDescriptor c = new Ornaments(env).findOrnament("list", "vector");
		assertTrue(c.isAlgebraic());
		assertNotNull(env.definition("list_to_vector_index"));
		assertNotNull(env.definition("list_to_vector"));
		assertNotNull(env.definition("list_to_vector_inv"));
		TermTests.check(new Term.Global("list_to_vector_index"), c.indexer());
		TermTests.check(new Term.Global("list_to_vector"), c.promote());
		TermTests.check(new Term.Global("list_to_vector_inv"), c.forget());
	}

	@Test
	public void test_0x0002() {
		// Ornaments are only discovered once
		Environment env = Prelude.environment();
		Ornaments ornaments = new Ornaments(env);
		assertNull(ornaments.lookupOrnament("list", "vector"));
		CorrespondenceDescriptor c = ornaments.findOrnament("list", "vector");
		assertSame(c, ornaments.findOrnament("list", "vector"));
		assertSame(c, ornaments.lookupOrnament("list", "vector"));
	}

	@Test
	public void test_0x0003() {
		Environment env = Prelude.environment();
		try {
			new Ornaments(env).findOrnament("add", "vector");
			fail("expected unsupported shape");
		} catch (OrnamentError.UnsupportedShape e) {
			// expected
		}
	}

	@Test
	public void test_0x0004() {
		Environment env = Prelude.environment();
		Ornaments ornaments = new Ornaments(env);
		IndexDescriptor d = ornaments.findIndex(env.getDeclaration("list"), env.getDeclaration("vector"));
		Term indexer = ornaments.synthesizeIndexer(d);
		// Synthesis alone does not extend the environment
		assertNull(env.definition("list_to_vector_index"));
		Term t = Terms.apply(indexer, Prelude.term(env, "nat"), Prelude.term(env, L12));
		TermTests.check(Prelude.term(env, "2"), new Reduction(env).normalise(t));
	}

	// ==============================================================
	// Types
	// ==============================================================

	@Test
	public void test_0x0010() {
		checkType("list_to_vector_index", "forall (T : Type), list T -> nat");
	}

	@Test
	public void test_0x0011() {
		checkType("list_to_vector", "forall (T : Type), list T -> Sigma nat (fun (n : nat) => vector T n)");
	}

	@Test
	public void test_0x0012() {
		checkType("list_to_vector_inv", "forall (T : Type), Sigma nat (fun (n : nat) => vector T n) -> list T");
	}

	@Test
	public void test_0x0013() {
		// Applied promote has the packed type
		Environment env = list();
		Term type = new TypeInference(env).infer(Context.EMPTY, Prelude.term(env, "list_to_vector nat " + L12));
		assertTrue(new Reduction(env).convertible(Prelude.term(env, "Sigma nat (fun (n : nat) => vector nat n)"),
				type));
	}

	// ==============================================================
	// Evaluation
	// ==============================================================

	@Test
	public void test_0x0020() {
		check(list(), "list_to_vector_index nat " + L12, "2");
	}

	@Test
	public void test_0x0021() {
		check(list(), "list_to_vector_index nat (nil nat)", "0");
	}

	@Test
	public void test_0x0022() {
		check(list(), "list_to_vector nat " + L12, V12);
	}

	@Test
	public void test_0x0023() {
		check(list(), "list_to_vector nat (nil nat)", "pack nat (fun (n : nat) => vector nat n) 0 (vnil nat)");
	}

	@Test
	public void test_0x0024() {
		check(list(), "list_to_vector_inv nat " + V12, L12);
	}

	@Test
	public void test_0x0025() {
		// The index agrees with the indexer
		check(list(), "(list_to_vector nat " + L12 + ").1", "list_to_vector_index nat " + L12);
	}

	// ==============================================================
	// Round Trips
	// ==============================================================

	@Test
	public void test_0x0030() {
		check(list(), "list_to_vector_inv nat (list_to_vector nat " + L12 + ")", L12);
	}

	@Test
	public void test_0x0031() {
		check(list(), "list_to_vector nat (list_to_vector_inv nat " + V12 + ")", V12);
	}

	@Test
	public void test_0x0032() {
		// Holds for any value, once the list is known
		Environment env = list();
		Term lhs = Prelude.term(env,
				"fun (T : Type) (x y : T) => list_to_vector_inv T (list_to_vector T (cons T x (cons T y (nil T))))");
		Term rhs = Prelude.term(env, "fun (T : Type) (x y : T) => cons T x (cons T y (nil T))");
		assertTrue(new Reduction(env).convertible(lhs, rhs));
	}

	@Test
	public void test_0x0033() {
		// Forget is not the identity
		Environment env = list();
		assertFalse(new Reduction(env).convertible(Prelude.term(env, "list_to_vector_inv nat " + V12),
				Prelude.term(env, "nil nat")));
	}

	// ==============================================================
	// Computed Indices
	// ==============================================================

	private static final String N34 = "(ncons 1 3 (ncons 0 4 nnil))";

	@Test
	public void test_0x0040() {
		Environment env = sums();
		check(env, "nvec_to_svec_index 2 " + N34, "7");
	}

	@Test
	public void test_0x0041() {
		Environment env = sums();
		check(env, "nvec_to_svec 2 " + N34,
				"pack nat (fun (s : nat) => svec 2 s) 7 (scons 1 3 4 (scons 0 4 0 snil))");
	}

	@Test
	public void test_0x0042() {
		Environment env = sums();
		check(env, "nvec_to_svec_inv 2 (nvec_to_svec 2 " + N34 + ")", N34);
	}

	// ==============================================================
	// Name Clashes
	// ==============================================================

	@Test
	public void test_0x0050() {
		// A clash on the last name leaves the environment untouched
		Environment env = Prelude.environment("Definition list_to_vector_inv := O.");
		Ornaments ornaments = new Ornaments(env);
		try {
			ornaments.findOrnament("list", "vector");
			fail("expected name clash");
		} catch (IllegalArgumentException e) {
			assertTrue(e.getMessage().startsWith(Ornaments.NAME_ALREADY_DECLARED));
		}
		assertNull(env.definition("list_to_vector_index"));
		assertNull(env.definition("list_to_vector"));
		assertNull(ornaments.lookupOrnament("list", "vector"));
	}

	@Test
	public void test_0x0051() {
		// A clash on the promote function
		Environment env = Prelude.environment("Definition list_to_vector := O.");
		try {
			new Ornaments(env).findOrnament("list", "vector");
			fail("expected name clash");
		} catch (IllegalArgumentException e) {
			assertTrue(e.getMessage().endsWith(": list_to_vector"));
		}
		assertFalse(env.isDeclared("list_to_vector_index"));
		assertFalse(env.isDeclared("list_to_vector_inv"));
	}

	private static Environment list() {
		Environment env = Prelude.environment();
		new Ornaments(env).findOrnament("list", "vector");
		return env;
	}

	private static Environment sums() {
		Environment env = Prelude.environment(DifferencingTests.NVEC, DifferencingTests.SVEC);
		new Ornaments(env).findOrnament("nvec", "svec");
		return env;
	}

	public static void checkType(String name, String type) {
		Environment env = list();
		TermTests.check(Prelude.term(env, type), env.definition(name).type());
	}

	public static void check(Environment env, String input, String output) {
		Term expected = Prelude.term(env, output);
		Term actual = Prelude.term(env, input);
		Reduction reduction = new Reduction(env);
		if (!reduction.convertible(expected, actual)) {
			throw new AssertionError("expected " + Syntax.toString(reduction.normalise(expected)) + ", got "
					+ Syntax.toString(reduction.normalise(actual)));
		}
	}
}
