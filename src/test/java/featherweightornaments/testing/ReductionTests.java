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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import featherweightornaments.core.Environment;
import featherweightornaments.core.Reduction;
import featherweightornaments.core.Syntax;
import featherweightornaments.core.Syntax.Term;
import featherweightornaments.core.TypeDeclaration;

/**
 * Test cases for reduction. Each test reads a term against the standard
 * declarations, reduces it and compares against an expected normal form.
 *
 * @author David J. Pearce
 *
 */
public class ReductionTests {

	// ==============================================================
	// Iota Reduction
	// ==============================================================

	@Test
	public void test_0x0001() {
		check("add 1 2", "3");
	}

	@Test
	public void test_0x0002() {
		check("add 0 0", "0");
	}

	@Test
	public void test_0x0003() {
		check("hd_default nat 0 (cons nat 1 (cons nat 2 (nil nat)))", "1", Prelude.HD_DEFAULT);
	}

	@Test
	public void test_0x0004() {
		check("hd_default nat 7 (nil nat)", "7", Prelude.HD_DEFAULT);
	}

	@Test
	public void test_0x0005() {
		check("length nat (cons nat 1 (cons nat 2 (cons nat 3 (nil nat))))", "3", Prelude.LENGTH);
	}

	@Test
	public void test_0x0006() {
		check("append nat (cons nat 1 (nil nat)) (cons nat 2 (nil nat))", "cons nat 1 (cons nat 2 (nil nat))",
				Prelude.APPEND);
	}

	@Test
	public void test_0x0007() {
		// Recursive arguments with indices
		String sum = "Definition vsum (n : nat) (v : vector nat n) : nat :=\n"
				+ "  elim vector [nat] (fun (m : nat) (x : vector nat m) => nat)\n"
				+ "    { O | fun (m : nat) (h : nat) (t : vector nat m) (ih : nat) => add h ih } [n] v.";
		check("vsum 2 (vcons nat 1 3 (vcons nat 0 4 (vnil nat)))", "7", sum);
	}

	// ==============================================================
	// Case Analysis
	// ==============================================================

	@Test
	public void test_0x0010() {
		check("case nat (fun (x : nat) => bool) 0 { true | fun (m : nat) => false }", "true");
	}

	@Test
	public void test_0x0011() {
		check("case nat (fun (x : nat) => nat) 3 { O | fun (m : nat) => m }", "2");
	}

	// ==============================================================
	// Let, Projection and Delta
	// ==============================================================

	@Test
	public void test_0x0020() {
		Environment env = Prelude.environment();
		Term t = new Reduction(env).whnf(Prelude.term(env, "let x : nat := 2 in S x"));
		TermTests.check(Prelude.term(env, "3"), t);
	}

	@Test
	public void test_0x0021() {
		check("(pack nat (fun (n : nat) => vector nat n) 0 (vnil nat)).1", "0");
	}

	@Test
	public void test_0x0022() {
		check("(pair nat bool 1 true).2", "true");
	}

	@Test
	public void test_0x0023() {
		// Definitions are left folded
		Environment env = Prelude.environment();
		Term t = Prelude.term(env, "add");
		assertSame(t, new Reduction(env, false).whnf(t));
	}

	@Test
	public void test_0x0024() {
		// Axioms cannot be unfolded
		Environment env = Prelude.environment("Axiom c : nat.");
		Term t = Prelude.term(env, "c");
		assertSame(t, new Reduction(env).whnf(t));
		TermTests.check(Prelude.term(env, "S c"), new Reduction(env).normalise(Prelude.term(env, "add 1 c")));
	}

	// ==============================================================
	// Fixpoints
	// ==============================================================

	@Test
	public void test_0x0030() {
		Environment env = Prelude.environment();
		TypeDeclaration nat = env.getDeclaration("nat");
		Term NAT = new Term.Global("nat");
		// fix f (n : nat) := case n { O | fun m => S (f m) }
		Term recurse = new Term.Application(new Term.Variable(2), new Term[] { new Term.Variable(0) });
		Term succ = new Term.Lambda("m", NAT, nat.construct(1, new Term[0], new Term[] { recurse }));
		Term body = new Term.Lambda("n", NAT, new Term.Case("nat", new Term.Lambda("x", NAT, NAT),
				new Term.Variable(0), new Term[] { nat.construct(0, new Term[0], new Term[0]), succ }));
		Term fix = new Term.Fix("f", new Term.Pi("_", NAT, NAT), body, 0);
		Term t = new Term.Application(fix, new Term[] { Prelude.term(env, "2") });
		TermTests.check(Prelude.term(env, "2"), new Reduction(env).normalise(t));
	}

	@Test
	public void test_0x0031() {
		// Fixpoints are stuck on unknown values
		Environment env = Prelude.environment("Axiom c : nat.");
		Term NAT = new Term.Global("nat");
		Term fix = new Term.Fix("f", new Term.Pi("_", NAT, NAT), new Term.Lambda("n", NAT, new Term.Variable(0)), 0);
		Term t = new Term.Application(fix, new Term[] { new Term.Global("c") });
		assertSame(t, new Reduction(env).whnf(t));
	}

	// ==============================================================
	// Convertibility
	// ==============================================================

	@Test
	public void test_0x0040() {
		Environment env = Prelude.environment();
		Reduction r = new Reduction(env);
		assertTrue(r.convertible(Prelude.term(env, "fun (x : nat) => add 0 x"), Prelude.term(env, "fun (y : nat) => y")));
	}

	@Test
	public void test_0x0041() {
		Environment env = Prelude.environment();
		Reduction r = new Reduction(env);
		assertFalse(r.convertible(Prelude.term(env, "fun (x : nat) => add x 0"), Prelude.term(env, "fun (y : nat) => y")));
	}

	public static void check(String input, String output, String... sentences) {
		Environment env = Prelude.environment(sentences);
		Term expected = Prelude.term(env, output);
		Term actual = new Reduction(env).normalise(Prelude.term(env, input));
		if (!expected.equals(actual)) {
			throw new AssertionError("expected " + Syntax.toString(expected) + ", got " + Syntax.toString(actual));
		}
	}
}
