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
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import featherweightornaments.Ornaments;
import featherweightornaments.core.Context;
import featherweightornaments.core.Environment;
import featherweightornaments.core.Packing;
import featherweightornaments.core.Reduction;
import featherweightornaments.core.Syntax;
import featherweightornaments.core.Syntax.Term;
import featherweightornaments.core.Terms;
import featherweightornaments.discovery.CorrespondenceDescriptor;
import featherweightornaments.lifting.LiftRule;
import featherweightornaments.lifting.LiftingConfiguration;
import featherweightornaments.lifting.LiftingConfiguration.Direction;
import featherweightornaments.util.OrnamentError;

/**
 * Test cases for lifting terms and definitions along the algebraic ornament
 * from lists to vectors, in both directions. Lifted functions are checked by
 * evaluating them on concrete values.
 *
 * @author David J. Pearce
 *
 */
public class LiftingTests {
	private static final String L1 = "(cons nat 1 (nil nat))";
	private static final String L2 = "(cons nat 2 (nil nat))";
	private static final String L12 = "(cons nat 1 (cons nat 2 (nil nat)))";
	private static final String V12 = "(pack nat (fun (n : nat) => vector nat n) 2 (vcons nat 1 1 (vcons nat 0 2 (vnil nat))))";
	private static final String SIGMA = "Sigma nat (fun (n : nat) => vector nat n)";

	// ==============================================================
	// Types and Constructors
	// ==============================================================

	@Test
	public void test_0x0001() {
		Fixture f = new Fixture();
		TermTests.check(f.term(SIGMA), f.lift(Direction.FORWARD, "list nat"));
	}

	@Test
	public void test_0x0002() {
		Fixture f = new Fixture();
		TermTests.check(f.term("list nat"), f.lift(Direction.BACKWARD, SIGMA));
	}

	@Test
	public void test_0x0003() {
		Fixture f = new Fixture();
		TermTests.check(f.term("list nat"), f.lift(Direction.BACKWARD, "vector nat 2"));
	}

	@Test
	public void test_0x0004() {
		Fixture f = new Fixture();
		Term t = f.lift(Direction.FORWARD, L12);
		assertTrue(Packing.isPack(t));
		f.checkConvertible(V12, t);
	}

	@Test
	public void test_0x0005() {
		Fixture f = new Fixture();
		TermTests.check(f.term(L12), f.lift(Direction.BACKWARD, V12));
	}

	@Test
	public void test_0x0006() {
		Fixture f = new Fixture();
		TermTests.check(f.term("cons nat 5 (nil nat)"), f.lift(Direction.BACKWARD, "vcons nat 0 5 (vnil nat)"));
	}

	@Test
	public void test_0x0007() {
		// Binder types are lifted too
		Fixture f = new Fixture();
		TermTests.check(f.term("fun (l : " + SIGMA + ") => l"), f.lift(Direction.FORWARD, "fun (l : list nat) => l"));
	}

	// ==============================================================
	// Functions
	// ==============================================================

	@Test
	public void test_0x0010() {
		Fixture f = new Fixture(Prelude.HD_DEFAULT);
		f.liftDefinition(Direction.FORWARD, "hd_default", "hd_default_vect");
		f.checkConvertible("1", f.term("hd_default_vect nat 0 " + V12));
		f.checkConvertible("3", f.term("hd_default_vect nat 3 (pack nat (fun (n : nat) => vector nat n) 0 (vnil nat))"));
	}

	@Test
	public void test_0x0011() {
		Fixture f = new Fixture(Prelude.HD_DEFAULT);
		f.liftDefinition(Direction.FORWARD, "hd_default", "hd_default_vect");
		Term type = f.environment.definition("hd_default_vect").type();
		TermTests.check(f.term("forall (T : Type), T -> Sigma nat (fun (n : nat) => vector T n) -> T"), type);
	}

	@Test
	public void test_0x0012() {
		Fixture f = new Fixture(Prelude.APPEND);
		f.liftDefinition(Direction.FORWARD, "append", "append_vect");
		f.checkConvertible(V12, f.term("append_vect nat (list_to_vector nat " + L1 + ") (list_to_vector nat " + L2 + ")"));
	}

	@Test
	public void test_0x0013() {
		// The index of the result is the length of the appended lists
		Fixture f = new Fixture(Prelude.APPEND);
		f.liftDefinition(Direction.FORWARD, "append", "append_vect");
		f.checkConvertible("list_to_vector_index nat (append nat " + L1 + " " + L2 + ")",
				f.term("(append_vect nat (list_to_vector nat " + L1 + ") (list_to_vector nat " + L2 + ")).1"));
	}

	@Test
	public void test_0x0014() {
		// Lifting there and back again
		Fixture f = new Fixture(Prelude.APPEND);
		f.liftDefinition(Direction.FORWARD, "append", "append_vect");
		f.liftDefinition(Direction.BACKWARD, "append_vect", "append_list");
		f.checkConvertible(L12, f.term("append_list nat " + L1 + " " + L2));
	}

	@Test
	public void test_0x0015() {
		Fixture f = new Fixture(Prelude.LENGTH);
		f.liftDefinition(Direction.FORWARD, "length", "length_vect");
		f.checkConvertible("2", f.term("length_vect nat " + V12));
	}

	@Test
	public void test_0x0016() {
		// Later lifts refer to the lifted definition
		Fixture f = new Fixture(Prelude.HD_DEFAULT);
		f.liftDefinition(Direction.FORWARD, "hd_default", "hd_default_vect");
		Term t = f.lift(Direction.FORWARD, "hd_default nat 0 " + L12);
		assertTrue(t instanceof Term.Application);
		TermTests.check(new Term.Global("hd_default_vect"), ((Term.Application) t).function());
	}

	@Test
	public void test_0x0017() {
		Fixture f = new Fixture();
		try {
			f.liftDefinition(Direction.FORWARD, "nat", "nat_vect");
			fail("expected invalid definition");
		} catch (IllegalArgumentException e) {
			// expected
		}
	}

	// ==============================================================
	// Coherence and Internalization
	// ==============================================================

	@Test
	public void test_0x0020() {
		Fixture f = new Fixture();
		f.checkConvertible("2", f.lift(Direction.FORWARD, "list_to_vector_index nat " + L12));
	}

	@Test
	public void test_0x0021() {
		Fixture f = new Fixture();
		TermTests.check(f.term("fun (s : list nat) => list_to_vector_index nat s"),
				f.lift(Direction.BACKWARD, "fun (s : " + SIGMA + ") => s.1"));
	}

	@Test
	public void test_0x0022() {
		Fixture f = new Fixture();
		f.checkConvertible(V12, f.lift(Direction.FORWARD, "list_to_vector nat " + L12));
	}

	@Test
	public void test_0x0023() {
		Fixture f = new Fixture();
		TermTests.check(f.term(L12), f.lift(Direction.BACKWARD, "list_to_vector_inv nat " + V12));
	}

	@Test
	public void test_0x0024() {
		// Promote is the identity once lifted
		Fixture f = new Fixture();
		TermTests.check(f.term("fun (l : " + SIGMA + ") => l"),
				f.lift(Direction.FORWARD, "fun (l : list nat) => list_to_vector nat l"));
	}

	// ==============================================================
	// Caching, Opacity and Idempotence
	// ==============================================================

	@Test
	public void test_0x0030() {
		// Terms not mentioning lists are unchanged
		Fixture f = new Fixture();
		Term t = f.term("add 1 2");
		assertSame(t, f.ornaments.lift(f.configuration(Direction.FORWARD), t));
	}

	@Test
	public void test_0x0031() {
		Fixture f = new Fixture(Prelude.HD_DEFAULT);
		LiftingConfiguration c = f.configuration(Direction.FORWARD);
		Term t = f.term("hd_default");
		Term first = f.ornaments.lift(c, t);
		int hits = c.cache().hits();
		Term second = f.ornaments.lift(c, t);
		assertSame(first, second);
		assertTrue(c.cache().hits() > hits);
	}

	@Test
	public void test_0x0032() {
		Fixture f = new Fixture(Prelude.HD_DEFAULT);
		Term t = f.term("hd_default");
		assertSame(t, f.ornaments.lift(f.ornaments.initializeLiftingConfiguration(f.correspondence,
				Direction.FORWARD, "hd_default"), t));
		assertNotSame(t, f.ornaments.lift(f.configuration(Direction.FORWARD), t));
	}

	@Test
	public void test_0x0033() {
		// Caches are not shared between configurations
		Fixture f = new Fixture(Prelude.HD_DEFAULT);
		LiftingConfiguration c1 = f.configuration(Direction.FORWARD);
		LiftingConfiguration c2 = f.configuration(Direction.FORWARD);
		f.ornaments.lift(c1, f.term("hd_default"));
		assertEquals(0, c2.cache().size());
		assertTrue(c1.cache().size() > 0);
	}

	@Test
	public void test_0x0034() {
		// Arguments of opaque functions are still lifted
		Fixture f = new Fixture(Prelude.HD_DEFAULT);
		LiftingConfiguration c = f.ornaments.initializeLiftingConfiguration(f.correspondence, Direction.FORWARD,
				"hd_default");
		Term t = f.ornaments.lift(c, f.term("hd_default nat 0 " + L12));
		assertEquals(new Term.Global("hd_default"), Terms.head(t));
		Term[] args = Terms.arguments(t);
		assertEquals(3, args.length);
		assertTrue(Packing.isPack(args[2]));
		f.checkConvertible(V12, args[2]);
	}

	// ==============================================================
	// Classification
	// ==============================================================

	@Test
	public void test_0x0040() {
		Fixture f = new Fixture(Prelude.HD_DEFAULT);
		checkRule(f, Direction.FORWARD, L12, LiftRule.Kind.CONSTRUCTOR);
		checkRule(f, Direction.FORWARD, "list nat", LiftRule.Kind.EQUIVALENCE);
		checkRule(f, Direction.FORWARD, "list_to_vector_index nat " + L12, LiftRule.Kind.COHERENCE);
		checkRule(f, Direction.FORWARD, "list_to_vector nat " + L12, LiftRule.Kind.INTERNALIZE);
		checkRule(f, Direction.FORWARD, "hd_default", LiftRule.Kind.CONSTANT);
		checkRule(f, Direction.FORWARD, "add 1 2", LiftRule.Kind.APPLICATION);
		checkRule(f, Direction.FORWARD, "3", LiftRule.Kind.GENERIC);
		checkRule(f, Direction.FORWARD,
				"elim list [nat] (fun (x : list nat) => nat) { O | fun (t : nat) (r : list nat) (ih : nat) => t } [] "
						+ L12,
				LiftRule.Kind.ELIMINATOR);
	}

	@Test
	public void test_0x0041() {
		Fixture f = new Fixture();
		checkRule(f, Direction.BACKWARD, "vcons nat 0 5 (vnil nat)", LiftRule.Kind.CONSTRUCTOR);
		checkRule(f, Direction.BACKWARD, SIGMA, LiftRule.Kind.EQUIVALENCE);
		checkRule(f, Direction.BACKWARD, "vector nat 2", LiftRule.Kind.EQUIVALENCE);
		checkRule(f, Direction.BACKWARD, V12, LiftRule.Kind.UNPACK);
		checkRule(f, Direction.BACKWARD, V12 + ".1", LiftRule.Kind.COHERENCE);
		checkRule(f, Direction.BACKWARD, V12 + ".2", LiftRule.Kind.UNPACK);
		checkRule(f, Direction.BACKWARD, "list_to_vector_inv nat " + V12, LiftRule.Kind.INTERNALIZE);
	}

	@Test
	public void test_0x0042() {
		Fixture f = new Fixture();
		LiftingConfiguration c = f.configuration(Direction.FORWARD);
		Term t = f.term(L12);
		f.ornaments.lift(c, t);
		assertEquals(LiftRule.Kind.CACHE_HIT, c.classify(Context.EMPTY, t).kind());
	}

	@Test
	public void test_0x0043() {
		Fixture f = new Fixture(Prelude.HD_DEFAULT);
		LiftingConfiguration c = f.ornaments.initializeLiftingConfiguration(f.correspondence, Direction.FORWARD,
				"hd_default");
		assertEquals(LiftRule.Kind.OPAQUE, c.classify(Context.EMPTY, f.term("hd_default")).kind());
	}

	// ==============================================================
	// Unliftable
	// ==============================================================

	@Test
	public void test_0x0050() {
		Fixture f = new Fixture();
		try {
			f.lift(Direction.FORWARD,
					"fun (l : list nat) => case list (fun (x : list nat) => nat) l { O | fun (h : nat) (t : list nat) => h }");
			fail("expected unliftable term");
		} catch (OrnamentError.UnliftableNode e) {
			// expected
		}
	}

	@Test
	public void test_0x0051() {
		// Case analysis over other types is fine
		Fixture f = new Fixture();
		Term t = f.term("fun (n : nat) => case nat (fun (x : nat) => nat) n { O | fun (m : nat) => m }");
		assertSame(t, f.ornaments.lift(f.configuration(Direction.FORWARD), t));
	}

	@Test
	public void test_0x0052() {
		// Fixpoints recursing over lists are unliftable
		Fixture f = new Fixture();
		Term list = f.term("list nat");
		Term NAT = new Term.Global("nat");
		Term fix = new Term.Fix("f", new Term.Pi("l", list, NAT), new Term.Lambda("l", list, f.term("0")), 0);
		assertEquals(LiftRule.Kind.UNLIFTABLE, f.configuration(Direction.FORWARD).classify(Context.EMPTY, fix).kind());
	}

	public static void checkRule(Fixture f, Direction direction, String input, LiftRule.Kind kind) {
		LiftRule rule = f.configuration(direction).classify(Context.EMPTY, f.term(input));
		assertEquals(kind, rule.kind());
	}

	/**
	 * The standard declarations with the ornament from lists to vectors
	 * already discovered.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Fixture {
		public final Environment environment;
		public final Ornaments ornaments;
		public final CorrespondenceDescriptor correspondence;

		public Fixture(String... sentences) {
			this.environment = Prelude.environment(sentences);
			this.ornaments = new Ornaments(environment);
			this.correspondence = ornaments.findOrnament("list", "vector");
		}

		public Term term(String input) {
			return Prelude.term(environment, input);
		}

		public LiftingConfiguration configuration(Direction direction) {
			return ornaments.initializeLiftingConfiguration(correspondence, direction);
		}

		public Term lift(Direction direction, String input) {
			return ornaments.lift(configuration(direction), term(input));
		}

		public void liftDefinition(Direction direction, String name, String newName) {
			ornaments.liftDefinition(configuration(direction), name, newName);
		}

		public void checkConvertible(String expected, Term actual) {
			Reduction reduction = new Reduction(environment);
			Term e = term(expected);
			assertNotNull(actual);
			if (!reduction.convertible(e, actual)) {
				throw new AssertionError("expected " + Syntax.toString(reduction.normalise(e)) + ", got "
						+ Syntax.toString(reduction.normalise(actual)));
			}
		}
	}
}
