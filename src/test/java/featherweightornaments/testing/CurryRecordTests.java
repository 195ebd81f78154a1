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

import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import featherweightornaments.Ornaments;
import featherweightornaments.core.Environment;
import featherweightornaments.core.Reduction;
import featherweightornaments.core.Syntax;
import featherweightornaments.core.Syntax.Term;
import featherweightornaments.discovery.CorrespondenceDescriptor;
import featherweightornaments.discovery.PromoteForgetSynthesizer;
import featherweightornaments.lifting.LiftingConfiguration;
import featherweightornaments.lifting.LiftingConfiguration.Direction;
import featherweightornaments.util.OrnamentError;

/**
 * Test cases for the correspondence between records and the nested pairs of
 * their fields, covering discovery, the synthesized functions and lifting in
 * both directions.
 *
 * @author David J. Pearce
 *
 */
public class CurryRecordTests {
	public static final String POINT = "Inductive point : Type := | mkpoint : nat -> bool -> point.\n"
			+ "Definition point_pairs := Prod nat bool.\n";

	public static final String TRIPLE = "Inductive triple (T : Type) : Type := | mktriple : T -> nat -> bool -> triple T.\n"
			+ "Definition triple_pairs (T : Type) := Prod T (Prod nat bool).\n";

	public static final String PX = "Definition px (r : point) : nat :=\n"
			+ "  elim point [] (fun (x : point) => nat) { fun (a : nat) (b : bool) => a } [] r.\n";

	// ==============================================================
	// Discovery
	// ==============================================================

	@Test
	public void test_0x0001() {
		Fixture f = new Fixture("point", "point_pairs", POINT);
		assertTrue(f.environment.definition("point_curry") != null);
		assertTrue(f.environment.definition("point_curry_inv") != null);
		assertSame(f.correspondence, f.ornaments.lookupOrnament("point", "point_pairs"));
	}

	@Test
	public void test_0x0002() {
		Fixture f = new Fixture("point", "point_pairs", POINT);
		TermTests.check(f.term("forall (r : point), Prod nat bool"),
				f.environment.definition("point_curry").type());
		TermTests.check(f.term("forall (p : Prod nat bool), point"),
				f.environment.definition("point_curry_inv").type());
	}

	@Test
	public void test_0x0003() {
		Fixture f = new Fixture("triple", "triple_pairs", TRIPLE);
		TermTests.check(f.term("forall (T : Type) (r : triple T), Prod T (Prod nat bool)"),
				f.environment.definition("triple_curry").type());
	}

	@Test
	public void test_0x0004() {
		Environment env = Prelude.environment(POINT, "Definition point_swapped := Prod bool nat.");
		checkUnsupported(env, "point", "point_swapped", Ornaments.NOT_CURRIED);
	}

	@Test
	public void test_0x0005() {
		Environment env = Prelude.environment(POINT);
		checkUnsupported(env, "list", "point_pairs", PromoteForgetSynthesizer.CurryRecord.NOT_RECORD);
	}

	@Test
	public void test_0x0006() {
		Environment env = Prelude.environment("Inductive wrap : Type := | mkwrap : nat -> wrap.",
				"Definition wrap_pairs := nat.");
		checkUnsupported(env, "wrap", "wrap_pairs", PromoteForgetSynthesizer.CurryRecord.TOO_FEW_FIELDS);
	}

	@Test
	public void test_0x0007() {
		Environment env = Prelude
				.environment("Inductive dep : Type := | mkdep : forall (n : nat), vector nat n -> dep.");
		checkUnsupported(env, "dep", PromoteForgetSynthesizer.CurryRecord.DEPENDENT_FIELD);
	}

	@Test
	public void test_0x0008() {
		Environment env = Prelude.environment("Inductive rose : Type := | mkrose : nat -> rose -> rose.");
		checkUnsupported(env, "rose", PromoteForgetSynthesizer.CurryRecord.RECURSIVE_FIELD);
	}

	@Test
	public void test_0x0009() {
		Environment env = Prelude.environment(POINT);
		checkUnsupported(env, "point", "missing", Ornaments.UNRELATED_TYPES);
	}

	// ==============================================================
	// Promote / Forget
	// ==============================================================

	@Test
	public void test_0x0010() {
		Fixture f = new Fixture("point", "point_pairs", POINT);
		f.checkConvertible("pair nat bool 1 true", f.term("point_curry (mkpoint 1 true)"));
	}

	@Test
	public void test_0x0011() {
		Fixture f = new Fixture("point", "point_pairs", POINT);
		f.checkConvertible("mkpoint 1 true", f.term("point_curry_inv (pair nat bool 1 true)"));
	}

	@Test
	public void test_0x0012() {
		Fixture f = new Fixture("triple", "triple_pairs", TRIPLE);
		f.checkConvertible("pair nat (Prod nat bool) 5 (pair nat bool 1 true)",
				f.term("triple_curry nat (mktriple nat 5 1 true)"));
		f.checkConvertible("mktriple nat 5 1 true",
				f.term("triple_curry_inv nat (pair nat (Prod nat bool) 5 (pair nat bool 1 true))"));
	}

	// ==============================================================
	// Lifting Forward
	// ==============================================================

	@Test
	public void test_0x0020() {
		Fixture f = new Fixture("point", "point_pairs", POINT);
		TermTests.check(f.term("Prod nat bool"), f.lift(Direction.FORWARD, "point"));
		TermTests.check(f.term("pair nat bool 1 true"), f.lift(Direction.FORWARD, "mkpoint 1 true"));
	}

	@Test
	public void test_0x0021() {
		Fixture f = new Fixture("point", "point_pairs", POINT);
		TermTests.check(f.term("fun (r : Prod nat bool) => r.2"), f.lift(Direction.FORWARD, "fun (r : point) => r.2"));
	}

	@Test
	public void test_0x0022() {
		Fixture f = new Fixture("triple", "triple_pairs", TRIPLE);
		TermTests.check(f.term("pair nat (Prod nat bool) 5 (pair nat bool 1 true)"),
				f.lift(Direction.FORWARD, "mktriple nat 5 1 true"));
		TermTests.check(f.term("fun (r : Prod nat (Prod nat bool)) => r.2.2"),
				f.lift(Direction.FORWARD, "fun (r : triple nat) => r.3"));
	}

	@Test
	public void test_0x0023() {
		Fixture f = new Fixture("point", "point_pairs", POINT, PX);
		f.ornaments.liftDefinition(f.configuration(Direction.FORWARD), "px", "px_pairs");
		TermTests.check(f.term("forall (r : Prod nat bool), nat"), f.environment.definition("px_pairs").type());
		f.checkConvertible("4", f.term("px_pairs (pair nat bool 4 false)"));
	}

	@Test
	public void test_0x0024() {
		Fixture f = new Fixture("point", "point_pairs", POINT);
		TermTests.check(f.term("pair nat bool 1 true"), f.lift(Direction.FORWARD, "point_curry (mkpoint 1 true)"));
	}

	// ==============================================================
	// Lifting Backward
	// ==============================================================

	@Test
	public void test_0x0030() {
		Fixture f = new Fixture("point", "point_pairs", POINT);
		TermTests.check(f.term("point"), f.lift(Direction.BACKWARD, "Prod nat bool"));
		TermTests.check(f.term("mkpoint 1 true"), f.lift(Direction.BACKWARD, "pair nat bool 1 true"));
	}

	@Test
	public void test_0x0031() {
		Fixture f = new Fixture("point", "point_pairs", POINT);
		TermTests.check(f.term("fun (p : point) => p.1"), f.lift(Direction.BACKWARD, "fun (p : Prod nat bool) => p.1"));
		TermTests.check(f.term("fun (p : point) => p.2"), f.lift(Direction.BACKWARD, "fun (p : Prod nat bool) => p.2"));
	}

	@Test
	public void test_0x0032() {
		Fixture f = new Fixture("triple", "triple_pairs", TRIPLE);
		TermTests.check(f.term("mktriple nat 5 1 true"),
				f.lift(Direction.BACKWARD, "pair nat (Prod nat bool) 5 (pair nat bool 1 true)"));
		TermTests.check(f.term("fun (p : triple nat) => p.2"),
				f.lift(Direction.BACKWARD, "fun (p : Prod nat (Prod nat bool)) => p.2.1"));
	}

	@Test
	public void test_0x0033() {
		// A partial chain of projections regroups the remaining fields
		Fixture f = new Fixture("triple", "triple_pairs", TRIPLE);
		TermTests.check(f.term("fun (p : triple nat) => pair nat bool p.2 p.3"),
				f.lift(Direction.BACKWARD, "fun (p : Prod nat (Prod nat bool)) => p.2"));
	}

	@Test
	public void test_0x0034() {
		// Lifting there and back again
		Fixture f = new Fixture("point", "point_pairs", POINT, PX);
		f.ornaments.liftDefinition(f.configuration(Direction.FORWARD), "px", "px_pairs");
		f.ornaments.liftDefinition(f.configuration(Direction.BACKWARD), "px_pairs", "px_point");
		TermTests.check(f.environment.definition("px").type(), f.environment.definition("px_point").type());
		f.checkConvertible("4", f.term("px_point (mkpoint 4 false)"));
	}

	@Test
	public void test_0x0035() {
		Fixture f = new Fixture("point", "point_pairs", POINT);
		TermTests.check(f.term("mkpoint 1 true"),
				f.lift(Direction.BACKWARD, "point_curry_inv (pair nat bool 1 true)"));
	}

	// ==============================================================
	// Name Clashes
	// ==============================================================

	@Test
	public void test_0x0040() {
		Environment env = Prelude.environment(POINT, "Definition point_curry_inv := O.");
		Ornaments ornaments = new Ornaments(env);
		try {
			ornaments.findOrnament("point", "point_pairs");
			fail("expected name clash");
		} catch (IllegalArgumentException e) {
			assertTrue(e.getMessage().startsWith(Ornaments.NAME_ALREADY_DECLARED));
		}
		assertTrue(env.definition("point_curry") == null);
		assertTrue(ornaments.lookupOrnament("point", "point_pairs") == null);
	}

	public static void checkUnsupported(Environment env, String before, String after, String msg) {
		try {
			new Ornaments(env).findOrnament(before, after);
			fail("expected unsupported shape");
		} catch (OrnamentError.UnsupportedShape e) {
			assertTrue(e.getMessage().startsWith(msg));
		}
	}

	public static void checkUnsupported(Environment env, String record, String msg) {
		try {
			new Ornaments(env).synthesizePromoteForget(env.getDeclaration(record));
			fail("expected unsupported shape");
		} catch (OrnamentError.UnsupportedShape e) {
			assertTrue(e.getMessage().startsWith(msg));
		}
	}

	/**
	 * The standard declarations extended with a record, along with its
	 * correspondence to nested pairs.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Fixture {
		public final Environment environment;
		public final Ornaments ornaments;
		public final CorrespondenceDescriptor correspondence;

		public Fixture(String record, String pairs, String... sentences) {
			this.environment = Prelude.environment(sentences);
			this.ornaments = new Ornaments(environment);
			this.correspondence = ornaments.findOrnament(record, pairs);
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

		public void checkConvertible(String expected, Term actual) {
			Reduction reduction = new Reduction(environment);
			Term e = term(expected);
			if (!reduction.convertible(e, actual)) {
				throw new AssertionError("expected " + Syntax.toString(reduction.normalise(e)) + ", got "
						+ Syntax.toString(reduction.normalise(actual)));
			}
		}
	}
}
