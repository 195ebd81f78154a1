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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import featherweightornaments.core.Context;
import featherweightornaments.core.Packing;
import featherweightornaments.core.Syntax.Term;
import featherweightornaments.core.TypeDeclaration;
import featherweightornaments.core.TypeInference;
import featherweightornaments.lifting.DeclarationLifter;
import featherweightornaments.lifting.LiftingConfiguration;
import featherweightornaments.lifting.LiftingConfiguration.Direction;
import featherweightornaments.util.OrnamentError;

/**
 * Test cases for lifting inductive declarations which mention the type being
 * ornamented, such that terms lifted afterwards refer to the lifted
 * declaration.
 *
 * @author David J. Pearce
 *
 */
public class DeclarationLiftingTests {
	private static final String TAGGED = "Inductive tagged : Type := | tag : nat -> list nat -> tagged.";
	private static final String TLIST = "Inductive tlist (T : Type) : list T -> Type := | tnil : tlist T (nil T).";
	private static final String BAD = "Inductive bad : nat -> Type :=\n"
			+ "  | mkbad : forall (l : list nat), bad (case list (fun (x : list nat) => nat) l { O | fun (h : nat) (t : list nat) => h }).";
	private static final String SIGMA = "Sigma nat (fun (n : nat) => vector nat n)";
	private static final String VNIL = "(pack nat (fun (n : nat) => vector nat n) 0 (vnil nat))";

	@Test
	public void test_0x0001() {
		LiftingTests.Fixture f = new LiftingTests.Fixture(TAGGED);
		TypeDeclaration d = f.ornaments.liftDeclaration(f.configuration(Direction.FORWARD), "tagged", "vect");
		assertEquals("tagged_vect", d.name());
		assertEquals(1, d.constructors().length);
		assertEquals("tag_vect", d.constructor(0).name());
		assertSame(d, f.environment.declaration("tagged_vect"));
	}

	@Test
	public void test_0x0002() {
		LiftingTests.Fixture f = new LiftingTests.Fixture(TAGGED);
		TypeDeclaration d = f.ornaments.liftDeclaration(f.configuration(Direction.FORWARD), "tagged", "vect");
		TermTests.check(f.term("nat"), d.constructor(0).arguments()[0].type());
		TermTests.check(f.term(SIGMA), d.constructor(0).arguments()[1].type());
	}

	@Test
	public void test_0x0003() {
		// Later lifts use the lifted declaration
		LiftingTests.Fixture f = new LiftingTests.Fixture(TAGGED);
		f.ornaments.liftDeclaration(f.configuration(Direction.FORWARD), "tagged", "vect");
		TermTests.check(f.term("tag_vect 1 " + VNIL), f.lift(Direction.FORWARD, "tag 1 (nil nat)"));
		TermTests.check(f.term("fun (t : tagged_vect) => t"), f.lift(Direction.FORWARD, "fun (t : tagged) => t"));
	}

	@Test
	public void test_0x0004() {
		LiftingTests.Fixture f = new LiftingTests.Fixture(TAGGED);
		f.ornaments.liftDeclaration(f.configuration(Direction.FORWARD), "tagged", "vect");
		TermTests.check(f.term("tag 1 (nil nat)"), f.lift(Direction.BACKWARD, "tag_vect 1 " + VNIL));
	}

	@Test
	public void test_0x0005() {
		LiftingTests.Fixture f = new LiftingTests.Fixture(TAGGED);
		f.ornaments.liftDeclaration(f.configuration(Direction.FORWARD), "tagged", "vect");
		TypeInference typing = new TypeInference(f.environment);
		TermTests.check(f.term("tagged_vect"),
				typing.infer(Context.EMPTY, f.lift(Direction.FORWARD, "tag 1 (nil nat)")));
	}

	@Test
	public void test_0x0006() {
		// Indices mentioning the ornamented type are lifted too
		LiftingTests.Fixture f = new LiftingTests.Fixture(TLIST);
		TypeDeclaration d = f.ornaments.liftDeclaration(f.configuration(Direction.FORWARD), "tlist", "vect");
		assertEquals("tlist_vect", d.name());
		assertEquals(1, d.parameters().length);
		assertTrue(Packing.isSigma(d.indices()[0].type()));
		assertTrue(Packing.isPack(d.constructor(0).indices()[0]));
		assertEquals("tnil_vect", d.constructor(0).name());
	}

	// ==============================================================
	// Failures
	// ==============================================================

	@Test
	public void test_0x0010() {
		// A failed lift leaves no renaming behind
		LiftingTests.Fixture f = new LiftingTests.Fixture(BAD);
		try {
			f.ornaments.liftDeclaration(f.configuration(Direction.FORWARD), "bad", "vect");
			fail("expected unliftable declaration");
		} catch (OrnamentError.UnliftableNode e) {
			// expected
		}
		assertNull(f.environment.declaration("bad_vect"));
		Term t = f.term("fun (b : bad 0) => b");
		TermTests.check(t, f.lift(Direction.FORWARD, "fun (b : bad 0) => b"));
	}

	@Test
	public void test_0x0011() {
		// The same configuration is usable afterwards
		LiftingTests.Fixture f = new LiftingTests.Fixture(BAD);
		LiftingConfiguration c = f.configuration(Direction.FORWARD);
		try {
			f.ornaments.liftDeclaration(c, "bad", "vect");
			fail("expected unliftable declaration");
		} catch (OrnamentError.UnliftableNode e) {
			// expected
		}
		Term t = f.term("bad 0");
		TermTests.check(t, f.ornaments.lift(c, t));
	}

	@Test
	public void test_0x0012() {
		LiftingTests.Fixture f = new LiftingTests.Fixture(TAGGED, "Inductive tagged_vect : Type := | other : tagged_vect.");
		try {
			f.ornaments.liftDeclaration(f.configuration(Direction.FORWARD), "tagged", "vect");
			fail("expected name clash");
		} catch (IllegalArgumentException e) {
			assertTrue(e.getMessage().startsWith(DeclarationLifter.NAME_ALREADY_DECLARED));
		}
		assertNull(f.environment.declaration("tag_vect"));
		TermTests.check(f.term("tag 1 " + VNIL), f.lift(Direction.FORWARD, "tag 1 (nil nat)"));
	}

	@Test
	public void test_0x0013() {
		// A failed retry keeps the earlier renaming
		LiftingTests.Fixture f = new LiftingTests.Fixture(TAGGED);
		f.ornaments.liftDeclaration(f.configuration(Direction.FORWARD), "tagged", "vect");
		try {
			f.ornaments.liftDeclaration(f.configuration(Direction.FORWARD), "tagged", "vect");
			fail("expected name clash");
		} catch (IllegalArgumentException e) {
			// expected
		}
		TermTests.check(f.term("tag_vect 1 " + VNIL), f.lift(Direction.FORWARD, "tag 1 (nil nat)"));
	}

	// ==============================================================
	// Opaque
	// ==============================================================

	@Test
	public void test_0x0020() {
		LiftingTests.Fixture f = new LiftingTests.Fixture(TAGGED);
		LiftingConfiguration c = f.ornaments.initializeLiftingConfiguration(f.correspondence, Direction.FORWARD,
				"tagged");
		TypeDeclaration d = f.ornaments.liftDeclaration(c, "tagged", "vect");
		assertSame(f.environment.getDeclaration("tagged"), d);
		assertNull(f.environment.declaration("tagged_vect"));
		TermTests.check(f.term("tag 1 " + VNIL), f.lift(Direction.FORWARD, "tag 1 (nil nat)"));
	}
}
