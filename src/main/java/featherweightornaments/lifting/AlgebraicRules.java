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
package featherweightornaments.lifting;

import java.util.Arrays;

import featherweightornaments.core.Context;
import featherweightornaments.core.Packing;
import featherweightornaments.core.Syntax.Term;
import featherweightornaments.core.Telescope;
import featherweightornaments.core.Terms;
import featherweightornaments.core.TypeDeclaration;
import featherweightornaments.discovery.Eliminators;
import featherweightornaments.discovery.IndexDescriptor;
import featherweightornaments.discovery.IndexDescriptor.CaseAlignment;
import featherweightornaments.discovery.StructuralRecursionPrinciple;
import featherweightornaments.discovery.TypeIntrospection;

/**
 * Lifting rules for a correspondence where <code>B</code> inserts a new index
 * into <code>A</code>. Lifting forward, every <code>A ps is</code> becomes the
 * packed type <code>Sigma I (fun i => B ps (insert i is))</code>. Lifting
 * backward, both the packed type and <code>B</code> itself become
 * <code>A</code>.
 *
 * @author David J. Pearce
 *
 */
public class AlgebraicRules extends LiftingRules {
	private final IndexDescriptor descriptor;
	private final TypeDeclaration A;
	private final TypeDeclaration B;
	private final StructuralRecursionPrinciple before;
	private final StructuralRecursionPrinciple after;
	private final int np;
	private final int kA;
	private final int position;
	/**
	 * Templates used for rewriting references to globals.
	 */
	private final Term equivalence;
	private final Term coherence;
	private final Term internalize;

	public AlgebraicRules(LiftingConfiguration configuration) {
		super(configuration);
		this.descriptor = correspondence.index();
		this.A = descriptor.before();
		this.B = descriptor.after();
		this.before = TypeIntrospection.principle(A);
		this.after = TypeIntrospection.principle(B);
		this.np = A.parameters().length;
		this.kA = A.indices().length;
		this.position = descriptor.position();
		Term[] ps = Terms.variables(np, kA);
		Term[] is = Terms.variables(kA, 0);
		Term packed = descriptor.packedType(ps, is);
		Term self = A.apply(ps, is);
		if (configuration.isForward()) {
			this.equivalence = closeOverA(packed);
			this.coherence = closeOverA(new Term.Lambda("a", packed, Packing.projectIndex(new Term.Variable(0))));
			this.internalize = closeOverA(new Term.Lambda("a", packed, new Term.Variable(0)));
		} else {
			Term[] isB = Terms.variables(kA + 1, 0);
			Term body = A.apply(Terms.variables(np, kA + 1), Terms.remove(isB, position));
			this.equivalence = Telescope.lambdas(B.parameters(), Telescope.lambdas(B.indices(), body));
			this.coherence = null;
			this.internalize = closeOverA(new Term.Lambda("a", self, new Term.Variable(0)));
		}
	}

	@Override
	public LiftRule classify(Context context, Term term) {
		if (configuration.isForward()) {
			return classifyForward(term);
		} else {
			return classifyBackward(context, term);
		}
	}

	private LiftRule classifyForward(Term term) {
		if (isConstructorOf(A, term)) {
			return LiftRule.CONSTRUCTOR;
		} else if (term instanceof Term.Eliminate && ((Term.Eliminate) term).type().equals(A.name())) {
			return LiftRule.ELIMINATOR;
		} else if (applies(term, A.name())) {
			return LiftRule.template(LiftRule.Kind.EQUIVALENCE, equivalence);
		} else if (applies(term, correspondence.indexer())) {
			return LiftRule.template(LiftRule.Kind.COHERENCE, coherence);
		}
		return internalize(term, internalize);
	}

	private LiftRule classifyBackward(Context context, Term term) {
		if (isConstructorOf(B, term)) {
			return LiftRule.CONSTRUCTOR;
		} else if (term instanceof Term.Eliminate && ((Term.Eliminate) term).type().equals(B.name())) {
			return LiftRule.ELIMINATOR;
		} else if (applies(term, B.name())) {
			return LiftRule.template(LiftRule.Kind.EQUIVALENCE, equivalence);
		} else if (Packing.isSigma(term) && unpackFamily(Packing.family(term)) != null) {
			return LiftRule.EQUIVALENCE;
		} else if (term instanceof Term.Project) {
			Term.Project p = (Term.Project) term;
			if (p.field() <= 1 && isPacked(configuration.typeOf(context, p.target()))) {
				return p.field() == 0 ? LiftRule.COHERENCE : LiftRule.UNPACK;
			}
		} else if (Packing.isPack(term) && unpackFamily(((Term.Construct) term).arguments()[1]) != null) {
			return LiftRule.UNPACK;
		} else if (Packing.isRepack(term) && isPacked(((Term.Let) term).type())) {
			return LiftRule.UNPACK;
		}
		return internalize(term, internalize);
	}

	@Override
	public boolean isBeforeType(Term type) {
		if (configuration.isForward()) {
			return A.isApplication(type);
		} else {
			return B.isApplication(type) || isPacked(type);
		}
	}

	@Override
	public Term apply(LiftRule rule, Context context, Term term, TermLifter lifter) {
		boolean forward = configuration.isForward();
		switch (rule.kind()) {
		case CONSTRUCTOR:
			return forward ? promoteConstructor(context, (Term.Construct) term, lifter)
					: forgetConstructor(context, (Term.Construct) term, lifter);
		case ELIMINATOR:
			return forward ? promoteEliminator(context, (Term.Eliminate) term, lifter)
					: forgetEliminator(context, (Term.Eliminate) term, lifter);
		case EQUIVALENCE: {
			// Sigma I (fun i => B ps (insert i is)) ~> A ps is
			Term[][] args = unpackFamily(Packing.family(term));
			return A.apply(lifter.lift(context, args[0]), lifter.lift(context, args[1]));
		}
		case COHERENCE: {
			// s.1 ~> indexer ps is s
			Term target = ((Term.Project) term).target();
			Term[][] args = unpackFamily(Packing.family(configuration.typeOf(context, target)));
			return index(lifter.lift(context, args[0]), lifter.lift(context, args[1]), lifter.lift(context, target));
		}
		case UNPACK:
			return lifter.lift(context, unpack(term));
		default:
			throw new IllegalArgumentException("Invalid rule encountered: " + rule);
		}
	}

	// ========================================================================
	// Constructors
	// ========================================================================

	/**
	 * Lift a constructor of <code>A</code> to the corresponding constructor of
	 * <code>B</code>, packed with its index. Recursive arguments (which are
	 * lifted to packed values) are unpacked, and index arguments are taken
	 * from the recursive argument they index.
	 *
	 * @param context
	 * @param term
	 * @param lifter
	 * @return
	 */
	private Term promoteConstructor(Context context, Term.Construct term, TermLifter lifter) {
		int j = term.index();
		Term[] args = lifter.lift(context, term.arguments());
		Term[] ps = Arrays.copyOfRange(args, 0, np);
		Term[] as = Arrays.copyOfRange(args, np, args.length);
		CaseAlignment alignment = descriptor.alignment(j);
		int[] sources = alignment.afterArgumentSources();
		CaseAlignment.Role[] roles = alignment.afterArgumentRoles();
		Term[] bs = new Term[sources.length];
		for (int q = 0; q != bs.length; ++q) {
			Term a = as[sources[q]];
			switch (roles[q]) {
			case INDEX:
				bs[q] = Packing.projectIndex(a);
				break;
			case RECURSIVE:
				bs[q] = Packing.projectValue(a);
				break;
			default:
				bs[q] = a;
			}
		}
		Term[] indices = Terms.instantiate(B.constructor(j).indices(), Terms.append(ps, bs));
		Term value = B.construct(j, ps, bs);
		return descriptor.pack(ps, Terms.remove(indices, position), indices[position], value);
	}

	/**
	 * Lift a constructor of <code>B</code> back to the corresponding
	 * constructor of <code>A</code>, dropping index arguments.
	 *
	 * @param context
	 * @param term
	 * @param lifter
	 * @return
	 */
	private Term forgetConstructor(Context context, Term.Construct term, TermLifter lifter) {
		Term[] args = lifter.lift(context, term.arguments());
		Term[] ps = Arrays.copyOfRange(args, 0, np);
		int[] targets = descriptor.alignment(term.index()).beforeArgumentTargets();
		Term[] as = new Term[targets.length];
		for (int k = 0; k != as.length; ++k) {
			as[k] = args[np + targets[k]];
		}
		return A.construct(term.index(), ps, as);
	}

	// ========================================================================
	// Eliminators
	// ========================================================================

	/**
	 * Lift an eliminator of <code>A</code> to one of <code>B</code>. The
	 * lifted motive receives the index and value of <code>B</code> and packs
	 * them, whilst each lifted case receives the slots of <code>B</code> and
	 * passes on those of <code>A</code>, packing recursive arguments with their
	 * indices. The scrutinee is unpacked into its index and value.
	 *
	 * @param context
	 * @param term
	 * @param lifter
	 * @return
	 */
	private Term promoteEliminator(Context context, Term.Eliminate term, TermLifter lifter) {
		Term[] ps = lifter.lift(context, term.parameters());
		Term motive = lifter.lift(context, term.motive());
		Term[] cases = lifter.lift(context, term.cases());
		Term[] is = lifter.lift(context, term.indices());
		Term scrutinee = lifter.lift(context, term.scrutinee());
		int kB = kA + 1;
		// Construct the motive
		Term[] mps = Terms.shift(ps, kB + 1);
		Term[] mis = Terms.variables(kB, 1);
		Term[] ais = Terms.remove(mis, position);
		Term packed = descriptor.pack(mps, ais, mis[position], new Term.Variable(0));
		Term body = Terms.beta(Terms.apply(Terms.shift(motive, kB + 1), Terms.append(ais, packed)));
		Term lifted = Eliminators.motive(B, ps, body);
		// Construct the cases
		Term[] lcases = new Term[cases.length];
		for (int j = 0; j != cases.length; ++j) {
			CaseAlignment alignment = descriptor.alignment(j);
			int nA = alignment.before().size();
			int nB = alignment.after().size();
			Telescope slots = Eliminators.slots(after, j, ps, lifted, nB);
			Term[] values = new Term[nA];
			for (int s = 0; s != nA; ++s) {
				int q = alignment.beforePartner(s);
				Term v = new Term.Variable(nB - 1 - q);
				if (alignment.beforeRole(s) == CaseAlignment.Role.RECURSIVE) {
					Term type = Terms.shift(slots.get(q).type(), nB - q);
					Term[] rps = Eliminators.parametersOf(B, type);
					Term[] ris = Eliminators.indicesOf(B, type);
					v = descriptor.pack(rps, Terms.remove(ris, position), ris[position], v);
				}
				values[s] = v;
			}
			Term result = Terms.beta(Terms.apply(Terms.shift(cases[j], nB), values));
			lcases[j] = Telescope.lambdas(slots.bindings(), result);
		}
		return new Term.Eliminate(B.name(), ps, lifted, lcases,
				Terms.insert(is, position, Packing.projectIndex(scrutinee)), Packing.projectValue(scrutinee));
	}

	/**
	 * Lift an eliminator of <code>B</code> back to one of <code>A</code>. The
	 * lifted motive computes the dropped index using the indexer, as does each
	 * lifted case for the index arguments.
	 *
	 * @param context
	 * @param term
	 * @param lifter
	 * @return
	 */
	private Term forgetEliminator(Context context, Term.Eliminate term, TermLifter lifter) {
		Term[] ps = lifter.lift(context, term.parameters());
		Term motive = lifter.lift(context, term.motive());
		Term[] cases = lifter.lift(context, term.cases());
		Term[] is = lifter.lift(context, term.indices());
		Term scrutinee = lifter.lift(context, term.scrutinee());
		// Construct the motive
		Term[] mps = Terms.shift(ps, kA + 1);
		Term[] mis = Terms.variables(kA, 1);
		Term x = new Term.Variable(0);
		Term[] args = Terms.append(Terms.insert(mis, position, index(mps, mis, x)), x);
		Term lifted = Eliminators.motive(A, ps, Terms.beta(Terms.apply(Terms.shift(motive, kA + 1), args)));
		// Construct the cases
		Term[] lcases = new Term[cases.length];
		for (int j = 0; j != cases.length; ++j) {
			CaseAlignment alignment = descriptor.alignment(j);
			int nA = alignment.before().size();
			int nB = alignment.after().size();
			Telescope slots = Eliminators.slots(before, j, ps, lifted, nA);
			Term[] values = new Term[nB];
			for (int q = 0; q != nB; ++q) {
				int r = alignment.afterPartner(q);
				Term v = new Term.Variable(nA - 1 - r);
				if (alignment.afterRole(q) == CaseAlignment.Role.INDEX) {
					Term type = Terms.shift(slots.get(r).type(), nA - r);
					v = index(Terms.shift(ps, nA), Eliminators.indicesOf(A, type), v);
				}
				values[q] = v;
			}
			Term result = Terms.beta(Terms.apply(Terms.shift(cases[j], nA), values));
			lcases[j] = Telescope.lambdas(slots.bindings(), result);
		}
		return new Term.Eliminate(A.name(), ps, lifted, lcases, Terms.remove(is, position), scrutinee);
	}

	// ========================================================================
	// Helpers
	// ========================================================================

	private Term unpack(Term term) {
		if (term instanceof Term.Project) {
			// s.2 ~> s
			return ((Term.Project) term).target();
		} else if (term instanceof Term.Let) {
			// let s := e in pack s.1 s.2 ~> e
			return ((Term.Let) term).value();
		} else {
			// pack I F i b ~> b
			return ((Term.Construct) term).arguments()[3];
		}
	}

	private Term index(Term[] ps, Term[] is, Term value) {
		return Terms.apply(correspondence.indexer(), Terms.append(Terms.append(ps, is), value));
	}

	private boolean isConstructorOf(TypeDeclaration declaration, Term term) {
		if (term instanceof Term.Construct) {
			Term.Construct c = (Term.Construct) term;
			return c.type().equals(declaration.name()) && c.arguments().length == declaration.parameters().length
					+ declaration.constructor(c.index()).arguments().length;
		}
		return false;
	}

	private boolean isPacked(Term type) {
		return Packing.isSigma(type) && unpackFamily(Packing.family(type)) != null;
	}

	/**
	 * Recover the parameters and indices of <code>A</code> from a type family
	 * <code>fun i => B ps (insert i is)</code>, or return <code>null</code> if
	 * the family does not have this form.
	 *
	 * @param family
	 * @return
	 */
	private Term[][] unpackFamily(Term family) {
		if (family instanceof Term.Lambda) {
			Term body = ((Term.Lambda) family).body();
			Term[] args = Terms.arguments(body);
			if (B.isApplication(body) && args.length == np + kA + 1) {
				Term[] ps = Arrays.copyOfRange(args, 0, np);
				Term[] is = Terms.remove(Arrays.copyOfRange(args, np, args.length), position);
				if (!occurs(ps) && !occurs(is)) {
					return new Term[][] { Terms.shift(ps, -1), Terms.shift(is, -1) };
				}
			}
		}
		return null;
	}

	private static boolean occurs(Term[] terms) {
		for (Term t : terms) {
			if (Terms.occurs(t, 0)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Close a term over the parameters and indices of <code>A</code>.
	 *
	 * @param body
	 * @return
	 */
	private Term closeOverA(Term body) {
		return Telescope.lambdas(A.parameters(), Telescope.lambdas(A.indices(), body));
	}
}
