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
package featherweightornaments.discovery;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import featherweightornaments.core.Environment;
import featherweightornaments.core.Reduction;
import featherweightornaments.core.Syntax.Binding;
import featherweightornaments.core.Syntax.Term;
import featherweightornaments.core.Telescope;
import featherweightornaments.core.Terms;
import featherweightornaments.core.TypeDeclaration;
import featherweightornaments.discovery.IndexDescriptor.CaseAlignment;
import featherweightornaments.discovery.IndexDescriptor.CaseAlignment.Role;
import featherweightornaments.util.OrnamentError;

/**
 * Compares the structural recursion principles of two declarations
 * <code>A</code> and <code>B</code>, where <code>B</code> is believed to insert
 * exactly one new index into <code>A</code>. This determines the position and
 * type of the new index, and aligns the arguments of corresponding
 * constructors.
 *
 * The new index is located by comparing the arguments of the motive in
 * corresponding cases: a position is new when some case of <code>A</code>
 * lacks the argument at that position, or has a different one. Having found
 * the position, the cases are walked in lock-step to identify which
 * hypotheses of <code>B</code> hold the index of a recursive argument.
 *
 * @author David J. Pearce
 *
 */
public class Differencing {
	private static final Logger log = LoggerFactory.getLogger(Differencing.class);

	// Error messages
	public final static String MUTUAL_DECLARATION = "mutually recursive declarations are not supported";
	public final static String COINDUCTIVE_DECLARATION = "coinductive declarations are not supported";
	public final static String PARAMETER_MISMATCH = "declarations have different numbers of parameters";
	public final static String CONSTRUCTOR_MISMATCH = "declarations have different numbers of constructors";
	public final static String INDEX_MISMATCH = "declaration must add exactly one index";
	public final static String NO_INDEX = "no new index found";
	public final static String AMBIGUOUS_INDEX = "more than one position qualifies as the new index";
	public final static String UNALIGNED_ARGUMENTS = "constructor arguments cannot be aligned";
	public final static String UNALIGNED_CONCLUSION = "constructor conclusions cannot be aligned";
	public final static String UNATTRIBUTED_INDEX = "new index is not held by an inductive hypothesis";

	private final Reduction reduction;
	private final DiscoveryPolicy policy;

	public Differencing(Environment environment) {
		this(environment, DiscoveryPolicy.FIRST_MATCH);
	}

	public Differencing(Environment environment, DiscoveryPolicy policy) {
		this.reduction = new Reduction(environment);
		this.policy = policy;
	}

	/**
	 * Determine the new index which <code>b</code> inserts into <code>a</code>.
	 *
	 * @param a The principle of the declaration before the index is inserted.
	 * @param b The principle of the declaration after the index is inserted.
	 * @return
	 */
	public IndexDescriptor findIndex(StructuralRecursionPrinciple a, StructuralRecursionPrinciple b) {
		TypeDeclaration A = a.declaration();
		TypeDeclaration B = b.declaration();
		checkShape(A, B);
		// Determine candidate positions
		List<Integer> confirmed = new ArrayList<>();
		for (int p : candidatePositions(A, B)) {
			if (isNewIndex(p, a, b)) {
				confirmed.add(p);
			}
		}
		log.debug("positions qualifying as new index of {} over {}: {}", B.name(), A.name(), confirmed);
		if (confirmed.isEmpty()) {
			throw new OrnamentError.IndexNotFound(NO_INDEX, B.name());
		} else if (confirmed.size() > 1 && policy == DiscoveryPolicy.STRICT) {
			throw new OrnamentError.AmbiguousIndex(AMBIGUOUS_INDEX, confirmed);
		}
		int position = confirmed.get(0);
		Term type = B.indices()[position].type();
		// Align each pair of cases
		CaseAlignment[] alignments = new CaseAlignment[A.constructors().length];
		for (int i = 0; i != alignments.length; ++i) {
			alignments[i] = align(position, A, B, a.caseType(i), b.caseType(i));
		}
		log.info("found new index of {} over {} at position {} of type {}", B.name(), A.name(), position, type);
		return new IndexDescriptor(A, B, position, type, alignments);
	}

	private static void checkShape(TypeDeclaration A, TypeDeclaration B) {
		for (TypeDeclaration d : new TypeDeclaration[] { A, B }) {
			if (d.blockSize() != 1) {
				throw new OrnamentError.UnsupportedShape(MUTUAL_DECLARATION, d.name());
			} else if (d.finiteness() != TypeDeclaration.Finiteness.INDUCTIVE) {
				throw new OrnamentError.UnsupportedShape(COINDUCTIVE_DECLARATION, d.name());
			}
		}
		if (A.parameters().length != B.parameters().length) {
			throw new OrnamentError.UnsupportedShape(PARAMETER_MISMATCH, A.name() + ", " + B.name());
		} else if (A.constructors().length != B.constructors().length) {
			throw new OrnamentError.UnsupportedShape(CONSTRUCTOR_MISMATCH, A.name() + ", " + B.name());
		} else if (A.indices().length + 1 != B.indices().length) {
			throw new OrnamentError.UnsupportedShape(INDEX_MISMATCH, A.name() + ", " + B.name());
		}
	}

	/**
	 * Determine the positions at which the new index could have been inserted.
	 * Since indices before the new one must be unchanged, these are the
	 * positions up to and including the first whose types differ.
	 *
	 * @param A
	 * @param B
	 * @return
	 */
	private List<Integer> candidatePositions(TypeDeclaration A, TypeDeclaration B) {
		Binding[] as = A.indices();
		Binding[] bs = B.indices();
		List<Integer> positions = new ArrayList<>();
		for (int p = 0; p <= as.length; ++p) {
			positions.add(p);
			if (p == as.length || !reduction.convertible(as[p].type(), bs[p].type())) {
				break;
			}
		}
		return positions;
	}

	/**
	 * Check whether position <code>p</code> distinguishes any case of
	 * <code>b</code> from the corresponding case of <code>a</code>.
	 *
	 * @param p
	 * @param a
	 * @param b
	 * @return
	 */
	private boolean isNewIndex(int p, StructuralRecursionPrinciple a, StructuralRecursionPrinciple b) {
		for (int i = 0; i != a.caseTypes().length; ++i) {
			if (isNewIndex(p, new Term.Variable(0), a.caseType(i), b.caseType(i))) {
				return true;
			}
		}
		return false;
	}

	private boolean isNewIndex(int p, Term motive, Term a, Term b) {
		if (a instanceof Term.Pi && b instanceof Term.Pi) {
			Term.Pi pa = (Term.Pi) a;
			Term.Pi pb = (Term.Pi) b;
			if (appliesMotive(pa.type(), motive) && !appliesMotive(pb.type(), motive)) {
				// skip the extra hypothesis of b
				return isNewIndex(p, Terms.shift(motive, 1), Terms.shift(a, 1), pb.body());
			}
			return isNewIndex(p, motive, pa.type(), pb.type())
					|| isNewIndex(p, Terms.shift(motive, 1), pa.body(), pb.body());
		} else if (appliesMotive(a, motive) && appliesMotive(b, motive)) {
			Term[] as = Terms.arguments(a);
			Term[] bs = Terms.arguments(b);
			// NOTE: the last argument is the value, not an index
			return p >= as.length - 1 || !as[p].equals(bs[p]);
		}
		return false;
	}

	// ========================================================================
	// Alignment
	// ========================================================================

	/**
	 * Walk the cases of <code>A</code> and <code>B</code> for one constructor in
	 * lock-step, determining the role of every slot. The remainder of the
	 * <code>A</code> case is shifted over every slot which only
	 * <code>B</code> has, so that both remainders always live in the same
	 * context.
	 *
	 * @param p
	 * @param A
	 * @param B
	 * @param caseA
	 * @param caseB
	 * @return
	 */
	private CaseAlignment align(int p, TypeDeclaration A, TypeDeclaration B, Term caseA, Term caseB) {
		Telescope ta = Telescope.ofProducts(caseA);
		Telescope tb = Telescope.ofProducts(caseB);
		Role[] rolesA = new Role[ta.size()];
		int[] partnersA = new int[ta.size()];
		Role[] rolesB = new Role[tb.size()];
		int[] partnersB = new int[tb.size()];
		Term a = caseA;
		Term b = caseB;
		Term motive = new Term.Variable(0);
		int ia = 0;
		int ib = 0;
		while (b instanceof Term.Pi) {
			Term.Pi pb = (Term.Pi) b;
			if (!(a instanceof Term.Pi) || isNewHypothesis(p, A, B, motive, (Term.Pi) a, pb)) {
				if (!(a instanceof Term.Pi) && !computesOnlyIndex(p, B, Terms.shift(motive, 1), pb.body())) {
					throw new OrnamentError.AlignmentFailure(UNALIGNED_ARGUMENTS, caseB);
				}
				rolesB[ib] = Role.INDEX;
				a = Terms.shift(a, 1);
			} else {
				Term.Pi pa = (Term.Pi) a;
				Role role = roleOf(A, B, motive, pa.type(), pb.type());
				rolesA[ia] = role;
				rolesB[ib] = role;
				partnersA[ia] = ib;
				partnersB[ib] = ia;
				a = pa.body();
				ia++;
			}
			b = pb.body();
			motive = Terms.shift(motive, 1);
			ib++;
		}
		if (a instanceof Term.Pi) {
			throw new OrnamentError.AlignmentFailure(UNALIGNED_ARGUMENTS, caseA);
		} else if (!appliesMotive(a, motive) || !appliesMotive(b, motive)) {
			throw new OrnamentError.AlignmentFailure(UNALIGNED_CONCLUSION, caseB);
		}
		attributeIndices(p, tb, rolesB, partnersB);
		return new CaseAlignment(ta, tb, rolesA, partnersA, rolesB, partnersB);
	}

	private Role roleOf(TypeDeclaration A, TypeDeclaration B, Term motive, Term ta, Term tb) {
		if (appliesMotive(ta, motive) && appliesMotive(tb, motive)) {
			return Role.HYPOTHESIS;
		} else if (A.isApplication(ta) && B.isApplication(tb)) {
			return Role.RECURSIVE;
		} else if (!A.isApplication(ta) && !B.isApplication(tb) && !appliesMotive(ta, motive)
				&& !appliesMotive(tb, motive)) {
			return Role.ARGUMENT;
		}
		throw new OrnamentError.AlignmentFailure(UNALIGNED_ARGUMENTS, ta + " and " + tb);
	}

	/**
	 * Determine whether a hypothesis of <code>B</code> has no counterpart in
	 * <code>A</code>. Two hypotheses which are the same modulo indexing can
	 * still differ when, for example, the new index has the same type as an
	 * existing argument. To catch this, when the number of remaining slots
	 * differs, the hypothesis is treated as new only if it computes nothing
	 * but an index.
	 *
	 * @param p
	 * @param A
	 * @param B
	 * @param motive
	 * @param a
	 * @param b
	 * @return
	 */
	private boolean isNewHypothesis(int p, TypeDeclaration A, TypeDeclaration B, Term motive, Term.Pi a,
			Term.Pi b) {
		if (!sameModuloIndexing(A, B, motive, a.type(), b.type())) {
			return true;
		} else if (arity(a.body()) == arity(b.body())) {
			return false;
		} else {
			return computesOnlyIndex(p, B, Terms.shift(motive, 1), b.body());
		}
	}

	private boolean sameModuloIndexing(TypeDeclaration A, TypeDeclaration B, Term motive, Term ta, Term tb) {
		return (appliesMotive(ta, motive) && appliesMotive(tb, motive))
				|| (A.isApplication(ta) && B.isApplication(tb)) || reduction.convertible(ta, tb);
	}

	/**
	 * Check whether the innermost variable (i.e. the hypothesis just bound) is
	 * used only to compute an index. That is, it appears exactly as the new
	 * index of some inductive hypothesis, and otherwise only within index
	 * positions (never as a parameter, or as a plain argument).
	 *
	 * @param p
	 * @param B
	 * @param motive
	 * @param rest   The remainder of the case, underneath the hypothesis.
	 * @return
	 */
	private static boolean computesOnlyIndex(int p, TypeDeclaration B, Term motive, Term rest) {
		int np = B.parameters().length;
		int v = 0;
		boolean pinned = false;
		while (rest instanceof Term.Pi) {
			Term.Pi pi = (Term.Pi) rest;
			Term h = pi.type();
			if (appliesMotive(h, motive)) {
				Term[] args = Terms.arguments(h);
				pinned |= p < args.length - 1 && args[p].equals(new Term.Variable(v));
				if (Terms.occurs(args[args.length - 1], v)) {
					return false;
				}
			} else if (B.isApplication(h)) {
				Term[] args = Terms.arguments(h);
				for (int i = 0; i < np && i < args.length; ++i) {
					if (Terms.occurs(args[i], v)) {
						return false;
					}
				}
			} else if (Terms.occurs(h, v)) {
				return false;
			}
			rest = pi.body();
			motive = Terms.shift(motive, 1);
			v++;
		}
		return pinned && appliesMotive(rest, motive);
	}

	/**
	 * Attribute every index slot to the recursive argument whose index it
	 * holds. This is found from the inductive hypothesis which mentions the
	 * index slot as its new index.
	 *
	 * @param p
	 * @param tb
	 * @param roles
	 * @param partners
	 */
	private static void attributeIndices(int p, Telescope tb, Role[] roles, int[] partners) {
		for (int s = 0; s != roles.length; ++s) {
			if (roles[s] != Role.INDEX) {
				continue;
			}
			partners[s] = -1;
			for (int h = s + 1; h < roles.length && partners[s] < 0; ++h) {
				if (roles[h] != Role.HYPOTHESIS) {
					continue;
				}
				Term[] args = Terms.arguments(tb.get(h).type());
				Term value = args[args.length - 1];
				if (args[p].equals(new Term.Variable(h - 1 - s)) && value instanceof Term.Variable) {
					int r = h - 1 - ((Term.Variable) value).index();
					if (r >= 0 && roles[r] == Role.RECURSIVE) {
						partners[s] = partners[r];
					}
				}
			}
			if (partners[s] < 0) {
				throw new OrnamentError.AlignmentFailure(UNATTRIBUTED_INDEX, tb.get(s));
			}
		}
	}

	private static boolean appliesMotive(Term term, Term motive) {
		return Terms.head(term).equals(motive);
	}

	private static int arity(Term term) {
		int n = 0;
		while (term instanceof Term.Pi) {
			term = ((Term.Pi) term).body();
			n++;
		}
		return n;
	}
}
