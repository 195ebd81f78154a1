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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import featherweightornaments.core.Packing;
import featherweightornaments.core.Syntax.Binding;
import featherweightornaments.core.Syntax.Term;
import featherweightornaments.core.Telescope;
import featherweightornaments.core.Terms;
import featherweightornaments.core.TypeDeclaration;
import featherweightornaments.discovery.IndexDescriptor.CaseAlignment;
import featherweightornaments.util.OrnamentError;

/**
 * Synthesizes the pair of functions witnessing a correspondence. The
 * <em>promote</em> function maps values of the original type into the new
 * representation, whilst <em>forget</em> maps them back again.
 *
 * @author David J. Pearce
 *
 */
public abstract class PromoteForgetSynthesizer {
	protected static final Logger log = LoggerFactory.getLogger(PromoteForgetSynthesizer.class);

	/**
	 * Construct the promote function.
	 *
	 * @return
	 */
	public abstract Term promote();

	/**
	 * Construct the type of the promote function.
	 *
	 * @return
	 */
	public abstract Term promoteType();

	/**
	 * Construct the forget function.
	 *
	 * @return
	 */
	public abstract Term forget();

	/**
	 * Construct the type of the forget function.
	 *
	 * @return
	 */
	public abstract Term forgetType();

	/**
	 * Synthesizes promote and forget for a declaration <code>B</code> which
	 * inserts a new index into <code>A</code>:
	 *
	 * <pre>
	 * promote : forall ps is, A ps is -> Sigma I (fun i => B ps (insert i is))
	 * forget : forall ps is, Sigma I (fun i => B ps (insert i is)) -> A ps is
	 * </pre>
	 *
	 * Promote recurses over <code>A</code>, building each constructor of
	 * <code>B</code> from the promoted recursive arguments and packs the final
	 * result with its index. Forget unpacks its argument and recurses over
	 * <code>B</code>, dropping the index arguments.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Algebraic extends PromoteForgetSynthesizer {
		private final IndexDescriptor descriptor;
		private final StructuralRecursionPrinciple before;
		private final StructuralRecursionPrinciple after;
		/**
		 * A closed term referring to the indexer (typically a global).
		 */
		private final Term indexer;

		public Algebraic(IndexDescriptor descriptor, StructuralRecursionPrinciple before,
				StructuralRecursionPrinciple after, Term indexer) {
			this.descriptor = descriptor;
			this.before = before;
			this.after = after;
			this.indexer = indexer;
		}

		@Override
		public Term promote() {
			TypeDeclaration A = descriptor.before();
			TypeDeclaration B = descriptor.after();
			int np = A.parameters().length;
			int k = A.indices().length;
			// Target context is (params, indices, a)
			Term[] ps = Terms.variables(np, k + 1);
			Term[] is = Terms.variables(k, 1);
			Term[] mps = Terms.shift(ps, k + 1);
			Term[] mis = Terms.variables(k, 1);
			Term index = index(mps, mis, new Term.Variable(0));
			Term motive = Eliminators.motive(A, ps, B.apply(mps, Terms.insert(mis, descriptor.position(), index)));
			Term[] cases = new Term[A.constructors().length];
			for (int j = 0; j != cases.length; ++j) {
				cases[j] = promoteCase(j, ps, motive);
			}
			Term elim = new Term.Eliminate(A.name(), ps, motive, cases, is, new Term.Variable(0));
			Term body = descriptor.pack(ps, is, index(ps, is, new Term.Variable(0)), elim);
			Term promote = Telescope.lambdas(A.parameters(),
					Telescope.lambdas(A.indices(), new Term.Lambda("a", before(), body)));
			log.debug("synthesized promote for {}: {}", A.name(), promote);
			return promote;
		}

		@Override
		public Term promoteType() {
			TypeDeclaration A = descriptor.before();
			int np = A.parameters().length;
			int k = A.indices().length;
			Term packed = descriptor.packedType(Terms.variables(np, k + 1), Terms.variables(k, 1));
			return Telescope.products(A.parameters(),
					Telescope.products(A.indices(), new Term.Pi("a", before(), packed)));
		}

		/**
		 * Construct the case of promote for a given constructor. Each slot of
		 * <code>B</code> is filled from the slots of <code>A</code>: recursive
		 * arguments by their (promoted) inductive hypotheses and index
		 * arguments by the indexer applied to the recursive argument they
		 * index.
		 *
		 * @param j
		 * @param ps
		 * @param motive
		 * @return
		 */
		private Term promoteCase(int j, Term[] ps, Term motive) {
			TypeDeclaration A = descriptor.before();
			CaseAlignment alignment = descriptor.alignment(j);
			int nA = alignment.before().size();
			int nB = alignment.after().size();
			Telescope slots = Eliminators.slots(before, j, ps, motive, nA);
			Term[] values = new Term[nB];
			for (int s = 0; s != nB; ++s) {
				int r = alignment.afterPartner(s);
				switch (alignment.afterRole(s)) {
				case RECURSIVE:
					values[s] = new Term.Variable(nA - 1 - CaseAlignment.hypothesisOf(r));
					break;
				case INDEX: {
					Term type = Terms.shift(slots.get(r).type(), nA - r);
					Term[] rps = Terms.shift(ps, nA);
					values[s] = index(rps, Eliminators.indicesOf(A, type), new Term.Variable(nA - 1 - r));
					break;
				}
				default:
					values[s] = new Term.Variable(nA - 1 - r);
				}
			}
			Term[] conclusion = Terms.arguments(alignment.after().body());
			Term value = Eliminators.relocate(conclusion[conclusion.length - 1], values, motive, ps, nA);
			return Telescope.lambdas(slots.bindings(), value);
		}

		@Override
		public Term forget() {
			TypeDeclaration A = descriptor.before();
			TypeDeclaration B = descriptor.after();
			int np = A.parameters().length;
			int k = A.indices().length;
			int p = descriptor.position();
			// Target context is (params, indices, s)
			Term[] ps = Terms.variables(np, k + 1);
			Term[] is = Terms.variables(k, 1);
			Term motive = Eliminators.motive(B, ps,
					A.apply(Terms.shift(ps, k + 2), Terms.remove(Terms.variables(k + 1, 1), p)));
			Term[] cases = new Term[B.constructors().length];
			for (int j = 0; j != cases.length; ++j) {
				cases[j] = forgetCase(j, ps, motive);
			}
			Term s = new Term.Variable(0);
			Term elim = new Term.Eliminate(B.name(), ps, motive, cases,
					Terms.insert(is, p, Packing.projectIndex(s)), Packing.projectValue(s));
			Term packed = descriptor.packedType(Terms.variables(np, k), Terms.variables(k, 0));
			Term forget = Telescope.lambdas(A.parameters(),
					Telescope.lambdas(A.indices(), new Term.Lambda("s", packed, elim)));
			log.debug("synthesized forget for {}: {}", B.name(), forget);
			return forget;
		}

		@Override
		public Term forgetType() {
			TypeDeclaration A = descriptor.before();
			int np = A.parameters().length;
			int k = A.indices().length;
			Term packed = descriptor.packedType(Terms.variables(np, k), Terms.variables(k, 0));
			Term self = A.apply(Terms.variables(np, k + 1), Terms.variables(k, 1));
			return Telescope.products(A.parameters(),
					Telescope.products(A.indices(), new Term.Pi("s", packed, self)));
		}

		/**
		 * Construct the case of forget for a given constructor. This rebuilds
		 * the constructor of <code>A</code>, ignoring index arguments and using
		 * the (forgotten) inductive hypotheses for recursive arguments.
		 *
		 * @param j
		 * @param ps
		 * @param motive
		 * @return
		 */
		private Term forgetCase(int j, Term[] ps, Term motive) {
			CaseAlignment alignment = descriptor.alignment(j);
			int nA = alignment.before().size();
			int nB = alignment.after().size();
			Telescope slots = Eliminators.slots(after, j, ps, motive, nB);
			Term[] values = new Term[nA];
			for (int s = 0; s != nA; ++s) {
				int r = alignment.beforePartner(s);
				if (alignment.beforeRole(s) == CaseAlignment.Role.RECURSIVE) {
					r = CaseAlignment.hypothesisOf(r);
				}
				values[s] = new Term.Variable(nB - 1 - r);
			}
			Term[] conclusion = Terms.arguments(alignment.before().body());
			Term value = Eliminators.relocate(conclusion[conclusion.length - 1], values, motive, ps, nB);
			return Telescope.lambdas(slots.bindings(), value);
		}

		/**
		 * Apply the indexer to given parameters, indices and value.
		 *
		 * @param ps
		 * @param is
		 * @param value
		 * @return
		 */
		private Term index(Term[] ps, Term[] is, Term value) {
			return Terms.apply(indexer, Terms.append(Terms.append(ps, is), value));
		}

		/**
		 * The type <code>A ps is</code> in the context of the parameters and
		 * indices.
		 *
		 * @return
		 */
		private Term before() {
			TypeDeclaration A = descriptor.before();
			int k = A.indices().length;
			return A.apply(Terms.variables(A.parameters().length, k), Terms.variables(k, 0));
		}
	}

	/**
	 * Synthesizes promote and forget for a record whose fields are regrouped
	 * into right-nested pairs. For example, given
	 * <code>Inductive R (T : Type) := mk : T -> nat -> bool -> R T</code>, this
	 * gives:
	 *
	 * <pre>
	 * promote = fun T (r : R T) => pair r.1 (pair r.2 r.3)
	 * forget = fun T (p : Prod T (Prod nat bool)) => mk T p.1 p.2.1 p.2.2
	 * </pre>
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class CurryRecord extends PromoteForgetSynthesizer {
		// Error messages
		public final static String NOT_RECORD = "expected record with exactly one constructor and no indices";
		public final static String TOO_FEW_FIELDS = "expected record with at least two fields";
		public final static String DEPENDENT_FIELD = "record fields must not depend on one another";
		public final static String RECURSIVE_FIELD = "record fields must not be recursive";

		private final TypeDeclaration record;
		/**
		 * The field types, in the context of the parameters.
		 */
		private final Term[] fields;

		public CurryRecord(TypeDeclaration record) {
			this.record = record;
			this.fields = fieldTypes(record);
		}

		public TypeDeclaration record() {
			return record;
		}

		/**
		 * Get the field types, in the context of the parameters.
		 *
		 * @return
		 */
		public Term[] fields() {
			return fields;
		}

		@Override
		public Term promote() {
			int np = record.parameters().length;
			// Target context is (params, r)
			Term[] types = Terms.instantiate(fields, Terms.variables(np, 1));
			Term[] values = new Term[fields.length];
			for (int i = 0; i != values.length; ++i) {
				values[i] = new Term.Project(i, new Term.Variable(0));
			}
			Term self = record.apply(Terms.variables(np, 0), new Term[0]);
			Term promote = Telescope.lambdas(record.parameters(),
					new Term.Lambda("r", self, Packing.nest(types, values)));
			log.debug("synthesized promote for {}: {}", record.name(), promote);
			return promote;
		}

		@Override
		public Term promoteType() {
			int np = record.parameters().length;
			Term self = record.apply(Terms.variables(np, 0), new Term[0]);
			Term nested = Packing.nest(Terms.instantiate(fields, Terms.variables(np, 1)));
			return Telescope.products(record.parameters(), new Term.Pi("r", self, nested));
		}

		@Override
		public Term forget() {
			int np = record.parameters().length;
			Term nested = Packing.nest(Terms.instantiate(fields, Terms.variables(np, 0)));
			Term[] values = Packing.unnest(new Term.Variable(0), fields.length);
			Term body = record.construct(0, Terms.variables(np, 1), values);
			Term forget = Telescope.lambdas(record.parameters(), new Term.Lambda("p", nested, body));
			log.debug("synthesized forget for {}: {}", record.name(), forget);
			return forget;
		}

		@Override
		public Term forgetType() {
			int np = record.parameters().length;
			Term nested = Packing.nest(Terms.instantiate(fields, Terms.variables(np, 0)));
			Term self = record.apply(Terms.variables(np, 1), new Term[0]);
			return Telescope.products(record.parameters(), new Term.Pi("p", nested, self));
		}

		/**
		 * Determine the field types of a record, moving each into the context
		 * of the parameters. This fails if the declaration is not a record,
		 * or if any field depends on an earlier one.
		 *
		 * @param record
		 * @return
		 */
		private static Term[] fieldTypes(TypeDeclaration record) {
			if (!record.isRecord() || record.blockSize() != 1
					|| record.finiteness() != TypeDeclaration.Finiteness.INDUCTIVE) {
				throw new OrnamentError.UnsupportedShape(NOT_RECORD, record.name());
			}
			Binding[] args = record.constructor(0).arguments();
			if (args.length < 2) {
				throw new OrnamentError.UnsupportedShape(TOO_FEW_FIELDS, record.name());
			}
			Term[] r = new Term[args.length];
			for (int i = 0; i != args.length; ++i) {
				Term type = args[i].type();
				for (int j = 0; j != i; ++j) {
					if (Terms.occurs(type, j)) {
						throw new OrnamentError.UnsupportedShape(DEPENDENT_FIELD, args[i]);
					}
				}
				if (Terms.mentions(type, record.name())) {
					throw new OrnamentError.UnsupportedShape(RECURSIVE_FIELD, args[i]);
				}
				r[i] = Terms.shift(type, -i);
			}
			return r;
		}
	}
}
