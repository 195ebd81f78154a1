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

import featherweightornaments.core.Syntax.Term;
import featherweightornaments.core.Telescope;
import featherweightornaments.core.Terms;
import featherweightornaments.core.TypeDeclaration;
import featherweightornaments.discovery.IndexDescriptor.CaseAlignment;

/**
 * Synthesizes the function which computes the new index from a value of the
 * original type. For lists and vectors, this gives:
 *
 * <pre>
 * fun (T : Type) (l : list T) =>
 *   elim list [T] (fun (x : list T) => nat) { O | fun x l IHl => S IHl } [] l
 * </pre>
 *
 * Each case returns the new index from the conclusion of the corresponding
 * constructor of <code>B</code>, where any index argument is replaced by the
 * inductive hypothesis of the recursive argument it indexes.
 *
 * @author David J. Pearce
 *
 */
public class IndexerSynthesizer {
	private static final Logger log = LoggerFactory.getLogger(IndexerSynthesizer.class);

	private final StructuralRecursionPrinciple principle;
	private final IndexDescriptor descriptor;

	public IndexerSynthesizer(StructuralRecursionPrinciple principle, IndexDescriptor descriptor) {
		this.principle = principle;
		this.descriptor = descriptor;
	}

	/**
	 * Construct the indexer.
	 *
	 * @return
	 */
	public Term synthesize() {
		TypeDeclaration A = descriptor.before();
		int np = A.parameters().length;
		int k = A.indices().length;
		// Target context is (params, indices, a)
		Term[] ps = Terms.variables(np, k + 1);
		Term[] is = Terms.variables(k, 1);
		Term motive = Eliminators.motive(A, ps,
				descriptor.indexType(Terms.shift(ps, k + 1), Terms.variables(k, 1)));
		Term[] cases = new Term[A.constructors().length];
		for (int j = 0; j != cases.length; ++j) {
			cases[j] = synthesizeCase(j, ps, motive);
		}
		Term elim = new Term.Eliminate(A.name(), ps, motive, cases, is, new Term.Variable(0));
		Term self = A.apply(Terms.variables(np, k), Terms.variables(k, 0));
		Term indexer = Telescope.lambdas(A.parameters(),
				Telescope.lambdas(A.indices(), new Term.Lambda("a", self, elim)));
		log.debug("synthesized indexer for {}: {}", A.name(), indexer);
		return indexer;
	}

	/**
	 * Construct the type of the indexer.
	 *
	 * @return
	 */
	public Term type() {
		TypeDeclaration A = descriptor.before();
		int np = A.parameters().length;
		int k = A.indices().length;
		Term self = A.apply(Terms.variables(np, k), Terms.variables(k, 0));
		Term index = descriptor.indexType(Terms.variables(np, k + 1), Terms.variables(k, 1));
		return Telescope.products(A.parameters(), Telescope.products(A.indices(), new Term.Pi("a", self, index)));
	}

	private Term synthesizeCase(int j, Term[] ps, Term motive) {
		CaseAlignment alignment = descriptor.alignment(j);
		int nA = alignment.before().size();
		int nB = alignment.after().size();
		Telescope slots = Eliminators.slots(principle, j, ps, motive, nA);
		Term[] values = new Term[nB];
		for (int s = 0; s != nB; ++s) {
			int partner = alignment.afterPartner(s);
			if (alignment.afterRole(s) == CaseAlignment.Role.INDEX) {
				partner = CaseAlignment.hypothesisOf(partner);
			}
			values[s] = new Term.Variable(nA - 1 - partner);
		}
		Term[] conclusion = Terms.arguments(alignment.after().body());
		Term index = Eliminators.relocate(conclusion[descriptor.position()], values, motive, ps, nA);
		return Telescope.lambdas(slots.bindings(), index);
	}
}
