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
package featherweightornaments;

import java.util.Arrays;
import java.util.HashSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import featherweightornaments.core.Environment;
import featherweightornaments.core.Packing;
import featherweightornaments.core.Reduction;
import featherweightornaments.core.Syntax.Term;
import featherweightornaments.core.Telescope;
import featherweightornaments.core.TypeDeclaration;
import featherweightornaments.discovery.CorrespondenceDescriptor;
import featherweightornaments.discovery.Differencing;
import featherweightornaments.discovery.DiscoveryPolicy;
import featherweightornaments.discovery.IndexDescriptor;
import featherweightornaments.discovery.IndexerSynthesizer;
import featherweightornaments.discovery.PromoteForgetSynthesizer;
import featherweightornaments.discovery.StructuralRecursionPrinciple;
import featherweightornaments.discovery.TypeIntrospection;
import featherweightornaments.lifting.DeclarationLifter;
import featherweightornaments.lifting.LiftingCache;
import featherweightornaments.lifting.LiftingConfiguration;
import featherweightornaments.lifting.LiftingRegistry;
import featherweightornaments.lifting.TermLifter;
import featherweightornaments.util.OrnamentError;

/**
 * Provides the entry points for discovering ornaments between types and for
 * lifting terms, definitions and declarations along them. Each instance
 * operates over a given environment, into which the synthesized functions and
 * lifted definitions are added, and keeps a registry of the ornaments found and
 * the names lifted so far.
 *
 * @author David J. Pearce
 *
 */
public class Ornaments {
	private static final Logger log = LoggerFactory.getLogger(Ornaments.class);

	// Error messages
	public final static String UNKNOWN_TYPE = "expected inductive type";
	public final static String UNRELATED_TYPES = "expected two inductive types, or a record and a definition";
	public final static String NOT_CURRIED = "definition is not the curried form of the record";
	public final static String UNKNOWN_DEFINITION = "expected definition with a body";
	public final static String NAME_ALREADY_DECLARED = "synthesized name already declared";

	private final Environment environment;
	private final DiscoveryPolicy policy;
	private final LiftingRegistry registry;

	public Ornaments(Environment environment) {
		this(environment, DiscoveryPolicy.FIRST_MATCH);
	}

	public Ornaments(Environment environment, DiscoveryPolicy policy) {
		this.environment = environment;
		this.policy = policy;
		this.registry = new LiftingRegistry();
	}

	public Environment environment() {
		return environment;
	}

	public LiftingRegistry registry() {
		return registry;
	}

	// ========================================================================
	// Discovery
	// ========================================================================

	/**
	 * Find the ornament between two types. Where both name inductive types,
	 * these must differ by exactly one new index, and the indexer, promote and
	 * forget functions are defined in the environment as
	 * <code>A_to_B_index</code>, <code>A_to_B</code> and
	 * <code>A_to_B_inv</code>. Where the first names a record and the second a
	 * definition of nested pairs over its fields, promote and forget are
	 * defined as <code>A_curry</code> and <code>A_curry_inv</code>. An
	 * ornament found before is returned again.
	 *
	 * @param before
	 * @param after
	 * @return
	 */
	public CorrespondenceDescriptor findOrnament(String before, String after) {
		CorrespondenceDescriptor correspondence = registry.lookupOrnament(before, after);
		if (correspondence != null) {
			return correspondence;
		}
		TypeDeclaration A = environment.declaration(before);
		if (A == null) {
			throw new OrnamentError.UnsupportedShape(UNKNOWN_TYPE, before);
		} else if (environment.declaration(after) != null) {
			correspondence = findAlgebraic(A, environment.declaration(after));
		} else if (environment.definition(after) != null && !environment.definition(after).isAxiom()) {
			correspondence = findCurryRecord(A, environment.definition(after));
		} else {
			throw new OrnamentError.UnsupportedShape(UNRELATED_TYPES, after);
		}
		registry.saveOrnament(correspondence);
		log.info("found ornament {}", correspondence);
		return correspondence;
	}

	/**
	 * Look up an ornament found earlier, or return <code>null</code>.
	 *
	 * @param before
	 * @param after
	 * @return
	 */
	public CorrespondenceDescriptor lookupOrnament(String before, String after) {
		return registry.lookupOrnament(before, after);
	}

	/**
	 * Determine the new index of an algebraic ornament between two inductive
	 * types.
	 *
	 * @param before
	 * @param after
	 * @return
	 */
	public IndexDescriptor findIndex(TypeDeclaration before, TypeDeclaration after) {
		Differencing differencing = new Differencing(environment, policy);
		return differencing.findIndex(TypeIntrospection.principle(before), TypeIntrospection.principle(after));
	}

	/**
	 * Synthesize the indexer for a given index, which computes the new index
	 * of a value of the type being ornamented.
	 *
	 * @param descriptor
	 * @return
	 */
	public Term synthesizeIndexer(IndexDescriptor descriptor) {
		return indexer(descriptor).synthesize();
	}

	/**
	 * Synthesize promote and forget for a given index, using a given term to
	 * refer to the indexer.
	 *
	 * @param descriptor
	 * @param indexer
	 * @return
	 */
	public PromoteForgetSynthesizer synthesizePromoteForget(IndexDescriptor descriptor, Term indexer) {
		return new PromoteForgetSynthesizer.Algebraic(descriptor, TypeIntrospection.principle(descriptor.before()),
				TypeIntrospection.principle(descriptor.after()), indexer);
	}

	/**
	 * Synthesize promote and forget between a record and nested pairs of its
	 * fields.
	 *
	 * @param record
	 * @return
	 */
	public PromoteForgetSynthesizer.CurryRecord synthesizePromoteForget(TypeDeclaration record) {
		return new PromoteForgetSynthesizer.CurryRecord(record);
	}

	private CorrespondenceDescriptor findAlgebraic(TypeDeclaration A, TypeDeclaration B) {
		IndexDescriptor descriptor = findIndex(A, B);
		String name = A.name() + "_to_" + B.name();
		checkFresh(name + "_index", name, name + "_inv");
		IndexerSynthesizer indexer = indexer(descriptor);
		environment.define(name + "_index", indexer.type(), indexer.synthesize());
		Term index = new Term.Global(name + "_index");
		PromoteForgetSynthesizer synthesizer = synthesizePromoteForget(descriptor, index);
		environment.define(name, synthesizer.promoteType(), synthesizer.promote());
		environment.define(name + "_inv", synthesizer.forgetType(), synthesizer.forget());
		return CorrespondenceDescriptor.algebraic(descriptor, index, new Term.Global(name),
				new Term.Global(name + "_inv"));
	}

	private CorrespondenceDescriptor findCurryRecord(TypeDeclaration record, Environment.Definition definition) {
		PromoteForgetSynthesizer.CurryRecord synthesizer = synthesizePromoteForget(record);
		int np = record.parameters().length;
		Telescope body = Telescope.ofLambdas(definition.body(), np);
		Reduction reduction = new Reduction(environment);
		if (body.size() != np || !reduction.convertible(body.body(), Packing.nest(synthesizer.fields()))) {
			throw new OrnamentError.UnsupportedShape(NOT_CURRIED, definition.name());
		}
		String name = record.name() + "_curry";
		checkFresh(name, name + "_inv");
		environment.define(name, synthesizer.promoteType(), synthesizer.promote());
		environment.define(name + "_inv", synthesizer.forgetType(), synthesizer.forget());
		return CorrespondenceDescriptor.curryRecord(record, definition.name(), synthesizer.fields(),
				new Term.Global(name), new Term.Global(name + "_inv"));
	}

	/**
	 * Check none of the given names is taken, before any is defined.
	 *
	 * @param names
	 */
	private void checkFresh(String... names) {
		for (String name : names) {
			if (environment.isDeclared(name)) {
				throw new IllegalArgumentException(NAME_ALREADY_DECLARED + ": " + name);
			}
		}
	}

	private IndexerSynthesizer indexer(IndexDescriptor descriptor) {
		return new IndexerSynthesizer(TypeIntrospection.principle(descriptor.before()), descriptor);
	}

	// ========================================================================
	// Lifting
	// ========================================================================

	/**
	 * Construct a fresh configuration for lifting along a given ornament in a
	 * given direction. Globals named as opaque are never unfolded or lifted.
	 *
	 * @param correspondence
	 * @param direction
	 * @param opaque
	 * @return
	 */
	public LiftingConfiguration initializeLiftingConfiguration(CorrespondenceDescriptor correspondence,
			LiftingConfiguration.Direction direction, String... opaque) {
		return new LiftingConfiguration(environment, correspondence, direction, new LiftingCache(),
				new HashSet<>(Arrays.asList(opaque)), registry);
	}

	/**
	 * Lift a closed term.
	 *
	 * @param configuration
	 * @param term
	 * @return
	 */
	public Term lift(LiftingConfiguration configuration, Term term) {
		return new TermLifter(configuration).lift(term);
	}

	/**
	 * Lift a named definition into a new definition, such that later lifts
	 * refer to the new name.
	 *
	 * @param configuration
	 * @param name
	 * @param newName
	 * @return
	 */
	public Environment.Definition liftDefinition(LiftingConfiguration configuration, String name, String newName) {
		Environment.Definition definition = environment.definition(name);
		if (definition == null || definition.isAxiom()) {
			throw new IllegalArgumentException(UNKNOWN_DEFINITION + ": " + name);
		}
		TermLifter lifter = new TermLifter(configuration);
		Term type = lifter.lift(definition.type());
		Term body = lifter.lift(definition.body());
		Environment.Definition lifted = environment.define(newName, type, body);
		CorrespondenceDescriptor correspondence = configuration.correspondence();
		registry.saveLifting(correspondence, configuration.direction(), name, newName);
		registry.saveLifting(correspondence, configuration.direction().opposite(), newName, name);
		log.info("lifted definition {} to {}", name, newName);
		return lifted;
	}

	/**
	 * Lift a named inductive type into a new one, whose name (and those of its
	 * constructors) carry a given suffix.
	 *
	 * @param configuration
	 * @param name
	 * @param suffix
	 * @return
	 */
	public TypeDeclaration liftDeclaration(LiftingConfiguration configuration, String name, String suffix) {
		TypeDeclaration declaration = environment.getDeclaration(name);
		return new DeclarationLifter(configuration, new TermLifter(configuration)).lift(declaration, suffix);
	}
}
