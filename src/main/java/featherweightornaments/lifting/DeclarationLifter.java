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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import featherweightornaments.core.Context;
import featherweightornaments.core.Environment;
import featherweightornaments.core.Syntax.Binding;
import featherweightornaments.core.Syntax.Term;
import featherweightornaments.core.TypeDeclaration;
import featherweightornaments.discovery.CorrespondenceDescriptor;

/**
 * Lifts an entire inductive type declaration whose parameters, indices or
 * constructor arguments mention the type being lifted from. The result is a
 * fresh declaration (whose name, and those of its constructors, carry a given
 * suffix) which is added to the environment. The renaming is recorded in the
 * registry for both directions, such that terms lifted afterwards refer to the
 * new declaration.
 *
 * @author David J. Pearce
 *
 */
public class DeclarationLifter {
	private static final Logger log = LoggerFactory.getLogger(DeclarationLifter.class);

	// Error messages
	public final static String NAME_ALREADY_DECLARED = "lifted name already declared";

	private final LiftingConfiguration configuration;
	private final TermLifter lifter;

	public DeclarationLifter(LiftingConfiguration configuration, TermLifter lifter) {
		this.configuration = configuration;
		this.lifter = lifter;
	}

	/**
	 * Lift a given declaration, returning the newly declared one. A
	 * declaration which is opaque in the configuration is returned unchanged.
	 * If lifting fails, neither the environment nor the registry is changed.
	 *
	 * @param declaration
	 * @param suffix
	 * @return
	 */
	public TypeDeclaration lift(TypeDeclaration declaration, String suffix) {
		if (configuration.opaque().contains(declaration.name())) {
			log.warn("not lifting opaque declaration {}", declaration.name());
			return declaration;
		}
		String[][] renamings = renamings(declaration, suffix);
		Environment environment = configuration.environment();
		for (String[] r : renamings) {
			if (environment.isDeclared(r[1])) {
				throw new IllegalArgumentException(NAME_ALREADY_DECLARED + ": " + r[1]);
			}
		}
		// Register renaming first, since constructors refer to their own type.
		String[] previous = register(renamings);
		try {
			TypeDeclaration lifted = liftDeclaration(declaration, suffix);
			environment.declare(lifted);
			log.info("lifted declaration {} to {}", declaration.name(), lifted.name());
			return lifted;
		} catch (RuntimeException e) {
			restore(renamings, previous);
			configuration.cache().clear();
			throw e;
		}
	}

	private TypeDeclaration liftDeclaration(TypeDeclaration declaration, String suffix) {
		Context context = Context.EMPTY;
		Binding[] parameters = declaration.parameters();
		Binding[] lparameters = new Binding[parameters.length];
		for (int i = 0; i != parameters.length; ++i) {
			lparameters[i] = new Binding(parameters[i].name(), lifter.lift(context, parameters[i].type()));
			context = context.bind(parameters[i].name(), parameters[i].type());
		}
		Binding[] lindices = liftTelescope(context, declaration.indices());
		TypeDeclaration.Constructor[] constructors = declaration.constructors();
		TypeDeclaration.Constructor[] lconstructors = new TypeDeclaration.Constructor[constructors.length];
		for (int i = 0; i != constructors.length; ++i) {
			lconstructors[i] = liftConstructor(context, constructors[i], suffix);
		}
		return new TypeDeclaration(declaration.name() + "_" + suffix, lparameters, lindices, declaration.sort(),
				lconstructors);
	}

	/**
	 * The pairs of original and lifted names, for the type followed by its
	 * constructors.
	 *
	 * @param declaration
	 * @param suffix
	 * @return
	 */
	private static String[][] renamings(TypeDeclaration declaration, String suffix) {
		TypeDeclaration.Constructor[] constructors = declaration.constructors();
		String[][] r = new String[constructors.length + 1][];
		r[0] = new String[] { declaration.name(), declaration.name() + "_" + suffix };
		for (int i = 0; i != constructors.length; ++i) {
			r[i + 1] = new String[] { constructors[i].name(), constructors[i].name() + "_" + suffix };
		}
		return r;
	}

	private TypeDeclaration.Constructor liftConstructor(Context context, TypeDeclaration.Constructor constructor,
			String suffix) {
		Binding[] arguments = constructor.arguments();
		Binding[] larguments = liftTelescope(context, arguments);
		for (int i = 0; i != arguments.length; ++i) {
			context = context.bind(arguments[i].name(), arguments[i].type());
		}
		Term[] indices = lifter.lift(context, constructor.indices());
		return new TypeDeclaration.Constructor(constructor.name() + "_" + suffix, larguments, indices);
	}

	private Binding[] liftTelescope(Context context, Binding[] bindings) {
		Binding[] lifted = new Binding[bindings.length];
		for (int i = 0; i != bindings.length; ++i) {
			lifted[i] = new Binding(bindings[i].name(), lifter.lift(context, bindings[i].type()));
			context = context.bind(bindings[i].name(), bindings[i].type());
		}
		return lifted;
	}

	/**
	 * Record the renamings in both directions, returning the names they
	 * replace (or <code>null</code> where there were none).
	 *
	 * @param renamings
	 * @return
	 */
	private String[] register(String[][] renamings) {
		LiftingRegistry registry = configuration.registry();
		CorrespondenceDescriptor correspondence = configuration.correspondence();
		LiftingConfiguration.Direction direction = configuration.direction();
		String[] previous = new String[renamings.length * 2];
		for (int i = 0; i != renamings.length; ++i) {
			String[] r = renamings[i];
			previous[2 * i] = registry.lookupLifting(correspondence, direction, r[0]);
			previous[2 * i + 1] = registry.lookupLifting(correspondence, direction.opposite(), r[1]);
			registry.saveLifting(correspondence, direction, r[0], r[1]);
			registry.saveLifting(correspondence, direction.opposite(), r[1], r[0]);
		}
		return previous;
	}

	private void restore(String[][] renamings, String[] previous) {
		LiftingRegistry registry = configuration.registry();
		CorrespondenceDescriptor correspondence = configuration.correspondence();
		LiftingConfiguration.Direction direction = configuration.direction();
		for (int i = 0; i != renamings.length; ++i) {
			String[] r = renamings[i];
			restore(registry, correspondence, direction, r[0], previous[2 * i]);
			restore(registry, correspondence, direction.opposite(), r[1], previous[2 * i + 1]);
		}
	}

	private static void restore(LiftingRegistry registry, CorrespondenceDescriptor correspondence,
			LiftingConfiguration.Direction direction, String from, String to) {
		if (to == null) {
			registry.removeLifting(correspondence, direction, from);
		} else {
			registry.saveLifting(correspondence, direction, from, to);
		}
	}
}
