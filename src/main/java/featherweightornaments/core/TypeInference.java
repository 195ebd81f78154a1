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
package featherweightornaments.core;

import java.util.Arrays;

import featherweightornaments.core.Syntax.Term;

/**
 * Responsible for inferring the type of an (already type-checked) term within
 * a given binder context. This does not attempt to fully check terms, rather
 * it computes the type a well-typed term must have. Inferred types are
 * returned with beta redexes contracted.
 *
 * @author David J. Pearce
 *
 */
public class TypeInference {
	// Error messages
	public final static String EXPECTED_FUNCTION = "expected function type";
	public final static String EXPECTED_INDUCTIVE = "expected value of inductive type";
	public final static String EXPECTED_RECORD = "expected value of record type";
	public final static String UNKNOWN_INDUCTIVE = "unknown inductive type";
	public final static String CONSTRUCTOR_ARITY = "constructor applied to wrong number of arguments";

	private final Environment environment;
	private final Reduction reduction;

	public TypeInference(Environment environment) {
		this.environment = environment;
		this.reduction = new Reduction(environment);
	}

	public Term infer(Context context, Term term) {
		return Terms.beta(doInfer(context, term));
	}

	private Term doInfer(Context context, Term term) {
		switch (term.getOpcode()) {
		case Syntax.TERM_variable:
			// T-Var
			return context.typeOf(((Term.Variable) term).index());
		case Syntax.TERM_global:
			// T-Global
			return environment.typeOf(((Term.Global) term).name());
		case Syntax.TERM_construct:
			return inferConstruct((Term.Construct) term);
		case Syntax.TERM_application:
			return inferApplication(context, (Term.Application) term);
		case Syntax.TERM_lambda: {
			// T-Abs
			Term.Lambda l = (Term.Lambda) term;
			Term body = doInfer(context.bind(l.name(), l.type()), l.body());
			return new Term.Pi(l.name(), l.type(), body);
		}
		case Syntax.TERM_pi: {
			// T-Prod
			Term.Pi p = (Term.Pi) term;
			Term sort = reduction.whnf(doInfer(context.bind(p.name(), p.type()), p.body()));
			return sort instanceof Term.Sort && ((Term.Sort) sort).isProp() ? Term.Sort.PROP : Term.Sort.TYPE;
		}
		case Syntax.TERM_let: {
			// T-Let
			Term.Let l = (Term.Let) term;
			Term body = doInfer(context.define(l.name(), l.type(), l.value()), l.body());
			return Terms.instantiate(body, l.value());
		}
		case Syntax.TERM_case: {
			// T-Case
			Term.Case c = (Term.Case) term;
			TypeDeclaration decl = declaration(c.type());
			Term type = reduction.whnf(doInfer(context, c.scrutinee()));
			check(decl.isApplication(type), EXPECTED_INDUCTIVE, c.scrutinee());
			Term[] args = Terms.arguments(type);
			Term[] indices = Arrays.copyOfRange(args, decl.parameters().length, args.length);
			return Terms.apply(c.motive(), Terms.append(indices, c.scrutinee()));
		}
		case Syntax.TERM_eliminate: {
			// T-Elim
			Term.Eliminate e = (Term.Eliminate) term;
			return Terms.apply(e.motive(), Terms.append(e.indices(), e.scrutinee()));
		}
		case Syntax.TERM_fix:
			return ((Term.Fix) term).type();
		case Syntax.TERM_cofix:
			return ((Term.CoFix) term).type();
		case Syntax.TERM_project:
			return inferProject(context, (Term.Project) term);
		case Syntax.TERM_cast:
			return ((Term.Cast) term).type();
		case Syntax.TERM_sort:
			return Term.Sort.TYPE;
		}
		throw new IllegalArgumentException("Invalid term encountered: " + term);
	}

	/**
	 * T-Construct
	 */
	private Term inferConstruct(Term.Construct term) {
		TypeDeclaration decl = declaration(term.type());
		TypeDeclaration.Constructor c = decl.constructor(term.index());
		int np = decl.parameters().length;
		Term[] args = term.arguments();
		check(args.length == np + c.arguments().length, CONSTRUCTOR_ARITY, term);
		Term[] ps = Arrays.copyOfRange(args, 0, np);
		return decl.apply(ps, Terms.instantiate(c.indices(), args));
	}

	/**
	 * T-App
	 */
	private Term inferApplication(Context context, Term.Application term) {
		Term type = doInfer(context, term.function());
		for (Term arg : term.arguments()) {
			type = reduction.whnf(type);
			check(type instanceof Term.Pi, EXPECTED_FUNCTION, term);
			type = Terms.instantiate(((Term.Pi) type).body(), arg);
		}
		return type;
	}

	/**
	 * T-Proj
	 */
	private Term inferProject(Context context, Term.Project term) {
		Term type = reduction.whnf(doInfer(context, term.target()));
		Term head = Terms.head(type);
		check(head instanceof Term.Global, EXPECTED_RECORD, term);
		TypeDeclaration decl = declaration(((Term.Global) head).name());
		check(decl.isRecord(), EXPECTED_RECORD, term);
		Term[] ps = Terms.arguments(type);
		Term[] values = Arrays.copyOf(ps, ps.length + term.field());
		for (int i = 0; i != term.field(); ++i) {
			values[ps.length + i] = new Term.Project(i, term.target());
		}
		Term field = decl.constructor(0).arguments()[term.field()].type();
		return Terms.instantiate(field, values);
	}

	private TypeDeclaration declaration(String name) {
		TypeDeclaration decl = environment.declaration(name);
		check(decl != null, UNKNOWN_INDUCTIVE, name);
		return decl;
	}

	private static void check(boolean ok, String msg, Object element) {
		if (!ok) {
			throw new IllegalArgumentException(msg + ": " + element);
		}
	}
}
