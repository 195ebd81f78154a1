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

import java.util.ArrayList;
import java.util.Arrays;

import featherweightornaments.util.SyntacticElement;

/**
 * The term language over which ornaments are discovered and terms are lifted.
 * This is a small dependently typed calculus with inductive types, where bound
 * variables are identified only by their de Bruijn index. That is,
 * <code>Variable(0)</code> refers to the innermost enclosing binder,
 * <code>Variable(1)</code> to the next, and so on.
 *
 * @author David J. Pearce
 *
 */
public class Syntax {
	public final static int TERM_variable = 0;
	public final static int TERM_global = 1;
	public final static int TERM_construct = 2;
	public final static int TERM_application = 3;
	public final static int TERM_lambda = 4;
	public final static int TERM_let = 5;
	public final static int TERM_pi = 6;
	public final static int TERM_case = 7;
	public final static int TERM_eliminate = 8;
	public final static int TERM_fix = 9;
	public final static int TERM_cofix = 10;
	public final static int TERM_project = 11;
	public final static int TERM_cast = 12;
	public final static int TERM_sort = 13;

	public interface Term extends SyntacticElement {

		/**
		 * Get the opcode associated with the syntactic form of this term.
		 *
		 * @return
		 */
		public int getOpcode();

		/**
		 * An abstract term to be implemented by all other terms.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static abstract class AbstractTerm extends SyntacticElement.Impl implements Term {
			private final int opcode;

			public AbstractTerm(int opcode, Attribute... attributes) {
				super(attributes);
				this.opcode = opcode;
			}

			@Override
			public int getOpcode() {
				return opcode;
			}

			@Override
			public String toString() {
				return Syntax.toString(this);
			}
		}

		/**
		 * A marker interface to indicates terms which contain other terms.
		 *
		 * @author David J. Pearce
		 *
		 */
		public interface Compound {

		}

		/**
		 * A term which introduces exactly one binder over its body, such as a
		 * lambda or a dependent product.
		 *
		 * @author David J. Pearce
		 *
		 */
		public interface Binder extends Term, Compound {
			public String name();

			public Term type();

			public Term body();
		}

		/**
		 * Represents a reference to a bound variable by its de Bruijn index.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Variable extends AbstractTerm {
			private final int index;

			public Variable(int index, Attribute... attributes) {
				super(TERM_variable, attributes);
				if (index < 0) {
					throw new IllegalArgumentException("invalid variable index: " + index);
				}
				this.index = index;
			}

			public int index() {
				return index;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Variable && ((Variable) o).index == index;
			}

			@Override
			public int hashCode() {
				return index;
			}
		}

		/**
		 * Represents a reference to a global definition, axiom or inductive type.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Global extends AbstractTerm {
			private final String name;

			public Global(String name, Attribute... attributes) {
				super(TERM_global, attributes);
				this.name = name;
			}

			public String name() {
				return name;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Global && ((Global) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}
		}

		/**
		 * Represents a fully applied constructor of an inductive type. The
		 * arguments include the parameters of the inductive type followed by the
		 * constructor's own arguments, such as <code>cons T x l</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Construct extends AbstractTerm implements Compound {
			private final String type;
			private final int index;
			private final String name;
			private final Term[] arguments;

			public Construct(String type, int index, String name, Term[] arguments, Attribute... attributes) {
				super(TERM_construct, attributes);
				this.type = type;
				this.index = index;
				this.name = name;
				this.arguments = arguments;
			}

			/**
			 * Get the name of the inductive type this constructs.
			 *
			 * @return
			 */
			public String type() {
				return type;
			}

			/**
			 * Get the position of this constructor within its declaration.
			 *
			 * @return
			 */
			public int index() {
				return index;
			}

			/**
			 * Get the constructor's name. This is for display only.
			 *
			 * @return
			 */
			public String name() {
				return name;
			}

			public Term[] arguments() {
				return arguments;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Construct) {
					Construct c = (Construct) o;
					return c.index == index && c.type.equals(type) && Arrays.equals(c.arguments, arguments);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return type.hashCode() ^ index ^ Arrays.hashCode(arguments);
			}
		}

		/**
		 * Represents the application of a function to one or more arguments.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Application extends AbstractTerm implements Compound {
			private final Term function;
			private final Term[] arguments;

			public Application(Term function, Term[] arguments, Attribute... attributes) {
				super(TERM_application, attributes);
				if (arguments.length == 0) {
					throw new IllegalArgumentException("application requires at least one argument");
				}
				this.function = function;
				this.arguments = arguments;
			}

			public Term function() {
				return function;
			}

			public Term[] arguments() {
				return arguments;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Application) {
					Application a = (Application) o;
					return a.function.equals(function) && Arrays.equals(a.arguments, arguments);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return function.hashCode() ^ Arrays.hashCode(arguments);
			}
		}

		/**
		 * Represents a function abstraction of the form
		 * <code>fun (x : T) => e</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Lambda extends AbstractTerm implements Binder {
			private final String name;
			private final Term type;
			private final Term body;

			public Lambda(String name, Term type, Term body, Attribute... attributes) {
				super(TERM_lambda, attributes);
				this.name = name;
				this.type = type;
				this.body = body;
			}

			@Override
			public String name() {
				return name;
			}

			@Override
			public Term type() {
				return type;
			}

			@Override
			public Term body() {
				return body;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Lambda) {
					Lambda l = (Lambda) o;
					return l.type.equals(type) && l.body.equals(body);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return 31 * type.hashCode() + body.hashCode();
			}
		}

		/**
		 * Represents a dependent product <code>forall (x : T), U</code>. When the
		 * body does not mention the binder this is the ordinary function type
		 * <code>T -> U</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Pi extends AbstractTerm implements Binder {
			private final String name;
			private final Term type;
			private final Term body;

			public Pi(String name, Term type, Term body, Attribute... attributes) {
				super(TERM_pi, attributes);
				this.name = name;
				this.type = type;
				this.body = body;
			}

			@Override
			public String name() {
				return name;
			}

			@Override
			public Term type() {
				return type;
			}

			@Override
			public Term body() {
				return body;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Pi) {
					Pi l = (Pi) o;
					return l.type.equals(type) && l.body.equals(body);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return 37 * type.hashCode() + body.hashCode();
			}
		}

		/**
		 * Represents a local definition <code>let x : T := v in e</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Let extends AbstractTerm implements Binder {
			private final String name;
			private final Term value;
			private final Term type;
			private final Term body;

			public Let(String name, Term value, Term type, Term body, Attribute... attributes) {
				super(TERM_let, attributes);
				this.name = name;
				this.value = value;
				this.type = type;
				this.body = body;
			}

			@Override
			public String name() {
				return name;
			}

			public Term value() {
				return value;
			}

			@Override
			public Term type() {
				return type;
			}

			@Override
			public Term body() {
				return body;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Let) {
					Let l = (Let) o;
					return l.value.equals(value) && l.type.equals(type) && l.body.equals(body);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return value.hashCode() ^ type.hashCode() ^ body.hashCode();
			}
		}

		/**
		 * Represents a primitive case split over a value of an inductive type.
		 * Each branch is a function over the (non-parameter) arguments of the
		 * corresponding constructor. The motive is a function over the indices
		 * and the scrutinee.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Case extends AbstractTerm implements Compound {
			private final String type;
			private final Term motive;
			private final Term scrutinee;
			private final Term[] branches;

			public Case(String type, Term motive, Term scrutinee, Term[] branches, Attribute... attributes) {
				super(TERM_case, attributes);
				this.type = type;
				this.motive = motive;
				this.scrutinee = scrutinee;
				this.branches = branches;
			}

			public String type() {
				return type;
			}

			public Term motive() {
				return motive;
			}

			public Term scrutinee() {
				return scrutinee;
			}

			public Term[] branches() {
				return branches;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Case) {
					Case c = (Case) o;
					return c.type.equals(type) && c.motive.equals(motive) && c.scrutinee.equals(scrutinee)
							&& Arrays.equals(c.branches, branches);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return type.hashCode() ^ motive.hashCode() ^ scrutinee.hashCode() ^ Arrays.hashCode(branches);
			}
		}

		/**
		 * Represents a fully applied structural recursion principle (i.e.
		 * eliminator) of an inductive type, such as:
		 *
		 * <pre>
		 * elim list [T] P { c_nil | c_cons } [] l
		 * </pre>
		 *
		 * Here, the motive <code>P</code> is a function over the indices and a
		 * value of the type. There is exactly one case per constructor. Each case
		 * is a function over the constructor's arguments where every recursive
		 * argument is followed by its inductive hypothesis.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Eliminate extends AbstractTerm implements Compound {
			private final String type;
			private final Term[] parameters;
			private final Term motive;
			private final Term[] cases;
			private final Term[] indices;
			private final Term scrutinee;

			public Eliminate(String type, Term[] parameters, Term motive, Term[] cases, Term[] indices,
					Term scrutinee, Attribute... attributes) {
				super(TERM_eliminate, attributes);
				this.type = type;
				this.parameters = parameters;
				this.motive = motive;
				this.cases = cases;
				this.indices = indices;
				this.scrutinee = scrutinee;
			}

			public String type() {
				return type;
			}

			public Term[] parameters() {
				return parameters;
			}

			public Term motive() {
				return motive;
			}

			public Term[] cases() {
				return cases;
			}

			public Term[] indices() {
				return indices;
			}

			public Term scrutinee() {
				return scrutinee;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Eliminate) {
					Eliminate e = (Eliminate) o;
					return e.type.equals(type) && Arrays.equals(e.parameters, parameters) && e.motive.equals(motive)
							&& Arrays.equals(e.cases, cases) && Arrays.equals(e.indices, indices)
							&& e.scrutinee.equals(scrutinee);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return type.hashCode() ^ Arrays.hashCode(parameters) ^ motive.hashCode() ^ Arrays.hashCode(cases)
						^ Arrays.hashCode(indices) ^ scrutinee.hashCode();
			}
		}

		/**
		 * Represents a recursive function <code>fix f : T := e</code> where
		 * <code>f</code> is bound in <code>e</code>. The decreasing argument
		 * identifies which argument of <code>f</code> is structurally smaller on
		 * each recursive call.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Fix extends AbstractTerm implements Binder {
			private final String name;
			private final Term type;
			private final Term body;
			private final int decreasing;

			public Fix(String name, Term type, Term body, int decreasing, Attribute... attributes) {
				super(TERM_fix, attributes);
				this.name = name;
				this.type = type;
				this.body = body;
				this.decreasing = decreasing;
			}

			@Override
			public String name() {
				return name;
			}

			@Override
			public Term type() {
				return type;
			}

			@Override
			public Term body() {
				return body;
			}

			public int decreasing() {
				return decreasing;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Fix) {
					Fix f = (Fix) o;
					return f.decreasing == decreasing && f.type.equals(type) && f.body.equals(body);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return decreasing ^ type.hashCode() ^ body.hashCode();
			}
		}

		/**
		 * Represents a corecursive definition <code>cofix f : T := e</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class CoFix extends AbstractTerm implements Binder {
			private final String name;
			private final Term type;
			private final Term body;

			public CoFix(String name, Term type, Term body, Attribute... attributes) {
				super(TERM_cofix, attributes);
				this.name = name;
				this.type = type;
				this.body = body;
			}

			@Override
			public String name() {
				return name;
			}

			@Override
			public Term type() {
				return type;
			}

			@Override
			public Term body() {
				return body;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof CoFix) {
					CoFix f = (CoFix) o;
					return f.type.equals(type) && f.body.equals(body);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return 41 * type.hashCode() + body.hashCode();
			}
		}

		/**
		 * Represents the projection of a field from a value of a record type
		 * (i.e. an inductive type with exactly one constructor and no indices).
		 * Fields are numbered from zero.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Project extends AbstractTerm implements Compound {
			private final int field;
			private final Term target;

			public Project(int field, Term target, Attribute... attributes) {
				super(TERM_project, attributes);
				this.field = field;
				this.target = target;
			}

			public int field() {
				return field;
			}

			public Term target() {
				return target;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Project) {
					Project p = (Project) o;
					return p.field == field && p.target.equals(target);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return field ^ target.hashCode();
			}
		}

		/**
		 * Represents a type ascription <code>(e : T)</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Cast extends AbstractTerm implements Compound {
			private final Term term;
			private final Term type;

			public Cast(Term term, Term type, Attribute... attributes) {
				super(TERM_cast, attributes);
				this.term = term;
				this.type = type;
			}

			public Term term() {
				return term;
			}

			public Term type() {
				return type;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Cast) {
					Cast c = (Cast) o;
					return c.term.equals(term) && c.type.equals(type);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return term.hashCode() ^ type.hashCode();
			}
		}

		/**
		 * Represents a universe, either <code>Prop</code> or <code>Type</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Sort extends AbstractTerm {
			public static final Sort PROP = new Sort(false);
			public static final Sort TYPE = new Sort(true);

			private final boolean computational;

			private Sort(boolean computational) {
				super(TERM_sort);
				this.computational = computational;
			}

			public boolean isProp() {
				return !computational;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Sort && ((Sort) o).computational == computational;
			}

			@Override
			public int hashCode() {
				return computational ? 1 : 0;
			}
		}
	}

	/**
	 * A named and typed entry in a telescope, such as a parameter of an
	 * inductive type or an argument of a constructor.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Binding {
		private final String name;
		private final Term type;

		public Binding(String name, Term type) {
			this.name = name;
			this.type = type;
		}

		public String name() {
			return name;
		}

		public Term type() {
			return type;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Binding && ((Binding) o).type.equals(type);
		}

		@Override
		public int hashCode() {
			return type.hashCode();
		}

		@Override
		public String toString() {
			return "(" + name + " : " + type + ")";
		}
	}

	// ========================================================================
	// Pretty Printing
	// ========================================================================

	/**
	 * Render a term for diagnostics, in a syntax close to that understood by
	 * the parser. Bound variables are printed using the names recorded on their
	 * binders, except that an anonymous binder at depth <code>d</code> is
	 * printed as <code>_d</code> so its uses can be told apart. Free variables
	 * are printed as <code>#i</code>. The parser does not read the printed
	 * forms of fixpoints, cofixpoints and casts.
	 *
	 * @param term
	 * @return
	 */
	public static String toString(Term term) {
		return print(term, new ArrayList<>());
	}

	private static String print(Term term, ArrayList<String> names) {
		switch (term.getOpcode()) {
		case TERM_variable: {
			int i = ((Term.Variable) term).index();
			return i < names.size() ? names.get(names.size() - 1 - i) : "#" + (i - names.size());
		}
		case TERM_global:
			return ((Term.Global) term).name();
		case TERM_construct: {
			Term.Construct c = (Term.Construct) term;
			String name = c.name() != null ? c.name() : c.type() + "#" + c.index();
			return c.arguments().length == 0 ? name : "(" + name + print(c.arguments(), names, " ") + ")";
		}
		case TERM_application: {
			Term.Application a = (Term.Application) term;
			return "(" + print(a.function(), names) + print(a.arguments(), names, " ") + ")";
		}
		case TERM_lambda: {
			Term.Lambda l = (Term.Lambda) term;
			String type = print(l.type(), names);
			String name = binder(l.name(), names);
			return "(fun (" + name + " : " + type + ") => " + printUnder(name, l.body(), names) + ")";
		}
		case TERM_pi: {
			Term.Pi p = (Term.Pi) term;
			String type = print(p.type(), names);
			if (!Terms.occurs(p.body(), 0)) {
				return "(" + type + " -> " + printUnder("_", p.body(), names) + ")";
			}
			String name = binder(p.name(), names);
			return "(forall (" + name + " : " + type + "), " + printUnder(name, p.body(), names) + ")";
		}
		case TERM_let: {
			Term.Let l = (Term.Let) term;
			String name = binder(l.name(), names);
			return "(let " + name + " : " + print(l.type(), names) + " := " + print(l.value(), names) + " in "
					+ printUnder(name, l.body(), names) + ")";
		}
		case TERM_case: {
			Term.Case c = (Term.Case) term;
			return "(case " + c.type() + " " + print(c.motive(), names) + " " + print(c.scrutinee(), names) + " {"
					+ print(c.branches(), names, " | ") + " })";
		}
		case TERM_eliminate: {
			Term.Eliminate e = (Term.Eliminate) term;
			return "(elim " + e.type() + " [" + join(e.parameters(), names) + "] " + print(e.motive(), names)
					+ " {" + print(e.cases(), names, " | ") + " } [" + join(e.indices(), names) + "] "
					+ print(e.scrutinee(), names) + ")";
		}
		case TERM_fix: {
			Term.Fix f = (Term.Fix) term;
			return "(fix " + f.name() + " : " + print(f.type(), names) + " := " + printUnder(f.name(), f.body(), names)
					+ " {struct " + f.decreasing() + "})";
		}
		case TERM_cofix: {
			Term.CoFix f = (Term.CoFix) term;
			return "(cofix " + f.name() + " : " + print(f.type(), names) + " := "
					+ printUnder(f.name(), f.body(), names) + ")";
		}
		case TERM_project: {
			Term.Project p = (Term.Project) term;
			return print(p.target(), names) + "." + (p.field() + 1);
		}
		case TERM_cast: {
			Term.Cast c = (Term.Cast) term;
			return "(" + print(c.term(), names) + " : " + print(c.type(), names) + ")";
		}
		case TERM_sort:
			return ((Term.Sort) term).isProp() ? "Prop" : "Type";
		}
		throw new IllegalArgumentException("Invalid term encountered: " + term.getClass().getName());
	}

	private static String binder(String name, ArrayList<String> names) {
		return name == null || name.equals("_") ? "_" + names.size() : name;
	}

	private static String printUnder(String name, Term body, ArrayList<String> names) {
		names.add(name);
		String r = print(body, names);
		names.remove(names.size() - 1);
		return r;
	}

	private static String print(Term[] terms, ArrayList<String> names, String separator) {
		String r = "";
		for (int i = 0; i != terms.length; ++i) {
			if (i != 0 || separator.equals(" ")) {
				r += separator;
			} else {
				r += " ";
			}
			r += print(terms[i], names);
		}
		return r;
	}

	private static String join(Term[] terms, ArrayList<String> names) {
		String r = "";
		for (int i = 0; i != terms.length; ++i) {
			if (i != 0) {
				r += ", ";
			}
			r += print(terms[i], names);
		}
		return r;
	}
}
