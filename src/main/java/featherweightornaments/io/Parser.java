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
package featherweightornaments.io;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import featherweightornaments.core.Context;
import featherweightornaments.core.Environment;
import featherweightornaments.core.Syntax.Binding;
import featherweightornaments.core.Syntax.Term;
import featherweightornaments.core.Telescope;
import featherweightornaments.core.TypeDeclaration;
import featherweightornaments.core.TypeInference;
import featherweightornaments.core.Terms;
import featherweightornaments.io.Lexer.*;
import featherweightornaments.util.SyntacticElement.Attribute;
import featherweightornaments.util.SyntaxError;

/**
 * Responsible for reading a sequence of sentences (i.e. inductive
 * declarations, definitions and axioms) into an environment, or a single term.
 * For example:
 *
 * <pre>
 * Inductive nat : Type := | O : nat | S : nat -> nat.
 * Inductive list (T : Type) : Type := | nil : list T | cons : T -> list T -> list T.
 * Definition one : list nat := cons nat 1 (nil nat).
 * </pre>
 *
 * Names are resolved as they are read, such that local variables become de
 * Bruijn indices and constructors must be fully applied. Numerals are read as
 * values of <code>nat</code>, and <code>t.1</code> projects the first field of
 * <code>t</code>.
 *
 * @author David J. Pearce
 *
 */
public class Parser {
	private final String sourcefile;
	private final ArrayList<Token> tokens;
	private final Environment environment;
	private int index;
	/**
	 * The inductive type whose constructors are being read, or
	 * <code>null</code>.
	 */
	private String declaring;

	public Parser(String sourcefile, List<Token> tokens, Environment environment) {
		this.sourcefile = sourcefile;
		this.tokens = new ArrayList<>(tokens);
		this.environment = environment;
	}

	/**
	 * Read all remaining sentences into the environment.
	 */
	public void parseSentences() {
		while (index < tokens.size()) {
			parseSentence();
		}
	}

	/**
	 * Read a single term, which must make up the remaining input.
	 *
	 * @return
	 */
	public Term parseClosedTerm() {
		Term t = parseTerm(Scope.EMPTY);
		if (index < tokens.size()) {
			syntaxError("unexpected '" + tokens.get(index).text + "'", tokens.get(index));
		}
		return t;
	}

	/**
	 * Parse a sentence, of the form:
	 *
	 * <pre>
	 * Sentence ::= Inductive | Definition | Axiom
	 * </pre>
	 */
	public void parseSentence() {
		checkNotEof();
		Token lookahead = tokens.get(index);
		if (lookahead.text.equals("Inductive") || lookahead.text.equals("CoInductive")) {
			parseInductive();
		} else if (lookahead.text.equals("Definition")) {
			parseDefinition();
		} else if (lookahead.text.equals("Axiom")) {
			parseAxiom();
		} else {
			syntaxError("expecting 'Inductive', 'Definition' or 'Axiom', found '" + lookahead.text + "'", lookahead);
		}
	}

	/**
	 * Parse an inductive type declaration, of the form:
	 *
	 * <pre>
	 * Inductive ::= ('Inductive' | 'CoInductive') Ident Binders ':' Term ':=' ('|' Ident ':' Term)* '.'
	 * </pre>
	 *
	 * The arity must be a product over the indices ending in a sort, whilst
	 * each constructor type must be a product over its arguments ending in the
	 * type being declared (applied to its parameters, then indices).
	 */
	public void parseInductive() {
		Token kind = match("Inductive", "CoInductive");
		Identifier name = matchIdentifier();
		ArrayList<Binding> parameters = new ArrayList<>();
		Scope scope = parseBinderGroups(Scope.EMPTY, parameters);
		match(":");
		Token at = tokens.get(index);
		Telescope arity = Telescope.ofProducts(parseTerm(scope));
		if (!(arity.body() instanceof Term.Sort)) {
			syntaxError("arity must end in a sort", at);
		}
		match(":=");
		ArrayList<TypeDeclaration.Constructor> constructors = new ArrayList<>();
		declaring = name.text;
		while (index < tokens.size() && tokens.get(index) instanceof Bar) {
			match("|");
			Identifier c = matchIdentifier();
			match(":");
			Term type = parseTerm(scope);
			constructors.add(constructor(c, type, name.text, parameters.size(), arity.size()));
		}
		declaring = null;
		match(".");
		TypeDeclaration.Finiteness finiteness = kind.text.equals("Inductive") ? TypeDeclaration.Finiteness.INDUCTIVE
				: TypeDeclaration.Finiteness.COINDUCTIVE;
		declare(new TypeDeclaration(name.text, parameters.toArray(new Binding[parameters.size()]),
				arity.bindings(), (Term.Sort) arity.body(), finiteness, 1,
				constructors.toArray(new TypeDeclaration.Constructor[constructors.size()])), name);
	}

	/**
	 * Parse a definition, of the form:
	 *
	 * <pre>
	 * Definition ::= 'Definition' Ident Binders (':' Term)? ':=' Term '.'
	 * </pre>
	 *
	 * When no type is given, it is inferred from the body.
	 */
	public void parseDefinition() {
		matchKeyword("Definition");
		Identifier name = matchIdentifier();
		ArrayList<Binding> bindings = new ArrayList<>();
		Scope scope = parseBinderGroups(Scope.EMPTY, bindings);
		Binding[] bs = bindings.toArray(new Binding[bindings.size()]);
		Term type = null;
		if (index < tokens.size() && tokens.get(index) instanceof Colon) {
			match(":");
			type = Telescope.products(bs, parseTerm(scope));
		}
		match(":=");
		Term body = Telescope.lambdas(bs, parseTerm(scope));
		match(".");
		if (type == null) {
			type = new TypeInference(environment).infer(Context.EMPTY, body);
		}
		checkFresh(name);
		environment.define(name.text, type, body);
	}

	/**
	 * Parse an axiom, of the form:
	 *
	 * <pre>
	 * Axiom ::= 'Axiom' Ident ':' Term '.'
	 * </pre>
	 */
	public void parseAxiom() {
		matchKeyword("Axiom");
		Identifier name = matchIdentifier();
		match(":");
		Term type = parseTerm(Scope.EMPTY);
		match(".");
		checkFresh(name);
		environment.define(name.text, type, null);
	}

	/**
	 * Parse a term, of the form:
	 *
	 * <pre>
	 * Term ::= 'fun' Binders '=>' Term
	 *        | 'forall' Binders ',' Term
	 *        | 'let' Ident ':' Term ':=' Term 'in' Term
	 *        | App ('->' Term)?
	 * </pre>
	 *
	 * @param scope
	 * @return
	 */
	public Term parseTerm(Scope scope) {
		checkNotEof();
		Token lookahead = tokens.get(index);
		if (lookahead.text.equals("fun")) {
			return parseLambda(scope);
		} else if (lookahead.text.equals("forall")) {
			return parsePi(scope);
		} else if (lookahead.text.equals("let")) {
			return parseLet(scope);
		} else {
			return parseArrow(scope);
		}
	}

	private Term parseLambda(Scope scope) {
		matchKeyword("fun");
		ArrayList<Binding> bindings = new ArrayList<>();
		scope = parseBinders(scope, bindings);
		match("=>");
		Term body = parseTerm(scope);
		return Telescope.lambdas(bindings.toArray(new Binding[bindings.size()]), body);
	}

	private Term parsePi(Scope scope) {
		matchKeyword("forall");
		ArrayList<Binding> bindings = new ArrayList<>();
		scope = parseBinders(scope, bindings);
		match(",");
		Term body = parseTerm(scope);
		return Telescope.products(bindings.toArray(new Binding[bindings.size()]), body);
	}

	private Term parseLet(Scope scope) {
		int start = index;
		matchKeyword("let");
		Identifier name = matchIdentifier();
		match(":");
		Term type = parseTerm(scope);
		match(":=");
		Term value = parseTerm(scope);
		matchKeyword("in");
		Term body = parseTerm(scope.bind(name.text));
		return new Term.Let(name.text, value, type, body, sourceAttr(start, index - 1));
	}

	private Term parseArrow(Scope scope) {
		int start = index;
		Term lhs = parseApplication(scope);
		if (index < tokens.size() && tokens.get(index) instanceof Arrow) {
			match("->");
			Term rhs = parseTerm(scope.bind("_"));
			return new Term.Pi("_", lhs, rhs, sourceAttr(start, index - 1));
		}
		return lhs;
	}

	/**
	 * Parse an application, of the form:
	 *
	 * <pre>
	 * App ::= Ident Postfix*
	 *       | 'elim' Ident '[' Terms ']' Postfix '{' Cases '}' '[' Terms ']' Postfix
	 *       | 'case' Ident Postfix Postfix '{' Cases '}'
	 *       | Postfix Postfix*
	 * </pre>
	 *
	 * Where the head names a constructor, exactly as many arguments as the
	 * constructor expects (including parameters) are read.
	 *
	 * @param scope
	 * @return
	 */
	private Term parseApplication(Scope scope) {
		checkNotEof();
		Token lookahead = tokens.get(index);
		Term head;
		if (isConstructor(scope, lookahead)) {
			return parseConstruct(scope);
		} else if (lookahead.text.equals("elim")) {
			head = parseEliminate(scope);
		} else if (lookahead.text.equals("case")) {
			head = parseCase(scope);
		} else {
			head = parsePostfix(scope);
		}
		ArrayList<Term> arguments = new ArrayList<>();
		while (isAtomStart()) {
			arguments.add(parsePostfix(scope));
		}
		return Terms.apply(head, arguments.toArray(new Term[arguments.size()]));
	}

	private Term parseConstruct(Scope scope) {
		int start = index;
		Identifier name = matchIdentifier();
		TypeDeclaration declaration = environment.ownerOf(name.text);
		int i = constructorIndex(declaration, name.text);
		int arity = declaration.parameters().length + declaration.constructor(i).arguments().length;
		ArrayList<Term> arguments = new ArrayList<>();
		while (arguments.size() < arity && isAtomStart()) {
			arguments.add(parsePostfix(scope));
		}
		if (arguments.size() < arity) {
			syntaxError("constructor " + name.text + " must be fully applied", name);
		}
		return new Term.Construct(declaration.name(), i, name.text, arguments.toArray(new Term[arity]),
				sourceAttr(start, index - 1));
	}

	private Term parseEliminate(Scope scope) {
		int start = index;
		matchKeyword("elim");
		Identifier name = matchIdentifier();
		TypeDeclaration declaration = getDeclaration(name);
		Term[] parameters = parseList(scope, declaration.parameters().length, name);
		Term motive = parsePostfix(scope);
		Term[] cases = parseCases(scope, declaration.constructors().length, name);
		Term[] indices = parseList(scope, declaration.indices().length, name);
		Term scrutinee = parsePostfix(scope);
		return new Term.Eliminate(declaration.name(), parameters, motive, cases, indices, scrutinee,
				sourceAttr(start, index - 1));
	}

	private Term parseCase(Scope scope) {
		int start = index;
		matchKeyword("case");
		Identifier name = matchIdentifier();
		TypeDeclaration declaration = getDeclaration(name);
		Term motive = parsePostfix(scope);
		Term scrutinee = parsePostfix(scope);
		Term[] branches = parseCases(scope, declaration.constructors().length, name);
		return new Term.Case(declaration.name(), motive, scrutinee, branches, sourceAttr(start, index - 1));
	}

	/**
	 * Parse a term followed by zero or more projections, such as
	 * <code>s.1</code>.
	 *
	 * @param scope
	 * @return
	 */
	private Term parsePostfix(Scope scope) {
		int start = index;
		Term t = parseAtom(scope);
		while (index < tokens.size() && tokens.get(index) instanceof Projection) {
			Projection p = match(Projection.class, "a projection");
			t = new Term.Project(p.field - 1, t, sourceAttr(start, index - 1));
		}
		return t;
	}

	private Term parseAtom(Scope scope) {
		checkNotEof();
		int start = index;
		Token lookahead = tokens.get(index);
		if (lookahead instanceof LeftBrace) {
			match("(");
			Term t = parseTerm(scope);
			match(")");
			return t;
		} else if (lookahead instanceof Int) {
			return numeral(match(Int.class, "an integer"));
		} else if (lookahead.text.equals("Type")) {
			matchKeyword("Type");
			return Term.Sort.TYPE;
		} else if (lookahead.text.equals("Prop")) {
			matchKeyword("Prop");
			return Term.Sort.PROP;
		}
		Identifier name = matchIdentifier();
		int i = scope.indexOf(name.text);
		if (i >= 0) {
			return new Term.Variable(i, sourceAttr(start, index - 1));
		} else if (environment.ownerOf(name.text) != null) {
			// Constructor in argument position
			TypeDeclaration declaration = environment.ownerOf(name.text);
			int c = constructorIndex(declaration, name.text);
			if (declaration.parameters().length + declaration.constructor(c).arguments().length != 0) {
				syntaxError("constructor " + name.text + " must be fully applied", name);
			}
			return new Term.Construct(declaration.name(), c, name.text, new Term[0], sourceAttr(start, index - 1));
		} else if (environment.isDeclared(name.text) || name.text.equals(declaring)) {
			return new Term.Global(name.text, sourceAttr(start, index - 1));
		}
		syntaxError("unknown identifier " + name.text, name);
		return null; // deadcode
	}

	/**
	 * Parse a sequence of parenthesised binder groups, such as
	 * <code>(x y : T) (z : U)</code>, adding them to a given list.
	 *
	 * @param scope
	 * @param bindings
	 * @return The scope extended with all binders.
	 */
	private Scope parseBinderGroups(Scope scope, List<Binding> bindings) {
		while (index < tokens.size() && tokens.get(index) instanceof LeftBrace) {
			match("(");
			scope = parseBinderGroup(scope, bindings);
			match(")");
		}
		return scope;
	}

	/**
	 * Parse the binders of an abstraction or product. These are either one or
	 * more parenthesised groups, or a single group without parentheses.
	 *
	 * @param scope
	 * @param bindings
	 * @return
	 */
	private Scope parseBinders(Scope scope, List<Binding> bindings) {
		checkNotEof();
		if (tokens.get(index) instanceof LeftBrace) {
			return parseBinderGroups(scope, bindings);
		} else {
			return parseBinderGroup(scope, bindings);
		}
	}

	private Scope parseBinderGroup(Scope scope, List<Binding> bindings) {
		ArrayList<Identifier> names = new ArrayList<>();
		do {
			names.add(matchIdentifier());
		} while (index < tokens.size() && tokens.get(index) instanceof Identifier);
		match(":");
		Term type = parseTerm(scope);
		for (int i = 0; i != names.size(); ++i) {
			// Each later binder sees the earlier ones
			bindings.add(new Binding(names.get(i).text, Terms.shift(type, i)));
			scope = scope.bind(names.get(i).text);
		}
		return scope;
	}

	private Term[] parseList(Scope scope, int expected, Token owner) {
		match("[");
		ArrayList<Term> terms = new ArrayList<>();
		while (index < tokens.size() && !(tokens.get(index) instanceof RightSquare)) {
			if (!terms.isEmpty()) {
				match(",");
			}
			terms.add(parseTerm(scope));
		}
		match("]");
		if (terms.size() != expected) {
			syntaxError("expecting " + expected + " parameters or indices for " + owner.text, owner);
		}
		return terms.toArray(new Term[terms.size()]);
	}

	private Term[] parseCases(Scope scope, int expected, Token owner) {
		match("{");
		ArrayList<Term> terms = new ArrayList<>();
		while (index < tokens.size() && !(tokens.get(index) instanceof RightCurly)) {
			if (!terms.isEmpty()) {
				match("|");
			}
			terms.add(parseTerm(scope));
		}
		match("}");
		if (terms.size() != expected) {
			syntaxError("expecting " + expected + " cases for " + owner.text, owner);
		}
		return terms.toArray(new Term[terms.size()]);
	}

	/**
	 * Construct a constructor from its declared type.
	 *
	 * @param name
	 * @param type
	 * @param declaring
	 * @param np
	 * @param nk
	 * @return
	 */
	private TypeDeclaration.Constructor constructor(Identifier name, Term type, String declaring, int np, int nk) {
		Telescope telescope = Telescope.ofProducts(type);
		int na = telescope.size();
		Term conclusion = telescope.body();
		Term[] arguments = Terms.arguments(conclusion);
		if (!Terms.isApplicationOf(conclusion, declaring) || arguments.length != np + nk) {
			syntaxError("constructor " + name.text + " must construct " + declaring, name);
		}
		for (int i = 0; i != np; ++i) {
			if (!arguments[i].equals(new Term.Variable(na + np - 1 - i))) {
				syntaxError("constructor " + name.text + " must not vary parameters", name);
			}
		}
		return new TypeDeclaration.Constructor(name.text, telescope.bindings(),
				Arrays.copyOfRange(arguments, np, np + nk));
	}

	private Term numeral(Int value) {
		TypeDeclaration nat = environment.declaration("nat");
		if (nat == null) {
			syntaxError("numerals require nat", value);
		}
		Term t = nat.construct(constructorIndex(nat, "O"), new Term[0], new Term[0]);
		int s = constructorIndex(nat, "S");
		for (int i = 0; i < value.value; ++i) {
			t = nat.construct(s, new Term[0], new Term[] { t });
		}
		return t;
	}

	private static int constructorIndex(TypeDeclaration declaration, String name) {
		TypeDeclaration.Constructor[] constructors = declaration.constructors();
		for (int i = 0; i != constructors.length; ++i) {
			if (constructors[i].name().equals(name)) {
				return i;
			}
		}
		return -1;
	}

	private boolean isConstructor(Scope scope, Token t) {
		return t instanceof Identifier && scope.indexOf(t.text) < 0 && environment.ownerOf(t.text) != null;
	}

	private boolean isAtomStart() {
		if (index >= tokens.size()) {
			return false;
		}
		Token t = tokens.get(index);
		return t instanceof Identifier || t instanceof Int || t instanceof LeftBrace || t.text.equals("Type")
				|| t.text.equals("Prop");
	}

	private TypeDeclaration getDeclaration(Identifier name) {
		TypeDeclaration d = environment.declaration(name.text);
		if (d == null) {
			syntaxError("unknown inductive type " + name.text, name);
		}
		return d;
	}

	private void declare(TypeDeclaration declaration, Identifier name) {
		checkFresh(name);
		for (TypeDeclaration.Constructor c : declaration.constructors()) {
			if (environment.isDeclared(c.name())) {
				syntaxError("constructor " + c.name() + " already declared", name);
			}
		}
		environment.declare(declaration);
	}

	private void checkFresh(Identifier name) {
		if (environment.isDeclared(name.text)) {
			syntaxError(name.text + " already declared", name);
		}
	}

	private void checkNotEof() {
		if (index >= tokens.size()) {
			throw new SyntaxError("unexpected end-of-file", sourcefile, index - 1, index - 1);
		}
		return;
	}

	private Token match(String op) {
		checkNotEof();
		Token t = tokens.get(index);
		if (!t.text.equals(op)) {
			syntaxError("expecting '" + op + "', found '" + t.text + "'", t);
		}
		index = index + 1;
		return t;
	}

	private Token match(String... options) {
		checkNotEof();
		Token t = tokens.get(index);
		for (int i = 0; i != options.length; ++i) {
			if (t.text.equals(options[i])) {
				index = index + 1;
				return t;
			}
		}
		String s = "";
		for (int i = 0; i != options.length; ++i) {
			if (i != 0) {
				s += " or ";
			}
			s += "'" + options[i] + "'";
		}
		syntaxError("expecting " + s + ", found '" + t.text + "'", t);
		return null;
	}

	@SuppressWarnings("unchecked")
	private <T extends Token> T match(Class<T> c, String name) {
		checkNotEof();
		Token t = tokens.get(index);
		if (!c.isInstance(t)) {
			syntaxError("expecting " + name + ", found '" + t.text + "'", t);
		}
		index = index + 1;
		return (T) t;
	}

	private Identifier matchIdentifier() {
		checkNotEof();
		Token t = tokens.get(index);
		if (t instanceof Identifier) {
			Identifier i = (Identifier) t;
			index = index + 1;
			return i;
		}
		syntaxError("identifier expected", t);
		return null; // unreachable.
	}

	private Keyword matchKeyword(String keyword) {
		checkNotEof();
		Token t = tokens.get(index);
		if (t instanceof Keyword) {
			if (t.text.equals(keyword)) {
				index = index + 1;
				return (Keyword) t;
			}
		}
		syntaxError("keyword " + keyword + " expected.", t);
		return null;
	}

	private Attribute.Source sourceAttr(int start, int end) {
		Token t1 = tokens.get(start);
		Token t2 = tokens.get(end);
		return new Attribute.Source(t1.start, t2.end());
	}

	private void syntaxError(String msg, Token t) {
		throw new SyntaxError(msg, sourcefile, t.start, t.start + t.text.length() - 1);
	}

	/**
	 * The names of the variables bound at the point a term is read, innermost
	 * first.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Scope {
		public static final Scope EMPTY = new Scope(null, null);

		private final Scope parent;
		private final String name;

		private Scope(Scope parent, String name) {
			this.parent = parent;
			this.name = name;
		}

		public Scope bind(String name) {
			return new Scope(this, name);
		}

		/**
		 * Get the de Bruijn index of a given name, or <code>-1</code> if it is
		 * not bound. Anonymous binders cannot be referred to.
		 *
		 * @param name
		 * @return
		 */
		public int indexOf(String name) {
			int i = 0;
			for (Scope s = this; s.parent != null; s = s.parent, ++i) {
				if (s.name.equals(name) && !name.equals("_")) {
					return i;
				}
			}
			return -1;
		}
	}
}
