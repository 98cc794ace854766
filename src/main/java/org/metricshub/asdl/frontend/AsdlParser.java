package org.metricshub.asdl.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jasdl
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.metricshub.asdl.ast.Constructor;
import org.metricshub.asdl.ast.Field;
import org.metricshub.asdl.ast.Module;
import org.metricshub.asdl.ast.Product;
import org.metricshub.asdl.ast.Sum;
import org.metricshub.asdl.ast.Type;
import org.metricshub.asdl.ast.TypeValue;
import org.metricshub.asdl.util.SpecSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts an ASDL specification into a {@link Module} tree.
 * <p>
 * Recursive descent with one token of lookahead, pulled from an
 * {@link AsdlLexer}. The grammar is:
 *
 * <pre>
 * module      ::= "module" Id "{" definitions "}"
 * definitions ::= { TypeId "=" type }
 * type        ::= product | sum
 * product     ::= fields [ "attributes" fields ]
 * sum         ::= constructor { "|" constructor } [ "attributes" fields ]
 * constructor ::= ConstructorId [ fields ]
 * fields      ::= "(" field { "," field } ")"
 * field       ::= TypeId [ "?" | "*" ] [ Id ]
 * </pre>
 *
 * Type references are not resolved here: a field may name a type defined
 * further down. See {@link org.metricshub.asdl.check.AsdlChecker}.
 */
public class AsdlParser {

	private static final Logger LOG = LoggerFactory.getLogger(AsdlParser.class);

	private static final Set<TokenKind> ID_KINDS = EnumSet.of(TokenKind.CONSTRUCTOR_ID, TokenKind.TYPE_ID);

	private static final String KW_MODULE = "module";
	private static final String KW_ATTRIBUTES = "attributes";

	private AsdlLexer lexer;
	private String sourceDescription;
	private Token curToken;

	/**
	 * Parse the ASDL in the buffer and return a tree with a {@link Module} root.
	 *
	 * @param buf the complete specification text
	 * @return the parsed module
	 * @throws AsdlSyntaxException upon a lexical or grammatical error
	 */
	public Module parse(String buf) {
		return parse(buf, SpecSource.DESCRIPTION_INLINE_SPEC);
	}

	/**
	 * Parse the specification held by {@code source}.
	 *
	 * @param source the specification source
	 * @return the parsed module
	 * @throws IOException if the source cannot be read
	 * @throws AsdlSyntaxException upon a lexical or grammatical error
	 */
	public Module parse(SpecSource source) throws IOException {
		if (source == null) {
			throw new IOException("No source supplied");
		}
		return parse(source.getContents(), source.getDescription());
	}

	private Module parse(String buf, String description) {
		LOG.debug("Parsing {}", description);
		sourceDescription = description;
		lexer = new AsdlLexer(buf, description);
		curToken = null;
		advance();
		Module module = MODULE();
		match(TokenKind.EOF);
		LOG.debug("Parsed module {} from {}: {} definition(s)", module.getName(), description, module.getDfns().size());
		return module;
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName
	// MODULE : "module" Id "{" DEFINITIONS "}"
	Module MODULE() {
		if (!atKeyword(KW_MODULE)) {
			throw parserException("Expecting \"" + KW_MODULE + "\". Found: " + describe(curToken));
		}
		advance();
		String name = match(ID_KINDS);
		match(TokenKind.OPEN_BRACE);
		List<Type> defs = DEFINITIONS();
		match(TokenKind.CLOSE_BRACE);
		return new Module(name, defs);
	}

	// DEFINITIONS : { TypeId "=" TYPE }
	List<Type> DEFINITIONS() {
		List<Type> defs = new ArrayList<Type>();
		while (curToken.getKind() == TokenKind.TYPE_ID) {
			String typeName = advance();
			match(TokenKind.EQUALS);
			defs.add(new Type(typeName, TYPE()));
		}
		return defs;
	}

	// TYPE : PRODUCT | SUM
	TypeValue TYPE() {
		// a product opens with its field list, a sum with a constructor
		if (curToken.getKind() == TokenKind.OPEN_PAREN) {
			return PRODUCT();
		}
		return SUM();
	}

	// PRODUCT : FIELDS [ "attributes" FIELDS ]
	Product PRODUCT() {
		List<Field> fields = FIELDS();
		return new Product(fields, optAttributes());
	}

	// SUM : CONSTRUCTOR { "|" CONSTRUCTOR } [ "attributes" FIELDS ]
	Sum SUM() {
		List<Constructor> constructors = new ArrayList<Constructor>();
		constructors.add(CONSTRUCTOR());
		while (curToken.getKind() == TokenKind.PIPE) {
			advance();
			constructors.add(CONSTRUCTOR());
		}
		return new Sum(constructors, optAttributes());
	}

	// CONSTRUCTOR : ConstructorId [ FIELDS ]
	Constructor CONSTRUCTOR() {
		String name = match(TokenKind.CONSTRUCTOR_ID);
		if (curToken.getKind() == TokenKind.OPEN_PAREN) {
			return new Constructor(name, FIELDS());
		}
		return new Constructor(name);
	}

	// FIELDS : "(" FIELD { "," FIELD } ")"
	List<Field> FIELDS() {
		List<Field> fields = new ArrayList<Field>();
		match(TokenKind.OPEN_PAREN);
		fields.add(FIELD());
		while (curToken.getKind() == TokenKind.COMMA) {
			advance();
			fields.add(FIELD());
		}
		match(TokenKind.CLOSE_PAREN);
		return fields;
	}

	// FIELD : TypeId [ "?" | "*" ] [ Id ]
	Field FIELD() {
		String typeName = match(TokenKind.TYPE_ID);
		boolean seq = false;
		boolean opt = false;
		if (curToken.getKind() == TokenKind.ASTERISK) {
			seq = true;
			advance();
		} else if (curToken.getKind() == TokenKind.QUESTION_MARK) {
			opt = true;
			advance();
		}
		String name = ID_KINDS.contains(curToken.getKind()) ? advance() : null;
		return new Field(typeName, name, seq, opt);
	}
	// CHECKSTYLE.ON: MethodName

	// SUPPORTING FUNCTIONS/METHODS
	private List<Field> optAttributes() {
		if (atKeyword(KW_ATTRIBUTES)) {
			advance();
			return FIELDS();
		}
		return null;
	}

	/**
	 * Returns the value of the current token and reads the next one.
	 */
	private String advance() {
		String value = curToken == null ? null : curToken.getValue();
		curToken = lexer.hasNext() ? lexer.next() : curToken;
		return value;
	}

	private String match(TokenKind kind) {
		return match(EnumSet.of(kind));
	}

	/**
	 * The 'match' primitive of recursive descent parsers: verifies that the
	 * current token is of one of the given kinds, returns its value and reads
	 * the next token.
	 */
	private String match(Set<TokenKind> kinds) {
		if (!kinds.contains(curToken.getKind())) {
			throw parserException(
					"Expecting "
							+ kinds.stream().map(TokenKind::name).collect(Collectors.joining(" or "))
							+ ". Found: "
							+ describe(curToken));
		}
		return advance();
	}

	private boolean atKeyword(String keyword) {
		return curToken.getKind() == TokenKind.TYPE_ID && curToken.getValue().equals(keyword);
	}

	private static String describe(Token token) {
		if (token.getKind() == TokenKind.EOF) {
			return TokenKind.EOF.name();
		}
		return token.getKind().name() + " (" + token.getValue() + ")";
	}

	private ParserException parserException(String msg) {
		return new ParserException(msg, sourceDescription, curToken.getLineNumber());
	}
}
