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

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits an ASDL buffer into {@link Token}s.
 * <p>
 * Tokens are produced lazily, one per call to {@link #next()}. The sequence
 * is single pass: once the {@link TokenKind#EOF} token has been returned the
 * lexer is exhausted and cannot be restarted.
 * <p>
 * Comments start with {@code --} and run to the end of the line.
 */
public class AsdlLexer implements Iterator<Token> {

	private static final Pattern NON_WHITESPACE = Pattern.compile("\\S", Pattern.UNICODE_CHARACTER_CLASS);
	private static final Pattern NON_WORD = Pattern.compile("\\W", Pattern.UNICODE_CHARACTER_CLASS);

	private static final Map<Character, TokenKind> OPERATORS;

	static {
		Map<Character, TokenKind> operators = new HashMap<Character, TokenKind>();
		operators.put('=', TokenKind.EQUALS);
		operators.put(',', TokenKind.COMMA);
		operators.put('?', TokenKind.QUESTION_MARK);
		operators.put('|', TokenKind.PIPE);
		operators.put('(', TokenKind.OPEN_PAREN);
		operators.put(')', TokenKind.CLOSE_PAREN);
		operators.put('*', TokenKind.ASTERISK);
		operators.put('{', TokenKind.OPEN_BRACE);
		operators.put('}', TokenKind.CLOSE_BRACE);
		OPERATORS = Collections.unmodifiableMap(operators);
	}

	private final String buf;
	private final String sourceDescription;
	private final Matcher nonWhitespace;
	private final Matcher nonWord;
	private int pos;
	private int lineNumber = 1;
	private boolean exhausted;

	/**
	 * @param buf the complete specification text
	 * @param sourceDescription description used in error messages, may be {@code null}
	 */
	public AsdlLexer(String buf, String sourceDescription) {
		this.buf = buf;
		this.sourceDescription = sourceDescription;
		this.nonWhitespace = NON_WHITESPACE.matcher(buf);
		this.nonWord = NON_WORD.matcher(buf);
	}

	public AsdlLexer(String buf) {
		this(buf, null);
	}

	/**
	 * @return {@code false} once the {@link TokenKind#EOF} token has been returned
	 */
	@Override
	public boolean hasNext() {
		return !exhausted;
	}

	/**
	 * Scans and returns the next token.
	 *
	 * @return the next token, {@link TokenKind#EOF} at the end of the buffer
	 * @throws LexerException on a character that cannot start a token
	 * @throws NoSuchElementException if called after {@link TokenKind#EOF}
	 */
	@Override
	public Token next() {
		if (exhausted) {
			throw new NoSuchElementException("No token after end of input");
		}
		while (true) {
			if (!skipWhitespace()) {
				exhausted = true;
				return new Token(TokenKind.EOF, "", lineNumber);
			}
			int cp = buf.codePointAt(pos);
			if (Character.isLetter(cp)) {
				int end = nonWord.find(pos + Character.charCount(cp)) ? nonWord.start() : buf.length();
				String id = buf.substring(pos, end);
				pos = end;
				if (Character.isUpperCase(cp)) {
					return new Token(TokenKind.CONSTRUCTOR_ID, id, lineNumber);
				}
				return new Token(TokenKind.TYPE_ID, id, lineNumber);
			}
			if (cp == '-') {
				if (pos + 1 < buf.length() && buf.charAt(pos + 1) == '-') {
					// comment, the newline itself is counted by skipWhitespace()
					int eol = buf.indexOf('\n', pos + 2);
					pos = eol < 0 ? buf.length() : eol;
					continue;
				}
				throw invalidOperator(cp);
			}
			// every operator is a single BMP character
			TokenKind kind = Character.isBmpCodePoint(cp) ? OPERATORS.get((char) cp) : null;
			if (kind == null) {
				throw invalidOperator(cp);
			}
			pos++;
			return new Token(kind, String.valueOf((char) cp), lineNumber);
		}
	}

	/**
	 * Moves to the next non-whitespace character, counting the newlines crossed.
	 *
	 * @return {@code false} if the end of the buffer was reached
	 */
	private boolean skipWhitespace() {
		if (pos >= buf.length() || !nonWhitespace.find(pos)) {
			countNewlines(buf.length());
			pos = buf.length();
			return false;
		}
		countNewlines(nonWhitespace.start());
		pos = nonWhitespace.start();
		return true;
	}

	private void countNewlines(int end) {
		for (int i = pos; i < end; i++) {
			if (buf.charAt(i) == '\n') {
				lineNumber++;
			}
		}
	}

	private LexerException invalidOperator(int cp) {
		return lexerException("Invalid operator " + new String(Character.toChars(cp)));
	}

	private LexerException lexerException(String msg) {
		return new LexerException(msg, sourceDescription, lineNumber);
	}
}
