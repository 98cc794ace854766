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

/**
 * One classified lexeme: its kind, its literal text and the 1-based
 * line on which it begins.
 */
public final class Token {

	private final TokenKind kind;
	private final String value;
	private final int lineNumber;

	/**
	 * @param kind token kind
	 * @param value literal text of the token
	 * @param lineNumber 1-based line on which the token begins
	 */
	public Token(TokenKind kind, String value, int lineNumber) {
		this.kind = kind;
		this.value = value;
		this.lineNumber = lineNumber;
	}

	public TokenKind getKind() {
		return kind;
	}

	public String getValue() {
		return value;
	}

	public int getLineNumber() {
		return lineNumber;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return "Token(" + kind.name() + ", " + value + ", " + lineNumber + ")";
	}
}
