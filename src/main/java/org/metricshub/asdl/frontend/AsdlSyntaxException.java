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
 * Thrown when an ASDL specification cannot be tokenized or parsed.
 * Parsing stops at the first syntax error; no partial tree is produced.
 */
public class AsdlSyntaxException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String reason;
	private final String sourceDescription;
	private final int lineNumber;

	/**
	 * Creates a syntax error without line information.
	 *
	 * @param reason what went wrong
	 */
	public AsdlSyntaxException(String reason) {
		this(reason, null, -1);
	}

	/**
	 * <p>
	 * Constructor for AsdlSyntaxException.
	 * </p>
	 *
	 * @param reason what went wrong
	 * @param sourceDescription description of the source being parsed, may be {@code null}
	 * @param lineno line of the offending input, or {@code -1} when unknown
	 */
	public AsdlSyntaxException(String reason, String sourceDescription, int lineno) {
		super("Syntax error on line " + (lineno >= 0 ? String.valueOf(lineno) : "<unknown>") + ": " + reason);
		this.reason = reason;
		this.sourceDescription = sourceDescription;
		this.lineNumber = lineno;
	}

	/**
	 * @return the message without the line prefix
	 */
	public String getReason() {
		return reason;
	}

	/**
	 * @return the description of the source being parsed, or {@code null}
	 */
	public String getSourceDescription() {
		return sourceDescription;
	}

	/**
	 * Returns the line number associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return lineNumber;
	}
}
