package org.metricshub.asdl.util;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A simple container for the parameters of a parse-and-check run.
 * These values have defaults, which may be changed through command line
 * arguments or programmatically.
 */
public class AsdlSettings {

	/**
	 * Where check diagnostics and tree dumps are printed;
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Type names accepted without a definition;
	 * {@link BuiltinTypes#DEFAULT} by default.
	 */
	private Set<String> builtinTypes = BuiltinTypes.DEFAULT;

	/**
	 * Whether to print the rendering of the parsed tree;
	 * <code>false</code> by default.
	 */
	private boolean dumpSyntaxTree = false;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("builtinTypes = ").append(getBuiltinTypes()).append(newLine);
		desc.append("dumpSyntaxTree = ").append(isDumpSyntaxTree()).append(newLine);

		return desc.toString();
	}

	/**
	 * @return the stream receiving diagnostics
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * @param pOutputStream the stream receiving diagnostics
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setOutputStream(PrintStream pOutputStream) {
		outputStream = pOutputStream;
	}

	/**
	 * @return an unmodifiable view of the built-in type names
	 */
	public Set<String> getBuiltinTypes() {
		return builtinTypes;
	}

	/**
	 * @param builtinTypes type names accepted without a definition
	 */
	public void setBuiltinTypes(Set<String> builtinTypes) {
		this.builtinTypes = Collections.unmodifiableSet(new LinkedHashSet<String>(builtinTypes));
	}

	/**
	 * @return whether the parsed tree is printed
	 */
	public boolean isDumpSyntaxTree() {
		return dumpSyntaxTree;
	}

	/**
	 * @param dumpSyntaxTree whether the parsed tree is printed
	 */
	public void setDumpSyntaxTree(boolean dumpSyntaxTree) {
		this.dumpSyntaxTree = dumpSyntaxTree;
	}
}
