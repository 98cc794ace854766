package org.metricshub.asdl;

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
import java.nio.file.Path;
import org.metricshub.asdl.ast.Module;
import org.metricshub.asdl.check.AsdlChecker;
import org.metricshub.asdl.check.CheckReport;
import org.metricshub.asdl.frontend.AsdlParser;
import org.metricshub.asdl.util.AsdlSettings;
import org.metricshub.asdl.util.SpecFileSource;
import org.metricshub.asdl.util.SpecSource;

/**
 * Entry point into the parsing and checking of an ASDL specification.
 * This entry point is used both when Jasdl is used as a library and when
 * invoked from the command line.
 * <p>
 * Processing happens in two steps:
 * <ul>
 * <li>Parse the specification, producing a {@link Module} tree. Malformed
 * input fails with an {@link org.metricshub.asdl.frontend.AsdlSyntaxException}.
 * <li>Check the tree: constructor names must be unique and every field type
 * must be built in or defined in the module. Errors are printed to the
 * configured output stream and reported through the boolean verdict.
 * </ul>
 * Instances hold no state between calls other than their settings.
 */
public class Asdl {

	private final AsdlSettings settings;

	/**
	 * Create a new instance with default settings.
	 */
	public Asdl() {
		this(new AsdlSettings());
	}

	/**
	 * @param settings output stream and built-in types to use
	 */
	public Asdl(AsdlSettings settings) {
		this.settings = settings;
	}

	/**
	 * Parse a specification held in memory.
	 *
	 * @param spec the complete specification text
	 * @return the parsed module
	 */
	public Module parse(String spec) {
		return new AsdlParser().parse(spec);
	}

	/**
	 * @param source the specification source
	 * @return the parsed module
	 * @throws IOException if the source cannot be read
	 */
	public Module parse(SpecSource source) throws IOException {
		return new AsdlParser().parse(source);
	}

	/**
	 * Read and parse a UTF-8 specification file.
	 *
	 * @param path the specification file
	 * @return the parsed module
	 * @throws IOException if the file cannot be read
	 */
	public Module parseFile(Path path) throws IOException {
		return parse(new SpecFileSource(path));
	}

	/**
	 * @param module a parsed module
	 * @return {@code true} if the module is valid
	 */
	public boolean check(Module module) {
		return checkReport(module).isValid();
	}

	/**
	 * @param module a parsed module
	 * @return the verdict with the diagnostics that were printed
	 */
	public CheckReport checkReport(Module module) {
		return new AsdlChecker(settings.getOutputStream(), settings.getBuiltinTypes()).checkReport(module);
	}
}
