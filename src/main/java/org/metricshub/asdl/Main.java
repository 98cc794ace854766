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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;
import org.metricshub.asdl.frontend.AsdlSyntaxException;

/**
 * Entry point when Jasdl is executed as a stand-alone application.
 * If you want to use Jasdl as a library, please use {@link Asdl}.
 */
public final class Main {

	/** SLF4J system property controlling the reports of its own initialization. */
	static final String SLF4J_VERBOSITY_PROPERTY = "slf4j.internal.verbosity";

	static {
		// keep SLF4J from announcing its provider on every command-line run
		if (System.getProperty(SLF4J_VERBOSITY_PROPERTY) == null) {
			System.setProperty(SLF4J_VERBOSITY_PROPERTY, "WARN");
		}
	}

	@SuppressWarnings("unused")
	private Main() {}

	/**
	 * Runs the command line and maps failures to an exit code, printing them
	 * to {@code err}.
	 *
	 * @param args command-line arguments
	 * @param out stream for the tree, diagnostics and summary
	 * @param err stream for failures
	 * @return the process exit code
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static int run(String[] args, PrintStream out, PrintStream err) {
		try {
			Cli cli = new Cli(out);
			cli.parse(args);
			return cli.run();
		} catch (AsdlSyntaxException e) {
			err.printf("%s: %s\n", e.getSourceDescription(), e.getMessage());
			return Cli.EXIT_INVALID;
		} catch (IllegalArgumentException e) {
			err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			err.println(e.getMessage());
			return Cli.EXIT_USAGE;
		} catch (Exception e) {
			err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			return Cli.EXIT_INVALID;
		}
	}

	/**
	 * The entry point to Jasdl for the VM.
	 *
	 * @param args Command line arguments to the VM.
	 */
	public static void main(String[] args) {
		System.exit(run(args, System.out, System.err));
	}
}
