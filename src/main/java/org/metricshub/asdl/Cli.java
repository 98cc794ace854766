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
import java.nio.file.Path;
import java.nio.file.Paths;
import org.metricshub.asdl.ast.Module;
import org.metricshub.asdl.check.CheckReport;
import org.metricshub.asdl.util.AsdlSettings;
import org.metricshub.asdl.util.BuiltinTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line interface for Jasdl: parses one specification file, checks
 * it and reports the result.
 */
public final class Cli {

	private static final Logger LOG = LoggerFactory.getLogger(Cli.class);

	/** Exit code of a valid specification. */
	public static final int EXIT_OK = 0;

	/** Exit code of a specification that failed to parse or check. */
	public static final int EXIT_INVALID = 1;

	/** Exit code of unusable command-line arguments. */
	public static final int EXIT_USAGE = 2;

	private final AsdlSettings settings = new AsdlSettings();
	private final PrintStream out;

	private Path specFile;
	private boolean printUsage;
	private boolean quiet;

	/**
	 * Creates a CLI instance wired to the standard output stream.
	 */
	public Cli() {
		this(System.out);
	}

	/**
	 * @param out stream where the tree, diagnostics and summary are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out) {
		this.out = out;
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link AsdlSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public AsdlSettings getSettings() {
		return settings;
	}

	/**
	 * @return the specification file given on the command line, or {@code null}
	 */
	public Path getSpecFile() {
		return specFile;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 * @throws IllegalArgumentException on an unknown option or a missing file
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				break;
			} else if (arg.equals("--dump-syntax")) {
				// --dump-syntax : print the parsed tree
				settings.setDumpSyntaxTree(true);
			} else if (arg.equals("--legacy-builtins")) {
				// --legacy-builtins : boolean is not a built-in type
				settings.setBuiltinTypes(BuiltinTypes.LEGACY);
			} else if (arg.equals("-q")) {
				// -q : no summary line
				quiet = true;
			} else if (arg.equals("-h") || arg.equals("-?")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (argIdx >= args.length) {
			throw new IllegalArgumentException("ASDL file not provided.");
		}
		specFile = Paths.get(args[argIdx++]);
		if (argIdx < args.length) {
			throw new IllegalArgumentException("Unexpected argument: " + args[argIdx]);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @return {@link #EXIT_OK} if the specification is valid, {@link #EXIT_INVALID} otherwise
	 * @throws Exception if the file cannot be read or parsed
	 */
	public int run() throws Exception {
		if (printUsage) {
			usage(out);
			return EXIT_OK;
		}
		LOG.debug("Settings:\n{}", settings.toDescriptionString());

		Asdl asdl = new Asdl(settings);
		Module module = asdl.parseFile(specFile);
		if (settings.isDumpSyntaxTree()) {
			out.println(module);
		}
		CheckReport report = asdl.checkReport(module);
		if (!quiet) {
			out.println(
					"Module " + module.getName() + ": " + module.getDfns().size() + " definition(s), "
							+ (report.isValid() ? "valid" : report.getErrorCount() + " error(s)"));
		}
		return report.isValid() ? EXIT_OK : EXIT_INVALID;
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest.println("java -jar jasdl.jar [--dump-syntax] [--legacy-builtins] [-q] file.asdl");
		dest.println();
		dest.println(" --dump-syntax = Print the parsed tree.");
		dest.println(" --legacy-builtins = Do not accept boolean as a built-in type.");
		dest.println(" -q = Do not print the summary line.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}
}
