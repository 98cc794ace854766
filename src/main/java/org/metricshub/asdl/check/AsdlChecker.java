package org.metricshub.asdl.check;

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
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.asdl.ast.Constructor;
import org.metricshub.asdl.ast.Field;
import org.metricshub.asdl.ast.Module;
import org.metricshub.asdl.ast.Product;
import org.metricshub.asdl.ast.Sum;
import org.metricshub.asdl.ast.Type;
import org.metricshub.asdl.ast.VisitorBase;
import org.metricshub.asdl.util.BuiltinTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a parsed ASDL tree for correctness:
 * <ul>
 * <li>a constructor name is defined only once in the whole module;
 * <li>every field type is either built in or defined in the module.
 * </ul>
 * Errors do not stop the check. Each one is printed to the output stream
 * and the verdict is {@code false} if any was found.
 */
public class AsdlChecker {

	private static final Logger LOG = LoggerFactory.getLogger(AsdlChecker.class);

	private final PrintStream out;
	private final Set<String> builtinTypes;

	/**
	 * Checker printing to {@code System.out} with {@link BuiltinTypes#DEFAULT}.
	 */
	public AsdlChecker() {
		this(System.out, BuiltinTypes.DEFAULT);
	}

	/**
	 * @param out where diagnostics are printed
	 * @param builtinTypes type names accepted without a definition
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public AsdlChecker(PrintStream out, Set<String> builtinTypes) {
		this.out = out;
		this.builtinTypes = Collections.unmodifiableSet(new LinkedHashSet<String>(builtinTypes));
	}

	/**
	 * Check the tree for correctness.
	 *
	 * @param module root of the tree
	 * @return {@code true} on success; on failure the errors have been printed
	 */
	public boolean check(Module module) {
		return checkReport(module).isValid();
	}

	/**
	 * Check the tree for correctness and keep the diagnostics.
	 *
	 * @param module root of the tree
	 * @return the error count and diagnostic transcript
	 */
	public CheckReport checkReport(Module module) {
		CheckVisitor v = new CheckVisitor();
		v.visit(module);

		for (Map.Entry<String, List<String>> use : v.typeUses.entrySet()) {
			String t = use.getKey();
			if (!module.getTypes().containsKey(t) && !builtinTypes.contains(t)) {
				v.error("Undefined type " + t + ", used in " + String.join(", ", use.getValue()));
			}
		}

		LOG.debug("Checked module {}: {} error(s)", module.getName(), v.errors);
		return new CheckReport(v.errors, v.diagnostics);
	}

	/**
	 * Collects constructor definitions and field type uses in one pass.
	 * The argument is the name of the enclosing type.
	 */
	private final class CheckVisitor extends VisitorBase<String> {

		/** Constructor name to the type that first defined it. */
		private final Map<String, String> cons = new LinkedHashMap<String, String>();

		/** Field type name to the types using it. */
		private final Map<String, List<String>> typeUses = new LinkedHashMap<String, List<String>>();

		private final List<String> diagnostics = new ArrayList<String>();
		private int errors;

		@Override
		public void visitModule(Module mod, String arg) {
			Set<String> seen = new HashSet<String>();
			for (Type dfn : mod.getDfns()) {
				if (!seen.add(dfn.getName())) {
					LOG
							.warn(
									"Type {} is defined more than once in module {}, the last definition wins",
									dfn.getName(),
									mod.getName());
				}
				visit(dfn);
			}
		}

		@Override
		public void visitType(Type type, String arg) {
			visit(type.getValue(), type.getName());
		}

		@Override
		public void visitSum(Sum sum, String name) {
			for (Constructor t : sum.getTypes()) {
				visit(t, name);
			}
			for (Field f : sum.getAttributes()) {
				visit(f, name);
			}
		}

		@Override
		public void visitConstructor(Constructor cons, String name) {
			String key = cons.getName();
			String conflict = this.cons.putIfAbsent(key, name);
			if (conflict != null) {
				error("Redefinition of constructor " + key, "Defined in " + conflict + " and " + name);
			}
			for (Field f : cons.getFields()) {
				visit(f, name);
			}
		}

		@Override
		public void visitProduct(Product prod, String name) {
			for (Field f : prod.getFields()) {
				visit(f, name);
			}
			for (Field f : prod.getAttributes()) {
				visit(f, name);
			}
		}

		@Override
		public void visitField(Field field, String name) {
			typeUses.computeIfAbsent(field.getType(), k -> new ArrayList<String>()).add(name);
		}

		private void error(String... lines) {
			errors++;
			for (String line : lines) {
				LOG.debug(line);
				diagnostics.add(line);
				out.println(line);
			}
		}
	}
}
