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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Field type names that never need a definition inside a module.
 */
public final class BuiltinTypes {

	/**
	 * The original set of ASDL primitives, without {@code boolean}.
	 */
	public static final Set<String> LEGACY = Collections
			.unmodifiableSet(
					new LinkedHashSet<String>(
							Arrays.asList("identifier", "string", "bytes", "int", "object", "singleton")));

	/**
	 * The current set of primitives: {@link #LEGACY} plus {@code boolean}.
	 */
	public static final Set<String> DEFAULT;

	static {
		Set<String> all = new LinkedHashSet<String>(LEGACY);
		all.add("boolean");
		DEFAULT = Collections.unmodifiableSet(all);
	}

	private BuiltinTypes() {
		// utility class
	}
}
