package org.metricshub.asdl.ast;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root of a parsed specification: {@code module Name { definitions }}.
 */
public final class Module extends AsdlNode {

	private final String name;
	private final List<Type> dfns;
	private final Map<String, TypeValue> types;

	/**
	 * @param name module name
	 * @param dfns type definitions, in source order
	 */
	public Module(String name, List<Type> dfns) {
		this.name = name;
		this.dfns = Collections.unmodifiableList(new ArrayList<Type>(dfns));
		Map<String, TypeValue> byName = new LinkedHashMap<String, TypeValue>();
		for (Type dfn : this.dfns) {
			// a later definition of the same name replaces the earlier one
			byName.put(dfn.getName(), dfn.getValue());
		}
		this.types = Collections.unmodifiableMap(byName);
	}

	public String getName() {
		return name;
	}

	public List<Type> getDfns() {
		return dfns;
	}

	/**
	 * @return the definitions keyed by type name, in source order
	 */
	public Map<String, TypeValue> getTypes() {
		return types;
	}

	@Override
	public <A> void accept(AsdlVisitor<A> visitor, A arg) {
		visitor.visitModule(this, arg);
	}

	@Override
	public String toString() {
		return "Module(" + name + ", " + dfns + ")";
	}
}
