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
import java.util.List;

/**
 * Right-hand side of a definition: either a {@link Sum} or a {@link Product}.
 * Both may carry trailing attributes.
 */
public abstract class TypeValue extends AsdlNode {

	private final List<Field> attributes;

	TypeValue(List<Field> attributes) {
		this.attributes = attributes == null
				? Collections.<Field>emptyList()
				: Collections.unmodifiableList(new ArrayList<Field>(attributes));
	}

	/**
	 * @return the attribute fields, empty when none were declared
	 */
	public List<Field> getAttributes() {
		return attributes;
	}

	/**
	 * Renders {@code Kind(items)} or {@code Kind(items, attributes)}.
	 */
	String render(String kind, List<?> items) {
		if (attributes.isEmpty()) {
			return kind + "(" + items + ")";
		}
		return kind + "(" + items + ", " + attributes + ")";
	}
}
