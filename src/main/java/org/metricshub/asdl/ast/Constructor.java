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
 * One alternative of a {@link Sum}, with its own fields.
 */
public final class Constructor extends AsdlNode {

	private final String name;
	private final List<Field> fields;

	/**
	 * @param name constructor name, starting with an upper-case letter
	 * @param fields the fields, {@code null} or empty when none
	 */
	public Constructor(String name, List<Field> fields) {
		this.name = name;
		this.fields = fields == null
				? Collections.<Field>emptyList()
				: Collections.unmodifiableList(new ArrayList<Field>(fields));
	}

	public Constructor(String name) {
		this(name, null);
	}

	public String getName() {
		return name;
	}

	public List<Field> getFields() {
		return fields;
	}

	@Override
	public <A> void accept(AsdlVisitor<A> visitor, A arg) {
		visitor.visitConstructor(this, arg);
	}

	@Override
	public String toString() {
		return "Constructor(" + name + ", " + fields + ")";
	}
}
