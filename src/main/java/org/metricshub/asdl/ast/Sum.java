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
 * A tagged union: {@code A(...) | B(...) attributes (...)}.
 * Every constructor shares the attributes of the sum.
 */
public final class Sum extends TypeValue {

	private final List<Constructor> types;

	/**
	 * @param types the constructors, at least one
	 * @param attributes shared attributes, {@code null} or empty when none
	 */
	public Sum(List<Constructor> types, List<Field> attributes) {
		super(attributes);
		if (types.isEmpty()) {
			throw new IllegalArgumentException("A sum needs at least one constructor");
		}
		this.types = Collections.unmodifiableList(new ArrayList<Constructor>(types));
	}

	public Sum(List<Constructor> types) {
		this(types, null);
	}

	/**
	 * @return the constructors, in source order
	 */
	public List<Constructor> getTypes() {
		return types;
	}

	@Override
	public <A> void accept(AsdlVisitor<A> visitor, A arg) {
		visitor.visitSum(this, arg);
	}

	@Override
	public String toString() {
		return render("Sum", types);
	}
}
