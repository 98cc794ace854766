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
 * A plain record: {@code (fields) attributes (...)}.
 */
public final class Product extends TypeValue {

	private final List<Field> fields;

	/**
	 * @param fields the record fields
	 * @param attributes trailing attributes, {@code null} or empty when none
	 */
	public Product(List<Field> fields, List<Field> attributes) {
		super(attributes);
		this.fields = Collections.unmodifiableList(new ArrayList<Field>(fields));
	}

	public Product(List<Field> fields) {
		this(fields, null);
	}

	public List<Field> getFields() {
		return fields;
	}

	@Override
	public <A> void accept(AsdlVisitor<A> visitor, A arg) {
		visitor.visitProduct(this, arg);
	}

	@Override
	public String toString() {
		return render("Product", fields);
	}
}
