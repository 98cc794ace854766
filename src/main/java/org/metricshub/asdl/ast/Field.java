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

/**
 * A typed field: {@code type}, {@code type name}, {@code type* name} or
 * {@code type? name}.
 */
public final class Field extends AsdlNode {

	private final String type;
	private final String name;
	private final boolean seq;
	private final boolean opt;

	/**
	 * @param type name of a built-in type or of a type of the module
	 * @param name field name, or {@code null}
	 * @param seq the field holds a sequence of {@code type}
	 * @param opt the field may be absent
	 * @throws IllegalArgumentException if both {@code seq} and {@code opt} are set
	 */
	public Field(String type, String name, boolean seq, boolean opt) {
		if (seq && opt) {
			throw new IllegalArgumentException("Field " + type + " cannot be both a sequence and optional");
		}
		this.type = type;
		this.name = name;
		this.seq = seq;
		this.opt = opt;
	}

	public Field(String type, String name) {
		this(type, name, false, false);
	}

	public String getType() {
		return type;
	}

	/**
	 * @return the field name, or {@code null} for an unnamed field
	 */
	public String getName() {
		return name;
	}

	public boolean isSeq() {
		return seq;
	}

	public boolean isOpt() {
		return opt;
	}

	@Override
	public <A> void accept(AsdlVisitor<A> visitor, A arg) {
		visitor.visitField(this, arg);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("Field(").append(type);
		if (name != null) {
			sb.append(", ").append(name);
		}
		if (seq) {
			sb.append(", seq=True");
		} else if (opt) {
			sb.append(", opt=True");
		}
		return sb.append(')').toString();
	}
}
