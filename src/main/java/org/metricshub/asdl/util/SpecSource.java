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

import java.io.IOException;

/**
 * Represents the content of one ASDL specification.
 * This is usually either a string handed over programmatically,
 * or an "*.asdl" file given as a path on the command line.
 */
public class SpecSource {

	/** Description used for sources that do not come from a file. */
	public static final String DESCRIPTION_INLINE_SPEC = "<inline-spec>";

	private final String description;
	private final String contents;

	/**
	 * <p>
	 * Constructor for SpecSource.
	 * </p>
	 *
	 * @param description a {@link java.lang.String} object
	 * @param contents the complete text of the specification
	 */
	public SpecSource(String description, String contents) {
		this.description = description;
		this.contents = contents;
	}

	/**
	 * <p>
	 * Getter for the field <code>description</code>.
	 * </p>
	 *
	 * @return a {@link java.lang.String} object
	 */
	public final String getDescription() {
		return description;
	}

	/**
	 * Obtain the full text of the specification.
	 *
	 * @return the specification text
	 * @throws java.io.IOException if the contents cannot be read
	 */
	public String getContents() throws IOException {
		return contents;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getDescription();
	}
}
