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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Represents one ASDL specification file, read as UTF-8 on first access.
 */
public class SpecFileSource extends SpecSource {

	private final Path filePath;
	private String fileContents;

	/**
	 * <p>
	 * Constructor for SpecFileSource.
	 * </p>
	 *
	 * @param filePath path of the specification file
	 */
	public SpecFileSource(Path filePath) {
		super(filePath.toString(), null);
		this.filePath = filePath;
	}

	/**
	 * <p>
	 * Getter for the field <code>filePath</code>.
	 * </p>
	 *
	 * @return the path of the specification file
	 */
	public Path getFilePath() {
		return filePath;
	}

	/** {@inheritDoc} */
	@Override
	public String getContents() throws IOException {
		if (fileContents == null) {
			fileContents = new String(Files.readAllBytes(filePath), StandardCharsets.UTF_8);
		}
		return fileContents;
	}
}
