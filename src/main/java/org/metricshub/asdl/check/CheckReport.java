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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one {@link AsdlChecker} run: the number of errors found and
 * every diagnostic line printed while finding them.
 */
public final class CheckReport {

	private final int errorCount;
	private final List<String> diagnostics;

	CheckReport(int errorCount, List<String> diagnostics) {
		this.errorCount = errorCount;
		this.diagnostics = Collections.unmodifiableList(new ArrayList<String>(diagnostics));
	}

	/**
	 * @return {@code true} if no error was found
	 */
	public boolean isValid() {
		return errorCount == 0;
	}

	public int getErrorCount() {
		return errorCount;
	}

	/**
	 * @return the diagnostic lines, in the order they were reported
	 */
	public List<String> getDiagnostics() {
		return diagnostics;
	}

	@Override
	public String toString() {
		return "CheckReport(errors=" + errorCount + ", " + diagnostics + ")";
	}
}
