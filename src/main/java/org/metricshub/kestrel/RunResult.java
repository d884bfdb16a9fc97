package org.metricshub.kestrel;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Kestrel
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
 * Outcome of running a whole script through {@link Kestrel#execute(String)}.
 */
public final class RunResult {

	private final Stage failedStage;
	private final List<String> diagnostics;

	RunResult(Stage failedStage, List<String> diagnostics) {
		this.failedStage = failedStage;
		this.diagnostics = Collections.unmodifiableList(new ArrayList<String>(diagnostics));
	}

	/**
	 * @return the stage which reported errors, or <code>null</code> when the
	 *         script ran to completion
	 */
	public Stage getFailedStage() {
		return failedStage;
	}

	/**
	 * @return the formatted errors of the failed stage, in order of detection;
	 *         empty on success
	 */
	public List<String> getDiagnostics() {
		return diagnostics;
	}

	public boolean isSuccess() {
		return failedStage == null;
	}

	@Override
	public String toString() {
		return isSuccess() ? "success" : failedStage + " " + diagnostics;
	}
}
