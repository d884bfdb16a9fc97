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
 * Thrown by {@link Kestrel#run(String)} when a stage of the pipeline reports
 * errors. The message lists the diagnostics, one per line.
 */
public class KestrelException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final Stage stage;
	private final transient List<String> diagnostics;

	/**
	 * <p>
	 * Constructor for KestrelException.
	 * </p>
	 *
	 * @param stage the stage which failed
	 * @param diagnostics the formatted errors of that stage
	 */
	public KestrelException(Stage stage, List<String> diagnostics) {
		super(buildMessage(stage, diagnostics));
		this.stage = stage;
		this.diagnostics = Collections.unmodifiableList(new ArrayList<String>(diagnostics));
	}

	private static String buildMessage(Stage stage, List<String> diagnostics) {
		StringBuilder message = new StringBuilder();
		message.append(stage).append(" failed:");
		for (String diagnostic : diagnostics) {
			message.append('\n').append(diagnostic);
		}
		return message.toString();
	}

	public Stage getStage() {
		return stage;
	}

	public List<String> getDiagnostics() {
		return diagnostics;
	}
}
