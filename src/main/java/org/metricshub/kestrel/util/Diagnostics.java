package org.metricshub.kestrel.util;

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

import org.metricshub.kestrel.frontend.ast.SourcePos;
import org.metricshub.kestrel.frontend.ast.Span;

/**
 * Formats diagnostics the same way for every stage of the pipeline:
 * <code>Line {line}, col {col}: {message}</code>.
 */
public final class Diagnostics {

	private Diagnostics() {}

	/**
	 * Formats a diagnostic message located at the given position.
	 *
	 * @param pos 1-based line/column of the offending source text
	 * @param message the diagnostic text
	 * @return the formatted diagnostic
	 */
	public static String format(SourcePos pos, String message) {
		return "Line " + pos.getLine() + ", col " + pos.getColumn() + ": " + message;
	}

	/**
	 * Formats a diagnostic message located at the start of the given span.
	 *
	 * @param span span of the offending source text
	 * @param message the diagnostic text
	 * @return the formatted diagnostic
	 */
	public static String format(Span span, String message) {
		return format(span.getPos(), message);
	}
}
