package org.metricshub.kestrel.jrt;

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

import java.util.Objects;
import org.metricshub.kestrel.frontend.ast.Span;
import org.metricshub.kestrel.util.Diagnostics;

/**
 * A runtime error raised while interpreting a Kestrel script. It is provided
 * to conveniently distinguish between Kestrel runtime errors and other
 * runtime exceptions, and records where in the source the error occurred.
 */
public class KestrelRuntimeException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final transient Span span;

	/**
	 * <p>
	 * Constructor for KestrelRuntimeException.
	 * </p>
	 *
	 * @param span location of the offending source text
	 * @param msg the error message
	 */
	public KestrelRuntimeException(Span span, String msg) {
		super(msg);
		this.span = Objects.requireNonNull(span, "span");
	}

	/**
	 * Returns the location associated with this exception.
	 *
	 * @return the offending span
	 */
	public Span getSpan() {
		return span;
	}

	/**
	 * @return the message prefixed with the line and column of the error
	 */
	public String getFormattedMessage() {
		return Diagnostics.format(span, getMessage());
	}
}
