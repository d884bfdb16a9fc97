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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;
import java.util.Objects;

/**
 * A simple container for the parameters of a Kestrel pipeline run.
 * These values have defaults which may be changed when invoking
 * Kestrel programmatically, from within Java code.
 */
public class KestrelSettings {

	/** Default value of {@link #getMaxCallDepth()}. */
	public static final int DEFAULT_MAX_CALL_DEPTH = 256;

	/**
	 * Output stream of the <code>print</code> builtin;
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Maximum nesting of user-defined function calls;
	 * a value of zero or less disables the check.
	 */
	private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("outputStream = ").append(outputStream == System.out ? "stdout" : "custom").append(newLine);
		desc.append("maxCallDepth = ").append(maxCallDepth).append(newLine);

		return desc.toString();
	}

	/**
	 * Output stream of the <code>print</code> builtin;
	 * <code>System.out</code> by default.
	 *
	 * @return the output stream
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * Sets the output stream of the <code>print</code> builtin.
	 *
	 * @param outputStream the output stream to set
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setOutputStream(PrintStream outputStream) {
		this.outputStream = Objects.requireNonNull(outputStream, "outputStream");
	}

	/**
	 * Maximum nesting of user-defined function calls.
	 *
	 * @return the maximum call depth, zero or less when unlimited
	 */
	public int getMaxCallDepth() {
		return maxCallDepth;
	}

	/**
	 * @param maxCallDepth the maximum call depth to set, zero or less for unlimited
	 */
	public void setMaxCallDepth(int maxCallDepth) {
		this.maxCallDepth = maxCallDepth;
	}

	/**
	 * Creates a copy of these settings, with the output redirected to the
	 * specified stream.
	 *
	 * @param out the output stream of the copy
	 * @return a new settings instance
	 */
	public KestrelSettings withOutputStream(PrintStream out) {
		KestrelSettings copy = new KestrelSettings();
		copy.setOutputStream(out);
		copy.setMaxCallDepth(maxCallDepth);
		return copy;
	}
}
