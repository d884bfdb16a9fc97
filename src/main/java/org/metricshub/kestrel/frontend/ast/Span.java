package org.metricshub.kestrel.frontend.ast;

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

/**
 * Half-open range <code>[start, end)</code> of character offsets in the source,
 * plus the line/column of <code>start</code>.
 * <p>
 * Every token, expression and statement carries one, so that diagnostics can
 * point at the offending text.
 */
public final class Span {

	private final int start;
	private final int end;
	private final SourcePos pos;

	/**
	 * Creates a Span.
	 *
	 * @param start inclusive start offset
	 * @param end exclusive end offset
	 * @param pos line/column of <code>start</code>
	 */
	public Span(int start, int end, SourcePos pos) {
		if (start < 0 || end < start) {
			throw new IllegalArgumentException("invalid span [" + start + ", " + end + ")");
		}
		this.start = start;
		this.end = end;
		this.pos = Objects.requireNonNull(pos, "pos");
	}

	/**
	 * Combines two spans into one which runs from the beginning of the first
	 * to the end of the last. The position is taken from the first.
	 *
	 * @param first leftmost span
	 * @param last rightmost span
	 * @return the covering span
	 */
	public static Span cover(Span first, Span last) {
		return new Span(first.start, Math.max(first.start, last.end), first.pos);
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	public SourcePos getPos() {
		return pos;
	}

	/**
	 * @return number of characters covered by this span
	 */
	public int length() {
		return end - start;
	}

	/**
	 * Extracts the text covered by this span.
	 *
	 * @param source the source this span was computed against
	 * @return the covered text
	 */
	public String slice(String source) {
		return source.substring(start, end);
	}

	@Override
	public int hashCode() {
		return Objects.hash(start, end, pos);
	}

	@Override
	public boolean equals(Object o) {
		return o == this
				|| o instanceof Span
						&& start == ((Span) o).start
						&& end == ((Span) o).end
						&& pos.equals(((Span) o).pos);
	}

	@Override
	public String toString() {
		return "[" + start + ", " + end + ")@" + pos;
	}
}
