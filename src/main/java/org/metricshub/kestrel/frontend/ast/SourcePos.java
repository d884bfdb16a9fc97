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

/** 1-based line and column of a point in the source text. */
public final class SourcePos {

	/** Position of the very first character of a source. */
	public static final SourcePos START = new SourcePos(1, 1);

	private final int line;
	private final int column;

	/**
	 * Creates a SourcePos.
	 *
	 * @param line 1-based line number
	 * @param column 1-based column number
	 */
	public SourcePos(int line, int column) {
		if (line < 1 || column < 1) {
			throw new IllegalArgumentException("line and column are 1-based: " + line + "." + column);
		}
		this.line = line;
		this.column = column;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	@Override
	public int hashCode() {
		return 31 * line + column;
	}

	@Override
	public boolean equals(Object o) {
		return o == this
				|| o instanceof SourcePos
						&& line == ((SourcePos) o).line
						&& column == ((SourcePos) o).column;
	}

	@Override
	public String toString() {
		return line + "." + column;
	}
}
