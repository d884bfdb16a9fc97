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
import org.metricshub.kestrel.backend.Environment;
import org.metricshub.kestrel.frontend.ast.Stmt;

/**
 * A user-defined function: its declaration plus the scope it was declared in
 * (its closure). Names in the body resolve against the closure, not against
 * the caller's scope. Functions compare by identity.
 */
public final class KestrelFunction {

	private final Stmt.Fn declaration;
	private final Environment closure;

	/**
	 * <p>
	 * Constructor for KestrelFunction.
	 * </p>
	 *
	 * @param declaration the <code>fn</code> statement
	 * @param closure scope in effect where the function was declared
	 */
	public KestrelFunction(Stmt.Fn declaration, Environment closure) {
		this.declaration = Objects.requireNonNull(declaration, "declaration");
		this.closure = Objects.requireNonNull(closure, "closure");
	}

	public Stmt.Fn getDeclaration() {
		return declaration;
	}

	public Environment getClosure() {
		return closure;
	}

	public int getArity() {
		return declaration.getParams().size();
	}

	@Override
	public String toString() {
		return "<fn " + declaration.getName().getText() + ">";
	}
}
