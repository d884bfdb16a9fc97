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

import java.util.List;
import java.util.Objects;

/**
 * A callable implemented in Java and installed in the global scope.
 * <p>
 * Builtins either take a fixed number of arguments, checked before the
 * arguments are evaluated, or are variadic. Builtins compare by identity.
 */
public final class Builtin {

	/**
	 * Native implementation of a builtin.
	 */
	public interface Implementation {
		/**
		 * @param arguments the evaluated arguments, in source order
		 * @return the result of the call, never <code>null</code>
		 */
		Object call(List<Object> arguments);
	}

	private static final int VARIADIC = -1;

	private final String name;
	private final int arity;
	private final Implementation implementation;

	private Builtin(String name, int arity, Implementation implementation) {
		this.name = Objects.requireNonNull(name, "name");
		this.arity = arity;
		this.implementation = Objects.requireNonNull(implementation, "implementation");
	}

	/**
	 * Creates a builtin which takes exactly <code>arity</code> arguments.
	 *
	 * @param name name under which the builtin is installed
	 * @param arity number of arguments
	 * @param implementation native implementation
	 * @return a new builtin
	 */
	public static Builtin fixed(String name, int arity, Implementation implementation) {
		if (arity < 0) {
			throw new IllegalArgumentException("Arity must not be negative: " + arity);
		}
		return new Builtin(name, arity, implementation);
	}

	/**
	 * Creates a builtin which takes any number of arguments.
	 *
	 * @param name name under which the builtin is installed
	 * @param implementation native implementation
	 * @return a new builtin
	 */
	public static Builtin variadic(String name, Implementation implementation) {
		return new Builtin(name, VARIADIC, implementation);
	}

	public String getName() {
		return name;
	}

	public boolean isVariadic() {
		return arity == VARIADIC;
	}

	/**
	 * @return the number of arguments expected; zero for variadic builtins
	 */
	public int getArity() {
		return isVariadic() ? 0 : arity;
	}

	/**
	 * Calls the native implementation.
	 *
	 * @param arguments evaluated arguments
	 * @return the result of the call
	 */
	public Object call(List<Object> arguments) {
		Object result = implementation.call(arguments);
		return result == null ? Nil.INSTANCE : result;
	}

	@Override
	public String toString() {
		return "<builtin " + name + ">";
	}
}
