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

/**
 * Helpers for the Kestrel value domain.
 * <p>
 * Runtime values are plain Java objects: {@link Nil#INSTANCE},
 * {@link Integer}, {@link Boolean}, {@link KestrelFunction} and
 * {@link Builtin}. No other type ever reaches the interpreter.
 */
public final class Values {

	private Values() {}

	/**
	 * Converts a literal payload, as carried by tokens and literal expressions,
	 * into a runtime value.
	 *
	 * @param literal an {@link Integer}, a {@link Boolean} or <code>null</code>
	 * @return the runtime value
	 */
	public static Object fromLiteral(Object literal) {
		return literal == null ? Nil.INSTANCE : literal;
	}

	/**
	 * @param value a runtime value
	 * @return the name of the type of the value, as used in error messages
	 */
	public static String typeName(Object value) {
		if (value instanceof Integer) {
			return "number";
		}
		if (value instanceof Boolean) {
			return "boolean";
		}
		if (value instanceof KestrelFunction) {
			return "function";
		}
		if (value instanceof Builtin) {
			return "builtin";
		}
		return "nil";
	}

	/**
	 * Renders a value the way <code>print</code> shows it.
	 *
	 * @param value a runtime value
	 * @return <code>nil</code>, the decimal integer, <code>true</code>/<code>false</code>,
	 *         or a fixed placeholder for callables
	 */
	public static String toDisplayString(Object value) {
		if (value instanceof Integer || value instanceof Boolean) {
			return value.toString();
		}
		if (value instanceof KestrelFunction) {
			return "function";
		}
		if (value instanceof Builtin) {
			return "builtin";
		}
		return "nil";
	}

	/**
	 * Strict equality: values of different kinds are never equal, integers and
	 * booleans compare by value, callables by identity.
	 *
	 * @param left a runtime value
	 * @param right a runtime value
	 * @return whether both values are equal
	 */
	public static boolean strictEquals(Object left, Object right) {
		if (left == right) {
			return true;
		}
		if (left instanceof Integer || left instanceof Boolean) {
			// Integer.equals() and Boolean.equals() already reject the other kinds
			return left.equals(right);
		}
		return false;
	}
}
