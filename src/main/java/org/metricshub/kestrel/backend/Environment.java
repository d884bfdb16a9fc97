package org.metricshub.kestrel.backend;

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

import java.util.HashMap;
import java.util.Map;

/**
 * A lexical scope: a table of bindings plus an optional enclosing scope.
 * <p>
 * Scopes form a chain towards the global scope. Lookup and assignment walk
 * the chain outwards; definition only ever touches this scope. Runtime values
 * are never <code>null</code>, so a <code>null</code> lookup result always
 * means the name is unbound.
 */
public class Environment {

	private final Map<String, Object> values = new HashMap<String, Object>();
	private final Environment enclosing;

	/**
	 * Creates a global scope.
	 */
	public Environment() {
		this(null);
	}

	/**
	 * Creates a scope nested in the specified one.
	 *
	 * @param enclosing the enclosing scope, or <code>null</code> for a global scope
	 */
	public Environment(Environment enclosing) {
		this.enclosing = enclosing;
	}

	/**
	 * @return the enclosing scope, <code>null</code> for a global scope
	 */
	public Environment getEnclosing() {
		return enclosing;
	}

	/**
	 * Binds a name in this scope.
	 *
	 * @param name name to bind
	 * @param value value to bind it to
	 * @return <code>false</code> when the name is already bound in this scope,
	 *         in which case nothing changes
	 */
	public boolean define(String name, Object value) {
		if (value == null) {
			throw new IllegalArgumentException("Cannot bind '" + name + "' to null");
		}
		if (values.containsKey(name)) {
			return false;
		}
		values.put(name, value);
		return true;
	}

	/**
	 * Rebinds the nearest existing binding of a name.
	 *
	 * @param name name to rebind
	 * @param value new value
	 * @return <code>false</code> when no scope in the chain binds the name
	 */
	public boolean assign(String name, Object value) {
		if (value == null) {
			throw new IllegalArgumentException("Cannot bind '" + name + "' to null");
		}
		Environment scope = this;
		while (scope != null) {
			if (scope.values.containsKey(name)) {
				scope.values.put(name, value);
				return true;
			}
			scope = scope.enclosing;
		}
		return false;
	}

	/**
	 * Looks a name up, from this scope outwards.
	 *
	 * @param name name to look up
	 * @return the value of the nearest binding, or <code>null</code> if unbound
	 */
	public Object lookup(String name) {
		Environment scope = this;
		while (scope != null) {
			Object value = scope.values.get(name);
			if (value != null) {
				return value;
			}
			scope = scope.enclosing;
		}
		return null;
	}

	/**
	 * @param name name to check
	 * @return whether the name is bound in this very scope
	 */
	public boolean hasLocal(String name) {
		return values.containsKey(name);
	}
}
