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

import java.io.PrintStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.kestrel.backend.Environment;
import org.metricshub.kestrel.util.KestrelSettings;

/**
 * Registry of the builtins installed in every fresh global scope.
 * <p>
 * The registry is built from the settings of a run rather than kept in a
 * static table, so that each run writes to its own output stream.
 */
public final class Builtins {

	/** Name of the builtin printing its arguments. */
	public static final String PRINT = "print";

	private Builtins() {}

	/**
	 * Creates the builtins bound to the given settings.
	 *
	 * @param settings settings of the run
	 * @return builtins by name, in installation order
	 */
	public static Map<String, Builtin> create(KestrelSettings settings) {
		Map<String, Builtin> builtins = new LinkedHashMap<String, Builtin>();
		builtins.put(PRINT, print(settings.getOutputStream()));
		return Collections.unmodifiableMap(builtins);
	}

	/**
	 * Defines every builtin in the specified (global) scope.
	 *
	 * @param globals scope to define the builtins in
	 * @param builtins builtins by name
	 */
	public static void install(Environment globals, Map<String, Builtin> builtins) {
		for (Map.Entry<String, Builtin> entry : builtins.entrySet()) {
			if (!globals.define(entry.getKey(), entry.getValue())) {
				throw new IllegalStateException("'" + entry.getKey() + "' is already defined in this scope");
			}
		}
	}

	/**
	 * <code>print(args...)</code>: writes the arguments separated by spaces,
	 * followed by a newline, and returns nil.
	 */
	static Builtin print(final PrintStream out) {
		return Builtin.variadic(PRINT, new Builtin.Implementation() {
			@Override
			public Object call(List<Object> arguments) {
				StringBuilder line = new StringBuilder();
				for (int i = 0; i < arguments.size(); i++) {
					if (i > 0) {
						line.append(' ');
					}
					line.append(Values.toDisplayString(arguments.get(i)));
				}
				line.append('\n');
				out.print(line);
				out.flush();
				return Nil.INSTANCE;
			}
		});
	}
}
