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

import java.util.Objects;
import org.metricshub.kestrel.jrt.KestrelRuntimeException;
import org.metricshub.kestrel.jrt.Nil;

/**
 * How the execution of a statement ended.
 * <p>
 * <code>break</code>, <code>continue</code>, <code>return</code> and runtime
 * failures travel back up the statement tree as values of this class, and
 * each enclosing construct decides whether it consumes them or passes them on.
 */
public final class ExecutionOutcome {

	/** Kinds of outcome. */
	public enum Kind {
		/** Execution completed; continue with the next statement. */
		NORMAL,
		/** A <code>break</code> was executed; consumed by the innermost loop. */
		BREAK,
		/** A <code>continue</code> was executed; consumed by the innermost loop. */
		CONTINUE,
		/** A <code>return</code> was executed; consumed by the function call. */
		RETURN,
		/** A runtime error occurred; stops the whole run. */
		FAILED
	}

	public static final ExecutionOutcome NORMAL = new ExecutionOutcome(Kind.NORMAL, Nil.INSTANCE, null);
	public static final ExecutionOutcome BREAK = new ExecutionOutcome(Kind.BREAK, Nil.INSTANCE, null);
	public static final ExecutionOutcome CONTINUE = new ExecutionOutcome(Kind.CONTINUE, Nil.INSTANCE, null);

	private final Kind kind;
	private final Object value;
	private final KestrelRuntimeException error;

	private ExecutionOutcome(Kind kind, Object value, KestrelRuntimeException error) {
		this.kind = kind;
		this.value = value;
		this.error = error;
	}

	/**
	 * @param value the returned value
	 * @return a {@link Kind#RETURN} outcome
	 */
	public static ExecutionOutcome returning(Object value) {
		return new ExecutionOutcome(Kind.RETURN, Objects.requireNonNull(value, "value"), null);
	}

	/**
	 * @param error the runtime error
	 * @return a {@link Kind#FAILED} outcome
	 */
	public static ExecutionOutcome failed(KestrelRuntimeException error) {
		return new ExecutionOutcome(Kind.FAILED, Nil.INSTANCE, Objects.requireNonNull(error, "error"));
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return whether the enclosing statements must stop executing
	 */
	public boolean isAbrupt() {
		return kind != Kind.NORMAL;
	}

	/**
	 * @return the returned value; nil unless this is a {@link Kind#RETURN} outcome
	 */
	public Object getValue() {
		return value;
	}

	/**
	 * @return the runtime error; <code>null</code> unless this is a {@link Kind#FAILED} outcome
	 */
	public KestrelRuntimeException getError() {
		return error;
	}

	@Override
	public String toString() {
		switch (kind) {
		case RETURN:
			return "RETURN(" + value + ")";
		case FAILED:
			return "FAILED(" + error.getMessage() + ")";
		default:
			return kind.name();
		}
	}
}
