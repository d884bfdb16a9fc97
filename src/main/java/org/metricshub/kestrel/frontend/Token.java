package org.metricshub.kestrel.frontend;

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

/**
 * A single scanned token: its kind, the raw text it was scanned from,
 * an optional literal payload and its location.
 * <p>
 * Tokens are immutable once created by the {@link Lexer}.
 */
public final class Token {

	private final TokenType type;
	private final String lexeme;
	private final Object literal;
	private final Span span;

	/**
	 * <p>
	 * Constructor for Token.
	 * </p>
	 *
	 * @param type the token kind
	 * @param lexeme raw source text of the token
	 * @param literal an {@link Integer}, a {@link Boolean}, or <code>null</code>
	 *        when the token carries no literal value
	 * @param span location of the token
	 */
	public Token(TokenType type, String lexeme, Object literal, Span span) {
		if (literal != null && !(literal instanceof Integer) && !(literal instanceof Boolean)) {
			throw new IllegalArgumentException("Unsupported literal payload: " + literal.getClass().getName());
		}
		this.type = Objects.requireNonNull(type, "type");
		this.lexeme = Objects.requireNonNull(lexeme, "lexeme");
		this.literal = literal;
		this.span = Objects.requireNonNull(span, "span");
	}

	public TokenType getType() {
		return type;
	}

	public String getLexeme() {
		return lexeme;
	}

	/**
	 * @return the literal payload: an {@link Integer}, a {@link Boolean}, or
	 *         <code>null</code> when absent
	 */
	public Object getLiteral() {
		return literal;
	}

	public boolean hasLiteral() {
		return literal != null;
	}

	public Span getSpan() {
		return span;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return type + " '" + lexeme + "'";
	}
}
