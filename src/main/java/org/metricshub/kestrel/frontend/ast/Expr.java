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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.metricshub.kestrel.frontend.Token;

/**
 * Expression node of the abstract syntax tree.
 * <p>
 * The set of expression kinds is closed: every subclass is nested in this
 * class and reports its {@link Kind}, so that consumers can switch over the
 * kind exhaustively. Each node exclusively owns its children, and carries the
 * span of the whole expression.
 */
public abstract class Expr {

	/** Expression kinds. */
	public enum Kind {
		LITERAL,
		IDENTIFIER,
		GROUPING,
		UNARY,
		BINARY,
		ASSIGN,
		CALL
	}

	private final Span span;

	private Expr(Span span) {
		this.span = Objects.requireNonNull(span, "span");
	}

	public abstract Kind getKind();

	public final Span getSpan() {
		return span;
	}

	/** Integer, boolean or absent constant. */
	public static final class Literal extends Expr {
		private final Object value;

		/**
		 * @param value an {@link Integer}, a {@link Boolean}, or <code>null</code> for nil
		 * @param span location of the literal
		 */
		public Literal(Object value, Span span) {
			super(span);
			this.value = value;
		}

		@Override
		public Kind getKind() {
			return Kind.LITERAL;
		}

		public Object getValue() {
			return value;
		}
	}

	/** Reference to a variable or function by name. */
	public static final class Identifier extends Expr {
		private final Name name;

		public Identifier(Name name) {
			super(name.getSpan());
			this.name = name;
		}

		@Override
		public Kind getKind() {
			return Kind.IDENTIFIER;
		}

		public Name getName() {
			return name;
		}
	}

	/** Parenthesized expression; only affects precedence. */
	public static final class Grouping extends Expr {
		private final Expr expression;

		public Grouping(Expr expression, Span span) {
			super(span);
			this.expression = Objects.requireNonNull(expression, "expression");
		}

		@Override
		public Kind getKind() {
			return Kind.GROUPING;
		}

		public Expr getExpression() {
			return expression;
		}
	}

	/** <code>!operand</code> or <code>-operand</code>. */
	public static final class Unary extends Expr {
		private final Token operator;
		private final Expr operand;

		public Unary(Token operator, Expr operand) {
			super(Span.cover(operator.getSpan(), operand.getSpan()));
			this.operator = operator;
			this.operand = operand;
		}

		@Override
		public Kind getKind() {
			return Kind.UNARY;
		}

		public Token getOperator() {
			return operator;
		}

		public Expr getOperand() {
			return operand;
		}
	}

	/** Arithmetic, comparison, equality or logical operator applied to two operands. */
	public static final class Binary extends Expr {
		private final Expr left;
		private final Token operator;
		private final Expr right;

		public Binary(Expr left, Token operator, Expr right) {
			super(Span.cover(left.getSpan(), right.getSpan()));
			this.left = left;
			this.operator = operator;
			this.right = right;
		}

		@Override
		public Kind getKind() {
			return Kind.BINARY;
		}

		public Expr getLeft() {
			return left;
		}

		public Token getOperator() {
			return operator;
		}

		public Expr getRight() {
			return right;
		}
	}

	/** <code>name = value</code>; evaluates to the assigned value. */
	public static final class Assign extends Expr {
		private final Name target;
		private final Expr value;

		public Assign(Name target, Expr value) {
			super(Span.cover(target.getSpan(), value.getSpan()));
			this.target = target;
			this.value = value;
		}

		@Override
		public Kind getKind() {
			return Kind.ASSIGN;
		}

		public Name getTarget() {
			return target;
		}

		public Expr getValue() {
			return value;
		}
	}

	/** <code>callee(arguments...)</code>. */
	public static final class Call extends Expr {
		private final Expr callee;
		private final List<Expr> arguments;
		private final Span parenSpan;

		/**
		 * @param callee the called expression
		 * @param arguments argument expressions, in evaluation order
		 * @param parenSpan span from the opening to the closing parenthesis,
		 *        where arity errors are reported
		 */
		public Call(Expr callee, List<Expr> arguments, Span parenSpan) {
			super(Span.cover(callee.getSpan(), parenSpan));
			this.callee = callee;
			this.arguments = Collections.unmodifiableList(new ArrayList<Expr>(arguments));
			this.parenSpan = parenSpan;
		}

		@Override
		public Kind getKind() {
			return Kind.CALL;
		}

		public Expr getCallee() {
			return callee;
		}

		public List<Expr> getArguments() {
			return arguments;
		}

		public Span getParenSpan() {
			return parenSpan;
		}
	}
}
