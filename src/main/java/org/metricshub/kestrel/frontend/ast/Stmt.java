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

/**
 * Statement node of the abstract syntax tree.
 * <p>
 * Like {@link Expr}, the set of statement kinds is closed and every node
 * carries its own span, running from its first token to its last.
 */
public abstract class Stmt {

	/** Statement kinds. */
	public enum Kind {
		EXPRESSION,
		LET,
		BLOCK,
		IF,
		WHILE,
		BREAK,
		CONTINUE,
		RETURN,
		FN
	}

	private final Span span;

	private Stmt(Span span) {
		this.span = Objects.requireNonNull(span, "span");
	}

	public abstract Kind getKind();

	public final Span getSpan() {
		return span;
	}

	private static <T> List<T> copyOf(List<T> list) {
		return Collections.unmodifiableList(new ArrayList<T>(list));
	}

	/** Expression evaluated for its side effects; the value is discarded. */
	public static final class Expression extends Stmt {
		private final Expr expression;

		public Expression(Expr expression, Span span) {
			super(span);
			this.expression = Objects.requireNonNull(expression, "expression");
		}

		@Override
		public Kind getKind() {
			return Kind.EXPRESSION;
		}

		public Expr getExpression() {
			return expression;
		}
	}

	/** <code>let name = initializer;</code> */
	public static final class Let extends Stmt {
		private final Name name;
		private final Expr initializer;

		public Let(Name name, Expr initializer, Span span) {
			super(span);
			this.name = Objects.requireNonNull(name, "name");
			this.initializer = Objects.requireNonNull(initializer, "initializer");
		}

		@Override
		public Kind getKind() {
			return Kind.LET;
		}

		public Name getName() {
			return name;
		}

		public Expr getInitializer() {
			return initializer;
		}
	}

	/** Braced sequence of statements, executed in a new scope. */
	public static final class Block extends Stmt {
		private final List<Stmt> statements;

		public Block(List<Stmt> statements, Span span) {
			super(span);
			this.statements = copyOf(statements);
		}

		@Override
		public Kind getKind() {
			return Kind.BLOCK;
		}

		public List<Stmt> getStatements() {
			return statements;
		}
	}

	/** <code>if (condition) thenBranch [else elseBranch]</code> */
	public static final class If extends Stmt {
		private final Expr condition;
		private final Stmt thenBranch;
		private final Stmt elseBranch;

		/**
		 * @param condition the condition, which must evaluate to a boolean
		 * @param thenBranch executed when the condition holds
		 * @param elseBranch executed otherwise; may be <code>null</code>
		 * @param span location of the whole statement
		 */
		public If(Expr condition, Stmt thenBranch, Stmt elseBranch, Span span) {
			super(span);
			this.condition = Objects.requireNonNull(condition, "condition");
			this.thenBranch = Objects.requireNonNull(thenBranch, "thenBranch");
			this.elseBranch = elseBranch;
		}

		@Override
		public Kind getKind() {
			return Kind.IF;
		}

		public Expr getCondition() {
			return condition;
		}

		public Stmt getThenBranch() {
			return thenBranch;
		}

		/**
		 * @return the else branch, or <code>null</code> when there is none
		 */
		public Stmt getElseBranch() {
			return elseBranch;
		}
	}

	/** <code>while (condition) body</code> */
	public static final class While extends Stmt {
		private final Expr condition;
		private final Stmt body;

		public While(Expr condition, Stmt body, Span span) {
			super(span);
			this.condition = Objects.requireNonNull(condition, "condition");
			this.body = Objects.requireNonNull(body, "body");
		}

		@Override
		public Kind getKind() {
			return Kind.WHILE;
		}

		public Expr getCondition() {
			return condition;
		}

		public Stmt getBody() {
			return body;
		}
	}

	/** <code>break;</code> */
	public static final class Break extends Stmt {
		public Break(Span span) {
			super(span);
		}

		@Override
		public Kind getKind() {
			return Kind.BREAK;
		}
	}

	/** <code>continue;</code> */
	public static final class Continue extends Stmt {
		public Continue(Span span) {
			super(span);
		}

		@Override
		public Kind getKind() {
			return Kind.CONTINUE;
		}
	}

	/** <code>return [value];</code> */
	public static final class Return extends Stmt {
		private final Expr value;

		/**
		 * @param value returned expression; may be <code>null</code>, in which case nil is returned
		 * @param span location of the whole statement
		 */
		public Return(Expr value, Span span) {
			super(span);
			this.value = value;
		}

		@Override
		public Kind getKind() {
			return Kind.RETURN;
		}

		/**
		 * @return the returned expression, or <code>null</code>
		 */
		public Expr getValue() {
			return value;
		}
	}

	/** <code>fn name(params...) { body }</code> */
	public static final class Fn extends Stmt {
		private final Name name;
		private final List<Name> params;
		private final List<Stmt> body;

		public Fn(Name name, List<Name> params, List<Stmt> body, Span span) {
			super(span);
			this.name = Objects.requireNonNull(name, "name");
			this.params = copyOf(params);
			this.body = copyOf(body);
		}

		@Override
		public Kind getKind() {
			return Kind.FN;
		}

		public Name getName() {
			return name;
		}

		public List<Name> getParams() {
			return params;
		}

		public List<Stmt> getBody() {
			return body;
		}
	}
}
