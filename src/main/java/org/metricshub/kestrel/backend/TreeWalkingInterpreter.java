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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.metricshub.kestrel.frontend.Token;
import org.metricshub.kestrel.frontend.ast.Expr;
import org.metricshub.kestrel.frontend.ast.Name;
import org.metricshub.kestrel.frontend.ast.Span;
import org.metricshub.kestrel.frontend.ast.Stmt;
import org.metricshub.kestrel.jrt.Builtin;
import org.metricshub.kestrel.jrt.Builtins;
import org.metricshub.kestrel.jrt.KestrelFunction;
import org.metricshub.kestrel.jrt.KestrelRuntimeException;
import org.metricshub.kestrel.jrt.Nil;
import org.metricshub.kestrel.jrt.Values;
import org.metricshub.kestrel.util.KestrelLogger;
import org.metricshub.kestrel.util.KestrelSettings;
import org.slf4j.Logger;

/**
 * Interprets a parsed Kestrel program by walking its syntax tree.
 * <p>
 * Expression evaluation reports runtime errors by throwing a
 * {@link KestrelRuntimeException}. Statement execution never throws: it turns
 * such an exception into an {@link ExecutionOutcome} and hands it back to the
 * enclosing statement, together with <code>break</code>, <code>continue</code>
 * and <code>return</code>. Every construct that changes the interpreter state
 * (current scope, loop and function nesting) restores it before handing an
 * outcome back, whatever the outcome.
 * <p>
 * The global scope, with the builtins installed, lives as long as the
 * interpreter: successive calls to {@link #interpret(List)} see the bindings
 * made by earlier ones.
 */
public class TreeWalkingInterpreter implements KestrelInterpreter {

	private static final Logger LOG = KestrelLogger.getLogger(TreeWalkingInterpreter.class);

	private final KestrelSettings settings;
	private final Environment globals = new Environment();
	private final List<String> errors = new ArrayList<String>();

	private Environment environment = globals;
	private int loopDepth = 0;
	private int functionDepth = 0;

	/**
	 * Creates an interpreter with the default settings.
	 */
	public TreeWalkingInterpreter() {
		this(new KestrelSettings());
	}

	/**
	 * <p>
	 * Constructor for TreeWalkingInterpreter.
	 * </p>
	 *
	 * @param settings output stream of <code>print</code> and call depth limit
	 */
	public TreeWalkingInterpreter(KestrelSettings settings) {
		this.settings = Objects.requireNonNull(settings, "settings");
		Map<String, Builtin> builtins = Builtins.create(settings);
		Builtins.install(globals, builtins);
	}

	/**
	 * @return the global scope, builtins included
	 */
	public Environment getGlobals() {
		return globals;
	}

	/**
	 * @return the runtime errors of the latest {@link #interpret(List)} call
	 */
	public List<String> getErrors() {
		return Collections.unmodifiableList(new ArrayList<String>(errors));
	}

	/**
	 * {@inheritDoc}
	 */
	@Override
	public List<String> interpret(List<Stmt> statements) {
		errors.clear();
		for (Stmt statement : statements) {
			ExecutionOutcome outcome = execute(statement);
			if (outcome.getKind() == ExecutionOutcome.Kind.FAILED) {
				KestrelRuntimeException error = outcome.getError();
				LOG.debug("Runtime error at {}: {}", error.getSpan(), error.getMessage());
				errors.add(error.getFormattedMessage());
				break;
			}
		}
		return getErrors();
	}

	//
	// Statements
	//

	private ExecutionOutcome execute(Stmt stmt) {
		try {
			return executeStatement(stmt);
		} catch (KestrelRuntimeException e) {
			return ExecutionOutcome.failed(e);
		}
	}

	private ExecutionOutcome executeStatement(Stmt stmt) {
		switch (stmt.getKind()) {
		case EXPRESSION:
			evaluate(((Stmt.Expression) stmt).getExpression());
			return ExecutionOutcome.NORMAL;
		case LET: {
			Stmt.Let let = (Stmt.Let) stmt;
			Object value = evaluate(let.getInitializer());
			Name name = let.getName();
			if (!environment.define(name.getText(), value)) {
				throw new KestrelRuntimeException(
						name.getSpan(),
						"Variable already declared in this scope: '" + name.getText() + "'.");
			}
			return ExecutionOutcome.NORMAL;
		}
		case BLOCK:
			return executeBlock(((Stmt.Block) stmt).getStatements(), new Environment(environment));
		case IF: {
			Stmt.If ifStmt = (Stmt.If) stmt;
			if (expectBoolean(evaluate(ifStmt.getCondition()), ifStmt.getCondition().getSpan(), "if condition")) {
				return execute(ifStmt.getThenBranch());
			}
			if (ifStmt.getElseBranch() != null) {
				return execute(ifStmt.getElseBranch());
			}
			return ExecutionOutcome.NORMAL;
		}
		case WHILE:
			return executeWhile((Stmt.While) stmt);
		case BREAK:
			if (loopDepth == 0) {
				throw new KestrelRuntimeException(stmt.getSpan(), "Break used outside of a loop.");
			}
			return ExecutionOutcome.BREAK;
		case CONTINUE:
			if (loopDepth == 0) {
				throw new KestrelRuntimeException(stmt.getSpan(), "Continue used outside of a loop.");
			}
			return ExecutionOutcome.CONTINUE;
		case RETURN: {
			if (functionDepth == 0) {
				throw new KestrelRuntimeException(stmt.getSpan(), "Return used outside of a function.");
			}
			Expr value = ((Stmt.Return) stmt).getValue();
			return ExecutionOutcome.returning(value == null ? Nil.INSTANCE : evaluate(value));
		}
		case FN: {
			Stmt.Fn fn = (Stmt.Fn) stmt;
			Name name = fn.getName();
			if (!environment.define(name.getText(), new KestrelFunction(fn, environment))) {
				throw new KestrelRuntimeException(
						name.getSpan(),
						"Function already declared in this scope: '" + name.getText() + "'.");
			}
			return ExecutionOutcome.NORMAL;
		}
		default:
			throw new IllegalStateException("Unknown statement kind: " + stmt.getKind());
		}
	}

	/**
	 * Executes statements in the specified scope, then restores the current
	 * scope.
	 *
	 * @return the outcome of the first statement which did not complete
	 *         normally, or {@link ExecutionOutcome#NORMAL}
	 */
	private ExecutionOutcome executeBlock(List<Stmt> statements, Environment scope) {
		Environment previous = environment;
		environment = scope;
		ExecutionOutcome outcome = ExecutionOutcome.NORMAL;
		for (Stmt statement : statements) {
			outcome = execute(statement);
			if (outcome.isAbrupt()) {
				break;
			}
		}
		environment = previous;
		return outcome;
	}

	private ExecutionOutcome executeWhile(Stmt.While loop) {
		loopDepth++;
		ExecutionOutcome outcome = runLoop(loop);
		loopDepth--;
		return outcome;
	}

	private ExecutionOutcome runLoop(Stmt.While loop) {
		Expr condition = loop.getCondition();
		while (true) {
			boolean proceed;
			try {
				proceed = expectBoolean(evaluate(condition), condition.getSpan(), "while condition");
			} catch (KestrelRuntimeException e) {
				return ExecutionOutcome.failed(e);
			}
			if (!proceed) {
				return ExecutionOutcome.NORMAL;
			}
			ExecutionOutcome outcome = execute(loop.getBody());
			switch (outcome.getKind()) {
			case BREAK:
				return ExecutionOutcome.NORMAL;
			case NORMAL:
			case CONTINUE:
				break;
			default:
				// RETURN and FAILED leave the loop
				return outcome;
			}
		}
	}

	//
	// Expressions
	//

	private Object evaluate(Expr expr) {
		switch (expr.getKind()) {
		case LITERAL:
			return Values.fromLiteral(((Expr.Literal) expr).getValue());
		case IDENTIFIER: {
			Name name = ((Expr.Identifier) expr).getName();
			Object value = environment.lookup(name.getText());
			if (value == null) {
				throw new KestrelRuntimeException(name.getSpan(), "Undefined identifier '" + name.getText() + "'.");
			}
			return value;
		}
		case GROUPING:
			return evaluate(((Expr.Grouping) expr).getExpression());
		case UNARY:
			return evaluateUnary((Expr.Unary) expr);
		case BINARY:
			return evaluateBinary((Expr.Binary) expr);
		case ASSIGN: {
			Expr.Assign assign = (Expr.Assign) expr;
			Object value = evaluate(assign.getValue());
			Name target = assign.getTarget();
			if (!environment.assign(target.getText(), value)) {
				throw new KestrelRuntimeException(target.getSpan(), "Undefined variable '" + target.getText() + "'.");
			}
			return value;
		}
		case CALL:
			return evaluateCall((Expr.Call) expr);
		default:
			throw new IllegalStateException("Unknown expression kind: " + expr.getKind());
		}
	}

	private Object evaluateUnary(Expr.Unary unary) {
		Token operator = unary.getOperator();
		Object operand = evaluate(unary.getOperand());
		switch (operator.getType()) {
		case MINUS:
			return -expectNumber(operand, operator.getSpan(), "unary minus");
		case BANG:
			return !expectBoolean(operand, operator.getSpan(), "logical not");
		default:
			throw new IllegalStateException("Unknown unary operator: " + operator);
		}
	}

	private Object evaluateBinary(Expr.Binary binary) {
		Token operator = binary.getOperator();
		Span at = operator.getSpan();

		// short-circuit operators check each operand where it stands
		switch (operator.getType()) {
		case AND_AND:
			if (!expectBoolean(evaluate(binary.getLeft()), binary.getLeft().getSpan(), "logical and")) {
				return Boolean.FALSE;
			}
			return expectBoolean(evaluate(binary.getRight()), binary.getRight().getSpan(), "logical and");
		case OR_OR:
			if (expectBoolean(evaluate(binary.getLeft()), binary.getLeft().getSpan(), "logical or")) {
				return Boolean.TRUE;
			}
			return expectBoolean(evaluate(binary.getRight()), binary.getRight().getSpan(), "logical or");
		default:
			break;
		}

		Object left = evaluate(binary.getLeft());
		Object right = evaluate(binary.getRight());

		switch (operator.getType()) {
		case EQUAL_EQUAL:
			return Values.strictEquals(left, right);
		case BANG_EQUAL:
			return !Values.strictEquals(left, right);
		case PLUS:
			return expectNumber(left, at, "addition") + expectNumber(right, at, "addition");
		case MINUS:
			return expectNumber(left, at, "subtraction") - expectNumber(right, at, "subtraction");
		case STAR:
			return expectNumber(left, at, "multiplication") * expectNumber(right, at, "multiplication");
		case SLASH: {
			int dividend = expectNumber(left, at, "division");
			int divisor = expectNumber(right, at, "division");
			if (divisor == 0) {
				throw new KestrelRuntimeException(at, "Division by zero.");
			}
			return dividend / divisor;
		}
		case GREATER:
			return expectNumber(left, at, "comparison") > expectNumber(right, at, "comparison");
		case GREATER_EQUAL:
			return expectNumber(left, at, "comparison") >= expectNumber(right, at, "comparison");
		case LESS:
			return expectNumber(left, at, "comparison") < expectNumber(right, at, "comparison");
		case LESS_EQUAL:
			return expectNumber(left, at, "comparison") <= expectNumber(right, at, "comparison");
		default:
			throw new IllegalStateException("Unknown binary operator: " + operator);
		}
	}

	private Object evaluateCall(Expr.Call call) {
		Object callee = evaluate(call.getCallee());

		if (callee instanceof Builtin) {
			Builtin builtin = (Builtin) callee;
			if (!builtin.isVariadic()) {
				checkArity(builtin.getArity(), call);
			}
			return builtin.call(evaluateArguments(call));
		}

		if (!(callee instanceof KestrelFunction)) {
			throw new KestrelRuntimeException(call.getSpan(), "Can only call functions or builtins.");
		}

		KestrelFunction function = (KestrelFunction) callee;
		List<Name> params = function.getDeclaration().getParams();
		checkArity(params.size(), call);
		int maxCallDepth = settings.getMaxCallDepth();
		if (maxCallDepth > 0 && functionDepth >= maxCallDepth) {
			throw new KestrelRuntimeException(call.getParenSpan(), "Maximum call depth exceeded.");
		}
		List<Object> arguments = evaluateArguments(call);

		// parameters live in a scope chained to the closure, not to the caller
		Environment callScope = new Environment(function.getClosure());
		for (int i = 0; i < params.size(); i++) {
			Name param = params.get(i);
			if (!callScope.define(param.getText(), arguments.get(i))) {
				throw new KestrelRuntimeException(param.getSpan(), "Duplicate parameter name '" + param.getText() + "'.");
			}
		}

		// loops of the caller are not visible from the body
		Environment callerEnvironment = environment;
		int callerLoopDepth = loopDepth;
		int callerFunctionDepth = functionDepth;
		loopDepth = 0;
		functionDepth++;
		ExecutionOutcome outcome;
		try {
			outcome = executeBlock(function.getDeclaration().getBody(), callScope);
		} catch (StackOverflowError e) {
			// the frames below did not get to restore their state
			environment = callerEnvironment;
			functionDepth = callerFunctionDepth;
			loopDepth = callerLoopDepth;
			throw new KestrelRuntimeException(call.getParenSpan(), "Maximum call depth exceeded.");
		}
		functionDepth--;
		loopDepth = callerLoopDepth;

		switch (outcome.getKind()) {
		case RETURN:
			return outcome.getValue();
		case FAILED:
			throw outcome.getError();
		default:
			return Nil.INSTANCE;
		}
	}

	private void checkArity(int expected, Expr.Call call) {
		int actual = call.getArguments().size();
		if (actual != expected) {
			throw new KestrelRuntimeException(
					call.getParenSpan(),
					"Expected " + expected + " arguments but got " + actual + ".");
		}
	}

	private List<Object> evaluateArguments(Expr.Call call) {
		List<Object> arguments = new ArrayList<Object>(call.getArguments().size());
		for (Expr argument : call.getArguments()) {
			arguments.add(evaluate(argument));
		}
		return arguments;
	}

	//
	// Type checks
	//

	private static boolean expectBoolean(Object value, Span span, String context) {
		if (!(value instanceof Boolean)) {
			throw new KestrelRuntimeException(
					span,
					"Expected boolean in " + context + ", got " + Values.typeName(value) + ".");
		}
		return (Boolean) value;
	}

	private static int expectNumber(Object value, Span span, String context) {
		if (!(value instanceof Integer)) {
			throw new KestrelRuntimeException(
					span,
					"Expected number in " + context + ", got " + Values.typeName(value) + ".");
		}
		return (Integer) value;
	}
}
