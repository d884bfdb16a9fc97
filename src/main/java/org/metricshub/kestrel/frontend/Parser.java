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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.metricshub.kestrel.frontend.ast.Expr;
import org.metricshub.kestrel.frontend.ast.Name;
import org.metricshub.kestrel.frontend.ast.ParseError;
import org.metricshub.kestrel.frontend.ast.Span;
import org.metricshub.kestrel.frontend.ast.Stmt;
import org.metricshub.kestrel.util.Diagnostics;

/**
 * Converts the token stream of a Kestrel script into a syntax tree,
 * which the backend then interprets.
 * <p>
 * This is a recursive-descent parser, with one method per grammar rule.
 * Binary operators are parsed with a precedence ladder, from lowest to
 * highest: assignment, <code>||</code>, <code>&amp;&amp;</code>, equality,
 * comparison, additive, multiplicative, unary, call and primary expressions.
 * <p>
 * A syntax error is recorded, then unwinds the current declaration with a
 * {@link ParseError}. The parser then skips tokens up to the next statement
 * boundary and carries on, so that one parse reports every independent error.
 * <p>
 * Statements, expressions and functions may nest at most {@link #MAX_NESTING}
 * levels deep; deeper sources are rejected with a syntax error rather than
 * exhausting the Java stack.
 */
public class Parser {

	/** Maximum nesting of statements, function bodies and sub-expressions. */
	public static final int MAX_NESTING = 200;

	private final List<Token> tokens;
	private final List<String> errors = new ArrayList<String>();
	private int current;
	private int nesting;

	/**
	 * <p>
	 * Constructor for Parser.
	 * </p>
	 *
	 * @param tokens the tokens to parse; the last one must be {@link TokenType#EOF}
	 */
	public Parser(List<Token> tokens) {
		Objects.requireNonNull(tokens, "tokens");
		if (tokens.isEmpty() || tokens.get(tokens.size() - 1).getType() != TokenType.EOF) {
			throw new IllegalArgumentException("The token stream must be terminated by EOF");
		}
		this.tokens = new ArrayList<Token>(tokens);
	}

	/**
	 * Parse the whole token stream.
	 *
	 * @return the top-level statements and the syntax errors
	 */
	public ParseResult parse() {
		current = 0;
		nesting = 0;
		errors.clear();
		List<Stmt> statements = new ArrayList<Stmt>();
		while (!isAtEnd()) {
			Stmt declaration = DECLARATION();
			if (declaration != null) {
				statements.add(declaration);
			}
		}
		return new ParseResult(statements, errors);
	}

	/**
	 * Convenience method parsing the given tokens with a new parser.
	 *
	 * @param tokens the tokens to parse
	 * @return the top-level statements and the syntax errors
	 */
	public static ParseResult parse(List<Token> tokens) {
		return new Parser(tokens).parse();
	}

	// DECLARATION = FN_DECLARATION | LET_DECLARATION | STATEMENT
	// returns null when the declaration is in error
	private Stmt DECLARATION() {
		try {
			if (match(TokenType.FN)) {
				return FN_DECLARATION();
			}
			if (match(TokenType.LET)) {
				return LET_DECLARATION();
			}
			return STATEMENT();
		} catch (ParseError e) {
			synchronize();
			return null;
		}
	}

	// STATEMENT = IF_STATEMENT | WHILE_STATEMENT | BREAK_STATEMENT | CONTINUE_STATEMENT
	// | RETURN_STATEMENT | BLOCK | EXPRESSION_STATEMENT
	private Stmt STATEMENT() {
		enterNesting();
		try {
			return NESTED_STATEMENT();
		} finally {
			nesting--;
		}
	}

	private Stmt NESTED_STATEMENT() {
		if (match(TokenType.IF)) {
			return IF_STATEMENT();
		}
		if (match(TokenType.WHILE)) {
			return WHILE_STATEMENT();
		}
		if (match(TokenType.BREAK)) {
			return BREAK_STATEMENT();
		}
		if (match(TokenType.CONTINUE)) {
			return CONTINUE_STATEMENT();
		}
		if (match(TokenType.RETURN)) {
			return RETURN_STATEMENT();
		}
		if (match(TokenType.LEFT_BRACE)) {
			return BLOCK(previous());
		}
		return EXPRESSION_STATEMENT();
	}

	// LET_DECLARATION = let IDENTIFIER '=' EXPRESSION ';'
	private Stmt LET_DECLARATION() {
		Token letToken = previous();
		Token name = consume(TokenType.IDENTIFIER, "Expect variable name after 'let'.");
		consume(TokenType.EQUAL, "Expect '=' after variable name.");
		Expr initializer = EXPRESSION();
		Token semicolon = consume(TokenType.SEMICOLON, "Expect ';' after variable declaration.");
		return new Stmt.Let(toName(name), initializer, Span.cover(letToken.getSpan(), semicolon.getSpan()));
	}

	// FN_DECLARATION = fn IDENTIFIER '(' [ IDENTIFIER { ',' IDENTIFIER } ] ')' '{' { DECLARATION } '}'
	private Stmt FN_DECLARATION() {
		Token fnToken = previous();
		Token name = consume(TokenType.IDENTIFIER, "Expect function name after 'fn'.");
		consume(TokenType.LEFT_PAREN, "Expect '(' after function name.");

		List<Name> params = new ArrayList<Name>();
		if (!check(TokenType.RIGHT_PAREN)) {
			do {
				params.add(toName(consume(TokenType.IDENTIFIER, "Expect parameter name.")));
			} while (match(TokenType.COMMA));
		}
		consume(TokenType.RIGHT_PAREN, "Expect ')' after parameters.");

		consume(TokenType.LEFT_BRACE, "Expect '{' before function body.");
		List<Stmt> body;
		enterNesting();
		try {
			body = DECLARATIONS_UNTIL_CLOSE_BRACE();
		} finally {
			nesting--;
		}
		Token rightBrace = consume(TokenType.RIGHT_BRACE, "Expect '}' after function body.");

		return new Stmt.Fn(toName(name), params, body, Span.cover(fnToken.getSpan(), rightBrace.getSpan()));
	}

	// IF_STATEMENT = if '(' EXPRESSION ')' STATEMENT [ else STATEMENT ]
	private Stmt IF_STATEMENT() {
		Token ifToken = previous();
		consume(TokenType.LEFT_PAREN, "Expect '(' after 'if'.");
		Expr condition = EXPRESSION();
		consume(TokenType.RIGHT_PAREN, "Expect ')' after if condition.");

		Stmt thenBranch = STATEMENT();
		Stmt elseBranch = null;
		Span last = thenBranch.getSpan();
		if (match(TokenType.ELSE)) {
			elseBranch = STATEMENT();
			last = elseBranch.getSpan();
		}
		return new Stmt.If(condition, thenBranch, elseBranch, Span.cover(ifToken.getSpan(), last));
	}

	// WHILE_STATEMENT = while '(' EXPRESSION ')' STATEMENT
	private Stmt WHILE_STATEMENT() {
		Token whileToken = previous();
		consume(TokenType.LEFT_PAREN, "Expect '(' after 'while'.");
		Expr condition = EXPRESSION();
		consume(TokenType.RIGHT_PAREN, "Expect ')' after while condition.");

		Stmt body = STATEMENT();
		return new Stmt.While(condition, body, Span.cover(whileToken.getSpan(), body.getSpan()));
	}

	// BREAK_STATEMENT = break ';'
	private Stmt BREAK_STATEMENT() {
		Token breakToken = previous();
		Token semicolon = consume(TokenType.SEMICOLON, "Expect ';' after 'break'.");
		return new Stmt.Break(Span.cover(breakToken.getSpan(), semicolon.getSpan()));
	}

	// CONTINUE_STATEMENT = continue ';'
	private Stmt CONTINUE_STATEMENT() {
		Token continueToken = previous();
		Token semicolon = consume(TokenType.SEMICOLON, "Expect ';' after 'continue'.");
		return new Stmt.Continue(Span.cover(continueToken.getSpan(), semicolon.getSpan()));
	}

	// RETURN_STATEMENT = return [ EXPRESSION ] ';'
	private Stmt RETURN_STATEMENT() {
		Token returnToken = previous();
		Expr value = null;
		if (!check(TokenType.SEMICOLON)) {
			value = EXPRESSION();
		}
		Token semicolon = consume(TokenType.SEMICOLON, "Expect ';' after return value.");
		return new Stmt.Return(value, Span.cover(returnToken.getSpan(), semicolon.getSpan()));
	}

	// BLOCK = '{' { DECLARATION } '}'
	private Stmt BLOCK(Token leftBrace) {
		List<Stmt> statements = DECLARATIONS_UNTIL_CLOSE_BRACE();
		Token rightBrace = consume(TokenType.RIGHT_BRACE, "Expect '}' after block.");
		return new Stmt.Block(statements, Span.cover(leftBrace.getSpan(), rightBrace.getSpan()));
	}

	private List<Stmt> DECLARATIONS_UNTIL_CLOSE_BRACE() {
		List<Stmt> statements = new ArrayList<Stmt>();
		while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
			Stmt declaration = DECLARATION();
			if (declaration != null) {
				statements.add(declaration);
			}
		}
		return statements;
	}

	// EXPRESSION_STATEMENT = EXPRESSION ';'
	private Stmt EXPRESSION_STATEMENT() {
		Expr expression = EXPRESSION();
		Token semicolon = consume(TokenType.SEMICOLON, "Expect ';' after expression.");
		return new Stmt.Expression(expression, Span.cover(expression.getSpan(), semicolon.getSpan()));
	}

	private Expr EXPRESSION() {
		enterNesting();
		try {
			return ASSIGNMENT_EXPRESSION();
		} finally {
			nesting--;
		}
	}

	// ASSIGNMENT_EXPRESSION = LOGICAL_OR_EXPRESSION [ '=' ASSIGNMENT_EXPRESSION ]
	// (right-associative; the left-hand side must be a bare identifier)
	private Expr ASSIGNMENT_EXPRESSION() {
		Expr expr = LOGICAL_OR_EXPRESSION();
		if (match(TokenType.EQUAL)) {
			Token equals = previous();
			Expr value = EXPRESSION();
			if (expr.getKind() == Expr.Kind.IDENTIFIER) {
				return new Expr.Assign(((Expr.Identifier) expr).getName(), value);
			}
			// recoverable: keep parsing with the left-hand side
			error(equals, "Invalid assignment target.");
		}
		return expr;
	}

	// LOGICAL_OR_EXPRESSION = LOGICAL_AND_EXPRESSION { '||' LOGICAL_AND_EXPRESSION }
	private Expr LOGICAL_OR_EXPRESSION() {
		Expr expr = LOGICAL_AND_EXPRESSION();
		while (match(TokenType.OR_OR)) {
			Token op = previous();
			Expr right = LOGICAL_AND_EXPRESSION();
			expr = new Expr.Binary(expr, op, right);
		}
		return expr;
	}

	// LOGICAL_AND_EXPRESSION = EQUALITY_EXPRESSION { '&&' EQUALITY_EXPRESSION }
	private Expr LOGICAL_AND_EXPRESSION() {
		Expr expr = EQUALITY_EXPRESSION();
		while (match(TokenType.AND_AND)) {
			Token op = previous();
			Expr right = EQUALITY_EXPRESSION();
			expr = new Expr.Binary(expr, op, right);
		}
		return expr;
	}

	// EQUALITY_EXPRESSION = COMPARISON_EXPRESSION { ('==' | '!=') COMPARISON_EXPRESSION }
	private Expr EQUALITY_EXPRESSION() {
		Expr expr = COMPARISON_EXPRESSION();
		while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
			Token op = previous();
			Expr right = COMPARISON_EXPRESSION();
			expr = new Expr.Binary(expr, op, right);
		}
		return expr;
	}

	// COMPARISON_EXPRESSION = ADDITIVE_EXPRESSION { ('>' | '>=' | '<' | '<=') ADDITIVE_EXPRESSION }
	private Expr COMPARISON_EXPRESSION() {
		Expr expr = ADDITIVE_EXPRESSION();
		while (match(TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
			Token op = previous();
			Expr right = ADDITIVE_EXPRESSION();
			expr = new Expr.Binary(expr, op, right);
		}
		return expr;
	}

	// ADDITIVE_EXPRESSION = MULTIPLICATIVE_EXPRESSION { ('+' | '-') MULTIPLICATIVE_EXPRESSION }
	private Expr ADDITIVE_EXPRESSION() {
		Expr expr = MULTIPLICATIVE_EXPRESSION();
		while (match(TokenType.PLUS, TokenType.MINUS)) {
			Token op = previous();
			Expr right = MULTIPLICATIVE_EXPRESSION();
			expr = new Expr.Binary(expr, op, right);
		}
		return expr;
	}

	// MULTIPLICATIVE_EXPRESSION = UNARY_EXPRESSION { ('*' | '/') UNARY_EXPRESSION }
	private Expr MULTIPLICATIVE_EXPRESSION() {
		Expr expr = UNARY_EXPRESSION();
		while (match(TokenType.STAR, TokenType.SLASH)) {
			Token op = previous();
			Expr right = UNARY_EXPRESSION();
			expr = new Expr.Binary(expr, op, right);
		}
		return expr;
	}

	// UNARY_EXPRESSION = ('!' | '-') UNARY_EXPRESSION | CALL_EXPRESSION
	private Expr UNARY_EXPRESSION() {
		if (match(TokenType.BANG, TokenType.MINUS)) {
			Token op = previous();
			Expr operand;
			enterNesting();
			try {
				operand = UNARY_EXPRESSION();
			} finally {
				nesting--;
			}
			return new Expr.Unary(op, operand);
		}
		return CALL_EXPRESSION();
	}

	// CALL_EXPRESSION = PRIMARY { '(' [ EXPRESSION { ',' EXPRESSION } ] ')' }
	private Expr CALL_EXPRESSION() {
		Expr expr = PRIMARY();
		while (match(TokenType.LEFT_PAREN)) {
			Token leftParen = previous();
			List<Expr> arguments = new ArrayList<Expr>();
			if (!check(TokenType.RIGHT_PAREN)) {
				do {
					arguments.add(EXPRESSION());
				} while (match(TokenType.COMMA));
			}
			Token rightParen = consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");
			expr = new Expr.Call(expr, arguments, Span.cover(leftParen.getSpan(), rightParen.getSpan()));
		}
		return expr;
	}

	// PRIMARY = NUMBER | true | false | IDENTIFIER | '(' EXPRESSION ')'
	private Expr PRIMARY() {
		if (match(TokenType.NUMBER, TokenType.TRUE, TokenType.FALSE)) {
			Token literal = previous();
			return new Expr.Literal(literal.getLiteral(), literal.getSpan());
		}
		if (match(TokenType.IDENTIFIER)) {
			return new Expr.Identifier(toName(previous()));
		}
		if (match(TokenType.LEFT_PAREN)) {
			Token leftParen = previous();
			Expr expression = EXPRESSION();
			Token rightParen = consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
			return new Expr.Grouping(expression, Span.cover(leftParen.getSpan(), rightParen.getSpan()));
		}
		throw error(peek(), "Expect expression.");
	}

	/**
	 * Skips tokens until the start of the next statement: just past a
	 * <code>;</code>, or on a keyword that begins a declaration or statement.
	 */
	private void synchronize() {
		advance();
		while (!isAtEnd()) {
			if (previous().getType() == TokenType.SEMICOLON) {
				return;
			}
			switch (peek().getType()) {
			case LET:
			case IF:
			case WHILE:
			case BREAK:
			case CONTINUE:
			case RETURN:
			case FN:
				return;
			default:
				advance();
				break;
			}
		}
	}

	private static Name toName(Token identifier) {
		return new Name(identifier.getLexeme(), identifier.getSpan());
	}

	private boolean isAtEnd() {
		return peek().getType() == TokenType.EOF;
	}

	private Token peek() {
		return tokens.get(current);
	}

	private Token previous() {
		return tokens.get(current - 1);
	}

	private Token advance() {
		if (!isAtEnd()) {
			current++;
		}
		return previous();
	}

	private boolean check(TokenType type) {
		if (isAtEnd()) {
			return false;
		}
		return peek().getType() == type;
	}

	private boolean match(TokenType... types) {
		for (TokenType type : types) {
			if (check(type)) {
				advance();
				return true;
			}
		}
		return false;
	}

	private Token consume(TokenType type, String message) {
		if (check(type)) {
			return advance();
		}
		throw error(peek(), message);
	}

	/**
	 * Records a syntax error at the given token.
	 *
	 * @return the signal to throw when the error is not recoverable
	 */
	/**
	 * Enters one more level of nesting; the caller leaves it in a
	 * <code>finally</code> block.
	 */
	private void enterNesting() {
		if (nesting >= MAX_NESTING) {
			throw error(peek(), "Too deeply nested.");
		}
		nesting++;
	}

	private ParseError error(Token token, String message) {
		errors.add(Diagnostics.format(token.getSpan(), message));
		return new ParseError();
	}
}
