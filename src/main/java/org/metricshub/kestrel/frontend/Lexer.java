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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.metricshub.kestrel.frontend.ast.SourcePos;
import org.metricshub.kestrel.frontend.ast.Span;
import org.metricshub.kestrel.util.Diagnostics;

/**
 * Converts Kestrel source text into a stream of {@link Token}s.
 * <p>
 * The scan is a single left-to-right pass which tracks line and column
 * numbers as it goes. Lexical errors never stop the scan: they are recorded
 * and the lexer resumes with the next character, so that one pass reports
 * every error in the source. Offsets are indices of UTF-16 characters in the
 * source string.
 * <p>
 * A Lexer instance scans one source only.
 */
public class Lexer {

	/**
	 * Contains a mapping of Kestrel keywords to their
	 * token values. Keywords are case-sensitive.
	 */
	private static final Map<String, TokenType> KEYWORDS = new HashMap<String, TokenType>();

	static {
		KEYWORDS.put("let", TokenType.LET);
		KEYWORDS.put("if", TokenType.IF);
		KEYWORDS.put("else", TokenType.ELSE);
		KEYWORDS.put("while", TokenType.WHILE);
		KEYWORDS.put("break", TokenType.BREAK);
		KEYWORDS.put("continue", TokenType.CONTINUE);
		KEYWORDS.put("return", TokenType.RETURN);
		KEYWORDS.put("fn", TokenType.FN);
		KEYWORDS.put("true", TokenType.TRUE);
		KEYWORDS.put("false", TokenType.FALSE);
	}

	private final String source;
	private final List<Token> tokens = new ArrayList<Token>();
	private final List<String> errors = new ArrayList<String>();

	// start of the current lexeme, and read cursor
	private int start;
	private int current;
	private int line = 1;
	private int column = 1;
	private SourcePos startPos = SourcePos.START;

	private boolean scanned;

	/**
	 * <p>
	 * Constructor for Lexer.
	 * </p>
	 *
	 * @param source the text to scan
	 */
	public Lexer(String source) {
		this.source = Objects.requireNonNull(source, "source");
	}

	/**
	 * Scans the whole source.
	 *
	 * @return the tokens, terminated by a zero-length {@link TokenType#EOF}
	 *         token at the final position, and the lexical errors
	 */
	public ScanResult scan() {
		if (scanned) {
			throw new IllegalStateException("This lexer has already scanned its source");
		}
		scanned = true;

		while (!isAtEnd()) {
			start = current;
			startPos = new SourcePos(line, column);
			scanToken();
		}

		// zero-length EOF so that the parser can always look one token ahead
		SourcePos eofPos = new SourcePos(line, column);
		tokens.add(new Token(TokenType.EOF, "", null, new Span(current, current, eofPos)));

		return new ScanResult(tokens, errors);
	}

	/**
	 * Convenience method scanning the given source with a new lexer.
	 *
	 * @param source the text to scan
	 * @return the tokens and lexical errors
	 */
	public static ScanResult scan(String source) {
		return new Lexer(source).scan();
	}

	private void scanToken() {
		char c = advance();
		switch (c) {
		case '(':
			addToken(TokenType.LEFT_PAREN);
			break;
		case ')':
			addToken(TokenType.RIGHT_PAREN);
			break;
		case '{':
			addToken(TokenType.LEFT_BRACE);
			break;
		case '}':
			addToken(TokenType.RIGHT_BRACE);
			break;
		case ';':
			addToken(TokenType.SEMICOLON);
			break;
		case ',':
			addToken(TokenType.COMMA);
			break;
		case '+':
			addToken(TokenType.PLUS);
			break;
		case '-':
			addToken(TokenType.MINUS);
			break;
		case '*':
			addToken(TokenType.STAR);
			break;
		case '!':
			addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG);
			break;
		case '=':
			addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL);
			break;
		case '<':
			addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
			break;
		case '>':
			addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
			break;
		case '&':
			if (match('&')) {
				addToken(TokenType.AND_AND);
			} else {
				addError("Unexpected '&' without pair.");
			}
			break;
		case '|':
			if (match('|')) {
				addToken(TokenType.OR_OR);
			} else {
				addError("Unexpected '|' without pair.");
			}
			break;
		case '/':
			if (match('/')) {
				// kill comment
				while (!isAtEnd() && peek() != '\n') {
					advance();
				}
			} else {
				addToken(TokenType.SLASH);
			}
			break;
		case ' ':
		case '\r':
		case '\t':
		case '\n':
			break;
		default:
			if (isDigit(c)) {
				number();
			} else if (isAlpha(c)) {
				identifier();
			} else {
				addError("Unexpected character.");
			}
			break;
		}
	}

	private void number() {
		while (isDigit(peek())) {
			advance();
		}
		String text = source.substring(start, current);
		Integer value;
		try {
			value = Integer.valueOf(text);
		} catch (NumberFormatException e) {
			addError("Integer literal out of range.");
			value = null;
		}
		addToken(TokenType.NUMBER, value);
	}

	private void identifier() {
		while (isAlphaNumeric(peek())) {
			advance();
		}
		String text = source.substring(start, current);
		TokenType type = KEYWORDS.get(text);
		if (type == null) {
			addToken(TokenType.IDENTIFIER);
		} else if (type == TokenType.TRUE) {
			addToken(type, Boolean.TRUE);
		} else if (type == TokenType.FALSE) {
			addToken(type, Boolean.FALSE);
		} else {
			addToken(type);
		}
	}

	private boolean isAtEnd() {
		return current >= source.length();
	}

	private char advance() {
		char c = source.charAt(current++);
		if (c == '\n') {
			line++;
			column = 1;
		} else {
			column++;
		}
		return c;
	}

	private boolean match(char expected) {
		if (isAtEnd() || source.charAt(current) != expected) {
			return false;
		}
		advance();
		return true;
	}

	private char peek() {
		return isAtEnd() ? '\0' : source.charAt(current);
	}

	private void addToken(TokenType type) {
		addToken(type, null);
	}

	private void addToken(TokenType type, Object literal) {
		String lexeme = source.substring(start, current);
		tokens.add(new Token(type, lexeme, literal, new Span(start, current, startPos)));
	}

	private void addError(String message) {
		errors.add(Diagnostics.format(startPos, message));
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isAlpha(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private static boolean isAlphaNumeric(char c) {
		return isAlpha(c) || isDigit(c);
	}
}
