package org.metricshub.kestrel.frontend;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.kestrel.frontend.ast.SourcePos;
import org.metricshub.kestrel.frontend.ast.Span;

public class LexerTest {

	private static List<TokenType> types(ScanResult result) {
		List<TokenType> types = new ArrayList<TokenType>();
		for (Token token : result.getTokens()) {
			types.add(token.getType());
		}
		return types;
	}

	@Test
	public void testOperators() {
		ScanResult result = Lexer.scan("(){};,+-*/ ! != = == < <= > >= && ||");
		assertFalse(result.hasErrors());
		assertEquals(
				Arrays.asList(
						TokenType.LEFT_PAREN,
						TokenType.RIGHT_PAREN,
						TokenType.LEFT_BRACE,
						TokenType.RIGHT_BRACE,
						TokenType.SEMICOLON,
						TokenType.COMMA,
						TokenType.PLUS,
						TokenType.MINUS,
						TokenType.STAR,
						TokenType.SLASH,
						TokenType.BANG,
						TokenType.BANG_EQUAL,
						TokenType.EQUAL,
						TokenType.EQUAL_EQUAL,
						TokenType.LESS,
						TokenType.LESS_EQUAL,
						TokenType.GREATER,
						TokenType.GREATER_EQUAL,
						TokenType.AND_AND,
						TokenType.OR_OR,
						TokenType.EOF),
				types(result));
	}

	@Test
	public void testKeywordsAndIdentifiers() {
		ScanResult result = Lexer.scan("let if else while break continue return fn true false Let letx _a1");
		assertEquals(
				Arrays.asList(
						TokenType.LET,
						TokenType.IF,
						TokenType.ELSE,
						TokenType.WHILE,
						TokenType.BREAK,
						TokenType.CONTINUE,
						TokenType.RETURN,
						TokenType.FN,
						TokenType.TRUE,
						TokenType.FALSE,
						TokenType.IDENTIFIER,
						TokenType.IDENTIFIER,
						TokenType.IDENTIFIER,
						TokenType.EOF),
				types(result));
		List<Token> tokens = result.getTokens();
		assertEquals(Boolean.TRUE, tokens.get(8).getLiteral());
		assertEquals(Boolean.FALSE, tokens.get(9).getLiteral());
		assertFalse("Keywords other than true/false carry no literal", tokens.get(0).hasLiteral());
		assertEquals("_a1", tokens.get(12).getLexeme());
	}

	@Test
	public void testSpans() {
		ScanResult result = Lexer.scan("let x\n  = 42;");
		List<Token> tokens = result.getTokens();
		assertEquals(6, tokens.size());
		assertEquals(new Span(0, 3, new SourcePos(1, 1)), tokens.get(0).getSpan());
		assertEquals(new Span(4, 5, new SourcePos(1, 5)), tokens.get(1).getSpan());
		assertEquals(new Span(8, 9, new SourcePos(2, 3)), tokens.get(2).getSpan());
		assertEquals(new Span(10, 12, new SourcePos(2, 5)), tokens.get(3).getSpan());
		assertEquals(Integer.valueOf(42), tokens.get(3).getLiteral());
		assertEquals(new Span(12, 13, new SourcePos(2, 7)), tokens.get(4).getSpan());

		Token eof = tokens.get(5);
		assertEquals(TokenType.EOF, eof.getType());
		assertEquals("", eof.getLexeme());
		assertEquals(new Span(13, 13, new SourcePos(2, 8)), eof.getSpan());
	}

	@Test
	public void testEmptySource() {
		ScanResult result = Lexer.scan("");
		assertEquals(Collections.singletonList(TokenType.EOF), types(result));
		assertEquals(new Span(0, 0, SourcePos.START), result.getTokens().get(0).getSpan());
	}

	@Test
	public void testComments() {
		assertEquals(
				Arrays.asList(TokenType.NUMBER, TokenType.NUMBER, TokenType.EOF),
				types(Lexer.scan("1 // a comment ( & $\n2")));
		assertEquals(
				Arrays.asList(TokenType.NUMBER, TokenType.SLASH, TokenType.NUMBER, TokenType.EOF),
				types(Lexer.scan("1 / 2")));
		assertEquals(Collections.singletonList(TokenType.EOF), types(Lexer.scan("// only a comment")));
	}

	@Test
	public void testUnpairedOperators() {
		ScanResult result = Lexer.scan("a & b | c");
		assertEquals(
				Arrays.asList(
						"Line 1, col 3: Unexpected '&' without pair.",
						"Line 1, col 7: Unexpected '|' without pair."),
				result.getErrors());
		assertEquals(
				Arrays.asList(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EOF),
				types(result));
	}

	@Test
	public void testUnexpectedCharacters() {
		ScanResult result = Lexer.scan("let $x = 1;\n  #");
		assertEquals(
				Arrays.asList("Line 1, col 5: Unexpected character.", "Line 2, col 3: Unexpected character."),
				result.getErrors());
		// scanning carries on past the offending characters
		assertEquals(
				Arrays.asList(
						TokenType.LET,
						TokenType.IDENTIFIER,
						TokenType.EQUAL,
						TokenType.NUMBER,
						TokenType.SEMICOLON,
						TokenType.EOF),
				types(result));
	}

	@Test
	public void testIntegerRange() {
		ScanResult result = Lexer.scan("2147483647 2147483648");
		assertEquals(Collections.singletonList("Line 1, col 12: Integer literal out of range."), result.getErrors());
		assertEquals(Integer.valueOf(Integer.MAX_VALUE), result.getTokens().get(0).getLiteral());
		Token overflow = result.getTokens().get(1);
		assertEquals(TokenType.NUMBER, overflow.getType());
		assertNull(overflow.getLiteral());
		assertEquals("2147483648", overflow.getLexeme());
	}

	@Test
	public void testSourceReconstruction() {
		String source = "fn add(a, b) {\n\treturn a + b; // sum\n}\r\nprint(add(1, 2) >= 3 && !false);\n";
		ScanResult result = Lexer.scan(source);
		assertFalse(result.hasErrors());

		StringBuilder rebuilt = new StringBuilder();
		int offset = 0;
		for (Token token : result.getTokens()) {
			Span span = token.getSpan();
			String gap = source.substring(offset, span.getStart());
			assertTrue("Only whitespace and comments between tokens: '" + gap + "'", gap.trim().isEmpty() || gap.trim().startsWith("//"));
			rebuilt.append(gap);
			assertEquals(token.getLexeme(), span.slice(source));
			rebuilt.append(token.getLexeme());
			offset = span.getEnd();
		}
		rebuilt.append(source.substring(offset));
		assertEquals(source, rebuilt.toString());
		assertEquals(source.length(), offset);
	}

	@Test(expected = IllegalStateException.class)
	public void testScanTwice() {
		Lexer lexer = new Lexer("1;");
		lexer.scan();
		lexer.scan();
	}

	@Test(expected = UnsupportedOperationException.class)
	public void testTokensAreReadOnly() {
		Lexer.scan("1;").getTokens().clear();
	}
}
