package org.metricshub.kestrel.backend;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Collections;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.kestrel.frontend.Lexer;
import org.metricshub.kestrel.frontend.ParseResult;
import org.metricshub.kestrel.frontend.Parser;
import org.metricshub.kestrel.frontend.ast.Stmt;
import org.metricshub.kestrel.jrt.Builtin;
import org.metricshub.kestrel.util.KestrelSettings;

public class TreeWalkingInterpreterTest {

	private ByteArrayOutputStream out;
	private TreeWalkingInterpreter interpreter;

	@Before
	public void setUp() throws Exception {
		out = new ByteArrayOutputStream();
		KestrelSettings settings = new KestrelSettings();
		settings.setOutputStream(new PrintStream(out, true, "UTF-8"));
		interpreter = new TreeWalkingInterpreter(settings);
	}

	private static List<Stmt> parse(String source) {
		ParseResult result = Parser.parse(Lexer.scan(source).getTokens());
		assertFalse("Unexpected syntax errors: " + result.getErrors(), result.hasErrors());
		return result.getStatements();
	}

	private String output() throws Exception {
		return out.toString("UTF-8");
	}

	@Test
	public void testBuiltinsInstalled() {
		Object print = interpreter.getGlobals().lookup("print");
		assertTrue(print instanceof Builtin);
		assertTrue(((Builtin) print).isVariadic());
	}

	@Test
	public void testGlobalsPersistAcrossCalls() throws Exception {
		assertEquals(Collections.emptyList(), interpreter.interpret(parse("let x = 40; fn add(a) { return x + a; }")));
		assertEquals(Collections.emptyList(), interpreter.interpret(parse("print(add(2));")));
		assertEquals("42\n", output());
		assertEquals(Integer.valueOf(40), interpreter.getGlobals().lookup("x"));
	}

	@Test
	public void testErrorsResetOnEachCall() {
		assertEquals(
				Collections.singletonList("Line 1, col 1: Undefined identifier 'nope'."),
				interpreter.interpret(parse("nope;")));
		assertEquals(1, interpreter.getErrors().size());
		assertEquals(Collections.emptyList(), interpreter.interpret(parse("1;")));
		assertTrue(interpreter.getErrors().isEmpty());
	}

	@Test
	public void testScopeRestoredAfterErrorInBlock() throws Exception {
		assertEquals(1, interpreter.interpret(parse("{ let y = 1; { print(z); } }")).size());
		// y was local to the failed block, the global scope is current again
		assertNull(interpreter.getGlobals().lookup("y"));
		assertEquals(Collections.emptyList(), interpreter.interpret(parse("let y = 2; print(y);")));
		assertEquals("2\n", output());
	}

	@Test
	public void testNestingRestoredAfterErrorInCall() {
		assertEquals(1, interpreter.interpret(parse("fn f() { while (true) { 1 / 0; } } f();")).size());
		assertEquals(
				Collections.singletonList("Line 1, col 1: Return used outside of a function."),
				interpreter.interpret(parse("return;")));
		assertEquals(
				Collections.singletonList("Line 1, col 1: Break used outside of a loop."),
				interpreter.interpret(parse("break;")));
	}

	@Test
	public void testScopeRestoredAfterReturnAndBreak() throws Exception {
		List<String> errors = interpreter.interpret(parse(
				"let v = 0; fn f() { { let v = 1; return v; } } "
						+ "while (true) { let v = 2; { break; } } "
						+ "print(f(), v);"));
		assertEquals(Collections.emptyList(), errors);
		assertEquals("1 0\n", output());
	}

	@Test
	public void testStopsAtFirstError() throws Exception {
		List<String> errors = interpreter.interpret(parse("print(1); 1 / 0; print(2); nope;"));
		assertEquals(Collections.singletonList("Line 1, col 13: Division by zero."), errors);
		assertEquals("1\n", output());
	}

	@Test
	public void testFixedArityBuiltin() throws Exception {
		interpreter.getGlobals().define("two", Builtin.fixed("two", 2, arguments -> (Integer) arguments.get(0) + (Integer) arguments.get(1)));

		// arguments are not evaluated when the count is wrong
		assertEquals(
				Collections.singletonList("Line 1, col 4: Expected 2 arguments but got 1."),
				interpreter.interpret(parse("two(1 / 0);")));
		assertEquals(
				Collections.singletonList("Line 1, col 4: Expected 2 arguments but got 3."),
				interpreter.interpret(parse("two(print(1), print(2), print(3));")));
		assertEquals("", output());

		assertEquals(Collections.emptyList(), interpreter.interpret(parse("print(two(3, 4));")));
		assertEquals("7\n", output());
	}

	@Test
	public void testStateRestoredAfterStackExhaustion() throws Exception {
		KestrelSettings settings = new KestrelSettings();
		settings.setOutputStream(new PrintStream(out, true, "UTF-8"));
		settings.setMaxCallDepth(0);
		TreeWalkingInterpreter unlimited = new TreeWalkingInterpreter(settings);

		assertEquals(
				Collections.singletonList("Line 1, col 26: Maximum call depth exceeded."),
				unlimited.interpret(parse("fn r() { while (true) { r(); } } r();")));
		assertEquals(
				Collections.singletonList("Line 1, col 1: Break used outside of a loop."),
				unlimited.interpret(parse("break;")));
		assertEquals(
				Collections.singletonList("Line 1, col 1: Return used outside of a function."),
				unlimited.interpret(parse("return;")));
		assertEquals(Collections.emptyList(), unlimited.interpret(parse("let after = 1; print(after);")));
		assertEquals(Integer.valueOf(1), unlimited.getGlobals().lookup("after"));
		assertEquals("1\n", output());
	}

	@Test
	public void testDefaultSettings() {
		TreeWalkingInterpreter defaultInterpreter = new TreeWalkingInterpreter();
		assertTrue(defaultInterpreter.interpret(parse("let a = 1;")).isEmpty());
	}
}
