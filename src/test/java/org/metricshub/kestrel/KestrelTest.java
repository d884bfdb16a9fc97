package org.metricshub.kestrel;

import static org.junit.Assert.*;
import static org.metricshub.kestrel.KestrelTestSupport.kestrelTest;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;

public class KestrelTest {

	private static final Kestrel KESTREL = new Kestrel();

	@Test
	public void testFunctionCall() {
		kestrelTest("call returning its argument plus one")
				.script("fn f(a) { return a + 1; } print(f(41));")
				.expectLines("42")
				.runAndAssert();
	}

	@Test
	public void testPrintRendering() {
		kestrelTest("every kind of value")
				.script("fn f() {} print(f, print, 1, true, false, f());")
				.expectLines("function builtin 1 true false nil")
				.runAndAssert();

		kestrelTest("print without argument")
				.script("print();")
				.expect("\n")
				.runAndAssert();

		kestrelTest("print returns nil")
				.script("print(print());")
				.expectLines("", "nil")
				.runAndAssert();
	}

	@Test
	public void testArithmetic() {
		kestrelTest("precedence")
				.script("print(1 + 2 * 3, (1 + 2) * 3, 10 - 4 - 3, 2 * -3);")
				.expectLines("7 9 3 -6")
				.runAndAssert();

		kestrelTest("division truncates toward zero")
				.script("print(7 / 2, -7 / 2, 7 / -2, 0 / 5);")
				.expectLines("3 -3 -3 0")
				.runAndAssert();

		kestrelTest("overflow wraps")
				.script("print(2147483647 + 1, -2147483647 - 2, 65536 * 65536);")
				.expectLines("-2147483648 2147483647 0")
				.runAndAssert();
	}

	@Test
	public void testComparisonAndEquality() {
		kestrelTest("comparisons")
				.script("print(1 < 2, 2 <= 2, 3 > 4, 4 >= 5);")
				.expectLines("true true false false")
				.runAndAssert();

		kestrelTest("strict equality")
				.script("fn f() {} fn g() {} print(1 == 1, 1 == true, true == true, print == print, f == f, f == g, f() == f(), 1 != 2);")
				.expectLines("true false true true true false true true")
				.runAndAssert();
	}

	@Test
	public void testLogicalOperators() {
		kestrelTest("truth table")
				.script("print(true && false, true || false, !true, !false && true);")
				.expectLines("false true false true")
				.runAndAssert();

		kestrelTest("&& does not evaluate its right operand when the left one is false")
				.script("print(false && (1 / 0 == 1));")
				.expectLines("false")
				.runAndAssert();

		kestrelTest("|| does not evaluate its right operand when the left one is true")
				.script("print(true || (1 / 0 == 1));")
				.expectLines("true")
				.runAndAssert();
	}

	@Test
	public void testVariables() {
		kestrelTest("shadowing in a nested block")
				.script("let x = 1; { let x = 2; print(x); } print(x);")
				.expectLines("2", "1")
				.runAndAssert();

		kestrelTest("assignment from a nested block")
				.script("let x = 1; { x = 2; } print(x);")
				.expectLines("2")
				.runAndAssert();

		kestrelTest("assignment is a right-associative expression")
				.script("let a = 1; let b = 2; a = b = 5; print(a, b, a = 6);")
				.expectLines("5 5 6")
				.runAndAssert();

		kestrelTest("redeclaration in the same scope")
				.script("let x = 1; let x = 2;")
				.expectError(Stage.RUNTIME, "Line 1, col 16: Variable already declared in this scope: 'x'.")
				.runAndAssert();

		kestrelTest("builtins live in the global scope")
				.script("let print = 1;")
				.expectError(Stage.RUNTIME, "Line 1, col 5: Variable already declared in this scope: 'print'.")
				.runAndAssert();
	}

	@Test
	public void testControlFlow() {
		kestrelTest("if and else")
				.script("if (1 < 2) print(1); else print(2); if (1 > 2) print(3); else print(4); if (false) print(5);")
				.expectLines("1", "4")
				.runAndAssert();

		kestrelTest("break leaves the loop")
				.script("while (true) { break; } print(1);")
				.expectLines("1")
				.runAndAssert();

		kestrelTest("continue skips to the condition")
				.script("let i = 0; let s = 0; while (i < 10) { i = i + 1; if (i / 2 * 2 == i) continue; s = s + i; } print(s);")
				.expectLines("25")
				.runAndAssert();

		kestrelTest("break only leaves the innermost loop")
				.script("let i = 0; while (i < 3) { i = i + 1; let j = 0; while (true) { j = j + 1; if (j == i) break; } print(i, j); }")
				.expectLines("1 1", "2 2", "3 3")
				.runAndAssert();

		kestrelTest("return from inside a loop")
				.script("fn first() { let i = 0; while (true) { i = i + 1; if (i == 3) return i; } } print(first());")
				.expectLines("3")
				.runAndAssert();
	}

	@Test
	public void testFunctions() {
		kestrelTest("recursion")
				.script("fn fib(n) { if (n < 2) return n; return fib(n - 1) + fib(n - 2); } print(fib(10));")
				.expectLines("55")
				.runAndAssert();

		kestrelTest("falling off the end returns nil")
				.script("fn f() { 1; } print(f());")
				.expectLines("nil")
				.runAndAssert();

		kestrelTest("bare return returns nil")
				.script("fn f() { return; print(1); } print(f());")
				.expectLines("nil")
				.runAndAssert();

		kestrelTest("arguments are evaluated left to right")
				.script("fn f(a, b) { return b; } f(print(1), print(2));")
				.expectLines("1", "2")
				.runAndAssert();

		kestrelTest("call chaining")
				.script("fn a() { fn b() { return 7; } return b; } print(a()());")
				.expectLines("7")
				.runAndAssert();

		kestrelTest("functions are values")
				.script("fn twice(g, x) { return g(g(x)); } fn inc(x) { return x + 1; } print(twice(inc, 5));")
				.expectLines("7")
				.runAndAssert();
	}

	@Test
	public void testClosures() {
		kestrelTest("closures see later assignments")
				.script("let x = 1; fn f() { return x; } x = 2; print(f());")
				.expectLines("2")
				.runAndAssert();

		kestrelTest("counter")
				.script("fn makeCounter() { let c = 0; fn inc() { c = c + 1; return c; } return inc; } "
						+ "let k = makeCounter(); let l = makeCounter(); k(); print(k(), l());")
				.expectLines("2 1")
				.runAndAssert();

		kestrelTest("scoping is lexical")
				.script("let x = 1; fn show() { print(x); } fn test() { let x = 2; show(); } test();")
				.expectLines("1")
				.runAndAssert();
	}

	@Test
	public void testTypeErrors() {
		kestrelTest("addition")
				.script("1 + true;")
				.expectError(Stage.RUNTIME, "Line 1, col 3: Expected number in addition, got boolean.")
				.runAndAssert();

		kestrelTest("subtraction")
				.script("print - 1;")
				.expectError(Stage.RUNTIME, "Line 1, col 7: Expected number in subtraction, got builtin.")
				.runAndAssert();

		kestrelTest("multiplication")
				.script("fn f() {} 2 * f;")
				.expectError(Stage.RUNTIME, "Line 1, col 13: Expected number in multiplication, got function.")
				.runAndAssert();

		kestrelTest("division checks the left operand first")
				.script("false / 0;")
				.expectError(Stage.RUNTIME, "Line 1, col 7: Expected number in division, got boolean.")
				.runAndAssert();

		kestrelTest("comparison")
				.script("1 < true;")
				.expectError(Stage.RUNTIME, "Line 1, col 3: Expected number in comparison, got boolean.")
				.runAndAssert();

		kestrelTest("unary minus")
				.script("-true;")
				.expectError(Stage.RUNTIME, "Line 1, col 1: Expected number in unary minus, got boolean.")
				.runAndAssert();

		kestrelTest("logical not")
				.script("!1;")
				.expectError(Stage.RUNTIME, "Line 1, col 1: Expected boolean in logical not, got number.")
				.runAndAssert();

		kestrelTest("logical and, left operand")
				.script("1 && true;")
				.expectError(Stage.RUNTIME, "Line 1, col 1: Expected boolean in logical and, got number.")
				.runAndAssert();

		kestrelTest("logical and, right operand")
				.script("true && 1;")
				.expectError(Stage.RUNTIME, "Line 1, col 9: Expected boolean in logical and, got number.")
				.runAndAssert();

		kestrelTest("logical or, right operand")
				.script("false || print;")
				.expectError(Stage.RUNTIME, "Line 1, col 10: Expected boolean in logical or, got builtin.")
				.runAndAssert();

		kestrelTest("if condition")
				.script("if (1) print(1);")
				.expectError(Stage.RUNTIME, "Line 1, col 5: Expected boolean in if condition, got number.")
				.runAndAssert();

		kestrelTest("while condition")
				.script("fn g() {} while (g()) {}")
				.expectError(Stage.RUNTIME, "Line 1, col 18: Expected boolean in while condition, got nil.")
				.runAndAssert();
	}

	@Test
	public void testRuntimeErrors() {
		kestrelTest("division by zero")
				.script("1 / 0;")
				.expectError(Stage.RUNTIME, "Line 1, col 3: Division by zero.")
				.runAndAssert();

		kestrelTest("undefined identifier, on the second line")
				.script("let a = 1;\nprint(b);")
				.expectError(Stage.RUNTIME, "Line 2, col 7: Undefined identifier 'b'.")
				.runAndAssert();

		kestrelTest("undefined assignment target")
				.script("y = 1;")
				.expectError(Stage.RUNTIME, "Line 1, col 1: Undefined variable 'y'.")
				.runAndAssert();

		kestrelTest("break outside of a loop")
				.script("break;")
				.expectError(Stage.RUNTIME, "Line 1, col 1: Break used outside of a loop.")
				.runAndAssert();

		kestrelTest("continue outside of a loop")
				.script("if (true) { continue; }")
				.expectError(Stage.RUNTIME, "Line 1, col 13: Continue used outside of a loop.")
				.runAndAssert();

		kestrelTest("return outside of a function")
				.script("return 1;")
				.expectError(Stage.RUNTIME, "Line 1, col 1: Return used outside of a function.")
				.runAndAssert();

		kestrelTest("loops of the caller are not visible from a function")
				.script("fn f() { break; } while (true) { f(); }")
				.expectError(Stage.RUNTIME, "Line 1, col 10: Break used outside of a loop.")
				.runAndAssert();

		kestrelTest("calling a number")
				.script("let x = 1; x();")
				.expectError(Stage.RUNTIME, "Line 1, col 12: Can only call functions or builtins.")
				.runAndAssert();

		kestrelTest("too few arguments")
				.script("fn f(a, b) { return a; } f(1);")
				.expectError(Stage.RUNTIME, "Line 1, col 27: Expected 2 arguments but got 1.")
				.runAndAssert();

		kestrelTest("arity is checked before the arguments are evaluated")
				.script("fn f(a) { return a; } f(print(1), print(2));")
				.expectLines()
				.expectError(Stage.RUNTIME, "Line 1, col 24: Expected 1 arguments but got 2.")
				.runAndAssert();

		kestrelTest("duplicate parameter")
				.script("fn f(a, a) { } f(1, 2);")
				.expectError(Stage.RUNTIME, "Line 1, col 9: Duplicate parameter name 'a'.")
				.runAndAssert();

		kestrelTest("function redeclaration")
				.script("fn f() {} fn f() {}")
				.expectError(Stage.RUNTIME, "Line 1, col 14: Function already declared in this scope: 'f'.")
				.runAndAssert();

		kestrelTest("a parameter cannot be redeclared in the body")
				.script("fn f(a) { let a = 2; } f(1);")
				.expectError(Stage.RUNTIME, "Line 1, col 15: Variable already declared in this scope: 'a'.")
				.runAndAssert();

		kestrelTest("output printed before the error is kept, later statements do not run")
				.script("print(1); print(x); print(2);")
				.expectLines("1")
				.expectError(Stage.RUNTIME, "Line 1, col 17: Undefined identifier 'x'.")
				.runAndAssert();

		kestrelTest("error inside a function body")
				.script("fn f() { return 1 / 0; } print(f());")
				.expectLines()
				.expectError(Stage.RUNTIME, "Line 1, col 19: Division by zero.")
				.runAndAssert();
	}

	@Test
	public void testCallDepth() {
		kestrelTest("runaway recursion")
				.script("fn r(n) { return r(n + 1); } r(0);")
				.maxCallDepth(10)
				.expectError(Stage.RUNTIME, "Line 1, col 19: Maximum call depth exceeded.")
				.runAndAssert();

		kestrelTest("recursion within the default limit")
				.script("fn d(n) { if (n == 0) return 0; return d(n - 1) + 1; } print(d(200));")
				.expectLines("200")
				.runAndAssert();

		kestrelTest("recursion beyond the default limit")
				.script("fn d(n) { if (n == 0) return 0; return d(n - 1) + 1; } print(d(300));")
				.expectError(Stage.RUNTIME, "Line 1, col 41: Maximum call depth exceeded.")
				.runAndAssert();

		kestrelTest("no limit stops at the end of the Java stack")
				.script("fn d(n) { if (n == 0) return 0; return d(n - 1) + 1; } print(d(1000000));")
				.maxCallDepth(0)
				.expectLines()
				.expectError(Stage.RUNTIME, "Line 1, col 41: Maximum call depth exceeded.")
				.runAndAssert();
	}

	@Test
	public void testNoCallDepthLimitOnLargeStack() throws Throwable {
		final Throwable[] failure = new Throwable[1];
		Runnable deepRecursion = new Runnable() {
			@Override
			public void run() {
				try {
					kestrelTest("no limit")
							.script("fn d(n) { if (n == 0) return 0; return d(n - 1) + 1; } print(d(1000));")
							.maxCallDepth(0)
							.expectLines("1000")
							.runAndAssert();
				} catch (Throwable t) {
					failure[0] = t;
				}
			}
		};
		Thread thread = new Thread(null, deepRecursion, "deep-recursion", 512L * 1024 * 1024);
		thread.start();
		thread.join();
		if (failure[0] != null) {
			throw failure[0];
		}
	}

	@Test
	public void testDeeplyNestedSource() {
		StringBuilder source = new StringBuilder("print(");
		for (int i = 0; i < 20000; i++) {
			source.append('(');
		}
		source.append('1');
		for (int i = 0; i < 20000; i++) {
			source.append(')');
		}
		source.append(");");

		RunResult result = KESTREL.execute(source.toString());
		assertEquals(Stage.PARSE, result.getFailedStage());
		assertEquals(1, result.getDiagnostics().size());
		assertTrue(result.getDiagnostics().get(0), result.getDiagnostics().get(0).endsWith("Too deeply nested."));
	}

	@Test
	public void testStages() {
		kestrelTest("lexical errors stop the run before parsing")
				.script("let x = 1 & 2; let = ;")
				.expectError(Stage.LEX, "Line 1, col 11: Unexpected '&' without pair.")
				.runAndAssert();

		kestrelTest("syntax errors stop the run before interpreting")
				.script("print(1); let = 1; let y 2;")
				.expectLines()
				.expectError(
						Stage.PARSE,
						"Line 1, col 15: Expect variable name after 'let'.",
						"Line 1, col 26: Expect '=' after variable name.")
				.runAndAssert();

		kestrelTest("invalid assignment target")
				.script("1 = 2;")
				.expectError(Stage.PARSE, "Line 1, col 3: Invalid assignment target.")
				.runAndAssert();
	}

	@Test
	public void testRun() {
		assertEquals("3\n", KESTREL.run("print(1 + 2);"));
		assertEquals("", KESTREL.run("// nothing to see"));
	}

	@Test
	public void testRunFailure() {
		try {
			KESTREL.run("print(1);\n1 / 0;");
			fail("A runtime error must throw");
		} catch (KestrelException e) {
			assertEquals(Stage.RUNTIME, e.getStage());
			assertEquals(Collections.singletonList("Line 2, col 3: Division by zero."), e.getDiagnostics());
			assertEquals("RUNTIME failed:\nLine 2, col 3: Division by zero.", e.getMessage());
		}

		try {
			KESTREL.run("@ #");
			fail("A lexical error must throw");
		} catch (KestrelException e) {
			assertEquals(Stage.LEX, e.getStage());
			assertEquals(
					Arrays.asList("Line 1, col 1: Unexpected character.", "Line 1, col 3: Unexpected character."),
					e.getDiagnostics());
		}
	}

	@Test
	public void testExecute() {
		RunResult result = KESTREL.execute("let x = 1;");
		assertTrue(result.isSuccess());
		assertNull(result.getFailedStage());
		assertTrue(result.getDiagnostics().isEmpty());

		result = KESTREL.execute("let x = ;");
		assertFalse(result.isSuccess());
		assertEquals(Stage.PARSE, result.getFailedStage());
		assertEquals(Collections.singletonList("Line 1, col 9: Expect expression."), result.getDiagnostics());
	}

	@Test
	public void testEachInterpretCallStartsFresh() {
		Kestrel kestrel = new Kestrel();
		assertTrue(kestrel.interpret(kestrel.parse(kestrel.scan("let x = 1;").getTokens()).getStatements()).isEmpty());
		assertTrue(kestrel.interpret(kestrel.parse(kestrel.scan("let x = 2;").getTokens()).getStatements()).isEmpty());
	}

	@Test(expected = NullPointerException.class)
	public void testNullSource() {
		KESTREL.execute(null);
	}
}
