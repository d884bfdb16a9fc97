package org.metricshub.kestrel;

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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import org.metricshub.kestrel.backend.TreeWalkingInterpreter;
import org.metricshub.kestrel.frontend.Lexer;
import org.metricshub.kestrel.frontend.ParseResult;
import org.metricshub.kestrel.frontend.Parser;
import org.metricshub.kestrel.frontend.ScanResult;
import org.metricshub.kestrel.frontend.Token;
import org.metricshub.kestrel.frontend.ast.Stmt;
import org.metricshub.kestrel.util.KestrelLogger;
import org.metricshub.kestrel.util.KestrelSettings;
import org.slf4j.Logger;

/**
 * Entry point into the scanning, parsing and execution of a Kestrel script.
 * <p>
 * The overall process to execute a Kestrel script is as follows:
 * <ul>
 * <li>Scan the source, producing a list of tokens.
 * <li>Parse the tokens, producing a list of statements.
 * <li>Walk the statements with a fresh interpreter.
 * </ul>
 * Each stage reports its errors as formatted diagnostics, and a stage only
 * runs when the previous one reported none.
 *
 * @see org.metricshub.kestrel.backend.TreeWalkingInterpreter
 */
public class Kestrel {

	private static final Logger LOG = KestrelLogger.getLogger(Kestrel.class);

	private final KestrelSettings settings;

	/**
	 * Create a new instance of Kestrel with the default settings.
	 */
	public Kestrel() {
		this(new KestrelSettings());
	}

	/**
	 * Create a new instance of Kestrel with the specified settings.
	 *
	 * @param settings output stream and limits of the runs
	 */
	public Kestrel(KestrelSettings settings) {
		this.settings = Objects.requireNonNull(settings, "settings");
	}

	public KestrelSettings getSettings() {
		return settings;
	}

	/**
	 * Scans the specified source.
	 *
	 * @param source script text
	 * @return the tokens and the lexical errors
	 */
	public ScanResult scan(String source) {
		ScanResult result = Lexer.scan(Objects.requireNonNull(source, "source"));
		LOG.debug("Scanned {} tokens, {} errors", result.getTokens().size(), result.getErrors().size());
		return result;
	}

	/**
	 * Parses the specified tokens.
	 *
	 * @param tokens tokens ending with an end-of-file token
	 * @return the statements and the syntax errors
	 */
	public ParseResult parse(List<Token> tokens) {
		ParseResult result = Parser.parse(tokens);
		LOG.debug("Parsed {} statements, {} errors", result.getStatements().size(), result.getErrors().size());
		return result;
	}

	/**
	 * Interprets the specified statements with a fresh interpreter.
	 *
	 * @param statements parsed program
	 * @return the runtime error, if any
	 */
	public List<String> interpret(List<Stmt> statements) {
		return interpret(statements, settings);
	}

	private List<String> interpret(List<Stmt> statements, KestrelSettings runSettings) {
		if (LOG.isDebugEnabled()) {
			LOG.debug("Interpreting {} statements with settings:\n{}", statements.size(), runSettings.toDescriptionString());
		}
		return new TreeWalkingInterpreter(runSettings).interpret(statements);
	}

	/**
	 * Runs the specified script through all the stages, stopping at the first
	 * stage which reports errors.
	 *
	 * @param source script text
	 * @return the failed stage, if any, and its diagnostics
	 */
	public RunResult execute(String source) {
		return execute(source, settings);
	}

	private RunResult execute(String source, KestrelSettings runSettings) {
		ScanResult scanned = scan(source);
		if (scanned.hasErrors()) {
			return failure(Stage.LEX, scanned.getErrors());
		}
		ParseResult parsed = parse(scanned.getTokens());
		if (parsed.hasErrors()) {
			return failure(Stage.PARSE, parsed.getErrors());
		}
		List<String> errors = interpret(parsed.getStatements(), runSettings);
		if (!errors.isEmpty()) {
			return failure(Stage.RUNTIME, errors);
		}
		return new RunResult(null, errors);
	}

	private static RunResult failure(Stage stage, List<String> diagnostics) {
		LOG.debug("{} stage stopped the run with {} errors", stage, diagnostics.size());
		return new RunResult(stage, diagnostics);
	}

	/**
	 * Runs the specified script and returns what it printed.
	 *
	 * @param source script text
	 * @return output of the script, decoded as UTF-8
	 * @throws KestrelException when a stage reports errors
	 */
	public String run(String source) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		PrintStream printStream;
		try {
			printStream = new PrintStream(out, true, StandardCharsets.UTF_8.name());
		} catch (UnsupportedEncodingException e) {
			throw new IllegalStateException(e);
		}
		RunResult result = execute(source, settings.withOutputStream(printStream));
		printStream.flush();
		if (!result.isSuccess()) {
			throw new KestrelException(result.getFailedStage(), result.getDiagnostics());
		}
		return new String(out.toByteArray(), StandardCharsets.UTF_8);
	}
}
