package org.metricshub.bhagwad;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Bhagwad
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
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

import java.io.IOException;
import java.util.List;
import org.metricshub.bhagwad.backend.PythonGenerator;
import org.metricshub.bhagwad.frontend.BhagwadParser;
import org.metricshub.bhagwad.frontend.Lexer;
import org.metricshub.bhagwad.frontend.Token;
import org.metricshub.bhagwad.frontend.ast.ProgramAst;
import org.metricshub.bhagwad.util.BhagwadLogger;
import org.metricshub.bhagwad.util.ScriptSource;
import org.metricshub.bhagwad.util.TranslatorSettings;
import org.slf4j.Logger;

/**
 * Entry point into the translation of Bhagwad scripts to Python 3.
 * This entry point is used when Bhagwad is used as a library.
 * If you want to translate scripts from the command line,
 * please use {@link Cli}.
 * <p>
 * The translation runs in three stages: the {@link Lexer} turns the text
 * into tokens, the {@link BhagwadParser} turns the tokens into a syntax tree,
 * and the {@link PythonGenerator} turns the tree into Python code. Each
 * stage is also available on its own.
 * <p>
 * An instance only holds its settings, so it may be shared between threads.
 *
 * <pre>
 * String python = new Bhagwad().translate("arjuna { manifest \"Om\" }");
 * </pre>
 */
public class Bhagwad {

	private static final Logger LOG = BhagwadLogger.getLogger(Bhagwad.class);

	private final TranslatorSettings settings;

	private final PythonGenerator generator;

	/**
	 * Create a new instance of Bhagwad with default settings
	 */
	public Bhagwad() {
		this(new TranslatorSettings());
	}

	/**
	 * Create a new instance of Bhagwad with the specified settings.
	 * A copy of the settings is kept.
	 *
	 * @param settings settings of the generated code
	 */
	public Bhagwad(TranslatorSettings settings) {
		this.settings = new TranslatorSettings(settings);
		this.generator = new PythonGenerator(this.settings);
	}

	/**
	 * @return a copy of the settings of this translator
	 */
	public TranslatorSettings getSettings() {
		return new TranslatorSettings(settings);
	}

	/**
	 * Translates the specified script.
	 *
	 * @param source text of the Bhagwad script
	 * @return the Python source code
	 * @throws TranslationException if the script is invalid
	 */
	public String translate(String source) {
		return generate(parse(tokenize(source)));
	}

	/**
	 * Translates the script served by the specified source. Errors report
	 * the description of the source.
	 *
	 * @param source the script and its description
	 * @return the Python source code
	 * @throws IOException upon an error while reading the script
	 * @throws TranslationException if the script is invalid
	 */
	public String translate(ScriptSource source) throws IOException {
		String script = source.readScript();
		LOG.debug("Translating {}", source.getDescription());
		try {
			return translate(script);
		} catch (TranslationException e) {
			throw e.withSourceDescription(source.getDescription());
		}
	}

	/**
	 * Splits the specified script into tokens.
	 *
	 * @param source text of the Bhagwad script
	 * @return the tokens, the last one being the end-of-input marker
	 * @throws org.metricshub.bhagwad.frontend.ast.LexerException if the script
	 *         contains an invalid character or an unterminated string
	 */
	public List<Token> tokenize(String source) {
		List<Token> tokens = Lexer.tokenize(source);
		LOG.debug("Lexer produced {} tokens", tokens.size());
		return tokens;
	}

	/**
	 * Builds the syntax tree of a tokenized script.
	 *
	 * @param tokens tokens produced by {@link #tokenize(String)}
	 * @return the root of the syntax tree
	 * @throws org.metricshub.bhagwad.frontend.ast.ParserException upon the first syntax error
	 */
	public ProgramAst parse(List<Token> tokens) {
		ProgramAst program = new BhagwadParser(tokens).parse();
		LOG.debug("Parser produced {} top-level statements", program.getStatements().size());
		return program;
	}

	/**
	 * Builds the syntax tree of the specified script.
	 *
	 * @param source text of the Bhagwad script
	 * @return the root of the syntax tree
	 * @throws TranslationException if the script is invalid
	 */
	public ProgramAst parse(String source) {
		return parse(tokenize(source));
	}

	/**
	 * Generates the Python code of a syntax tree.
	 *
	 * @param program root of the syntax tree
	 * @return the Python source code
	 * @throws org.metricshub.bhagwad.backend.GenerationException if the tree lacks a required node
	 */
	public String generate(ProgramAst program) {
		List<String> lines = generator.generateLines(program).getLines();
		LOG.debug("Generator produced {} lines", lines.size());
		return String.join("\n", lines);
	}
}
