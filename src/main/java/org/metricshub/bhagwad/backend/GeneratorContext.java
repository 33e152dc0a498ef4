package org.metricshub.bhagwad.backend;

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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.metricshub.bhagwad.util.TranslatorSettings;

/**
 * State of one generation: the lines produced so far, the current
 * indentation depth and the names in scope.
 * <p>
 * Names live in nested scopes, one per block. A constant is spelled in
 * upper case wherever it is in scope. Any other declaration, parameter, loop
 * variable or error variable of an inner block hides a constant of the same
 * name until the end of that block. A name that is a Python keyword gets a
 * trailing underscore.
 * <p>
 * A new context is created for each call to
 * {@link PythonGenerator#generate(org.metricshub.bhagwad.frontend.ast.ProgramAst)}.
 */
public class GeneratorContext {

	private static final Set<String> PYTHON_KEYWORDS = new HashSet<String>(
			Arrays
					.asList(
							"False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
							"continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
							"if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
							"return", "try", "while", "with", "yield"));

	private final List<String> lines = new ArrayList<String>();
	// innermost scope first; maps a name to whether it is a constant
	private final Deque<Map<String, Boolean>> scopes = new ArrayDeque<Map<String, Boolean>>();
	private final Map<String, Set<String>> moduleConstants = new HashMap<String, Set<String>>();
	private final String indentUnit;
	private final boolean annotations;
	private int level;

	/**
	 * @param settings settings of the translation
	 */
	public GeneratorContext(TranslatorSettings settings) {
		StringBuilder unit = new StringBuilder();
		for (int i = 0; i < settings.getIndent(); i++) {
			unit.append(' ');
		}
		this.indentUnit = unit.toString();
		this.annotations = settings.isEmitAnnotations();
		scopes.push(new HashMap<String, Boolean>());
	}

	/**
	 * Appends a line at the current indentation. A blank line is kept empty.
	 *
	 * @param code the line, without indentation
	 */
	public void emit(String code) {
		if (code.trim().isEmpty()) {
			lines.add("");
			return;
		}
		StringBuilder line = new StringBuilder();
		for (int i = 0; i < level; i++) {
			line.append(indentUnit);
		}
		lines.add(line.append(code).toString());
	}

	/**
	 * Appends a line followed by a comment naming the construct it comes from,
	 * unless annotations are disabled.
	 *
	 * @param code the line, without indentation
	 * @param annotation the comment text
	 */
	public void emit(String code, String annotation) {
		if (annotations) {
			emit(code + "  # " + annotation);
		} else {
			emit(code);
		}
	}

	/**
	 * Appends a line without indentation.
	 *
	 * @param code the line
	 */
	public void emitRaw(String code) {
		lines.add(code);
	}

	public void blankLine() {
		lines.add("");
	}

	public void indent() {
		level++;
	}

	public void dedent() {
		if (level == 0) {
			throw new IllegalStateException("Indentation is already at the top level");
		}
		level--;
	}

	public int getLevel() {
		return level;
	}

	/**
	 * @return whether comment lines describing constructs are generated
	 */
	public boolean isAnnotations() {
		return annotations;
	}

	/**
	 * Opens the scope of a block.
	 */
	public void enterScope() {
		scopes.push(new HashMap<String, Boolean>());
	}

	/**
	 * Closes the innermost scope, forgetting the names declared in it.
	 */
	public void exitScope() {
		if (scopes.size() == 1) {
			throw new IllegalStateException("The global scope cannot be closed");
		}
		scopes.pop();
	}

	/**
	 * Declares a constant in the innermost scope.
	 *
	 * @param name name of the constant, as declared
	 * @return the name of the constant in the Python code
	 */
	public String declareConstant(String name) {
		scopes.peek().put(name, Boolean.TRUE);
		return pythonName(name);
	}

	/**
	 * Declares a variable, parameter, function or module in the innermost
	 * scope, hiding any constant of the same name from the outer scopes.
	 *
	 * @param name the name, as declared
	 * @return the name in the Python code
	 */
	public String declare(String name) {
		scopes.peek().put(name, Boolean.FALSE);
		return safeName(name);
	}

	/**
	 * @param name a name
	 * @return whether the innermost declaration of this name in scope is a constant
	 */
	public boolean isConstant(String name) {
		for (Map<String, Boolean> scope : scopes) {
			Boolean constant = scope.get(name);
			if (constant != null) {
				return constant.booleanValue();
			}
		}
		return false;
	}

	/**
	 * @param name a name as written in the Bhagwad script
	 * @return the name under which it appears in the Python code
	 */
	public String pythonName(String name) {
		if (isConstant(name)) {
			return safeName(name.toUpperCase(Locale.ROOT));
		}
		return safeName(name);
	}

	/**
	 * Records a constant declared in the body of a module, so that
	 * {@code Module.name} is spelled like the declaration.
	 *
	 * @param module name of the module
	 * @param name name of the constant
	 */
	public void addModuleConstant(String module, String name) {
		Set<String> names = moduleConstants.get(module);
		if (names == null) {
			names = new HashSet<String>();
			moduleConstants.put(module, names);
		}
		names.add(name);
	}

	/**
	 * @param owner the name written before the dot
	 * @param member the name written after the dot
	 * @return the member name in the Python code
	 */
	public String memberName(String owner, String member) {
		Set<String> names = moduleConstants.get(owner);
		if (names != null && names.contains(member) && !isDeclaredLocally(owner)) {
			return safeName(member.toUpperCase(Locale.ROOT));
		}
		return safeName(member);
	}

	/**
	 * A module is always declared at the top level, so a declaration of the
	 * same name in an inner scope hides it.
	 */
	private boolean isDeclaredLocally(String name) {
		int depth = 0;
		for (Map<String, Boolean> scope : scopes) {
			if (++depth == scopes.size()) {
				return false;
			}
			if (scope.containsKey(name)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @param name an identifier
	 * @return the identifier, followed by an underscore if it is a Python keyword
	 */
	public static String safeName(String name) {
		return PYTHON_KEYWORDS.contains(name) ? name + "_" : name;
	}

	/**
	 * @return the lines produced so far
	 */
	public List<String> getLines() {
		return Collections.unmodifiableList(lines);
	}

	/**
	 * @return the lines produced so far, joined with line feeds
	 */
	public String toText() {
		return String.join("\n", lines);
	}
}
