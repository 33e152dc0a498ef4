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

import org.metricshub.bhagwad.TranslationException;
import org.metricshub.bhagwad.frontend.ast.AstNode;

/**
 * Raised when a syntax tree cannot be translated, which only happens with
 * trees built by hand: the parser never produces a node with a missing
 * required child.
 */
public class GenerationException extends TranslationException {

	private static final long serialVersionUID = 1L;

	/**
	 * @param msg description of the problem
	 * @param node the node that cannot be translated
	 */
	public GenerationException(String msg, AstNode node) {
		super(msg, node.getLine(), node.getColumn());
	}

	/**
	 * @param msg description of the problem
	 * @param sourceDescription name of the script
	 * @param lineno line of the node
	 * @param column column of the node
	 */
	public GenerationException(String msg, String sourceDescription, int lineno, int column) {
		super(msg, sourceDescription, lineno, column);
	}

	/** {@inheritDoc} */
	@Override
	public GenerationException withSourceDescription(String description) {
		GenerationException copy = new GenerationException(getMessage(), description, getLineNumber(), getColumnNumber());
		copy.initCause(this);
		return copy;
	}
}
