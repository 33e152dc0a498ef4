package org.metricshub.bhagwad.frontend.ast;

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

/**
 * Raised by the lexer when the script contains a character sequence
 * that does not form a valid token. Lexical errors are fatal: tokenization
 * stops at the first one.
 */
public class LexerException extends TranslationException {

	private static final long serialVersionUID = 1L;

	/**
	 * @param msg description of the problem
	 * @param lineno 1-based line of the offending character
	 * @param column 1-based column of the offending character
	 */
	public LexerException(String msg, int lineno, int column) {
		super(msg, lineno, column);
	}

	/**
	 * @param msg description of the problem
	 * @param sourceDescription name of the script
	 * @param lineno 1-based line of the offending character
	 * @param column 1-based column of the offending character
	 */
	public LexerException(String msg, String sourceDescription, int lineno, int column) {
		super(msg, sourceDescription, lineno, column);
	}

	/** {@inheritDoc} */
	@Override
	public LexerException withSourceDescription(String description) {
		LexerException copy = new LexerException(getMessage(), description, getLineNumber(), getColumnNumber());
		copy.initCause(this);
		return copy;
	}
}
