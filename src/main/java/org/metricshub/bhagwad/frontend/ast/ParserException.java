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
import org.metricshub.bhagwad.frontend.Token;

/**
 * Raised by the parser when the token sequence violates the grammar,
 * e.g. a missing delimiter or a malformed loop header.
 * <p>
 * The message describes the construct that was expected, and the
 * position is the one of the offending token.
 */
public class ParserException extends TranslationException {

	private static final long serialVersionUID = 1L;

	private final transient Token token;

	/**
	 * @param msg description of the expected construct
	 * @param token the offending token
	 */
	public ParserException(String msg, Token token) {
		this(msg, null, token);
	}

	/**
	 * @param msg description of the expected construct
	 * @param sourceDescription name of the script
	 * @param token the offending token
	 */
	public ParserException(String msg, String sourceDescription, Token token) {
		super(msg, sourceDescription, token.getLine(), token.getColumn());
		this.token = token;
	}

	/**
	 * @return the token on which the parser failed
	 */
	public Token getToken() {
		return token;
	}

	/** {@inheritDoc} */
	@Override
	public ParserException withSourceDescription(String description) {
		ParserException copy = new ParserException(getMessage(), description, token);
		copy.initCause(this);
		return copy;
	}
}
