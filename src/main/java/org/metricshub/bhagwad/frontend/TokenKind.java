package org.metricshub.bhagwad.frontend;

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

/**
 * Lexer token kinds.
 * <p>
 * The Bhagwad keywords are themed after the Bhagavad Gita. The
 * comment next to each keyword gives its conventional meaning.
 */
public enum TokenKind {
	// keywords
	SHLOKA, // function
	DHARMA, // if
	ADHARMA, // else
	KARMA, // loop
	ARJUNA, // main block
	MANIFEST, // print
	MOKSHA, // return
	MAYA, // variable
	SANKALPA, // constant
	YUGA, // module
	MEDITATION, // try
	DISTURBANCE, // catch
	COSMIC, // array type

	// primitive types
	SATTVA, // integer
	RAJAS, // string
	TAMAS, // boolean

	// literals
	NUMBER,
	STRING,
	BOOLEAN,
	IDENTIFIER,

	// operators
	PLUS,
	MINUS,
	MULTIPLY,
	DIVIDE,
	MODULO,
	ASSIGN,
	EQUALS,
	NOT_EQUALS,
	LESS_THAN,
	GREATER_THAN,
	LESS_EQUAL,
	GREATER_EQUAL,

	// delimiters
	LEFT_PAREN,
	RIGHT_PAREN,
	LEFT_BRACE,
	RIGHT_BRACE,
	LEFT_BRACKET,
	RIGHT_BRACKET,
	COMMA,
	SEMICOLON,
	ARROW,
	DOT,

	// loop ranges
	FROM,
	TO,
	IN,

	NEWLINE,
	COMMENT,
	EOF;

	/**
	 * @return whether this kind names one of the three primitive types
	 */
	public boolean isPrimitiveType() {
		return this == SATTVA || this == RAJAS || this == TAMAS;
	}
}
