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

import java.util.Objects;

/**
 * One lexical token: its kind, its text and where it starts in the script.
 * <p>
 * For {@link TokenKind#STRING} tokens, the text is the value of the
 * literal, with escape sequences already resolved. For
 * {@link TokenKind#COMMENT} tokens, it is the body of the comment without
 * the leading {@code //}. For all other kinds, it is the text as written.
 */
public final class Token {

	private final TokenKind kind;
	private final String text;
	private final int line;
	private final int column;

	/**
	 * @param kind kind of the token
	 * @param text text of the token
	 * @param line 1-based line where the token starts
	 * @param column 1-based column where the token starts
	 */
	public Token(TokenKind kind, String text, int line, int column) {
		this.kind = Objects.requireNonNull(kind, "kind");
		this.text = Objects.requireNonNull(text, "text");
		this.line = line;
		this.column = column;
	}

	public TokenKind getKind() {
		return kind;
	}

	public String getText() {
		return text;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	/**
	 * @param candidate the kind to compare with
	 * @return whether this token is of the specified kind
	 */
	public boolean is(TokenKind candidate) {
		return kind == candidate;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof Token)) {
			return false;
		}
		Token that = (Token) other;
		return kind == that.kind && line == that.line && column == that.column && text.equals(that.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, text, line, column);
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return kind + "(" + text.replace("\n", "\\n") + ") at " + line + ":" + column;
	}
}
