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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.metricshub.bhagwad.frontend.ast.LexerException;

/**
 * Converts the text of a Bhagwad script into a flat list of tokens.
 * <p>
 * The lexer performs a single forward pass over the characters. Line breaks
 * are not skipped: they separate statements and are consumed by the parser.
 * Comments are kept as {@link TokenKind#COMMENT} tokens, which the parser
 * ignores.
 * <p>
 * An instance holds the cursor of one pass and must not be shared.
 */
public class Lexer {

	/**
	 * Contains a mapping of Bhagwad keywords to their token kinds.
	 * Keywords are matched case-insensitively, so keys are lower case.
	 */
	private static final Map<String, TokenKind> KEYWORDS = new HashMap<String, TokenKind>();

	static {
		// statements
		KEYWORDS.put("shloka", TokenKind.SHLOKA);
		KEYWORDS.put("dharma", TokenKind.DHARMA);
		KEYWORDS.put("adharma", TokenKind.ADHARMA);
		KEYWORDS.put("karma", TokenKind.KARMA);
		KEYWORDS.put("arjuna", TokenKind.ARJUNA);
		KEYWORDS.put("manifest", TokenKind.MANIFEST);
		KEYWORDS.put("moksha", TokenKind.MOKSHA);
		KEYWORDS.put("maya", TokenKind.MAYA);
		KEYWORDS.put("sankalpa", TokenKind.SANKALPA);
		KEYWORDS.put("yuga", TokenKind.YUGA);
		KEYWORDS.put("meditation", TokenKind.MEDITATION);
		KEYWORDS.put("disturbance", TokenKind.DISTURBANCE);
		KEYWORDS.put("cosmic", TokenKind.COSMIC);

		// types (gunas)
		KEYWORDS.put("sattva", TokenKind.SATTVA);
		KEYWORDS.put("rajas", TokenKind.RAJAS);
		KEYWORDS.put("tamas", TokenKind.TAMAS);

		// loop ranges
		KEYWORDS.put("from", TokenKind.FROM);
		KEYWORDS.put("to", TokenKind.TO);
		KEYWORDS.put("in", TokenKind.IN);

		KEYWORDS.put("true", TokenKind.BOOLEAN);
		KEYWORDS.put("false", TokenKind.BOOLEAN);
	}

	/**
	 * Operators and delimiters made of one character.
	 */
	private static final Map<Character, TokenKind> SINGLE_CHARS = new HashMap<Character, TokenKind>();

	static {
		SINGLE_CHARS.put('+', TokenKind.PLUS);
		SINGLE_CHARS.put('-', TokenKind.MINUS);
		SINGLE_CHARS.put('*', TokenKind.MULTIPLY);
		SINGLE_CHARS.put('/', TokenKind.DIVIDE);
		SINGLE_CHARS.put('%', TokenKind.MODULO);
		SINGLE_CHARS.put('=', TokenKind.ASSIGN);
		SINGLE_CHARS.put('<', TokenKind.LESS_THAN);
		SINGLE_CHARS.put('>', TokenKind.GREATER_THAN);
		SINGLE_CHARS.put('(', TokenKind.LEFT_PAREN);
		SINGLE_CHARS.put(')', TokenKind.RIGHT_PAREN);
		SINGLE_CHARS.put('{', TokenKind.LEFT_BRACE);
		SINGLE_CHARS.put('}', TokenKind.RIGHT_BRACE);
		SINGLE_CHARS.put('[', TokenKind.LEFT_BRACKET);
		SINGLE_CHARS.put(']', TokenKind.RIGHT_BRACKET);
		SINGLE_CHARS.put(',', TokenKind.COMMA);
		SINGLE_CHARS.put(';', TokenKind.SEMICOLON);
		SINGLE_CHARS.put('.', TokenKind.DOT);
	}

	private final String source;
	private int position;
	private int line = 1;
	private int column = 1;

	private final List<Token> tokens = new ArrayList<Token>();
	private final StringBuilder text = new StringBuilder();

	/**
	 * @param source text of the script
	 */
	public Lexer(String source) {
		this.source = source == null ? "" : source;
	}

	/**
	 * Returns whether the specified word is a reserved word of the language,
	 * whatever its case.
	 *
	 * @param word the word to check
	 * @return {@code true} if the word is a keyword, a type name or a boolean literal
	 */
	public static boolean isKeyword(String word) {
		return KEYWORDS.containsKey(word.toLowerCase(Locale.ROOT));
	}

	/**
	 * Convenience method that tokenizes the specified script.
	 *
	 * @param source text of the script
	 * @return the tokens, the last one being {@link TokenKind#EOF}
	 * @throws LexerException if the script contains an invalid character
	 */
	public static List<Token> tokenize(String source) {
		return new Lexer(source).tokenize();
	}

	/**
	 * Reads the whole script.
	 *
	 * @return the tokens, the last one being {@link TokenKind#EOF}
	 * @throws LexerException if the script contains an invalid character
	 *         or an unterminated string
	 */
	public List<Token> tokenize() {
		while (position < source.length()) {
			skipWhitespaces();
			if (position >= source.length()) {
				break;
			}

			char c = current();
			int startLine = line;
			int startColumn = column;

			if (c == '/' && peek() == '/') {
				tokens.add(new Token(TokenKind.COMMENT, readComment(), startLine, startColumn));
			} else if (c == '\n') {
				advance();
				tokens.add(new Token(TokenKind.NEWLINE, "\n", startLine, startColumn));
			} else if (c == '"' || c == '\'') {
				tokens.add(new Token(TokenKind.STRING, readString(), startLine, startColumn));
			} else if (isAsciiDigit(c)) {
				tokens.add(new Token(TokenKind.NUMBER, readNumber(), startLine, startColumn));
			} else if (Character.isLetter(c) || c == '_') {
				String word = readIdentifier();
				TokenKind kind = KEYWORDS.get(word.toLowerCase(Locale.ROOT));
				tokens.add(new Token(kind == null ? TokenKind.IDENTIFIER : kind, word, startLine, startColumn));
			} else {
				tokens.add(readOperator(startLine, startColumn));
			}
		}
		tokens.add(new Token(TokenKind.EOF, "", line, column));
		return Collections.unmodifiableList(tokens);
	}

	private char current() {
		return source.charAt(position);
	}

	private int peek() {
		return position + 1 < source.length() ? source.charAt(position + 1) : -1;
	}

	private void advance() {
		if (source.charAt(position) == '\n') {
			line++;
			column = 1;
		} else {
			column++;
		}
		position++;
	}

	/**
	 * Skip spaces, tabs and carriage returns, but not line breaks
	 */
	private void skipWhitespaces() {
		while (position < source.length()) {
			char c = current();
			if (c != ' ' && c != '\t' && c != '\r') {
				return;
			}
			advance();
		}
	}

	private String readComment() {
		// skip the two slashes
		advance();
		advance();
		text.setLength(0);
		while (position < source.length() && current() != '\n') {
			text.append(current());
			advance();
		}
		return text.toString().trim();
	}

	/**
	 * Reads the string and handle the escape codes.
	 * An escape code that is not recognized stands for the escaped character.
	 */
	private String readString() {
		int startLine = line;
		int startColumn = column;
		char quote = current();
		advance();
		text.setLength(0);
		while (position < source.length() && current() != quote) {
			char c = current();
			if (c == '\\') {
				advance();
				if (position >= source.length()) {
					break;
				}
				c = current();
				switch (c) {
				case 'n':
					text.append('\n');
					break;
				case 'r':
					text.append('\r');
					break;
				case 't':
					text.append('\t');
					break;
				default:
					// covers \\, \" and \' as well
					text.append(c);
					break;
				}
			} else {
				text.append(c);
			}
			advance();
		}
		if (position >= source.length()) {
			throw new LexerException("Unterminated string", startLine, startColumn);
		}
		// closing quote
		advance();
		return text.toString();
	}

	/**
	 * Reads a run of digits with at most one decimal point.
	 */
	private String readNumber() {
		text.setLength(0);
		boolean seenDot = false;
		while (position < source.length()) {
			char c = current();
			if (isAsciiDigit(c)) {
				text.append(c);
			} else if (c == '.' && !seenDot) {
				seenDot = true;
				text.append(c);
			} else {
				break;
			}
			advance();
		}
		return text.toString();
	}

	private String readIdentifier() {
		text.setLength(0);
		while (position < source.length() && (Character.isLetterOrDigit(current()) || current() == '_')) {
			text.append(current());
			advance();
		}
		return text.toString();
	}

	private Token readOperator(int startLine, int startColumn) {
		char c = current();
		int next = peek();

		// two-character operators first
		TokenKind twoChars = null;
		if (c == '=' && next == '=') {
			twoChars = TokenKind.EQUALS;
		} else if (c == '!' && next == '=') {
			twoChars = TokenKind.NOT_EQUALS;
		} else if (c == '<' && next == '=') {
			twoChars = TokenKind.LESS_EQUAL;
		} else if (c == '>' && next == '=') {
			twoChars = TokenKind.GREATER_EQUAL;
		} else if (c == '-' && next == '>') {
			twoChars = TokenKind.ARROW;
		}
		if (twoChars != null) {
			advance();
			advance();
			return new Token(twoChars, new String(new char[] { c, (char) next }), startLine, startColumn);
		}

		TokenKind single = SINGLE_CHARS.get(c);
		if (single != null) {
			advance();
			return new Token(single, String.valueOf(c), startLine, startColumn);
		}

		throw new LexerException("Unexpected character '" + c + "'", startLine, startColumn);
	}

	private static boolean isAsciiDigit(char c) {
		return c >= '0' && c <= '9';
	}
}
