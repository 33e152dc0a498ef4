package org.metricshub.bhagwad.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.bhagwad.frontend.ast.LexerException;

public class LexerTest {

	private static List<TokenKind> kinds(String source) {
		List<TokenKind> kinds = new ArrayList<>();
		for (Token token : Lexer.tokenize(source)) {
			kinds.add(token.getKind());
		}
		return kinds;
	}

	@Test
	public void testDeclarationPositions() {
		List<Token> tokens = Lexer.tokenize("maya x = 5");
		assertEquals(5, tokens.size());
		assertEquals(new Token(TokenKind.MAYA, "maya", 1, 1), tokens.get(0));
		assertEquals(new Token(TokenKind.IDENTIFIER, "x", 1, 6), tokens.get(1));
		assertEquals(new Token(TokenKind.ASSIGN, "=", 1, 8), tokens.get(2));
		assertEquals(new Token(TokenKind.NUMBER, "5", 1, 10), tokens.get(3));
		assertEquals(new Token(TokenKind.EOF, "", 1, 11), tokens.get(4));
	}

	@Test
	public void testEmptySource() {
		assertEquals(Arrays.asList(new Token(TokenKind.EOF, "", 1, 1)), Lexer.tokenize(""));
		assertEquals(Arrays.asList(TokenKind.EOF), kinds(null));
		assertEquals(Arrays.asList(TokenKind.EOF), kinds("  \t  "));
	}

	@Test
	public void testKeywordsAreCaseInsensitive() {
		List<Token> tokens = Lexer.tokenize("MAYA Manifest TRUE fAlSe Sattva");
		assertEquals(TokenKind.MAYA, tokens.get(0).getKind());
		assertEquals("MAYA", tokens.get(0).getText());
		assertEquals(TokenKind.MANIFEST, tokens.get(1).getKind());
		assertEquals(TokenKind.BOOLEAN, tokens.get(2).getKind());
		assertEquals(TokenKind.BOOLEAN, tokens.get(3).getKind());
		assertEquals(TokenKind.SATTVA, tokens.get(4).getKind());
		assertTrue(Lexer.isKeyword("Dharma"));
		assertTrue(Lexer.isKeyword("cosmic"));
		assertFalse(Lexer.isKeyword("krishna"));
	}

	@Test
	public void testAllKeywords() {
		assertEquals(
				Arrays
						.asList(
								TokenKind.SHLOKA,
								TokenKind.DHARMA,
								TokenKind.ADHARMA,
								TokenKind.KARMA,
								TokenKind.ARJUNA,
								TokenKind.MANIFEST,
								TokenKind.MOKSHA,
								TokenKind.MAYA,
								TokenKind.SANKALPA,
								TokenKind.YUGA,
								TokenKind.MEDITATION,
								TokenKind.DISTURBANCE,
								TokenKind.COSMIC,
								TokenKind.SATTVA,
								TokenKind.RAJAS,
								TokenKind.TAMAS,
								TokenKind.FROM,
								TokenKind.TO,
								TokenKind.IN,
								TokenKind.EOF),
				kinds(
						"shloka dharma adharma karma arjuna manifest moksha maya sankalpa yuga"
								+ " meditation disturbance cosmic sattva rajas tamas from to in"));
	}

	@Test
	public void testOperators() {
		assertEquals(
				Arrays
						.asList(
								TokenKind.EQUALS,
								TokenKind.NOT_EQUALS,
								TokenKind.LESS_EQUAL,
								TokenKind.GREATER_EQUAL,
								TokenKind.ARROW,
								TokenKind.LESS_THAN,
								TokenKind.GREATER_THAN,
								TokenKind.ASSIGN,
								TokenKind.PLUS,
								TokenKind.MINUS,
								TokenKind.MULTIPLY,
								TokenKind.DIVIDE,
								TokenKind.MODULO,
								TokenKind.LEFT_PAREN,
								TokenKind.RIGHT_PAREN,
								TokenKind.LEFT_BRACE,
								TokenKind.RIGHT_BRACE,
								TokenKind.LEFT_BRACKET,
								TokenKind.RIGHT_BRACKET,
								TokenKind.COMMA,
								TokenKind.SEMICOLON,
								TokenKind.DOT,
								TokenKind.EOF),
				kinds("== != <= >= -> < > = + - * / % ( ) { } [ ] , ; ."));
		assertEquals(
				Arrays.asList(TokenKind.IDENTIFIER, TokenKind.MINUS, TokenKind.NUMBER, TokenKind.EOF),
				kinds("a-1"));
	}

	@Test
	public void testNewlinesAndComments() {
		List<Token> tokens = Lexer.tokenize("manifest 1 // say one\r\nmanifest 2");
		assertEquals(
				Arrays
						.asList(
								TokenKind.MANIFEST,
								TokenKind.NUMBER,
								TokenKind.COMMENT,
								TokenKind.NEWLINE,
								TokenKind.MANIFEST,
								TokenKind.NUMBER,
								TokenKind.EOF),
				kinds("manifest 1 // say one\r\nmanifest 2"));
		assertEquals("say one", tokens.get(2).getText());
		assertEquals(2, tokens.get(4).getLine());
		assertEquals(1, tokens.get(4).getColumn());
	}

	@Test
	public void testStrings() {
		List<Token> tokens = Lexer.tokenize("\"a\\nb\\t\\\"c\\\"\" 'single' \"\\q\"");
		assertEquals(new Token(TokenKind.STRING, "a\nb\t\"c\"", 1, 1), tokens.get(0));
		assertEquals("single", tokens.get(1).getText());
		assertEquals("q", tokens.get(2).getText());
	}

	@Test
	public void testNumbers() {
		List<Token> tokens = Lexer.tokenize("3.14 42 007");
		assertEquals("3.14", tokens.get(0).getText());
		assertEquals("42", tokens.get(1).getText());
		assertEquals("007", tokens.get(2).getText());
		assertEquals(
				Arrays.asList(TokenKind.NUMBER, TokenKind.DOT, TokenKind.NUMBER, TokenKind.EOF),
				kinds("1.2.3"));
	}

	@Test
	public void testIdentifiers() {
		List<Token> tokens = Lexer.tokenize("_a1 b_2 Math.add");
		assertEquals(new Token(TokenKind.IDENTIFIER, "_a1", 1, 1), tokens.get(0));
		assertEquals(new Token(TokenKind.IDENTIFIER, "b_2", 1, 5), tokens.get(1));
		assertEquals(TokenKind.IDENTIFIER, tokens.get(2).getKind());
		assertEquals(TokenKind.DOT, tokens.get(3).getKind());
		assertEquals(TokenKind.IDENTIFIER, tokens.get(4).getKind());
	}

	@Test
	public void testUnterminatedString() {
		LexerException e = assertThrows(LexerException.class, () -> Lexer.tokenize("\nmanifest \"abc"));
		assertEquals("Unterminated string", e.getMessage());
		assertEquals(2, e.getLineNumber());
		assertEquals(10, e.getColumnNumber());
	}

	@Test
	public void testUnexpectedCharacter() {
		LexerException e = assertThrows(LexerException.class, () -> Lexer.tokenize("maya x = 5 @ 2"));
		assertEquals("Unexpected character '@'", e.getMessage());
		assertEquals(1, e.getLineNumber());
		assertEquals(12, e.getColumnNumber());
		assertThrows(LexerException.class, () -> Lexer.tokenize("a ! b"));
	}

	@Test
	public void testTokensAreImmutable() {
		List<Token> tokens = Lexer.tokenize("x");
		assertThrows(UnsupportedOperationException.class, () -> tokens.add(tokens.get(0)));
	}
}
