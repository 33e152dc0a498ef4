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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.metricshub.bhagwad.frontend.ast.ArrayIndexAst;
import org.metricshub.bhagwad.frontend.ast.ArrayLiteralAst;
import org.metricshub.bhagwad.frontend.ast.AssignmentAst;
import org.metricshub.bhagwad.frontend.ast.BinaryExpressionAst;
import org.metricshub.bhagwad.frontend.ast.BlockAst;
import org.metricshub.bhagwad.frontend.ast.ExpressionAst;
import org.metricshub.bhagwad.frontend.ast.ExpressionStatementAst;
import org.metricshub.bhagwad.frontend.ast.FunctionCallAst;
import org.metricshub.bhagwad.frontend.ast.FunctionDefAst;
import org.metricshub.bhagwad.frontend.ast.IdentifierAst;
import org.metricshub.bhagwad.frontend.ast.IfStatementAst;
import org.metricshub.bhagwad.frontend.ast.LiteralAst;
import org.metricshub.bhagwad.frontend.ast.LoopStatementAst;
import org.metricshub.bhagwad.frontend.ast.MainBlockAst;
import org.metricshub.bhagwad.frontend.ast.MemberAccessAst;
import org.metricshub.bhagwad.frontend.ast.ModuleAst;
import org.metricshub.bhagwad.frontend.ast.Parameter;
import org.metricshub.bhagwad.frontend.ast.ParserException;
import org.metricshub.bhagwad.frontend.ast.PrimitiveType;
import org.metricshub.bhagwad.frontend.ast.PrintStatementAst;
import org.metricshub.bhagwad.frontend.ast.ProgramAst;
import org.metricshub.bhagwad.frontend.ast.ReturnStatementAst;
import org.metricshub.bhagwad.frontend.ast.StatementAst;
import org.metricshub.bhagwad.frontend.ast.TryStatementAst;
import org.metricshub.bhagwad.frontend.ast.UnaryExpressionAst;
import org.metricshub.bhagwad.frontend.ast.VariableDeclarationAst;

/**
 * Converts the tokens of a Bhagwad script into a syntax tree,
 * which the backend then translates.
 * <p>
 * This is a recursive descent parser. Statements are recognized by their
 * first token. Expressions are parsed by precedence climbing, from the
 * loosest binding (equality) to the tightest (postfix calls, indices and
 * member accesses).
 * <p>
 * The first syntax error ends the parse. Before the error is thrown, the
 * cursor is moved to the start of the next statement, so that it is left
 * in a consistent position.
 * <p>
 * An instance holds the cursor of one parse and must not be shared.
 */
public class BhagwadParser {

	/**
	 * Tokens at which the cursor stops when recovering from an error.
	 */
	private static final Set<TokenKind> STATEMENT_STARTS = EnumSet
			.of(
					TokenKind.ARJUNA,
					TokenKind.SHLOKA,
					TokenKind.YUGA,
					TokenKind.MAYA,
					TokenKind.SANKALPA,
					TokenKind.MANIFEST,
					TokenKind.DHARMA,
					TokenKind.KARMA,
					TokenKind.MOKSHA);

	private final List<Token> tokens;
	private int current;

	/**
	 * @param tokens tokens produced by the {@link Lexer}, ending with {@link TokenKind#EOF}
	 */
	public BhagwadParser(List<Token> tokens) {
		if (tokens == null || tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenKind.EOF)) {
			throw new IllegalArgumentException("The token list must end with an EOF token");
		}
		this.tokens = tokens;
		this.current = 0;
	}

	/**
	 * Parse the tokens. Build and return the root of the abstract syntax
	 * tree which represents the Bhagwad script.
	 *
	 * @return The abstract syntax tree of this script.
	 * @throws ParserException upon the first syntax error
	 */
	public ProgramAst parse() {
		return SCRIPT();
	}

	/**
	 * @return the index of the token the parser is looking at
	 */
	public int getPosition() {
		return current;
	}

	// SUPPORTING FUNCTIONS/METHODS

	private Token peek() {
		if (current >= tokens.size()) {
			return tokens.get(tokens.size() - 1);
		}
		return tokens.get(current);
	}

	private Token previous() {
		return tokens.get(current - 1);
	}

	private boolean isAtEnd() {
		return peek().is(TokenKind.EOF);
	}

	private Token advance() {
		if (!isAtEnd()) {
			current++;
		}
		return previous();
	}

	private boolean check(TokenKind kind) {
		return peek().is(kind);
	}

	private boolean match(TokenKind... kinds) {
		for (TokenKind kind : kinds) {
			if (check(kind)) {
				advance();
				return true;
			}
		}
		return false;
	}

	private Token consume(TokenKind kind, String message) {
		if (check(kind)) {
			return advance();
		}
		throw new ParserException(message, peek());
	}

	private void optNewlines() {
		while (match(TokenKind.NEWLINE)) {
			// skip
		}
	}

	/**
	 * Whether the next token, after line breaks and comments, is of the specified kind.
	 * If so, the line breaks and comments are consumed.
	 */
	private boolean nextSignificantIs(TokenKind kind) {
		int lookahead = current;
		while (lookahead < tokens.size()
				&& (tokens.get(lookahead).is(TokenKind.NEWLINE) || tokens.get(lookahead).is(TokenKind.COMMENT))) {
			lookahead++;
		}
		if (lookahead < tokens.size() && tokens.get(lookahead).is(kind)) {
			current = lookahead;
			return true;
		}
		return false;
	}

	private static String describe(Token token) {
		if (token.is(TokenKind.EOF)) {
			return "end of input";
		}
		if (token.is(TokenKind.NEWLINE)) {
			return "end of line";
		}
		return token.getText();
	}

	/**
	 * Moves the cursor past the statement that failed: up to the next line
	 * break, or the next token that starts a statement.
	 */
	private void synchronize() {
		advance();
		while (!isAtEnd()) {
			if (previous().is(TokenKind.NEWLINE)) {
				return;
			}
			if (STATEMENT_STARTS.contains(peek().getKind())) {
				return;
			}
			advance();
		}
	}

	// RECURSIVE DECENT PARSER:
	// CHECKSTYLE.OFF: MethodName

	// SCRIPT : [\n] [ STATEMENT [\n] ]* EOF
	ProgramAst SCRIPT() {
		List<StatementAst> statements = new ArrayList<StatementAst>();
		optNewlines();
		while (!isAtEnd()) {
			StatementAst stmt = STATEMENT();
			if (stmt != null) {
				statements.add(stmt);
			}
			optNewlines();
		}
		return new ProgramAst(statements);
	}

	// STATEMENT :
	// MAIN_BLOCK
	// | FUNCTION
	// | MODULE
	// | DECLARATION | TYPED_DECLARATION | ARRAY_DECLARATION
	// | PRINT_STATEMENT
	// | IF_STATEMENT
	// | LOOP_STATEMENT
	// | RETURN_STATEMENT
	// | TRY_STATEMENT
	// | ASSIGNMENT_OR_EXPRESSION
	// | comment
	StatementAst STATEMENT() {
		try {
			Token start = peek();
			switch (start.getKind()) {
			case ARJUNA:
				return MAIN_BLOCK();
			case SHLOKA:
				return FUNCTION();
			case YUGA:
				return MODULE();
			case MAYA:
			case SANKALPA:
				return DECLARATION();
			case SATTVA:
			case RAJAS:
			case TAMAS:
				return TYPED_DECLARATION();
			case COSMIC:
				return ARRAY_DECLARATION();
			case MANIFEST:
				return PRINT_STATEMENT();
			case DHARMA:
				return IF_STATEMENT();
			case KARMA:
				return LOOP_STATEMENT();
			case MOKSHA:
				return RETURN_STATEMENT();
			case MEDITATION:
				return TRY_STATEMENT();
			case IDENTIFIER:
				return ASSIGNMENT_OR_EXPRESSION();
			case COMMENT:
				advance();
				return null;
			default:
				throw new ParserException("Unexpected token: " + describe(start), start);
			}
		} catch (ParserException e) {
			synchronize();
			throw e;
		}
	}

	// BLOCK : '{' [\n] [ STATEMENT [\n] ]* '}'
	// (the opening brace is consumed by the caller)
	BlockAst BLOCK(Token openBrace) {
		List<StatementAst> statements = new ArrayList<StatementAst>();
		optNewlines();
		while (!check(TokenKind.RIGHT_BRACE) && !isAtEnd()) {
			StatementAst stmt = STATEMENT();
			if (stmt != null) {
				statements.add(stmt);
			}
			optNewlines();
		}
		consume(TokenKind.RIGHT_BRACE, "Expected '}' after block");
		return new BlockAst(statements, openBrace.getLine(), openBrace.getColumn());
	}

	// MAIN_BLOCK : arjuna BLOCK
	StatementAst MAIN_BLOCK() {
		Token keyword = advance();
		Token brace = consume(TokenKind.LEFT_BRACE, "Expected '{' after 'arjuna'");
		return new MainBlockAst(BLOCK(brace), keyword.getLine(), keyword.getColumn());
	}

	// FUNCTION : shloka name '(' [ PARAMETER_LIST ] ')' [ '->' TYPE ] BLOCK
	StatementAst FUNCTION() {
		Token keyword = advance();
		String name = consume(TokenKind.IDENTIFIER, "Expected function name").getText();
		consume(TokenKind.LEFT_PAREN, "Expected '(' after function name");

		List<Parameter> parameters;
		if (check(TokenKind.RIGHT_PAREN)) {
			parameters = new ArrayList<Parameter>();
		} else {
			parameters = PARAMETER_LIST();
		}
		consume(TokenKind.RIGHT_PAREN, "Expected ')' after parameters");

		String returnType = null;
		if (match(TokenKind.ARROW)) {
			returnType = TYPE("Expected return type after '->'");
		}

		Token brace = consume(TokenKind.LEFT_BRACE, "Expected '{' before function body");
		BlockAst body = BLOCK(brace);
		return new FunctionDefAst(name, parameters, returnType, body, keyword.getLine(), keyword.getColumn());
	}

	// PARAMETER_LIST : TYPE name [ ',' TYPE name ]*
	List<Parameter> PARAMETER_LIST() {
		List<Parameter> parameters = new ArrayList<Parameter>();
		do {
			String type = TYPE("Expected parameter type");
			String name = consume(TokenKind.IDENTIFIER, "Expected parameter name").getText();
			parameters.add(new Parameter(name, type));
		} while (match(TokenKind.COMMA));
		return parameters;
	}

	// TYPE : sattva | rajas | tamas | cosmic TYPE '[' ']'
	String TYPE(String message) {
		if (peek().getKind().isPrimitiveType()) {
			return advance().getText().toLowerCase(Locale.ROOT);
		}
		if (match(TokenKind.COSMIC)) {
			String elementType = TYPE("Expected array element type after 'cosmic'");
			return elementType + ARRAY_BRACKETS();
		}
		throw new ParserException(message, peek());
	}

	// ARRAY_BRACKETS : '[' ']'
	private String ARRAY_BRACKETS() {
		consume(TokenKind.LEFT_BRACKET, "Expected '[' after array type");
		consume(TokenKind.RIGHT_BRACKET, "Expected ']' after '['");
		return PrimitiveType.ARRAY_SUFFIX;
	}

	// MODULE : yuga name BLOCK
	StatementAst MODULE() {
		Token keyword = advance();
		String name = consume(TokenKind.IDENTIFIER, "Expected module name").getText();
		Token brace = consume(TokenKind.LEFT_BRACE, "Expected '{' after module name");
		return new ModuleAst(name, BLOCK(brace), keyword.getLine(), keyword.getColumn());
	}

	// DECLARATION : ( maya name [ '=' EXPRESSION ] ) | ( sankalpa name '=' EXPRESSION )
	StatementAst DECLARATION() {
		Token keyword = advance();
		boolean constant = keyword.is(TokenKind.SANKALPA);
		String name = consume(TokenKind.IDENTIFIER, "Expected variable name").getText();

		ExpressionAst value = null;
		if (constant) {
			consume(TokenKind.ASSIGN, "Expected '=' after constant name");
			value = EXPRESSION();
		} else if (match(TokenKind.ASSIGN)) {
			value = EXPRESSION();
		}
		return new VariableDeclarationAst(name, null, value, constant, keyword.getLine(), keyword.getColumn());
	}

	// TYPED_DECLARATION : ( sattva | rajas | tamas ) name [ '=' EXPRESSION ]
	StatementAst TYPED_DECLARATION() {
		Token keyword = advance();
		String dataType = keyword.getText().toLowerCase(Locale.ROOT);
		String name = consume(TokenKind.IDENTIFIER, "Expected variable name").getText();

		ExpressionAst value = null;
		if (match(TokenKind.ASSIGN)) {
			value = EXPRESSION();
		}
		return new VariableDeclarationAst(name, dataType, value, false, keyword.getLine(), keyword.getColumn());
	}

	// ARRAY_DECLARATION : cosmic TYPE '[' ']' name [ '=' EXPRESSION ]
	StatementAst ARRAY_DECLARATION() {
		Token keyword = advance();
		String dataType = TYPE("Expected array element type") + ARRAY_BRACKETS();
		String name = consume(TokenKind.IDENTIFIER, "Expected array name").getText();

		ExpressionAst value = null;
		if (match(TokenKind.ASSIGN)) {
			value = EXPRESSION();
		}
		return new VariableDeclarationAst(name, dataType, value, false, keyword.getLine(), keyword.getColumn());
	}

	// PRINT_STATEMENT : manifest EXPRESSION
	StatementAst PRINT_STATEMENT() {
		Token keyword = advance();
		return new PrintStatementAst(EXPRESSION(), keyword.getLine(), keyword.getColumn());
	}

	// IF_STATEMENT : dharma '(' EXPRESSION ')' BLOCK [ [\n] adharma ( BLOCK | IF_STATEMENT ) ]
	StatementAst IF_STATEMENT() {
		Token keyword = advance();
		consume(TokenKind.LEFT_PAREN, "Expected '(' after 'dharma'");
		ExpressionAst condition = EXPRESSION();
		consume(TokenKind.RIGHT_PAREN, "Expected ')' after condition");

		Token brace = consume(TokenKind.LEFT_BRACE, "Expected '{' after condition");
		BlockAst thenBlock = BLOCK(brace);

		BlockAst elseBlock = null;
		if (nextSignificantIs(TokenKind.ADHARMA)) {
			Token elseKeyword = advance();
			if (check(TokenKind.DHARMA)) {
				// adharma dharma (...) { } is an else-if
				List<StatementAst> nested = new ArrayList<StatementAst>();
				nested.add(IF_STATEMENT());
				elseBlock = new BlockAst(nested, elseKeyword.getLine(), elseKeyword.getColumn());
			} else {
				Token elseBrace = consume(TokenKind.LEFT_BRACE, "Expected '{' after 'adharma'");
				elseBlock = BLOCK(elseBrace);
			}
		}
		return new IfStatementAst(condition, thenBlock, elseBlock, keyword.getLine(), keyword.getColumn());
	}

	// LOOP_STATEMENT :
	// karma name from EXPRESSION to EXPRESSION BLOCK
	// | karma name in EXPRESSION BLOCK
	StatementAst LOOP_STATEMENT() {
		Token keyword = advance();
		if (!check(TokenKind.IDENTIFIER)) {
			throw new ParserException("Expected loop variable after 'karma'", peek());
		}
		String variable = advance().getText();

		if (match(TokenKind.FROM)) {
			ExpressionAst start = EXPRESSION();
			consume(TokenKind.TO, "Expected 'to' after start value");
			ExpressionAst end = EXPRESSION();
			Token brace = consume(TokenKind.LEFT_BRACE, "Expected '{' after loop range");
			BlockAst body = BLOCK(brace);
			return LoopStatementAst.range(variable, start, end, body, keyword.getLine(), keyword.getColumn());
		} else if (match(TokenKind.IN)) {
			ExpressionAst iterable = EXPRESSION();
			Token brace = consume(TokenKind.LEFT_BRACE, "Expected '{' after iterable");
			BlockAst body = BLOCK(brace);
			return LoopStatementAst.collection(variable, iterable, body, keyword.getLine(), keyword.getColumn());
		} else {
			throw new ParserException("Expected 'from' or 'in' after loop variable", peek());
		}
	}

	// RETURN_STATEMENT : moksha [ EXPRESSION ]
	StatementAst RETURN_STATEMENT() {
		Token keyword = advance();
		ExpressionAst value = null;
		if (!check(TokenKind.NEWLINE)
				&& !check(TokenKind.RIGHT_BRACE)
				&& !check(TokenKind.COMMENT)
				&& !isAtEnd()) {
			value = EXPRESSION();
		}
		return new ReturnStatementAst(value, keyword.getLine(), keyword.getColumn());
	}

	// TRY_STATEMENT : meditation BLOCK [ [\n] disturbance '(' name ')' BLOCK ]
	StatementAst TRY_STATEMENT() {
		Token keyword = advance();
		Token brace = consume(TokenKind.LEFT_BRACE, "Expected '{' after 'meditation'");
		BlockAst tryBlock = BLOCK(brace);

		String catchVariable = null;
		BlockAst catchBlock = null;
		if (nextSignificantIs(TokenKind.DISTURBANCE)) {
			advance();
			consume(TokenKind.LEFT_PAREN, "Expected '(' after 'disturbance'");
			catchVariable = consume(TokenKind.IDENTIFIER, "Expected error variable name").getText();
			consume(TokenKind.RIGHT_PAREN, "Expected ')' after error variable");
			Token catchBrace = consume(TokenKind.LEFT_BRACE, "Expected '{' after disturbance clause");
			catchBlock = BLOCK(catchBrace);
		}
		return new TryStatementAst(tryBlock, catchVariable, catchBlock, keyword.getLine(), keyword.getColumn());
	}

	// ASSIGNMENT_OR_EXPRESSION : ( name '=' EXPRESSION ) | EXPRESSION
	StatementAst ASSIGNMENT_OR_EXPRESSION() {
		Token start = peek();
		if (current + 1 < tokens.size() && tokens.get(current + 1).is(TokenKind.ASSIGN)) {
			advance(); // name
			advance(); // =
			return new AssignmentAst(start.getText(), EXPRESSION(), start.getLine(), start.getColumn());
		}
		return new ExpressionStatementAst(EXPRESSION(), start.getLine(), start.getColumn());
	}

	// EXPRESSION : EQUALITY_EXPRESSION
	ExpressionAst EXPRESSION() {
		return EQUALITY_EXPRESSION();
	}

	// EQUALITY_EXPRESSION : COMPARISON_EXPRESSION [ ( '==' | '!=' ) COMPARISON_EXPRESSION ]*
	ExpressionAst EQUALITY_EXPRESSION() {
		ExpressionAst expr = COMPARISON_EXPRESSION();
		while (match(TokenKind.EQUALS, TokenKind.NOT_EQUALS)) {
			String operator = previous().getText();
			expr = new BinaryExpressionAst(expr, operator, COMPARISON_EXPRESSION(), expr.getLine(), expr.getColumn());
		}
		return expr;
	}

	// COMPARISON_EXPRESSION : TERM [ ( '<' | '>' | '<=' | '>=' ) TERM ]*
	ExpressionAst COMPARISON_EXPRESSION() {
		ExpressionAst expr = TERM();
		while (match(TokenKind.GREATER_THAN, TokenKind.GREATER_EQUAL, TokenKind.LESS_THAN, TokenKind.LESS_EQUAL)) {
			String operator = previous().getText();
			expr = new BinaryExpressionAst(expr, operator, TERM(), expr.getLine(), expr.getColumn());
		}
		return expr;
	}

	// TERM : FACTOR [ ( '+' | '-' ) FACTOR ]*
	ExpressionAst TERM() {
		ExpressionAst expr = FACTOR();
		while (match(TokenKind.PLUS, TokenKind.MINUS)) {
			String operator = previous().getText();
			expr = new BinaryExpressionAst(expr, operator, FACTOR(), expr.getLine(), expr.getColumn());
		}
		return expr;
	}

	// FACTOR : UNARY_FACTOR [ ( '*' | '/' | '%' ) UNARY_FACTOR ]*
	ExpressionAst FACTOR() {
		ExpressionAst expr = UNARY_FACTOR();
		while (match(TokenKind.MULTIPLY, TokenKind.DIVIDE, TokenKind.MODULO)) {
			String operator = previous().getText();
			expr = new BinaryExpressionAst(expr, operator, UNARY_FACTOR(), expr.getLine(), expr.getColumn());
		}
		return expr;
	}

	// UNARY_FACTOR : '-' UNARY_FACTOR | POSTFIX_EXPRESSION
	ExpressionAst UNARY_FACTOR() {
		if (match(TokenKind.MINUS)) {
			Token operator = previous();
			return new UnaryExpressionAst(operator.getText(), UNARY_FACTOR(), operator.getLine(), operator.getColumn());
		}
		return POSTFIX_EXPRESSION();
	}

	// POSTFIX_EXPRESSION : PRIMARY [ '(' [ ARGUMENTS ] ')' | '[' EXPRESSION ']' | '.' name ]*
	ExpressionAst POSTFIX_EXPRESSION() {
		ExpressionAst expr = PRIMARY();
		while (true) {
			if (match(TokenKind.LEFT_PAREN)) {
				Token paren = previous();
				String callee = calleeName(expr);
				if (callee == null) {
					throw new ParserException("Invalid function call", paren);
				}
				List<ExpressionAst> arguments = ARGUMENTS();
				consume(TokenKind.RIGHT_PAREN, "Expected ')' after arguments");
				expr = new FunctionCallAst(callee, arguments, expr.getLine(), expr.getColumn());
			} else if (match(TokenKind.LEFT_BRACKET)) {
				ExpressionAst index = EXPRESSION();
				consume(TokenKind.RIGHT_BRACKET, "Expected ']' after array index");
				expr = new ArrayIndexAst(expr, index, expr.getLine(), expr.getColumn());
			} else if (match(TokenKind.DOT)) {
				String member = consume(TokenKind.IDENTIFIER, "Expected member name after '.'").getText();
				expr = new MemberAccessAst(expr, member, expr.getLine(), expr.getColumn());
			} else {
				return expr;
			}
		}
	}

	// ARGUMENTS : EXPRESSION [ ',' EXPRESSION ]*
	List<ExpressionAst> ARGUMENTS() {
		List<ExpressionAst> arguments = new ArrayList<ExpressionAst>();
		if (!check(TokenKind.RIGHT_PAREN)) {
			do {
				arguments.add(EXPRESSION());
			} while (match(TokenKind.COMMA));
		}
		return arguments;
	}

	/**
	 * Only names can be called: a plain identifier, or a chain of member
	 * accesses on an identifier ({@code Module.function}).
	 *
	 * @return the dotted name, or {@code null} if the expression is not a name
	 */
	private static String calleeName(ExpressionAst expr) {
		if (expr instanceof IdentifierAst) {
			return ((IdentifierAst) expr).getName();
		}
		if (expr instanceof MemberAccessAst) {
			MemberAccessAst access = (MemberAccessAst) expr;
			String owner = calleeName(access.getObject());
			return owner == null ? null : owner + "." + access.getMember();
		}
		return null;
	}

	// PRIMARY : boolean | number | string | name | '(' EXPRESSION ')' | '[' [ EXPRESSION [ ',' EXPRESSION ]* ] ']'
	ExpressionAst PRIMARY() {
		Token token = peek();
		switch (token.getKind()) {
		case BOOLEAN:
			advance();
			return new LiteralAst(
					Boolean.valueOf("true".equalsIgnoreCase(token.getText())),
					PrimitiveType.TAMAS,
					token.getLine(),
					token.getColumn());
		case NUMBER:
			advance();
			return new LiteralAst(toNumber(token.getText()), PrimitiveType.SATTVA, token.getLine(), token.getColumn());
		case STRING:
			advance();
			return new LiteralAst(token.getText(), PrimitiveType.RAJAS, token.getLine(), token.getColumn());
		case IDENTIFIER:
			advance();
			return new IdentifierAst(token.getText(), token.getLine(), token.getColumn());
		case LEFT_PAREN: {
			advance();
			ExpressionAst expr = EXPRESSION();
			consume(TokenKind.RIGHT_PAREN, "Expected ')' after expression");
			return expr;
		}
		case LEFT_BRACKET: {
			advance();
			List<ExpressionAst> elements = new ArrayList<ExpressionAst>();
			optNewlines();
			if (!check(TokenKind.RIGHT_BRACKET)) {
				do {
					optNewlines();
					elements.add(EXPRESSION());
					optNewlines();
				} while (match(TokenKind.COMMA));
			}
			consume(TokenKind.RIGHT_BRACKET, "Expected ']' after array elements");
			return new ArrayLiteralAst(elements, token.getLine(), token.getColumn());
		}
		default:
			throw new ParserException("Unexpected token: " + describe(token), token);
		}
	}

	// CHECKSTYLE.ON: MethodName

	/**
	 * A number with a decimal point is floating, otherwise it is integral.
	 */
	private static Number toNumber(String text) {
		if (text.indexOf('.') >= 0) {
			return new BigDecimal(text);
		}
		return new BigInteger(text);
	}
}
