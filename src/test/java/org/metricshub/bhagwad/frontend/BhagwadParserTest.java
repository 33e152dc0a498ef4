package org.metricshub.bhagwad.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.bhagwad.frontend.ast.ArrayIndexAst;
import org.metricshub.bhagwad.frontend.ast.ArrayLiteralAst;
import org.metricshub.bhagwad.frontend.ast.AssignmentAst;
import org.metricshub.bhagwad.frontend.ast.BinaryExpressionAst;
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
import org.metricshub.bhagwad.util.AstDumper;

public class BhagwadParserTest {

	private static ProgramAst parse(String source) {
		return new BhagwadParser(Lexer.tokenize(source)).parse();
	}

	private static StatementAst single(String source) {
		List<StatementAst> statements = parse(source).getStatements();
		assertEquals("Expected a single statement in: " + source, 1, statements.size());
		return statements.get(0);
	}

	private static ExpressionAst printed(String expression) {
		return ((PrintStatementAst) single("manifest " + expression)).getExpression();
	}

	private static ParserException parseError(String source) {
		return assertThrows(ParserException.class, () -> parse(source));
	}

	@Test
	public void testEmptyProgram() {
		assertTrue(parse("").getStatements().isEmpty());
		assertTrue(parse("\n\n  \n").getStatements().isEmpty());
		assertTrue(parse("// only a comment\n").getStatements().isEmpty());
	}

	@Test
	public void testTokensMustEndWithEof() {
		assertThrows(IllegalArgumentException.class, () -> new BhagwadParser(Collections.<Token>emptyList()));
		assertThrows(
				IllegalArgumentException.class,
				() -> new BhagwadParser(Arrays.asList(new Token(TokenKind.IDENTIFIER, "x", 1, 1))));
	}

	@Test
	public void testMultiplicationBindsTighterThanAddition() {
		BinaryExpressionAst sum = (BinaryExpressionAst) printed("1 + 2 * 3");
		assertEquals("+", sum.getOperator());
		assertEquals(BigInteger.ONE, ((LiteralAst) sum.getLeft()).getValue());
		BinaryExpressionAst product = (BinaryExpressionAst) sum.getRight();
		assertEquals("*", product.getOperator());
	}

	@Test
	public void testBinaryOperatorsAreLeftAssociative() {
		BinaryExpressionAst outer = (BinaryExpressionAst) printed("a - b - c");
		assertEquals("c", ((IdentifierAst) outer.getRight()).getName());
		BinaryExpressionAst inner = (BinaryExpressionAst) outer.getLeft();
		assertEquals("a", ((IdentifierAst) inner.getLeft()).getName());
		assertEquals("b", ((IdentifierAst) inner.getRight()).getName());
	}

	@Test
	public void testEqualityIsLoosestAndParenthesesGroup() {
		BinaryExpressionAst equality = (BinaryExpressionAst) printed("a < b == c >= d");
		assertEquals("==", equality.getOperator());
		assertEquals("<", ((BinaryExpressionAst) equality.getLeft()).getOperator());
		assertEquals(">=", ((BinaryExpressionAst) equality.getRight()).getOperator());

		BinaryExpressionAst product = (BinaryExpressionAst) printed("(1 + 2) * 3");
		assertEquals("*", product.getOperator());
		assertEquals("+", ((BinaryExpressionAst) product.getLeft()).getOperator());
	}

	@Test
	public void testUnaryMinus() {
		BinaryExpressionAst product = (BinaryExpressionAst) printed("-x * 2");
		UnaryExpressionAst negation = (UnaryExpressionAst) product.getLeft();
		assertEquals("-", negation.getOperator());
		assertEquals("x", ((IdentifierAst) negation.getOperand()).getName());

		UnaryExpressionAst twice = (UnaryExpressionAst) printed("--1");
		assertTrue(twice.getOperand() instanceof UnaryExpressionAst);
	}

	@Test
	public void testLiterals() {
		LiteralAst integer = (LiteralAst) printed("007");
		assertEquals(new BigInteger("7"), integer.getValue());
		assertEquals(PrimitiveType.SATTVA, integer.getType());

		assertEquals(new BigDecimal("2.50"), ((LiteralAst) printed("2.50")).getValue());

		LiteralAst text = (LiteralAst) printed("'Om'");
		assertEquals("Om", text.getValue());
		assertEquals(PrimitiveType.RAJAS, text.getType());

		LiteralAst truth = (LiteralAst) printed("TRUE");
		assertEquals(Boolean.TRUE, truth.getValue());
		assertEquals(PrimitiveType.TAMAS, truth.getType());
		assertEquals(Boolean.FALSE, ((LiteralAst) printed("false")).getValue());
	}

	@Test
	public void testPostfixChain() {
		ArrayIndexAst index = (ArrayIndexAst) printed("a.b[0]");
		MemberAccessAst member = (MemberAccessAst) index.getArray();
		assertEquals("b", member.getMember());
		assertEquals("a", ((IdentifierAst) member.getObject()).getName());

		FunctionCallAst call = (FunctionCallAst) printed("Math.add(1, x)");
		assertEquals("Math.add", call.getName());
		assertEquals(2, call.getArguments().size());

		ArrayIndexAst callIndex = (ArrayIndexAst) printed("items(1)[2]");
		assertEquals("items", ((FunctionCallAst) callIndex.getArray()).getName());
	}

	@Test
	public void testOnlyNamesCanBeCalled() {
		ParserException e = parseError("manifest xs[0](1)");
		assertEquals("Invalid function call", e.getMessage());
		assertEquals(15, e.getColumnNumber());
		assertEquals("Invalid function call", parseError("manifest 5(1)").getMessage());
		ParserException chained = parseError("manifest a.b[0](x)");
		assertEquals("Invalid function call", chained.getMessage());
		assertEquals(16, chained.getColumnNumber());
	}

	@Test
	public void testArrayLiteral() {
		ArrayLiteralAst empty = (ArrayLiteralAst) printed("[]");
		assertTrue(empty.getElements().isEmpty());

		ArrayLiteralAst multiline = (ArrayLiteralAst) printed("[\n  1,\n  2,\n  3\n]");
		assertEquals(3, multiline.getElements().size());
	}

	@Test
	public void testDeclarations() {
		VariableDeclarationAst untyped = (VariableDeclarationAst) single("maya x");
		assertEquals("x", untyped.getName());
		assertNull(untyped.getDataType());
		assertNull(untyped.getValue());
		assertFalse(untyped.isConstant());

		VariableDeclarationAst constant = (VariableDeclarationAst) single("sankalpa pi = 3.14");
		assertTrue(constant.isConstant());
		assertEquals(new BigDecimal("3.14"), ((LiteralAst) constant.getValue()).getValue());

		VariableDeclarationAst typed = (VariableDeclarationAst) single("Rajas name = \"Arjuna\"");
		assertEquals("rajas", typed.getDataType());
		assertNotNull(typed.getValue());

		VariableDeclarationAst array = (VariableDeclarationAst) single("cosmic sattva[] nums = [1, 2, 3]");
		assertEquals("nums", array.getName());
		assertEquals("sattva[]", array.getDataType());
		assertTrue(array.getValue() instanceof ArrayLiteralAst);

		VariableDeclarationAst grid = (VariableDeclarationAst) single("cosmic cosmic tamas[][] grid");
		assertEquals("tamas[][]", grid.getDataType());
		assertNull(grid.getValue());
	}

	@Test
	public void testConstantRequiresInitializer() {
		ParserException e = parseError("sankalpa pi\n");
		assertEquals("Expected '=' after constant name", e.getMessage());
		assertEquals(1, e.getLineNumber());
		assertEquals(12, e.getColumnNumber());
	}

	@Test
	public void testArrayDeclarationErrors() {
		assertEquals("Expected '[' after array type", parseError("cosmic sattva nums").getMessage());
		assertEquals("Expected array element type", parseError("cosmic nums[]").getMessage());
		assertEquals("Expected array name", parseError("cosmic rajas[] = []").getMessage());
	}

	@Test
	public void testAssignmentAndExpressionStatement() {
		AssignmentAst assignment = (AssignmentAst) single("count = count + 1");
		assertEquals("count", assignment.getTarget());
		assertTrue(assignment.getValue() instanceof BinaryExpressionAst);

		ExpressionStatementAst call = (ExpressionStatementAst) single("greet(\"Om\")");
		assertEquals("greet", ((FunctionCallAst) call.getExpression()).getName());
	}

	@Test
	public void testFunction() {
		FunctionDefAst function = (FunctionDefAst) single(
				"shloka add(sattva a, cosmic sattva[] b) -> sattva {\n"
						+ "    moksha a + b[0]\n"
						+ "}");
		assertEquals("add", function.getName());
		assertEquals(
				Arrays.asList(new Parameter("a", "sattva"), new Parameter("b", "sattva[]")),
				function.getParameters());
		assertEquals("sattva", function.getReturnType());
		ReturnStatementAst moksha = (ReturnStatementAst) function.getBody().getStatements().get(0);
		assertTrue(moksha.getExpression() instanceof BinaryExpressionAst);

		FunctionDefAst empty = (FunctionDefAst) single("shloka noop() {}");
		assertTrue(empty.getParameters().isEmpty());
		assertNull(empty.getReturnType());
		assertTrue(empty.getBody().isEmpty());
	}

	@Test
	public void testMissingParenthesisInFunctionHeader() {
		ParserException e = parseError("shloka f(sattva a {\n}");
		assertEquals("Expected ')' after parameters", e.getMessage());
		assertEquals(1, e.getLineNumber());
		assertEquals(19, e.getColumnNumber());
		assertEquals(TokenKind.LEFT_BRACE, e.getToken().getKind());
	}

	@Test
	public void testReturnWithoutValue() {
		FunctionDefAst function = (FunctionDefAst) single("shloka stop() {\n moksha\n}");
		assertNull(((ReturnStatementAst) function.getBody().getStatements().get(0)).getExpression());

		FunctionDefAst sameLine = (FunctionDefAst) single("shloka stop() { moksha }");
		assertNull(((ReturnStatementAst) sameLine.getBody().getStatements().get(0)).getExpression());

		ReturnStatementAst commented = (ReturnStatementAst) parse("moksha // done").getStatements().get(0);
		assertNull(commented.getExpression());
	}

	@Test
	public void testIfElse() {
		IfStatementAst plain = (IfStatementAst) single("dharma (x > 1) {\n manifest x\n}");
		assertEquals(1, plain.getThenBlock().getStatements().size());
		assertNull(plain.getElseBlock());

		IfStatementAst withElse = (IfStatementAst) single(
				"dharma (x > 1) {\n manifest x\n}\n\n// otherwise\nadharma {\n manifest 0\n}");
		assertNotNull(withElse.getElseBlock());
		assertEquals(1, withElse.getElseBlock().getStatements().size());

		IfStatementAst elseIf = (IfStatementAst) single("dharma (a) { manifest 1 } adharma dharma (b) { manifest 2 }");
		StatementAst nested = elseIf.getElseBlock().getStatements().get(0);
		assertTrue(nested instanceof IfStatementAst);
	}

	@Test
	public void testIfErrors() {
		assertEquals("Expected '(' after 'dharma'", parseError("dharma x > 1 { }").getMessage());
		assertEquals("Expected ')' after condition", parseError("dharma (x > 1 { }").getMessage());
		assertEquals("Expected '}' after block", parseError("dharma (x) {\n manifest x\n").getMessage());
	}

	@Test
	public void testLoops() {
		LoopStatementAst range = (LoopStatementAst) single("karma i from 1 to n + 1 {\n manifest i\n}");
		assertEquals(LoopStatementAst.Kind.RANGE, range.getKind());
		assertEquals("i", range.getVariable());
		assertEquals(BigInteger.ONE, ((LiteralAst) range.getStart()).getValue());
		assertTrue(range.getEnd() instanceof BinaryExpressionAst);
		assertNull(range.getIterable());

		LoopStatementAst collection = (LoopStatementAst) single("karma item in items {\n}");
		assertEquals(LoopStatementAst.Kind.COLLECTION, collection.getKind());
		assertEquals("items", ((IdentifierAst) collection.getIterable()).getName());
		assertTrue(collection.getBody().isEmpty());
	}

	@Test
	public void testLoopErrors() {
		assertEquals("Expected 'from' or 'in' after loop variable", parseError("karma i over xs { }").getMessage());
		assertEquals("Expected 'to' after start value", parseError("karma i from 1 until 3 { }").getMessage());
		assertEquals("Expected loop variable after 'karma'", parseError("karma 1 to 3 { }").getMessage());
	}

	@Test
	public void testTry() {
		TryStatementAst guarded = (TryStatementAst) single(
				"meditation {\n risky()\n}\ndisturbance (err) {\n manifest \"calm\"\n}");
		assertEquals(1, guarded.getTryBlock().getStatements().size());
		assertEquals("err", guarded.getCatchVariable());
		assertEquals(1, guarded.getCatchBlock().getStatements().size());

		TryStatementAst unguarded = (TryStatementAst) single("meditation { risky() }");
		assertNull(unguarded.getCatchVariable());
		assertNull(unguarded.getCatchBlock());

		assertEquals(
				"Expected error variable name",
				parseError("meditation { } disturbance () { }").getMessage());
	}

	@Test
	public void testModuleAndMainBlock() {
		List<StatementAst> statements = parse(
				"yuga Math {\n"
						+ "  shloka square(sattva n) -> sattva { moksha n * n }\n"
						+ "}\n"
						+ "\n"
						+ "arjuna {\n"
						+ "  manifest Math.square(4)\n"
						+ "}\n").getStatements();
		assertEquals(2, statements.size());
		ModuleAst module = (ModuleAst) statements.get(0);
		assertEquals("Math", module.getName());
		assertTrue(module.getBody().getStatements().get(0) instanceof FunctionDefAst);
		MainBlockAst main = (MainBlockAst) statements.get(1);
		PrintStatementAst print = (PrintStatementAst) main.getBody().getStatements().get(0);
		assertEquals("Math.square", ((FunctionCallAst) print.getExpression()).getName());
		assertEquals(5, main.getLine());
		assertEquals(1, main.getColumn());
	}

	@Test
	public void testCommentsAreSkipped() {
		List<StatementAst> statements = parse(
				"// intro\n"
						+ "maya x = 1 // one\n"
						+ "arjuna {\n"
						+ "  // nothing to see\n"
						+ "}\n").getStatements();
		assertEquals(2, statements.size());
		assertTrue(((MainBlockAst) statements.get(1)).getBody().isEmpty());
	}

	@Test
	public void testUnexpectedTokens() {
		ParserException semicolon = parseError("maya x = 1;");
		assertEquals("Unexpected token: ;", semicolon.getMessage());
		assertEquals(11, semicolon.getColumnNumber());

		assertEquals("Unexpected token: end of input", parseError("manifest").getMessage());
		assertEquals("Unexpected token: }", parseError("}").getMessage());
	}

	@Test
	public void testRecoveryStopsAtNextStatement() {
		BhagwadParser parser = new BhagwadParser(Lexer.tokenize("manifest )\nmaya y = 2"));
		assertThrows(ParserException.class, parser::parse);
		assertEquals(3, parser.getPosition());
	}

	@Test
	public void testParsingIsDeterministic() {
		String source = "sankalpa limit = 3\n"
				+ "shloka show(rajas s) { manifest s }\n"
				+ "arjuna {\n"
				+ "  karma i from 1 to limit { dharma (i % 2 == 0) { show(\"even\") } adharma { show(\"odd\") } }\n"
				+ "}\n";
		List<Token> tokens = Lexer.tokenize(source);
		String first = AstDumper.dump(new BhagwadParser(tokens).parse());
		String second = AstDumper.dump(new BhagwadParser(tokens).parse());
		assertEquals(first, second);
		assertTrue(first.startsWith("Program\n  Constant limit\n"));
	}
}
