package org.metricshub.bhagwad.util;

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

import java.util.List;
import org.metricshub.bhagwad.frontend.Token;
import org.metricshub.bhagwad.frontend.ast.ArrayIndexAst;
import org.metricshub.bhagwad.frontend.ast.ArrayLiteralAst;
import org.metricshub.bhagwad.frontend.ast.AssignmentAst;
import org.metricshub.bhagwad.frontend.ast.BinaryExpressionAst;
import org.metricshub.bhagwad.frontend.ast.BlockAst;
import org.metricshub.bhagwad.frontend.ast.ExpressionAst;
import org.metricshub.bhagwad.frontend.ast.ExpressionStatementAst;
import org.metricshub.bhagwad.frontend.ast.ExpressionVisitor;
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
import org.metricshub.bhagwad.frontend.ast.PrintStatementAst;
import org.metricshub.bhagwad.frontend.ast.ProgramAst;
import org.metricshub.bhagwad.frontend.ast.ReturnStatementAst;
import org.metricshub.bhagwad.frontend.ast.StatementAst;
import org.metricshub.bhagwad.frontend.ast.StatementVisitor;
import org.metricshub.bhagwad.frontend.ast.TryStatementAst;
import org.metricshub.bhagwad.frontend.ast.UnaryExpressionAst;
import org.metricshub.bhagwad.frontend.ast.VariableDeclarationAst;

/**
 * Renders tokens and syntax trees as indented text, one node per line,
 * for the {@code --dump-tokens} and {@code --dump-syntax} switches.
 * <p>
 * Two structurally identical trees are rendered as the same text.
 */
public final class AstDumper implements ExpressionVisitor<Void, Integer>, StatementVisitor<Void, Integer> {

	private static final String INDENT = "  ";

	private final StringBuilder out = new StringBuilder();

	private AstDumper() {}

	/**
	 * @param tokens tokens to render
	 * @return one token per line
	 */
	public static String dumpTokens(List<Token> tokens) {
		StringBuilder text = new StringBuilder();
		for (Token token : tokens) {
			text.append(token).append('\n');
		}
		return text.toString();
	}

	/**
	 * @param program root of the tree to render
	 * @return the tree, one node per line, children indented below their parent
	 */
	public static String dump(ProgramAst program) {
		AstDumper dumper = new AstDumper();
		dumper.line(0, "Program");
		for (StatementAst statement : program.getStatements()) {
			statement.accept(dumper, 1);
		}
		return dumper.out.toString();
	}

	private void line(int depth, String text) {
		for (int i = 0; i < depth; i++) {
			out.append(INDENT);
		}
		out.append(text).append('\n');
	}

	private void child(ExpressionAst expression, int depth) {
		if (expression == null) {
			line(depth, "<none>");
		} else {
			expression.accept(this, depth);
		}
	}

	private void child(BlockAst block, int depth) {
		if (block == null) {
			line(depth, "<none>");
		} else {
			block.accept(this, depth);
		}
	}

	@Override
	public Void visitLiteral(LiteralAst literal, Integer depth) {
		Object value = literal.getValue();
		String text = value instanceof String ? '"' + value.toString().replace("\n", "\\n") + '"' : String.valueOf(value);
		line(depth, "Literal " + text + (literal.getType() == null ? "" : " (" + literal.getType().keyword() + ")"));
		return null;
	}

	@Override
	public Void visitIdentifier(IdentifierAst identifier, Integer depth) {
		line(depth, "Identifier " + identifier.getName());
		return null;
	}

	@Override
	public Void visitBinaryExpression(BinaryExpressionAst binary, Integer depth) {
		line(depth, "Binary " + binary.getOperator());
		child(binary.getLeft(), depth + 1);
		child(binary.getRight(), depth + 1);
		return null;
	}

	@Override
	public Void visitUnaryExpression(UnaryExpressionAst unary, Integer depth) {
		line(depth, "Unary " + unary.getOperator());
		child(unary.getOperand(), depth + 1);
		return null;
	}

	@Override
	public Void visitFunctionCall(FunctionCallAst call, Integer depth) {
		line(depth, "Call " + call.getName());
		for (ExpressionAst argument : call.getArguments()) {
			child(argument, depth + 1);
		}
		return null;
	}

	@Override
	public Void visitArrayIndex(ArrayIndexAst index, Integer depth) {
		line(depth, "Index");
		child(index.getArray(), depth + 1);
		child(index.getIndex(), depth + 1);
		return null;
	}

	@Override
	public Void visitArrayLiteral(ArrayLiteralAst array, Integer depth) {
		line(depth, "Array");
		for (ExpressionAst element : array.getElements()) {
			child(element, depth + 1);
		}
		return null;
	}

	@Override
	public Void visitMemberAccess(MemberAccessAst access, Integer depth) {
		line(depth, "Member " + access.getMember());
		child(access.getObject(), depth + 1);
		return null;
	}

	@Override
	public Void visitBlock(BlockAst block, Integer depth) {
		line(depth, "Block");
		for (StatementAst statement : block.getStatements()) {
			statement.accept(this, depth + 1);
		}
		return null;
	}

	@Override
	public Void visitVariableDeclaration(VariableDeclarationAst declaration, Integer depth) {
		StringBuilder text = new StringBuilder(declaration.isConstant() ? "Constant " : "Variable ");
		text.append(declaration.getName());
		if (declaration.getDataType() != null) {
			text.append(" : ").append(declaration.getDataType());
		}
		line(depth, text.toString());
		if (declaration.getValue() != null) {
			child(declaration.getValue(), depth + 1);
		}
		return null;
	}

	@Override
	public Void visitAssignment(AssignmentAst assignment, Integer depth) {
		line(depth, "Assign " + assignment.getTarget());
		child(assignment.getValue(), depth + 1);
		return null;
	}

	@Override
	public Void visitPrint(PrintStatementAst print, Integer depth) {
		line(depth, "Manifest");
		child(print.getExpression(), depth + 1);
		return null;
	}

	@Override
	public Void visitIf(IfStatementAst ifStatement, Integer depth) {
		line(depth, "Dharma");
		child(ifStatement.getCondition(), depth + 1);
		child(ifStatement.getThenBlock(), depth + 1);
		if (ifStatement.getElseBlock() != null) {
			line(depth, "Adharma");
			child(ifStatement.getElseBlock(), depth + 1);
		}
		return null;
	}

	@Override
	public Void visitLoop(LoopStatementAst loop, Integer depth) {
		if (loop.getKind() == LoopStatementAst.Kind.RANGE) {
			line(depth, "Karma " + loop.getVariable() + " from/to");
			child(loop.getStart(), depth + 1);
			child(loop.getEnd(), depth + 1);
		} else {
			line(depth, "Karma " + loop.getVariable() + " in");
			child(loop.getIterable(), depth + 1);
		}
		child(loop.getBody(), depth + 1);
		return null;
	}

	@Override
	public Void visitReturn(ReturnStatementAst returnStatement, Integer depth) {
		line(depth, "Moksha");
		if (returnStatement.getExpression() != null) {
			child(returnStatement.getExpression(), depth + 1);
		}
		return null;
	}

	@Override
	public Void visitFunctionDef(FunctionDefAst function, Integer depth) {
		StringBuilder text = new StringBuilder("Shloka ").append(function.getName()).append('(');
		for (int i = 0; i < function.getParameters().size(); i++) {
			Parameter parameter = function.getParameters().get(i);
			if (i > 0) {
				text.append(", ");
			}
			text.append(parameter.getDataType()).append(' ').append(parameter.getName());
		}
		text.append(')');
		if (function.getReturnType() != null) {
			text.append(" -> ").append(function.getReturnType());
		}
		line(depth, text.toString());
		child(function.getBody(), depth + 1);
		return null;
	}

	@Override
	public Void visitMainBlock(MainBlockAst mainBlock, Integer depth) {
		line(depth, "Arjuna");
		child(mainBlock.getBody(), depth + 1);
		return null;
	}

	@Override
	public Void visitModule(ModuleAst module, Integer depth) {
		line(depth, "Yuga " + module.getName());
		child(module.getBody(), depth + 1);
		return null;
	}

	@Override
	public Void visitTry(TryStatementAst tryStatement, Integer depth) {
		line(depth, "Meditation");
		child(tryStatement.getTryBlock(), depth + 1);
		if (tryStatement.getCatchBlock() != null) {
			line(depth, "Disturbance " + tryStatement.getCatchVariable());
			child(tryStatement.getCatchBlock(), depth + 1);
		}
		return null;
	}

	@Override
	public Void visitExpressionStatement(ExpressionStatementAst statement, Integer depth) {
		line(depth, "Expression");
		child(statement.getExpression(), depth + 1);
		return null;
	}
}
