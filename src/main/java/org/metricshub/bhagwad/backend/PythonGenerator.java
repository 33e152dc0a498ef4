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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.metricshub.bhagwad.frontend.ast.ArrayIndexAst;
import org.metricshub.bhagwad.frontend.ast.ArrayLiteralAst;
import org.metricshub.bhagwad.frontend.ast.AssignmentAst;
import org.metricshub.bhagwad.frontend.ast.AstNode;
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
import org.metricshub.bhagwad.frontend.ast.PrimitiveType;
import org.metricshub.bhagwad.frontend.ast.PrintStatementAst;
import org.metricshub.bhagwad.frontend.ast.ProgramAst;
import org.metricshub.bhagwad.frontend.ast.ReturnStatementAst;
import org.metricshub.bhagwad.frontend.ast.StatementAst;
import org.metricshub.bhagwad.frontend.ast.StatementVisitor;
import org.metricshub.bhagwad.frontend.ast.TryStatementAst;
import org.metricshub.bhagwad.frontend.ast.UnaryExpressionAst;
import org.metricshub.bhagwad.frontend.ast.VariableDeclarationAst;
import org.metricshub.bhagwad.util.TranslatorSettings;

/**
 * Translates the syntax tree of a Bhagwad script into Python 3 source code.
 * <p>
 * Expressions are rendered into strings; statements emit lines into the
 * {@link GeneratorContext} of the current generation. The generator itself
 * only holds its settings, so one instance can serve any number of
 * generations, concurrently or not.
 */
public class PythonGenerator
		implements ExpressionVisitor<String, GeneratorContext>, StatementVisitor<Void, GeneratorContext> {

	static final String[] HEADER = {
			"#!/usr/bin/env python3",
			"\"\"\"",
			"Generated from Bhagwad Programming Language",
			"\"\"\"" };

	private static final String DOCSTRING_QUOTES = "\"\"\"";

	private final TranslatorSettings settings;

	/**
	 * Creates a generator with default settings.
	 */
	public PythonGenerator() {
		this(new TranslatorSettings());
	}

	/**
	 * @param settings settings of the generated code; a copy is kept
	 */
	public PythonGenerator(TranslatorSettings settings) {
		this.settings = new TranslatorSettings(settings);
	}

	/**
	 * Generates the Python program equivalent to the specified syntax tree.
	 * Each top-level statement is followed by a blank line.
	 *
	 * @param program root of the syntax tree
	 * @return the Python source code
	 * @throws GenerationException if the tree lacks a required node
	 */
	public String generate(ProgramAst program) {
		return generateLines(program).toText();
	}

	/**
	 * Same as {@link #generate(ProgramAst)}, but returns the context, whose
	 * lines can be inspected.
	 *
	 * @param program root of the syntax tree
	 * @return the context holding the generated lines
	 */
	public GeneratorContext generateLines(ProgramAst program) {
		if (program == null) {
			throw new IllegalArgumentException("program must not be null");
		}
		GeneratorContext context = new GeneratorContext(settings);
		// top-level constants are global in Python, so function bodies may use them before the declaration
		for (StatementAst statement : program.getStatements()) {
			collectConstants(required(statement, program, "statement"), context);
		}

		if (settings.isEmitHeader()) {
			for (String line : HEADER) {
				context.emitRaw(line);
			}
			context.blankLine();
		}

		for (StatementAst statement : program.getStatements()) {
			statement.accept(this, context);
			context.blankLine();
		}
		return context;
	}

	private static void collectConstants(StatementAst statement, GeneratorContext context) {
		if (statement instanceof VariableDeclarationAst && ((VariableDeclarationAst) statement).isConstant()) {
			context.declareConstant(((VariableDeclarationAst) statement).getName());
		} else if (statement instanceof ModuleAst && ((ModuleAst) statement).getBody() != null) {
			ModuleAst module = (ModuleAst) statement;
			for (StatementAst member : module.getBody().getStatements()) {
				if (member instanceof VariableDeclarationAst && ((VariableDeclarationAst) member).isConstant()) {
					context.addModuleConstant(module.getName(), ((VariableDeclarationAst) member).getName());
				}
			}
		}
	}

	private static <T> T required(T child, AstNode parent, String what) {
		if (child == null) {
			throw new GenerationException(
					"Missing " + what + " in " + parent.getClass().getSimpleName(),
					parent);
		}
		return child;
	}

	private String expression(ExpressionAst expression, AstNode parent, String what, GeneratorContext context) {
		return required(expression, parent, what).accept(this, context);
	}

	/**
	 * Emits the statements of a block one level deeper, or {@code pass}
	 * if the block is empty. The block has its own scope, where the
	 * specified names are bound.
	 */
	private void body(BlockAst block, AstNode parent, GeneratorContext context, String... binders) {
		required(block, parent, "block");
		context.indent();
		context.enterScope();
		for (String binder : binders) {
			if (binder != null) {
				context.declare(binder);
			}
		}
		if (block.isEmpty()) {
			context.emit("pass");
		} else {
			block.accept(this, context);
		}
		context.exitScope();
		context.dedent();
	}

	/**
	 * Renders a possibly dotted name such as {@code Temple.open}.
	 */
	private static String dottedName(String name, GeneratorContext context) {
		String[] parts = name.split("\\.");
		StringBuilder text = new StringBuilder(context.pythonName(parts[0]));
		for (int i = 1; i < parts.length; i++) {
			text.append('.');
			text.append(i == 1 ? context.memberName(parts[0], parts[i]) : GeneratorContext.safeName(parts[i]));
		}
		return text.toString();
	}

	// Types

	/**
	 * Maps a Bhagwad type string to the name of a Python type, as in
	 * {@code sattva[]} to {@code List[int]}.
	 *
	 * @param bhagwadType the type string, e.g. {@code rajas} or {@code tamas[][]}
	 * @return the Python type, {@code Any} if the type is unknown
	 */
	static String pythonType(String bhagwadType) {
		if (bhagwadType == null) {
			return "Any";
		}
		if (bhagwadType.endsWith(PrimitiveType.ARRAY_SUFFIX)) {
			String elementType = bhagwadType.substring(0, bhagwadType.length() - PrimitiveType.ARRAY_SUFFIX.length());
			return "List[" + pythonType(elementType) + "]";
		}
		PrimitiveType primitive = PrimitiveType.fromKeyword(bhagwadType);
		return primitive == null ? "Any" : primitive.getPythonType();
	}

	/**
	 * @param bhagwadType the type string of a declaration, may be {@code null}
	 * @return the Python literal a declaration without initializer is bound to
	 */
	static String defaultValue(String bhagwadType) {
		if (bhagwadType == null) {
			return "None";
		}
		if (bhagwadType.endsWith(PrimitiveType.ARRAY_SUFFIX)) {
			return "[]";
		}
		PrimitiveType primitive = PrimitiveType.fromKeyword(bhagwadType);
		return primitive == null ? "None" : primitive.getPythonDefault();
	}

	// Literals

	/**
	 * Renders a string as a double-quoted Python literal.
	 *
	 * @param value the string
	 * @return the Python literal
	 */
	static String quote(String value) {
		StringBuilder literal = new StringBuilder(value.length() + 2);
		literal.append('"');
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			switch (c) {
			case '\\':
				literal.append("\\\\");
				break;
			case '"':
				literal.append("\\\"");
				break;
			case '\n':
				literal.append("\\n");
				break;
			case '\r':
				literal.append("\\r");
				break;
			case '\t':
				literal.append("\\t");
				break;
			default:
				if (c < 0x20 || c == 0x7f) {
					literal.append(String.format(Locale.ROOT, "\\x%02x", (int) c));
				} else {
					literal.append(c);
				}
				break;
			}
		}
		return literal.append('"').toString();
	}

	/**
	 * Renders a number so that Python reads it with the same kind: a
	 * floating number always keeps a decimal point.
	 */
	static String number(Number value) {
		if (value instanceof BigDecimal) {
			BigDecimal decimal = (BigDecimal) value;
			String text = decimal.toPlainString();
			if (decimal.scale() <= 0) {
				return text + ".0";
			}
			return text;
		}
		return value.toString();
	}

	// Expressions

	@Override
	public String visitLiteral(LiteralAst literal, GeneratorContext context) {
		Object value = literal.getValue();
		if (value == null) {
			return "None";
		}
		if (value instanceof Boolean) {
			return ((Boolean) value).booleanValue() ? "True" : "False";
		}
		if (value instanceof Number) {
			return number((Number) value);
		}
		return quote(value.toString());
	}

	@Override
	public String visitIdentifier(IdentifierAst identifier, GeneratorContext context) {
		return context.pythonName(identifier.getName());
	}

	@Override
	public String visitBinaryExpression(BinaryExpressionAst binary, GeneratorContext context) {
		String left = expression(binary.getLeft(), binary, "left operand", context);
		String right = expression(binary.getRight(), binary, "right operand", context);
		return "(" + left + " " + binary.getOperator() + " " + right + ")";
	}

	@Override
	public String visitUnaryExpression(UnaryExpressionAst unary, GeneratorContext context) {
		return "(" + unary.getOperator() + expression(unary.getOperand(), unary, "operand", context) + ")";
	}

	@Override
	public String visitFunctionCall(FunctionCallAst call, GeneratorContext context) {
		return dottedName(call.getName(), context) + "(" + join(call.getArguments(), call, context) + ")";
	}

	@Override
	public String visitArrayIndex(ArrayIndexAst index, GeneratorContext context) {
		String array = expression(index.getArray(), index, "array", context);
		return array + "[" + expression(index.getIndex(), index, "index", context) + "]";
	}

	@Override
	public String visitArrayLiteral(ArrayLiteralAst array, GeneratorContext context) {
		return "[" + join(array.getElements(), array, context) + "]";
	}

	@Override
	public String visitMemberAccess(MemberAccessAst access, GeneratorContext context) {
		String object = expression(access.getObject(), access, "object", context);
		if (access.getObject() instanceof IdentifierAst) {
			return object + "." + context.memberName(((IdentifierAst) access.getObject()).getName(), access.getMember());
		}
		return object + "." + GeneratorContext.safeName(access.getMember());
	}

	private String join(List<ExpressionAst> expressions, AstNode parent, GeneratorContext context) {
		List<String> parts = new ArrayList<String>(expressions.size());
		for (ExpressionAst expression : expressions) {
			parts.add(expression(expression, parent, "element", context));
		}
		return String.join(", ", parts);
	}

	// Statements

	@Override
	public Void visitBlock(BlockAst block, GeneratorContext context) {
		for (StatementAst statement : block.getStatements()) {
			required(statement, block, "statement").accept(this, context);
		}
		return null;
	}

	@Override
	public Void visitVariableDeclaration(VariableDeclarationAst declaration, GeneratorContext context) {
		String value;
		if (declaration.getValue() != null) {
			value = declaration.getValue().accept(this, context);
		} else {
			value = defaultValue(declaration.getDataType());
		}

		String target;
		if (declaration.isConstant()) {
			target = context.declareConstant(declaration.getName());
			context.emit("# Sankalpa (Constant): " + declaration.getName());
		} else {
			target = context.declare(declaration.getName());
			context.emit("# Maya (Variable): " + declaration.getName());
		}
		if (declaration.getDataType() != null) {
			context.emit("# Type: " + pythonType(declaration.getDataType()));
		}
		context.emit(target + " = " + value);
		return null;
	}

	@Override
	public Void visitAssignment(AssignmentAst assignment, GeneratorContext context) {
		String value = expression(assignment.getValue(), assignment, "value", context);
		context.emit(context.pythonName(assignment.getTarget()) + " = " + value);
		return null;
	}

	@Override
	public Void visitPrint(PrintStatementAst print, GeneratorContext context) {
		String value = expression(print.getExpression(), print, "expression", context);
		context.emit("print(" + value + ")", "Manifest: print");
		return null;
	}

	@Override
	public Void visitIf(IfStatementAst ifStatement, GeneratorContext context) {
		emitIf(ifStatement, "if", context);
		return null;
	}

	/**
	 * An else block made of a single conditional is rendered as {@code elif}.
	 */
	private void emitIf(IfStatementAst ifStatement, String keyword, GeneratorContext context) {
		String condition = expression(ifStatement.getCondition(), ifStatement, "condition", context);
		context.emit(keyword + " " + condition + ":", "Dharma: if");
		body(ifStatement.getThenBlock(), ifStatement, context);

		BlockAst elseBlock = ifStatement.getElseBlock();
		if (elseBlock == null) {
			return;
		}
		List<StatementAst> statements = elseBlock.getStatements();
		if (statements.size() == 1 && statements.get(0) instanceof IfStatementAst) {
			emitIf((IfStatementAst) statements.get(0), "elif", context);
		} else {
			context.emit("else:", "Adharma: else");
			body(elseBlock, ifStatement, context);
		}
	}

	@Override
	public Void visitLoop(LoopStatementAst loop, GeneratorContext context) {
		if (loop.getKind() == LoopStatementAst.Kind.RANGE) {
			String start = expression(loop.getStart(), loop, "range start", context);
			String end = expression(loop.getEnd(), loop, "range end", context);
			context.emit("for " + GeneratorContext.safeName(loop.getVariable()) + " in range(" + start + ", " + end + " + 1):", "Karma: range");
		} else {
			String iterable = expression(loop.getIterable(), loop, "iterable", context);
			context.emit("for " + GeneratorContext.safeName(loop.getVariable()) + " in " + iterable + ":", "Karma: collection");
		}
		body(loop.getBody(), loop, context, loop.getVariable());
		return null;
	}

	@Override
	public Void visitReturn(ReturnStatementAst returnStatement, GeneratorContext context) {
		if (returnStatement.getExpression() == null) {
			context.emit("return", "Moksha: return");
		} else {
			context.emit("return " + returnStatement.getExpression().accept(this, context), "Moksha: return");
		}
		return null;
	}

	@Override
	public Void visitFunctionDef(FunctionDefAst function, GeneratorContext context) {
		List<String> names = new ArrayList<String>();
		for (Parameter parameter : function.getParameters()) {
			names.add(GeneratorContext.safeName(parameter.getName()));
		}
		String name = context.declare(function.getName());
		context.emit("def " + name + "(" + String.join(", ", names) + "):", "Shloka: function");

		if (!function.getParameters().isEmpty() || function.getReturnType() != null) {
			context.indent();
			context.emit(DOCSTRING_QUOTES);
			if (!function.getParameters().isEmpty()) {
				context.emit("Parameters:");
				for (Parameter parameter : function.getParameters()) {
					context.emit("    " + GeneratorContext.safeName(parameter.getName()) + ": " + pythonType(parameter.getDataType())
							+ " (" + parameter.getDataType() + ")");
				}
			}
			if (function.getReturnType() != null) {
				context.emit("Returns: " + pythonType(function.getReturnType()) + " (" + function.getReturnType() + ")");
			}
			context.emit(DOCSTRING_QUOTES);
			context.dedent();
		}

		List<String> parameters = new ArrayList<String>();
		for (Parameter parameter : function.getParameters()) {
			parameters.add(parameter.getName());
		}
		body(function.getBody(), function, context, parameters.toArray(new String[0]));
		return null;
	}

	@Override
	public Void visitMainBlock(MainBlockAst mainBlock, GeneratorContext context) {
		context.emit("if __name__ == \"__main__\":", "Arjuna: main");
		body(mainBlock.getBody(), mainBlock, context);
		return null;
	}

	@Override
	public Void visitModule(ModuleAst module, GeneratorContext context) {
		context.emit("class " + context.declare(module.getName()) + ":", "Yuga: module");
		body(module.getBody(), module, context);
		return null;
	}

	@Override
	public Void visitTry(TryStatementAst tryStatement, GeneratorContext context) {
		context.emit("try:", "Meditation: try");
		body(tryStatement.getTryBlock(), tryStatement, context);

		if (tryStatement.getCatchBlock() != null) {
			String variable = tryStatement.getCatchVariable() == null
					? "e"
					: GeneratorContext.safeName(tryStatement.getCatchVariable());
			context.emit("except Exception as " + variable + ":", "Disturbance: catch");
			body(tryStatement.getCatchBlock(), tryStatement, context, tryStatement.getCatchVariable());
		} else {
			// Python requires a handler or a finally clause
			context.emit("finally:");
			context.indent();
			context.emit("pass");
			context.dedent();
		}
		return null;
	}

	@Override
	public Void visitExpressionStatement(ExpressionStatementAst statement, GeneratorContext context) {
		context.emit(expression(statement.getExpression(), statement, "expression", context));
		return null;
	}
}
