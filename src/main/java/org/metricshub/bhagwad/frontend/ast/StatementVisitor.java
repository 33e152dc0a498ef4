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

/**
 * Visitor of the statement nodes. Implementations must handle every kind of
 * statement, which the compiler checks.
 *
 * @param <R> type of the result of each visit
 * @param <C> type of the context passed along the traversal
 */
public interface StatementVisitor<R, C> {

	R visitBlock(BlockAst node, C context);

	R visitVariableDeclaration(VariableDeclarationAst node, C context);

	R visitAssignment(AssignmentAst node, C context);

	R visitPrint(PrintStatementAst node, C context);

	R visitIf(IfStatementAst node, C context);

	R visitLoop(LoopStatementAst node, C context);

	R visitReturn(ReturnStatementAst node, C context);

	R visitFunctionDef(FunctionDefAst node, C context);

	R visitMainBlock(MainBlockAst node, C context);

	R visitModule(ModuleAst node, C context);

	R visitTry(TryStatementAst node, C context);

	R visitExpressionStatement(ExpressionStatementAst node, C context);
}
