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
 * Visitor of the expression nodes. Implementations must handle every kind of
 * expression, which the compiler checks.
 *
 * @param <R> type of the result of each visit
 * @param <C> type of the context passed along the traversal
 */
public interface ExpressionVisitor<R, C> {

	R visitLiteral(LiteralAst node, C context);

	R visitIdentifier(IdentifierAst node, C context);

	R visitBinaryExpression(BinaryExpressionAst node, C context);

	R visitUnaryExpression(UnaryExpressionAst node, C context);

	R visitFunctionCall(FunctionCallAst node, C context);

	R visitArrayIndex(ArrayIndexAst node, C context);

	R visitArrayLiteral(ArrayLiteralAst node, C context);

	R visitMemberAccess(MemberAccessAst node, C context);
}
