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
 * An infix operation: arithmetic, comparison or equality.
 * The operator is kept as written ({@code +}, {@code <=}, ...).
 */
public final class BinaryExpressionAst extends ExpressionAst {

	private final ExpressionAst left;
	private final String operator;
	private final ExpressionAst right;

	public BinaryExpressionAst(ExpressionAst left, String operator, ExpressionAst right, int line, int column) {
		super(line, column);
		this.left = left;
		this.operator = operator;
		this.right = right;
	}

	public ExpressionAst getLeft() {
		return left;
	}

	public String getOperator() {
		return operator;
	}

	public ExpressionAst getRight() {
		return right;
	}

	@Override
	public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
		return visitor.visitBinaryExpression(this, context);
	}
}
