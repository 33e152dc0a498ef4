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
 * {@code dharma (condition) { ... } adharma { ... }}, the else block being optional.
 */
public final class IfStatementAst extends StatementAst {

	private final ExpressionAst condition;
	private final BlockAst thenBlock;
	private final BlockAst elseBlock;

	public IfStatementAst(ExpressionAst condition, BlockAst thenBlock, BlockAst elseBlock, int line, int column) {
		super(line, column);
		this.condition = condition;
		this.thenBlock = thenBlock;
		this.elseBlock = elseBlock;
	}

	public ExpressionAst getCondition() {
		return condition;
	}

	public BlockAst getThenBlock() {
		return thenBlock;
	}

	/**
	 * @return the else block, or {@code null}
	 */
	public BlockAst getElseBlock() {
		return elseBlock;
	}

	@Override
	public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
		return visitor.visitIf(this, context);
	}
}
