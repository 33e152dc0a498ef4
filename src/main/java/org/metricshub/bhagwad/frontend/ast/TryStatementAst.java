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
 * {@code meditation { ... } disturbance (error) { ... }}, the
 * {@code disturbance} clause being optional.
 */
public final class TryStatementAst extends StatementAst {

	private final BlockAst tryBlock;
	private final String catchVariable;
	private final BlockAst catchBlock;

	public TryStatementAst(BlockAst tryBlock, String catchVariable, BlockAst catchBlock, int line, int column) {
		super(line, column);
		this.tryBlock = tryBlock;
		this.catchVariable = catchVariable;
		this.catchBlock = catchBlock;
	}

	public BlockAst getTryBlock() {
		return tryBlock;
	}

	/**
	 * @return the name bound to the caught error, or {@code null} without a catch clause
	 */
	public String getCatchVariable() {
		return catchVariable;
	}

	/**
	 * @return the error-handling block, or {@code null} without a catch clause
	 */
	public BlockAst getCatchBlock() {
		return catchBlock;
	}

	@Override
	public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
		return visitor.visitTry(this, context);
	}
}
