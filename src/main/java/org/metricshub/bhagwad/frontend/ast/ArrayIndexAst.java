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
 * Indexed access into a collection: {@code array[index]}.
 */
public final class ArrayIndexAst extends ExpressionAst {

	private final ExpressionAst array;
	private final ExpressionAst index;

	public ArrayIndexAst(ExpressionAst array, ExpressionAst index, int line, int column) {
		super(line, column);
		this.array = array;
		this.index = index;
	}

	public ExpressionAst getArray() {
		return array;
	}

	public ExpressionAst getIndex() {
		return index;
	}

	@Override
	public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
		return visitor.visitArrayIndex(this, context);
	}
}
