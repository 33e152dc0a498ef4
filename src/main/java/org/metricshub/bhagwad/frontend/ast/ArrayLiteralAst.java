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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A bracketed list of elements: {@code [1, 2, 3]}.
 */
public final class ArrayLiteralAst extends ExpressionAst {

	private final List<ExpressionAst> elements;

	public ArrayLiteralAst(List<ExpressionAst> elements, int line, int column) {
		super(line, column);
		this.elements = Collections.unmodifiableList(new ArrayList<ExpressionAst>(elements));
	}

	public List<ExpressionAst> getElements() {
		return elements;
	}

	@Override
	public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
		return visitor.visitArrayLiteral(this, context);
	}
}
