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
 * A call of a named function. The name may be qualified with the name of
 * a module, as in {@code Math.add}.
 */
public final class FunctionCallAst extends ExpressionAst {

	private final String name;
	private final List<ExpressionAst> arguments;

	public FunctionCallAst(String name, List<ExpressionAst> arguments, int line, int column) {
		super(line, column);
		this.name = name;
		this.arguments = Collections.unmodifiableList(new ArrayList<ExpressionAst>(arguments));
	}

	public String getName() {
		return name;
	}

	public List<ExpressionAst> getArguments() {
		return arguments;
	}

	@Override
	public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
		return visitor.visitFunctionCall(this, context);
	}
}
