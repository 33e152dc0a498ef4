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
 * {@code shloka name(sattva a, rajas b) -> tamas { ... }}
 */
public final class FunctionDefAst extends StatementAst {

	private final String name;
	private final List<Parameter> parameters;
	private final String returnType;
	private final BlockAst body;

	public FunctionDefAst(String name, List<Parameter> parameters, String returnType, BlockAst body, int line, int column) {
		super(line, column);
		this.name = name;
		this.parameters = Collections.unmodifiableList(new ArrayList<Parameter>(parameters));
		this.returnType = returnType;
		this.body = body;
	}

	public String getName() {
		return name;
	}

	public List<Parameter> getParameters() {
		return parameters;
	}

	/**
	 * @return the declared return type, or {@code null}
	 */
	public String getReturnType() {
		return returnType;
	}

	public BlockAst getBody() {
		return body;
	}

	@Override
	public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
		return visitor.visitFunctionDef(this, context);
	}
}
