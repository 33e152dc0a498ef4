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
 * Introduction of a named binding.
 * <p>
 * The three surface forms ({@code maya}/{@code sankalpa}, primitive-typed,
 * and {@code cosmic} array-typed) all produce this node. The data type is
 * {@code null} for untyped bindings, a primitive keyword such as
 * {@code sattva}, or an array type such as {@code sattva[]}.
 */
public final class VariableDeclarationAst extends StatementAst {

	private final String name;
	private final String dataType;
	private final ExpressionAst value;
	private final boolean constant;

	public VariableDeclarationAst(String name, String dataType, ExpressionAst value, boolean constant, int line, int column) {
		super(line, column);
		this.name = name;
		this.dataType = dataType;
		this.value = value;
		this.constant = constant;
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the declared type, or {@code null} if untyped
	 */
	public String getDataType() {
		return dataType;
	}

	/**
	 * @return the initializer, or {@code null} if none
	 */
	public ExpressionAst getValue() {
		return value;
	}

	public boolean isConstant() {
		return constant;
	}

	@Override
	public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
		return visitor.visitVariableDeclaration(this, context);
	}
}
