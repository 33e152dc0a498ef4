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

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * A literal value.
 * <p>
 * The value is a {@link BigInteger} or a {@link BigDecimal} for
 * {@link PrimitiveType#SATTVA}, a {@link String} for {@link PrimitiveType#RAJAS},
 * and a {@link Boolean} for {@link PrimitiveType#TAMAS}.
 */
public final class LiteralAst extends ExpressionAst {

	private final Object value;
	private final PrimitiveType type;

	public LiteralAst(Object value, PrimitiveType type, int line, int column) {
		super(line, column);
		this.value = value;
		this.type = type;
	}

	public Object getValue() {
		return value;
	}

	public PrimitiveType getType() {
		return type;
	}

	@Override
	public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
		return visitor.visitLiteral(this, context);
	}
}
