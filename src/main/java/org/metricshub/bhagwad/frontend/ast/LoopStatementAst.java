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
 * A {@code karma} loop, in one of two forms:
 * <ul>
 * <li>{@code karma i from start to end { ... }}, where both bounds are inclusive
 * <li>{@code karma item in iterable { ... }}
 * </ul>
 * Use the {@link #range} and {@link #collection} factories.
 */
public final class LoopStatementAst extends StatementAst {

	/** The two forms of loop */
	public enum Kind {
		RANGE,
		COLLECTION
	}

	private final Kind kind;
	private final String variable;
	private final ExpressionAst start;
	private final ExpressionAst end;
	private final ExpressionAst iterable;
	private final BlockAst body;

	private LoopStatementAst(
			Kind kind,
			String variable,
			ExpressionAst start,
			ExpressionAst end,
			ExpressionAst iterable,
			BlockAst body,
			int line,
			int column) {
		super(line, column);
		this.kind = kind;
		this.variable = variable;
		this.start = start;
		this.end = end;
		this.iterable = iterable;
		this.body = body;
	}

	public static LoopStatementAst range(String variable, ExpressionAst start, ExpressionAst end, BlockAst body, int line, int column) {
		return new LoopStatementAst(Kind.RANGE, variable, start, end, null, body, line, column);
	}

	public static LoopStatementAst collection(String variable, ExpressionAst iterable, BlockAst body, int line, int column) {
		return new LoopStatementAst(Kind.COLLECTION, variable, null, null, iterable, body, line, column);
	}

	public Kind getKind() {
		return kind;
	}

	public String getVariable() {
		return variable;
	}

	/**
	 * @return the first value of the range, {@code null} for collection loops
	 */
	public ExpressionAst getStart() {
		return start;
	}

	/**
	 * @return the last value of the range (inclusive), {@code null} for collection loops
	 */
	public ExpressionAst getEnd() {
		return end;
	}

	/**
	 * @return the iterated expression, {@code null} for range loops
	 */
	public ExpressionAst getIterable() {
		return iterable;
	}

	public BlockAst getBody() {
		return body;
	}

	@Override
	public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
		return visitor.visitLoop(this, context);
	}
}
