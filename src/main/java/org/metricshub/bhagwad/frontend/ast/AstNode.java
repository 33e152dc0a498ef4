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
 * Base class of the nodes of the abstract syntax tree.
 * <p>
 * Nodes are immutable once constructed and exclusively own their children.
 * Each node remembers where it starts in the script.
 */
public abstract class AstNode {

	private final int line;
	private final int column;

	protected AstNode(int line, int column) {
		this.line = line;
		this.column = column;
	}

	/**
	 * @return 1-based line of the first token of this node
	 */
	public final int getLine() {
		return line;
	}

	/**
	 * @return 1-based column of the first token of this node
	 */
	public final int getColumn() {
		return column;
	}
}
