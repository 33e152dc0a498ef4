package org.metricshub.bhagwad.util;

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
 * A simple container for the parameters of a translation, mostly
 * populated by the command line switches.
 * <p>
 * The translator takes a copy of the settings it is given, so changing an
 * instance afterwards has no effect on translations already configured.
 */
public class TranslatorSettings {

	/**
	 * Number of spaces per indentation level of the generated Python code;
	 * <code>4</code> by default.
	 */
	private int indent = 4;

	/**
	 * Whether the generated code starts with the shebang line and the
	 * module docstring; <code>true</code> by default.
	 */
	private boolean emitHeader = true;

	/**
	 * Whether generated lines carry a trailing comment naming the
	 * Bhagwad construct they come from; <code>true</code> by default.
	 */
	private boolean emitAnnotations = true;

	/**
	 * Creates settings with default values.
	 */
	public TranslatorSettings() {}

	/**
	 * Creates a copy of the specified settings.
	 *
	 * @param other settings to copy
	 */
	public TranslatorSettings(TranslatorSettings other) {
		this.indent = other.indent;
		this.emitHeader = other.emitHeader;
		this.emitAnnotations = other.emitAnnotations;
	}

	/**
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("indent = ").append(getIndent()).append(newLine);
		desc.append("emitHeader = ").append(isEmitHeader()).append(newLine);
		desc.append("emitAnnotations = ").append(isEmitAnnotations()).append(newLine);

		return desc.toString();
	}

	/**
	 * @return the number of spaces per indentation level
	 */
	public int getIndent() {
		return indent;
	}

	/**
	 * @param indent the number of spaces per indentation level, at least 1
	 * @throws IllegalArgumentException if the value is lower than 1
	 */
	public void setIndent(int indent) {
		if (indent < 1) {
			throw new IllegalArgumentException("Indentation must be at least 1 space: " + indent);
		}
		this.indent = indent;
	}

	/**
	 * @return whether the header is generated
	 */
	public boolean isEmitHeader() {
		return emitHeader;
	}

	/**
	 * @param emitHeader whether the header is generated
	 */
	public void setEmitHeader(boolean emitHeader) {
		this.emitHeader = emitHeader;
	}

	/**
	 * @return whether the trailing annotations are generated
	 */
	public boolean isEmitAnnotations() {
		return emitAnnotations;
	}

	/**
	 * @param emitAnnotations whether the trailing annotations are generated
	 */
	public void setEmitAnnotations(boolean emitAnnotations) {
		this.emitAnnotations = emitAnnotations;
	}
}
