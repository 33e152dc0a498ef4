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

import java.util.Locale;

/**
 * The three primitive types of Bhagwad (the gunas), with the name of the
 * Python type that represents them at run time.
 */
public enum PrimitiveType {
	SATTVA("int", "0"),
	RAJAS("str", "\"\""),
	TAMAS("bool", "False");

	/** Suffix of the type string of array types, as in {@code sattva[]} */
	public static final String ARRAY_SUFFIX = "[]";

	private final String pythonType;
	private final String pythonDefault;

	PrimitiveType(String pythonType, String pythonDefault) {
		this.pythonType = pythonType;
		this.pythonDefault = pythonDefault;
	}

	/**
	 * @return the keyword of this type in Bhagwad scripts
	 */
	public String keyword() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * @return the name of the corresponding Python type
	 */
	public String getPythonType() {
		return pythonType;
	}

	/**
	 * @return the Python literal of the default value of this type
	 */
	public String getPythonDefault() {
		return pythonDefault;
	}

	/**
	 * Looks up a primitive type by its keyword, whatever its case.
	 *
	 * @param keyword the keyword, e.g. {@code Sattva}
	 * @return the type, or {@code null} if the keyword is not a primitive type
	 */
	public static PrimitiveType fromKeyword(String keyword) {
		if (keyword == null) {
			return null;
		}
		for (PrimitiveType type : values()) {
			if (type.name().equalsIgnoreCase(keyword)) {
				return type;
			}
		}
		return null;
	}
}
