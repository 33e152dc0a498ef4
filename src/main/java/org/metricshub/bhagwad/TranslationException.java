package org.metricshub.bhagwad;

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
 * Base class of all the errors raised while translating a Bhagwad script.
 * It is provided to conveniently distinguish between translation
 * errors and other runtime exceptions.
 * <p>
 * The position of the error is kept apart from the message, so that
 * callers can decide how to present it.
 */
public class TranslationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int lineNumber;

	private final int columnNumber;

	private final String sourceDescription;

	/**
	 * Creates an exception that is not associated with any position.
	 *
	 * @param msg description of the problem
	 */
	public TranslationException(String msg) {
		this(msg, null, -1, -1);
	}

	/**
	 * Creates an exception associated with a position in the script.
	 *
	 * @param msg description of the problem
	 * @param lineno 1-based line number, or {@code -1}
	 * @param column 1-based column number, or {@code -1}
	 */
	public TranslationException(String msg, int lineno, int column) {
		this(msg, null, lineno, column);
	}

	/**
	 * Creates an exception associated with a position in a named script.
	 *
	 * @param msg description of the problem
	 * @param sourceDescription name of the script (usually a file name), may be {@code null}
	 * @param lineno 1-based line number, or {@code -1}
	 * @param column 1-based column number, or {@code -1}
	 */
	public TranslationException(String msg, String sourceDescription, int lineno, int column) {
		super(msg);
		this.sourceDescription = sourceDescription;
		this.lineNumber = lineno;
		this.columnNumber = column;
	}

	/**
	 * Returns the line number associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * Returns the column number associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the offending column number or {@code -1}
	 */
	public int getColumnNumber() {
		return columnNumber;
	}

	/**
	 * @return the description of the script in which the error occurred, or {@code null}
	 */
	public String getSourceDescription() {
		return sourceDescription;
	}

	/**
	 * Creates a copy of this exception that names the script it comes from.
	 *
	 * @param description description of the script
	 * @return a new exception of the same kind
	 */
	public TranslationException withSourceDescription(String description) {
		TranslationException copy = new TranslationException(getMessage(), description, lineNumber, columnNumber);
		copy.initCause(this);
		return copy;
	}

	/**
	 * Formats the position of the error as {@code description:line:column},
	 * omitting the parts that are unknown.
	 *
	 * @return the formatted location, empty if nothing is known
	 */
	public String getLocation() {
		StringBuilder location = new StringBuilder();
		if (sourceDescription != null) {
			location.append(sourceDescription);
		}
		if (lineNumber >= 0) {
			if (location.length() > 0) {
				location.append(':');
			}
			location.append(lineNumber);
			if (columnNumber >= 0) {
				location.append(':').append(columnNumber);
			}
		}
		return location.toString();
	}
}
