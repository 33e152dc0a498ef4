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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;

/**
 * Represents the text of one Bhagwad script, together with a description
 * of where it comes from. The description is attached to the errors
 * reported while translating the script.
 * <p>
 * This is usually either a string given on the command line with
 * {@code -e}, or a {@code *.bhagwad} file (see {@link ScriptFileSource}).
 */
public class ScriptSource {

	/** Description of a script given on the command line */
	public static final String DESCRIPTION_COMMAND_LINE_SCRIPT = "<command-line-supplied-script>";

	private final String description;
	private final Reader reader;

	/**
	 * @param description name of the script, used in error messages
	 * @param reader reader serving the script contents
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "The reader is consumed once by the translator; no copy is possible.")
	public ScriptSource(String description, Reader reader) {
		this.description = description;
		this.reader = reader;
	}

	/**
	 * Creates a source from a script held in memory.
	 *
	 * @param description name of the script, used in error messages
	 * @param script text of the script
	 * @return a new source
	 */
	public static ScriptSource fromString(String description, String script) {
		return new ScriptSource(description, new StringReader(script));
	}

	/**
	 * @return the name of the script
	 */
	public final String getDescription() {
		return description;
	}

	/**
	 * Obtain the {@link Reader} serving the script contents.
	 *
	 * @return The reader which contains the script contents.
	 * @throws IOException if the script cannot be opened
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "The reader is meant to be consumed by the caller.")
	public Reader getReader() throws IOException {
		return reader;
	}

	/**
	 * Reads the whole script and closes the reader.
	 *
	 * @return the text of the script
	 * @throws IOException if the script cannot be read
	 */
	public String readScript() throws IOException {
		StringBuilder script = new StringBuilder();
		char[] buffer = new char[4096];
		try (Reader in = getReader()) {
			if (in == null) {
				throw new IOException("No content available for " + description);
			}
			int count;
			while ((count = in.read(buffer)) != -1) {
				script.append(buffer, 0, count);
			}
		}
		return script.toString();
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getDescription();
	}
}
