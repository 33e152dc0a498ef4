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

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * A Bhagwad script stored in a {@code *.bhagwad} file, read as UTF-8.
 * The file is only opened when its contents are requested.
 */
public class ScriptFileSource extends ScriptSource {

	/** Extension of Bhagwad script files */
	public static final String EXTENSION = ".bhagwad";

	private final String filePath;

	/**
	 * @param filePath path to the script file
	 * @throws IllegalArgumentException if the file name does not end with {@value #EXTENSION}
	 */
	public ScriptFileSource(String filePath) {
		super(filePath, null);
		if (!hasScriptExtension(filePath)) {
			throw new IllegalArgumentException("Bhagwad script files must end with '" + EXTENSION + "': " + filePath);
		}
		this.filePath = filePath;
	}

	/**
	 * @param fileName name of a file
	 * @return whether the name ends with {@value #EXTENSION}
	 */
	public static boolean hasScriptExtension(String fileName) {
		return fileName != null && fileName.endsWith(EXTENSION) && fileName.length() > EXTENSION.length();
	}

	/**
	 * @return path to the script file
	 */
	public String getFilePath() {
		return filePath;
	}

	/**
	 * Computes the path of the Python file generated next to this script:
	 * the same name, with the {@code .py} extension.
	 *
	 * @return the path of the generated Python file
	 */
	public Path getDefaultOutputPath() {
		return Paths.get(filePath.substring(0, filePath.length() - EXTENSION.length()) + ".py");
	}

	/** {@inheritDoc} */
	@Override
	public Reader getReader() throws IOException {
		return Files.newBufferedReader(Paths.get(filePath), StandardCharsets.UTF_8);
	}
}
