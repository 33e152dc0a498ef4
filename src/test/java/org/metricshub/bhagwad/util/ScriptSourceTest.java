package org.metricshub.bhagwad.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Paths;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ScriptSourceTest {

	@Rule
	public TemporaryFolder tempFolder = new TemporaryFolder();

	@Test
	public void testReadFromString() throws Exception {
		ScriptSource source = ScriptSource.fromString("inline", "manifest 1\nmanifest 2\n");
		assertEquals("inline", source.getDescription());
		assertEquals("inline", source.toString());
		assertEquals("manifest 1\nmanifest 2\n", source.readScript());
	}

	@Test
	public void testReadWithoutReader() {
		ScriptSource source = new ScriptSource("nothing", null);
		IOException e = assertThrows(IOException.class, source::readScript);
		assertEquals("No content available for nothing", e.getMessage());
	}

	@Test
	public void testReadFile() throws Exception {
		File file = tempFolder.newFile("gita.bhagwad");
		Files.write(file.toPath(), "manifest \"धर्म\"\n".getBytes(StandardCharsets.UTF_8));
		ScriptFileSource source = new ScriptFileSource(file.getPath());
		assertEquals(file.getPath(), source.getDescription());
		assertEquals(file.getPath(), source.getFilePath());
		assertEquals("manifest \"धर्म\"\n", source.readScript());
	}

	@Test
	public void testMissingFile() {
		ScriptFileSource source = new ScriptFileSource(new File(tempFolder.getRoot(), "absent.bhagwad").getPath());
		assertThrows(NoSuchFileException.class, source::readScript);
	}

	@Test
	public void testExtension() {
		assertTrue(ScriptFileSource.hasScriptExtension("a.bhagwad"));
		assertTrue(ScriptFileSource.hasScriptExtension("dir/app.bhagwad"));
		assertFalse(ScriptFileSource.hasScriptExtension(".bhagwad"));
		assertFalse(ScriptFileSource.hasScriptExtension("app.py"));
		assertFalse(ScriptFileSource.hasScriptExtension(null));

		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new ScriptFileSource("app.txt"));
		assertEquals("Bhagwad script files must end with '.bhagwad': app.txt", e.getMessage());
	}

	@Test
	public void testDefaultOutputPath() {
		assertEquals(Paths.get("app.py"), new ScriptFileSource("app.bhagwad").getDefaultOutputPath());
		assertEquals(Paths.get("src", "loop.py"), new ScriptFileSource("src/loop.bhagwad").getDefaultOutputPath());
	}
}
