package org.metricshub.bhagwad.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.metricshub.bhagwad.frontend.BhagwadParser;
import org.metricshub.bhagwad.frontend.Lexer;
import org.metricshub.bhagwad.frontend.ast.ProgramAst;

public class AstDumperTest {

	private static ProgramAst parse(String script) {
		return new BhagwadParser(Lexer.tokenize(script)).parse();
	}

	@Test
	public void testDumpTokens() {
		assertEquals(
				"MANIFEST(manifest) at 1:1\nSTRING(Om) at 1:10\nEOF() at 1:14\n",
				AstDumper.dumpTokens(Lexer.tokenize("manifest 'Om'")));
	}

	@Test
	public void testDumpFunction() {
		String script = "shloka add(sattva a, cosmic sattva[] b) -> sattva {\n"
				+ "    moksha a + b[0]\n"
				+ "}\n";
		assertEquals(
				"Program\n"
						+ "  Shloka add(sattva a, sattva[] b) -> sattva\n"
						+ "    Block\n"
						+ "      Moksha\n"
						+ "        Binary +\n"
						+ "          Identifier a\n"
						+ "          Index\n"
						+ "            Identifier b\n"
						+ "            Literal 0 (sattva)\n",
				AstDumper.dump(parse(script)));
	}

	@Test
	public void testDumpStatements() {
		String script = "sankalpa LIMIT = 3\n"
				+ "rajas name\n"
				+ "karma i in [1, 2] {\n"
				+ "    dharma (i > LIMIT) { manifest \"big\" } adharma { meditation { log.write(i) } disturbance (err) { } }\n"
				+ "}\n";
		assertEquals(
				"Program\n"
						+ "  Constant LIMIT\n"
						+ "    Literal 3 (sattva)\n"
						+ "  Variable name : rajas\n"
						+ "  Karma i in\n"
						+ "    Array\n"
						+ "      Literal 1 (sattva)\n"
						+ "      Literal 2 (sattva)\n"
						+ "    Block\n"
						+ "      Dharma\n"
						+ "        Binary >\n"
						+ "          Identifier i\n"
						+ "          Identifier LIMIT\n"
						+ "        Block\n"
						+ "          Manifest\n"
						+ "            Literal \"big\" (rajas)\n"
						+ "      Adharma\n"
						+ "        Block\n"
						+ "          Meditation\n"
						+ "            Block\n"
						+ "              Expression\n"
						+ "                Call log.write\n"
						+ "                  Identifier i\n"
						+ "          Disturbance err\n"
						+ "            Block\n",
				AstDumper.dump(parse(script)));
	}

	@Test
	public void testSameTreeSameText() {
		String script = "arjuna {\n  maya x = -(1 + 2) * 3\n  x = x % 2\n}\n";
		assertEquals(AstDumper.dump(parse(script)), AstDumper.dump(parse(script)));
		assertTrue(AstDumper.dump(parse(script)).contains("      Assign x\n        Binary %\n"));
	}
}
