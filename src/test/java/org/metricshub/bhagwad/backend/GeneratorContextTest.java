package org.metricshub.bhagwad.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.metricshub.bhagwad.util.TranslatorSettings;

public class GeneratorContextTest {

	@Test
	public void testScopes() {
		GeneratorContext context = new GeneratorContext(new TranslatorSettings());
		assertEquals("MAX", context.declareConstant("max"));
		assertTrue(context.isConstant("max"));

		context.enterScope();
		assertEquals("MAX", context.pythonName("max"));
		assertEquals("max", context.declare("max"));
		assertFalse(context.isConstant("max"));
		assertEquals("max", context.pythonName("max"));
		context.exitScope();

		assertEquals("MAX", context.pythonName("max"));
		assertEquals("other", context.pythonName("other"));
		IllegalStateException e = assertThrows(IllegalStateException.class, context::exitScope);
		assertEquals("The global scope cannot be closed", e.getMessage());
	}

	@Test
	public void testModuleMembers() {
		GeneratorContext context = new GeneratorContext(new TranslatorSettings());
		context.addModuleConstant("Temple", "bell");
		assertEquals("BELL", context.memberName("Temple", "bell"));
		assertEquals("door", context.memberName("Temple", "door"));
		assertEquals("bell", context.memberName("Other", "bell"));

		context.enterScope();
		context.declare("Temple");
		assertEquals("bell", context.memberName("Temple", "bell"));
		context.exitScope();
	}

	@Test
	public void testPythonKeywords() {
		assertEquals("lambda_", GeneratorContext.safeName("lambda"));
		assertEquals("None_", GeneratorContext.safeName("None"));
		assertEquals("none", GeneratorContext.safeName("none"));
		assertEquals("print", GeneratorContext.safeName("print"));

		GeneratorContext context = new GeneratorContext(new TranslatorSettings());
		assertEquals("class_", context.declare("class"));
		assertEquals("class_", context.pythonName("class"));
	}
}
