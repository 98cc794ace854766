package org.metricshub.asdl.check;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.asdl.ast.Module;
import org.metricshub.asdl.frontend.AsdlParser;
import org.metricshub.asdl.util.BuiltinTypes;

public class AsdlCheckerTest {

	private ByteArrayOutputStream output;
	private AsdlChecker checker;

	@Before
	public void setUp() throws Exception {
		output = new ByteArrayOutputStream();
		checker = new AsdlChecker(new PrintStream(output, true, "UTF-8"), BuiltinTypes.DEFAULT);
	}

	private static Module parse(String spec) {
		return new AsdlParser().parse(spec);
	}

	private String printed() {
		return new String(output.toByteArray(), StandardCharsets.UTF_8);
	}

	@Test
	public void testValidModule() {
		Module module = parse(
				"module M { x = A(int a, y* ys) | B attributes (int lineno) y = (identifier name, string? doc, x parent) }");
		assertTrue(checker.check(module));
		assertEquals("", printed());
	}

	@Test
	public void testAllBuiltinsAreAccepted() {
		Module module = parse(
				"module M { p = (identifier a, string b, bytes c, int d, object e, singleton f, boolean g) }");
		CheckReport report = checker.checkReport(module);
		assertTrue(report.isValid());
		assertEquals(0, report.getErrorCount());
		assertTrue(report.getDiagnostics().isEmpty());
	}

	@Test
	public void testDuplicateConstructor() {
		Module module = parse("module M { x = A | B  y = C | A }");
		CheckReport report = checker.checkReport(module);
		assertFalse(report.isValid());
		assertEquals(1, report.getErrorCount());
		assertEquals(List.of("Redefinition of constructor A", "Defined in x and y"), report.getDiagnostics());
		assertTrue(printed().contains("Redefinition of constructor A"));
		assertTrue(printed().contains("Defined in x and y"));
	}

	@Test
	public void testDuplicateConstructorInSameSum() {
		assertFalse(checker.check(parse("module M { x = A | A }")));
		assertTrue(printed().contains("Defined in x and x"));
	}

	@Test
	public void testUndefinedType() {
		Module module = parse("module M { x = A(foo f) y = (foo g, bar h) }");
		CheckReport report = checker.checkReport(module);
		assertFalse(report.isValid());
		assertEquals(2, report.getErrorCount());
		assertEquals(
				List.of("Undefined type foo, used in x, y", "Undefined type bar, used in y"),
				report.getDiagnostics());
	}

	@Test
	public void testAttributesAreChecked() {
		CheckReport report = checker.checkReport(parse("module M { x = A attributes (location l) p = (int i) attributes (span s) }"));
		assertEquals(
				List.of("Undefined type location, used in x", "Undefined type span, used in p"),
				report.getDiagnostics());
	}

	@Test
	public void testErrorsAccumulate() {
		CheckReport report = checker.checkReport(parse("module M { x = A(nope n) y = A | B }"));
		assertEquals(2, report.getErrorCount());
		assertEquals("Redefinition of constructor A", report.getDiagnostics().get(0));
		assertEquals("Undefined type nope, used in x", report.getDiagnostics().get(2));
	}

	@Test
	public void testLegacyBuiltinsRejectBoolean() {
		Module module = parse("module M { p = (boolean flag) }");
		assertTrue(checker.check(module));

		AsdlChecker legacy = new AsdlChecker(new PrintStream(output), BuiltinTypes.LEGACY);
		assertFalse(legacy.check(module));
		assertTrue(printed().contains("Undefined type boolean, used in p"));
	}

	@Test
	public void testDuplicateTypeNamesAreNotErrors() {
		assertTrue(checker.check(parse("module M { x = A  x = B }")));
	}

	@Test
	public void testEachCheckStartsFresh() {
		Module module = parse("module M { x = A  y = A }");
		assertEquals(1, checker.checkReport(module).getErrorCount());
		assertEquals(1, checker.checkReport(module).getErrorCount());
	}

	@Test
	public void testSelfReferenceIsDefined() {
		assertTrue(checker.check(parse("module M { tree = Leaf(int v) | Node(tree left, tree right) }")));
	}
}
