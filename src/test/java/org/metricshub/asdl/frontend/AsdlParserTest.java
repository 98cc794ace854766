package org.metricshub.asdl.frontend;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.metricshub.asdl.ast.Constructor;
import org.metricshub.asdl.ast.Field;
import org.metricshub.asdl.ast.Module;
import org.metricshub.asdl.ast.Product;
import org.metricshub.asdl.ast.Sum;
import org.metricshub.asdl.util.SpecSource;

public class AsdlParserTest {

	private static Module parse(String spec) {
		return new AsdlParser().parse(spec);
	}

	@Test
	public void testMinimalSum() {
		Module module = parse("module M { x = A | B }");
		assertEquals("M", module.getName());
		assertEquals(1, module.getDfns().size());
		assertEquals("x", module.getDfns().get(0).getName());
		Sum sum = (Sum) module.getDfns().get(0).getValue();
		assertEquals(2, sum.getTypes().size());
		assertEquals("A", sum.getTypes().get(0).getName());
		assertEquals("B", sum.getTypes().get(1).getName());
		assertTrue(sum.getAttributes().isEmpty());
		assertEquals("Module(M, [Type(x, Sum([Constructor(A, []), Constructor(B, [])]))])", module.toString());
	}

	@Test
	public void testProductWithAttributes() {
		Module module = parse("module M { p = (int a, string b) attributes (int line) }");
		Product product = (Product) module.getTypes().get("p");
		assertEquals(2, product.getFields().size());

		Field a = product.getFields().get(0);
		assertEquals("int", a.getType());
		assertEquals("a", a.getName());
		assertFalse(a.isSeq());
		assertFalse(a.isOpt());

		Field b = product.getFields().get(1);
		assertEquals("string", b.getType());
		assertEquals("b", b.getName());
		assertFalse(b.isSeq());
		assertFalse(b.isOpt());

		assertEquals(1, product.getAttributes().size());
		assertEquals("Field(int, line)", product.getAttributes().get(0).toString());
		assertEquals("Product([Field(int, a), Field(string, b)], [Field(int, line)])", product.toString());
	}

	@Test
	public void testOptionalAndSequenceFields() {
		Module module = parse("module M { e = Foo(int? a, int* b) }");
		Constructor foo = ((Sum) module.getTypes().get("e")).getTypes().get(0);
		assertEquals("Foo", foo.getName());

		Field a = foo.getFields().get(0);
		assertEquals("a", a.getName());
		assertTrue(a.isOpt());
		assertFalse(a.isSeq());

		Field b = foo.getFields().get(1);
		assertEquals("b", b.getName());
		assertTrue(b.isSeq());
		assertFalse(b.isOpt());

		assertEquals("Constructor(Foo, [Field(int, a, opt=True), Field(int, b, seq=True)])", foo.toString());
	}

	@Test
	public void testSumWithAttributes() {
		Module module = parse("module M { s = A | B(int x) attributes (int lineno, int col_offset) }");
		assertEquals(
				"Sum([Constructor(A, []), Constructor(B, [Field(int, x)])], "
						+ "[Field(int, lineno), Field(int, col_offset)])",
				module.getTypes().get("s").toString());
	}

	@Test
	public void testUnnamedFields() {
		Module module = parse("module M { t = T(int, string*, identifier? Name) }");
		assertEquals(
				"[Field(int), Field(string, seq=True), Field(identifier, Name, opt=True)]",
				((Sum) module.getTypes().get("t")).getTypes().get(0).getFields().toString());
	}

	@Test
	public void testEmptyModule() {
		Module module = parse("module python { }");
		assertEquals("python", module.getName());
		assertTrue(module.getDfns().isEmpty());
		assertEquals("Module(python, [])", module.toString());
	}

	@Test
	public void testForwardReferencesAreAccepted() {
		Module module = parse("module M { a = (b x) b = (int y) }");
		assertEquals(2, module.getDfns().size());
		assertEquals("b", ((Product) module.getTypes().get("a")).getFields().get(0).getType());
	}

	@Test
	public void testCommentsDoNotChangeTheTree() {
		String plain = "module M { x = A(int a, string* b) | B attributes (int l) y = (x v) }";
		String commented = "-- header\nmodule M -- c\n{ -- c\n x -- c\n = A(int -- c\n a, string* b) -- c\n"
				+ " | B attributes -- c\n (int l)\n y = (x v) -- c\n } -- trailing";
		assertEquals(parse(plain).toString(), parse(commented).toString());
	}

	@Test
	public void testRenderingIsStable() {
		String spec = "module M { x = A(int? a) | B attributes (int l) p = (x* xs) }";
		AsdlParser parser = new AsdlParser();
		String first = parser.parse(spec).toString();
		String second = parser.parse(spec).toString();
		assertEquals(first, second);
	}

	@Test
	public void testUnterminatedInput() {
		ParserException e = assertThrows(ParserException.class, () -> parse("module M { x = ("));
		assertEquals(1, e.getLineNumber());
		assertEquals("Expecting TYPE_ID. Found: EOF", e.getReason());

		e = assertThrows(ParserException.class, () -> parse("module M {\n x = (\n"));
		assertEquals(3, e.getLineNumber());
	}

	@Test
	public void testMissingModuleKeyword() {
		ParserException e = assertThrows(ParserException.class, () -> parse("modul M { }"));
		assertEquals("Expecting \"module\". Found: TYPE_ID (modul)", e.getReason());
		assertThrows(ParserException.class, () -> parse(""));
	}

	@Test
	public void testMissingModuleName() {
		ParserException e = assertThrows(ParserException.class, () -> parse("module { }"));
		assertEquals("Expecting CONSTRUCTOR_ID or TYPE_ID. Found: OPEN_BRACE ({)", e.getReason());
	}

	@Test
	public void testSumMustStartWithConstructor() {
		ParserException e = assertThrows(ParserException.class, () -> parse("module M {\n x = a }"));
		assertEquals(2, e.getLineNumber());
		assertEquals("Expecting CONSTRUCTOR_ID. Found: TYPE_ID (a)", e.getReason());
		assertEquals("Syntax error on line 2: Expecting CONSTRUCTOR_ID. Found: TYPE_ID (a)", e.getMessage());
	}

	@Test
	public void testFieldQuantifiersAreExclusive() {
		ParserException e = assertThrows(ParserException.class, () -> parse("module M { p = (int*? a) }"));
		assertEquals("Expecting CLOSE_PAREN. Found: QUESTION_MARK (?)", e.getReason());
	}

	@Test
	public void testFieldListSyntax() {
		assertThrows(ParserException.class, () -> parse("module M { x = A() }"));
		assertThrows(ParserException.class, () -> parse("module M { p = (int a int b) }"));
		assertThrows(ParserException.class, () -> parse("module M { p = (int a,) }"));
		assertThrows(ParserException.class, () -> parse("module M { p = (Int a) }"));
	}

	@Test
	public void testTrailingInputIsRejected() {
		ParserException e = assertThrows(ParserException.class, () -> parse("module M { }\nx"));
		assertEquals(2, e.getLineNumber());
		assertEquals("Expecting EOF. Found: TYPE_ID (x)", e.getReason());
	}

	@Test
	public void testLexerErrorsAbortParsing() {
		assertThrows(LexerException.class, () -> parse("module M { x = A - B }"));
	}

	@Test
	public void testUnknownLine() {
		AsdlSyntaxException e = new AsdlSyntaxException("no context");
		assertEquals(-1, e.getLineNumber());
		assertEquals("Syntax error on line <unknown>: no context", e.getMessage());
	}

	@Test
	public void testParseSource() throws Exception {
		Module module = new AsdlParser().parse(new SpecSource("test.asdl", "module T { t = (int i) }"));
		assertEquals("T", module.getName());

		ParserException e = assertThrows(
				ParserException.class,
				() -> new AsdlParser().parse(new SpecSource("broken.asdl", "module T { t = }")));
		assertEquals("broken.asdl", e.getSourceDescription());
	}

	@Test
	public void testEveryParsedFieldHasAtMostOneQuantifier() {
		Module module = parse("module M { x = A(int a, int* b, int? c) | B(x* d) p = (int? e, string f) attributes (int* g) }");
		for (Field field : allFields(module)) {
			assertFalse(field.toString(), field.isSeq() && field.isOpt());
		}
	}

	private static List<Field> allFields(Module module) {
		List<Field> fields = new ArrayList<Field>();
		module.getTypes().values().forEach(value -> {
			fields.addAll(value.getAttributes());
			if (value instanceof Product) {
				fields.addAll(((Product) value).getFields());
			} else {
				((Sum) value).getTypes().forEach(c -> fields.addAll(c.getFields()));
			}
		});
		return fields;
	}
}
