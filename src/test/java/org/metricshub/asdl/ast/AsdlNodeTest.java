package org.metricshub.asdl.ast;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;

public class AsdlNodeTest {

	@Test
	public void testFieldRendering() {
		assertEquals("Field(int)", new Field("int", null).toString());
		assertEquals("Field(int, a)", new Field("int", "a").toString());
		assertEquals("Field(int, a, seq=True)", new Field("int", "a", true, false).toString());
		assertEquals("Field(int, a, opt=True)", new Field("int", "a", false, true).toString());
		assertEquals("Field(expr, seq=True)", new Field("expr", null, true, false).toString());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testFieldCannotBeSequenceAndOptional() {
		new Field("int", "a", true, true);
	}

	@Test
	public void testProductRendering() {
		Product alias = new Product(
				Arrays.asList(new Field("identifier", "name"), new Field("identifier", "asname", false, true)));
		assertEquals("Product([Field(identifier, name), Field(identifier, asname, opt=True)])", alias.toString());

		Product withAttributes = new Product(
				Collections.singletonList(new Field("int", "a")),
				Collections.singletonList(new Field("int", "lineno")));
		assertEquals("Product([Field(int, a)], [Field(int, lineno)])", withAttributes.toString());
	}

	@Test
	public void testSumRendering() {
		Sum sum = new Sum(Arrays.asList(new Constructor("Load"), new Constructor("Store", Collections.<Field>emptyList())));
		assertEquals("Sum([Constructor(Load, []), Constructor(Store, [])])", sum.toString());

		Sum withAttributes = new Sum(
				Collections.singletonList(new Constructor("Pass")),
				Collections.singletonList(new Field("int", "lineno")));
		assertEquals("Sum([Constructor(Pass, [])], [Field(int, lineno)])", withAttributes.toString());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testSumNeedsAConstructor() {
		new Sum(Collections.<Constructor>emptyList());
	}

	@Test
	public void testModuleRendering() {
		Module module = new Module(
				"M",
				Arrays.asList(
						new Type("x", new Sum(Collections.singletonList(new Constructor("A")))),
						new Type("p", new Product(Collections.singletonList(new Field("x", "v"))))));
		assertEquals(
				"Module(M, [Type(x, Sum([Constructor(A, [])])), Type(p, Product([Field(x, v)]))])",
				module.toString());
	}

	@Test
	public void testNodesAreImmutable() {
		List<Field> fields = new ArrayList<Field>();
		fields.add(new Field("int", "a"));
		Constructor cons = new Constructor("A", fields);
		fields.add(new Field("int", "b"));
		assertEquals(1, cons.getFields().size());
		assertThrows(UnsupportedOperationException.class, () -> cons.getFields().add(new Field("int", "c")));

		List<Type> dfns = new ArrayList<Type>();
		dfns.add(new Type("a", new Product(fields)));
		Module module = new Module("M", dfns);
		dfns.clear();
		assertEquals(1, module.getDfns().size());
		assertThrows(UnsupportedOperationException.class, () -> module.getDfns().clear());
		assertThrows(UnsupportedOperationException.class, () -> module.getTypes().remove("a"));
	}

	@Test
	public void testModuleTypesLastDefinitionWins() {
		Sum first = new Sum(Collections.singletonList(new Constructor("A")));
		Sum second = new Sum(Collections.singletonList(new Constructor("B")));
		Product other = new Product(Collections.singletonList(new Field("int", "i")));
		Module module = new Module("M", Arrays.asList(new Type("x", first), new Type("y", other), new Type("x", second)));

		assertEquals(3, module.getDfns().size());
		assertEquals(2, module.getTypes().size());
		assertSame(second, module.getTypes().get("x"));
		assertEquals(Arrays.asList("x", "y"), new ArrayList<String>(module.getTypes().keySet()));
	}
}
