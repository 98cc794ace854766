package org.metricshub.asdl.ast;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.metricshub.asdl.frontend.AsdlParser;

public class VisitorBaseTest {

	private static final Module MODULE = new AsdlParser()
			.parse("module M { x = A(int a) | B(string* b) | C  p = (x* xs, int? n) }");

	/** Walks the whole tree, recording the constructor and field names it meets. */
	private static class Recorder extends VisitorBase<String> {

		private final List<String> seen = new ArrayList<String>();

		@Override
		public void visitModule(Module module, String arg) {
			for (Type dfn : module.getDfns()) {
				visit(dfn, dfn.getName());
			}
		}

		@Override
		public void visitType(Type type, String arg) {
			visit(type.getValue(), arg);
		}

		@Override
		public void visitSum(Sum sum, String arg) {
			for (Constructor c : sum.getTypes()) {
				visit(c, arg);
			}
		}

		@Override
		public void visitProduct(Product product, String arg) {
			for (Field f : product.getFields()) {
				visit(f, arg);
			}
		}

		@Override
		public void visitConstructor(Constructor constructor, String arg) {
			seen.add(arg + "." + constructor.getName());
			for (Field f : constructor.getFields()) {
				visit(f, arg + "." + constructor.getName());
			}
		}

		@Override
		public void visitField(Field field, String arg) {
			seen.add(arg + "." + field.getName());
		}
	}

	@Test
	public void testDispatchByNodeKind() {
		Recorder recorder = new Recorder();
		recorder.visit(MODULE);
		assertEquals(List.of("x.A", "x.A.a", "x.B", "x.B.b", "x.C", "p.xs", "p.n"), recorder.seen);
	}

	@Test
	public void testUnhandledKindsAreSkipped() {
		List<String> fields = new ArrayList<String>();
		VisitorBase<Void> fieldsOnly = new VisitorBase<Void>() {
			@Override
			public void visitField(Field field, Void arg) {
				fields.add(field.getName());
			}
		};

		// no visitModule handler, so nothing below the module is reached
		fieldsOnly.visit(MODULE);
		assertTrue(fields.isEmpty());

		fieldsOnly.visit(((Product) MODULE.getTypes().get("p")).getFields().get(0));
		assertEquals(List.of("xs"), fields);
	}

	@Test
	public void testHandlerErrorStopsTraversal() {
		Recorder failing = new Recorder() {
			@Override
			public void visitConstructor(Constructor constructor, String arg) {
				super.visitConstructor(constructor, arg);
				if (constructor.getName().equals("B")) {
					throw new IllegalStateException("boom");
				}
			}
		};

		IllegalStateException e = assertThrows(IllegalStateException.class, () -> failing.visit(MODULE));
		assertEquals("boom", e.getMessage());
		assertEquals(List.of("x.A", "x.A.a", "x.B", "x.B.b"), failing.seen);
	}

	@Test
	public void testHandlerErrorIsReportedOnce() {
		List<AsdlNode> reportedNodes = new ArrayList<AsdlNode>();
		Recorder failing = new Recorder() {
			@Override
			public void visitConstructor(Constructor constructor, String arg) {
				if (constructor.getName().equals("B")) {
					throw new IllegalStateException("boom");
				}
				super.visitConstructor(constructor, arg);
			}

			@Override
			protected void reportError(AsdlNode node, RuntimeException e) {
				reportedNodes.add(node);
			}
		};

		// Module, Type, Sum and Constructor frames are all on the stack when B fails
		assertThrows(IllegalStateException.class, () -> failing.visit(MODULE));
		assertEquals(1, reportedNodes.size());
		assertEquals("Constructor(B, [Field(string, b, seq=True)])", reportedNodes.get(0).toString());
	}
}
