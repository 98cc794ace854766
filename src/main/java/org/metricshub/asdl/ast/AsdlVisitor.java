package org.metricshub.asdl.ast;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jasdl
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
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
 * There is a method in this interface for each concrete type of
 * {@link AsdlNode}. Every method does nothing by default, so a visitor only
 * implements the node kinds it cares about; the others are skipped.
 *
 * @param <A> type of the argument passed along the traversal
 */
public interface AsdlVisitor<A> {

	default void visitModule(Module module, A arg) {}

	default void visitType(Type type, A arg) {}

	default void visitSum(Sum sum, A arg) {}

	default void visitProduct(Product product, A arg) {}

	default void visitConstructor(Constructor constructor, A arg) {}

	default void visitField(Field field, A arg) {}
}
