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
 * Base class of every node of a parsed ASDL specification. The root node of
 * a tree is always a {@link Module}.
 * <p>
 * Nodes are immutable. Their {@link #toString()} is a canonical rendering
 * which two trees parsed from the same text always share.
 * <p>
 * Do not confuse these nodes, which describe an ASDL file, with the tree
 * types that the ASDL file itself describes.
 */
public abstract class AsdlNode {

	/**
	 * Calls the handler of {@code visitor} that matches the concrete type of
	 * this node.
	 *
	 * @param <A> type of the argument passed along the traversal
	 * @param visitor the visitor to dispatch to
	 * @param arg argument handed to the handler, may be {@code null}
	 */
	public abstract <A> void accept(AsdlVisitor<A> visitor, A arg);
}
