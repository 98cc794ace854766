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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generic tree walker. {@link #visit(AsdlNode, Object)} dispatches to the
 * {@code visitXxx} handler matching the node's concrete type. Handlers
 * recurse by calling {@code visit} on the children they are interested in.
 * <p>
 * A handler failure is reported once, with the node whose handler threw,
 * and rethrown; the traversal stops there.
 *
 * @param <A> type of the argument passed along the traversal
 */
public abstract class VisitorBase<A> implements AsdlVisitor<A> {

	private static final Logger LOG = LoggerFactory.getLogger(VisitorBase.class);

	/** Last failure reported, so that enclosing frames do not report it again. */
	private RuntimeException reported;

	/**
	 * Visits {@code node} with the given argument.
	 *
	 * @param node node to visit
	 * @param arg argument handed to the handler, may be {@code null}
	 */
	public void visit(AsdlNode node, A arg) {
		try {
			node.accept(this, arg);
		} catch (RuntimeException e) {
			if (e != reported) {
				reported = e;
				reportError(node, e);
			}
			throw e;
		}
	}

	/**
	 * Visits {@code node} without an argument.
	 *
	 * @param node node to visit
	 */
	public void visit(AsdlNode node) {
		visit(node, null);
	}

	/**
	 * Called once per failure, before it propagates out of {@link #visit(AsdlNode, Object)}.
	 *
	 * @param node the node whose handler threw
	 * @param e the failure
	 */
	protected void reportError(AsdlNode node, RuntimeException e) {
		LOG.error("Error visiting {}: {}", node, e.getMessage());
	}
}
