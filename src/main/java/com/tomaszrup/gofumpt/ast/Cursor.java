////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.gofumpt.ast;

import java.util.function.Consumer;

/**
 * The node currently visited by a {@link NodeWalker}, with enough of its
 * surroundings to replace it in place.
 */
public final class Cursor {
	private final Node parent;
	private final int index;
	private final Consumer<Node> slot;
	private Node node;

	Cursor(Node parent, Node node, int index, Consumer<Node> slot) {
		this.parent = parent;
		this.node = node;
		this.index = index;
		this.slot = slot;
	}

	public Node node() {
		return node;
	}

	/**
	 * The enclosing node, or null for the root.
	 */
	public Node parent() {
		return parent;
	}

	/**
	 * Index of the node within its parent's child list, or -1 when the node
	 * is not a list element.
	 */
	public int index() {
		return index;
	}

	/**
	 * Puts {@code replacement} in the slot the current node occupies. The walk
	 * then continues into the replacement's children.
	 *
	 * @throws ClassCastException if the slot cannot hold the replacement
	 */
	public void replace(Node replacement) {
		slot.accept(replacement);
		node = replacement;
	}
}
