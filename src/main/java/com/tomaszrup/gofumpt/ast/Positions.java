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

import java.util.Comparator;

/**
 * Helpers for source positions. A position is a 0-based byte offset into the
 * buffer the tree was parsed from; {@link #NO_POS} marks an absent one.
 */
public class Positions {
	private Positions() {
	}

	public static final int NO_POS = -1;

	public static final Comparator<Node> COMPARATOR = (Node n1, Node n2) -> {
		if (n1.pos() != n2.pos()) {
			return Integer.compare(n1.pos(), n2.pos());
		}
		return Integer.compare(n1.end(), n2.end());
	};

	public static boolean valid(int pos) {
		return pos >= 0;
	}

	/**
	 * Returns the first valid position of the two, or {@link #NO_POS}.
	 */
	public static int firstValid(int pos, int fallback) {
		return valid(pos) ? pos : fallback;
	}
}
