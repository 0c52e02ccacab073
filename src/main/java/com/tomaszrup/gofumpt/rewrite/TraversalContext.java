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
package com.tomaszrup.gofumpt.rewrite;

import com.tomaszrup.gofumpt.ast.FuncType;
import com.tomaszrup.gofumpt.layout.LayoutLimits;

/**
 * State carried down the tree during one rewrite: how many blocks enclose
 * the current node, the signature of the enclosing top-level function, and
 * the minimum split factor the long-line rule must respect there.
 */
public class TraversalContext {
	private int depth;
	private FuncType topFuncType;
	private double minSplitFactor = LayoutLimits.DEFAULT_SPLIT_FACTOR;

	public int getDepth() {
		return depth;
	}

	public void enterBlock() {
		depth++;
	}

	public void leaveBlock() {
		if (depth == 0) {
			throw new IllegalStateException("block depth underflow");
		}
		depth--;
	}

	public FuncType getTopFuncType() {
		return topFuncType;
	}

	public void setTopFuncType(FuncType topFuncType) {
		this.topFuncType = topFuncType;
	}

	public double getMinSplitFactor() {
		return minSplitFactor;
	}

	public void setMinSplitFactor(double minSplitFactor) {
		this.minSplitFactor = minSplitFactor;
	}

	public void resetMinSplitFactor() {
		this.minSplitFactor = LayoutLimits.DEFAULT_SPLIT_FACTOR;
	}
}
