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
package com.tomaszrup.gofumpt.rules;

import java.util.function.DoubleSupplier;
import java.util.function.IntSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.gofumpt.ast.CallExpr;
import com.tomaszrup.gofumpt.ast.CompositeLit;
import com.tomaszrup.gofumpt.ast.Cursor;
import com.tomaszrup.gofumpt.ast.Node;
import com.tomaszrup.gofumpt.ast.NodeKind;
import com.tomaszrup.gofumpt.ast.Positions;
import com.tomaszrup.gofumpt.ast.UnaryExpr;
import com.tomaszrup.gofumpt.layout.LayoutInvariantException;
import com.tomaszrup.gofumpt.layout.LayoutLimits;
import com.tomaszrup.gofumpt.layout.LengthEstimator;
import com.tomaszrup.gofumpt.layout.LineTable;

/**
 * Experimental: breaks a long line before a list element or binary operand
 * when both resulting lines would still be reasonably long.
 */
public class LongLineSplitter {
	private static final Logger logger = LoggerFactory.getLogger(LongLineSplitter.class);

	private final LineTable lines;
	private final LengthEstimator estimator;
	private final DoubleSupplier minSplitFactor;
	private final IntSupplier depth;

	public LongLineSplitter(LineTable lines, LengthEstimator estimator, DoubleSupplier minSplitFactor,
			IntSupplier depth) {
		this.lines = lines;
		this.estimator = estimator;
		this.minSplitFactor = minSplitFactor;
		this.depth = depth;
	}

	public void apply(Cursor cursor) {
		Node node = cursor.node();
		if (!Positions.valid(node.pos()) || !Positions.valid(node.end())) {
			return;
		}
		int startLine = lines.lineOf(node.pos());
		if (startLine != lines.lineOf(node.end())) {
			return;
		}
		// binary expression chains count as lists too
		Node parent = cursor.parent();
		boolean inList = cursor.index() >= 0 || (parent != null && parent.kind() == NodeKind.BINARY_EXPR);
		if (!inList) {
			return;
		}

		LayoutLimits limits = estimator.limits();
		int startColumn = lines.columnOf(node.pos());
		int startCol = estimator.column(node.pos());
		int endCol = estimator.column(node.end());

		int newlinePos = node.pos();
		CompositeLit composite = asComposite(node);
		if (composite != null && !composite.getElts().isEmpty()) {
			// break before the first element; the closing brace gets one too
			newlinePos = composite.getElts().get(0).pos();
		}

		if (node instanceof CallExpr && !((CallExpr) node).getArgs().isEmpty()) {
			// prefer breaking before the whole call over an opening paren at the end of a line
			int firstArgColumn = lines.columnOf(((CallExpr) node).getArgs().get(0).pos());
			startCol += (firstArgColumn - startColumn) / 2;
		}

		if (startCol <= limits.getShortLineLimit()) {
			return;
		}

		int lineEndColumn = lines.columnOf(lines.lineEnd(startLine));

		// lengths of the two halves, without indentation
		int firstLength = startColumn - depth.getAsInt();
		if (firstLength < 0) {
			throw new LayoutInvariantException("negative length before offset " + node.pos());
		}
		int secondLength = lineEndColumn - startColumn;
		if (secondLength < 0) {
			throw new LayoutInvariantException("negative length after offset " + node.pos());
		}

		int minSplitLength = limits.minSplitLength(minSplitFactor.getAsDouble());
		if (endCol > limits.getLongLineLimit()
				&& firstLength >= minSplitLength && secondLength >= minSplitLength) {
			logger.debug("Splitting long line {} at offset {}", startLine, newlinePos);
			lines.insertBreak(newlinePos);
		}
	}

	// T{...} or &T{...}
	static CompositeLit asComposite(Node node) {
		if (node instanceof CompositeLit) {
			return (CompositeLit) node;
		}
		if (node instanceof UnaryExpr) {
			return asComposite(((UnaryExpr) node).getX());
		}
		return null;
	}
}
