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
package com.tomaszrup.gofumpt.layout;

import java.io.IOException;
import java.util.function.IntSupplier;

import com.tomaszrup.gofumpt.ast.Comment;
import com.tomaszrup.gofumpt.ast.Node;
import com.tomaszrup.gofumpt.printer.NodePrinter;

/**
 * Approximates how wide a node will be once printed.
 *
 * <p>The node is rendered on its own, so the printer cannot tell how deeply
 * it will be indented. Instead, every enclosing block adds
 * {@link LayoutLimits#getIndentWidth()} bytes to lengths and
 * {@link LayoutLimits#getTabbedColumnWidth()} to columns. An inline comment
 * after the node counts towards its length.
 */
public class LengthEstimator {
	private final NodePrinter printer;
	private final LineTable lines;
	private final CommentIndex comments;
	private final LayoutLimits limits;
	private final IntSupplier depth;

	public LengthEstimator(NodePrinter printer, LineTable lines, CommentIndex comments, LayoutLimits limits,
			IntSupplier depth) {
		this.printer = printer;
		this.lines = lines;
		this.comments = comments;
		this.limits = limits;
		this.depth = depth;
	}

	public LayoutLimits limits() {
		return limits;
	}

	public int estimate(Node node) {
		ByteCounter counter = new ByteCounter();
		try {
			printer.print(node, counter);
		} catch (IOException e) {
			throw new LayoutInvariantException("unexpected print error for " + node.kind(), e);
		}
		int count = counter.count;

		Comment inline = comments.inlineCommentAfter(node.end());
		if (inline != null) {
			count += 1 + ByteCounter.utf8Length(inline.getText());
		}
		return count + depth.getAsInt() * limits.getIndentWidth();
	}

	/**
	 * Estimated printed column of {@code pos}.
	 */
	public int column(int pos) {
		return lines.columnOf(pos) + depth.getAsInt() * limits.getTabbedColumnWidth();
	}

	public boolean fitsShortLine(Node node) {
		return estimate(node) <= limits.getShortLineLimit();
	}

	private static final class ByteCounter implements Appendable {
		private int count;

		@Override
		public Appendable append(CharSequence csq) {
			count += utf8Length(csq);
			return this;
		}

		@Override
		public Appendable append(CharSequence csq, int start, int end) {
			count += utf8Length(csq.subSequence(start, end));
			return this;
		}

		@Override
		public Appendable append(char c) {
			count += utf8Length(String.valueOf(c));
			return this;
		}

		static int utf8Length(CharSequence text) {
			int length = 0;
			for (int i = 0; i < text.length(); i++) {
				char c = text.charAt(i);
				if (c < 0x80) {
					length++;
				} else if (c < 0x800) {
					length += 2;
				} else if (Character.isHighSurrogate(c)) {
					length += 4;
					i++;
				} else {
					length += 3;
				}
			}
			return length;
		}
	}
}
