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

/**
 * The constants behind every join and split decision. Lengths and columns
 * are estimates, so these only have to be in the right ballpark; they are
 * kept together so tests and configuration can pin them.
 */
public final class LayoutLimits {

	/** Multi-line nodes estimated at most this many bytes may be joined. */
	public static final int DEFAULT_SHORT_LINE_LIMIT = 60;

	/** Single lines ending past this column may be split. */
	public static final int DEFAULT_LONG_LINE_LIMIT = 100;

	/** Assumed width of one indentation tab when estimating lengths. */
	public static final int DEFAULT_INDENT_WIDTH = 8;

	/** Extra columns per indentation level; a tab already counts as one column. */
	public static final int DEFAULT_TABBED_COLUMN_WIDTH = 7;

	public static final double DEFAULT_SPLIT_FACTOR = 0.4;

	/** Parameters of a top-level function need longer halves before a split. */
	public static final double PARAMS_SPLIT_FACTOR = 0.6;

	/** Unreachable on purpose: result lists are never split. */
	public static final double RESULTS_SPLIT_FACTOR = 1000;

	public static final LayoutLimits DEFAULT = new LayoutLimits(DEFAULT_SHORT_LINE_LIMIT, DEFAULT_LONG_LINE_LIMIT,
			DEFAULT_INDENT_WIDTH, DEFAULT_TABBED_COLUMN_WIDTH);

	private final int shortLineLimit;
	private final int longLineLimit;
	private final int indentWidth;
	private final int tabbedColumnWidth;

	public LayoutLimits(int shortLineLimit, int longLineLimit, int indentWidth, int tabbedColumnWidth) {
		if (shortLineLimit <= 0 || longLineLimit <= 0) {
			throw new IllegalArgumentException("line limits must be positive");
		}
		if (indentWidth < 0 || tabbedColumnWidth < 0) {
			throw new IllegalArgumentException("indentation widths must not be negative");
		}
		this.shortLineLimit = shortLineLimit;
		this.longLineLimit = longLineLimit;
		this.indentWidth = indentWidth;
		this.tabbedColumnWidth = tabbedColumnWidth;
	}

	public int getShortLineLimit() {
		return shortLineLimit;
	}

	public int getLongLineLimit() {
		return longLineLimit;
	}

	public int getIndentWidth() {
		return indentWidth;
	}

	public int getTabbedColumnWidth() {
		return tabbedColumnWidth;
	}

	public LayoutLimits withShortLineLimit(int limit) {
		return new LayoutLimits(limit, longLineLimit, indentWidth, tabbedColumnWidth);
	}

	public LayoutLimits withLongLineLimit(int limit) {
		return new LayoutLimits(shortLineLimit, limit, indentWidth, tabbedColumnWidth);
	}

	/**
	 * Minimum length both halves of a split line must reach.
	 */
	public int minSplitLength(double factor) {
		return (int) (factor * longLineLimit);
	}

	@Override
	public String toString() {
		return "LayoutLimits[short=" + shortLineLimit + ", long=" + longLineLimit
				+ ", indent=" + indentWidth + ", tabbedColumn=" + tabbedColumnWidth + "]";
	}
}
