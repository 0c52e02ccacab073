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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Mutable mapping between byte offsets and 1-based line numbers.
 *
 * <p>The table holds the offset at which every line starts. The first line
 * always starts at 0, offsets are strictly increasing and smaller than the
 * buffer size. Rules add and remove line breaks through this class only, and
 * every change is visible to the next lookup.
 */
public class LineTable {
	private final int size;
	private int[] lines;

	public LineTable(int size, int[] lineStarts) {
		if (size < 0) {
			throw new LayoutInvariantException("negative buffer size " + size);
		}
		checkLineStarts(size, lineStarts);
		this.size = size;
		this.lines = lineStarts.clone();
	}

	/**
	 * Builds the table of {@code source} as the parser would: a line starts
	 * at 0 and after every newline. Offsets count UTF-8 bytes.
	 */
	public static LineTable of(String source) {
		byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
		int[] starts = new int[16];
		int count = 0;
		starts[count++] = 0;
		for (int i = 0; i < bytes.length; i++) {
			if (bytes[i] == '\n' && i + 1 < bytes.length) {
				if (count == starts.length) {
					starts = Arrays.copyOf(starts, count * 2);
				}
				starts[count++] = i + 1;
			}
		}
		return new LineTable(bytes.length, Arrays.copyOf(starts, count));
	}

	private static void checkLineStarts(int size, int[] lineStarts) {
		if (lineStarts.length == 0 || lineStarts[0] != 0) {
			throw new LayoutInvariantException("first line must start at offset 0");
		}
		for (int i = 1; i < lineStarts.length; i++) {
			if (lineStarts[i] <= lineStarts[i - 1]) {
				throw new LayoutInvariantException("line starts must be strictly increasing: "
						+ Arrays.toString(lineStarts));
			}
			if (lineStarts[i] >= size) {
				throw new LayoutInvariantException("line start " + lineStarts[i] + " beyond buffer size " + size);
			}
		}
	}

	public int size() {
		return size;
	}

	public int lineCount() {
		return lines.length;
	}

	public int[] lineStarts() {
		return lines.clone();
	}

	/**
	 * Line containing {@code pos}; a newline byte belongs to the line it ends.
	 */
	public int lineOf(int pos) {
		checkPosition(pos);
		int i = Arrays.binarySearch(lines, pos);
		if (i >= 0) {
			return i + 1;
		}
		return -i - 1;
	}

	/**
	 * 1-based byte column of {@code pos} on its line.
	 */
	public int columnOf(int pos) {
		int line = lineOf(pos);
		return pos - lines[line - 1] + 1;
	}

	public int lineStart(int line) {
		checkLine(line);
		return lines[line - 1];
	}

	/**
	 * Offset of the newline ending {@code line}, or the buffer size for the
	 * last line.
	 */
	public int lineEnd(int line) {
		checkLine(line);
		if (line == lines.length) {
			return size;
		}
		return lines[line] - 1;
	}

	/**
	 * Starts a new line at {@code pos}. Breaks are never duplicated, so
	 * inserting an existing one does nothing.
	 */
	public void insertBreak(int pos) {
		if (pos < 0 || pos >= size) {
			throw new LayoutInvariantException("cannot insert a line break at " + pos
					+ " in a buffer of " + size + " bytes");
		}
		int i = Arrays.binarySearch(lines, pos);
		if (i >= 0) {
			return;
		}
		int at = -i - 1;
		int[] updated = new int[lines.length + 1];
		System.arraycopy(lines, 0, updated, 0, at);
		updated[at] = pos;
		System.arraycopy(lines, at, updated, at + 1, lines.length - at);
		lines = updated;
	}

	/**
	 * Joins {@code line} with the line after it. Every following line number
	 * shifts down by one.
	 */
	public void mergeLines(int line) {
		if (line < 1 || line >= lines.length) {
			throw new LayoutInvariantException("cannot merge line " + line + " of " + lines.length);
		}
		int[] updated = new int[lines.length - 1];
		System.arraycopy(lines, 0, updated, 0, line);
		System.arraycopy(lines, line + 1, updated, line, lines.length - line - 1);
		lines = updated;
	}

	/**
	 * Removes every break between {@code fromLine} and {@code toLine}, so
	 * both end up on the same line.
	 */
	public void removeLines(int fromLine, int toLine) {
		while (fromLine < toLine) {
			mergeLines(fromLine);
			toLine--;
		}
	}

	/**
	 * Like {@link #removeLines(int, int)}, but keeps exactly one break between
	 * the lines of the two positions.
	 */
	public void removeLinesBetween(int from, int to) {
		removeLines(lineOf(from) + 1, lineOf(to));
	}

	private void checkPosition(int pos) {
		if (pos < 0 || pos > size) {
			throw new LayoutInvariantException("position " + pos + " outside buffer of " + size + " bytes");
		}
	}

	private void checkLine(int line) {
		if (line < 1 || line > lines.length) {
			throw new LayoutInvariantException("illegal line number " + line);
		}
	}
}
