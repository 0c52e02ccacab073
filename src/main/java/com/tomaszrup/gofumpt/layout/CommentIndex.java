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

import java.util.Collections;
import java.util.List;

import com.tomaszrup.gofumpt.ast.Comment;
import com.tomaszrup.gofumpt.ast.CommentGroup;

/**
 * Position lookups over the comment groups of one file. The groups are
 * sorted by position and are never re-parented; lines are resolved against
 * the current state of the {@link LineTable}.
 */
public class CommentIndex {
	private final List<CommentGroup> groups;
	private final LineTable lines;

	public CommentIndex(List<CommentGroup> groups, LineTable lines) {
		this.groups = groups;
		this.lines = lines;
	}

	public List<CommentGroup> groups() {
		return Collections.unmodifiableList(groups);
	}

	/**
	 * Comment groups starting at or after {@code p1} and before {@code p2}.
	 */
	public List<CommentGroup> commentsBetween(int p1, int p2) {
		int from = lowerBound(p1, 0);
		int to = lowerBound(p2, from);
		return Collections.unmodifiableList(groups.subList(from, to));
	}

	/**
	 * The comment trailing {@code pos} on the same line, if any: the first
	 * comment of the next group that starts on {@code pos}'s line.
	 */
	public Comment inlineCommentAfter(int pos) {
		int i = lowerBound(pos, 0);
		if (i >= groups.size()) {
			return null;
		}
		int line = lines.lineOf(pos);
		for (Comment comment : groups.get(i).getList()) {
			if (lines.lineOf(comment.pos()) == line) {
				return comment;
			}
		}
		return null;
	}

	// first index >= from whose group starts at or after pos
	private int lowerBound(int pos, int from) {
		int lo = from;
		int hi = groups.size();
		while (lo < hi) {
			int mid = (lo + hi) >>> 1;
			if (groups.get(mid).pos() >= pos) {
				hi = mid;
			} else {
				lo = mid + 1;
			}
		}
		return lo;
	}
}
