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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.gofumpt.ast.Field;
import com.tomaszrup.gofumpt.ast.FieldList;
import com.tomaszrup.gofumpt.ast.Node;
import com.tomaszrup.gofumpt.ast.NodeEquivalence;
import com.tomaszrup.gofumpt.ast.Positions;
import com.tomaszrup.gofumpt.layout.CommentIndex;
import com.tomaszrup.gofumpt.layout.LineTable;

public class FieldListRules {
	private static final Logger logger = LoggerFactory.getLogger(FieldListRules.class);

	private final LineTable lines;
	private final CommentIndex comments;
	private final boolean extraRules;

	public FieldListRules(LineTable lines, CommentIndex comments, boolean extraRules) {
		this.lines = lines;
		this.comments = comments;
		this.extraRules = extraRules;
	}

	public void apply(FieldList fields, Node parent) {
		collapseEmpty(fields);
		if (!extraRules || parent == null) {
			return;
		}
		switch (parent.kind()) {
			case FUNC_DECL:
			case FUNC_TYPE:
			case INTERFACE_TYPE:
				mergeAdjacentFields(fields.getList());
				break;
			default:
				// struct fields are never merged
				break;
		}
	}

	/**
	 * {@code ()} and {@code struct{}} belong on one line, unless the opening
	 * line ends in a comment.
	 */
	void collapseEmpty(FieldList fields) {
		if (fields.numFields() != 0 || !Positions.valid(fields.getOpening())) {
			return;
		}
		if (comments.inlineCommentAfter(fields.pos()) != null) {
			return;
		}
		lines.removeLines(lines.lineOf(fields.pos()), lines.lineOf(fields.end()));
	}

	/**
	 * Turns {@code a int, b int} into {@code a, b int} when both fields are
	 * named, start on the same line and have equal types.
	 */
	void mergeAdjacentFields(List<Field> fields) {
		int i = 0;
		while (i + 1 < fields.size()) {
			Field first = fields.get(i);
			Field second = fields.get(i + 1);
			if (shouldMerge(first, second)) {
				logger.debug("Merging field {} into field at offset {}", second.getNames(), first.pos());
				first.getNames().addAll(second.getNames());
				fields.remove(i + 1);
			} else {
				i++;
			}
		}
	}

	private boolean shouldMerge(Field first, Field second) {
		if (first.getNames().isEmpty() || second.getNames().isEmpty()) {
			return false;
		}
		if (lines.lineOf(first.pos()) != lines.lineOf(second.pos())) {
			// separate lines were chosen on purpose
			return false;
		}
		return NodeEquivalence.equivalent(first.getType(), second.getType());
	}
}
