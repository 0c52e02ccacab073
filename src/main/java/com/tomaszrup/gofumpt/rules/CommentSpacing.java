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

import com.tomaszrup.gofumpt.ast.Comment;
import com.tomaszrup.gofumpt.ast.CommentGroup;
import com.tomaszrup.gofumpt.layout.CommentClassifier;
import com.tomaszrup.gofumpt.layout.CommentClassifier.Shape;

/**
 * Puts a space after {@code //} in prose comments. A group is left alone as
 * soon as one of its comments is a block comment, a directive or looks like
 * commented-out code.
 */
public class CommentSpacing {
	private static final Logger logger = LoggerFactory.getLogger(CommentSpacing.class);

	public void apply(List<CommentGroup> groups) {
		for (CommentGroup group : groups) {
			if (isProse(group)) {
				normalize(group);
			}
		}
	}

	private boolean isProse(CommentGroup group) {
		for (Comment comment : group.getList()) {
			if (CommentClassifier.classify(comment) != Shape.PROSE) {
				return false;
			}
		}
		return true;
	}

	private void normalize(CommentGroup group) {
		for (Comment comment : group.getList()) {
			String body = CommentClassifier.body(comment.getText());
			if (!CommentClassifier.startsWithSpace(body)) {
				comment.setText(CommentClassifier.LINE_COMMENT_MARKER + " " + body);
				logger.debug("Added space to comment at offset {}", comment.pos());
			}
		}
	}
}
