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

import com.tomaszrup.gofumpt.ast.BlockStmt;
import com.tomaszrup.gofumpt.ast.CommentGroup;
import com.tomaszrup.gofumpt.ast.Expr;
import com.tomaszrup.gofumpt.ast.Field;
import com.tomaszrup.gofumpt.ast.FieldList;
import com.tomaszrup.gofumpt.ast.ForStmt;
import com.tomaszrup.gofumpt.ast.FuncDecl;
import com.tomaszrup.gofumpt.ast.FuncLit;
import com.tomaszrup.gofumpt.ast.FuncType;
import com.tomaszrup.gofumpt.ast.IfStmt;
import com.tomaszrup.gofumpt.ast.Node;
import com.tomaszrup.gofumpt.ast.Positions;
import com.tomaszrup.gofumpt.layout.CommentIndex;
import com.tomaszrup.gofumpt.layout.LengthEstimator;
import com.tomaszrup.gofumpt.layout.LineTable;

/**
 * Removes empty lines at the edges of blocks.
 *
 * <p>An empty block is closed on the line it opens. A function body, or a
 * short block with a single statement, loses the empty lines after its
 * opening and before its closing brace. The empty line after the opening
 * brace stays when it follows a multi-line condition or signature.
 */
public class BlockCollapser {
	private static final Logger logger = LoggerFactory.getLogger(BlockCollapser.class);

	private final LineTable lines;
	private final CommentIndex comments;
	private final LengthEstimator estimator;

	public BlockCollapser(LineTable lines, CommentIndex comments, LengthEstimator estimator) {
		this.lines = lines;
		this.comments = comments;
		this.estimator = estimator;
	}

	/**
	 * @param block  the block being visited
	 * @param parent the node owning the block, or null
	 */
	public void apply(BlockStmt block, Node parent) {
		List<CommentGroup> inner = comments.commentsBetween(block.getLbrace(), block.getRbrace());
		if (block.getList().isEmpty() && inner.isEmpty()) {
			lines.removeLines(lines.lineOf(block.getLbrace()), lines.lineOf(block.getRbrace()));
			return;
		}

		FuncType sign = null;
		Expr cond = null;
		if (parent instanceof FuncDecl) {
			sign = ((FuncDecl) parent).getType();
		} else if (parent instanceof FuncLit) {
			sign = ((FuncLit) parent).getType();
		} else if (parent instanceof IfStmt) {
			cond = ((IfStmt) parent).getCond();
		} else if (parent instanceof ForStmt) {
			cond = ((ForStmt) parent).getCond();
		}

		if (sign == null) {
			// only single statement blocks, and only when they are short
			if (block.getList().size() > 1 || !estimator.fitsShortLine(block)) {
				return;
			}
		}

		int bodyPos = Positions.NO_POS;
		int bodyEnd = Positions.NO_POS;
		if (!block.getList().isEmpty()) {
			bodyPos = block.getList().get(0).pos();
			bodyEnd = block.getList().get(block.getList().size() - 1).end();
		}
		if (!inner.isEmpty()) {
			int first = inner.get(0).pos();
			if (!Positions.valid(bodyPos) || first < bodyPos) {
				bodyPos = first;
			}
			int last = inner.get(inner.size() - 1).end();
			if (!Positions.valid(bodyEnd) || last > bodyEnd) {
				bodyEnd = last;
			}
		}

		lines.removeLinesBetween(bodyEnd, block.getRbrace());

		if (cond != null && lines.lineOf(cond.pos()) != lines.lineOf(cond.end())) {
			// multi-line condition, the empty line helps readability
			return;
		}
		if (sign != null && endsWithLastParameter(sign)) {
			return;
		}

		logger.debug("Trimming empty lines inside block at offset {}", block.getLbrace());
		lines.removeLinesBetween(block.getLbrace(), bodyPos);
	}

	// multi-line signature whose last result (or parameter) sits on its last line
	private boolean endsWithLastParameter(FuncType sign) {
		Field last = lastField(sign.getResults());
		if (last == null) {
			last = lastField(sign.getParams());
		}
		if (last == null) {
			return false;
		}
		int endLine = lines.lineOf(sign.end());
		return lines.lineOf(sign.pos()) != endLine && lines.lineOf(last.pos()) == endLine;
	}

	private static Field lastField(FieldList fields) {
		if (fields == null || fields.getList().isEmpty()) {
			return null;
		}
		return fields.getList().get(fields.getList().size() - 1);
	}
}
