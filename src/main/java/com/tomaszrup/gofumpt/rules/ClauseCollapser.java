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

import java.util.Collections;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.gofumpt.ast.CaseClause;
import com.tomaszrup.gofumpt.ast.CommClause;
import com.tomaszrup.gofumpt.ast.Node;
import com.tomaszrup.gofumpt.layout.CommentIndex;
import com.tomaszrup.gofumpt.layout.LengthEstimator;
import com.tomaszrup.gofumpt.layout.LineTable;

/**
 * Joins a {@code case} header spread over several lines when it is short
 * and has no comments inside.
 */
public class ClauseCollapser {
	private static final Logger logger = LoggerFactory.getLogger(ClauseCollapser.class);

	private final LineTable lines;
	private final CommentIndex comments;
	private final LengthEstimator estimator;

	public ClauseCollapser(LineTable lines, CommentIndex comments, LengthEstimator estimator) {
		this.lines = lines;
		this.comments = comments;
		this.estimator = estimator;
	}

	public void apply(CaseClause clause) {
		// only the header counts, not the statements after the colon
		CaseClause header = new CaseClause(clause.getCasePos(), clause.getList(), clause.getColon(),
				Collections.emptyList());
		collapse(clause.getCasePos(), clause.getColon(), header);
	}

	public void apply(CommClause clause) {
		CommClause header = new CommClause(clause.getCasePos(), clause.getComm(), clause.getColon(),
				Collections.emptyList());
		collapse(clause.getCasePos(), clause.getColon(), header);
	}

	private void collapse(int casePos, int colon, Node header) {
		int openLine = lines.lineOf(casePos);
		int closeLine = lines.lineOf(colon);
		if (openLine == closeLine) {
			return;
		}
		if (!comments.commentsBetween(casePos, colon).isEmpty()) {
			return;
		}
		if (!estimator.fitsShortLine(header)) {
			return;
		}
		logger.debug("Joining case header at offset {}", casePos);
		lines.removeLines(openLine, closeLine);
	}
}
