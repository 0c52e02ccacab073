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

import com.tomaszrup.gofumpt.ast.CompositeLit;
import com.tomaszrup.gofumpt.ast.Expr;
import com.tomaszrup.gofumpt.layout.LineTable;

/**
 * Line breaks inside multi-line composite literals. Runs after the
 * literal's children were visited, so breaks added by other rules are
 * taken into account.
 */
public class CompositeLiteralLayout {
	private static final Logger logger = LoggerFactory.getLogger(CompositeLiteralLayout.class);

	private final LineTable lines;

	public CompositeLiteralLayout(LineTable lines) {
		this.lines = lines;
	}

	public void apply(CompositeLit lit) {
		List<Expr> elts = lit.getElts();
		if (elts.isEmpty()) {
			return;
		}
		int openLine = lines.lineOf(lit.getLbrace());
		int closeLine = lines.lineOf(lit.getRbrace());
		if (openLine == closeLine) {
			return;
		}

		boolean newlineAroundElems = false;
		boolean newlineBetweenElems = false;
		int lastLine = openLine;
		for (int i = 0; i < elts.size(); i++) {
			Expr elt = elts.get(i);
			int eltLine = lines.lineOf(elt.pos());
			if (eltLine > lastLine) {
				if (i == 0) {
					newlineAroundElems = true;
					// drop leading empty lines
					lines.removeLines(openLine + 1, eltLine);
				} else {
					newlineBetweenElems = true;
				}
			}
			lastLine = lines.lineOf(elt.end());
		}
		if (closeLine > lastLine) {
			newlineAroundElems = true;
		}

		if (newlineBetweenElems || newlineAroundElems) {
			Expr first = elts.get(0);
			if (openLine == lines.lineOf(first.pos())) {
				lines.insertBreak(lit.getLbrace() + 1);
				closeLine = lines.lineOf(lit.getRbrace());
			}
			Expr last = elts.get(elts.size() - 1);
			if (closeLine == lines.lineOf(last.end())) {
				lines.insertBreak(lit.getRbrace());
			}
		}

		if (!newlineBetweenElems) {
			return;
		}
		// one element per line once any two are on separate lines
		for (int i = 0; i + 1 < elts.size(); i++) {
			Expr current = elts.get(i);
			Expr next = elts.get(i + 1);
			if (!(current instanceof CompositeLit) && !(next instanceof CompositeLit)) {
				continue;
			}
			if (lines.lineOf(current.end()) == lines.lineOf(next.pos())) {
				logger.debug("Breaking composite literal elements at offset {}", current.end());
				lines.insertBreak(current.end());
			}
		}
	}
}
