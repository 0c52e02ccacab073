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

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.gofumpt.ast.AssignStmt;
import com.tomaszrup.gofumpt.ast.Cursor;
import com.tomaszrup.gofumpt.ast.DeclStmt;
import com.tomaszrup.gofumpt.ast.Expr;
import com.tomaszrup.gofumpt.ast.GenDecl;
import com.tomaszrup.gofumpt.ast.Ident;
import com.tomaszrup.gofumpt.ast.Positions;
import com.tomaszrup.gofumpt.ast.Spec;
import com.tomaszrup.gofumpt.ast.ValueSpec;
import com.tomaszrup.gofumpt.layout.CommentIndex;
import com.tomaszrup.gofumpt.layout.LineTable;

/**
 * Simplifications of {@code var} declarations.
 */
public class VarDeclRewriter {
	private static final Logger logger = LoggerFactory.getLogger(VarDeclRewriter.class);

	private final LineTable lines;
	private final CommentIndex comments;

	public VarDeclRewriter(LineTable lines, CommentIndex comments) {
		this.lines = lines;
		this.comments = comments;
	}

	/**
	 * Replaces {@code var name = value} inside a function with
	 * {@code name := value}, or {@code _ = value} when every name is blank.
	 * Typed declarations and declarations with several specs stay. A grouped
	 * declaration loses its parentheses first, since the replaced node is
	 * not visited again.
	 */
	public void toAssignment(Cursor cursor) {
		GenDecl decl = ((DeclStmt) cursor.node()).getDecl();
		if (decl.getTok() != GenDecl.Token.VAR || decl.getSpecs().size() != 1) {
			return;
		}
		ValueSpec spec = (ValueSpec) decl.getSpecs().get(0);
		if (spec.getType() != null || spec.getValues().isEmpty()) {
			return;
		}
		AssignStmt.Token tok = AssignStmt.Token.ASSIGN;
		List<Expr> names = new ArrayList<>(spec.getNames().size());
		for (Ident name : spec.getNames()) {
			names.add(name);
			if (!name.isBlank()) {
				tok = AssignStmt.Token.DEFINE;
			}
		}
		dropRedundantParens(decl);
		logger.debug("Rewriting var declaration at offset {} as an assignment", decl.pos());
		cursor.replace(new AssignStmt(names, Positions.NO_POS, tok, spec.getValues()));
	}

	/**
	 * Drops the parentheses of a {@code var} group holding a single spec.
	 * Groups with a doc comment keep them.
	 */
	public void dropRedundantParens(GenDecl decl) {
		if (decl.getTok() != GenDecl.Token.VAR || decl.getSpecs().size() != 1
				|| !Positions.valid(decl.getLparen()) || decl.getDoc() != null) {
			return;
		}
		Spec spec = decl.getSpecs().get(0);
		int specPos = spec.pos();
		int specEnd = spec.end();

		if (!comments.commentsBetween(decl.getTokPos(), specPos).isEmpty()) {
			// the spec's comment now has to lead the whole declaration
			decl.setTokPos(specPos);
		} else {
			lines.removeLines(lines.lineOf(decl.getTokPos()), lines.lineOf(specPos));
		}
		lines.removeLines(lines.lineOf(specEnd), lines.lineOf(decl.getRparen()));

		logger.debug("Dropping parentheses of single var spec at offset {}", specPos);
		decl.setLparen(Positions.NO_POS);
		decl.setRparen(Positions.NO_POS);
	}
}
