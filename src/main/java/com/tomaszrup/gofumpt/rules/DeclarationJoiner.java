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

import com.tomaszrup.gofumpt.ast.Comment;
import com.tomaszrup.gofumpt.ast.CommentGroup;
import com.tomaszrup.gofumpt.ast.Decl;
import com.tomaszrup.gofumpt.ast.GenDecl;
import com.tomaszrup.gofumpt.ast.ImportSpec;
import com.tomaszrup.gofumpt.ast.Positions;
import com.tomaszrup.gofumpt.ast.SourceFile;
import com.tomaszrup.gofumpt.layout.CommentIndex;
import com.tomaszrup.gofumpt.layout.LineTable;

/**
 * Top-level declaration layout: joins runs of lone {@code var}, {@code const},
 * {@code import} and {@code type} lines into one grouped declaration, then
 * separates multi-line declarations with a blank line.
 */
public class DeclarationJoiner {
	private static final Logger logger = LoggerFactory.getLogger(DeclarationJoiner.class);

	private final LineTable lines;
	private final CommentIndex comments;

	public DeclarationJoiner(LineTable lines, CommentIndex comments) {
		this.lines = lines;
		this.comments = comments;
	}

	public void apply(SourceFile file) {
		joinLoneDeclarations(file);
		separateMultiLineDeclarations(file);
	}

	/**
	 * Joins contiguous lone declarations of the same kind. A run stops at an
	 * empty line, a comment line, a grouped declaration or a cgo import.
	 */
	void joinLoneDeclarations(SourceFile file) {
		List<Decl> decls = file.getDecls();
		List<Decl> joined = new ArrayList<>(decls.size());
		int i = 0;
		while (i < decls.size()) {
			Decl decl = decls.get(i);
			joined.add(decl);
			i++;
			if (!(decl instanceof GenDecl)) {
				continue;
			}
			GenDecl start = (GenDecl) decl;
			if (isCgoImport(start) || start.getDoc() != null) {
				continue;
			}
			int lastPos = start.pos();
			while (i < decls.size() && canContinue(start, decls.get(i), lastPos)) {
				GenDecl cont = (GenDecl) decls.get(i);
				start.getSpecs().addAll(cont.getSpecs());
				Comment inline = comments.inlineCommentAfter(cont.end());
				if (inline != null) {
					// keep the trailing comment inside the group
					start.setRparen(inline.end());
				} else {
					// makes the joined group count as multi-line below
					start.setRparen(cont.end());
				}
				logger.debug("Joined {} declaration at offset {} into the one at {}",
						cont.getTok().keyword(), cont.pos(), start.pos());
				lastPos = cont.pos();
				i++;
			}
		}
		decls.clear();
		decls.addAll(joined);
	}

	private boolean canContinue(GenDecl start, Decl next, int lastPos) {
		if (!(next instanceof GenDecl)) {
			return false;
		}
		GenDecl cont = (GenDecl) next;
		return cont.getTok() == start.getTok()
				&& !Positions.valid(cont.getLparen())
				&& cont.getDoc() == null
				&& lines.lineOf(lastPos) >= lines.lineOf(cont.pos()) - 1
				&& !isCgoImport(cont);
	}

	/**
	 * Adds an empty line between two multi-line declarations that sit on
	 * adjacent lines. Comments leading a declaration count as part of it.
	 */
	void separateMultiLineDeclarations(SourceFile file) {
		boolean lastMulti = false;
		int lastEnd = Positions.NO_POS;
		for (Decl decl : file.getDecls()) {
			int pos = decl.pos();
			List<CommentGroup> leading = comments.commentsBetween(lastEnd, pos);
			if (!leading.isEmpty()) {
				pos = leading.get(0).pos();
			}

			boolean multi = lines.lineOf(pos) < lines.lineOf(decl.end());
			if (multi && lastMulti && lines.lineOf(lastEnd) + 1 == lines.lineOf(pos)) {
				logger.debug("Separating multi-line declarations at offset {}", lastEnd);
				lines.insertBreak(lastEnd);
			}

			lastMulti = multi;
			lastEnd = decl.end();
		}
	}

	/**
	 * True for the cgo pseudo-import {@code import "C"}, grouped or not.
	 */
	public static boolean isCgoImport(GenDecl decl) {
		if (decl.getTok() != GenDecl.Token.IMPORT || decl.getSpecs().size() != 1) {
			return false;
		}
		ImportSpec spec = (ImportSpec) decl.getSpecs().get(0);
		return "\"C\"".equals(spec.getPath().getValue());
	}
}
