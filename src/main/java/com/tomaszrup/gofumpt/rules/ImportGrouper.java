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

import com.tomaszrup.gofumpt.ast.CommentGroup;
import com.tomaszrup.gofumpt.ast.GenDecl;
import com.tomaszrup.gofumpt.ast.ImportSpec;
import com.tomaszrup.gofumpt.ast.Positions;
import com.tomaszrup.gofumpt.ast.SourceFile;
import com.tomaszrup.gofumpt.ast.Spec;
import com.tomaszrup.gofumpt.layout.CommentIndex;
import com.tomaszrup.gofumpt.layout.LineTable;

/**
 * Moves standard library imports to the top of a grouped import
 * declaration, separated from all other imports by one empty line.
 */
public class ImportGrouper {
	private static final Logger logger = LoggerFactory.getLogger(ImportGrouper.class);

	private final SourceFile file;
	private final LineTable lines;
	private final CommentIndex comments;
	private final ImportSorter sorter;

	public ImportGrouper(SourceFile file, LineTable lines, CommentIndex comments, ImportSorter sorter) {
		this.file = file;
		this.lines = lines;
		this.comments = comments;
		this.sorter = sorter;
	}

	public void apply(GenDecl decl) {
		if (decl.getTok() != GenDecl.Token.IMPORT || !Positions.valid(decl.getLparen())
				|| DeclarationJoiner.isCgoImport(decl)) {
			return;
		}
		List<Spec> std = new ArrayList<>();
		List<Spec> other = new ArrayList<>();
		boolean firstGroup = true;
		boolean needsSort = false;
		int lastEnd = decl.pos();
		for (int i = 0; i < decl.getSpecs().size(); i++) {
			ImportSpec spec = (ImportSpec) decl.getSpecs().get(i);
			List<CommentGroup> between = comments.commentsBetween(lastEnd, spec.pos());
			if (!between.isEmpty()) {
				lastEnd = between.get(between.size() - 1).end();
			}
			if (i > 0 && firstGroup && lines.lineOf(spec.pos()) > lines.lineOf(lastEnd) + 1) {
				firstGroup = false;
			} else {
				lastEnd = spec.end();
			}

			if (isOther(spec, firstGroup)) {
				other.add(spec);
				continue;
			}
			if (!firstGroup || !other.isEmpty()) {
				// moving up; collapse its positions so comments are not dragged along
				spec.relocate(decl.pos());
				needsSort = true;
			}
			std.add(spec);
		}

		if (!std.isEmpty() && !other.isEmpty()
				&& lines.lineOf(std.get(std.size() - 1).end()) + 1 >= lines.lineOf(other.get(0).pos())) {
			// two breaks, a single one is not enough when the groups were adjacent
			int otherPos = other.get(0).pos();
			logger.debug("Separating standard library imports from others at offset {}", otherPos);
			lines.insertBreak(otherPos - 1);
			lines.insertBreak(otherPos);
		}

		decl.getSpecs().clear();
		decl.getSpecs().addAll(std);
		decl.getSpecs().addAll(other);

		if (needsSort) {
			sorter.sort(file);
		}
	}

	/**
	 * Whether an import belongs after the standard library group. Paths with
	 * a dot are third party; {@code test/}, {@code example/} and
	 * {@code internal/} are reserved and never standard. Outside the first
	 * group a named or commented import also counts as other.
	 */
	static boolean isOther(ImportSpec spec, boolean firstGroup) {
		String path = spec.pathValue();
		if (path.contains(".")) {
			return true;
		}
		if (path.startsWith("test/") || path.startsWith("example/") || path.startsWith("internal/")) {
			return true;
		}
		return !firstGroup && (spec.getName() != null || spec.getComment() != null);
	}
}
