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
import java.util.Comparator;
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
import com.tomaszrup.gofumpt.ast.Spec;
import com.tomaszrup.gofumpt.layout.LineTable;

/**
 * Sorts the specs of the leading import declarations the way gofmt does.
 *
 * <p>Each run of specs on consecutive lines is sorted on its own, by path,
 * then name, then trailing comment. Exact duplicates are dropped. The run's
 * original start and end positions are handed out again in order, so the
 * sorted specs occupy the same lines. A trailing comment follows its spec
 * to the new slot; doc comments above a spec keep their positions.
 */
public class ImportSorter {
	private static final Logger logger = LoggerFactory.getLogger(ImportSorter.class);

	private static final Comparator<ImportSpec> ORDER = Comparator
			.comparing(ImportSpec::pathValue)
			.thenComparing(ImportSorter::importName)
			.thenComparing(ImportSorter::importComment);

	private final LineTable lines;

	public ImportSorter(LineTable lines) {
		this.lines = lines;
	}

	public void sort(SourceFile file) {
		for (Decl decl : file.getDecls()) {
			if (!(decl instanceof GenDecl) || ((GenDecl) decl).getTok() != GenDecl.Token.IMPORT) {
				// imports always come first
				break;
			}
			GenDecl imports = (GenDecl) decl;
			if (!Positions.valid(imports.getLparen())) {
				continue;
			}
			sortDecl(imports);
		}
		// moved trailing comments may now be out of order
		file.getComments().sort(Comparator.comparingInt(CommentGroup::pos));
	}

	private void sortDecl(GenDecl decl) {
		List<Spec> specs = decl.getSpecs();
		List<Spec> sorted = new ArrayList<>(specs.size());
		int runStart = 0;
		for (int j = 1; j < specs.size(); j++) {
			if (lines.lineOf(specs.get(j).pos()) > 1 + lines.lineOf(specs.get(j - 1).end())) {
				sorted.addAll(sortRun(specs.subList(runStart, j)));
				runStart = j;
			}
		}
		sorted.addAll(sortRun(specs.subList(runStart, specs.size())));
		specs.clear();
		specs.addAll(sorted);

		// dropping duplicates can leave empty lines before the closing paren
		if (!specs.isEmpty() && Positions.valid(decl.getRparen())) {
			int lastLine = lines.lineOf(specs.get(specs.size() - 1).pos());
			int rparenLine = lines.lineOf(decl.getRparen());
			while (rparenLine > lastLine + 1) {
				rparenLine--;
				lines.mergeLines(rparenLine);
			}
		}
	}

	private List<ImportSpec> sortRun(List<Spec> run) {
		int[] starts = new int[run.size()];
		int[] ends = new int[run.size()];
		List<ImportSpec> specs = new ArrayList<>(run.size());
		for (int i = 0; i < run.size(); i++) {
			ImportSpec spec = (ImportSpec) run.get(i);
			starts[i] = spec.pos();
			ends[i] = spec.end();
			specs.add(spec);
		}

		specs.sort(ORDER);

		List<ImportSpec> deduped = new ArrayList<>(specs.size());
		for (int i = 0; i < specs.size(); i++) {
			ImportSpec spec = specs.get(i);
			if (i == specs.size() - 1 || !collapses(spec, specs.get(i + 1))) {
				deduped.add(spec);
			} else {
				logger.debug("Dropping duplicate import {}", spec.getPath().getValue());
				lines.mergeLines(lines.lineOf(spec.pos()));
			}
		}

		for (int i = 0; i < deduped.size(); i++) {
			ImportSpec spec = deduped.get(i);
			spec.moveTo(starts[i], ends[i]);
			if (spec.getComment() != null) {
				for (Comment comment : spec.getComment().getList()) {
					comment.moveTo(ends[i]);
				}
			}
		}
		return deduped;
	}

	private static boolean collapses(ImportSpec prev, ImportSpec next) {
		return prev.pathValue().equals(next.pathValue())
				&& importName(prev).equals(importName(next))
				&& prev.getComment() == null;
	}

	private static String importName(ImportSpec spec) {
		return spec.getName() != null ? spec.getName().getName() : "";
	}

	private static String importComment(ImportSpec spec) {
		CommentGroup group = spec.getComment();
		if (group == null) {
			return "";
		}
		StringBuilder sb = new StringBuilder();
		for (Comment comment : group.getList()) {
			sb.append(comment.getText());
		}
		return sb.toString();
	}
}
