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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.gofumpt.rules;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.gofumpt.SourceFixture;
import com.tomaszrup.gofumpt.ast.BasicLit;
import com.tomaszrup.gofumpt.ast.Comment;
import com.tomaszrup.gofumpt.ast.CommentGroup;
import com.tomaszrup.gofumpt.ast.GenDecl;
import com.tomaszrup.gofumpt.ast.Ident;
import com.tomaszrup.gofumpt.ast.ImportSpec;
import com.tomaszrup.gofumpt.ast.Positions;
import com.tomaszrup.gofumpt.ast.SourceFile;
import com.tomaszrup.gofumpt.ast.Spec;
import com.tomaszrup.gofumpt.layout.CommentIndex;
import com.tomaszrup.gofumpt.layout.LineTable;

class ImportGrouperTests {

	/** A grouped import of {@code paths}, in source order. */
	static GenDecl imports(SourceFixture f, String... paths) {
		int tokPos = f.next("import");
		int lparen = f.next("(");
		List<ImportSpec> specs = new ArrayList<>();
		for (String path : paths) {
			specs.add(new ImportSpec(null, f.stringLit("\"" + path + "\"")));
		}
		return new GenDecl(tokPos, GenDecl.Token.IMPORT, lparen, specs, f.next(")"));
	}

	static List<String> paths(GenDecl decl) {
		List<String> paths = new ArrayList<>();
		for (Spec spec : decl.getSpecs()) {
			paths.add(((ImportSpec) spec).pathValue());
		}
		return paths;
	}

	private static LineTable group(SourceFixture f, GenDecl decl) {
		LineTable lines = f.lineTable();
		SourceFile file = new SourceFile(0, new Ident(8, "p"), Collections.singletonList(decl),
				Collections.<CommentGroup>emptyList());
		new ImportGrouper(file, lines, new CommentIndex(file.getComments(), lines), new ImportSorter(lines))
				.apply(decl);
		return lines;
	}

	private static int line(LineTable lines, GenDecl decl, int index) {
		return lines.lineOf(decl.getSpecs().get(index).pos());
	}

	@Test
	void testStandardLibraryMovesAboveThirdParty() {
		SourceFixture f = SourceFixture.lines(
				"package p",
				"",
				"import (",
				"	\"fmt\"",
				"	\"github.com/x/y\"",
				"	\"os\"",
				")");
		GenDecl decl = imports(f, "fmt", "github.com/x/y", "os");
		LineTable lines = group(f, decl);

		Assertions.assertEquals(Arrays.asList("fmt", "os", "github.com/x/y"), paths(decl));
		// the printer leaves one empty line for a gap of two lines
		int stdEnd = lines.lineOf(decl.getSpecs().get(1).end());
		Assertions.assertTrue(line(lines, decl, 2) - stdEnd >= 2);
	}

	@Test
	void testAdjacentGroupsAreSeparated() {
		SourceFixture f = SourceFixture.lines(
				"package p",
				"",
				"import (",
				"	\"fmt\"",
				"	\"github.com/x/y\"",
				")");
		GenDecl decl = imports(f, "fmt", "github.com/x/y");
		LineTable lines = group(f, decl);

		Assertions.assertEquals(Arrays.asList("fmt", "github.com/x/y"), paths(decl));
		Assertions.assertEquals(line(lines, decl, 0) + 2, line(lines, decl, 1));
	}

	@Test
	void testSeparatedGroupsAreUntouched() {
		SourceFixture f = SourceFixture.lines(
				"package p",
				"",
				"import (",
				"	\"fmt\"",
				"",
				"	\"github.com/x/y\"",
				")");
		GenDecl decl = imports(f, "fmt", "github.com/x/y");
		LineTable lines = group(f, decl);

		Assertions.assertEquals(7, lines.lineCount());
		Assertions.assertEquals(6, line(lines, decl, 1));
	}

	@Test
	void testStandardImportInLaterGroupMovesUp() {
		SourceFixture f = SourceFixture.lines(
				"package p",
				"",
				"import (",
				"	\"fmt\"",
				"",
				"	\"github.com/x/y\"",
				"	\"os\"",
				")");
		GenDecl decl = imports(f, "fmt", "github.com/x/y", "os");
		LineTable lines = group(f, decl);

		Assertions.assertEquals(Arrays.asList("fmt", "os", "github.com/x/y"), paths(decl));
		Assertions.assertTrue(line(lines, decl, 2) - lines.lineOf(decl.getSpecs().get(1).end()) >= 2);
	}

	@Test
	void testNamedImportInLaterGroupStays() {
		SourceFixture f = SourceFixture.lines(
				"package p",
				"",
				"import (",
				"	\"fmt\"",
				"",
				"	str \"strings\"",
				")");
		int tokPos = f.next("import");
		int lparen = f.next("(");
		ImportSpec fmt = new ImportSpec(null, f.stringLit("\"fmt\""));
		ImportSpec strings = new ImportSpec(f.ident("str"), f.stringLit("\"strings\""));
		GenDecl decl = new GenDecl(tokPos, GenDecl.Token.IMPORT, lparen, Arrays.asList(fmt, strings), f.next(")"));
		LineTable lines = group(f, decl);

		Assertions.assertEquals(Arrays.asList("fmt", "strings"), paths(decl));
		Assertions.assertEquals(7, lines.lineCount());
	}

	@Test
	void testSingleImportIsIgnored() {
		SourceFixture f = SourceFixture.lines("package p", "", "import \"github.com/x/y\"");
		int tokPos = f.next("import");
		ImportSpec spec = new ImportSpec(null, f.stringLit("\"github.com/x/y\""));
		GenDecl decl = new GenDecl(tokPos, GenDecl.Token.IMPORT, Positions.NO_POS, Collections.singletonList(spec),
				Positions.NO_POS);
		LineTable lines = group(f, decl);

		Assertions.assertEquals(3, lines.lineCount());
	}

	// ------------------------------------------------------------------
	// classification
	// ------------------------------------------------------------------

	private static ImportSpec spec(String path) {
		return new ImportSpec(null, new BasicLit(0, BasicLit.LitKind.STRING, "\"" + path + "\""));
	}

	@Test
	void testPathsWithDotsAreOther() {
		Assertions.assertTrue(ImportGrouper.isOther(spec("github.com/x/y"), true));
		Assertions.assertTrue(ImportGrouper.isOther(spec("golang.org/x/tools"), true));
		Assertions.assertFalse(ImportGrouper.isOther(spec("net/http"), true));
	}

	@Test
	void testReservedPrefixesAreOther() {
		Assertions.assertTrue(ImportGrouper.isOther(spec("test/foo"), true));
		Assertions.assertTrue(ImportGrouper.isOther(spec("example/foo"), true));
		Assertions.assertTrue(ImportGrouper.isOther(spec("internal/foo"), true));
		Assertions.assertFalse(ImportGrouper.isOther(spec("testing"), true));
	}

	@Test
	void testNamedOrCommentedImportsCountAsOtherOutsideFirstGroup() {
		ImportSpec named = new ImportSpec(new Ident(0, "str"), new BasicLit(4, BasicLit.LitKind.STRING, "\"strings\""));
		Assertions.assertFalse(ImportGrouper.isOther(named, true));
		Assertions.assertTrue(ImportGrouper.isOther(named, false));

		ImportSpec commented = spec("os");
		commented.setComment(new CommentGroup(Collections.singletonList(new Comment(10, "// files"))));
		Assertions.assertFalse(ImportGrouper.isOther(commented, true));
		Assertions.assertTrue(ImportGrouper.isOther(commented, false));
		Assertions.assertFalse(ImportGrouper.isOther(spec("os"), false));
	}
}
