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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.gofumpt.SourceFixture;
import com.tomaszrup.gofumpt.ast.BlockStmt;
import com.tomaszrup.gofumpt.ast.CommentGroup;
import com.tomaszrup.gofumpt.ast.Decl;
import com.tomaszrup.gofumpt.ast.Expr;
import com.tomaszrup.gofumpt.ast.Field;
import com.tomaszrup.gofumpt.ast.FieldList;
import com.tomaszrup.gofumpt.ast.FuncDecl;
import com.tomaszrup.gofumpt.ast.FuncType;
import com.tomaszrup.gofumpt.ast.GenDecl;
import com.tomaszrup.gofumpt.ast.Ident;
import com.tomaszrup.gofumpt.ast.ImportSpec;
import com.tomaszrup.gofumpt.ast.Positions;
import com.tomaszrup.gofumpt.ast.SourceFile;
import com.tomaszrup.gofumpt.ast.Stmt;
import com.tomaszrup.gofumpt.ast.ValueSpec;
import com.tomaszrup.gofumpt.layout.CommentIndex;
import com.tomaszrup.gofumpt.layout.LineTable;

class DeclarationJoinerTests {

	/** {@code <keyword> <name> = <value>} without parentheses. */
	static GenDecl lone(SourceFixture f, GenDecl.Token tok, String name, String value) {
		int tokPos = f.next(tok.keyword());
		ValueSpec spec = new ValueSpec(Collections.singletonList(f.ident(name)), null,
				Collections.<Expr>singletonList(f.intLit(value)));
		return new GenDecl(tokPos, tok, Positions.NO_POS, Collections.singletonList(spec), Positions.NO_POS);
	}

	static GenDecl loneImport(SourceFixture f, String quotedPath) {
		int tokPos = f.next("import");
		ImportSpec spec = new ImportSpec(null, f.stringLit(quotedPath));
		return new GenDecl(tokPos, GenDecl.Token.IMPORT, Positions.NO_POS, Collections.singletonList(spec),
				Positions.NO_POS);
	}

	/** {@code func <name>() {...}} with an empty body. */
	static FuncDecl emptyFunc(SourceFixture f, String name) {
		int funcPos = f.next("func");
		Ident ident = f.ident(name);
		FuncType type = new FuncType(funcPos,
				new FieldList(f.next("("), Collections.<Field>emptyList(), f.next(")")), null);
		BlockStmt body = new BlockStmt(f.next("{"), Collections.<Stmt>emptyList(), f.next("}"));
		return new FuncDecl(null, ident, type, body);
	}

	static SourceFile file(SourceFixture f, List<CommentGroup> comments, Decl... decls) {
		return new SourceFile(0, new Ident(8, "p"), Arrays.asList(decls), comments);
	}

	private static void join(SourceFile file, LineTable lines) {
		new DeclarationJoiner(lines, new CommentIndex(file.getComments(), lines)).apply(file);
	}

	// ------------------------------------------------------------------
	// joining lone declarations
	// ------------------------------------------------------------------

	@Test
	void testAdjacentConstsAreJoined() {
		SourceFixture f = SourceFixture.lines("package p", "", "const a = 1", "const b = 2", "", "var c = 3");
		f.next("package p");
		GenDecl a = lone(f, GenDecl.Token.CONST, "a", "1");
		GenDecl b = lone(f, GenDecl.Token.CONST, "b", "2");
		GenDecl c = lone(f, GenDecl.Token.VAR, "c", "3");
		SourceFile file = file(f, Collections.<CommentGroup>emptyList(), a, b, c);
		join(file, f.lineTable());

		Assertions.assertEquals(Arrays.asList(a, c), file.getDecls());
		Assertions.assertEquals(2, a.getSpecs().size());
		Assertions.assertEquals(b.end(), a.getRparen());
	}

	@Test
	void testInlineCommentStaysInsideJoinedGroup() {
		SourceFixture f = SourceFixture.lines("package p", "", "var a = 1", "var b = 2 // two");
		f.next("package p");
		GenDecl a = lone(f, GenDecl.Token.VAR, "a", "1");
		GenDecl b = lone(f, GenDecl.Token.VAR, "b", "2");
		CommentGroup two = f.group("// two");
		SourceFile file = file(f, Collections.singletonList(two), a, b);
		join(file, f.lineTable());

		Assertions.assertEquals(1, file.getDecls().size());
		Assertions.assertEquals(two.end(), a.getRparen());
	}

	@Test
	void testRunOfThreeIsJoined() {
		SourceFixture f = SourceFixture.lines("package p", "", "var a = 1", "var b = 2", "var c = 3");
		f.next("package p");
		GenDecl a = lone(f, GenDecl.Token.VAR, "a", "1");
		GenDecl b = lone(f, GenDecl.Token.VAR, "b", "2");
		GenDecl c = lone(f, GenDecl.Token.VAR, "c", "3");
		SourceFile file = file(f, Collections.<CommentGroup>emptyList(), a, b, c);
		join(file, f.lineTable());

		Assertions.assertEquals(Collections.singletonList(a), file.getDecls());
		Assertions.assertEquals(3, a.getSpecs().size());
		Assertions.assertEquals(c.end(), a.getRparen());
	}

	@Test
	void testEmptyLineStopsJoining() {
		SourceFixture f = SourceFixture.lines("package p", "", "const a = 1", "", "const b = 2");
		f.next("package p");
		GenDecl a = lone(f, GenDecl.Token.CONST, "a", "1");
		GenDecl b = lone(f, GenDecl.Token.CONST, "b", "2");
		SourceFile file = file(f, Collections.<CommentGroup>emptyList(), a, b);
		join(file, f.lineTable());

		Assertions.assertEquals(Arrays.asList(a, b), file.getDecls());
		Assertions.assertEquals(1, a.getSpecs().size());
	}

	@Test
	void testDifferentKeywordsAreNotJoined() {
		SourceFixture f = SourceFixture.lines("package p", "", "const a = 1", "var b = 2");
		f.next("package p");
		GenDecl a = lone(f, GenDecl.Token.CONST, "a", "1");
		GenDecl b = lone(f, GenDecl.Token.VAR, "b", "2");
		SourceFile file = file(f, Collections.<CommentGroup>emptyList(), a, b);
		join(file, f.lineTable());

		Assertions.assertEquals(Arrays.asList(a, b), file.getDecls());
	}

	@Test
	void testDocumentedDeclarationDoesNotStartAGroup() {
		SourceFixture f = SourceFixture.lines("package p", "", "//go:embed x", "var a = 1", "var b = 2");
		f.next("package p");
		CommentGroup directive = f.group("//go:embed x");
		GenDecl a = lone(f, GenDecl.Token.VAR, "a", "1");
		a.setDoc(directive);
		GenDecl b = lone(f, GenDecl.Token.VAR, "b", "2");
		SourceFile file = file(f, Collections.singletonList(directive), a, b);
		join(file, f.lineTable());

		Assertions.assertEquals(Arrays.asList(a, b), file.getDecls());
	}

	@Test
	void testGroupedContinuationIsNotJoined() {
		SourceFixture f = SourceFixture.lines("package p", "", "var a = 1", "var (b = 2)");
		f.next("package p");
		GenDecl a = lone(f, GenDecl.Token.VAR, "a", "1");
		int tokPos = f.next("var");
		int lparen = f.next("(");
		ValueSpec spec = new ValueSpec(Collections.singletonList(f.ident("b")), null,
				Collections.<Expr>singletonList(f.intLit("2")));
		GenDecl b = new GenDecl(tokPos, GenDecl.Token.VAR, lparen, Collections.singletonList(spec), f.next(")"));
		SourceFile file = file(f, Collections.<CommentGroup>emptyList(), a, b);
		join(file, f.lineTable());

		Assertions.assertEquals(Arrays.asList(a, b), file.getDecls());
	}

	@Test
	void testCgoImportIsNeverJoined() {
		SourceFixture f = SourceFixture.lines("package p", "", "import \"C\"", "import \"fmt\"", "import \"os\"");
		f.next("package p");
		GenDecl cgo = loneImport(f, "\"C\"");
		GenDecl fmt = loneImport(f, "\"fmt\"");
		GenDecl os = loneImport(f, "\"os\"");
		SourceFile file = file(f, Collections.<CommentGroup>emptyList(), cgo, fmt, os);
		join(file, f.lineTable());

		Assertions.assertEquals(Arrays.asList(cgo, fmt), file.getDecls());
		Assertions.assertEquals(2, fmt.getSpecs().size());
		Assertions.assertTrue(DeclarationJoiner.isCgoImport(cgo));
		Assertions.assertFalse(DeclarationJoiner.isCgoImport(fmt));
	}

	// ------------------------------------------------------------------
	// blank lines between multi-line declarations
	// ------------------------------------------------------------------

	@Test
	void testAdjacentMultiLineDeclarationsAreSeparated() {
		SourceFixture f = SourceFixture.lines("package p", "", "func a() {", "}", "func b() {", "}");
		FuncDecl a = emptyFunc(f, "a");
		FuncDecl b = emptyFunc(f, "b");
		LineTable lines = f.lineTable();
		SourceFile file = file(f, Collections.<CommentGroup>emptyList(), a, b);
		join(file, lines);

		int closeA = lines.lineOf(a.getBody().getRbrace());
		Assertions.assertEquals(closeA + 2, lines.lineOf(b.pos()));
	}

	@Test
	void testLeadingCommentCountsAsPartOfDeclaration() {
		SourceFixture f = SourceFixture.lines("package p", "", "func a() {", "}", "// b does b", "func b() {", "}");
		FuncDecl a = emptyFunc(f, "a");
		CommentGroup doc = f.group("// b does b");
		FuncDecl b = emptyFunc(f, "b");
		b.setDoc(doc);
		LineTable lines = f.lineTable();
		SourceFile file = file(f, Collections.singletonList(doc), a, b);
		join(file, lines);

		Assertions.assertEquals(lines.lineOf(a.getBody().getRbrace()) + 2, lines.lineOf(doc.pos()));
	}

	@Test
	void testSingleLineNeighboursAreLeftAlone() {
		SourceFixture f = SourceFixture.lines("package p", "", "func a() {", "}", "var x = 1");
		FuncDecl a = emptyFunc(f, "a");
		GenDecl x = lone(f, GenDecl.Token.VAR, "x", "1");
		LineTable lines = f.lineTable();
		int before = lines.lineCount();
		join(file(f, Collections.<CommentGroup>emptyList(), a, x), lines);

		Assertions.assertEquals(before, lines.lineCount());
	}
}
