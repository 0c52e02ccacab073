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
package com.tomaszrup.gofumpt.rewrite;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.gofumpt.FormatOptions;
import com.tomaszrup.gofumpt.SourceFixture;
import com.tomaszrup.gofumpt.ast.AssignStmt;
import com.tomaszrup.gofumpt.ast.BasicLit;
import com.tomaszrup.gofumpt.ast.BlockStmt;
import com.tomaszrup.gofumpt.ast.CallExpr;
import com.tomaszrup.gofumpt.ast.CommentGroup;
import com.tomaszrup.gofumpt.ast.DeclStmt;
import com.tomaszrup.gofumpt.ast.Expr;
import com.tomaszrup.gofumpt.ast.ExprStmt;
import com.tomaszrup.gofumpt.ast.Field;
import com.tomaszrup.gofumpt.ast.FieldList;
import com.tomaszrup.gofumpt.ast.FuncDecl;
import com.tomaszrup.gofumpt.ast.FuncType;
import com.tomaszrup.gofumpt.ast.GenDecl;
import com.tomaszrup.gofumpt.ast.Ident;
import com.tomaszrup.gofumpt.ast.IfStmt;
import com.tomaszrup.gofumpt.ast.Positions;
import com.tomaszrup.gofumpt.ast.SourceFile;
import com.tomaszrup.gofumpt.ast.Stmt;
import com.tomaszrup.gofumpt.ast.ValueSpec;
import com.tomaszrup.gofumpt.layout.LayoutLimits;
import com.tomaszrup.gofumpt.layout.LineTable;

class LayoutRewriterTests {

	/** {@code func f()} up to the body. */
	private static FuncType signature(SourceFixture f) {
		int funcPos = f.next("func");
		return new FuncType(funcPos, new FieldList(f.next("("), Collections.<Field>emptyList(), f.next(")")), null);
	}

	private static LayoutRewriter rewrite(SourceFile file, LineTable lines, FormatOptions options) {
		LayoutRewriter rewriter = new LayoutRewriter(file, lines, options);
		rewriter.rewrite();
		return rewriter;
	}

	// func f() {
	// 	if x {
	//
	// 		foo()
	// 	}
	// }
	private static final String[] NESTED_IF = {
			"package p", "", "func f() {", "	if x {", "", "		foo()", "	}", "}" };

	private static class NestedIf {
		final SourceFixture f = SourceFixture.lines(NESTED_IF);
		final ExprStmt foo;
		final SourceFile file;

		NestedIf() {
			f.next("package p");
			FuncType type = signature(f);
			Ident name = new Ident(type.pos() + 5, "f");
			int lbrace = f.next("{");
			int ifPos = f.next("if");
			Expr cond = f.ident("x");
			int ifLbrace = f.next("{");
			foo = new ExprStmt(new CallExpr(f.ident("foo"), f.next("("), Collections.<Expr>emptyList(), f.next(")")));
			BlockStmt ifBody = new BlockStmt(ifLbrace, Collections.<Stmt>singletonList(foo), f.next("}"));
			IfStmt ifStmt = new IfStmt(ifPos, null, cond, ifBody, null);
			BlockStmt body = new BlockStmt(lbrace, Collections.<Stmt>singletonList(ifStmt), f.next("}"));
			file = new SourceFile(0, new Ident(8, "p"),
					Collections.singletonList(new FuncDecl(null, name, type, body)),
					Collections.<CommentGroup>emptyList());
		}
	}

	@Test
	void testContextIsBalancedAfterRewrite() {
		NestedIf source = new NestedIf();
		LineTable lines = source.f.lineTable();
		LayoutRewriter rewriter = rewrite(source.file, lines, FormatOptions.builder().build());

		Assertions.assertEquals(0, rewriter.context().getDepth());
		Assertions.assertEquals(LayoutLimits.DEFAULT_SPLIT_FACTOR, rewriter.context().getMinSplitFactor());
	}

	@Test
	void testNestingCountsTowardsShortLineLength() {
		// "{ foo() }" is nine bytes, plus eight for the enclosing function body
		NestedIf fits = new NestedIf();
		LineTable fitsLines = fits.f.lineTable();
		rewrite(fits.file, fitsLines, FormatOptions.builder()
				.layoutLimits(LayoutLimits.DEFAULT.withShortLineLimit(17)).build());
		Assertions.assertEquals(5, fitsLines.lineOf(fits.foo.pos()));

		NestedIf tooLong = new NestedIf();
		LineTable tooLongLines = tooLong.f.lineTable();
		rewrite(tooLong.file, tooLongLines, FormatOptions.builder()
				.layoutLimits(LayoutLimits.DEFAULT.withShortLineLimit(16)).build());
		Assertions.assertEquals(6, tooLongLines.lineOf(tooLong.foo.pos()));
	}

	@Test
	void testLocalVarBecomesAssignmentAndItsLiteralIsRewritten() {
		SourceFixture f = SourceFixture.lines("package p", "", "func f() {", "	var mode = 0755", "	use(mode)", "}");
		f.next("package p");
		FuncType type = signature(f);
		int lbrace = f.next("{");
		int varPos = f.next("var");
		ValueSpec spec = new ValueSpec(f.idents("mode"), null, Collections.<Expr>singletonList(f.intLit("0755")));
		DeclStmt decl = new DeclStmt(new GenDecl(varPos, GenDecl.Token.VAR, Positions.NO_POS,
				Collections.singletonList(spec), Positions.NO_POS));
		ExprStmt use = new ExprStmt(new CallExpr(f.ident("use"), f.next("("),
				Collections.<Expr>singletonList(f.ident("mode")), f.next(")")));
		BlockStmt body = new BlockStmt(lbrace, Arrays.<Stmt>asList(decl, use), f.next("}"));
		SourceFile file = new SourceFile(0, new Ident(8, "p"),
				Collections.singletonList(new FuncDecl(null, new Ident(type.pos() + 5, "f"), type, body)),
				Collections.<CommentGroup>emptyList());
		rewrite(file, f.lineTable(), FormatOptions.builder().langVersion("v1.21").build());

		AssignStmt assign = (AssignStmt) body.getList().get(0);
		Assertions.assertEquals(AssignStmt.Token.DEFINE, assign.getTok());
		Assertions.assertEquals("0o755", ((BasicLit) assign.getRhs().get(0)).getValue());
	}

	// ------------------------------------------------------------------
	// long lines
	// ------------------------------------------------------------------

	private static final String P70 = "p".repeat(70);
	private static final String Q40 = "q".repeat(40);
	private static final String A70 = "a".repeat(70);
	private static final String B45 = "b".repeat(45);

	@Test
	void testTopLevelParametersNeedLongerHalves() {
		SourceFixture f = SourceFixture.lines(
				"package p",
				"",
				"func f(" + P70 + " int, " + Q40 + " int) {",
				"}",
				"",
				"var x = foo(" + A70 + ", " + B45 + ")");
		f.next("package p");
		int funcPos = f.next("func");
		Ident name = f.ident("f");
		int opening = f.next("(");
		List<Field> params = new ArrayList<>();
		params.add(new Field(f.idents(P70), f.ident("int")));
		params.add(new Field(f.idents(Q40), f.ident("int")));
		FuncType type = new FuncType(funcPos, new FieldList(opening, params, f.next(")")), null);
		BlockStmt body = new BlockStmt(f.next("{"), Collections.<Stmt>emptyList(), f.next("}"));
		FuncDecl func = new FuncDecl(null, name, type, body);

		int varPos = f.next("var");
		List<Ident> names = f.idents("x");
		Ident fun = f.ident("foo");
		int lparen = f.next("(");
		List<Expr> args = new ArrayList<>();
		args.add(f.ident(A70));
		args.add(f.ident(B45));
		CallExpr call = new CallExpr(fun, lparen, args, f.next(")"));
		GenDecl decl = new GenDecl(varPos, GenDecl.Token.VAR, Positions.NO_POS,
				Collections.singletonList(new ValueSpec(names, null, Collections.<Expr>singletonList(call))),
				Positions.NO_POS);

		SourceFile file = new SourceFile(0, new Ident(8, "p"), Arrays.asList(func, decl),
				Collections.<CommentGroup>emptyList());
		LineTable lines = f.lineTable();
		rewrite(file, lines, FormatOptions.builder().splitLongLines(true).build());

		// the parameter line would only have a 47 byte second half
		Assertions.assertEquals(lines.lineOf(params.get(0).pos()), lines.lineOf(params.get(1).pos()));
		// the same shape outside the signature is split
		Assertions.assertEquals(lines.lineOf(args.get(0).pos()) + 1, lines.lineOf(args.get(1).pos()));
	}

	@Test
	void testLongLinesStayWithoutTheOption() {
		SourceFixture f = SourceFixture.lines("package p", "", "var x = foo(" + A70 + ", " + B45 + ")");
		int varPos = f.next("var");
		List<Ident> names = f.idents("x");
		Ident fun = f.ident("foo");
		int lparen = f.next("(");
		List<Expr> args = new ArrayList<>();
		args.add(f.ident(A70));
		args.add(f.ident(B45));
		CallExpr call = new CallExpr(fun, lparen, args, f.next(")"));
		GenDecl decl = new GenDecl(varPos, GenDecl.Token.VAR, Positions.NO_POS,
				Collections.singletonList(new ValueSpec(names, null, Collections.<Expr>singletonList(call))),
				Positions.NO_POS);
		SourceFile file = new SourceFile(0, new Ident(8, "p"), Collections.singletonList(decl),
				Collections.<CommentGroup>emptyList());
		LineTable lines = f.lineTable();
		rewrite(file, lines, FormatOptions.builder().build());

		Assertions.assertEquals(3, lines.lineCount());
	}
}
