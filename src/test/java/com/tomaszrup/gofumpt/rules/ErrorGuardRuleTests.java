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
import com.tomaszrup.gofumpt.ast.AssignStmt;
import com.tomaszrup.gofumpt.ast.BinaryExpr;
import com.tomaszrup.gofumpt.ast.BlockStmt;
import com.tomaszrup.gofumpt.ast.CallExpr;
import com.tomaszrup.gofumpt.ast.Expr;
import com.tomaszrup.gofumpt.ast.IfStmt;
import com.tomaszrup.gofumpt.ast.ReturnStmt;
import com.tomaszrup.gofumpt.ast.Stmt;
import com.tomaszrup.gofumpt.layout.LineTable;

class ErrorGuardRuleTests {

	/** {@code <lhs...> <tok> g()} */
	private static AssignStmt assign(SourceFixture f, AssignStmt.Token tok, String... lhs) {
		List<Expr> names = new ArrayList<Expr>(f.idents(lhs));
		int tokPos = f.next(tok.text());
		CallExpr call = new CallExpr(f.ident("g"), f.next("("), Collections.<Expr>emptyList(), f.next(")"));
		return new AssignStmt(names, tokPos, tok, Collections.<Expr>singletonList(call));
	}

	/** {@code if err <op> nil { return }} */
	private static IfStmt guard(SourceFixture f, String op) {
		int ifPos = f.next("if");
		BinaryExpr cond = new BinaryExpr(f.ident("err"), f.next(op), op, f.ident("nil"));
		return new IfStmt(ifPos, null, cond, body(f), null);
	}

	private static BlockStmt body(SourceFixture f) {
		int lbrace = f.next("{");
		ReturnStmt ret = new ReturnStmt(f.next("return"), Collections.<Expr>emptyList());
		return new BlockStmt(lbrace, Collections.<Stmt>singletonList(ret), f.next("}"));
	}

	private static LineTable apply(SourceFixture f, Stmt... stmts) {
		LineTable lines = f.lineTable();
		new ErrorGuardRule(lines).apply(Arrays.asList(stmts));
		return lines;
	}

	@Test
	void testBlankLineBeforeErrorCheckIsRemoved() {
		SourceFixture f = SourceFixture.lines(
				"	x, err := g()",
				"",
				"",
				"	if err != nil {",
				"		return",
				"	}");
		AssignStmt assign = assign(f, AssignStmt.Token.DEFINE, "x", "err");
		IfStmt check = guard(f, "!=");
		LineTable lines = apply(f, assign, check);

		Assertions.assertEquals(lines.lineOf(assign.pos()) + 1, lines.lineOf(check.pos()));
		Assertions.assertEquals(4, lines.lineCount());
	}

	@Test
	void testPlainAssignmentIsNotGlued() {
		SourceFixture f = SourceFixture.lines(
				"	x, err = g()",
				"",
				"	if err != nil {",
				"		return",
				"	}");
		AssignStmt assign = assign(f, AssignStmt.Token.ASSIGN, "x", "err");
		IfStmt check = guard(f, "!=");
		LineTable lines = apply(f, assign, check);

		Assertions.assertEquals(3, lines.lineOf(check.pos()));
	}

	@Test
	void testErrMustBeLastName() {
		SourceFixture f = SourceFixture.lines(
				"	err, x := g()",
				"",
				"	if err != nil {",
				"		return",
				"	}");
		AssignStmt assign = assign(f, AssignStmt.Token.DEFINE, "err", "x");
		IfStmt check = guard(f, "!=");
		LineTable lines = apply(f, assign, check);

		Assertions.assertEquals(3, lines.lineOf(check.pos()));
	}

	@Test
	void testOnlyInequalityGuardsAreGlued() {
		SourceFixture f = SourceFixture.lines(
				"	x, err := g()",
				"",
				"	if err == nil {",
				"		return",
				"	}");
		AssignStmt assign = assign(f, AssignStmt.Token.DEFINE, "x", "err");
		IfStmt check = guard(f, "==");
		LineTable lines = apply(f, assign, check);

		Assertions.assertEquals(3, lines.lineOf(check.pos()));
	}

	@Test
	void testGuardWithElseIsNotGlued() {
		SourceFixture f = SourceFixture.lines(
				"	x, err := g()",
				"",
				"	if err != nil {",
				"		return",
				"	} else {",
				"		return",
				"	}");
		AssignStmt assign = assign(f, AssignStmt.Token.DEFINE, "x", "err");
		IfStmt check = guard(f, "!=");
		f.next("else");
		check.setElse(body(f));
		LineTable lines = apply(f, assign, check);

		Assertions.assertEquals(3, lines.lineOf(check.pos()));
	}

	@Test
	void testOnlyAdjacentStatementsArePaired() {
		SourceFixture f = SourceFixture.lines(
				"	x, err := g()",
				"	y := g()",
				"",
				"	if err != nil {",
				"		return",
				"	}");
		AssignStmt first = assign(f, AssignStmt.Token.DEFINE, "x", "err");
		AssignStmt second = assign(f, AssignStmt.Token.DEFINE, "y");
		IfStmt check = guard(f, "!=");
		LineTable lines = apply(f, first, second, check);

		Assertions.assertEquals(4, lines.lineOf(check.pos()));
	}
}
