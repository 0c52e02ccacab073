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
import com.tomaszrup.gofumpt.ast.CommentGroup;
import com.tomaszrup.gofumpt.ast.Field;
import com.tomaszrup.gofumpt.ast.FieldList;
import com.tomaszrup.gofumpt.ast.FuncType;
import com.tomaszrup.gofumpt.ast.Ident;
import com.tomaszrup.gofumpt.ast.StarExpr;
import com.tomaszrup.gofumpt.ast.StructType;
import com.tomaszrup.gofumpt.layout.CommentIndex;
import com.tomaszrup.gofumpt.layout.LineTable;

class FieldListRulesTests {

	private static FieldListRules rules(LineTable lines, boolean extra, List<CommentGroup> groups) {
		return new FieldListRules(lines, new CommentIndex(groups, lines), extra);
	}

	private static FieldListRules rules(LineTable lines, boolean extra) {
		return rules(lines, extra, Collections.<CommentGroup>emptyList());
	}

	private static Field field(SourceFixture f, String name, String type) {
		List<Ident> names = f.idents(name);
		return new Field(names, f.ident(type));
	}

	private static List<String> names(FieldList fields) {
		List<String> names = new ArrayList<>();
		for (Field field : fields.getList()) {
			StringBuilder sb = new StringBuilder();
			for (Ident name : field.getNames()) {
				sb.append(sb.length() == 0 ? "" : ",").append(name.getName());
			}
			names.add(sb.toString());
		}
		return names;
	}

	/** Parameters {@code (a int, b int, c string)} of {@code func f}. */
	private static FieldList threeParams(SourceFixture f) {
		f.next("func");
		f.next("f");
		int opening = f.next("(");
		List<Field> list = new ArrayList<>();
		list.add(field(f, "a", "int"));
		list.add(field(f, "b", "int"));
		list.add(field(f, "c", "string"));
		return new FieldList(opening, list, f.next(")"));
	}

	// ------------------------------------------------------------------
	// empty lists
	// ------------------------------------------------------------------

	@Test
	void testEmptyParametersAreCollapsed() {
		SourceFixture f = SourceFixture.lines("func f(", ") {}");
		f.next("func");
		FieldList params = new FieldList(f.next("("), Collections.<Field>emptyList(), f.next(")"));
		LineTable lines = f.lineTable();
		rules(lines, false).apply(params, new FuncType(0, params, null));

		Assertions.assertEquals(1, lines.lineCount());
	}

	@Test
	void testEmptyStructIsCollapsed() {
		SourceFixture f = SourceFixture.lines("type T struct {", "", "}");
		int structPos = f.next("struct");
		FieldList fields = new FieldList(f.next("{"), Collections.<Field>emptyList(), f.next("}"));
		LineTable lines = f.lineTable();
		rules(lines, false).apply(fields, new StructType(structPos, fields));

		Assertions.assertEquals(1, lines.lineCount());
	}

	@Test
	void testCommentAfterOpeningKeepsEmptyListOpen() {
		SourceFixture f = SourceFixture.lines("func f( // none", ") {}");
		f.next("func");
		int opening = f.next("(");
		CommentGroup none = f.group("// none");
		FieldList params = new FieldList(opening, Collections.<Field>emptyList(), f.next(")"));
		LineTable lines = f.lineTable();
		rules(lines, false, Collections.singletonList(none)).apply(params, new FuncType(0, params, null));

		Assertions.assertEquals(2, lines.lineCount());
	}

	// ------------------------------------------------------------------
	// merging adjacent fields
	// ------------------------------------------------------------------

	@Test
	void testAdjacentParametersWithSameTypeAreMerged() {
		SourceFixture f = SourceFixture.lines("func f(a int, b int, c string) {}");
		FieldList params = threeParams(f);
		rules(f.lineTable(), true).apply(params, new FuncType(0, params, null));

		Assertions.assertEquals(Arrays.asList("a,b", "c"), names(params));
	}

	@Test
	void testPointerTypesAreComparedStructurally() {
		SourceFixture f = SourceFixture.lines("func f(a *T, b *T) {}");
		f.next("func");
		int opening = f.next("(");
		List<Field> list = new ArrayList<>();
		List<Ident> a = f.idents("a");
		list.add(new Field(a, new StarExpr(f.next("*"), f.ident("T"))));
		List<Ident> b = f.idents("b");
		list.add(new Field(b, new StarExpr(f.next("*"), f.ident("T"))));
		FieldList params = new FieldList(opening, list, f.next(")"));
		rules(f.lineTable(), true).apply(params, new FuncType(0, params, null));

		Assertions.assertEquals(Collections.singletonList("a,b"), names(params));
	}

	@Test
	void testStructFieldsAreNeverMerged() {
		SourceFixture f = SourceFixture.lines("type T struct { a int; b int }");
		int structPos = f.next("struct");
		int lbrace = f.next("{");
		List<Field> list = new ArrayList<>();
		list.add(field(f, "a", "int"));
		list.add(field(f, "b", "int"));
		FieldList fields = new FieldList(lbrace, list, f.next("}"));
		rules(f.lineTable(), true).apply(fields, new StructType(structPos, fields));

		Assertions.assertEquals(Arrays.asList("a", "b"), names(fields));
	}

	@Test
	void testMergingNeedsExtraRules() {
		SourceFixture f = SourceFixture.lines("func f(a int, b int, c string) {}");
		FieldList params = threeParams(f);
		rules(f.lineTable(), false).apply(params, new FuncType(0, params, null));

		Assertions.assertEquals(Arrays.asList("a", "b", "c"), names(params));
	}

	@Test
	void testFieldsOnSeparateLinesStay() {
		SourceFixture f = SourceFixture.lines("func f(a int,", "	b int) {}");
		f.next("func");
		int opening = f.next("(");
		List<Field> list = new ArrayList<>();
		list.add(field(f, "a", "int"));
		list.add(field(f, "b", "int"));
		FieldList params = new FieldList(opening, list, f.next(")"));
		rules(f.lineTable(), true).apply(params, new FuncType(0, params, null));

		Assertions.assertEquals(Arrays.asList("a", "b"), names(params));
	}

	@Test
	void testUnnamedResultsStay() {
		SourceFixture f = SourceFixture.lines("func f() (int, int) {}");
		f.next(")");
		int opening = f.next("(");
		List<Field> list = new ArrayList<>();
		list.add(new Field(Collections.<Ident>emptyList(), f.ident("int")));
		list.add(new Field(Collections.<Ident>emptyList(), f.ident("int")));
		FieldList results = new FieldList(opening, list, f.next(")"));
		rules(f.lineTable(), true).apply(results, new FuncType(0, null, results));

		Assertions.assertEquals(2, results.getList().size());
	}
}
