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
package com.tomaszrup.gofumpt.layout;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.gofumpt.ast.Comment;
import com.tomaszrup.gofumpt.layout.CommentClassifier.Shape;

class CommentClassifierTests {

	private static Shape classify(String text) {
		return CommentClassifier.classify(new Comment(0, text));
	}

	@Test
	void testBlockComment() {
		Assertions.assertEquals(Shape.BLOCK, classify("/* block */"));
		Assertions.assertEquals(Shape.BLOCK, classify("/*no space*/"));
	}

	@Test
	void testDirectives() {
		Assertions.assertEquals(Shape.DIRECTIVE, classify("//go:generate stringer -type=Kind"));
		Assertions.assertEquals(Shape.DIRECTIVE, classify("//go:noinline"));
		Assertions.assertEquals(Shape.DIRECTIVE, classify("//lint:ignore SA1000 reason"));
		Assertions.assertEquals(Shape.DIRECTIVE, classify("//go-sumtype:decl Node"));
		Assertions.assertEquals(Shape.DIRECTIVE, classify("//line foo.go:10"));
		Assertions.assertEquals(Shape.DIRECTIVE, classify("//export Callback"));
		Assertions.assertEquals(Shape.DIRECTIVE, classify("//extern puts"));
		Assertions.assertEquals(Shape.DIRECTIVE, classify("//sys\tread(fd int) (n int, err error)"));
		Assertions.assertEquals(Shape.DIRECTIVE, classify("//sysnb\tgetpid() (pid int)"));
		Assertions.assertEquals(Shape.DIRECTIVE, classify("//nolint"));
		Assertions.assertEquals(Shape.DIRECTIVE, classify("//nolint:errcheck"));
	}

	@Test
	void testUrlIsNotADirective() {
		Assertions.assertEquals(Shape.PROSE, classify("//https://example.com"));
	}

	@Test
	void testWordsStartingLikeDirectivesAreProse() {
		Assertions.assertEquals(Shape.PROSE, classify("//linear scan"));
		Assertions.assertEquals(Shape.PROSE, classify("//exports everything"));
		Assertions.assertEquals(Shape.PROSE, classify("//system call"));
	}

	@Test
	void testCodeLike() {
		Assertions.assertEquals(Shape.CODE_LIKE, classify("//{"));
		Assertions.assertEquals(Shape.CODE_LIKE, classify("//}"));
		Assertions.assertEquals(Shape.CODE_LIKE, classify("//-"));
		Assertions.assertEquals(Shape.CODE_LIKE, classify("//"));
	}

	@Test
	void testProse() {
		Assertions.assertEquals(Shape.PROSE, classify("//Foo does things"));
		Assertions.assertEquals(Shape.PROSE, classify("// Foo does things"));
		Assertions.assertEquals(Shape.PROSE, classify("//\tindented"));
		Assertions.assertEquals(Shape.PROSE, classify("//2 items"));
		Assertions.assertEquals(Shape.PROSE, classify("//über"));
	}

	@Test
	void testStartsWithSpace() {
		Assertions.assertTrue(CommentClassifier.startsWithSpace(" x"));
		Assertions.assertTrue(CommentClassifier.startsWithSpace("\tx"));
		Assertions.assertFalse(CommentClassifier.startsWithSpace("x"));
		Assertions.assertFalse(CommentClassifier.startsWithSpace(""));
	}
}
