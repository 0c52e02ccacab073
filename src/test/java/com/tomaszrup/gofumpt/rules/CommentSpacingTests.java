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

import com.tomaszrup.gofumpt.ast.Comment;
import com.tomaszrup.gofumpt.ast.CommentGroup;

class CommentSpacingTests {

	private static CommentGroup group(String... texts) {
		List<Comment> list = new ArrayList<>();
		int pos = 0;
		for (String text : texts) {
			list.add(new Comment(pos, text));
			pos += text.length() + 1;
		}
		return new CommentGroup(list);
	}

	private static List<String> texts(CommentGroup group) {
		List<String> texts = new ArrayList<>();
		for (Comment comment : group.getList()) {
			texts.add(comment.getText());
		}
		return texts;
	}

	private static CommentGroup spaced(String... texts) {
		CommentGroup group = group(texts);
		new CommentSpacing().apply(Collections.singletonList(group));
		return group;
	}

	@Test
	void testProseGetsSpaceAfterMarker() {
		Assertions.assertEquals(Arrays.asList("// foo", "// bar"), texts(spaced("//foo", "// bar")));
	}

	@Test
	void testCommentStartingWithDigitIsProse() {
		Assertions.assertEquals(Arrays.asList("// 42 reasons"), texts(spaced("//42 reasons")));
	}

	@Test
	void testTabAfterMarkerIsKept() {
		Assertions.assertEquals(Arrays.asList("//\tindented"), texts(spaced("//\tindented")));
	}

	@Test
	void testDirectiveKeepsWholeGroupUntouched() {
		Assertions.assertEquals(Arrays.asList("//go:generate stringer", "//foo"),
				texts(spaced("//go:generate stringer", "//foo")));
		Assertions.assertEquals(Arrays.asList("//nolint"), texts(spaced("//nolint")));
		Assertions.assertEquals(Arrays.asList("//export Foo"), texts(spaced("//export Foo")));
	}

	@Test
	void testCodeLikeKeepsWholeGroupUntouched() {
		Assertions.assertEquals(Arrays.asList("//foo()", "//}"), texts(spaced("//foo()", "//}")));
	}

	@Test
	void testEmptyLineCommentKeepsGroupUntouched() {
		Assertions.assertEquals(Arrays.asList("//foo", "//"), texts(spaced("//foo", "//")));
	}

	@Test
	void testBlockCommentIsUntouched() {
		Assertions.assertEquals(Arrays.asList("/*foo*/"), texts(spaced("/*foo*/")));
	}

	@Test
	void testUrlIsProse() {
		Assertions.assertEquals(Arrays.asList("// https://example.com"), texts(spaced("//https://example.com")));
	}

	@Test
	void testGroupsAreIndependent() {
		CommentGroup prose = group("//first");
		CommentGroup directive = group("//line foo.go:1");
		new CommentSpacing().apply(Arrays.asList(prose, directive));
		Assertions.assertEquals(Arrays.asList("// first"), texts(prose));
		Assertions.assertEquals(Arrays.asList("//line foo.go:1"), texts(directive));
	}
}
