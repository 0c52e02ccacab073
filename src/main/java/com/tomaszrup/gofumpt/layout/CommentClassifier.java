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
package com.tomaszrup.gofumpt.layout;

import java.util.regex.Pattern;

import com.tomaszrup.gofumpt.ast.Comment;

/**
 * Sorts comments into the shapes the spacing rule cares about.
 */
public final class CommentClassifier {

	public enum Shape {
		/** {@code /*}-style comment. */
		BLOCK,
		/** Machine-read line comment such as {@code //go:generate} or {@code //nolint}. */
		DIRECTIVE,
		/** Line comment that reads like disabled code, e.g. {@code //}{@code {}. */
		CODE_LIKE,
		/** Any other line comment. */
		PROSE
	}

	public static final String LINE_COMMENT_MARKER = "//";

	/*
	 * Directives recognised right after the marker:
	 *   some-words:word  tool directives (go:noinline, lint:ignore, go-sumtype:decl)
	 *   line             line markers inserted by generators
	 *   export, extern   cgo exports and gccgo declarations
	 *   sys, sysnb       syscall wrapper prototypes
	 *   nolint           linter suppressions
	 * "some-words:" must be followed by a letter, so "https://site" is prose.
	 */
	private static final Pattern DIRECTIVE =
			Pattern.compile("^([a-z-]+:[a-z]+|line\\b|export\\b|extern\\b|sys(nb)?\\b|nolint\\b)");

	private CommentClassifier() {
	}

	public static Shape classify(Comment comment) {
		String text = comment.getText();
		if (!text.startsWith(LINE_COMMENT_MARKER)) {
			return Shape.BLOCK;
		}
		String body = body(text);
		if (DIRECTIVE.matcher(body).find()) {
			return Shape.DIRECTIVE;
		}
		if (body.isEmpty()) {
			return Shape.CODE_LIKE;
		}
		int first = body.codePointAt(0);
		if (!Character.isLetter(first) && !isNumber(first) && !isSpace(first)) {
			return Shape.CODE_LIKE;
		}
		return Shape.PROSE;
	}

	/**
	 * Text after the {@code //} marker.
	 */
	public static String body(String text) {
		return text.substring(LINE_COMMENT_MARKER.length());
	}

	public static boolean startsWithSpace(String body) {
		return !body.isEmpty() && isSpace(body.codePointAt(0));
	}

	private static boolean isNumber(int codePoint) {
		int type = Character.getType(codePoint);
		return type == Character.DECIMAL_DIGIT_NUMBER
				|| type == Character.LETTER_NUMBER
				|| type == Character.OTHER_NUMBER;
	}

	private static boolean isSpace(int codePoint) {
		return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint);
	}
}
