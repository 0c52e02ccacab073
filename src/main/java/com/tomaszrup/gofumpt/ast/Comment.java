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
package com.tomaszrup.gofumpt.ast;

/**
 * A single {@code //} or {@code /*} comment. Comments are not tree nodes; they
 * live in {@link SourceFile#getComments()} and are found by position.
 */
public class Comment {
	private int slash;
	private String text;

	public Comment(int slash, String text) {
		this.slash = slash;
		this.text = text;
	}

	public int pos() {
		return slash;
	}

	public int end() {
		return slash + text.length();
	}

	/**
	 * Moves the comment so it starts at {@code slash}; used when the node it
	 * trails is moved.
	 */
	public void moveTo(int slash) {
		this.slash = slash;
	}

	public String getText() {
		return text;
	}

	public void setText(String text) {
		this.text = text;
	}

	@Override
	public String toString() {
		return text;
	}
}
