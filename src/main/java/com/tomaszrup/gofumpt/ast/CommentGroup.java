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

import java.util.ArrayList;
import java.util.List;

/**
 * A run of comments with no tokens and no blank line in between.
 */
public class CommentGroup {
	private final List<Comment> list;

	public CommentGroup(List<Comment> list) {
		if (list == null || list.isEmpty()) {
			throw new IllegalArgumentException("comment group must not be empty");
		}
		this.list = new ArrayList<>(list);
	}

	public List<Comment> getList() {
		return list;
	}

	public int pos() {
		return list.get(0).pos();
	}

	public int end() {
		return list.get(list.size() - 1).end();
	}
}
