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
 * Root of a parsed Go source file. Every comment of the file, including doc
 * and trailing comments referenced by nodes, is listed in {@link #getComments()}
 * in source order.
 */
public class SourceFile extends Node {
	private final int packagePos;
	private Ident name;
	private final List<Decl> decls;
	private final List<CommentGroup> comments;

	public SourceFile(int packagePos, Ident name, List<? extends Decl> decls, List<CommentGroup> comments) {
		this.packagePos = packagePos;
		this.name = name;
		this.decls = new ArrayList<>(decls);
		this.comments = new ArrayList<>(comments);
	}

	@Override
	public NodeKind kind() {
		return NodeKind.SOURCE_FILE;
	}

	@Override
	public int pos() {
		return packagePos;
	}

	@Override
	public int end() {
		if (!decls.isEmpty()) {
			return decls.get(decls.size() - 1).end();
		}
		return name.end();
	}

	public Ident getName() {
		return name;
	}

	public void setName(Ident name) {
		this.name = name;
	}

	public List<Decl> getDecls() {
		return decls;
	}

	public List<CommentGroup> getComments() {
		return comments;
	}
}
