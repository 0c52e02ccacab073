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
 * A parameter, result, struct field or interface method. Embedded fields and
 * unnamed parameters have no names.
 */
public class Field extends Node {
	private CommentGroup doc;
	private final List<Ident> names;
	private Expr type;
	private BasicLit tag;
	private CommentGroup comment;

	public Field(List<Ident> names, Expr type) {
		this.names = new ArrayList<>(names);
		this.type = type;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.FIELD;
	}

	@Override
	public int pos() {
		if (!names.isEmpty()) {
			return names.get(0).pos();
		}
		return type.pos();
	}

	@Override
	public int end() {
		if (tag != null) {
			return tag.end();
		}
		return type.end();
	}

	public CommentGroup getDoc() {
		return doc;
	}

	public void setDoc(CommentGroup doc) {
		this.doc = doc;
	}

	public List<Ident> getNames() {
		return names;
	}

	public Expr getType() {
		return type;
	}

	public void setType(Expr type) {
		this.type = type;
	}

	public BasicLit getTag() {
		return tag;
	}

	public void setTag(BasicLit tag) {
		this.tag = tag;
	}

	public CommentGroup getComment() {
		return comment;
	}

	public void setComment(CommentGroup comment) {
		this.comment = comment;
	}
}
