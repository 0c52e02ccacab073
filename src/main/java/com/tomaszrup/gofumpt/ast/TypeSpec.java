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
 * {@code Name T}, or the alias form {@code Name = T} when {@code assign} is
 * valid.
 */
public class TypeSpec extends Spec {
	private CommentGroup doc;
	private Ident name;
	private final int assign;
	private Expr type;
	private CommentGroup comment;

	public TypeSpec(Ident name, int assign, Expr type) {
		this.name = name;
		this.assign = assign;
		this.type = type;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.TYPE_SPEC;
	}

	@Override
	public int pos() {
		return name.pos();
	}

	@Override
	public int end() {
		return type.end();
	}

	public CommentGroup getDoc() {
		return doc;
	}

	public void setDoc(CommentGroup doc) {
		this.doc = doc;
	}

	public Ident getName() {
		return name;
	}

	public void setName(Ident name) {
		this.name = name;
	}

	public boolean isAlias() {
		return Positions.valid(assign);
	}

	public Expr getType() {
		return type;
	}

	public void setType(Expr type) {
		this.type = type;
	}

	public CommentGroup getComment() {
		return comment;
	}

	public void setComment(CommentGroup comment) {
		this.comment = comment;
	}
}
