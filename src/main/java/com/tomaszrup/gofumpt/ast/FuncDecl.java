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
 * Function or method declaration; {@code body} is null for external functions.
 */
public class FuncDecl extends Decl {
	private CommentGroup doc;
	private FieldList recv;
	private Ident name;
	private FuncType type;
	private BlockStmt body;

	public FuncDecl(FieldList recv, Ident name, FuncType type, BlockStmt body) {
		this.recv = recv;
		this.name = name;
		this.type = type;
		this.body = body;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.FUNC_DECL;
	}

	@Override
	public int pos() {
		return type.pos();
	}

	@Override
	public int end() {
		if (body != null) {
			return body.end();
		}
		return type.end();
	}

	public CommentGroup getDoc() {
		return doc;
	}

	public void setDoc(CommentGroup doc) {
		this.doc = doc;
	}

	public FieldList getRecv() {
		return recv;
	}

	public void setRecv(FieldList recv) {
		this.recv = recv;
	}

	public Ident getName() {
		return name;
	}

	public void setName(Ident name) {
		this.name = name;
	}

	public FuncType getType() {
		return type;
	}

	public void setType(FuncType type) {
		this.type = type;
	}

	public BlockStmt getBody() {
		return body;
	}

	public void setBody(BlockStmt body) {
		this.body = body;
	}
}
