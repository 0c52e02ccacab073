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
 * {@code for init; cond; post {}}; any of the three header parts may be null.
 */
public class ForStmt extends Stmt {
	private final int forPos;
	private Stmt init;
	private Expr cond;
	private Stmt post;
	private BlockStmt body;

	public ForStmt(int forPos, Stmt init, Expr cond, Stmt post, BlockStmt body) {
		this.forPos = forPos;
		this.init = init;
		this.cond = cond;
		this.post = post;
		this.body = body;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.FOR_STMT;
	}

	@Override
	public int pos() {
		return forPos;
	}

	@Override
	public int end() {
		return body.end();
	}

	public Stmt getInit() {
		return init;
	}

	public void setInit(Stmt init) {
		this.init = init;
	}

	public Expr getCond() {
		return cond;
	}

	public void setCond(Expr cond) {
		this.cond = cond;
	}

	public Stmt getPost() {
		return post;
	}

	public void setPost(Stmt post) {
		this.post = post;
	}

	public BlockStmt getBody() {
		return body;
	}

	public void setBody(BlockStmt body) {
		this.body = body;
	}
}
