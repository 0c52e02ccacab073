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

public class IfStmt extends Stmt {
	private final int ifPos;
	private Stmt init;
	private Expr cond;
	private BlockStmt body;
	private Stmt elseStmt;

	public IfStmt(int ifPos, Stmt init, Expr cond, BlockStmt body, Stmt elseStmt) {
		this.ifPos = ifPos;
		this.init = init;
		this.cond = cond;
		this.body = body;
		this.elseStmt = elseStmt;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.IF_STMT;
	}

	@Override
	public int pos() {
		return ifPos;
	}

	@Override
	public int end() {
		if (elseStmt != null) {
			return elseStmt.end();
		}
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

	public BlockStmt getBody() {
		return body;
	}

	public void setBody(BlockStmt body) {
		this.body = body;
	}

	public Stmt getElse() {
		return elseStmt;
	}

	public void setElse(Stmt elseStmt) {
		this.elseStmt = elseStmt;
	}
}
