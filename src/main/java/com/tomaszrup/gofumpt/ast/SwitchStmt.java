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
 * Expression switch. The body holds only {@link CaseClause} statements.
 */
public class SwitchStmt extends Stmt {
	private final int switchPos;
	private Stmt init;
	private Expr tag;
	private BlockStmt body;

	public SwitchStmt(int switchPos, Stmt init, Expr tag, BlockStmt body) {
		this.switchPos = switchPos;
		this.init = init;
		this.tag = tag;
		this.body = body;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.SWITCH_STMT;
	}

	@Override
	public int pos() {
		return switchPos;
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

	public Expr getTag() {
		return tag;
	}

	public void setTag(Expr tag) {
		this.tag = tag;
	}

	public BlockStmt getBody() {
		return body;
	}

	public void setBody(BlockStmt body) {
		this.body = body;
	}
}
