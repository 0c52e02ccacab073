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
 * The body holds only {@link CommClause} statements.
 */
public class SelectStmt extends Stmt {
	private final int selectPos;
	private BlockStmt body;

	public SelectStmt(int selectPos, BlockStmt body) {
		this.selectPos = selectPos;
		this.body = body;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.SELECT_STMT;
	}

	@Override
	public int pos() {
		return selectPos;
	}

	@Override
	public int end() {
		return body.end();
	}

	public BlockStmt getBody() {
		return body;
	}

	public void setBody(BlockStmt body) {
		this.body = body;
	}
}
