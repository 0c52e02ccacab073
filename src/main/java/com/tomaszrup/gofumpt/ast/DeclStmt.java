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
 * A {@code var}, {@code const} or {@code type} declaration inside a function.
 */
public class DeclStmt extends Stmt {
	private GenDecl decl;

	public DeclStmt(GenDecl decl) {
		this.decl = decl;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.DECL_STMT;
	}

	@Override
	public int pos() {
		return decl.pos();
	}

	@Override
	public int end() {
		return decl.end();
	}

	public GenDecl getDecl() {
		return decl;
	}

	public void setDecl(GenDecl decl) {
		this.decl = decl;
	}
}
