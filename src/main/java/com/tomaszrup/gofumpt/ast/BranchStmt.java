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
 * {@code break}, {@code continue}, {@code goto} or {@code fallthrough}, with
 * an optional label.
 */
public class BranchStmt extends Stmt {
	private final int tokPos;
	private final String tok;
	private Ident label;

	public BranchStmt(int tokPos, String tok, Ident label) {
		this.tokPos = tokPos;
		this.tok = tok;
		this.label = label;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.BRANCH_STMT;
	}

	@Override
	public int pos() {
		return tokPos;
	}

	@Override
	public int end() {
		if (label != null) {
			return label.end();
		}
		return tokPos + tok.length();
	}

	public String getTok() {
		return tok;
	}

	public Ident getLabel() {
		return label;
	}

	public void setLabel(Ident label) {
		this.label = label;
	}
}
