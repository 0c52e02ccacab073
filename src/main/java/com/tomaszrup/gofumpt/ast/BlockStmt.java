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

public class BlockStmt extends Stmt {
	private final int lbrace;
	private final List<Stmt> list;
	private final int rbrace;

	public BlockStmt(int lbrace, List<Stmt> list, int rbrace) {
		this.lbrace = lbrace;
		this.list = new ArrayList<>(list);
		this.rbrace = rbrace;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.BLOCK_STMT;
	}

	@Override
	public int pos() {
		return lbrace;
	}

	@Override
	public int end() {
		return rbrace + 1;
	}

	public int getLbrace() {
		return lbrace;
	}

	public List<Stmt> getList() {
		return list;
	}

	public int getRbrace() {
		return rbrace;
	}
}
