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

public class AssignStmt extends Stmt {

	public enum Token {
		ASSIGN("="),
		DEFINE(":="),
		ADD_ASSIGN("+="),
		SUB_ASSIGN("-="),
		MUL_ASSIGN("*="),
		QUO_ASSIGN("/=");

		private final String text;

		Token(String text) {
			this.text = text;
		}

		public String text() {
			return text;
		}
	}

	private final List<Expr> lhs;
	private final int tokPos;
	private final Token tok;
	private final List<Expr> rhs;

	public AssignStmt(List<Expr> lhs, int tokPos, Token tok, List<Expr> rhs) {
		this.lhs = new ArrayList<>(lhs);
		this.tokPos = tokPos;
		this.tok = tok;
		this.rhs = new ArrayList<>(rhs);
	}

	@Override
	public NodeKind kind() {
		return NodeKind.ASSIGN_STMT;
	}

	@Override
	public int pos() {
		return lhs.get(0).pos();
	}

	@Override
	public int end() {
		return rhs.get(rhs.size() - 1).end();
	}

	public List<Expr> getLhs() {
		return lhs;
	}

	public int getTokPos() {
		return tokPos;
	}

	public Token getTok() {
		return tok;
	}

	public List<Expr> getRhs() {
		return rhs;
	}
}
