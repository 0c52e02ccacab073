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

public class ParenExpr extends Expr {
	private final int lparen;
	private Expr x;
	private final int rparen;

	public ParenExpr(int lparen, Expr x, int rparen) {
		this.lparen = lparen;
		this.x = x;
		this.rparen = rparen;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.PAREN_EXPR;
	}

	@Override
	public int pos() {
		return lparen;
	}

	@Override
	public int end() {
		return rparen + 1;
	}

	public Expr getX() {
		return x;
	}

	public void setX(Expr x) {
		this.x = x;
	}
}
