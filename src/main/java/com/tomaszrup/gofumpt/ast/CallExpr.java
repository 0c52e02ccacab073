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

public class CallExpr extends Expr {
	private Expr fun;
	private final int lparen;
	private final List<Expr> args;
	private final int rparen;

	public CallExpr(Expr fun, int lparen, List<Expr> args, int rparen) {
		this.fun = fun;
		this.lparen = lparen;
		this.args = new ArrayList<>(args);
		this.rparen = rparen;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.CALL_EXPR;
	}

	@Override
	public int pos() {
		return fun.pos();
	}

	@Override
	public int end() {
		return rparen + 1;
	}

	public Expr getFun() {
		return fun;
	}

	public void setFun(Expr fun) {
		this.fun = fun;
	}

	public int getLparen() {
		return lparen;
	}

	public List<Expr> getArgs() {
		return args;
	}

	public int getRparen() {
		return rparen;
	}
}
