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

public class KeyValueExpr extends Expr {
	private Expr key;
	private final int colon;
	private Expr value;

	public KeyValueExpr(Expr key, int colon, Expr value) {
		this.key = key;
		this.colon = colon;
		this.value = value;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.KEY_VALUE_EXPR;
	}

	@Override
	public int pos() {
		return key.pos();
	}

	@Override
	public int end() {
		return value.end();
	}

	public Expr getKey() {
		return key;
	}

	public void setKey(Expr key) {
		this.key = key;
	}

	public int getColon() {
		return colon;
	}

	public Expr getValue() {
		return value;
	}

	public void setValue(Expr value) {
		this.value = value;
	}
}
