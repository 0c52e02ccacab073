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
 * {@code [N]T}, or {@code []T} when the length is null.
 */
public class ArrayType extends Expr {
	private final int lbrack;
	private Expr len;
	private Expr elt;

	public ArrayType(int lbrack, Expr len, Expr elt) {
		this.lbrack = lbrack;
		this.len = len;
		this.elt = elt;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.ARRAY_TYPE;
	}

	@Override
	public int pos() {
		return lbrack;
	}

	@Override
	public int end() {
		return elt.end();
	}

	public Expr getLen() {
		return len;
	}

	public void setLen(Expr len) {
		this.len = len;
	}

	public Expr getElt() {
		return elt;
	}

	public void setElt(Expr elt) {
		this.elt = elt;
	}
}
