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

/**
 * {@code T{a, b}}; the type is null for elided types inside another literal.
 */
public class CompositeLit extends Expr {
	private Expr type;
	private final int lbrace;
	private final List<Expr> elts;
	private final int rbrace;

	public CompositeLit(Expr type, int lbrace, List<Expr> elts, int rbrace) {
		this.type = type;
		this.lbrace = lbrace;
		this.elts = new ArrayList<>(elts);
		this.rbrace = rbrace;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.COMPOSITE_LIT;
	}

	@Override
	public int pos() {
		return type != null ? type.pos() : lbrace;
	}

	@Override
	public int end() {
		return rbrace + 1;
	}

	public Expr getType() {
		return type;
	}

	public void setType(Expr type) {
		this.type = type;
	}

	public int getLbrace() {
		return lbrace;
	}

	public List<Expr> getElts() {
		return elts;
	}

	public int getRbrace() {
		return rbrace;
	}
}
