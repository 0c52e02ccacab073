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
 * Function signature. {@code funcPos} is absent for interface methods, and
 * {@code results} is null when the function returns nothing.
 */
public class FuncType extends Expr {
	private final int funcPos;
	private FieldList params;
	private FieldList results;

	public FuncType(int funcPos, FieldList params, FieldList results) {
		this.funcPos = funcPos;
		this.params = params;
		this.results = results;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.FUNC_TYPE;
	}

	@Override
	public int pos() {
		if (Positions.valid(funcPos)) {
			return funcPos;
		}
		return params.pos();
	}

	@Override
	public int end() {
		if (results != null) {
			return results.end();
		}
		return params.end();
	}

	public int getFuncPos() {
		return funcPos;
	}

	public FieldList getParams() {
		return params;
	}

	public void setParams(FieldList params) {
		this.params = params;
	}

	public FieldList getResults() {
		return results;
	}

	public void setResults(FieldList results) {
		this.results = results;
	}
}
