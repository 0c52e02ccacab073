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

public class MapType extends Expr {
	private final int mapPos;
	private Expr key;
	private Expr value;

	public MapType(int mapPos, Expr key, Expr value) {
		this.mapPos = mapPos;
		this.key = key;
		this.value = value;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.MAP_TYPE;
	}

	@Override
	public int pos() {
		return mapPos;
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

	public Expr getValue() {
		return value;
	}

	public void setValue(Expr value) {
		this.value = value;
	}
}
