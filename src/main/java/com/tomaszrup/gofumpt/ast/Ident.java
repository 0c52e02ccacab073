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

public class Ident extends Expr {
	public static final String BLANK = "_";

	private int namePos;
	private final String name;

	public Ident(int namePos, String name) {
		this.namePos = namePos;
		this.name = name;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.IDENT;
	}

	@Override
	public int pos() {
		return namePos;
	}

	@Override
	public int end() {
		return namePos + name.length();
	}

	public String getName() {
		return name;
	}

	public void setNamePos(int namePos) {
		this.namePos = namePos;
	}

	public boolean isBlank() {
		return BLANK.equals(name);
	}

	/**
	 * Whether {@code expr} is an identifier spelled {@code name}.
	 */
	public static boolean is(Expr expr, String name) {
		return expr instanceof Ident && ((Ident) expr).name.equals(name);
	}
}
