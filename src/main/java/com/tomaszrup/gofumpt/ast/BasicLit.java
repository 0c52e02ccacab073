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
 * Literal of a basic type. The value keeps the source spelling, including
 * quotes for strings and prefixes for numbers.
 */
public class BasicLit extends Expr {

	public enum LitKind {
		INT,
		FLOAT,
		IMAG,
		CHAR,
		STRING
	}

	private int valuePos;
	private final LitKind litKind;
	private String value;

	public BasicLit(int valuePos, LitKind litKind, String value) {
		this.valuePos = valuePos;
		this.litKind = litKind;
		this.value = value;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.BASIC_LIT;
	}

	@Override
	public int pos() {
		return valuePos;
	}

	@Override
	public int end() {
		return valuePos + value.length();
	}

	public LitKind getLitKind() {
		return litKind;
	}

	public String getValue() {
		return value;
	}

	public void setValue(String value) {
		this.value = value;
	}

	public void setValuePos(int valuePos) {
		this.valuePos = valuePos;
	}

	/**
	 * The string value without its surrounding quotes, for {@code STRING}
	 * literals; escapes are left as written.
	 */
	public String unquoted() {
		if (litKind != LitKind.STRING || value.length() < 2) {
			return value;
		}
		return value.substring(1, value.length() - 1);
	}
}
