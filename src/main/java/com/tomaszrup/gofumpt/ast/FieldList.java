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
 * Fields between parentheses or braces. {@code opening} and {@code closing}
 * are absent for a single unparenthesized result type.
 */
public class FieldList extends Node {
	private final int opening;
	private final List<Field> list;
	private final int closing;

	public FieldList(int opening, List<Field> list, int closing) {
		this.opening = opening;
		this.list = new ArrayList<>(list);
		this.closing = closing;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.FIELD_LIST;
	}

	@Override
	public int pos() {
		if (Positions.valid(opening)) {
			return opening;
		}
		if (!list.isEmpty()) {
			return list.get(0).pos();
		}
		return Positions.NO_POS;
	}

	@Override
	public int end() {
		if (Positions.valid(closing)) {
			return closing + 1;
		}
		if (!list.isEmpty()) {
			return list.get(list.size() - 1).end();
		}
		return Positions.NO_POS;
	}

	public int getOpening() {
		return opening;
	}

	public List<Field> getList() {
		return list;
	}

	public int getClosing() {
		return closing;
	}

	/**
	 * Number of parameters or fields, counting each name separately.
	 */
	public int numFields() {
		int n = 0;
		for (Field field : list) {
			int names = field.getNames().size();
			n += names == 0 ? 1 : names;
		}
		return n;
	}
}
