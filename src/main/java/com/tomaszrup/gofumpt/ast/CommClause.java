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
 * {@code case comm: body} inside a select; a null comm is the default clause.
 */
public class CommClause extends Stmt {
	private final int casePos;
	private Stmt comm;
	private final int colon;
	private final List<Stmt> body;

	public CommClause(int casePos, Stmt comm, int colon, List<Stmt> body) {
		this.casePos = casePos;
		this.comm = comm;
		this.colon = colon;
		this.body = new ArrayList<>(body);
	}

	@Override
	public NodeKind kind() {
		return NodeKind.COMM_CLAUSE;
	}

	@Override
	public int pos() {
		return casePos;
	}

	@Override
	public int end() {
		if (!body.isEmpty()) {
			return body.get(body.size() - 1).end();
		}
		return colon + 1;
	}

	public int getCasePos() {
		return casePos;
	}

	public Stmt getComm() {
		return comm;
	}

	public void setComm(Stmt comm) {
		this.comm = comm;
	}

	public int getColon() {
		return colon;
	}

	public List<Stmt> getBody() {
		return body;
	}
}
