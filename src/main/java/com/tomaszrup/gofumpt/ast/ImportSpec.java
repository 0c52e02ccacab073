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

public class ImportSpec extends Spec {
	private CommentGroup doc;
	private Ident name;
	private final BasicLit path;
	private CommentGroup comment;
	private int endPos = Positions.NO_POS;

	public ImportSpec(Ident name, BasicLit path) {
		this.name = name;
		this.path = path;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.IMPORT_SPEC;
	}

	@Override
	public int pos() {
		if (name != null) {
			return name.pos();
		}
		return path.pos();
	}

	@Override
	public int end() {
		if (Positions.valid(endPos)) {
			return endPos;
		}
		return path.end();
	}

	/**
	 * Moves every position of the spec: the start to {@code start} and the end
	 * to {@code end}. Comments attached to the spec keep their positions.
	 */
	public void moveTo(int start, int end) {
		if (name != null) {
			name.setNamePos(start);
		}
		path.setValuePos(start);
		endPos = end;
	}

	/**
	 * Collapses the spec onto a single position.
	 */
	public void relocate(int pos) {
		moveTo(pos, pos);
	}

	public CommentGroup getDoc() {
		return doc;
	}

	public void setDoc(CommentGroup doc) {
		this.doc = doc;
	}

	public Ident getName() {
		return name;
	}

	public void setName(Ident name) {
		this.name = name;
	}

	public BasicLit getPath() {
		return path;
	}

	public String pathValue() {
		return path.unquoted();
	}

	public CommentGroup getComment() {
		return comment;
	}

	public void setComment(CommentGroup comment) {
		this.comment = comment;
	}

	public int getEndPos() {
		return endPos;
	}
}
