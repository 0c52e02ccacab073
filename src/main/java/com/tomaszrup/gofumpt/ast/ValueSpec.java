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
 * {@code a, b T = x, y} inside a {@code const} or {@code var} declaration.
 */
public class ValueSpec extends Spec {
	private CommentGroup doc;
	private final List<Ident> names;
	private Expr type;
	private final List<Expr> values;
	private CommentGroup comment;

	public ValueSpec(List<Ident> names, Expr type, List<Expr> values) {
		this.names = new ArrayList<>(names);
		this.type = type;
		this.values = new ArrayList<>(values);
	}

	@Override
	public NodeKind kind() {
		return NodeKind.VALUE_SPEC;
	}

	@Override
	public int pos() {
		return names.get(0).pos();
	}

	@Override
	public int end() {
		if (!values.isEmpty()) {
			return values.get(values.size() - 1).end();
		}
		if (type != null) {
			return type.end();
		}
		return names.get(names.size() - 1).end();
	}

	public CommentGroup getDoc() {
		return doc;
	}

	public void setDoc(CommentGroup doc) {
		this.doc = doc;
	}

	public List<Ident> getNames() {
		return names;
	}

	public Expr getType() {
		return type;
	}

	public void setType(Expr type) {
		this.type = type;
	}

	public List<Expr> getValues() {
		return values;
	}

	public CommentGroup getComment() {
		return comment;
	}

	public void setComment(CommentGroup comment) {
		this.comment = comment;
	}
}
