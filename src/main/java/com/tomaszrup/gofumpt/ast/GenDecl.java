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
 * {@code import}, {@code const}, {@code type} or {@code var} declaration. The
 * declaration is printed grouped when {@code lparen} is valid or when it holds
 * more than one spec; {@code rparen} then closes the group.
 */
public class GenDecl extends Decl {

	public enum Token {
		IMPORT("import"),
		CONST("const"),
		TYPE("type"),
		VAR("var");

		private final String keyword;

		Token(String keyword) {
			this.keyword = keyword;
		}

		public String keyword() {
			return keyword;
		}
	}

	private CommentGroup doc;
	private int tokPos;
	private final Token tok;
	private int lparen;
	private final List<Spec> specs;
	private int rparen;

	public GenDecl(int tokPos, Token tok, int lparen, List<? extends Spec> specs, int rparen) {
		this.tokPos = tokPos;
		this.tok = tok;
		this.lparen = lparen;
		this.specs = new ArrayList<>(specs);
		this.rparen = rparen;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.GEN_DECL;
	}

	@Override
	public int pos() {
		return tokPos;
	}

	@Override
	public int end() {
		if (Positions.valid(rparen)) {
			return rparen + 1;
		}
		return specs.get(0).end();
	}

	public CommentGroup getDoc() {
		return doc;
	}

	public void setDoc(CommentGroup doc) {
		this.doc = doc;
	}

	public int getTokPos() {
		return tokPos;
	}

	public void setTokPos(int tokPos) {
		this.tokPos = tokPos;
	}

	public Token getTok() {
		return tok;
	}

	public int getLparen() {
		return lparen;
	}

	public void setLparen(int lparen) {
		this.lparen = lparen;
	}

	public List<Spec> getSpecs() {
		return specs;
	}

	public int getRparen() {
		return rparen;
	}

	public void setRparen(int rparen) {
		this.rparen = rparen;
	}

	public boolean isGrouped() {
		return Positions.valid(lparen) || specs.size() > 1;
	}
}
