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

import java.util.List;

/**
 * Structural equality of type expressions, ignoring every position. Two
 * nodes are equivalent when they have the same kind, the same spellings and
 * equivalent children.
 */
public final class NodeEquivalence {

	private NodeEquivalence() {
	}

	public static boolean equivalent(Node a, Node b) {
		if (a == b) {
			return true;
		}
		if (a == null || b == null || a.kind() != b.kind()) {
			return false;
		}
		switch (a.kind()) {
			case IDENT:
				return ((Ident) a).getName().equals(((Ident) b).getName());
			case BASIC_LIT: {
				BasicLit x = (BasicLit) a;
				BasicLit y = (BasicLit) b;
				return x.getLitKind() == y.getLitKind() && x.getValue().equals(y.getValue());
			}
			case COMPOSITE_LIT: {
				CompositeLit x = (CompositeLit) a;
				CompositeLit y = (CompositeLit) b;
				return equivalent(x.getType(), y.getType()) && allEquivalent(x.getElts(), y.getElts());
			}
			case KEY_VALUE_EXPR: {
				KeyValueExpr x = (KeyValueExpr) a;
				KeyValueExpr y = (KeyValueExpr) b;
				return equivalent(x.getKey(), y.getKey()) && equivalent(x.getValue(), y.getValue());
			}
			case BINARY_EXPR: {
				BinaryExpr x = (BinaryExpr) a;
				BinaryExpr y = (BinaryExpr) b;
				return x.getOp().equals(y.getOp())
						&& equivalent(x.getX(), y.getX())
						&& equivalent(x.getY(), y.getY());
			}
			case UNARY_EXPR: {
				UnaryExpr x = (UnaryExpr) a;
				UnaryExpr y = (UnaryExpr) b;
				return x.getOp().equals(y.getOp()) && equivalent(x.getX(), y.getX());
			}
			case CALL_EXPR: {
				CallExpr x = (CallExpr) a;
				CallExpr y = (CallExpr) b;
				return equivalent(x.getFun(), y.getFun()) && allEquivalent(x.getArgs(), y.getArgs());
			}
			case SELECTOR_EXPR: {
				SelectorExpr x = (SelectorExpr) a;
				SelectorExpr y = (SelectorExpr) b;
				return equivalent(x.getX(), y.getX()) && equivalent(x.getSel(), y.getSel());
			}
			case STAR_EXPR:
				return equivalent(((StarExpr) a).getX(), ((StarExpr) b).getX());
			case PAREN_EXPR:
				return equivalent(((ParenExpr) a).getX(), ((ParenExpr) b).getX());
			case INDEX_EXPR: {
				IndexExpr x = (IndexExpr) a;
				IndexExpr y = (IndexExpr) b;
				return equivalent(x.getX(), y.getX()) && equivalent(x.getIndex(), y.getIndex());
			}
			case ARRAY_TYPE: {
				ArrayType x = (ArrayType) a;
				ArrayType y = (ArrayType) b;
				return equivalent(x.getLen(), y.getLen()) && equivalent(x.getElt(), y.getElt());
			}
			case MAP_TYPE: {
				MapType x = (MapType) a;
				MapType y = (MapType) b;
				return equivalent(x.getKey(), y.getKey()) && equivalent(x.getValue(), y.getValue());
			}
			case FUNC_TYPE: {
				FuncType x = (FuncType) a;
				FuncType y = (FuncType) b;
				return equivalent(x.getParams(), y.getParams()) && equivalent(x.getResults(), y.getResults());
			}
			case STRUCT_TYPE:
				return equivalent(((StructType) a).getFields(), ((StructType) b).getFields());
			case INTERFACE_TYPE:
				return equivalent(((InterfaceType) a).getMethods(), ((InterfaceType) b).getMethods());
			case FIELD_LIST:
				return allEquivalent(((FieldList) a).getList(), ((FieldList) b).getList());
			case FIELD: {
				Field x = (Field) a;
				Field y = (Field) b;
				return allEquivalent(x.getNames(), y.getNames())
						&& equivalent(x.getType(), y.getType())
						&& equivalent(x.getTag(), y.getTag());
			}
			default:
				// statements and declarations never appear inside a type
				return false;
		}
	}

	private static boolean allEquivalent(List<? extends Node> a, List<? extends Node> b) {
		if (a.size() != b.size()) {
			return false;
		}
		for (int i = 0; i < a.size(); i++) {
			if (!equivalent(a.get(i), b.get(i))) {
				return false;
			}
		}
		return true;
	}
}
