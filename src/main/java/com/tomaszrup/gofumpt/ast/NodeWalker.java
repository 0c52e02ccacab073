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
import java.util.function.Consumer;

/**
 * Depth-first traversal with a pre-order and a post-order callback. Children
 * are read after the pre-order callback returns, so a callback may rewrite
 * the current node's child lists or replace the node itself and have the
 * result walked. Comments are not nodes and are not visited.
 */
public final class NodeWalker {

	/**
	 * Callback invoked for every node.
	 */
	@FunctionalInterface
	public interface Visitor {
		void visit(Cursor cursor);
	}

	private final Visitor pre;
	private final Visitor post;

	private NodeWalker(Visitor pre, Visitor post) {
		this.pre = pre;
		this.post = post;
	}

	/**
	 * Walks {@code root}; either callback may be null.
	 *
	 * @return the root, which cannot be replaced
	 */
	public static Node apply(Node root, Visitor pre, Visitor post) {
		NodeWalker walker = new NodeWalker(pre, post);
		walker.walk(new Cursor(null, root, -1, n -> {
			throw new UnsupportedOperationException("the root node cannot be replaced");
		}));
		return root;
	}

	private void walk(Cursor cursor) {
		if (pre != null) {
			pre.visit(cursor);
		}
		walkChildren(cursor.node());
		if (post != null) {
			post.visit(cursor);
		}
	}

	private void child(Node parent, Node child, Consumer<Node> slot) {
		if (child != null) {
			walk(new Cursor(parent, child, -1, slot));
		}
	}

	private <T extends Node> void children(Node parent, List<T> list, Class<T> type) {
		for (int i = 0; i < list.size(); i++) {
			final int index = i;
			walk(new Cursor(parent, list.get(i), i, n -> list.set(index, type.cast(n))));
		}
	}

	private static Consumer<Node> fixed(Node parent, String slot) {
		return n -> {
			throw new UnsupportedOperationException(parent.kind() + "." + slot + " cannot be replaced");
		};
	}

	private void walkChildren(Node node) {
		switch (node.kind()) {
			case SOURCE_FILE: {
				SourceFile file = (SourceFile) node;
				child(file, file.getName(), n -> file.setName((Ident) n));
				children(file, file.getDecls(), Decl.class);
				break;
			}
			case IDENT:
			case BASIC_LIT:
				break;
			case COMPOSITE_LIT: {
				CompositeLit lit = (CompositeLit) node;
				child(lit, lit.getType(), n -> lit.setType((Expr) n));
				children(lit, lit.getElts(), Expr.class);
				break;
			}
			case KEY_VALUE_EXPR: {
				KeyValueExpr kv = (KeyValueExpr) node;
				child(kv, kv.getKey(), n -> kv.setKey((Expr) n));
				child(kv, kv.getValue(), n -> kv.setValue((Expr) n));
				break;
			}
			case BINARY_EXPR: {
				BinaryExpr binary = (BinaryExpr) node;
				child(binary, binary.getX(), n -> binary.setX((Expr) n));
				child(binary, binary.getY(), n -> binary.setY((Expr) n));
				break;
			}
			case UNARY_EXPR: {
				UnaryExpr unary = (UnaryExpr) node;
				child(unary, unary.getX(), n -> unary.setX((Expr) n));
				break;
			}
			case CALL_EXPR: {
				CallExpr call = (CallExpr) node;
				child(call, call.getFun(), n -> call.setFun((Expr) n));
				children(call, call.getArgs(), Expr.class);
				break;
			}
			case SELECTOR_EXPR: {
				SelectorExpr selector = (SelectorExpr) node;
				child(selector, selector.getX(), n -> selector.setX((Expr) n));
				child(selector, selector.getSel(), n -> selector.setSel((Ident) n));
				break;
			}
			case STAR_EXPR: {
				StarExpr star = (StarExpr) node;
				child(star, star.getX(), n -> star.setX((Expr) n));
				break;
			}
			case PAREN_EXPR: {
				ParenExpr paren = (ParenExpr) node;
				child(paren, paren.getX(), n -> paren.setX((Expr) n));
				break;
			}
			case INDEX_EXPR: {
				IndexExpr index = (IndexExpr) node;
				child(index, index.getX(), n -> index.setX((Expr) n));
				child(index, index.getIndex(), n -> index.setIndex((Expr) n));
				break;
			}
			case FUNC_LIT: {
				FuncLit lit = (FuncLit) node;
				child(lit, lit.getType(), n -> lit.setType((FuncType) n));
				child(lit, lit.getBody(), n -> lit.setBody((BlockStmt) n));
				break;
			}
			case ARRAY_TYPE: {
				ArrayType array = (ArrayType) node;
				child(array, array.getLen(), n -> array.setLen((Expr) n));
				child(array, array.getElt(), n -> array.setElt((Expr) n));
				break;
			}
			case MAP_TYPE: {
				MapType map = (MapType) node;
				child(map, map.getKey(), n -> map.setKey((Expr) n));
				child(map, map.getValue(), n -> map.setValue((Expr) n));
				break;
			}
			case FUNC_TYPE: {
				FuncType type = (FuncType) node;
				child(type, type.getParams(), n -> type.setParams((FieldList) n));
				child(type, type.getResults(), n -> type.setResults((FieldList) n));
				break;
			}
			case STRUCT_TYPE: {
				StructType struct = (StructType) node;
				child(struct, struct.getFields(), n -> struct.setFields((FieldList) n));
				break;
			}
			case INTERFACE_TYPE: {
				InterfaceType iface = (InterfaceType) node;
				child(iface, iface.getMethods(), n -> iface.setMethods((FieldList) n));
				break;
			}
			case FIELD_LIST: {
				FieldList fields = (FieldList) node;
				children(fields, fields.getList(), Field.class);
				break;
			}
			case FIELD: {
				Field field = (Field) node;
				children(field, field.getNames(), Ident.class);
				child(field, field.getType(), n -> field.setType((Expr) n));
				child(field, field.getTag(), n -> field.setTag((BasicLit) n));
				break;
			}
			case BLOCK_STMT: {
				BlockStmt block = (BlockStmt) node;
				children(block, block.getList(), Stmt.class);
				break;
			}
			case EXPR_STMT: {
				ExprStmt stmt = (ExprStmt) node;
				child(stmt, stmt.getX(), n -> stmt.setX((Expr) n));
				break;
			}
			case ASSIGN_STMT: {
				AssignStmt assign = (AssignStmt) node;
				children(assign, assign.getLhs(), Expr.class);
				children(assign, assign.getRhs(), Expr.class);
				break;
			}
			case DECL_STMT: {
				DeclStmt stmt = (DeclStmt) node;
				child(stmt, stmt.getDecl(), n -> stmt.setDecl((GenDecl) n));
				break;
			}
			case RETURN_STMT: {
				ReturnStmt ret = (ReturnStmt) node;
				children(ret, ret.getResults(), Expr.class);
				break;
			}
			case INC_DEC_STMT: {
				IncDecStmt stmt = (IncDecStmt) node;
				child(stmt, stmt.getX(), n -> stmt.setX((Expr) n));
				break;
			}
			case BRANCH_STMT: {
				BranchStmt branch = (BranchStmt) node;
				child(branch, branch.getLabel(), n -> branch.setLabel((Ident) n));
				break;
			}
			case IF_STMT: {
				IfStmt ifs = (IfStmt) node;
				child(ifs, ifs.getInit(), n -> ifs.setInit((Stmt) n));
				child(ifs, ifs.getCond(), n -> ifs.setCond((Expr) n));
				child(ifs, ifs.getBody(), n -> ifs.setBody((BlockStmt) n));
				child(ifs, ifs.getElse(), n -> ifs.setElse((Stmt) n));
				break;
			}
			case FOR_STMT: {
				ForStmt loop = (ForStmt) node;
				child(loop, loop.getInit(), n -> loop.setInit((Stmt) n));
				child(loop, loop.getCond(), n -> loop.setCond((Expr) n));
				child(loop, loop.getPost(), n -> loop.setPost((Stmt) n));
				child(loop, loop.getBody(), n -> loop.setBody((BlockStmt) n));
				break;
			}
			case SWITCH_STMT: {
				SwitchStmt stmt = (SwitchStmt) node;
				child(stmt, stmt.getInit(), n -> stmt.setInit((Stmt) n));
				child(stmt, stmt.getTag(), n -> stmt.setTag((Expr) n));
				child(stmt, stmt.getBody(), n -> stmt.setBody((BlockStmt) n));
				break;
			}
			case SELECT_STMT: {
				SelectStmt stmt = (SelectStmt) node;
				child(stmt, stmt.getBody(), n -> stmt.setBody((BlockStmt) n));
				break;
			}
			case CASE_CLAUSE: {
				CaseClause clause = (CaseClause) node;
				children(clause, clause.getList(), Expr.class);
				children(clause, clause.getBody(), Stmt.class);
				break;
			}
			case COMM_CLAUSE: {
				CommClause clause = (CommClause) node;
				child(clause, clause.getComm(), n -> clause.setComm((Stmt) n));
				children(clause, clause.getBody(), Stmt.class);
				break;
			}
			case GEN_DECL: {
				GenDecl decl = (GenDecl) node;
				children(decl, decl.getSpecs(), Spec.class);
				break;
			}
			case FUNC_DECL: {
				FuncDecl decl = (FuncDecl) node;
				child(decl, decl.getRecv(), n -> decl.setRecv((FieldList) n));
				child(decl, decl.getName(), n -> decl.setName((Ident) n));
				child(decl, decl.getType(), n -> decl.setType((FuncType) n));
				child(decl, decl.getBody(), n -> decl.setBody((BlockStmt) n));
				break;
			}
			case IMPORT_SPEC: {
				ImportSpec spec = (ImportSpec) node;
				child(spec, spec.getName(), n -> spec.setName((Ident) n));
				child(spec, spec.getPath(), fixed(spec, "path"));
				break;
			}
			case VALUE_SPEC: {
				ValueSpec spec = (ValueSpec) node;
				children(spec, spec.getNames(), Ident.class);
				child(spec, spec.getType(), n -> spec.setType((Expr) n));
				children(spec, spec.getValues(), Expr.class);
				break;
			}
			case TYPE_SPEC: {
				TypeSpec spec = (TypeSpec) node;
				child(spec, spec.getName(), n -> spec.setName((Ident) n));
				child(spec, spec.getType(), n -> spec.setType((Expr) n));
				break;
			}
			default:
				throw new IllegalStateException("unhandled node kind " + node.kind());
		}
	}
}
