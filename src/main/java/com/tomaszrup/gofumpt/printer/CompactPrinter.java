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
package com.tomaszrup.gofumpt.printer;

import java.io.IOException;
import java.util.List;

import com.tomaszrup.gofumpt.ast.ArrayType;
import com.tomaszrup.gofumpt.ast.AssignStmt;
import com.tomaszrup.gofumpt.ast.BasicLit;
import com.tomaszrup.gofumpt.ast.BinaryExpr;
import com.tomaszrup.gofumpt.ast.BlockStmt;
import com.tomaszrup.gofumpt.ast.BranchStmt;
import com.tomaszrup.gofumpt.ast.CallExpr;
import com.tomaszrup.gofumpt.ast.CaseClause;
import com.tomaszrup.gofumpt.ast.CommClause;
import com.tomaszrup.gofumpt.ast.CompositeLit;
import com.tomaszrup.gofumpt.ast.DeclStmt;
import com.tomaszrup.gofumpt.ast.ExprStmt;
import com.tomaszrup.gofumpt.ast.Field;
import com.tomaszrup.gofumpt.ast.FieldList;
import com.tomaszrup.gofumpt.ast.ForStmt;
import com.tomaszrup.gofumpt.ast.FuncDecl;
import com.tomaszrup.gofumpt.ast.FuncLit;
import com.tomaszrup.gofumpt.ast.FuncType;
import com.tomaszrup.gofumpt.ast.GenDecl;
import com.tomaszrup.gofumpt.ast.Ident;
import com.tomaszrup.gofumpt.ast.IfStmt;
import com.tomaszrup.gofumpt.ast.ImportSpec;
import com.tomaszrup.gofumpt.ast.IncDecStmt;
import com.tomaszrup.gofumpt.ast.IndexExpr;
import com.tomaszrup.gofumpt.ast.InterfaceType;
import com.tomaszrup.gofumpt.ast.KeyValueExpr;
import com.tomaszrup.gofumpt.ast.MapType;
import com.tomaszrup.gofumpt.ast.Node;
import com.tomaszrup.gofumpt.ast.ParenExpr;
import com.tomaszrup.gofumpt.ast.Positions;
import com.tomaszrup.gofumpt.ast.ReturnStmt;
import com.tomaszrup.gofumpt.ast.SelectStmt;
import com.tomaszrup.gofumpt.ast.SelectorExpr;
import com.tomaszrup.gofumpt.ast.SourceFile;
import com.tomaszrup.gofumpt.ast.StarExpr;
import com.tomaszrup.gofumpt.ast.StructType;
import com.tomaszrup.gofumpt.ast.SwitchStmt;
import com.tomaszrup.gofumpt.ast.TypeSpec;
import com.tomaszrup.gofumpt.ast.UnaryExpr;
import com.tomaszrup.gofumpt.ast.ValueSpec;

/**
 * Prints any node on one line with canonical Go spacing, e.g.
 * {@code a, b := f(x)}, {@code { x++; return }} or {@code T{a, b}}.
 * Positions and comments are ignored. The output is only meant for length
 * estimates; the real printer lays nodes out over several lines.
 */
public class CompactPrinter implements NodePrinter {

	@Override
	public void print(Node node, Appendable out) throws IOException {
		StringBuilder sb = new StringBuilder();
		node(node, sb);
		out.append(sb);
	}

	/**
	 * Convenience for tests and logging.
	 */
	public String toString(Node node) {
		StringBuilder sb = new StringBuilder();
		node(node, sb);
		return sb.toString();
	}

	private void node(Node node, StringBuilder sb) {
		switch (node.kind()) {
			case SOURCE_FILE: {
				SourceFile file = (SourceFile) node;
				sb.append("package ").append(file.getName().getName());
				for (Node decl : file.getDecls()) {
					sb.append("; ");
					node(decl, sb);
				}
				break;
			}
			case IDENT:
				sb.append(((Ident) node).getName());
				break;
			case BASIC_LIT:
				sb.append(((BasicLit) node).getValue());
				break;
			case COMPOSITE_LIT: {
				CompositeLit lit = (CompositeLit) node;
				if (lit.getType() != null) {
					node(lit.getType(), sb);
				}
				sb.append('{');
				list(lit.getElts(), ", ", sb);
				sb.append('}');
				break;
			}
			case KEY_VALUE_EXPR: {
				KeyValueExpr kv = (KeyValueExpr) node;
				node(kv.getKey(), sb);
				sb.append(": ");
				node(kv.getValue(), sb);
				break;
			}
			case BINARY_EXPR: {
				BinaryExpr binary = (BinaryExpr) node;
				node(binary.getX(), sb);
				sb.append(' ').append(binary.getOp()).append(' ');
				node(binary.getY(), sb);
				break;
			}
			case UNARY_EXPR: {
				UnaryExpr unary = (UnaryExpr) node;
				sb.append(unary.getOp());
				node(unary.getX(), sb);
				break;
			}
			case CALL_EXPR: {
				CallExpr call = (CallExpr) node;
				node(call.getFun(), sb);
				sb.append('(');
				list(call.getArgs(), ", ", sb);
				sb.append(')');
				break;
			}
			case SELECTOR_EXPR: {
				SelectorExpr selector = (SelectorExpr) node;
				node(selector.getX(), sb);
				sb.append('.');
				node(selector.getSel(), sb);
				break;
			}
			case STAR_EXPR:
				sb.append('*');
				node(((StarExpr) node).getX(), sb);
				break;
			case PAREN_EXPR:
				sb.append('(');
				node(((ParenExpr) node).getX(), sb);
				sb.append(')');
				break;
			case INDEX_EXPR: {
				IndexExpr index = (IndexExpr) node;
				node(index.getX(), sb);
				sb.append('[');
				node(index.getIndex(), sb);
				sb.append(']');
				break;
			}
			case FUNC_LIT: {
				FuncLit lit = (FuncLit) node;
				node(lit.getType(), sb);
				sb.append(' ');
				node(lit.getBody(), sb);
				break;
			}
			case ARRAY_TYPE: {
				ArrayType array = (ArrayType) node;
				sb.append('[');
				if (array.getLen() != null) {
					node(array.getLen(), sb);
				}
				sb.append(']');
				node(array.getElt(), sb);
				break;
			}
			case MAP_TYPE: {
				MapType map = (MapType) node;
				sb.append("map[");
				node(map.getKey(), sb);
				sb.append(']');
				node(map.getValue(), sb);
				break;
			}
			case FUNC_TYPE:
				sb.append("func");
				signature((FuncType) node, sb);
				break;
			case STRUCT_TYPE:
				sb.append("struct");
				braced(((StructType) node).getFields(), sb);
				break;
			case INTERFACE_TYPE:
				sb.append("interface");
				braced(((InterfaceType) node).getMethods(), sb);
				break;
			case FIELD_LIST:
				parameters((FieldList) node, sb);
				break;
			case FIELD:
				field((Field) node, sb);
				break;
			case BLOCK_STMT:
				block((BlockStmt) node, sb);
				break;
			case EXPR_STMT:
				node(((ExprStmt) node).getX(), sb);
				break;
			case ASSIGN_STMT: {
				AssignStmt assign = (AssignStmt) node;
				list(assign.getLhs(), ", ", sb);
				sb.append(' ').append(assign.getTok().text()).append(' ');
				list(assign.getRhs(), ", ", sb);
				break;
			}
			case DECL_STMT:
				node(((DeclStmt) node).getDecl(), sb);
				break;
			case RETURN_STMT: {
				ReturnStmt ret = (ReturnStmt) node;
				sb.append("return");
				if (!ret.getResults().isEmpty()) {
					sb.append(' ');
					list(ret.getResults(), ", ", sb);
				}
				break;
			}
			case INC_DEC_STMT: {
				IncDecStmt stmt = (IncDecStmt) node;
				node(stmt.getX(), sb);
				sb.append(stmt.isIncrement() ? "++" : "--");
				break;
			}
			case BRANCH_STMT: {
				BranchStmt branch = (BranchStmt) node;
				sb.append(branch.getTok());
				if (branch.getLabel() != null) {
					sb.append(' ');
					node(branch.getLabel(), sb);
				}
				break;
			}
			case IF_STMT: {
				IfStmt ifs = (IfStmt) node;
				sb.append("if ");
				if (ifs.getInit() != null) {
					node(ifs.getInit(), sb);
					sb.append("; ");
				}
				node(ifs.getCond(), sb);
				sb.append(' ');
				node(ifs.getBody(), sb);
				if (ifs.getElse() != null) {
					sb.append(" else ");
					node(ifs.getElse(), sb);
				}
				break;
			}
			case FOR_STMT:
				forStmt((ForStmt) node, sb);
				break;
			case SWITCH_STMT: {
				SwitchStmt stmt = (SwitchStmt) node;
				sb.append("switch ");
				if (stmt.getInit() != null) {
					node(stmt.getInit(), sb);
					sb.append("; ");
				}
				if (stmt.getTag() != null) {
					node(stmt.getTag(), sb);
					sb.append(' ');
				}
				node(stmt.getBody(), sb);
				break;
			}
			case SELECT_STMT:
				sb.append("select ");
				node(((SelectStmt) node).getBody(), sb);
				break;
			case CASE_CLAUSE: {
				CaseClause clause = (CaseClause) node;
				if (clause.isDefault()) {
					sb.append("default:");
				} else {
					sb.append("case ");
					list(clause.getList(), ", ", sb);
					sb.append(':');
				}
				clauseBody(clause.getBody(), sb);
				break;
			}
			case COMM_CLAUSE: {
				CommClause clause = (CommClause) node;
				if (clause.getComm() == null) {
					sb.append("default:");
				} else {
					sb.append("case ");
					node(clause.getComm(), sb);
					sb.append(':');
				}
				clauseBody(clause.getBody(), sb);
				break;
			}
			case GEN_DECL: {
				GenDecl decl = (GenDecl) node;
				sb.append(decl.getTok().keyword()).append(' ');
				if (decl.isGrouped()) {
					sb.append('(');
					list(decl.getSpecs(), "; ", sb);
					sb.append(')');
				} else {
					node(decl.getSpecs().get(0), sb);
				}
				break;
			}
			case FUNC_DECL: {
				FuncDecl decl = (FuncDecl) node;
				sb.append("func ");
				if (decl.getRecv() != null) {
					parameters(decl.getRecv(), sb);
					sb.append(' ');
				}
				node(decl.getName(), sb);
				signature(decl.getType(), sb);
				if (decl.getBody() != null) {
					sb.append(' ');
					node(decl.getBody(), sb);
				}
				break;
			}
			case IMPORT_SPEC: {
				ImportSpec spec = (ImportSpec) node;
				if (spec.getName() != null) {
					node(spec.getName(), sb);
					sb.append(' ');
				}
				node(spec.getPath(), sb);
				break;
			}
			case VALUE_SPEC: {
				ValueSpec spec = (ValueSpec) node;
				list(spec.getNames(), ", ", sb);
				if (spec.getType() != null) {
					sb.append(' ');
					node(spec.getType(), sb);
				}
				if (!spec.getValues().isEmpty()) {
					sb.append(" = ");
					list(spec.getValues(), ", ", sb);
				}
				break;
			}
			case TYPE_SPEC: {
				TypeSpec spec = (TypeSpec) node;
				node(spec.getName(), sb);
				sb.append(spec.isAlias() ? " = " : " ");
				node(spec.getType(), sb);
				break;
			}
			default:
				throw new IllegalArgumentException("cannot print " + node.kind());
		}
	}

	private void list(List<? extends Node> nodes, String separator, StringBuilder sb) {
		for (int i = 0; i < nodes.size(); i++) {
			if (i > 0) {
				sb.append(separator);
			}
			node(nodes.get(i), sb);
		}
	}

	private void block(BlockStmt block, StringBuilder sb) {
		if (block.getList().isEmpty()) {
			sb.append("{}");
			return;
		}
		sb.append("{ ");
		list(block.getList(), "; ", sb);
		sb.append(" }");
	}

	private void clauseBody(List<? extends Node> body, StringBuilder sb) {
		if (!body.isEmpty()) {
			sb.append(' ');
			list(body, "; ", sb);
		}
	}

	private void forStmt(ForStmt loop, StringBuilder sb) {
		sb.append("for ");
		if (loop.getInit() == null && loop.getPost() == null) {
			if (loop.getCond() != null) {
				node(loop.getCond(), sb);
				sb.append(' ');
			}
		} else {
			if (loop.getInit() != null) {
				node(loop.getInit(), sb);
			}
			sb.append("; ");
			if (loop.getCond() != null) {
				node(loop.getCond(), sb);
			}
			sb.append("; ");
			if (loop.getPost() != null) {
				node(loop.getPost(), sb);
			}
			sb.append(' ');
		}
		node(loop.getBody(), sb);
	}

	private void signature(FuncType type, StringBuilder sb) {
		parameters(type.getParams(), sb);
		FieldList results = type.getResults();
		if (results == null || results.getList().isEmpty()) {
			return;
		}
		sb.append(' ');
		Field only = results.getList().get(0);
		if (!Positions.valid(results.getOpening()) && results.getList().size() == 1 && only.getNames().isEmpty()) {
			node(only.getType(), sb);
		} else {
			parameters(results, sb);
		}
	}

	private void parameters(FieldList fields, StringBuilder sb) {
		sb.append('(');
		list(fields.getList(), ", ", sb);
		sb.append(')');
	}

	private void braced(FieldList fields, StringBuilder sb) {
		if (fields == null || fields.getList().isEmpty()) {
			sb.append("{}");
			return;
		}
		sb.append("{ ");
		List<Field> list = fields.getList();
		for (int i = 0; i < list.size(); i++) {
			if (i > 0) {
				sb.append("; ");
			}
			Field field = list.get(i);
			if (field.getType() instanceof FuncType && !field.getNames().isEmpty()) {
				// interface method
				node(field.getNames().get(0), sb);
				signature((FuncType) field.getType(), sb);
			} else {
				field(field, sb);
			}
		}
		sb.append(" }");
	}

	private void field(Field field, StringBuilder sb) {
		if (!field.getNames().isEmpty()) {
			list(field.getNames(), ", ", sb);
			sb.append(' ');
		}
		node(field.getType(), sb);
		if (field.getTag() != null) {
			sb.append(' ');
			node(field.getTag(), sb);
		}
	}
}
