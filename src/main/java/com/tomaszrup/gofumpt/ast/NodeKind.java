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
 * Tag carried by every syntax tree node. Traversal and rule dispatch switch
 * on this tag instead of inspecting node classes.
 */
public enum NodeKind {
	SOURCE_FILE,

	// expressions and types
	IDENT,
	BASIC_LIT,
	COMPOSITE_LIT,
	KEY_VALUE_EXPR,
	BINARY_EXPR,
	UNARY_EXPR,
	CALL_EXPR,
	SELECTOR_EXPR,
	STAR_EXPR,
	PAREN_EXPR,
	INDEX_EXPR,
	FUNC_LIT,
	ARRAY_TYPE,
	MAP_TYPE,
	FUNC_TYPE,
	STRUCT_TYPE,
	INTERFACE_TYPE,

	FIELD_LIST,
	FIELD,

	// statements
	BLOCK_STMT,
	EXPR_STMT,
	ASSIGN_STMT,
	DECL_STMT,
	RETURN_STMT,
	INC_DEC_STMT,
	BRANCH_STMT,
	IF_STMT,
	FOR_STMT,
	SWITCH_STMT,
	SELECT_STMT,
	CASE_CLAUSE,
	COMM_CLAUSE,

	// declarations and specs
	GEN_DECL,
	FUNC_DECL,
	IMPORT_SPEC,
	VALUE_SPEC,
	TYPE_SPEC
}
