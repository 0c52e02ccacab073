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
package com.tomaszrup.gofumpt.rules;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.gofumpt.ast.AssignStmt;
import com.tomaszrup.gofumpt.ast.BinaryExpr;
import com.tomaszrup.gofumpt.ast.Expr;
import com.tomaszrup.gofumpt.ast.Ident;
import com.tomaszrup.gofumpt.ast.IfStmt;
import com.tomaszrup.gofumpt.ast.Stmt;
import com.tomaszrup.gofumpt.layout.LineTable;

/**
 * Keeps an error check glued to the call producing the error:
 *
 * <pre>
 * f, err := os.Open(name)
 * if err != nil {
 * </pre>
 */
public class ErrorGuardRule {
	private static final Logger logger = LoggerFactory.getLogger(ErrorGuardRule.class);

	static final String ERR = "err";

	private final LineTable lines;

	public ErrorGuardRule(LineTable lines) {
		this.lines = lines;
	}

	public void apply(List<Stmt> stmts) {
		for (int i = 1; i < stmts.size(); i++) {
			if (!(stmts.get(i) instanceof IfStmt) || !(stmts.get(i - 1) instanceof AssignStmt)) {
				continue;
			}
			AssignStmt assign = (AssignStmt) stmts.get(i - 1);
			IfStmt guard = (IfStmt) stmts.get(i);
			if (declaresErr(assign) && isSimpleGuard(guard)) {
				logger.debug("Removing blank lines before error check at offset {}", guard.pos());
				lines.removeLinesBetween(assign.end(), guard.pos());
			}
		}
	}

	// "..., err := ..."
	private static boolean declaresErr(AssignStmt assign) {
		List<Expr> lhs = assign.getLhs();
		return assign.getTok() == AssignStmt.Token.DEFINE
				&& Ident.is(lhs.get(lhs.size() - 1), ERR);
	}

	// "if err != nil" without init or else
	private static boolean isSimpleGuard(IfStmt guard) {
		if (guard.getInit() != null || guard.getElse() != null || !(guard.getCond() instanceof BinaryExpr)) {
			return false;
		}
		BinaryExpr cond = (BinaryExpr) guard.getCond();
		return "!=".equals(cond.getOp())
				&& Ident.is(cond.getX(), ERR)
				&& Ident.is(cond.getY(), "nil");
	}
}
