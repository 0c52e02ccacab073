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
package com.tomaszrup.gofumpt.rewrite;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.gofumpt.FormatOptions;
import com.tomaszrup.gofumpt.ast.BasicLit;
import com.tomaszrup.gofumpt.ast.BlockStmt;
import com.tomaszrup.gofumpt.ast.CaseClause;
import com.tomaszrup.gofumpt.ast.CommClause;
import com.tomaszrup.gofumpt.ast.CompositeLit;
import com.tomaszrup.gofumpt.ast.Cursor;
import com.tomaszrup.gofumpt.ast.FieldList;
import com.tomaszrup.gofumpt.ast.FuncDecl;
import com.tomaszrup.gofumpt.ast.FuncType;
import com.tomaszrup.gofumpt.ast.GenDecl;
import com.tomaszrup.gofumpt.ast.Node;
import com.tomaszrup.gofumpt.ast.NodeWalker;
import com.tomaszrup.gofumpt.ast.SourceFile;
import com.tomaszrup.gofumpt.layout.CommentIndex;
import com.tomaszrup.gofumpt.layout.LayoutLimits;
import com.tomaszrup.gofumpt.layout.LengthEstimator;
import com.tomaszrup.gofumpt.layout.LineTable;
import com.tomaszrup.gofumpt.printer.CompactPrinter;
import com.tomaszrup.gofumpt.rules.BlockCollapser;
import com.tomaszrup.gofumpt.rules.ClauseCollapser;
import com.tomaszrup.gofumpt.rules.CommentSpacing;
import com.tomaszrup.gofumpt.rules.CompositeLiteralLayout;
import com.tomaszrup.gofumpt.rules.DeclarationJoiner;
import com.tomaszrup.gofumpt.rules.ErrorGuardRule;
import com.tomaszrup.gofumpt.rules.FieldListRules;
import com.tomaszrup.gofumpt.rules.ImportGrouper;
import com.tomaszrup.gofumpt.rules.ImportSorter;
import com.tomaszrup.gofumpt.rules.LongLineSplitter;
import com.tomaszrup.gofumpt.rules.OctalLiteralRule;
import com.tomaszrup.gofumpt.rules.VarDeclRewriter;

/**
 * Applies every layout rule to one file in a single walk. Most rules run
 * when a node is entered; composite literals are laid out when they are
 * left, after their elements were handled.
 *
 * <p>An instance holds the state of one run and must not be reused.
 */
public class LayoutRewriter {
	private static final Logger logger = LoggerFactory.getLogger(LayoutRewriter.class);

	private final SourceFile file;
	private final TraversalContext context = new TraversalContext();

	private final DeclarationJoiner declarationJoiner;
	private final CommentSpacing commentSpacing;
	private final VarDeclRewriter varDecls;
	private final ImportGrouper importGrouper;
	private final BlockCollapser blockCollapser;
	private final ClauseCollapser clauseCollapser;
	private final FieldListRules fieldLists;
	private final OctalLiteralRule octalLiterals;
	private final ErrorGuardRule errorGuards;
	private final CompositeLiteralLayout compositeLiterals;
	private final LongLineSplitter longLines;

	public LayoutRewriter(SourceFile file, LineTable lines, FormatOptions options) {
		this.file = file;
		LayoutLimits limits = options.getLayoutLimits();
		CommentIndex comments = new CommentIndex(file.getComments(), lines);
		LengthEstimator estimator = new LengthEstimator(new CompactPrinter(), lines, comments, limits,
				context::getDepth);

		declarationJoiner = new DeclarationJoiner(lines, comments);
		commentSpacing = new CommentSpacing();
		varDecls = new VarDeclRewriter(lines, comments);
		importGrouper = new ImportGrouper(file, lines, comments, new ImportSorter(lines));
		blockCollapser = new BlockCollapser(lines, comments, estimator);
		clauseCollapser = new ClauseCollapser(lines, comments, estimator);
		fieldLists = new FieldListRules(lines, comments, options.isExtraRules());
		octalLiterals = new OctalLiteralRule(options.getLangVersion());
		errorGuards = new ErrorGuardRule(lines);
		compositeLiterals = new CompositeLiteralLayout(lines);
		longLines = options.isSplitLongLines()
				? new LongLineSplitter(lines, estimator, context::getMinSplitFactor, context::getDepth)
				: null;
	}

	public void rewrite() {
		logger.debug("Rewriting layout of package {}", file.getName().getName());
		NodeWalker.apply(file, this::enter, this::leave);
	}

	TraversalContext context() {
		return context;
	}

	private void enter(Cursor cursor) {
		if (longLines != null) {
			longLines.apply(cursor);
		}

		Node node = cursor.node();
		switch (node.kind()) {
			case SOURCE_FILE:
				declarationJoiner.apply(file);
				commentSpacing.apply(file.getComments());
				break;
			case DECL_STMT:
				varDecls.toAssignment(cursor);
				break;
			case GEN_DECL: {
				GenDecl decl = (GenDecl) node;
				importGrouper.apply(decl);
				varDecls.dropRedundantParens(decl);
				break;
			}
			case BLOCK_STMT: {
				BlockStmt block = (BlockStmt) node;
				errorGuards.apply(block.getList());
				blockCollapser.apply(block, cursor.parent());
				break;
			}
			case CASE_CLAUSE: {
				CaseClause clause = (CaseClause) node;
				errorGuards.apply(clause.getBody());
				clauseCollapser.apply(clause);
				break;
			}
			case COMM_CLAUSE: {
				CommClause clause = (CommClause) node;
				errorGuards.apply(clause.getBody());
				clauseCollapser.apply(clause);
				break;
			}
			case FIELD_LIST:
				fieldLists.apply((FieldList) node, cursor.parent());
				break;
			case BASIC_LIT:
				octalLiterals.apply((BasicLit) node);
				break;
			default:
				break;
		}

		node = cursor.node();
		switch (node.kind()) {
			case FUNC_DECL:
				context.setTopFuncType(((FuncDecl) node).getType());
				break;
			case FIELD_LIST: {
				FuncType top = context.getTopFuncType();
				if (top == null || cursor.parent() != top) {
					break;
				}
				// longer halves for top-level parameters; results are never split
				if (top.getParams() == node) {
					context.setMinSplitFactor(LayoutLimits.PARAMS_SPLIT_FACTOR);
				}
				if (top.getResults() == node) {
					context.setMinSplitFactor(LayoutLimits.RESULTS_SPLIT_FACTOR);
				}
				break;
			}
			case BLOCK_STMT:
				context.enterBlock();
				break;
			default:
				break;
		}
	}

	private void leave(Cursor cursor) {
		Node node = cursor.node();
		switch (node.kind()) {
			case COMPOSITE_LIT:
				compositeLiterals.apply((CompositeLit) node);
				break;
			case FUNC_TYPE:
				if (node == context.getTopFuncType()) {
					context.resetMinSplitFactor();
				}
				break;
			case BLOCK_STMT:
				context.leaveBlock();
				break;
			default:
				break;
		}
	}
}
