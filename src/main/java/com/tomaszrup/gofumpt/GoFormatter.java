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
package com.tomaszrup.gofumpt;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.gofumpt.ast.SourceFile;
import com.tomaszrup.gofumpt.layout.LineTable;
import com.tomaszrup.gofumpt.rewrite.LayoutRewriter;

/**
 * Entry point: applies the stricter layout rules to Go code.
 *
 * <p>Parsing and printing are left to the {@link SourceParser} and
 * {@link SourcePrinter} given at construction. The formatter keeps no
 * state between calls, so one instance can serve several threads as long
 * as each call gets its own tree.
 */
public class GoFormatter {
	private static final Logger logger = LoggerFactory.getLogger(GoFormatter.class);

	private final SourceParser parser;
	private final SourcePrinter printer;

	public GoFormatter(SourceParser parser, SourcePrinter printer) {
		this.parser = Objects.requireNonNull(parser, "parser");
		this.printer = Objects.requireNonNull(printer, "printer");
	}

	/**
	 * Parses, rewrites and prints {@code source}.
	 *
	 * @throws SourceParseException if the source does not parse; no rule has
	 *                              run at that point
	 */
	public String source(String source, FormatOptions options) throws SourceParseException {
		ParsedSource parsed = parser.parse(source);
		FormatResult result = file(parsed.getFile(), parsed.getLines(), options);
		return printer.print(result.getFile(), result.getLines());
	}

	/**
	 * Rewrites {@code file} and {@code lines} in place.
	 *
	 * @throws com.tomaszrup.gofumpt.layout.LayoutInvariantException if a
	 *         rule would corrupt the line table; the tree is then unusable
	 */
	public static FormatResult file(SourceFile file, LineTable lines, FormatOptions options) {
		Objects.requireNonNull(options, "options");
		long startNanos = System.nanoTime();
		new LayoutRewriter(file, lines, options).rewrite();
		if (logger.isDebugEnabled()) {
			logger.debug("Formatted package {} ({} lines) in {} us with {}", file.getName().getName(),
					lines.lineCount(), (System.nanoTime() - startNanos) / 1000, options);
		}
		return new FormatResult(file, lines);
	}
}
