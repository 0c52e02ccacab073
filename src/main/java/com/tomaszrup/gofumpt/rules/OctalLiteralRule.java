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

import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.gofumpt.ast.BasicLit;
import com.tomaszrup.gofumpt.util.LanguageVersion;

/**
 * Spells legacy octal integers such as {@code 0755} as {@code 0o755}, for
 * code targeting Go 1.13 or later.
 */
public class OctalLiteralRule {
	private static final Logger logger = LoggerFactory.getLogger(OctalLiteralRule.class);

	private static final Pattern LEGACY_OCTAL = Pattern.compile("\\A0[0-7_]+\\z");

	private final boolean enabled;

	public OctalLiteralRule(LanguageVersion langVersion) {
		this.enabled = langVersion.isAtLeast(LanguageVersion.V1_13);
	}

	public void apply(BasicLit lit) {
		if (!enabled || lit.getLitKind() != BasicLit.LitKind.INT) {
			return;
		}
		String value = lit.getValue();
		if (LEGACY_OCTAL.matcher(value).matches()) {
			lit.setValue("0o" + value.substring(1));
			logger.debug("Rewrote octal literal {} as {}", value, lit.getValue());
		}
	}
}
