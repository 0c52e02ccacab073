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

import java.util.Map;
import java.util.Objects;

import com.tomaszrup.gofumpt.layout.LayoutLimits;
import com.tomaszrup.gofumpt.util.LanguageVersion;

/**
 * Immutable formatting options.
 *
 * <ul>
 *   <li>{@code langVersion}: Go version the code targets; rules needing newer
 *   syntax only fire at or above it. Defaults to {@code v1}.</li>
 *   <li>{@code extraRules}: enables merging of adjacent parameters with the
 *   same type.</li>
 *   <li>{@code splitLongLines}: enables the experimental long line splitting.
 *   Off unless {@value #SPLIT_LONG_LINES_ENV}{@code =on} is set or the option
 *   is given explicitly.</li>
 *   <li>{@code layoutLimits}: thresholds of the length estimates.</li>
 * </ul>
 */
public final class FormatOptions {

    public static final String SPLIT_LONG_LINES_ENV = "GOFUMPT_SPLIT_LONG_LINES";

    private final LanguageVersion langVersion;
    private final boolean extraRules;
    private final boolean splitLongLines;
    private final LayoutLimits layoutLimits;

    private FormatOptions(Builder builder) {
        this.langVersion = builder.langVersion;
        this.extraRules = builder.extraRules;
        this.splitLongLines = builder.splitLongLines;
        this.layoutLimits = builder.layoutLimits;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default options, with long line splitting taken from the process
     * environment.
     */
    public static FormatOptions fromEnvironment() {
        return builder().environment(System.getenv()).build();
    }

    public LanguageVersion getLangVersion() {
        return langVersion;
    }

    public boolean isExtraRules() {
        return extraRules;
    }

    public boolean isSplitLongLines() {
        return splitLongLines;
    }

    public LayoutLimits getLayoutLimits() {
        return layoutLimits;
    }

    public Builder toBuilder() {
        return new Builder()
                .langVersion(langVersion)
                .extraRules(extraRules)
                .splitLongLines(splitLongLines)
                .layoutLimits(layoutLimits);
    }

    @Override
    public String toString() {
        return "FormatOptions[langVersion=" + langVersion + ", extraRules=" + extraRules
                + ", splitLongLines=" + splitLongLines + ", " + layoutLimits + "]";
    }

    public static final class Builder {
        private LanguageVersion langVersion = LanguageVersion.DEFAULT;
        private boolean extraRules;
        private boolean splitLongLines;
        private LayoutLimits layoutLimits = LayoutLimits.DEFAULT;

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException if {@code version} is not a valid
         *                                  semantic version
         */
        public Builder langVersion(String version) {
            this.langVersion = LanguageVersion.parse(version);
            return this;
        }

        public Builder langVersion(LanguageVersion version) {
            this.langVersion = Objects.requireNonNull(version, "version");
            return this;
        }

        public Builder extraRules(boolean extraRules) {
            this.extraRules = extraRules;
            return this;
        }

        public Builder splitLongLines(boolean splitLongLines) {
            this.splitLongLines = splitLongLines;
            return this;
        }

        /**
         * Enables long line splitting when the environment has
         * {@value #SPLIT_LONG_LINES_ENV} set to exactly {@code on}.
         */
        public Builder environment(Map<String, String> env) {
            if ("on".equals(env.get(SPLIT_LONG_LINES_ENV))) {
                this.splitLongLines = true;
            }
            return this;
        }

        public Builder layoutLimits(LayoutLimits layoutLimits) {
            this.layoutLimits = Objects.requireNonNull(layoutLimits, "layoutLimits");
            return this;
        }

        public FormatOptions build() {
            return new FormatOptions(this);
        }
    }
}
