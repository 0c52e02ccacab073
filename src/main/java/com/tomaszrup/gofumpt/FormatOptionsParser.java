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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.gofumpt.layout.LayoutLimits;

/**
 * Reads {@link FormatOptions} from a JSON object such as
 * <pre>
 * {"langVersion": "1.21", "extraRules": true, "logLevel": "DEBUG"}
 * </pre>
 * Unknown keys are ignored. Malformed values are logged and skipped, so a
 * bad entry never prevents formatting with the remaining options.
 */
public final class FormatOptionsParser {

    private static final Logger logger = LoggerFactory.getLogger(FormatOptionsParser.class);

    static final String LANG_VERSION_OPTION = "langVersion";
    static final String EXTRA_RULES_OPTION = "extraRules";
    static final String SPLIT_LONG_LINES_OPTION = "splitLongLines";
    static final String LOG_LEVEL_OPTION = "logLevel";
    static final String SHORT_LINE_LIMIT_OPTION = "shortLineLimit";
    static final String LONG_LINE_LIMIT_OPTION = "longLineLimit";

    private static final String LOGBACK_PACKAGE = "ch.qos.logback.";

    /**
     * Parses a JSON document.
     *
     * @throws IllegalArgumentException if {@code json} is not a JSON object
     */
    public static FormatOptions parse(String json, Map<String, String> env) {
        JsonElement element;
        try {
            element = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("malformed options: " + e.getMessage(), e);
        }
        if (!element.isJsonObject()) {
            throw new IllegalArgumentException("options must be a JSON object");
        }
        return parse(element.getAsJsonObject(), env);
    }

    /**
     * Builds options from {@code opts}; the environment only decides long
     * line splitting when the JSON does not.
     */
    public static FormatOptions parse(JsonObject opts, Map<String, String> env) {
        applyLogLevelOption(opts);

        FormatOptions.Builder builder = FormatOptions.builder().environment(env);
        parseLangVersionOption(opts, builder);

        Boolean extraRules = booleanOption(opts, EXTRA_RULES_OPTION);
        if (extraRules != null) {
            builder.extraRules(extraRules);
            logger.info("Extra rules: {}", extraRules);
        }
        Boolean splitLongLines = booleanOption(opts, SPLIT_LONG_LINES_OPTION);
        if (splitLongLines != null) {
            builder.splitLongLines(splitLongLines);
            logger.info("Split long lines: {}", splitLongLines);
        }
        builder.layoutLimits(parseLayoutLimits(opts));
        return builder.build();
    }

    private static void parseLangVersionOption(JsonObject opts, FormatOptions.Builder builder) {
        if (!opts.has(LANG_VERSION_OPTION) || !opts.get(LANG_VERSION_OPTION).isJsonPrimitive()) {
            return;
        }
        String version = opts.get(LANG_VERSION_OPTION).getAsString();
        try {
            builder.langVersion(version);
            logger.info("Language version: {}", version);
        } catch (IllegalArgumentException e) {
            logger.warn("Ignoring language version '{}': {}", version, e.getMessage());
        }
    }

    private static LayoutLimits parseLayoutLimits(JsonObject opts) {
        LayoutLimits limits = LayoutLimits.DEFAULT;
        Integer shortLimit = positiveIntOption(opts, SHORT_LINE_LIMIT_OPTION);
        if (shortLimit != null) {
            limits = limits.withShortLineLimit(shortLimit);
            logger.info("Short line limit: {}", shortLimit);
        }
        Integer longLimit = positiveIntOption(opts, LONG_LINE_LIMIT_OPTION);
        if (longLimit != null) {
            limits = limits.withLongLineLimit(longLimit);
            logger.info("Long line limit: {}", longLimit);
        }
        return limits;
    }

    private static Boolean booleanOption(JsonObject opts, String name) {
        if (!opts.has(name)) {
            return null;
        }
        JsonElement value = opts.get(name);
        if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isBoolean()) {
            logger.warn("Ignoring option '{}': expected a boolean but got {}", name, value);
            return null;
        }
        return value.getAsBoolean();
    }

    private static Integer positiveIntOption(JsonObject opts, String name) {
        if (!opts.has(name)) {
            return null;
        }
        JsonElement value = opts.get(name);
        if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isNumber()) {
            double number = value.getAsDouble();
            if (number > 0 && number <= Integer.MAX_VALUE && number == Math.rint(number)) {
                return (int) number;
            }
        }
        logger.warn("Ignoring option '{}': expected a positive integer but got {}", name, value);
        return null;
    }

    private static void applyLogLevelOption(JsonObject opts) {
        if (opts.has(LOG_LEVEL_OPTION) && opts.get(LOG_LEVEL_OPTION).isJsonPrimitive()) {
            applyLogLevel(opts.get(LOG_LEVEL_OPTION).getAsString());
        }
    }

    /**
     * Dynamically set the Logback root logger level from a string value.
     * Accepted values (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE.
     * Invalid values are ignored and a warning is logged.
     */
    static void applyLogLevel(String levelName) {
        if (!LoggerFactory.getILoggerFactory().getClass().getName().startsWith(LOGBACK_PACKAGE)) {
            logger.warn("Cannot set log level to '{}': logging is not backed by Logback", levelName);
            return;
        }
        LogbackLevels.apply(levelName);
    }

    // loaded only once Logback is known to be bound, so it stays optional
    private static final class LogbackLevels {

        static void apply(String levelName) {
            ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
            if (level == null) {
                logger.warn("Unknown log level '{}', keeping current level", levelName);
                return;
            }
            ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
                    LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            ch.qos.logback.classic.Level previous = root.getLevel();
            root.setLevel(level);
            logger.info("Log level changed from {} to {}", previous, level);
        }

        private LogbackLevels() {
        }
    }

    private FormatOptionsParser() {
        // utility class
    }
}
