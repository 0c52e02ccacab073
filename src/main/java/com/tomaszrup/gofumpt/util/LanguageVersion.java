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
package com.tomaszrup.gofumpt.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Go language version the formatted code targets, in semantic version form
 * ({@code v1}, {@code v1.13}, {@code v1.21.0-rc.1}). Missing minor and patch
 * numbers count as zero.
 */
public final class LanguageVersion implements Comparable<LanguageVersion> {

    private static final Pattern SEMVER = Pattern.compile(
            "^v(0|[1-9]\\d*)(?:\\.(0|[1-9]\\d*)(?:\\.(0|[1-9]\\d*)"
                    + "(?:-([0-9A-Za-z.-]+))?(?:\\+([0-9A-Za-z.-]+))?)?)?$");

    /** Used when no version is configured. */
    public static final LanguageVersion DEFAULT = parse("");

    /** First version with {@code 0o} octal literals. */
    public static final LanguageVersion V1_13 = parse("v1.13");

    private final String text;
    private final int major;
    private final int minor;
    private final int patch;
    private final String prerelease;

    private LanguageVersion(String text, int major, int minor, int patch, String prerelease) {
        this.text = text;
        this.major = major;
        this.minor = minor;
        this.patch = patch;
        this.prerelease = prerelease;
    }

    /**
     * Parses a version, adding the {@code v} prefix when it is missing. The
     * empty string means {@code v1}.
     *
     * @throws IllegalArgumentException if the result is not a valid version
     */
    public static LanguageVersion parse(String version) {
        String normalized = version == null ? "" : version.trim();
        if (normalized.isEmpty()) {
            normalized = "v1";
        } else if (normalized.charAt(0) != 'v') {
            normalized = "v" + normalized;
        }
        Matcher m = SEMVER.matcher(normalized);
        if (!m.matches()) {
            throw new IllegalArgumentException("invalid Go version: \"" + version + "\"");
        }
        try {
            return new LanguageVersion(normalized,
                    Integer.parseInt(m.group(1)),
                    m.group(2) != null ? Integer.parseInt(m.group(2)) : 0,
                    m.group(3) != null ? Integer.parseInt(m.group(3)) : 0,
                    m.group(4));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid Go version: \"" + version + "\"", e);
        }
    }

    public int getMajor() {
        return major;
    }

    public int getMinor() {
        return minor;
    }

    public int getPatch() {
        return patch;
    }

    public boolean isPrerelease() {
        return prerelease != null;
    }

    public boolean isAtLeast(LanguageVersion other) {
        return compareTo(other) >= 0;
    }

    @Override
    public int compareTo(LanguageVersion other) {
        if (major != other.major) {
            return Integer.compare(major, other.major);
        }
        if (minor != other.minor) {
            return Integer.compare(minor, other.minor);
        }
        if (patch != other.patch) {
            return Integer.compare(patch, other.patch);
        }
        boolean release = prerelease == null;
        boolean otherRelease = other.prerelease == null;
        if (release || otherRelease) {
            return Boolean.compare(release, otherRelease);
        }
        return comparePrerelease(prerelease, other.prerelease);
    }

    // dot-separated identifiers; numeric ones compare numerically and sort first
    private static int comparePrerelease(String left, String right) {
        String[] a = left.split("\\.");
        String[] b = right.split("\\.");
        int common = Math.min(a.length, b.length);
        for (int i = 0; i < common; i++) {
            boolean aNumeric = isNumeric(a[i]);
            boolean bNumeric = isNumeric(b[i]);
            int result;
            if (aNumeric && bNumeric) {
                result = a[i].length() != b[i].length()
                        ? Integer.compare(a[i].length(), b[i].length())
                        : a[i].compareTo(b[i]);
            } else if (aNumeric != bNumeric) {
                result = aNumeric ? -1 : 1;
            } else {
                result = a[i].compareTo(b[i]);
            }
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(a.length, b.length);
    }

    private static boolean isNumeric(String identifier) {
        if (identifier.isEmpty()) {
            return false;
        }
        for (int i = 0; i < identifier.length(); i++) {
            if (!Character.isDigit(identifier.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LanguageVersion)) {
            return false;
        }
        return compareTo((LanguageVersion) o) == 0;
    }

    @Override
    public int hashCode() {
        int result = major;
        result = 31 * result + minor;
        result = 31 * result + patch;
        result = 31 * result + (prerelease != null ? prerelease.hashCode() : 0);
        return result;
    }

    @Override
    public String toString() {
        return text;
    }
}
