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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.gofumpt.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LanguageVersionTests {

    @Test
    void parseDefaultsEmptyToV1() {
        assertEquals("v1", LanguageVersion.parse("").toString());
        assertEquals("v1", LanguageVersion.parse(null).toString());
        assertEquals(LanguageVersion.DEFAULT, LanguageVersion.parse("v1.0.0"));
    }

    @Test
    void parseAddsMissingPrefix() {
        LanguageVersion version = LanguageVersion.parse("1.14");
        assertEquals("v1.14", version.toString());
        assertEquals(1, version.getMajor());
        assertEquals(14, version.getMinor());
        assertEquals(0, version.getPatch());
    }

    @Test
    void parseRejectsInvalidVersions() {
        assertThrows(IllegalArgumentException.class, () -> LanguageVersion.parse("go1.14"));
        assertThrows(IllegalArgumentException.class, () -> LanguageVersion.parse("v1.014"));
        assertThrows(IllegalArgumentException.class, () -> LanguageVersion.parse("v1.2.3.4"));
        assertThrows(IllegalArgumentException.class, () -> LanguageVersion.parse("v1.2-rc1"));
    }

    @Test
    void incompleteVersionsCompareAsZeroFilled() {
        assertEquals(0, LanguageVersion.parse("1.13").compareTo(LanguageVersion.parse("1.13.0")));
        assertTrue(LanguageVersion.parse("1.13.1").isAtLeast(LanguageVersion.V1_13));
        assertFalse(LanguageVersion.parse("1.12.17").isAtLeast(LanguageVersion.V1_13));
        assertTrue(LanguageVersion.parse("2").isAtLeast(LanguageVersion.V1_13));
    }

    @Test
    void prereleaseSortsBeforeRelease() {
        LanguageVersion rc = LanguageVersion.parse("v1.13.0-rc.1");
        assertTrue(rc.isPrerelease());
        assertFalse(rc.isAtLeast(LanguageVersion.V1_13));
        assertTrue(LanguageVersion.parse("v1.13.0-rc.2").compareTo(rc) > 0);
        assertTrue(LanguageVersion.parse("v1.13.0-rc.10").compareTo(LanguageVersion.parse("v1.13.0-rc.9")) > 0);
        assertTrue(LanguageVersion.parse("v1.13.0-beta").compareTo(LanguageVersion.parse("v1.13.0-alpha")) > 0);
    }

    @Test
    void buildMetadataIsIgnored() {
        assertEquals(LanguageVersion.parse("v1.21.0"), LanguageVersion.parse("v1.21.0+build.5"));
        assertEquals(LanguageVersion.parse("v1.21.0").hashCode(), LanguageVersion.parse("v1.21.0+build.5").hashCode());
    }
}
