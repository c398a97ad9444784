/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.ghaverify.core;

import dev.mars.ghaverify.core.exceptions.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FixTagTest {

    @ParameterizedTest
    @CsvSource({
            "permissions, PERMISSIONS",
            "smell_3, PERMISSIONS",
            "TIMEOUT, TIMEOUT",
            "smell_7, CONCURRENCY",
            "fork-prevention, FORK_PREVENTION",
            "smell_10, FORK_PREVENTION",
            "fork_prevention, FORK_PREVENTION",
            "smell_8, PATH_FILTER",
            "continue-on-error, CONTINUE_ON_ERROR",
            "smell_18, PACKAGE_PINNING"
    })
    void testParseIdsAndAliases(String value, FixTag expected) throws ConfigurationException {
        assertEquals(expected, FixTag.parse(value));
    }

    @Test
    void testParseUnknownTag() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> FixTag.parse("smell_99"));

        assertEquals("permitted-fixes", e.getPropertyName());
        assertTrue(e.getMessage().contains("smell_99"));
    }

    @Test
    void testParseBlankTag() {
        assertThrows(ConfigurationException.class, () -> FixTag.parse(" "));
    }

    @Test
    void testParseList() throws ConfigurationException {
        assertEquals(EnumSet.of(FixTag.PERMISSIONS, FixTag.TIMEOUT), FixTag.parseList("permissions, smell_6,"));
        assertEquals(Set.of(), FixTag.parseList(""));
        assertEquals(Set.of(), FixTag.parseList(null));
        assertEquals(EnumSet.allOf(FixTag.class), FixTag.parseList("ALL"));
    }

    @Test
    void testToStringIsId() {
        assertEquals("fork-prevention", FixTag.FORK_PREVENTION.toString());
    }
}
