/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.patricia.config;

import com.google.common.collect.ImmutableMap;
import org.junit.After;
import org.junit.Test;

import org.patricia.exceptions.ConfigurationException;
import org.patricia.tries.PatriciaTrie;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class PatriciaRelevantPropertiesTest
{
    @After
    public void clearProperties()
    {
        for (PatriciaRelevantProperties property : PatriciaRelevantProperties.values())
            property.clearValue();
    }

    @Test
    public void testDefaults()
    {
        assertFalse(PatriciaRelevantProperties.VERIFY_INVARIANTS.isPresent());
        assertFalse(PatriciaRelevantProperties.VERIFY_INVARIANTS.getBoolean());
        assertEquals(-1, PatriciaRelevantProperties.TO_STRING_MAX_ENTRIES.getInt());
        assertEquals("patricia.trie.verify_invariants", PatriciaRelevantProperties.VERIFY_INVARIANTS.getKey());
    }

    @Test
    public void testSetAndReset()
    {
        assertNull(PatriciaRelevantProperties.VERIFY_INVARIANTS.setBoolean(true));
        assertTrue(PatriciaRelevantProperties.VERIFY_INVARIANTS.getBoolean());
        assertTrue(PatriciaRelevantProperties.VERIFY_INVARIANTS.setBoolean(false));

        assertNull(PatriciaRelevantProperties.TO_STRING_MAX_ENTRIES.setInt(5));
        assertEquals(5, (int) PatriciaRelevantProperties.TO_STRING_MAX_ENTRIES.setInt(7));
        assertEquals("7", PatriciaRelevantProperties.TO_STRING_MAX_ENTRIES.getString());

        PatriciaRelevantProperties.TO_STRING_MAX_ENTRIES.reset();
        assertTrue(PatriciaRelevantProperties.TO_STRING_MAX_ENTRIES.isPresent());
        assertEquals("-1", PatriciaRelevantProperties.TO_STRING_MAX_ENTRIES.getString());
        assertEquals(-1, PatriciaRelevantProperties.TO_STRING_MAX_ENTRIES.getInt());
    }

    @Test
    public void testInvalidInteger()
    {
        System.setProperty(PatriciaRelevantProperties.TO_STRING_MAX_ENTRIES.getKey(), "many");
        assertThatThrownBy(PatriciaRelevantProperties.TO_STRING_MAX_ENTRIES::getInt)
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("'many'");
    }

    @Test
    public void testToStringLimit()
    {
        PatriciaTrie<Integer> trie = PatriciaTrie.of(ImmutableMap.of("a", 1, "b", 2, "c", 3));
        PatriciaRelevantProperties.TO_STRING_MAX_ENTRIES.setInt(2);
        assertEquals("PatriciaTrie{a=1, b=2, ...}", trie.toString());
        PatriciaRelevantProperties.TO_STRING_MAX_ENTRIES.setInt(0);
        assertEquals("PatriciaTrie{...}", trie.toString());
        PatriciaRelevantProperties.TO_STRING_MAX_ENTRIES.setInt(3);
        assertEquals("PatriciaTrie{a=1, b=2, c=3}", trie.toString());
    }

    @Test
    public void testVerifiedInsertions()
    {
        PatriciaRelevantProperties.VERIFY_INVARIANTS.setBoolean(true);
        PatriciaTrie<Integer> trie = PatriciaTrie.of(ImmutableMap.of("romane", 1, "romanus", 2, "romulus", 3, "rubens", 4, "ruber", 5));
        assertThat(trie.keysWithPrefix("rom")).containsExactlyInAnyOrder("romane", "romanus", "romulus");
        assertThat(trie.keysWithPrefix("rub")).containsExactlyInAnyOrder("rubens", "ruber");
    }
}
