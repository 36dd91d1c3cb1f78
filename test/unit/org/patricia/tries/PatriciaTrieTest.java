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
package org.patricia.tries;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class PatriciaTrieTest
{
    static final String TEXT = "The fool baal baarhus in the bazar!";

    static PatriciaTrie<Integer> scanTrie()
    {
        Map<String, Integer> entries = new LinkedHashMap<>();
        entries.put("foo", 1);
        entries.put("baar", 2);
        entries.put("baarhus", 3);
        entries.put("bazar", 4);
        return PatriciaTrie.of(entries);
    }

    @Test
    public void testInitContains()
    {
        PatriciaTrie<String> trie = new PatriciaTrie<>();
        trie.set("key", "value");
        trie = PatriciaTrie.copyOf(trie);
        assertTrue(trie.contains("key"));
        assertFalse(trie.contains("keys"));
        assertFalse(trie.contains("ke"));
        assertFalse(trie.contains("kex"));
    }

    @Test
    public void testSetGetDelete()
    {
        PatriciaTrie<Integer> trie = new PatriciaTrie<>();
        trie.set("foo", 1);
        trie.set("bar", 2);
        trie.set("baz", 3);
        assertTrue(trie.contains("foo"));
        assertTrue(trie.contains("bar"));
        assertTrue(trie.contains("baz"));
        assertEquals(1, (int) trie.get("foo"));
        assertEquals(2, (int) trie.get("bar"));
        assertEquals(3, (int) trie.get("baz"));
        assertThatThrownBy(() -> trie.get("ba")).isInstanceOf(KeyNotFoundException.class);
        assertThatThrownBy(() -> trie.get("fool")).isInstanceOf(KeyNotFoundException.class);

        assertEquals(2, (int) trie.delete("bar"));
        assertThatThrownBy(() -> trie.get("bar")).isInstanceOf(KeyNotFoundException.class);
        assertEquals(3, (int) trie.get("baz"));
        assertEquals(2, trie.count());
    }

    @Test
    public void testDeleteMissingKey()
    {
        PatriciaTrie<Integer> trie = PatriciaTrie.of(ImmutableMap.of("bar", 2, "baz", 3));
        assertThatThrownBy(() -> trie.delete("ba")).isInstanceOf(KeyNotFoundException.class);
        assertThatThrownBy(() -> trie.delete("qux")).isInstanceOf(KeyNotFoundException.class);

        trie.delete("bar");
        assertThatThrownBy(() -> trie.delete("bar")).isInstanceOf(KeyNotFoundException.class);
        assertEquals(1, trie.count());
    }

    @Test
    public void testEmptyStringKey()
    {
        PatriciaTrie<Integer> trie = new PatriciaTrie<>();
        trie.set("foo", 1);
        trie.set("", 2);
        assertTrue(trie.contains("foo"));
        assertTrue(trie.contains(""));
        assertEquals(2, (int) trie.get(""));

        trie.delete("");
        assertFalse(trie.contains(""));
        assertThatThrownBy(() -> trie.get("")).isInstanceOf(KeyNotFoundException.class);
    }

    @Test
    public void testIterator()
    {
        PatriciaTrie<Integer> trie = new PatriciaTrie<>();
        trie.set("ba", 2);
        trie.set("baz", 3);
        trie.set("fool", 1);
        assertThat(trie).containsExactlyInAnyOrder("fool", "ba", "baz");

        trie.set("", 0);
        assertThat(trie).containsExactlyInAnyOrder("", "fool", "ba", "baz");
    }

    @Test
    public void testValues()
    {
        PatriciaTrie<Object> trie = new PatriciaTrie<>();
        trie.set("ba", 2);
        trie.set("baz", "hey's");
        trie.set("fool", 1.5);
        assertThat(trie.values()).containsExactlyInAnyOrder(2, "hey's", 1.5);
    }

    @Test
    public void testItems()
    {
        PatriciaTrie<Integer> trie = PatriciaTrie.of(ImmutableMap.of("ba", 2, "baz", 3, "fool", 1));
        List<Map.Entry<String, Integer>> items = Lists.newArrayList(trie.items());
        assertEquals(ImmutableList.of(Map.entry("ba", 2), Map.entry("baz", 3), Map.entry("fool", 1)), items);
    }

    @Test
    public void testToString()
    {
        PatriciaTrie<Object> trie = new PatriciaTrie<>();
        trie.set("ba", 2);
        trie.set("baz", "hey's");
        trie.set("fool", 1.5);
        assertEquals("PatriciaTrie{ba=2, baz=hey's, fool=1.5}", trie.toString());
        assertEquals("PatriciaTrie{}", new PatriciaTrie<>().toString());
    }

    @Test
    public void testLongestItem()
    {
        PatriciaTrie<Integer> trie = new PatriciaTrie<>();
        trie.set("ba", 2);
        trie.set("baz", 3);
        trie.set("fool", 1);

        Match<Integer> match = trie.longestMatch("bar");
        assertEquals("ba", match.key());
        assertEquals(2, (int) match.value());
        assertEquals(1, (int) trie.value("fool"));
        assertThatThrownBy(() -> trie.key("foo")).isInstanceOf(KeyNotFoundException.class);

        trie.set("", 0);
        assertEquals(new Match<>("", 0, 0, 0), trie.longestMatch(""));
        assertEquals("", trie.key("foo"));
    }

    @Test
    public void testDefaultIsNotConfusedWithAbsence()
    {
        PatriciaTrie<Integer> trie = new PatriciaTrie<>();
        Match<Integer> match = trie.longestMatch("foo", 0, 3, null);
        assertTrue(match.isDefault());
        assertNull(match.key());
        assertNull(match.value());
        assertNull(trie.value("foo", 0, 3, null));
        assertNull(trie.get("foo", null));

        trie.set("foo", null);
        assertTrue(trie.contains("foo"));
        assertNull(trie.get("foo"));
        Match<Integer> stored = trie.longestMatch("foo", 0, 3, 42);
        assertFalse(stored.isDefault());
        assertEquals("foo", stored.key());
        assertNull(stored.value());

        // a stored null wins over the default, only absent or deleted keys fall back to it
        assertNull(trie.get("foo", 42));
        trie.set("bar", 7);
        assertEquals(7, (int) trie.get("bar", 42));
        assertEquals(42, (int) trie.get("ba", 42));
        assertEquals(42, (int) trie.get("bars", 42));
        trie.delete("bar");
        assertEquals(42, (int) trie.get("bar", 42));
    }

    @Test
    public void testRootValue()
    {
        PatriciaTrie<List<Integer>> trie = new PatriciaTrie<>(Arrays.asList(1, 2));
        assertEquals(Arrays.asList(1, 2), trie.get(""));
        assertEquals(1, trie.count());

        PatriciaTrie<String> loaded = PatriciaTrie.of("root", ImmutableMap.of("key", "value", "king", "kong"));
        assertEquals(3, loaded.count());
        assertEquals("root", loaded.value("keys and kewl stuff", 1));
        assertEquals("value", loaded.value("keys and kewl stuff"));
    }

    @Test
    public void testMatchingIterables()
    {
        PatriciaTrie<Integer> trie = new PatriciaTrie<>();
        trie.set("ba", 2);
        trie.set("baz", 3);
        trie.set("fool", 1);
        assertThat(trie.keys("bazar")).containsExactly("ba", "baz");
        assertThat(trie.allMatches("fools")).containsExactly(new Match<>("fool", 0, 4, 1));
        assertThat(trie.values("others")).isEmpty();
        assertThat(trie.values("bazar")).containsExactly(2, 3);
        assertThat(trie.items("bazar")).containsExactly(Map.entry("ba", 2), Map.entry("baz", 3));

        PatriciaTrie<Integer> scan = scanTrie();
        assertThat(scan.items(TEXT, 14)).containsExactly(Map.entry("baar", 2), Map.entry("baarhus", 3));
        assertThat(scan.keys(TEXT, 14, 20)).containsExactly("baar");
        assertThat(scan.values(TEXT, -6)).containsExactly(4);
    }

    @Test
    public void testIsPrefix()
    {
        PatriciaTrie<Integer> trie = new PatriciaTrie<>();
        trie.set("bar", 2);
        trie.set("baz", 3);
        trie.set("fool", 1);
        assertTrue(trie.isPrefix("ba"));
        assertTrue(trie.isPrefix("fo"));
        assertTrue(trie.isPrefix("fool"));
        assertFalse(trie.isPrefix("fools"));
        assertFalse(trie.isPrefix("bax"));
        assertTrue(trie.isPrefix(""));
    }

    @Test
    public void testIterPrefix()
    {
        PatriciaTrie<Integer> trie = new PatriciaTrie<>();
        trie.set("b", 1);
        trie.set("baar", 2);
        trie.set("baahus", 3);
        assertThat(trie.keysWithPrefix("ba")).containsExactlyInAnyOrder("baar", "baahus");
        assertThat(trie.keysWithPrefix("baa")).containsExactlyInAnyOrder("baar", "baahus");
        assertThat(trie.keysWithPrefix("b")).containsExactlyInAnyOrder("b", "baar", "baahus");
        assertThat(trie.keysWithPrefix("baah")).containsExactly("baahus");
        assertThat(trie.keysWithPrefix("others")).isEmpty();
        assertThat(trie.keysWithPrefix("baarx")).isEmpty();
        assertThat(trie.valuesWithPrefix("ba")).containsExactlyInAnyOrder(2, 3);
        assertThat(trie.itemsWithPrefix("baa")).containsExactlyInAnyOrder(Map.entry("baar", 2), Map.entry("baahus", 3));
    }

    @Test
    public void testOffsetMatching()
    {
        PatriciaTrie<Integer> trie = scanTrie();
        List<Integer> values = Lists.newArrayList();
        List<String> keys = Lists.newArrayList();
        List<Match<Integer>> items = Lists.newArrayList();
        for (int i = 0; i < TEXT.length(); ++i)
        {
            trie.values(TEXT, i).forEach(values::add);
            trie.keys(TEXT, i).forEach(keys::add);
            trie.allMatches(TEXT, i).forEach(items::add);
        }
        assertEquals(ImmutableList.of(1, 2, 3, 4), values);
        assertEquals(ImmutableList.of("foo", "baar", "baarhus", "bazar"), keys);
        assertEquals(ImmutableList.of(new Match<>("foo", 4, 7, 1),
                                      new Match<>("baar", 14, 18, 2),
                                      new Match<>("baarhus", 14, 21, 3),
                                      new Match<>("bazar", 29, 34, 4)),
                     items);
    }

    @Test
    public void testLongestMatchAtEachOccurrence()
    {
        PatriciaTrie<Integer> trie = scanTrie();
        assertEquals(1, (int) trie.value(TEXT, TEXT.indexOf("fool")));
        assertEquals(3, (int) trie.value(TEXT, TEXT.indexOf("baarhus")));
        assertEquals(4, (int) trie.value(TEXT, TEXT.indexOf("bazar")));
        assertThatThrownBy(() -> trie.value(TEXT, TEXT.indexOf("baal"))).isInstanceOf(KeyNotFoundException.class);
        assertEquals(-1, (int) trie.value(TEXT, TEXT.indexOf("baal"), TEXT.length(), -1));
    }

    @Test
    public void testKeyPresenceOnly()
    {
        PatriciaTrie<Boolean> trie = PatriciaTrie.of(ImmutableMap.of("foo", true, "baar", true, "baarhus", true, "bazar", true));
        List<Integer> presence = Lists.newArrayList();
        for (int i = 0; i < TEXT.length(); ++i)
        {
            if (trie.value(TEXT, i, TEXT.length(), false))
                presence.add(i);
        }
        assertEquals(ImmutableList.of(4, 14, 29), presence);
    }

    @Test
    public void testOverwriteKeepsCount()
    {
        PatriciaTrie<String> trie = new PatriciaTrie<>();
        trie.set("key", "first");
        trie.set("key", "second");
        assertEquals("second", trie.get("key"));
        assertEquals(1, trie.count());
    }

    @Test
    public void testDeleteLeavesSiblingsIntact()
    {
        PatriciaTrie<Integer> trie = PatriciaTrie.of(ImmutableMap.of("bar", 1, "barking", 2, "baz", 3));
        trie.delete("bar");
        assertEquals(2, trie.count());
        assertEquals(2, (int) trie.get("barking"));
        assertEquals(3, (int) trie.get("baz"));
        assertEquals("barking", trie.key("barking mad"));

        trie.set("bar", 4);
        assertEquals(3, trie.count());
        assertEquals(2, (int) trie.get("barking"));
        assertEquals(3, (int) trie.get("baz"));
        assertEquals(ImmutableList.of("bar", "barking"), Lists.newArrayList(trie.keys("barking mad")));
    }

    @Test
    public void testIsEmpty()
    {
        PatriciaTrie<Integer> trie = new PatriciaTrie<>();
        assertTrue(trie.isEmpty());
        trie.set("a", 1);
        assertFalse(trie.isEmpty());
        trie.delete("a");
        assertTrue(trie.isEmpty());
        assertEquals(0, trie.count());
    }

    @Test
    public void testNullKeysAreRejected()
    {
        PatriciaTrie<Integer> trie = new PatriciaTrie<>();
        assertThatThrownBy(() -> trie.set(null, 1)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> trie.contains(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> trie.longestMatch(null)).isInstanceOf(NullPointerException.class);
    }
}
