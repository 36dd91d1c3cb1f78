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

import java.util.AbstractMap;
import java.util.Iterator;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Iterables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.patricia.config.PatriciaRelevantProperties;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A PATRICIA trie (compressed prefix tree) mapping string keys to values, built for matching a collection of keys
 * against text.
 * <p>
 * Besides dictionary-like access ({@link #get}, {@link #set}, {@link #delete}, {@link #contains}), the trie can scan a
 * window of a text for the stored keys that are prefixes of it: {@link #longestMatch} reports the longest one,
 * {@link #allMatches} all of them. {@link #keysWithPrefix} and {@link #isPrefix} go the other way and look for stored
 * keys that start with a given string.
 * <p>
 * Keys are sequences of {@code char}s, compared symbol by symbol without any normalization. Values may be null; a
 * stored null is a value like any other. The empty key is stored at the root, and so always matches, with length zero,
 * at the start of any scanned window.
 * <p>
 * Deletion is logical: it clears the value of the key's node but never changes the structure. Tries that see many
 * deletions can be compacted with {@link #copyOf}.
 * <p>
 * Enumeration follows edge insertion order at each level and is not sorted. All iterables returned re-walk the trie
 * from the root on every call to {@code iterator()}; the trie must not be modified while an iterator is in use.
 * Instances are not thread-safe.
 */
public class PatriciaTrie<T> implements Iterable<String>
{
    private static final Logger logger = LoggerFactory.getLogger(PatriciaTrie.class);

    private final Node<T> root = new Node<>();
    private final boolean verifyInvariants = PatriciaRelevantProperties.VERIFY_INVARIANTS.getBoolean();

    public PatriciaTrie()
    {
    }

    /**
     * Creates a trie holding {@code rootValue} as the value of the empty key.
     */
    public PatriciaTrie(@Nullable T rootValue)
    {
        root.value = Value.present(rootValue);
    }

    /**
     * Creates a trie holding the given entries, inserted in the map's iteration order.
     */
    public static <T> PatriciaTrie<T> of(Map<? extends CharSequence, ? extends T> entries)
    {
        PatriciaTrie<T> trie = new PatriciaTrie<>();
        trie.setAll(entries);
        return trie;
    }

    /**
     * Creates a trie holding {@code rootValue} for the empty key and the given entries, inserted in the map's
     * iteration order. An entry for the empty key replaces the root value.
     */
    public static <T> PatriciaTrie<T> of(@Nullable T rootValue, Map<? extends CharSequence, ? extends T> entries)
    {
        PatriciaTrie<T> trie = new PatriciaTrie<>(rootValue);
        trie.setAll(entries);
        return trie;
    }

    /**
     * Creates a compact copy of {@code source}, containing none of the structure left behind by deleted keys.
     */
    public static <T> PatriciaTrie<T> copyOf(PatriciaTrie<? extends T> source)
    {
        PatriciaTrie<T> trie = new PatriciaTrie<>();
        int count = 0;
        for (Map.Entry<String, ? extends T> entry : source.items())
        {
            trie.set(entry.getKey(), entry.getValue());
            ++count;
        }
        logger.debug("Copied {} entries into a compacted trie", count);
        return trie;
    }

    private void setAll(Map<? extends CharSequence, ? extends T> entries)
    {
        for (Map.Entry<? extends CharSequence, ? extends T> entry : entries.entrySet())
            set(entry.getKey(), entry.getValue());
        logger.debug("Loaded {} entries", entries.size());
    }

    /**
     * Associates {@code value} with {@code key}, replacing the value previously stored for it, if any.
     */
    public void set(CharSequence key, @Nullable T value)
    {
        TrieMutator.set(root, checkNotNull(key, "key"), value, verifyInvariants);
    }

    /**
     * Removes {@code key} from the trie.
     *
     * @return the value that was stored for the key.
     * @throws KeyNotFoundException if the key is not in the trie.
     */
    public T delete(CharSequence key)
    {
        return TrieMutator.delete(root, checkNotNull(key, "key"));
    }

    /**
     * @throws KeyNotFoundException if the key is not in the trie.
     */
    public T get(CharSequence key)
    {
        return TrieMatcher.get(root, checkNotNull(key, "key"));
    }

    /**
     * @return the value stored for {@code key}, or {@code defaultValue} if the key is not in the trie.
     */
    public T get(CharSequence key, @Nullable T defaultValue)
    {
        Node<T> node = TrieMatcher.exactNode(root, checkNotNull(key, "key"));
        return node != null && node.isTerminal() ? node.value.get() : defaultValue;
    }

    public boolean contains(CharSequence key)
    {
        return TrieMatcher.contains(root, checkNotNull(key, "key"));
    }

    /**
     * Counts the keys in the trie. This walks the whole trie.
     */
    public int count()
    {
        return TrieEnumerator.count(root);
    }

    public boolean isEmpty()
    {
        return !iterator().hasNext();
    }

    /**
     * Checks whether any key in the trie starts with {@code prefix}. The check follows the structure only, so the path
     * of a deleted key (or any part of it) still counts as a prefix until the trie is compacted with {@link #copyOf}.
     */
    public boolean isPrefix(CharSequence prefix)
    {
        return TrieEnumerator.isPrefix(root, checkNotNull(prefix, "prefix"));
    }

    @Override
    public Iterator<String> iterator()
    {
        return new TrieEntriesIterator.AsKeys<>(root, "");
    }

    public Iterable<String> keys()
    {
        return this;
    }

    public Iterable<T> values()
    {
        return () -> new TrieEntriesIterator.AsValues<>(root, "");
    }

    public Iterable<Map.Entry<String, T>> items()
    {
        return () -> new TrieEntriesIterator.AsEntries<>(root, "");
    }

    /**
     * @return the keys starting with {@code prefix}, including {@code prefix} itself if it is a key.
     */
    public Iterable<String> keysWithPrefix(CharSequence prefix)
    {
        checkNotNull(prefix, "prefix");
        return () -> TrieEnumerator.keys(root, prefix);
    }

    public Iterable<T> valuesWithPrefix(CharSequence prefix)
    {
        checkNotNull(prefix, "prefix");
        return () -> TrieEnumerator.values(root, prefix);
    }

    public Iterable<Map.Entry<String, T>> itemsWithPrefix(CharSequence prefix)
    {
        checkNotNull(prefix, "prefix");
        return () -> TrieEnumerator.entries(root, prefix);
    }

    /**
     * Finds the longest key that is a prefix of {@code text}.
     *
     * @throws KeyNotFoundException if no key is a prefix of the text.
     */
    public Match<T> longestMatch(CharSequence text)
    {
        return longestMatch(text, 0);
    }

    /**
     * Finds the longest key that is a prefix of {@code text[start:]}. A negative {@code start} counts from the end
     * of the text.
     *
     * @throws KeyNotFoundException if no key is a prefix of the text.
     */
    public Match<T> longestMatch(CharSequence text, int start)
    {
        checkNotNull(text, "text");
        return PrefixScanner.longestOrThrow(root, text, PrefixScanner.Window.of(text, start));
    }

    /**
     * Finds the longest key that is a prefix of {@code text[start:end]}. Negative offsets count from the end of the
     * text, and both offsets are clamped to the text's bounds.
     *
     * @throws KeyNotFoundException if no key is a prefix of the window.
     */
    public Match<T> longestMatch(CharSequence text, int start, int end)
    {
        checkNotNull(text, "text");
        return PrefixScanner.longestOrThrow(root, text, PrefixScanner.Window.of(text, start, end));
    }

    /**
     * Finds the longest key that is a prefix of {@code text[start:end]}.
     *
     * @return the match, or a {@link Match#isDefault default} match holding {@code defaultValue} if no key is a prefix
     * of the window.
     */
    public Match<T> longestMatch(CharSequence text, int start, int end, @Nullable T defaultValue)
    {
        checkNotNull(text, "text");
        PrefixScanner.Window window = PrefixScanner.Window.of(text, start, end);
        Match<T> match = PrefixScanner.longest(root, text, window);
        return match != null ? match : Match.ofDefault(window.start, defaultValue);
    }

    /**
     * @return the longest key that is a prefix of {@code text}.
     * @throws KeyNotFoundException if there is none.
     */
    public String key(CharSequence text)
    {
        return longestMatch(text).key();
    }

    public String key(CharSequence text, int start)
    {
        return longestMatch(text, start).key();
    }

    public String key(CharSequence text, int start, int end)
    {
        return longestMatch(text, start, end).key();
    }

    /**
     * @return the value of the longest key that is a prefix of {@code text}.
     * @throws KeyNotFoundException if there is none.
     */
    public T value(CharSequence text)
    {
        return longestMatch(text).value();
    }

    public T value(CharSequence text, int start)
    {
        return longestMatch(text, start).value();
    }

    public T value(CharSequence text, int start, int end)
    {
        return longestMatch(text, start, end).value();
    }

    /**
     * @return the value of the longest key that is a prefix of {@code text[start:end]}, or {@code defaultValue} if
     * there is none.
     */
    public T value(CharSequence text, int start, int end, @Nullable T defaultValue)
    {
        return longestMatch(text, start, end, defaultValue).value();
    }

    /**
     * @return all keys that are prefixes of {@code text}, shortest first.
     */
    public Iterable<Match<T>> allMatches(CharSequence text)
    {
        return allMatches(text, 0);
    }

    public Iterable<Match<T>> allMatches(CharSequence text, int start)
    {
        checkNotNull(text, "text");
        // the window is clamped on every iteration, against the length the text has at that time
        return () -> PrefixScanner.all(root, text, PrefixScanner.Window.of(text, start));
    }

    /**
     * @return all keys that are prefixes of {@code text[start:end]}, shortest first. Offsets are interpreted as for
     * {@link #longestMatch(CharSequence, int, int)}.
     */
    public Iterable<Match<T>> allMatches(CharSequence text, int start, int end)
    {
        checkNotNull(text, "text");
        return () -> PrefixScanner.all(root, text, PrefixScanner.Window.of(text, start, end));
    }

    /**
     * @return the keys that are prefixes of {@code text}, shortest first.
     */
    public Iterable<String> keys(CharSequence text)
    {
        return Iterables.transform(allMatches(text), Match::key);
    }

    public Iterable<String> keys(CharSequence text, int start)
    {
        return Iterables.transform(allMatches(text, start), Match::key);
    }

    public Iterable<String> keys(CharSequence text, int start, int end)
    {
        return Iterables.transform(allMatches(text, start, end), Match::key);
    }

    /**
     * @return the values of the keys that are prefixes of {@code text}, shortest key first.
     */
    public Iterable<T> values(CharSequence text)
    {
        return Iterables.transform(allMatches(text), Match::value);
    }

    public Iterable<T> values(CharSequence text, int start)
    {
        return Iterables.transform(allMatches(text, start), Match::value);
    }

    public Iterable<T> values(CharSequence text, int start, int end)
    {
        return Iterables.transform(allMatches(text, start, end), Match::value);
    }

    /**
     * @return the (key, value) pairs of the keys that are prefixes of {@code text}, shortest key first.
     */
    public Iterable<Map.Entry<String, T>> items(CharSequence text)
    {
        return Iterables.transform(allMatches(text), PatriciaTrie::toEntry);
    }

    public Iterable<Map.Entry<String, T>> items(CharSequence text, int start)
    {
        return Iterables.transform(allMatches(text, start), PatriciaTrie::toEntry);
    }

    public Iterable<Map.Entry<String, T>> items(CharSequence text, int start, int end)
    {
        return Iterables.transform(allMatches(text, start, end), PatriciaTrie::toEntry);
    }

    private static <T> Map.Entry<String, T> toEntry(Match<T> match)
    {
        return new AbstractMap.SimpleImmutableEntry<>(match.key(), match.value());
    }

    @VisibleForTesting
    Node<T> root()
    {
        return root;
    }

    /**
     * Renders the entries in enumeration order, e.g. {@code PatriciaTrie{ba=2, baz=3}}. Meant for diagnostics only.
     */
    @Override
    public String toString()
    {
        int limit = PatriciaRelevantProperties.TO_STRING_MAX_ENTRIES.getInt();
        StringBuilder sb = new StringBuilder("PatriciaTrie{");
        int rendered = 0;
        for (Map.Entry<String, T> entry : items())
        {
            if (limit >= 0 && rendered == limit)
            {
                sb.append(rendered == 0 ? "..." : ", ...");
                break;
            }
            if (rendered++ > 0)
                sb.append(", ");
            sb.append(entry.getKey()).append('=').append(entry.getValue());
        }
        return sb.append('}').toString();
    }
}
