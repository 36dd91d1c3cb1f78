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

import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.function.BiFunction;

import javax.annotation.Nullable;

/**
 * Enumeration of stored keys, optionally restricted to the keys starting with a given prefix.
 */
final class TrieEnumerator
{
    private TrieEnumerator()
    {
    }

    static <T> Iterator<String> keys(Node<T> root, CharSequence prefix)
    {
        return withPrefix(root, prefix, TrieEntriesIterator.AsKeys::new);
    }

    static <T> Iterator<T> values(Node<T> root, CharSequence prefix)
    {
        return withPrefix(root, prefix, TrieEntriesIterator.AsValues::new);
    }

    static <T> Iterator<Map.Entry<String, T>> entries(Node<T> root, CharSequence prefix)
    {
        return withPrefix(root, prefix, TrieEntriesIterator.AsEntries::new);
    }

    /**
     * @return whether the structure has a path spelling {@code prefix}, i.e. {@code prefix} is the beginning of the
     * concatenated edge labels of some path. Value slots are not consulted.
     */
    static <T> boolean isPrefix(Node<T> root, CharSequence prefix)
    {
        return descend(root, prefix) != null;
    }

    /**
     * @return the number of terminal nodes in the branch.
     */
    static <T> int count(Node<T> root)
    {
        int count = 0;
        for (Iterator<T> it = new TrieEntriesIterator.AsValues<>(root, ""); it.hasNext(); it.next())
            ++count;
        return count;
    }

    private static <T, V> Iterator<V> withPrefix(Node<T> root,
                                                 CharSequence prefix,
                                                 BiFunction<Node<T>, CharSequence, Iterator<V>> iteratorFactory)
    {
        Branch<T> branch = descend(root, prefix);
        if (branch == null)
            return Collections.emptyIterator();
        return iteratorFactory.apply(branch.node, branch.path);
    }

    /**
     * Follows {@code prefix} from {@code root}. The prefix may end inside an edge label, in which case the branch is
     * the one below that edge and its path extends past the prefix.
     *
     * @return the highest node whose path starts with {@code prefix}, or null if there is none.
     */
    @Nullable
    static <T> Branch<T> descend(Node<T> root, CharSequence prefix)
    {
        int length = prefix.length();
        TrieWalker<T> walker = TrieMatcher.walk(root, prefix, 0, length).advanceFully();
        int offset = walker.offset();
        if (offset == length)
            return new Branch<>(walker.node(), prefix);

        Node.Edge<T> edge = walker.node().findEdge(prefix.charAt(offset));
        if (edge == null || !startsWith(edge.label, prefix, offset))
            return null;

        String path = prefix.subSequence(0, offset) + edge.label;
        return new Branch<>(edge.child, path);
    }

    /**
     * @return whether {@code label} starts with {@code prefix[offset:]}.
     */
    private static boolean startsWith(String label, CharSequence prefix, int offset)
    {
        int remaining = prefix.length() - offset;
        if (remaining > label.length())
            return false;
        for (int i = 0; i < remaining; ++i)
        {
            if (label.charAt(i) != prefix.charAt(offset + i))
                return false;
        }
        return true;
    }

    static final class Branch<T>
    {
        final Node<T> node;
        final CharSequence path;

        Branch(Node<T> node, CharSequence path)
        {
            this.node = node;
            this.path = path;
        }
    }
}
