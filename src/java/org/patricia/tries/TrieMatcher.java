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

import javax.annotation.Nullable;

/**
 * Exact lookups: the node at the end of a key's path, value retrieval and containment.
 */
final class TrieMatcher
{
    private TrieMatcher()
    {
    }

    static <T> TrieWalker<T> walk(Node<T> root, CharSequence sequence, int start, int end)
    {
        return new TrieWalker<>(root, sequence, start, end);
    }

    /**
     * @return the node whose path is exactly {@code key}, or null if the structure has no such node. The node may
     * hold no value.
     */
    @Nullable
    static <T> Node<T> exactNode(Node<T> root, CharSequence key)
    {
        TrieWalker<T> walker = walk(root, key, 0, key.length()).advanceFully();
        return walker.offset() == key.length() ? walker.node() : null;
    }

    /**
     * @throws KeyNotFoundException if no value is stored under {@code key}.
     */
    static <T> Node<T> terminalNode(Node<T> root, CharSequence key)
    {
        TrieWalker<T> walker = walk(root, key, 0, key.length()).advanceFully();
        if (walker.offset() != key.length() || !walker.node().isTerminal())
            throw new KeyNotFoundException(key, key.subSequence(0, walker.offset()));
        return walker.node();
    }

    static <T> T get(Node<T> root, CharSequence key)
    {
        return terminalNode(root, key).value.get();
    }

    static <T> boolean contains(Node<T> root, CharSequence key)
    {
        Node<T> node = exactNode(root, key);
        return node != null && node.isTerminal();
    }
}
