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
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Depth-first iterator over the terminal nodes of a trie branch, where each node is passed through
 * {@link #mapContent} together with its path (to be implemented by descendants).
 * <p>
 * A node is presented before its children, and children in the order of their node's edges. The traversal keeps an
 * explicit stack of edge iterators, one per level of the branch, so deep keys do not consume call stack.
 */
abstract class TrieEntriesIterator<T, V> implements Iterator<V>
{
    private final Deque<Level<T>> levels = new ArrayDeque<>();
    private final StringBuilder path;
    private Node<T> next;
    private boolean gotNext;

    /**
     * @param root the root of the branch to iterate.
     * @param rootPath the path leading to {@code root}, used as prefix of all reported paths.
     */
    TrieEntriesIterator(Node<T> root, CharSequence rootPath)
    {
        this.path = new StringBuilder(rootPath);
        descend(root);
        next = root;
        gotNext = root.isTerminal();
    }

    public boolean hasNext()
    {
        if (!gotNext)
        {
            next = advanceToContent();
            gotNext = true;
        }
        return next != null;
    }

    public V next()
    {
        if (!hasNext())
            throw new NoSuchElementException();

        gotNext = false;
        Node<T> node = next;
        next = null;
        return mapContent(node.value.get(), path);
    }

    private Node<T> advanceToContent()
    {
        while (!levels.isEmpty())
        {
            Level<T> level = levels.peek();
            if (!level.edges.hasNext())
            {
                levels.pop();
                continue;
            }

            Node.Edge<T> edge = level.edges.next();
            path.setLength(level.pathLength);
            path.append(edge.label);
            descend(edge.child);
            if (edge.child.isTerminal())
                return edge.child;
        }
        return null;
    }

    private void descend(Node<T> node)
    {
        if (node.hasEdges())
            levels.push(new Level<>(node.edges().iterator(), path.length()));
    }

    protected abstract V mapContent(T value, CharSequence path);

    private static final class Level<T>
    {
        final Iterator<Node.Edge<T>> edges;
        final int pathLength;

        Level(Iterator<Node.Edge<T>> edges, int pathLength)
        {
            this.edges = edges;
            this.pathLength = pathLength;
        }
    }

    static class AsKeys<T> extends TrieEntriesIterator<T, String>
    {
        AsKeys(Node<T> root, CharSequence rootPath)
        {
            super(root, rootPath);
        }

        @Override
        protected String mapContent(T value, CharSequence path)
        {
            return path.toString();
        }
    }

    static class AsValues<T> extends TrieEntriesIterator<T, T>
    {
        AsValues(Node<T> root, CharSequence rootPath)
        {
            super(root, rootPath);
        }

        @Override
        protected T mapContent(T value, CharSequence path)
        {
            return value;
        }
    }

    /**
     * Iterator representing the content of the branch as a sequence of (key, value) pairs.
     */
    static class AsEntries<T> extends TrieEntriesIterator<T, Map.Entry<String, T>>
    {
        AsEntries(Node<T> root, CharSequence rootPath)
        {
            super(root, rootPath);
        }

        @Override
        protected Map.Entry<String, T> mapContent(T value, CharSequence path)
        {
            return new AbstractMap.SimpleImmutableEntry<>(path.toString(), value);
        }
    }
}
