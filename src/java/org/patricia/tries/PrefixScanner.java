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

import java.util.Iterator;

import javax.annotation.Nullable;

import com.google.common.collect.AbstractIterator;

/**
 * Prefix matching over a window of a text: finds the stored keys that are prefixes of {@code text[start:end]}.
 * <p>
 * Both operations walk the trie once along the window. As nodes are visited in order of increasing offset, the last
 * terminal node seen is the longest match. A value stored for the empty key always gives a zero-length match at the
 * start of the window.
 */
final class PrefixScanner
{
    private PrefixScanner()
    {
    }

    /**
     * @return the longest match in the window, or null if no stored key is a prefix of it.
     */
    @Nullable
    static <T> Match<T> longest(Node<T> root, CharSequence text, Window window)
    {
        TrieWalker<T> walker = TrieMatcher.walk(root, text, window.start, window.end);
        Node<T> best = null;
        int bestEnd = window.start;
        do
        {
            Node<T> node = walker.node();
            if (node.isTerminal())
            {
                best = node;
                bestEnd = walker.offset();
            }
        }
        while (walker.advance());

        return best == null ? null : Match.of(text, window.start, bestEnd, best.value.get());
    }

    /**
     * Same as {@link #longest}, but fails with the part of the window matched structurally.
     *
     * @throws KeyNotFoundException if no stored key is a prefix of the window.
     */
    static <T> Match<T> longestOrThrow(Node<T> root, CharSequence text, Window window)
    {
        Match<T> match = longest(root, text, window);
        if (match != null)
            return match;

        TrieWalker<T> walker = TrieMatcher.walk(root, text, window.start, window.end).advanceFully();
        throw new KeyNotFoundException(text.subSequence(window.start, window.end),
                                       text.subSequence(window.start, walker.offset()));
    }

    /**
     * @return all matches in the window, shortest first. The iterator walks the trie lazily and cannot be restarted.
     */
    static <T> Iterator<Match<T>> all(Node<T> root, CharSequence text, Window window)
    {
        return new MatchIterator<>(TrieMatcher.walk(root, text, window.start, window.end), text, window.start);
    }

    private static class MatchIterator<T> extends AbstractIterator<Match<T>>
    {
        private final TrieWalker<T> walker;
        private final CharSequence text;
        private final int start;
        private boolean started;

        MatchIterator(TrieWalker<T> walker, CharSequence text, int start)
        {
            this.walker = walker;
            this.text = text;
            this.start = start;
        }

        @Override
        protected Match<T> computeNext()
        {
            // the starting node is visited before any edge is followed
            boolean positioned = !started || walker.advance();
            started = true;
            while (positioned)
            {
                Node<T> node = walker.node();
                if (node.isTerminal())
                    return Match.of(text, start, walker.offset(), node.value.get());
                positioned = walker.advance();
            }
            return endOfData();
        }
    }

    /**
     * A {@code [start, end)} window of a text, with offsets normalized to the text's bounds.
     */
    static final class Window
    {
        final int start;
        final int end;

        private Window(int start, int end)
        {
            this.start = start;
            this.end = end;
        }

        /**
         * Negative offsets count from the end of the text; all offsets are clamped to {@code [0, length]} and an end
         * before the start gives an empty window at the start.
         */
        static Window of(CharSequence text, int start, int end)
        {
            int length = text.length();
            int from = clamp(start, length);
            int to = clamp(end, length);
            return new Window(from, Math.max(from, to));
        }

        static Window of(CharSequence text, int start)
        {
            return of(text, start, text.length());
        }

        private static int clamp(int offset, int length)
        {
            if (offset < 0)
                return Math.max(0, length + offset);
            return Math.min(offset, length);
        }

        @Override
        public String toString()
        {
            return "[" + start + ", " + end + ')';
        }
    }
}
