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

/**
 * Cursor following the edges of a trie along a character sequence.
 * <p>
 * The walker starts positioned at the given node and offset; every call to {@link #advance} follows the edge whose
 * label matches the sequence at the current offset and lies completely before {@code end}. Visited nodes are thus
 * presented in order of increasing offset. Once {@code advance} returns false the walk is over; walking again requires
 * a new walker.
 */
final class TrieWalker<T>
{
    private final CharSequence sequence;
    private final int end;
    private Node<T> node;
    private int offset;
    private boolean exhausted;

    TrieWalker(Node<T> node, CharSequence sequence, int start, int end)
    {
        assert 0 <= start && start <= sequence.length() : "Invalid start " + start;
        assert end <= sequence.length() : "Invalid end " + end;
        this.node = node;
        this.sequence = sequence;
        this.offset = start;
        this.end = end;
    }

    Node<T> node()
    {
        return node;
    }

    /**
     * @return the offset in the sequence immediately after the path leading to the current node.
     */
    int offset()
    {
        return offset;
    }

    /**
     * Moves to the child whose edge label matches the sequence at the current offset.
     *
     * @return false, leaving the walker on the current node, if no such edge exists within the window.
     */
    boolean advance()
    {
        if (exhausted)
            return false;
        if (offset < end)
        {
            Node.Edge<T> edge = node.findEdge(sequence.charAt(offset));
            if (edge != null && matchesAt(edge.label, sequence, offset, end))
            {
                node = edge.child;
                offset += edge.label.length();
                return true;
            }
        }
        exhausted = true;
        return false;
    }

    /**
     * Follows edges until the end of the window or the first mismatch.
     *
     * @return the walker, positioned on the deepest node reached.
     */
    TrieWalker<T> advanceFully()
    {
        boolean moved;
        do
        {
            moved = advance();
        }
        while (moved);
        return this;
    }

    /**
     * @return whether {@code label} occurs in {@code sequence} at {@code offset} and ends at or before {@code end}.
     */
    static boolean matchesAt(String label, CharSequence sequence, int offset, int end)
    {
        int length = label.length();
        if (offset + length > end)
            return false;
        // the first symbol was used to select the edge
        for (int i = 1; i < length; ++i)
        {
            if (label.charAt(i) != sequence.charAt(offset + i))
                return false;
        }
        return true;
    }
}
