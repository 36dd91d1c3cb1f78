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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Insertion and (logical) deletion of keys.
 * <p>
 * Insertion keeps the trie maximally compressed by construction: a new key either follows existing edges, branches
 * off in a new leaf holding the whole unmatched remainder, or splits an edge at the point where the key diverges from
 * its label. Deletion only clears the value slot of the key's node; nodes and edges are never removed, so a trie that
 * has seen many deletions can only be compacted by copying it (see {@link PatriciaTrie#copyOf}).
 */
final class TrieMutator
{
    private static final Logger logger = LoggerFactory.getLogger(TrieMutator.class);

    private TrieMutator()
    {
    }

    /**
     * Associates {@code value} with {@code key}, replacing any value already stored for it.
     *
     * @param verifyEdges whether to check the edge index of every node whose edges are changed.
     */
    static <T> void set(Node<T> root, CharSequence key, T value, boolean verifyEdges)
    {
        Node<T> node = root;
        int length = key.length();
        int offset = 0;

        while (offset < length)
        {
            Node.Edge<T> edge = node.findEdge(key.charAt(offset));
            if (edge == null)
            {
                String label = key.subSequence(offset, length).toString();
                node.putEdge(new Node.Edge<>(label, new Node<>(Value.present(value))));
                if (logger.isTraceEnabled())
                    logger.trace("Added leaf \"{}\" for key \"{}\"", label, key);
                if (verifyEdges)
                    node.checkEdges();
                return;
            }

            int common = commonPrefixLength(edge.label, key, offset, length);
            if (common < edge.label.length())
                node = split(node, edge, common, verifyEdges);
            else
                node = edge.child;
            offset += common;
        }

        // also reached when the key ends on an existing branching node, which then becomes terminal
        node.value = Value.present(value);
    }

    /**
     * Replaces {@code edge} of {@code parent} by an edge leading to a new intermediate node at {@code position} of the
     * edge's label, under which the remainder of the label leads to the original child.
     *
     * @return the intermediate node.
     */
    private static <T> Node<T> split(Node<T> parent, Node.Edge<T> edge, int position, boolean verifyEdges)
    {
        assert position > 0 && position < edge.label.length() : "Invalid split position " + position + " for " + edge;
        Node<T> intermediate = new Node<>();
        intermediate.putEdge(new Node.Edge<>(edge.label.substring(position), edge.child));
        // same leading symbol: this replaces the old edge in place
        parent.putEdge(new Node.Edge<>(edge.label.substring(0, position), intermediate));

        if (logger.isTraceEnabled())
            logger.trace("Split edge \"{}\" into \"{}\" and \"{}\"", edge.label, edge.label.substring(0, position), edge.label.substring(position));
        if (verifyEdges)
        {
            parent.checkEdges();
            intermediate.checkEdges();
        }
        return intermediate;
    }

    /**
     * Clears the value stored for {@code key}. The key's node and any now useless edges stay in place.
     *
     * @return the value that was removed.
     * @throws KeyNotFoundException if no value is stored under {@code key}.
     */
    static <T> T delete(Node<T> root, CharSequence key)
    {
        Node<T> node = TrieMatcher.terminalNode(root, key);
        T previous = node.value.get();
        node.value = Value.absent();
        if (logger.isTraceEnabled())
            logger.trace("Cleared value of key \"{}\"", key);
        return previous;
    }

    /**
     * @return the length of the longest common prefix of {@code label} and {@code key[offset:length]}, at least one
     * as edges are selected by their first symbol.
     */
    static int commonPrefixLength(String label, CharSequence key, int offset, int length)
    {
        int limit = Math.min(label.length(), length - offset);
        int position = 1;
        while (position < limit && label.charAt(position) == key.charAt(offset + position))
            ++position;
        return position;
    }
}
