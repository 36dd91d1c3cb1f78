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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import javax.annotation.Nullable;

/**
 * A trie node: a value slot and the outgoing edges, indexed by the first symbol of their label.
 * <p>
 * No two edges of a node start with the same symbol, so the edge to follow for a given position in a key is
 * determined by a single lookup. Edges keep their insertion order, which is the order in which enumeration visits
 * them. Every node exclusively owns its children; there are no parent links.
 */
final class Node<T>
{
    Value<T> value;

    // Most nodes are leaves; the map is only allocated when the first edge is added.
    private Map<Character, Edge<T>> edges = Collections.emptyMap();

    Node()
    {
        this(Value.absent());
    }

    Node(Value<T> value)
    {
        this.value = value;
    }

    boolean isTerminal()
    {
        return value.isPresent();
    }

    boolean hasEdges()
    {
        return !edges.isEmpty();
    }

    int edgeCount()
    {
        return edges.size();
    }

    /**
     * @return the edge whose label starts with the given symbol, or null if there is none.
     */
    @Nullable
    Edge<T> findEdge(char symbol)
    {
        return edges.get(symbol);
    }

    Collection<Edge<T>> edges()
    {
        return edges.values();
    }

    /**
     * Adds the given edge, replacing the edge that starts with the same symbol if one exists. A replaced edge keeps
     * its position in the enumeration order.
     */
    void putEdge(Edge<T> edge)
    {
        if (edges.isEmpty())
            edges = new LinkedHashMap<>(4);
        edges.put(edge.label.charAt(0), edge);
    }

    /**
     * Checks that every edge is indexed by the first symbol of its non-empty label.
     *
     * @throws IllegalStateException on the first violation found.
     */
    void checkEdges()
    {
        for (Map.Entry<Character, Edge<T>> entry : edges.entrySet())
        {
            String label = entry.getValue().label;
            if (label.isEmpty())
                throw new IllegalStateException("Empty edge label under symbol '" + entry.getKey() + '\'');
            if (label.charAt(0) != entry.getKey())
                throw new IllegalStateException("Edge \"" + label + "\" indexed under symbol '" + entry.getKey() + '\'');
        }
    }

    static final class Edge<T>
    {
        final String label;
        final Node<T> child;

        Edge(String label, Node<T> child)
        {
            assert !label.isEmpty() : "Edge labels cannot be empty";
            this.label = label;
            this.child = child;
        }

        @Override
        public String toString()
        {
            return label;
        }
    }
}
