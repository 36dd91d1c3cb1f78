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

import java.util.NoSuchElementException;
import java.util.Objects;

import javax.annotation.Nullable;

/**
 * The value slot of a trie node: either a stored value (which may be {@code null}) or the absence of one.
 * <p>
 * Absence is a separate state rather than a reserved value, so that no value a caller stores or passes as a default
 * can be confused with "there is no value here". Instances never leave this package.
 */
abstract class Value<T>
{
    private static final Value<?> ABSENT = new Absent();

    @SuppressWarnings("unchecked")
    static <T> Value<T> absent()
    {
        return (Value<T>) ABSENT;
    }

    static <T> Value<T> present(@Nullable T value)
    {
        return new Present<>(value);
    }

    abstract boolean isPresent();

    /**
     * @throws NoSuchElementException if the slot is empty.
     */
    abstract T get();

    static final class Present<T> extends Value<T>
    {
        private final T value;

        private Present(T value)
        {
            this.value = value;
        }

        boolean isPresent()
        {
            return true;
        }

        T get()
        {
            return value;
        }

        @Override
        public boolean equals(Object o)
        {
            if (this == o) return true;
            if (!(o instanceof Present)) return false;
            return Objects.equals(value, ((Present<?>) o).value);
        }

        @Override
        public int hashCode()
        {
            return Objects.hashCode(value);
        }

        @Override
        public String toString()
        {
            return "Present(" + value + ')';
        }
    }

    private static final class Absent extends Value<Object>
    {
        boolean isPresent()
        {
            return false;
        }

        Object get()
        {
            throw new NoSuchElementException("No value is set");
        }

        @Override
        public String toString()
        {
            return "Absent";
        }
    }
}
