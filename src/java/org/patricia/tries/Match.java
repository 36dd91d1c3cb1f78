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

import java.util.Objects;

import javax.annotation.Nullable;

/**
 * A stored key found as a prefix of a scanned text window, together with its position in the text and its value.
 * <p>
 * A match may also stand for a caller-supplied default when a scan found nothing: such a match has a null key, an
 * empty extent at the start of the window, and the default as value (see {@link #isDefault}).
 */
public final class Match<T>
{
    @Nullable
    private final String key;
    private final int start;
    private final int end;
    @Nullable
    private final T value;

    Match(@Nullable String key, int start, int end, @Nullable T value)
    {
        this.key = key;
        this.start = start;
        this.end = end;
        this.value = value;
    }

    static <T> Match<T> of(CharSequence text, int start, int end, T value)
    {
        return new Match<>(text.subSequence(start, end).toString(), start, end, value);
    }

    static <T> Match<T> ofDefault(int start, T defaultValue)
    {
        return new Match<>(null, start, start, defaultValue);
    }

    /**
     * @return the matched key, or null for a default match.
     */
    @Nullable
    public String key()
    {
        return key;
    }

    /**
     * @return the offset in the text at which the match starts.
     */
    public int start()
    {
        return start;
    }

    /**
     * @return the offset in the text immediately after the match.
     */
    public int end()
    {
        return end;
    }

    public int length()
    {
        return end - start;
    }

    @Nullable
    public T value()
    {
        return value;
    }

    public boolean isDefault()
    {
        return key == null;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Match<?> match = (Match<?>) o;
        return start == match.start && end == match.end && Objects.equals(key, match.key) && Objects.equals(value, match.value);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(key, start, end, value);
    }

    @Override
    public String toString()
    {
        return isDefault()
               ? "Match{default=" + value + '}'
               : "Match{" + key + '=' + value + " @[" + start + ", " + end + ")}";
    }
}
