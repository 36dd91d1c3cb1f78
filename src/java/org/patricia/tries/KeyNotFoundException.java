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
 * Thrown when a key, or a key that is a prefix of a scanned text, is not present in a {@link PatriciaTrie}.
 * <p>
 * Besides the query, the exception reports the longest part of it that could be followed through the trie's
 * structure, which is usually enough to tell where a lookup went astray.
 */
public class KeyNotFoundException extends RuntimeException
{
    private final String key;
    private final String matchedPath;

    public KeyNotFoundException(CharSequence key, CharSequence matchedPath)
    {
        super(matchedPath.length() == key.length()
              ? String.format("'%s'", key)
              : String.format("'%s' (matched '%s')", key, matchedPath));
        this.key = key.toString();
        this.matchedPath = matchedPath.toString();
    }

    public String getKey()
    {
        return key;
    }

    /**
     * @return the prefix of the key that was matched by edges of the trie before the lookup failed.
     */
    public String getMatchedPath()
    {
        return matchedPath;
    }
}
