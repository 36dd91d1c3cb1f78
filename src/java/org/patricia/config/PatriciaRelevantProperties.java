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
package org.patricia.config;

import java.util.HashSet;
import java.util.Set;

import javax.annotation.Nullable;

import org.patricia.exceptions.ConfigurationException;

/** A class that extracts the system properties controlling the behaviour of tries. */
public enum PatriciaRelevantProperties
{
    /**
     * Maximum number of entries rendered by {@code PatriciaTrie.toString()}; negative for no limit.
     */
    TO_STRING_MAX_ENTRIES("patricia.trie.to_string_max_entries", "-1"),

    /**
     * Whether insertions check the edge index of every node they change. Meant for tests and debugging.
     */
    VERIFY_INVARIANTS("patricia.trie.verify_invariants", "false");

    static
    {
        PatriciaRelevantProperties[] values = PatriciaRelevantProperties.values();
        Set<String> visited = new HashSet<>(values.length);
        PatriciaRelevantProperties prev = null;
        for (PatriciaRelevantProperties next : values)
        {
            if (!visited.add(next.getKey()))
                throw new IllegalStateException("System properties have duplicate key: " + next.getKey());
            if (prev != null && next.name().compareTo(prev.name()) < 0)
                throw new IllegalStateException("Enum constants are not in alphabetical order: " + prev.name() + " should come before " + next.name());
            else
                prev = next;
        }
    }

    PatriciaRelevantProperties(String key, String defaultVal)
    {
        this.key = key;
        this.defaultVal = defaultVal;
    }

    private final String key;
    private final String defaultVal;

    public String getKey()
    {
        return key;
    }

    /**
     * Gets the value of the indicated system property.
     * @return system property value if it exists, defaultValue otherwise.
     */
    public String getString()
    {
        String value = System.getProperty(key);
        return value == null ? defaultVal : value;
    }

    /**
     * Sets the property to its default value.
     */
    public void reset()
    {
        System.setProperty(key, defaultVal);
    }

    /**
     * Gets the value of a system property as a boolean.
     * @return system property boolean value if it exists, the default value otherwise.
     */
    public boolean getBoolean()
    {
        String value = System.getProperty(key);
        return BOOLEAN_CONVERTER.convert(value == null ? defaultVal : value);
    }

    /**
     * Sets the value into system properties.
     * @param value to set
     * @return Previous value if it exists.
     */
    public Boolean setBoolean(boolean value)
    {
        String prev = System.setProperty(key, Boolean.toString(value));
        return prev == null ? null : BOOLEAN_CONVERTER.convert(prev);
    }

    /**
     * Gets the value of a system property as an int.
     * @return system property int value if it exists, the default value otherwise.
     * @throws ConfigurationException if the value is not an integer.
     */
    public int getInt()
    {
        String value = System.getProperty(key);
        return INTEGER_CONVERTER.convert(value == null ? defaultVal : value);
    }

    /**
     * Sets the value into system properties.
     * @param value to set
     * @return Previous value or null if it did not have one.
     */
    @Nullable
    public Integer setInt(int value)
    {
        String prev = System.setProperty(key, Integer.toString(value));
        return prev == null ? null : INTEGER_CONVERTER.convert(prev);
    }

    /**
     * Clears the value set in the system property.
     */
    public void clearValue()
    {
        System.clearProperty(key);
    }

    /**
     * @return whether a system property is present or not.
     */
    public boolean isPresent()
    {
        return System.getProperties().containsKey(key);
    }

    private interface PropertyConverter<T>
    {
        T convert(String value);
    }

    private static final PropertyConverter<Boolean> BOOLEAN_CONVERTER = Boolean::parseBoolean;

    private static final PropertyConverter<Integer> INTEGER_CONVERTER = value ->
    {
        try
        {
            return Integer.decode(value.trim());
        }
        catch (NumberFormatException e)
        {
            throw new ConfigurationException(String.format("Invalid value for system property: " +
                                                           "expected integer value but got '%s'", value), e);
        }
    };
}
