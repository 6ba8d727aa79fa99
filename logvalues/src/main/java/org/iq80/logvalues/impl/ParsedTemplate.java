/*
 * Copyright (C) 2011 the original author or authors.
 * See the notice.md file distributed with this work for additional
 * information regarding copyright ownership.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.iq80.logvalues.impl;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Result of parsing a named template: the positional format and the placeholder names, where the
 * name at position {@code i} belongs to format item {@code {i}}.
 */
public final class ParsedTemplate
{
    private final String format;
    private final List<String> names;
    private final boolean literal;

    private ParsedTemplate(String format, List<String> names, boolean literal)
    {
        this.format = requireNonNull(format, "format is null");
        this.names = ImmutableList.copyOf(names);
        this.literal = literal;
    }

    /**
     * A template that was not scanned and is rendered exactly as written.
     */
    static ParsedTemplate literal(String text)
    {
        return new ParsedTemplate(text, ImmutableList.of(), true);
    }

    static ParsedTemplate positional(String format, List<String> names)
    {
        return new ParsedTemplate(format, names, false);
    }

    public String getFormat()
    {
        return format;
    }

    public List<String> getNames()
    {
        return names;
    }

    public boolean isLiteral()
    {
        return literal;
    }

    @Override
    public String toString()
    {
        return "ParsedTemplate{" +
                "format='" + format + '\'' +
                ", names=" + names +
                ", literal=" + literal +
                '}';
    }
}
