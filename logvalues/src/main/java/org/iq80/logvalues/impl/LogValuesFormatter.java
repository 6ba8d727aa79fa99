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

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import org.iq80.logvalues.format.CompositeFormatter;

import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkPositionIndex;
import static com.google.common.collect.Maps.immutableEntry;
import static java.util.Objects.requireNonNull;

/**
 * Formatter for templates with named placeholders, such as
 * {@code "User {UserId} logged in from {IpAddress}"}.
 * <p>
 * The template is parsed on first use and the result is kept for the lifetime of the instance.
 * Each placeholder is bound to the argument at the same position: the first placeholder to
 * {@code values[0]}, the second to {@code values[1]} and so on, whatever their names.
 * <p>
 * Instances are immutable and safe for use by multiple concurrent threads.
 */
public final class LogValuesFormatter
{
    /**
     * Name of the pair carrying the unparsed template.
     */
    public static final String ORIGINAL_FORMAT = "{OriginalFormat}";

    /**
     * Text rendered in place of a {@code null} argument or collection element.
     */
    public static final String NULL_VALUE = "(null)";

    private static final Object[] EMPTY_VALUES = new Object[0];

    private final String originalFormat;
    private final Supplier<ParsedTemplate> parsedTemplate;

    public LogValuesFormatter(String format)
    {
        this.originalFormat = requireNonNull(format, "format is null");
        this.parsedTemplate = Suppliers.memoize(() -> TemplateParser.parse(originalFormat));
    }

    public String getOriginalFormat()
    {
        return originalFormat;
    }

    /**
     * Placeholder names in order of appearance, one entry per placeholder.
     */
    public List<String> getValueNames()
    {
        return parsedTemplate.get().getNames();
    }

    /**
     * Render the template. {@code values} is left untouched; a {@code null} array is rendered like an
     * empty one.
     * <p>
     * Alignment and format string are not checked when the template is parsed. A placeholder whose
     * alignment is not a number, such as {@code {Count,abc}}, is rendered as literal text in its
     * positional form, {@code {0,abc}}.
     *
     * @throws org.iq80.logvalues.LogFormatException if a placeholder has no corresponding value or
     * its format specifier does not apply to the value
     */
    public String format(Object... values)
    {
        final ParsedTemplate template = parsedTemplate.get();
        if (template.isLiteral()) {
            return template.getFormat();
        }
        return CompositeFormatter.invariant().format(template.getFormat(), DisplayValues.of(values));
    }

    /**
     * Get the name/value pair at {@code index}. Index {@code getValueNames().size()} is valid and
     * returns the {@value #ORIGINAL_FORMAT} pair holding the unparsed template.
     *
     * @throws IndexOutOfBoundsException if {@code index} is negative or greater than the number of
     * names, or if {@code values} has no element at {@code index}
     */
    public Map.Entry<String, Object> getValue(Object[] values, int index)
    {
        final List<String> names = getValueNames();
        checkPositionIndex(index, names.size(), "index");
        if (index < names.size()) {
            Object[] args = values == null ? EMPTY_VALUES : values;
            checkElementIndex(index, args.length, "index");
            return immutableEntry(names.get(index), args[index]);
        }
        return immutableEntry(ORIGINAL_FORMAT, originalFormat);
    }

    /**
     * All name/value pairs: one per placeholder, followed by the {@value #ORIGINAL_FORMAT} pair.
     * Values beyond the number of placeholders are not included.
     *
     * @throws IndexOutOfBoundsException if {@code values} is shorter than the number of names
     */
    public List<Map.Entry<String, Object>> getValues(Object[] values)
    {
        final List<String> names = getValueNames();
        final Object[] args = values == null ? EMPTY_VALUES : values;
        if (args.length < names.size()) {
            throw new IndexOutOfBoundsException(String.format("Template has %s placeholder(s) but only %s value(s) were supplied", names.size(), args.length));
        }
        final ImmutableList.Builder<Map.Entry<String, Object>> builder = ImmutableList.builderWithExpectedSize(names.size() + 1);
        for (int i = 0; i < names.size(); i++) {
            builder.add(immutableEntry(names.get(i), args[i]));
        }
        builder.add(immutableEntry(ORIGINAL_FORMAT, originalFormat));
        return builder.build();
    }

    ParsedTemplate getParsedTemplate()
    {
        return parsedTemplate.get();
    }

    @Override
    public String toString()
    {
        return "LogValuesFormatter{" +
                "originalFormat='" + originalFormat + '\'' +
                '}';
    }
}
