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

import java.util.AbstractList;
import java.util.Map;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.collect.Maps.immutableEntry;
import static java.util.Objects.requireNonNull;

/**
 * State of one structured log event: a template together with the values bound to its
 * placeholders.
 * <p>
 * As a list it holds the name/value pairs, the last one being the
 * {@value LogValuesFormatter#ORIGINAL_FORMAT} pair; {@link #toString()} renders the message.
 */
public final class FormattedLogValues
        extends AbstractList<Map.Entry<String, Object>>
{
    static final String NULL_FORMAT = "[null]";
    private static final Object[] EMPTY_VALUES = new Object[0];

    private final LogValuesFormatter formatter;
    private final Object[] values;
    private final String originalMessage;

    public FormattedLogValues(FormatterCache formatters, String format, Object... values)
    {
        requireNonNull(formatters, "formatters is null");
        this.values = values == null ? EMPTY_VALUES : values;
        this.originalMessage = format == null ? NULL_FORMAT : format;
        // without values there is nothing to bind, the message is the template itself
        this.formatter = format != null && this.values.length > 0 ? formatters.get(format) : null;
    }

    public String getOriginalMessage()
    {
        return originalMessage;
    }

    @Override
    public Map.Entry<String, Object> get(int index)
    {
        checkElementIndex(index, size());
        if (index == size() - 1) {
            return immutableEntry(LogValuesFormatter.ORIGINAL_FORMAT, originalMessage);
        }
        return formatter.getValue(values, index);
    }

    @Override
    public int size()
    {
        if (formatter == null) {
            return 1;
        }
        return formatter.getValueNames().size() + 1;
    }

    @Override
    public String toString()
    {
        if (formatter == null) {
            return originalMessage;
        }
        return formatter.format(values);
    }
}
