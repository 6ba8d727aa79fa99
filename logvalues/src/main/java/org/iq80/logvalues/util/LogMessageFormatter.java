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
package org.iq80.logvalues.util;

import com.google.common.base.Joiner;
import com.google.common.collect.Iterables;
import org.iq80.logvalues.LogFormatException;
import org.iq80.logvalues.impl.DisplayValues;
import org.iq80.logvalues.impl.FormatterCache;
import org.iq80.logvalues.impl.LogValuesFormatter;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Formats log lines: a timestamp followed by the message.
 */
public final class LogMessageFormatter
{
    private static final int DATE_SIZE = 28;
    private static final Joiner EXTRA_ARGS = Joiner.on(", ");

    private final Supplier<LocalDateTime> clock;
    private final FormatterCache formatters;

    public LogMessageFormatter(Supplier<LocalDateTime> clock, FormatterCache formatters)
    {
        this.clock = requireNonNull(clock, "clock is null");
        this.formatters = requireNonNull(formatters, "formatters is null");
    }

    public String format(String message)
    {
        final StringBuilder sb = new StringBuilder(message.length() + DATE_SIZE);
        sb.append(clock.get());
        sb.append(' ');
        sb.append(message);
        return sb.toString();
    }

    /**
     * Render {@code template} with its named placeholders bound to {@code args}. Arguments without a
     * placeholder are appended at the end in square braces, converted like the bound ones.
     * <p>
     * A template that cannot be rendered, for example because it has more placeholders than there are
     * arguments, is written as is and followed by all arguments in square braces.
     */
    public String format(String template, Object[] args)
    {
        template = String.valueOf(template); // null -> "null"
        final Object[] values = args == null ? new Object[0] : args;

        final LogValuesFormatter formatter = formatters.get(template);
        String message;
        int bound;
        try {
            message = formatter.format(values);
            bound = formatter.getValueNames().size();
        }
        catch (LogFormatException e) {
            message = template;
            bound = 0;
        }
        StringBuilder builder = new StringBuilder(DATE_SIZE + message.length() + 16 * values.length);
        builder.append(clock.get());
        builder.append(' ');
        builder.append(message);

        // if we run out of placeholders, append the extra args in square braces
        if (bound < values.length) {
            builder.append(" [");
            EXTRA_ARGS.appendTo(builder, Iterables.transform(Arrays.asList(values).subList(bound, values.length), DisplayValues::toDisplayValue));
            builder.append(']');
        }
        return builder.toString();
    }
}
