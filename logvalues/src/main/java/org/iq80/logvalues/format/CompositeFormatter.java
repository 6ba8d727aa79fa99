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
package org.iq80.logvalues.format;

import com.google.common.base.Strings;
import org.iq80.logvalues.LogFormatException;

import static java.util.Objects.requireNonNull;

/**
 * Renders positional composite format strings such as {@code "{0} took {1,8:F3} ms"}.
 * <p>
 * A format item is {@code {index[,alignment][:formatString]}}. A positive alignment right-aligns the
 * text in a field of that width, a negative one left-aligns it. {@code {{} and {@code }}} stand for
 * literal braces. A brace that does not belong to a well-formed item is copied as is, so an item with
 * a malformed alignment such as {@code {0,abc}} appears verbatim in the output.
 * <p>
 * An item referencing an argument that was not supplied fails with {@link LogFormatException}.
 */
public final class CompositeFormatter
{
    private static final CompositeFormatter INVARIANT = new CompositeFormatter(InvariantValueFormatter.INSTANCE);
    private static final Object[] NO_ARGUMENTS = new Object[0];

    // same limits as the index and width of format items in other composite format engines
    private static final int MAX_INDEX = 1_000_000;
    private static final int MAX_ALIGNMENT = 1_000_000;

    private final ValueFormatter valueFormatter;

    public CompositeFormatter(ValueFormatter valueFormatter)
    {
        this.valueFormatter = requireNonNull(valueFormatter, "valueFormatter is null");
    }

    public static CompositeFormatter invariant()
    {
        return INVARIANT;
    }

    public String format(String format, Object... args)
    {
        requireNonNull(format, "format is null");
        final Object[] arguments = args == null ? NO_ARGUMENTS : args;
        final int length = format.length();
        final StringBuilder sb = new StringBuilder(length + 16 * arguments.length);
        int pos = 0;
        while (pos < length) {
            char c = format.charAt(pos);
            if (c == '{') {
                if (pos + 1 < length && format.charAt(pos + 1) == '{') {
                    sb.append('{');
                    pos += 2;
                    continue;
                }
                FormatItem item = FormatItem.parse(format, pos);
                if (item == null) {
                    sb.append(c);
                    pos++;
                }
                else {
                    appendItem(sb, item, arguments);
                    pos = item.end;
                }
            }
            else if (c == '}') {
                sb.append(c);
                pos += pos + 1 < length && format.charAt(pos + 1) == '}' ? 2 : 1;
            }
            else {
                sb.append(c);
                pos++;
            }
        }
        return sb.toString();
    }

    private void appendItem(StringBuilder sb, FormatItem item, Object[] arguments)
    {
        if (item.index >= arguments.length) {
            throw new LogFormatException(String.format("Format item {%s} references a missing argument, only %s argument(s) supplied",
                    item.index,
                    arguments.length));
        }
        String text = valueFormatter.format(arguments[item.index], item.formatString);
        if (item.alignment > 0) {
            sb.append(Strings.padStart(text, item.alignment, ' '));
        }
        else if (item.alignment < 0) {
            sb.append(Strings.padEnd(text, -item.alignment, ' '));
        }
        else {
            sb.append(text);
        }
    }

    static final class FormatItem
    {
        final int index;
        final int alignment;
        final String formatString;
        // position just after the closing brace
        final int end;

        private FormatItem(int index, int alignment, String formatString, int end)
        {
            this.index = index;
            this.alignment = alignment;
            this.formatString = formatString;
            this.end = end;
        }

        /**
         * Parse the format item whose opening brace is at {@code start}.
         *
         * @return the item, or {@code null} if the text at {@code start} is not a well-formed item
         */
        static FormatItem parse(String format, int start)
        {
            final int length = format.length();
            int pos = start + 1;
            if (pos >= length || !isDigit(format.charAt(pos))) {
                return null;
            }
            int index = 0;
            while (pos < length && isDigit(format.charAt(pos))) {
                index = index * 10 + (format.charAt(pos) - '0');
                if (index >= MAX_INDEX) {
                    return null;
                }
                pos++;
            }
            pos = skipSpaces(format, pos);

            int alignment = 0;
            if (pos < length && format.charAt(pos) == ',') {
                pos = skipSpaces(format, pos + 1);
                boolean leftAlign = pos < length && format.charAt(pos) == '-';
                if (leftAlign) {
                    pos++;
                }
                if (pos >= length || !isDigit(format.charAt(pos))) {
                    return null;
                }
                int width = 0;
                while (pos < length && isDigit(format.charAt(pos))) {
                    width = width * 10 + (format.charAt(pos) - '0');
                    if (width >= MAX_ALIGNMENT) {
                        return null;
                    }
                    pos++;
                }
                pos = skipSpaces(format, pos);
                alignment = leftAlign ? -width : width;
            }

            String formatString = null;
            if (pos < length && format.charAt(pos) == ':') {
                int specStart = ++pos;
                while (pos < length && format.charAt(pos) != '}') {
                    if (format.charAt(pos) == '{') {
                        return null;
                    }
                    pos++;
                }
                formatString = format.substring(specStart, pos);
            }

            if (pos >= length || format.charAt(pos) != '}') {
                return null;
            }
            return new FormatItem(index, alignment, formatString, pos + 1);
        }

        private static boolean isDigit(char c)
        {
            return c >= '0' && c <= '9';
        }

        private static int skipSpaces(String format, int pos)
        {
            while (pos < format.length() && format.charAt(pos) == ' ') {
                pos++;
            }
            return pos;
        }
    }
}
