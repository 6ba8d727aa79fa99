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

import com.google.common.base.Joiner;
import com.google.common.collect.Iterables;
import org.iq80.logvalues.format.InvariantValueFormatter;

import java.lang.reflect.Array;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.iq80.logvalues.impl.LogValuesFormatter.NULL_VALUE;

/**
 * Prepares arguments for display: {@code null} becomes {@value LogValuesFormatter#NULL_VALUE} and
 * collections, arrays and maps become the comma separated text of their elements.
 * Character sequences and paths are kept as they are, although a {@link Path} is iterable.
 */
public final class DisplayValues
{
    private static final Object[] EMPTY = new Object[0];
    private static final Joiner JOINER = Joiner.on(", ").useForNull(NULL_VALUE);

    private DisplayValues()
    {
    }

    /**
     * @return a new array holding the display form of each value; {@code values} is not modified
     */
    static Object[] of(Object[] values)
    {
        if (values == null) {
            return EMPTY;
        }
        final Object[] display = new Object[values.length];
        for (int i = 0; i < values.length; i++) {
            display[i] = toDisplayValue(values[i]);
        }
        return display;
    }

    public static Object toDisplayValue(Object value)
    {
        if (value == null) {
            return NULL_VALUE;
        }
        if (value instanceof CharSequence || value instanceof Path) {
            return value;
        }
        if (value instanceof Iterable) {
            return join((Iterable<?>) value);
        }
        if (value instanceof Map) {
            return join(((Map<?, ?>) value).entrySet());
        }
        if (value.getClass().isArray()) {
            return join(arrayElements(value));
        }
        return value;
    }

    private static String join(Iterable<?> elements)
    {
        return JOINER.join(Iterables.transform(elements, element -> element == null ? null : InvariantValueFormatter.INSTANCE.format(element, null)));
    }

    private static List<?> arrayElements(Object array)
    {
        if (array instanceof Object[]) {
            return Arrays.asList((Object[]) array);
        }
        // primitive array
        int length = Array.getLength(array);
        List<Object> elements = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            elements.add(Array.get(array, i));
        }
        return elements;
    }
}
