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
import org.testng.annotations.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertSame;

public class DisplayValuesTest
{
    @Test
    public void testNullIsReplaced()
    {
        assertEquals(DisplayValues.toDisplayValue(null), "(null)");
    }

    @Test
    public void testScalarsAreKept()
    {
        StringBuilder text = new StringBuilder("a,b");
        assertSame(DisplayValues.toDisplayValue(text), text);
        assertSame(DisplayValues.toDisplayValue("abc"), "abc");
        assertEquals(DisplayValues.toDisplayValue(42), 42);
    }

    @Test
    public void testPathIsNotSplit()
    {
        Path path = Paths.get("/var/log/app.log");
        assertSame(DisplayValues.toDisplayValue(path), path);
        assertEquals(DisplayValues.toDisplayValue(Arrays.asList(path, null)), path + ", (null)");
    }

    @Test
    public void testCollectionsAreJoined()
    {
        assertEquals(DisplayValues.toDisplayValue(Arrays.asList(1, null, 3)), "1, (null), 3");
        assertEquals(DisplayValues.toDisplayValue(new LinkedHashSet<>(Arrays.asList("b", "a"))), "b, a");
        assertEquals(DisplayValues.toDisplayValue(ImmutableList.of()), "");
        assertEquals(DisplayValues.toDisplayValue(Arrays.asList(ImmutableList.of(1, 2), 3)), "[1, 2], 3");
        assertEquals(DisplayValues.toDisplayValue(ImmutableList.of(new Date(0))), "1970-01-01T00:00:00Z");
    }

    @Test
    public void testArraysAreJoined()
    {
        assertEquals(DisplayValues.toDisplayValue(new Object[] {"x", null}), "x, (null)");
        assertEquals(DisplayValues.toDisplayValue(new int[] {1, 2, 3}), "1, 2, 3");
        assertEquals(DisplayValues.toDisplayValue(new char[] {'a', 'b'}), "a, b");
        assertEquals(DisplayValues.toDisplayValue(new double[0]), "");
    }

    @Test
    public void testMapsAreJoined()
    {
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put("a", 1);
        map.put("b", null);
        assertEquals(DisplayValues.toDisplayValue(map), "a=1, b=null");
    }

    @Test
    public void testOfCopiesValues()
    {
        Object[] values = {null, Arrays.asList(1, 2), "s"};
        Object[] display = DisplayValues.of(values);
        assertEquals(display, new Object[] {"(null)", "1, 2", "s"});
        assertNull(values[0]);
        assertEquals(DisplayValues.of(null).length, 0);
    }
}
