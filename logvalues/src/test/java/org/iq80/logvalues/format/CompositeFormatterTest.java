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

import org.iq80.logvalues.LogFormatException;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertThrows;

public class CompositeFormatterTest
{
    @DataProvider(name = "formats")
    public Object[][] formats()
    {
        return new Object[][] {
                {"{0} + {1} = {2}", new Object[] {1, 2, 3}, "1 + 2 = 3"},
                {"{1}{0}", new Object[] {"a", "b"}, "ba"},
                {"{0} and {0}", new Object[] {"again"}, "again and again"},
                {"{{0}}", new Object[] {"x"}, "{0}"},
                {"{{{0}}}", new Object[] {"x"}, "{x}"},
                {"[{0,5}]", new Object[] {"ab"}, "[   ab]"},
                {"[{0,-5}]", new Object[] {"ab"}, "[ab   ]"},
                {"[{0,2}]", new Object[] {"abcd"}, "[abcd]"},
                {"[{0 , 4 :D2}]", new Object[] {7}, "[  07]"},
                {"{0:F1}", new Object[] {2.25}, "2.3"},
                {"{0}", new Object[] {null}, ""},
                {"a } b", new Object[0], "a } b"},
                {"{x}", new Object[0], "{x}"},
                {"{}", new Object[0], "{}"},
                {"{0", new Object[] {1}, "{0"},
                {"{0,x}", new Object[] {1}, "{0,x}"},
                {"ab", null, "ab"},
        };
    }

    @Test(dataProvider = "formats")
    public void testFormat(String format, Object[] args, String expected)
    {
        assertEquals(CompositeFormatter.invariant().format(format, args), expected);
    }

    @Test
    public void testMissingArgument()
    {
        CompositeFormatter formatter = CompositeFormatter.invariant();
        assertThrows(LogFormatException.class, () -> formatter.format("{1}", "a"));
        assertThrows(LogFormatException.class, () -> formatter.format("{0}", (Object[]) null));
    }

    @Test
    public void testMissingArgumentMessage()
    {
        try {
            CompositeFormatter.invariant().format("{0} {3}", "a", "b");
        }
        catch (LogFormatException e) {
            assertEquals(e.getMessage(), "Format item {3} references a missing argument, only 2 argument(s) supplied");
            return;
        }
        throw new AssertionError("expected LogFormatException");
    }

    @Test
    public void testSpecIsForwardedToValueFormatter()
    {
        CompositeFormatter formatter = new CompositeFormatter((value, formatString) -> "<" + value + ":" + formatString + ">");
        assertEquals(formatter.format("{0:abc} {1}", 1, 2), "<1:abc> <2:null>");
        assertEquals(formatter.format("{0,8:x}", 1), "   <1:x>");
    }
}
