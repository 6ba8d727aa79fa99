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
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.List;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class TemplateParserTest
{
    @DataProvider(name = "templates")
    public Object[][] templates()
    {
        return new Object[][] {
                {"User {UserId} logged in from {IpAddress}", "User {0} logged in from {1}", ImmutableList.of("UserId", "IpAddress")},
                {"{Name}", "{0}", ImmutableList.of("Name")},
                {"{A} and {A}", "{0} and {1}", ImmutableList.of("A", "A")},
                {"{A}{B}", "{0}{1}", ImmutableList.of("A", "B")},
                {"{Count,5:D2}", "{0,5:D2}", ImmutableList.of("Count")},
                {"{A,-10}", "{0,-10}", ImmutableList.of("A")},
                {"{Time:HH:mm}", "{0:HH:mm}", ImmutableList.of("Time")},
                {"{{escaped}}", "{{escaped}}", ImmutableList.of()},
                {"{{{X}}}", "{{{0}}}", ImmutableList.of("X")},
                {"{{a}} {B}", "{{a}} {0}", ImmutableList.of("B")},
                {"{Name", "{Name", ImmutableList.of()},
                {"a } b {A}", "a } b {0}", ImmutableList.of("A")},
                {"{0}", "{0}", ImmutableList.of("0")},
                {"{a}", "{0}", ImmutableList.of("a")},
                {"{}x", "{0}x", ImmutableList.of("")},
                {"{a{b}", "{0}", ImmutableList.of("a{b")},
                {"no placeholders", "no placeholders", ImmutableList.of()},
        };
    }

    @Test(dataProvider = "templates")
    public void testParse(String template, String expectedFormat, List<String> expectedNames)
    {
        ParsedTemplate parsed = TemplateParser.parse(template);
        assertFalse(parsed.isLiteral());
        assertEquals(parsed.getFormat(), expectedFormat);
        assertEquals(parsed.getNames(), expectedNames);
    }

    @DataProvider(name = "shortTemplates")
    public Object[][] shortTemplates()
    {
        return new Object[][] {{""}, {"a"}, {"{}"}, {"}{"}, {"{{"}, {"}}"}, {"{a"}};
    }

    @Test(dataProvider = "shortTemplates")
    public void testShortTemplatesAreNotScanned(String template)
    {
        ParsedTemplate parsed = TemplateParser.parse(template);
        assertTrue(parsed.isLiteral());
        assertEquals(parsed.getFormat(), template);
        assertTrue(parsed.getNames().isEmpty());
    }

    @Test
    public void testEveryPlaceholderHasOneSlot()
    {
        ParsedTemplate parsed = TemplateParser.parse("{A} {B,3} {A:F2} {{literal}} {C}");
        assertEquals(parsed.getFormat(), "{0} {1,3} {2:F2} {{literal}} {3}");
        assertEquals(parsed.getNames(), ImmutableList.of("A", "B", "A", "C"));
    }

    @Test(expectedExceptions = NullPointerException.class)
    public void testNullTemplate()
    {
        TemplateParser.parse(null);
    }
}
