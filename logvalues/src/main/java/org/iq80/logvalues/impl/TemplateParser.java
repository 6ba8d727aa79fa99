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

import static java.util.Objects.requireNonNull;

/**
 * Rewrites named placeholders into positional ones.
 * <p>
 * {@code "User {UserId,8} from {Ip}"} becomes {@code "User {0,8} from {1}"} with names
 * {@code [UserId, Ip]}. Every placeholder takes the next index, so a repeated name is listed once
 * per occurrence. Alignment and format specifier are copied unchanged.
 */
public final class TemplateParser
{
    // "{0}" is the shortest template that can hold a placeholder
    static final int MIN_TEMPLATE_LENGTH = 3;

    private TemplateParser()
    {
    }

    public static ParsedTemplate parse(String template)
    {
        requireNonNull(template, "template is null");
        if (template.length() < MIN_TEMPLATE_LENGTH) {
            return ParsedTemplate.literal(template);
        }

        final int endIndex = template.length();
        final StringBuilder sb = new StringBuilder(endIndex);
        final ImmutableList.Builder<String> names = ImmutableList.builder();
        int nameCount = 0;
        int scanIndex = 0;
        while (scanIndex < endIndex) {
            int openBraceIndex = BracePolicy.OPEN.find(template, scanIndex, endIndex);
            int closeBraceIndex = BracePolicy.CLOSE.find(template, openBraceIndex, endIndex);

            if (closeBraceIndex == endIndex) {
                // no more placeholders, an unmatched opener stays literal text
                sb.append(template, scanIndex, endIndex);
                scanIndex = endIndex;
            }
            else {
                // format item syntax: {index[,alignment][:formatString]}
                int delimiterIndex = indexOfDelimiter(template, openBraceIndex, closeBraceIndex);
                sb.append(template, scanIndex, openBraceIndex + 1);
                sb.append(nameCount++);
                names.add(template.substring(openBraceIndex + 1, delimiterIndex));
                sb.append(template, delimiterIndex, closeBraceIndex + 1);
                scanIndex = closeBraceIndex + 1;
            }
        }
        return ParsedTemplate.positional(sb.toString(), names.build());
    }

    private static int indexOfDelimiter(String template, int startIndex, int endIndex)
    {
        for (int i = startIndex; i < endIndex; i++) {
            char c = template.charAt(i);
            if (c == ',' || c == ':') {
                return i;
            }
        }
        return endIndex;
    }
}
