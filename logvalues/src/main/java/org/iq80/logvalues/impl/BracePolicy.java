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

/**
 * How a run of identical braces is resolved while scanning a template.
 * <p>
 * A run of even length is always an escaped literal. In a run of odd length one brace is real, and
 * which one depends on the brace: an opening brace is the <em>last</em> of its run, a closing brace
 * the <em>first</em> of its run. That way {@code {{{X}}}} reads as a literal {@code {}, the
 * placeholder {@code {X}} and a literal {@code }}.
 */
public enum BracePolicy
{
    OPEN('{', true),
    CLOSE('}', false);

    private final char brace;
    private final boolean lastOfRun;

    BracePolicy(char brace, boolean lastOfRun)
    {
        this.brace = brace;
        this.lastOfRun = lastOfRun;
    }

    public char brace()
    {
        return brace;
    }

    /**
     * Find the position of the first unescaped brace in {@code text} between {@code start}
     * (inclusive) and {@code end} (exclusive).
     *
     * @return index of the unescaped brace, or {@code end} if there is none
     */
    public int find(String text, int start, int end)
    {
        int braceIndex = end;
        int runLength = 0;
        for (int i = start; i < end; i++) {
            char c = text.charAt(i);
            if (runLength > 0 && c != brace) {
                if (runLength % 2 == 0) {
                    // escaped, look for the next run
                    runLength = 0;
                    braceIndex = end;
                }
                else {
                    break;
                }
            }
            else if (c == brace) {
                if (lastOfRun || runLength == 0) {
                    braceIndex = i;
                }
                runLength++;
            }
        }
        return braceIndex;
    }
}
