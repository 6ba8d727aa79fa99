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

/**
 * Converts a single argument to text for a format item.
 */
public interface ValueFormatter
{
    /**
     * @param value the argument, may be {@code null}
     * @param formatString the text after {@code ':'} in the format item, or {@code null} when there is none
     * @return the text of {@code value}, never {@code null}
     * @throws org.iq80.logvalues.LogFormatException if {@code formatString} does not apply to {@code value}
     */
    String format(Object value, String formatString);
}
