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
package org.iq80.logvalues;

/**
 * Options to control how formatters are shared and how the library reports its own activity.
 */
public class FormatOptions
{
    private int maxCachedFormatters = 1024;
    private Logger logger;

    /**
     * Clone, create a copy of the provided instance of {@link FormatOptions}
     */
    public static FormatOptions fromOptions(FormatOptions options)
    {
        checkArgNotNull(options, "Options can't be null");
        final FormatOptions options1 = new FormatOptions();
        options1.maxCachedFormatters = options.maxCachedFormatters;
        options1.logger = options.logger;
        return options1;
    }

    /**
     * Create a FormatOptions object with default values for all fields.
     */
    public static FormatOptions newDefaultOptions()
    {
        return new FormatOptions();
    }

    static void checkArgNotNull(Object value, String name)
    {
        if (value == null) {
            throw new IllegalArgumentException("The " + name + " argument cannot be null");
        }
    }

    public int maxCachedFormatters()
    {
        return maxCachedFormatters;
    }

    /**
     * Number of parsed templates kept for reuse. Templates are usually string constants at the
     * logging call site, so a small cache covers most applications.
     * Least recently used entries are evicted once the limit is reached; zero disables caching and
     * every lookup parses its template again.
     * <p>
     * Default: 1024
     */
    public FormatOptions maxCachedFormatters(int maxCachedFormatters)
    {
        if (maxCachedFormatters < 0) {
            throw new IllegalArgumentException("maxCachedFormatters is negative: " + maxCachedFormatters);
        }
        this.maxCachedFormatters = maxCachedFormatters;
        return this;
    }

    public Logger logger()
    {
        return logger;
    }

    /**
     * Internal progress information, such as formatter cache evictions, is written to
     * {@code logger} if it is non-null and discarded otherwise.
     */
    public FormatOptions logger(Logger logger)
    {
        this.logger = logger;
        return this;
    }
}
