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

import java.io.Closeable;
import java.io.IOException;
import java.util.Arrays;

/**
 * An interface for writing log messages.
 */
public interface Logger extends Closeable
{
    void log(String message);

    /**
     * Renders {@code template}, whose named placeholders such as {@code {UserId}} are bound to
     * {@code args} by position, and logs the result.
     * <p>
     * Implementations that do not understand named placeholders inherit this default, which logs the
     * template text followed by the arguments in square brackets. Logging never fails because of the
     * template: a template that cannot be rendered against {@code args}, for example one with more
     * placeholders than arguments, is logged as written, followed by the arguments.
     *
     * @param template a non-null template string containing 0 or more named placeholders.
     * @param args     the arguments bound to the placeholders, in order of appearance.
     */
    default void log(String template, Object... args)
    {
        if (args == null || args.length == 0) {
            log(template);
        }
        else {
            log(template + " " + Arrays.toString(args));
        }
    }

    @Override
    default void close() throws IOException
    {
        //nothing to release by default
    }
}
