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
 * Thrown when a positional template cannot be rendered against the supplied arguments, for example
 * when a format item references an argument that was not supplied or when a format specifier does
 * not apply to the argument's type.
 */
public class LogFormatException
        extends IllegalArgumentException
{
    public LogFormatException(String message)
    {
        super(message);
    }

    public LogFormatException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
