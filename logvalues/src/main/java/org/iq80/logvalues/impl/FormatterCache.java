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

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.RemovalListener;
import org.iq80.logvalues.FormatOptions;
import org.iq80.logvalues.Logger;

import static java.util.Objects.requireNonNull;

/**
 * LRU cache of {@link LogValuesFormatter} keyed by template, so that a template logged repeatedly
 * is parsed once.
 */
public final class FormatterCache
{
    private final Cache<String, LogValuesFormatter> cache;
    private final Logger logger;

    private FormatterCache(int capacity, Logger logger)
    {
        this.logger = logger;
        if (capacity == 0) {
            this.cache = null;
        }
        else {
            RemovalListener<String, LogValuesFormatter> listener = notification -> {
                if (notification.wasEvicted()) {
                    logEviction(notification.getKey());
                }
            };
            this.cache = CacheBuilder.newBuilder()
                    .maximumSize(capacity)
                    .concurrencyLevel(1 << 4)
                    .removalListener(listener)
                    .build();
        }
    }

    public static FormatterCache createCache(FormatOptions options)
    {
        requireNonNull(options, "options is null");
        return new FormatterCache(options.maxCachedFormatters(), options.logger());
    }

    /**
     * Get the formatter of {@code template}, creating and caching it if needed.
     */
    public LogValuesFormatter get(String template)
    {
        requireNonNull(template, "template is null");
        if (cache == null) {
            return new LogValuesFormatter(template);
        }
        return cache.asMap().computeIfAbsent(template, LogValuesFormatter::new);
    }

    /**
     * Get a cached formatter.
     *
     * @return formatter if present, {@code null} otherwise
     */
    public LogValuesFormatter getIfPresent(String template)
    {
        return cache == null ? null : cache.getIfPresent(template);
    }

    public long size()
    {
        return cache == null ? 0 : cache.size();
    }

    /**
     * Discards all cached formatters.
     */
    public void invalidateAll()
    {
        if (cache != null) {
            cache.invalidateAll();
        }
    }

    private void logEviction(String template)
    {
        if (logger != null) {
            logger.log("Evicted cached formatter for template {Template}", template);
        }
    }
}
