/*
 * Copyright 2026 The Freshen Authors. All Rights Reserved.
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

/**
 * This package contains caching statistic utilities.
 * <p>
 * Statistics are accumulated by a {@link com.github.freshen.cache.stats.StatsCounter} when the
 * cache is built with {@link com.github.freshen.cache.Freshen#recordStats()} and are read as an
 * immutable {@link com.github.freshen.cache.stats.CacheStats} snapshot.
 */
@NullMarked
package com.github.freshen.cache.stats;

import org.jspecify.annotations.NullMarked;
