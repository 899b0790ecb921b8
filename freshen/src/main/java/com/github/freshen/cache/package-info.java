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
 * This package contains in-memory caches that keep their entries fresh by re-invoking a loader in
 * the background. All cache variants are configured and created using the
 * {@link com.github.freshen.cache.Freshen} builder.
 * <p>
 * A {@link com.github.freshen.cache.PointCache} populates each key lazily on its first request
 * with a {@link com.github.freshen.cache.PointLoader}, coalescing concurrent requests for the same
 * key into a single load. Entries that are stale and still being read are reloaded by the cache's
 * maintenance task, so that a hot key is rarely ever loaded on a reader's thread after its first
 * request.
 * <p>
 * A {@link com.github.freshen.cache.BulkCache} is populated by a
 * {@link com.github.freshen.cache.BulkLoader} that writes many mappings in a single run. Readers
 * wait until the first run succeeds, and the loader is run again on a fixed cadence thereafter.
 * <p>
 * Every cache owns a maintenance task and must be {@linkplain
 * com.github.freshen.cache.RefreshingCache#close() closed} when it is no longer needed.
 */
@NullMarked
@CheckReturnValue
package com.github.freshen.cache;

import org.jspecify.annotations.NullMarked;

import com.google.errorprone.annotations.CheckReturnValue;
