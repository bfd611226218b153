/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * Provides annotation types for documenting visibility constraints.
 * <p>
 * {@link io.github.jbellis.fsstore.annotations.VisibleForTesting} marks classes, methods, or fields
 * that are made visible solely for testing purposes. These elements are internal implementation
 * details and may change without warning despite their visibility level.
 */
package io.github.jbellis.fsstore.annotations;
