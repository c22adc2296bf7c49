/*
 * Copyright 2022-2026 Revetware LLC.
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

package com.cursory;

import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

import static java.lang.String.format;

/**
 * Thrown when a key matches more than one column of a result, for example {@code id} in a join of two tables that
 * both expose an {@code id} column.
 * <p>
 * Positional access and access by the declaring column object still work for such columns.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class AmbiguousColumnException extends NoSuchColumnException {
	public AmbiguousColumnException(@Nullable Object key) {
		super(key, format("Ambiguous column name '%s' in result set column descriptions", key));
	}
}
