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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

import static java.lang.String.format;

/**
 * Thrown when a row is asked for a key that its {@link RowMetadata} does not know about.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class NoSuchColumnException extends DatabaseException {
	@Nullable
	private final transient Object key;

	public NoSuchColumnException(@Nullable Object key) {
		this(key, format("Could not locate column in row for column '%s'", key));
	}

	protected NoSuchColumnException(@Nullable Object key,
																	@NonNull String message) {
		super(message);
		this.key = key;
	}

	/**
	 * The key that could not be located, as supplied by the caller.
	 *
	 * @return the requested key
	 */
	@Nullable
	public Object getKey() {
		return this.key;
	}
}
