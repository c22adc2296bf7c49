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

import javax.annotation.concurrent.NotThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * Thrown by {@link Row#getAttribute(String)} when the name is not a column of the row.
 * <p>
 * The underlying {@link NoSuchColumnException} is available as the cause.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class NoSuchAttributeException extends DatabaseException {
	@NonNull
	private final String attributeName;

	public NoSuchAttributeException(@NonNull String attributeName,
																	@NonNull NoSuchColumnException cause) {
		super(requireNonNull(cause).getMessage(), cause);
		this.attributeName = requireNonNull(attributeName);
	}

	@NonNull
	public String getAttributeName() {
		return this.attributeName;
	}
}
