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

/**
 * Converts a raw driver value into the value exposed by a {@link Row}.
 * <p>
 * Decoders are chosen once per column when {@link RowMetadata} is resolved and applied exactly once per value.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ValueDecoder {
	/**
	 * Decodes {@code rawValue}.
	 *
	 * @param rawValue the value as returned by the driver, may be {@code null}
	 * @return the decoded value
	 */
	@Nullable
	Object decode(@Nullable Object rawValue);

	/**
	 * A decoder which returns its input unchanged.
	 *
	 * @return the pass-through decoder
	 */
	@NonNull
	static ValueDecoder passThrough() {
		return PassThroughValueDecoder.INSTANCE;
	}

	/**
	 * Is this the pass-through decoder?
	 *
	 * @return {@code true} if values are not changed by this decoder
	 */
	default boolean isPassThrough() {
		return false;
	}
}

enum PassThroughValueDecoder implements ValueDecoder {
	INSTANCE;

	@Override
	@Nullable
	public Object decode(@Nullable Object rawValue) {
		return rawValue;
	}

	@Override
	public boolean isPassThrough() {
		return true;
	}
}
