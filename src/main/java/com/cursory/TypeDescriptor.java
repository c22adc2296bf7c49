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

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Describes the logical SQL type of an expression.
 *
 * @since 1.0.0
 */
public interface TypeDescriptor {
	/**
	 * A key which is equal for all instances that behave identically; it is embedded in cache keys.
	 *
	 * @return this type's static cache key
	 */
	@NonNull
	Object getStaticCacheKey();

	/**
	 * The general family of this type, e.g. "integer" for both {@code INTEGER} and {@code BIGINT}.
	 *
	 * @return this type's affinity
	 */
	@NonNull
	Object getAffinity();

	default boolean hasAffinityWith(@NonNull TypeDescriptor typeDescriptor) {
		requireNonNull(typeDescriptor);
		return getAffinity().equals(typeDescriptor.getAffinity());
	}

	/**
	 * The decoder to apply to raw values of this type, given the driver's type code for the column.
	 *
	 * @param dialect      the dialect in effect
	 * @param jdbcTypeCode the raw column's {@link java.sql.Types} code
	 * @return the decoder, or empty if raw values can be used as-is
	 */
	@NonNull
	default Optional<ValueDecoder> resultDecoder(@NonNull Dialect dialect,
																							 int jdbcTypeCode) {
		return Optional.empty();
	}
}
