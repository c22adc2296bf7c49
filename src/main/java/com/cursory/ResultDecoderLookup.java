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

import static java.util.Objects.requireNonNull;

/**
 * Chooses the {@link ValueDecoder} for a result column, given its declared type and the driver's description of it.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResultDecoderLookup {
	/**
	 * Picks a decoder.
	 *
	 * @param dialect             the dialect in effect
	 * @param declaredType        the declared (or, for undeclared columns, {@link SqlType#NULL}) type
	 * @param rawColumnDescriptor the driver's description of the column
	 * @return the decoder to use, {@link ValueDecoder#passThrough()} if none is needed
	 */
	@NonNull
	ValueDecoder decoderFor(@NonNull Dialect dialect,
													@NonNull TypeDescriptor declaredType,
													@NonNull RawColumnDescriptor rawColumnDescriptor);

	/**
	 * Asks the declared type for its decoder.
	 *
	 * @return the default lookup
	 */
	@NonNull
	static ResultDecoderLookup fromDeclaredTypes() {
		return (dialect, declaredType, rawColumnDescriptor) -> {
			requireNonNull(dialect);
			requireNonNull(declaredType);
			requireNonNull(rawColumnDescriptor);

			return declaredType.resultDecoder(dialect, rawColumnDescriptor.getJdbcTypeCode())
					.orElse(ValueDecoder.passThrough());
		};
	}
}
