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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Types;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Commonly-used {@link TypeDescriptor}s.
 *
 * @since 1.0.0
 */
public enum SqlType implements TypeDescriptor {
	INTEGER("integer") {
		@Override
		@NonNull
		public Optional<ValueDecoder> resultDecoder(@NonNull Dialect dialect, int jdbcTypeCode) {
			requireNonNull(dialect);

			if (jdbcTypeCode == Types.INTEGER)
				return Optional.empty();

			return Optional.of(value -> value instanceof Number && !(value instanceof Integer)
					? ((Number) value).intValue() : value);
		}
	},
	BIGINT("integer") {
		@Override
		@NonNull
		public Optional<ValueDecoder> resultDecoder(@NonNull Dialect dialect, int jdbcTypeCode) {
			requireNonNull(dialect);

			if (jdbcTypeCode == Types.BIGINT)
				return Optional.empty();

			return Optional.of(value -> value instanceof Number && !(value instanceof Long)
					? ((Number) value).longValue() : value);
		}
	},
	NUMERIC("numeric") {
		@Override
		@NonNull
		public Optional<ValueDecoder> resultDecoder(@NonNull Dialect dialect, int jdbcTypeCode) {
			requireNonNull(dialect);

			if (jdbcTypeCode == Types.NUMERIC || jdbcTypeCode == Types.DECIMAL)
				return Optional.empty();

			return Optional.of(SqlType::toBigDecimal);
		}
	},
	VARCHAR("string"),
	BOOLEAN("boolean") {
		@Override
		@NonNull
		public Optional<ValueDecoder> resultDecoder(@NonNull Dialect dialect, int jdbcTypeCode) {
			requireNonNull(dialect);

			if (jdbcTypeCode == Types.BOOLEAN || jdbcTypeCode == Types.BIT)
				return Optional.empty();

			// Databases without a native boolean hand back 0/1
			return Optional.of(value -> value instanceof Number ? ((Number) value).intValue() != 0 : value);
		}
	},
	TIMESTAMP("datetime") {
		@Override
		@NonNull
		public Optional<ValueDecoder> resultDecoder(@NonNull Dialect dialect, int jdbcTypeCode) {
			requireNonNull(dialect);
			return Optional.of(value -> value instanceof java.sql.Timestamp
					? ((java.sql.Timestamp) value).toLocalDateTime() : value);
		}
	},
	DATE("datetime") {
		@Override
		@NonNull
		public Optional<ValueDecoder> resultDecoder(@NonNull Dialect dialect, int jdbcTypeCode) {
			requireNonNull(dialect);
			return Optional.of(value -> value instanceof java.sql.Date
					? ((java.sql.Date) value).toLocalDate() : value);
		}
	},
	/**
	 * The type of expressions whose type is unknown. Values pass through untouched.
	 */
	NULL("null");

	@NonNull
	private final String affinity;

	SqlType(@NonNull String affinity) {
		this.affinity = requireNonNull(affinity);
	}

	@Override
	@NonNull
	public Object getStaticCacheKey() {
		return this;
	}

	@Override
	@NonNull
	public Object getAffinity() {
		return this.affinity;
	}

	private static Object toBigDecimal(Object value) {
		if (value instanceof BigDecimal || !(value instanceof Number))
			return value;

		if (value instanceof BigInteger)
			return new BigDecimal((BigInteger) value);

		if (value instanceof Double || value instanceof Float)
			return BigDecimal.valueOf(((Number) value).doubleValue());

		return BigDecimal.valueOf(((Number) value).longValue());
	}
}
