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

import javax.annotation.concurrent.Immutable;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A column as described by the database driver: its reported name and {@link java.sql.Types} code.
 *
 * @since 1.0.0
 */
@Immutable
public final class RawColumnDescriptor {
	@NonNull
	private final String name;
	private final int jdbcTypeCode;
	@Nullable
	private final String typeName;

	public RawColumnDescriptor(@NonNull String name,
														 int jdbcTypeCode,
														 @Nullable String typeName) {
		this.name = requireNonNull(name);
		this.jdbcTypeCode = jdbcTypeCode;
		this.typeName = typeName;
	}

	@NonNull
	public static RawColumnDescriptor of(@NonNull String name,
																			 int jdbcTypeCode) {
		return new RawColumnDescriptor(name, jdbcTypeCode, null);
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	public int getJdbcTypeCode() {
		return this.jdbcTypeCode;
	}

	/**
	 * The database-specific type name, e.g. {@code "VARCHAR2"}.
	 *
	 * @return the type name, if the driver reported one
	 */
	@NonNull
	public Optional<String> getTypeName() {
		return Optional.ofNullable(this.typeName);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof RawColumnDescriptor rawColumnDescriptor))
			return false;

		return Objects.equals(getName(), rawColumnDescriptor.getName())
				&& getJdbcTypeCode() == rawColumnDescriptor.getJdbcTypeCode()
				&& Objects.equals(getTypeName(), rawColumnDescriptor.getTypeName());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), getJdbcTypeCode(), getTypeName());
	}

	@Override
	public String toString() {
		return format("%s{name=%s, jdbcTypeCode=%d, typeName=%s}", getClass().getSimpleName(), getName(),
				getJdbcTypeCode(), getTypeName().orElse(null));
	}
}
