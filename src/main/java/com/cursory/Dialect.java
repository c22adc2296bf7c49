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
import javax.annotation.concurrent.ThreadSafe;
import java.util.Locale;
import java.util.Optional;
import java.util.function.UnaryOperator;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Database-specific rules for interpreting result column names and values.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Dialect {
	@NonNull
	private final DatabaseType databaseType;
	private final boolean caseSensitive;
	private final boolean nameNormalizationRequired;
	@Nullable
	private final UnaryOperator<String> columnNameTranslator;
	@NonNull
	private final ResultDecoderLookup resultDecoderLookup;
	@NonNull
	private final Locale normalizationLocale;

	private Dialect(@NonNull Builder builder) {
		requireNonNull(builder);

		this.databaseType = builder.databaseType;
		this.caseSensitive = builder.caseSensitive == null ? true : builder.caseSensitive;
		this.nameNormalizationRequired = builder.nameNormalizationRequired == null
				? builder.databaseType.isUppercaseIdentifiers() : builder.nameNormalizationRequired;
		this.columnNameTranslator = builder.columnNameTranslator;
		this.resultDecoderLookup = builder.resultDecoderLookup == null
				? ResultDecoderLookup.fromDeclaredTypes() : builder.resultDecoderLookup;
		this.normalizationLocale = builder.normalizationLocale == null ? Locale.ROOT : builder.normalizationLocale;
	}

	/**
	 * A dialect with default rules for the given database type.
	 *
	 * @param databaseType the type of database
	 * @return a dialect
	 */
	@NonNull
	public static Dialect forDatabaseType(@NonNull DatabaseType databaseType) {
		return withDatabaseType(databaseType).build();
	}

	@NonNull
	public static Builder withDatabaseType(@NonNull DatabaseType databaseType) {
		requireNonNull(databaseType);
		return new Builder(databaseType);
	}

	/**
	 * Converts a driver-reported name to the lowercase convention if the database reported a case-insensitive name in
	 * uppercase. Names containing lowercase characters were quoted and are returned unchanged.
	 *
	 * @param name the name as reported by the driver
	 * @return the normalized name
	 */
	@NonNull
	public String normalizeName(@NonNull String name) {
		requireNonNull(name);

		String lowercaseName = name.toLowerCase(getNormalizationLocale());

		if (name.equals(name.toUpperCase(getNormalizationLocale())) && !name.equals(lowercaseName))
			return lowercaseName;

		return name;
	}

	/**
	 * Translates a driver-reported column name, e.g. stripping a {@code table.} prefix that some drivers add.
	 *
	 * @param name the name as reported by the driver
	 * @return the translated name, or empty if this dialect does not translate names or {@code name} is unchanged
	 */
	@NonNull
	public Optional<String> translateColumnName(@NonNull String name) {
		requireNonNull(name);

		if (this.columnNameTranslator == null)
			return Optional.empty();

		String translatedName = this.columnNameTranslator.apply(name);
		return translatedName == null || translatedName.equals(name) ? Optional.empty() : Optional.of(translatedName);
	}

	public boolean hasColumnNameTranslator() {
		return this.columnNameTranslator != null;
	}

	/**
	 * Applies this dialect's case sensitivity to a string lookup key.
	 *
	 * @param key the key
	 * @return {@code key}, lowercased if this dialect is case-insensitive
	 */
	@NonNull
	public String foldKey(@NonNull String key) {
		requireNonNull(key);
		return isCaseSensitive() ? key : key.toLowerCase(getNormalizationLocale());
	}

	@NonNull
	public DatabaseType getDatabaseType() {
		return this.databaseType;
	}

	public boolean isCaseSensitive() {
		return this.caseSensitive;
	}

	public boolean isNameNormalizationRequired() {
		return this.nameNormalizationRequired;
	}

	@NonNull
	public ResultDecoderLookup getResultDecoderLookup() {
		return this.resultDecoderLookup;
	}

	@NonNull
	public Locale getNormalizationLocale() {
		return this.normalizationLocale;
	}

	@Override
	public String toString() {
		return format("%s{databaseType=%s, caseSensitive=%s, nameNormalizationRequired=%s}", getClass().getSimpleName(),
				getDatabaseType(), isCaseSensitive(), isNameNormalizationRequired());
	}

	/**
	 * Builder used to construct instances of {@link Dialect}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final DatabaseType databaseType;
		@Nullable
		private Boolean caseSensitive;
		@Nullable
		private Boolean nameNormalizationRequired;
		@Nullable
		private UnaryOperator<String> columnNameTranslator;
		@Nullable
		private ResultDecoderLookup resultDecoderLookup;
		@Nullable
		private Locale normalizationLocale;

		private Builder(@NonNull DatabaseType databaseType) {
			this.databaseType = requireNonNull(databaseType);
		}

		@NonNull
		public Builder caseSensitive(@Nullable Boolean caseSensitive) {
			this.caseSensitive = caseSensitive;
			return this;
		}

		@NonNull
		public Builder nameNormalizationRequired(@Nullable Boolean nameNormalizationRequired) {
			this.nameNormalizationRequired = nameNormalizationRequired;
			return this;
		}

		@NonNull
		public Builder columnNameTranslator(@Nullable UnaryOperator<String> columnNameTranslator) {
			this.columnNameTranslator = columnNameTranslator;
			return this;
		}

		@NonNull
		public Builder resultDecoderLookup(@Nullable ResultDecoderLookup resultDecoderLookup) {
			this.resultDecoderLookup = resultDecoderLookup;
			return this;
		}

		@NonNull
		public Builder normalizationLocale(@Nullable Locale normalizationLocale) {
			this.normalizationLocale = normalizationLocale;
			return this;
		}

		@NonNull
		public Dialect build() {
			return new Dialect(this);
		}
	}
}
