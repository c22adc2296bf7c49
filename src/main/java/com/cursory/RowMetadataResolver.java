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
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Contract for merging a compiled statement's declared result columns with the columns the driver reports, producing
 * the {@link RowMetadata} that {@link Row}s are read through.
 * <p>
 * A production-ready concrete implementation is available via the following static methods:
 * <ul>
 *   <li>{@link #withDefaultConfiguration()}</li>
 *   <li>{@link #withMetadataCachingEnabled(Boolean)} (builder)</li>
 *   <li>{@link #withMetadataCacheCapacity(Integer)} (builder)</li>
 * </ul>
 * <p>
 * How to acquire an instance:
 * <pre>{@code  // With out-of-the-box defaults
 * RowMetadataResolver default = RowMetadataResolver.withDefaultConfiguration();
 *
 * // Customized
 * RowMetadataResolver custom = RowMetadataResolver.withMetadataCachingEnabled(true)
 *  .metadataCacheCapacity(128)
 *  .build();}</pre>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface RowMetadataResolver {
	/**
	 * Resolves metadata for a result.
	 *
	 * @param executionContext the execution the result belongs to
	 * @param description      the driver's column descriptions, in column order
	 * @return the resolved metadata
	 * @throws InvalidRequestException if a textual positional statement declares the same column expression twice
	 */
	@NonNull
	RowMetadata resolve(@NonNull ExecutionContext executionContext,
											@NonNull List<RawColumnDescriptor> description);

	/**
	 * Default maximum number of cached {@link RowMetadata} instances.
	 */
	int DEFAULT_METADATA_CACHE_CAPACITY = 1024;

	/**
	 * Acquires a builder for a concrete implementation of this interface, specifying whether resolved metadata should be
	 * cached by the statement's {@link CacheKey}.
	 *
	 * @param metadataCachingEnabled whether resolved metadata should be cached
	 * @return a {@code Builder} for a concrete implementation
	 */
	@NonNull
	static Builder withMetadataCachingEnabled(@NonNull Boolean metadataCachingEnabled) {
		requireNonNull(metadataCachingEnabled);
		return new Builder().metadataCachingEnabled(metadataCachingEnabled);
	}

	/**
	 * Acquires a builder for a concrete implementation of this interface, specifying the metadata cache's capacity.
	 *
	 * @param metadataCacheCapacity maximum number of cached entries, or {@code 0} for an unbounded cache
	 * @return a {@code Builder} for a concrete implementation
	 */
	@NonNull
	static Builder withMetadataCacheCapacity(@NonNull Integer metadataCacheCapacity) {
		requireNonNull(metadataCacheCapacity);
		return new Builder().metadataCacheCapacity(metadataCacheCapacity);
	}

	/**
	 * Acquires a concrete implementation of this interface with out-of-the-box defaults.
	 * <p>
	 * The returned instance is thread-safe.
	 *
	 * @return a concrete implementation of this interface with out-of-the-box defaults
	 */
	@NonNull
	static RowMetadataResolver withDefaultConfiguration() {
		return new Builder().build();
	}

	/**
	 * Builder used to construct a standard implementation of {@link RowMetadataResolver}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	class Builder {
		@NonNull
		Boolean metadataCachingEnabled;
		@NonNull
		Integer metadataCacheCapacity;

		private Builder() {
			this.metadataCachingEnabled = true;
			this.metadataCacheCapacity = DEFAULT_METADATA_CACHE_CAPACITY;
		}

		@NonNull
		public Builder metadataCachingEnabled(@Nullable Boolean metadataCachingEnabled) {
			this.metadataCachingEnabled = metadataCachingEnabled == null ? true : metadataCachingEnabled;
			return this;
		}

		@NonNull
		public Builder metadataCacheCapacity(@Nullable Integer metadataCacheCapacity) {
			if (metadataCacheCapacity != null && metadataCacheCapacity < 0)
				throw new IllegalArgumentException("Metadata cache capacity must not be negative");

			this.metadataCacheCapacity = metadataCacheCapacity == null ? DEFAULT_METADATA_CACHE_CAPACITY : metadataCacheCapacity;
			return this;
		}

		@NonNull
		public RowMetadataResolver build() {
			return new DefaultRowMetadataResolver(this);
		}
	}
}
