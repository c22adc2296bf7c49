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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Per-execution choices that determine which fetch strategy a {@link CursorResult} starts with.
 * <ul>
 *   <li>{@code bufferFully}: read every row at execution time and release the cursor immediately</li>
 *   <li>{@code streamResults}: buffer rows in growing batches, starting with one row</li>
 *   <li>{@code yieldPer}: buffer rows in batches of exactly this size</li>
 *   <li>otherwise, every fetch goes straight to the driver</li>
 * </ul>
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ExecutionOptions {
	/**
	 * Default cap on the batch size used when streaming.
	 */
	public static final int DEFAULT_MAX_ROW_BUFFER = 1000;

	/**
	 * Default multiplier applied to the batch size after each refill when streaming.
	 */
	public static final int DEFAULT_GROWTH_FACTOR = 5;

	@NonNull
	private static final ExecutionOptions DEFAULTS = builder().build();

	private final boolean streamResults;
	private final boolean bufferFully;
	private final int maxRowBuffer;
	private final int growthFactor;
	@Nullable
	private final Integer yieldPer;

	private ExecutionOptions(@NonNull Builder builder) {
		requireNonNull(builder);

		this.streamResults = builder.streamResults == null ? false : builder.streamResults;
		this.bufferFully = builder.bufferFully == null ? false : builder.bufferFully;
		this.maxRowBuffer = builder.maxRowBuffer == null ? DEFAULT_MAX_ROW_BUFFER : builder.maxRowBuffer;
		this.growthFactor = builder.growthFactor == null ? DEFAULT_GROWTH_FACTOR : builder.growthFactor;
		this.yieldPer = builder.yieldPer;

		if (this.maxRowBuffer < 1)
			throw new IllegalArgumentException("Maximum row buffer must be at least 1");

		if (this.growthFactor < 0)
			throw new IllegalArgumentException("Growth factor must not be negative");

		if (this.yieldPer != null && this.yieldPer < 1)
			throw new IllegalArgumentException("Yield-per batch size must be at least 1");

		if (this.bufferFully && (this.streamResults || this.yieldPer != null))
			throw new IllegalArgumentException("Results cannot be both fully buffered and streamed");
	}

	@NonNull
	public static ExecutionOptions defaults() {
		return DEFAULTS;
	}

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	public boolean isStreamResults() {
		return this.streamResults;
	}

	public boolean isBufferFully() {
		return this.bufferFully;
	}

	public int getMaxRowBuffer() {
		return this.maxRowBuffer;
	}

	public int getGrowthFactor() {
		return this.growthFactor;
	}

	@NonNull
	public Optional<Integer> getYieldPer() {
		return Optional.ofNullable(this.yieldPer);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(5);

		components.add(format("streamResults=%s", isStreamResults()));
		components.add(format("bufferFully=%s", isBufferFully()));
		components.add(format("maxRowBuffer=%d", getMaxRowBuffer()));
		components.add(format("growthFactor=%d", getGrowthFactor()));

		if (this.yieldPer != null)
			components.add(format("yieldPer=%d", this.yieldPer));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	/**
	 * Builder used to construct instances of {@link ExecutionOptions}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@Nullable
		private Boolean streamResults;
		@Nullable
		private Boolean bufferFully;
		@Nullable
		private Integer maxRowBuffer;
		@Nullable
		private Integer growthFactor;
		@Nullable
		private Integer yieldPer;

		private Builder() {
			// Only accessible via static factory
		}

		@NonNull
		public Builder streamResults(@Nullable Boolean streamResults) {
			this.streamResults = streamResults;
			return this;
		}

		@NonNull
		public Builder bufferFully(@Nullable Boolean bufferFully) {
			this.bufferFully = bufferFully;
			return this;
		}

		@NonNull
		public Builder maxRowBuffer(@Nullable Integer maxRowBuffer) {
			this.maxRowBuffer = maxRowBuffer;
			return this;
		}

		@NonNull
		public Builder growthFactor(@Nullable Integer growthFactor) {
			this.growthFactor = growthFactor;
			return this;
		}

		@NonNull
		public Builder yieldPer(@Nullable Integer yieldPer) {
			this.yieldPer = yieldPer;
			return this;
		}

		@NonNull
		public ExecutionOptions build() {
			return new ExecutionOptions(this);
		}
	}
}
