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
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Diagnostics for one {@link CursorResult}, from execution until its cursor was released.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ResultLog {
	@NonNull
	private final ExecutionContext executionContext;
	@NonNull
	private final String fetchStrategyName;
	@NonNull
	private final List<String> keys;
	private final long rowsEmitted;
	@NonNull
	private final Duration fetchDuration;
	@NonNull
	private final Duration decodeDuration;
	@NonNull
	private final Duration totalDuration;
	@Nullable
	private final Exception exception;

	private ResultLog(@NonNull Builder builder) {
		requireNonNull(builder);

		this.executionContext = builder.executionContext;
		this.fetchStrategyName = builder.fetchStrategyName == null ? "unknown" : builder.fetchStrategyName;
		this.keys = builder.keys == null ? List.of() : List.copyOf(builder.keys);
		this.rowsEmitted = builder.rowsEmitted == null ? 0L : builder.rowsEmitted;
		this.fetchDuration = builder.fetchDuration == null ? Duration.ZERO : builder.fetchDuration;
		this.decodeDuration = builder.decodeDuration == null ? Duration.ZERO : builder.decodeDuration;
		this.totalDuration = this.fetchDuration.plus(this.decodeDuration);
		this.exception = builder.exception;
	}

	/**
	 * Creates a {@link ResultLog} builder for the given {@code executionContext}.
	 *
	 * @param executionContext the execution that produced the result
	 * @return a {@link ResultLog} builder
	 */
	@NonNull
	public static Builder withExecutionContext(@NonNull ExecutionContext executionContext) {
		requireNonNull(executionContext);
		return new Builder(executionContext);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(7);

		components.add(format("executionContext=%s", getExecutionContext()));
		components.add(format("fetchStrategyName=%s", getFetchStrategyName()));
		components.add(format("keys=%s", getKeys()));
		components.add(format("rowsEmitted=%d", getRowsEmitted()));
		components.add(format("totalDuration=%s", getTotalDuration()));

		Exception exception = getException().orElse(null);

		if (exception != null)
			components.add(format("exception=%s", exception));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ResultLog resultLog))
			return false;

		return Objects.equals(getExecutionContext(), resultLog.getExecutionContext())
				&& Objects.equals(getFetchStrategyName(), resultLog.getFetchStrategyName())
				&& Objects.equals(getKeys(), resultLog.getKeys())
				&& getRowsEmitted() == resultLog.getRowsEmitted()
				&& Objects.equals(getFetchDuration(), resultLog.getFetchDuration())
				&& Objects.equals(getDecodeDuration(), resultLog.getDecodeDuration())
				&& Objects.equals(getException(), resultLog.getException());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getExecutionContext(), getFetchStrategyName(), getKeys(), getRowsEmitted(), getFetchDuration(),
				getDecodeDuration(), getException());
	}

	@NonNull
	public ExecutionContext getExecutionContext() {
		return this.executionContext;
	}

	/**
	 * Name of the fetch strategy in effect when the cursor was released, e.g. {@code GrowthBufferedFetchStrategy}.
	 *
	 * @return the strategy name
	 */
	@NonNull
	public String getFetchStrategyName() {
		return this.fetchStrategyName;
	}

	/**
	 * Column keys of the result, empty for statements that do not return rows.
	 *
	 * @return the keys
	 */
	@NonNull
	public List<String> getKeys() {
		return this.keys;
	}

	public long getRowsEmitted() {
		return this.rowsEmitted;
	}

	/**
	 * Time spent waiting on the driver.
	 *
	 * @return the fetch duration
	 */
	@NonNull
	public Duration getFetchDuration() {
		return this.fetchDuration;
	}

	/**
	 * Time spent turning raw driver rows into {@link Row}s.
	 *
	 * @return the decode duration
	 */
	@NonNull
	public Duration getDecodeDuration() {
		return this.decodeDuration;
	}

	@NonNull
	public Duration getTotalDuration() {
		return this.totalDuration;
	}

	@NonNull
	public Optional<Exception> getException() {
		return Optional.ofNullable(this.exception);
	}

	/**
	 * Builder used to construct instances of {@link ResultLog}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final ExecutionContext executionContext;
		@Nullable
		private String fetchStrategyName;
		@Nullable
		private List<String> keys;
		@Nullable
		private Long rowsEmitted;
		@Nullable
		private Duration fetchDuration;
		@Nullable
		private Duration decodeDuration;
		@Nullable
		private Exception exception;

		private Builder(@NonNull ExecutionContext executionContext) {
			this.executionContext = requireNonNull(executionContext);
		}

		@NonNull
		public Builder fetchStrategyName(@Nullable String fetchStrategyName) {
			this.fetchStrategyName = fetchStrategyName;
			return this;
		}

		@NonNull
		public Builder keys(@Nullable List<String> keys) {
			this.keys = keys;
			return this;
		}

		@NonNull
		public Builder rowsEmitted(@Nullable Long rowsEmitted) {
			this.rowsEmitted = rowsEmitted;
			return this;
		}

		@NonNull
		public Builder fetchDuration(@Nullable Duration fetchDuration) {
			this.fetchDuration = fetchDuration;
			return this;
		}

		@NonNull
		public Builder decodeDuration(@Nullable Duration decodeDuration) {
			this.decodeDuration = decodeDuration;
			return this;
		}

		@NonNull
		public Builder exception(@Nullable Exception exception) {
			this.exception = exception;
			return this;
		}

		@NonNull
		public ResultLog build() {
			return new ResultLog(this);
		}
	}
}
