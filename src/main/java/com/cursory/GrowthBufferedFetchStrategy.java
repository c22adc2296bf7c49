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
import java.sql.SQLException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Streams rows through an in-process buffer whose refill size grows geometrically.
 * <p>
 * The first refill requests a single row; each later refill multiplies the request by the growth factor, up to the
 * maximum buffer size. With a growth factor of zero the batch size is fixed, which is how {@code yieldPer} streams.
 *
 * @since 1.0.0
 */
@NotThreadSafe
final class GrowthBufferedFetchStrategy extends CursorFetchStrategy {
	@NonNull
	private final Deque<Object[]> rowBuffer;
	private final int maxRowBuffer;
	private final int growthFactor;
	private int bufferSize;

	private GrowthBufferedFetchStrategy(@NonNull DriverCursor driverCursor,
																			@NonNull Deque<Object[]> initialBuffer,
																			int maxRowBuffer,
																			int growthFactor) {
		super(driverCursor);

		requireNonNull(initialBuffer);

		if (maxRowBuffer < 1)
			throw new IllegalArgumentException("Maximum row buffer must be at least 1");

		if (growthFactor < 0)
			throw new IllegalArgumentException("Growth factor must not be negative");

		this.rowBuffer = initialBuffer;
		this.maxRowBuffer = maxRowBuffer;
		this.growthFactor = growthFactor;
		this.bufferSize = growthFactor == 0 ? maxRowBuffer : Math.min(maxRowBuffer, growthFactor);
	}

	/**
	 * Creates a growing buffer, priming it with the first row of the cursor.
	 *
	 * @param result       the result being read
	 * @param driverCursor the cursor to stream from
	 * @param maxRowBuffer the largest refill
	 * @param growthFactor refill multiplier
	 * @return the strategy
	 */
	@NonNull
	static GrowthBufferedFetchStrategy create(@NonNull CursorResult result,
																						@NonNull DriverCursor driverCursor,
																						int maxRowBuffer,
																						int growthFactor) {
		requireNonNull(result);
		requireNonNull(driverCursor);

		List<Object[]> initialRows;

		try {
			initialRows = driverCursor.fetchMany(1);
		} catch (SQLException e) {
			throw result.handleFetchError(e);
		}

		return new GrowthBufferedFetchStrategy(driverCursor, new ArrayDeque<>(initialRows), maxRowBuffer, growthFactor);
	}

	@NonNull
	static GrowthBufferedFetchStrategy withFixedBatchSize(@NonNull DriverCursor driverCursor,
																												@NonNull Deque<Object[]> buffer,
																												int batchSize) {
		return new GrowthBufferedFetchStrategy(driverCursor, buffer, batchSize, 0);
	}

	@Override
	@NonNull
	Optional<Object[]> fetchOne(@NonNull CursorResult result) {
		requireNonNull(result);

		if (this.rowBuffer.isEmpty()) {
			refill(result);

			if (this.rowBuffer.isEmpty()) {
				result.softClose();
				return Optional.empty();
			}
		}

		return Optional.of(this.rowBuffer.pollFirst());
	}

	@Override
	@NonNull
	List<Object[]> fetchMany(@NonNull CursorResult result,
													 @Nullable Integer size) {
		requireNonNull(result);

		if (size == null)
			return fetchAll(result);

		boolean exhausted = false;
		int buffered = this.rowBuffer.size();

		if (size > buffered) {
			List<Object[]> rows;

			try {
				rows = getDriverCursor().fetchMany(size - buffered);
			} catch (SQLException e) {
				throw result.handleFetchError(e);
			}

			if (rows.isEmpty())
				exhausted = true;
			else
				this.rowBuffer.addAll(rows);
		}

		int count = Math.min(size, this.rowBuffer.size());
		List<Object[]> rows = new ArrayList<>(count);

		for (int i = 0; i < count; ++i)
			rows.add(this.rowBuffer.pollFirst());

		// Close only after draining the buffer, since releasing the cursor discards it
		if (exhausted)
			result.softClose();

		return rows;
	}

	@Override
	@NonNull
	List<Object[]> fetchAll(@NonNull CursorResult result) {
		requireNonNull(result);

		List<Object[]> rows = new ArrayList<>(this.rowBuffer);

		try {
			rows.addAll(getDriverCursor().fetchAll());
		} catch (SQLException e) {
			throw result.handleFetchError(e);
		}

		this.rowBuffer.clear();
		result.softClose();

		return rows;
	}

	@Override
	@NonNull
	FetchStrategy yieldPer(@NonNull CursorResult result,
												 int batchSize) {
		requireNonNull(result);
		return withFixedBatchSize(getDriverCursor(), new ArrayDeque<>(this.rowBuffer), batchSize);
	}

	private void refill(@NonNull CursorResult result) {
		requireNonNull(result);

		int size = this.bufferSize;
		List<Object[]> rows;

		try {
			rows = getDriverCursor().fetchMany(size);
		} catch (SQLException e) {
			throw result.handleFetchError(e);
		}

		if (rows.isEmpty())
			return;

		this.rowBuffer.addAll(rows);

		if (this.growthFactor > 0 && size < this.maxRowBuffer)
			this.bufferSize = (int) Math.min(this.maxRowBuffer, (long) size * this.growthFactor);
	}

	int getBufferSize() {
		return this.bufferSize;
	}

	@Override
	public String toString() {
		return format("%s{bufferSize=%d, maxRowBuffer=%d, growthFactor=%d, buffered=%d}", getName(), this.bufferSize,
				this.maxRowBuffer, this.growthFactor, this.rowBuffer.size());
	}
}
