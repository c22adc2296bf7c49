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

import static java.util.Objects.requireNonNull;

/**
 * Drains the whole cursor into memory up front, then serves every fetch from the buffer.
 *
 * @since 1.0.0
 */
@NotThreadSafe
final class FullyBufferedFetchStrategy extends CursorFetchStrategy {
	@NonNull
	private final Deque<Object[]> rowBuffer;

	private FullyBufferedFetchStrategy(@NonNull DriverCursor driverCursor,
																		 @NonNull Deque<Object[]> rowBuffer) {
		super(driverCursor);
		this.rowBuffer = requireNonNull(rowBuffer);
	}

	@NonNull
	static FullyBufferedFetchStrategy drain(@NonNull CursorResult result,
																					@NonNull DriverCursor driverCursor) {
		requireNonNull(result);
		requireNonNull(driverCursor);

		List<Object[]> rows;

		try {
			rows = driverCursor.fetchAll();
		} catch (SQLException e) {
			throw result.handleFetchError(e);
		}

		return new FullyBufferedFetchStrategy(driverCursor, new ArrayDeque<>(rows));
	}

	@Override
	@NonNull
	Optional<Object[]> fetchOne(@NonNull CursorResult result) {
		requireNonNull(result);

		if (this.rowBuffer.isEmpty()) {
			result.softClose();
			return Optional.empty();
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

		int count = Math.min(size, this.rowBuffer.size());
		List<Object[]> rows = new ArrayList<>(count);

		for (int i = 0; i < count; ++i)
			rows.add(this.rowBuffer.pollFirst());

		if (rows.isEmpty())
			result.softClose();

		return rows;
	}

	@Override
	@NonNull
	List<Object[]> fetchAll(@NonNull CursorResult result) {
		requireNonNull(result);

		List<Object[]> rows = new ArrayList<>(this.rowBuffer);
		this.rowBuffer.clear();
		result.softClose();

		return rows;
	}
}
