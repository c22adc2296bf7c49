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
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Forwards every fetch straight to the driver.
 *
 * @since 1.0.0
 */
@NotThreadSafe
final class DirectFetchStrategy extends CursorFetchStrategy {
	DirectFetchStrategy(@NonNull DriverCursor driverCursor) {
		super(driverCursor);
	}

	@Override
	@NonNull
	Optional<Object[]> fetchOne(@NonNull CursorResult result) {
		requireNonNull(result);

		Optional<Object[]> row;

		try {
			row = getDriverCursor().fetchOne();
		} catch (SQLException e) {
			throw result.handleFetchError(e);
		}

		if (row.isEmpty())
			result.softClose();

		return row;
	}

	@Override
	@NonNull
	List<Object[]> fetchMany(@NonNull CursorResult result,
													 @Nullable Integer size) {
		requireNonNull(result);

		List<Object[]> rows;

		try {
			rows = size == null ? getDriverCursor().fetchMany() : getDriverCursor().fetchMany(size);
		} catch (SQLException e) {
			throw result.handleFetchError(e);
		}

		if (rows.isEmpty())
			result.softClose();

		return rows;
	}

	@Override
	@NonNull
	List<Object[]> fetchAll(@NonNull CursorResult result) {
		requireNonNull(result);

		List<Object[]> rows;

		try {
			rows = getDriverCursor().fetchAll();
		} catch (SQLException e) {
			throw result.handleFetchError(e);
		}

		result.softClose();
		return rows;
	}

	@Override
	@NonNull
	FetchStrategy yieldPer(@NonNull CursorResult result,
												 int batchSize) {
		requireNonNull(result);
		return GrowthBufferedFetchStrategy.withFixedBatchSize(getDriverCursor(), new ArrayDeque<>(), batchSize);
	}
}
