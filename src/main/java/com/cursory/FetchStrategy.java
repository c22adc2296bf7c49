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
import java.util.List;
import java.util.Optional;

/**
 * Decides how a {@link CursorResult} pulls raw rows from its driver cursor, and owns that cursor while it is live.
 * <p>
 * A result swaps its strategy rather than mutating it: on soft close, hard close and {@code yieldPer} reconfiguration
 * the current strategy is replaced and, where applicable, hands its cursor to the replacement. Driver failures are
 * routed through {@link CursorResult#handleFetchError(Exception)}.
 *
 * @since 1.0.0
 */
@NotThreadSafe
abstract class FetchStrategy {
	@NonNull
	abstract FetchState getState();

	/**
	 * The next raw row. Soft-closes {@code result} when the cursor is exhausted.
	 *
	 * @param result the result being read
	 * @return the row, or empty if there are no more rows
	 */
	@NonNull
	abstract Optional<Object[]> fetchOne(@NonNull CursorResult result);

	/**
	 * Up to {@code size} raw rows. Soft-closes {@code result} when a fetch returns no rows.
	 *
	 * @param result the result being read
	 * @param size   the maximum number of rows, or {@code null} for the strategy's natural batch
	 * @return the rows, empty if there are no more rows
	 */
	@NonNull
	abstract List<Object[]> fetchMany(@NonNull CursorResult result,
																		@Nullable Integer size);

	/**
	 * All remaining raw rows. Always soft-closes {@code result}.
	 *
	 * @param result the result being read
	 * @return the rows
	 */
	@NonNull
	abstract List<Object[]> fetchAll(@NonNull CursorResult result);

	/**
	 * The strategy to use after {@code yieldPer(batchSize)}. Strategies that cannot stream return themselves.
	 *
	 * @param result    the result being read
	 * @param batchSize the fixed batch size
	 * @return the replacement strategy
	 */
	@NonNull
	FetchStrategy yieldPer(@NonNull CursorResult result,
												 int batchSize) {
		return this;
	}

	/**
	 * Closes the driver cursor, if this strategy owns one. Called once, after this strategy has been replaced.
	 *
	 * @throws SQLException if the driver fails to close the cursor
	 */
	void releaseCursor() throws SQLException {
		// Nothing to release by default
	}

	@NonNull
	String getName() {
		return getClass().getSimpleName();
	}

	@Override
	public String toString() {
		return String.format("%s{state=%s}", getName(), getState());
	}
}
