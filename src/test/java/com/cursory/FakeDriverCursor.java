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
import java.sql.Types;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * In-memory {@link DriverCursor} that records what was asked of it.
 */
@NotThreadSafe
public class FakeDriverCursor implements DriverCursor {
	@Nullable
	private final List<RawColumnDescriptor> description;
	@NonNull
	private final List<Object[]> rows;
	private final long rowCount;
	@Nullable
	private final Object lastRowId;
	@NonNull
	private final List<Integer> requestedSizes;
	@NonNull
	private final List<Integer> deliveredSizes;
	private int position;
	private int closeCount;
	private int defaultFetchSize;
	@Nullable
	private SQLException fetchFailure;
	@Nullable
	private SQLException closeFailure;

	private FakeDriverCursor(@Nullable List<RawColumnDescriptor> description,
													 @NonNull List<Object[]> rows,
													 long rowCount,
													 @Nullable Object lastRowId) {
		this.description = description;
		this.rows = requireNonNull(rows);
		this.rowCount = rowCount;
		this.lastRowId = lastRowId;
		this.requestedSizes = new ArrayList<>();
		this.deliveredSizes = new ArrayList<>();
		this.defaultFetchSize = 1;
	}

	@NonNull
	public static FakeDriverCursor withRows(@NonNull List<RawColumnDescriptor> description,
																					@NonNull List<Object[]> rows) {
		return new FakeDriverCursor(description, rows, -1, null);
	}

	/**
	 * A cursor over {@code rowCount} rows of a single integer column {@code n}, valued 1 to {@code rowCount}.
	 */
	@NonNull
	public static FakeDriverCursor withIntegers(int rowCount) {
		List<Object[]> rows = new ArrayList<>(rowCount);

		for (int i = 1; i <= rowCount; ++i)
			rows.add(new Object[]{i});

		return withRows(List.of(RawColumnDescriptor.of("n", Types.INTEGER)), rows);
	}

	@NonNull
	public static FakeDriverCursor withoutRows(long rowCount,
																						 @Nullable Object lastRowId) {
		return new FakeDriverCursor(null, List.of(), rowCount, lastRowId);
	}

	@NonNull
	public FakeDriverCursor failFetchesWith(@Nullable SQLException fetchFailure) {
		this.fetchFailure = fetchFailure;
		return this;
	}

	@NonNull
	public FakeDriverCursor failCloseWith(@Nullable SQLException closeFailure) {
		this.closeFailure = closeFailure;
		return this;
	}

	@NonNull
	public FakeDriverCursor defaultFetchSize(int defaultFetchSize) {
		this.defaultFetchSize = defaultFetchSize;
		return this;
	}

	@Override
	@NonNull
	public Optional<List<RawColumnDescriptor>> getDescription() {
		return Optional.ofNullable(this.description);
	}

	@Override
	@NonNull
	public Optional<Object[]> fetchOne() throws SQLException {
		List<Object[]> rows = take(1);
		return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
	}

	@Override
	@NonNull
	public List<Object[]> fetchMany(int size) throws SQLException {
		return take(size);
	}

	@Override
	@NonNull
	public List<Object[]> fetchMany() throws SQLException {
		return take(this.defaultFetchSize);
	}

	@Override
	@NonNull
	public List<Object[]> fetchAll() throws SQLException {
		return take(Integer.MAX_VALUE);
	}

	@Override
	public long getRowCount() {
		return this.rowCount;
	}

	@Override
	@NonNull
	public Optional<Object> getLastRowId() {
		return Optional.ofNullable(this.lastRowId);
	}

	@Override
	public void close() throws SQLException {
		++this.closeCount;

		if (this.closeFailure != null)
			throw this.closeFailure;
	}

	@NonNull
	private List<Object[]> take(int size) throws SQLException {
		if (this.closeCount > 0)
			throw new SQLException("Cursor is closed");

		if (this.fetchFailure != null)
			throw this.fetchFailure;

		if (size != Integer.MAX_VALUE)
			this.requestedSizes.add(size);

		int end = (int) Math.min((long) this.position + size, this.rows.size());
		List<Object[]> taken = new ArrayList<>(this.rows.subList(this.position, end));

		this.position = end;
		this.deliveredSizes.add(taken.size());

		return taken;
	}

	@NonNull
	public List<Integer> getRequestedSizes() {
		return Collections.unmodifiableList(this.requestedSizes);
	}

	@NonNull
	public List<Integer> getDeliveredSizes() {
		return Collections.unmodifiableList(this.deliveredSizes);
	}

	public int getCloseCount() {
		return this.closeCount;
	}

	public int getRemainingRowCount() {
		return this.rows.size() - this.position;
	}

	@Override
	public String toString() {
		return String.format("%s{position=%d, rows=%d, closeCount=%d, description=%s}", getClass().getSimpleName(),
				this.position, this.rows.size(), this.closeCount,
				this.description == null ? null : Arrays.toString(this.description.toArray()));
	}
}
