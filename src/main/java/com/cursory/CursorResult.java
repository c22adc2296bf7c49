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
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The rows (or row count) produced by executing one statement.
 * <p>
 * A result is a forward-only, single-pass sequence of {@link Row}s backed by a live {@link DriverCursor}. How rows are
 * pulled from the cursor is decided by a {@link FetchStrategy} chosen from the {@link ExecutionOptions}:
 * <ul>
 *   <li>direct, one driver call per fetch (default)</li>
 *   <li>growth-buffered, when streaming or after {@link #yieldPer(int)}</li>
 *   <li>fully buffered, when {@link ExecutionOptions#isBufferFully()} is set</li>
 * </ul>
 * <p>
 * The cursor is released ("soft close") as soon as a fetch exhausts it; reads then return nothing. {@link #close()}
 * releases the cursor if necessary and makes every later read fail. Statements that do not return rows are soft-closed
 * on creation, and reading rows from them always fails.
 * <p>
 * Instances are not threadsafe.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public final class CursorResult implements Iterable<Row>, AutoCloseable {
	@NonNull
	private static final Logger LOGGER = Logger.getLogger(CursorResult.class.getName());

	@NonNull
	private final ExecutionContext executionContext;
	private final long rowCount;
	@Nullable
	private final Object lastRowId;
	@NonNull
	private RowMetadata rowMetadata;
	@NonNull
	private FetchStrategy fetchStrategy;
	@Nullable
	private Integer yieldPer;
	@Nullable
	private Exception exception;
	private long rowsEmitted;
	private long fetchNanos;
	private long decodeNanos;
	private int fetchDepth;
	@Nullable
	private String releasedFetchStrategyName;

	private CursorResult(@NonNull ExecutionContext executionContext,
											 @NonNull DriverCursor driverCursor) {
		requireNonNull(executionContext);
		requireNonNull(driverCursor);

		this.executionContext = executionContext;
		this.rowCount = driverCursor.getRowCount();
		this.lastRowId = driverCursor.getLastRowId().orElse(null);
		this.rowMetadata = NoRowsMetadata.INSTANCE;
		this.fetchStrategy = new DirectFetchStrategy(driverCursor);
	}

	/**
	 * Wraps a freshly executed driver cursor, which the result then owns.
	 * <p>
	 * Resolves the cursor's {@link RowMetadata} and installs the fetch strategy the context's options call for. If the
	 * statement does not return rows, the cursor is released immediately.
	 *
	 * @param executionContext the execution that produced the cursor
	 * @param driverCursor     the live cursor
	 * @return the result
	 */
	@NonNull
	public static CursorResult create(@NonNull ExecutionContext executionContext,
																		@NonNull DriverCursor driverCursor) {
		requireNonNull(executionContext);
		requireNonNull(driverCursor);

		CursorResult result = new CursorResult(executionContext, driverCursor);
		List<RawColumnDescriptor> description;

		try {
			description = driverCursor.getDescription().orElse(null);
		} catch (SQLException e) {
			throw result.handleFetchError(e);
		}

		if (description == null) {
			result.softClose();
			return result;
		}

		try {
			result.rowMetadata = executionContext.getRowMetadataResolver().resolve(executionContext, description);
		} catch (RuntimeException e) {
			result.closeAfterFailure(e);
			throw e;
		}

		ExecutionOptions executionOptions = executionContext.getExecutionOptions();
		Integer yieldPer = executionOptions.getYieldPer().orElse(null);

		if (executionOptions.isBufferFully())
			result.fetchStrategy = FullyBufferedFetchStrategy.drain(result, driverCursor);
		else if (yieldPer != null)
			result.yieldPer(yieldPer);
		else if (executionOptions.isStreamResults())
			result.fetchStrategy = GrowthBufferedFetchStrategy.create(result, driverCursor,
					executionOptions.getMaxRowBuffer(), executionOptions.getGrowthFactor());

		return result;
	}

	@NonNull
	public Optional<Row> fetchOne() {
		return deferringResultLog(() -> {
			long start = System.nanoTime();
			Optional<Object[]> rawRow = getFetchStrategy().fetchOne(this);
			this.fetchNanos += System.nanoTime() - start;

			return rawRow.map(this::toRow);
		});
	}

	/**
	 * Fetches up to the driver's default number of rows, or the {@link #yieldPer(int)} batch size if streaming.
	 *
	 * @return the rows, empty once the result is exhausted
	 */
	@NonNull
	public List<Row> fetchMany() {
		return fetchManyRows(this.yieldPer);
	}

	@NonNull
	public List<Row> fetchMany(int size) {
		if (size < 1)
			throw new InvalidRequestException(format("Fetch size must be at least 1 but was %d", size));

		return fetchManyRows(size);
	}

	@NonNull
	public List<Row> fetchAll() {
		return deferringResultLog(() -> {
			long start = System.nanoTime();
			List<Object[]> rawRows = getFetchStrategy().fetchAll(this);
			this.fetchNanos += System.nanoTime() - start;

			return toRows(rawRows);
		});
	}

	/**
	 * Synonym for {@link #fetchAll()}.
	 *
	 * @return all remaining rows
	 */
	@NonNull
	public List<Row> all() {
		return fetchAll();
	}

	/**
	 * Fetches the first row and closes this result.
	 *
	 * @return the first row, or empty if there are no rows
	 */
	@NonNull
	public Optional<Row> first() {
		Optional<Row> row;

		try {
			row = fetchOne();
		} catch (RuntimeException e) {
			closeAfterFailure(e);
			throw e;
		}

		if (getFetchState() == FetchState.OPEN)
			LOGGER.log(Level.FINE, "Closing result with unread rows after first()");

		close();
		return row;
	}

	/**
	 * Fetches exactly one row and closes this result.
	 *
	 * @return the row
	 * @throws InvalidRequestException if there are no rows or more than one
	 */
	@NonNull
	public Row one() {
		return onlyRow(true).orElseThrow();
	}

	/**
	 * Fetches at most one row and closes this result.
	 *
	 * @return the row, or empty if there are none
	 * @throws InvalidRequestException if there is more than one row
	 */
	@NonNull
	public Optional<Row> oneOrNull() {
		return onlyRow(false);
	}

	/**
	 * The first column of the first row. Closes this result.
	 *
	 * @return the value, or empty if there are no rows or the value is {@code null}
	 */
	@NonNull
	public Optional<Object> scalar() {
		return first().map(row -> row.get(0));
	}

	/**
	 * The first column of every remaining row.
	 *
	 * @return the values
	 */
	@NonNull
	public List<Object> scalars() {
		return scalars(0);
	}

	@NonNull
	public List<Object> scalars(@NonNull Object key) {
		requireNonNull(key);

		List<Row> rows = fetchAll();
		List<Object> values = new ArrayList<>(rows.size());

		for (Row row : rows)
			values.add(row.get(key));

		return values;
	}

	/**
	 * Restricts the rows this result produces to the given columns, in the given order. Values of other columns are
	 * not decoded.
	 *
	 * @param keys column names, declaring column objects or integer positions
	 * @return this result
	 * @throws NoSuchColumnException    if a key is unknown
	 * @throws AmbiguousColumnException if a key is ambiguous
	 */
	@NonNull
	public CursorResult columns(@NonNull Object... keys) {
		requireNonNull(keys);

		this.rowMetadata = getRowMetadata().reduce(Arrays.asList(keys));
		return this;
	}

	/**
	 * A view of this result that produces {@link RowMapping}s instead of {@link Row}s. Both share one cursor.
	 *
	 * @return the mapping view
	 */
	@NonNull
	public MappingResult mappings() {
		return new MappingResult(this);
	}

	/**
	 * Iterates over the remaining rows in lists of at most {@code size} rows.
	 *
	 * @param size the partition size
	 * @return the partitions
	 */
	@NonNull
	public Iterable<List<Row>> partitions(int size) {
		if (size < 1)
			throw new InvalidRequestException(format("Partition size must be at least 1 but was %d", size));

		return () -> new PartitionIterator(size);
	}

	/**
	 * Iterates over the remaining rows in lists of the {@link #yieldPer(int)} batch size, or of the driver's default
	 * size otherwise.
	 *
	 * @return the partitions
	 */
	@NonNull
	public Iterable<List<Row>> partitions() {
		return () -> new PartitionIterator(this.yieldPer);
	}

	/**
	 * Streams the remaining rows in fixed batches of {@code batchSize}, disabling any buffer growth.
	 *
	 * @param batchSize rows per driver fetch
	 * @return this result
	 */
	@NonNull
	public CursorResult yieldPer(int batchSize) {
		if (batchSize < 1)
			throw new InvalidRequestException(format("Yield-per batch size must be at least 1 but was %d", batchSize));

		this.fetchStrategy = getFetchStrategy().yieldPer(this, batchSize);
		this.yieldPer = batchSize;
		return this;
	}

	@Override
	@NonNull
	public Iterator<Row> iterator() {
		return new RowIterator();
	}

	/**
	 * The remaining rows as a sequential stream. Closing the stream closes this result.
	 *
	 * @return the stream
	 */
	@NonNull
	public Stream<Row> stream() {
		return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL),
				false).onClose(this::close);
	}

	/**
	 * Column names, in column order.
	 *
	 * @return the column names
	 * @throws ResourceClosedException if the statement does not return rows
	 */
	@NonNull
	public List<String> keys() {
		return getRowMetadata().getKeys();
	}

	public boolean returnsRows() {
		return getRowMetadata().returnsRows();
	}

	/**
	 * Number of rows the statement affected, as reported by the driver when the statement was executed.
	 *
	 * @return the row count, or {@code -1} if the driver did not report one
	 */
	public long getRowCount() {
		return this.rowCount;
	}

	@NonNull
	public Optional<Object> getLastRowId() {
		return Optional.ofNullable(this.lastRowId);
	}

	@NonNull
	public RowMetadata getRowMetadata() {
		return this.rowMetadata;
	}

	@NonNull
	public FetchState getFetchState() {
		return getFetchStrategy().getState();
	}

	public boolean isClosed() {
		return getFetchState() == FetchState.HARD_CLOSED;
	}

	/**
	 * Whether the driver cursor has been released, either because the rows ran out or because of {@link #close()}.
	 *
	 * @return {@code true} if no cursor is held
	 */
	public boolean isSoftClosed() {
		return getFetchState() != FetchState.OPEN;
	}

	@NonNull
	public ExecutionContext getExecutionContext() {
		return this.executionContext;
	}

	/**
	 * Releases the driver cursor, if still held, and makes every later read fail. Safe to call repeatedly.
	 */
	@Override
	public void close() {
		if (isClosed())
			return;

		transitionTo(returnsRows() ? ClosedCursorFetchStrategy.HARD_CLOSED : NonRowReturningFetchStrategy.HARD_CLOSED, null);
	}

	@Override
	public String toString() {
		return format("%s{fetchStrategy=%s, rowMetadata=%s}", getClass().getSimpleName(), getFetchStrategy(),
				getRowMetadata());
	}

	/**
	 * Releases the driver cursor but keeps answering reads with no rows. No-op unless the cursor is still held.
	 */
	void softClose() {
		if (isSoftClosed())
			return;

		transitionTo(returnsRows() ? ClosedCursorFetchStrategy.SOFT_CLOSED : NonRowReturningFetchStrategy.SOFT_CLOSED, null);
	}

	/**
	 * Maps a driver failure through the context's {@link ExecutionErrorHandler} and closes this result.
	 *
	 * @param exception the driver failure
	 * @return the exception to throw
	 */
	@NonNull
	RuntimeException handleFetchError(@NonNull Exception exception) {
		requireNonNull(exception);

		RuntimeException mapped = getExecutionContext().getExecutionErrorHandler().handle(exception, this);
		closeAfterFailure(mapped);
		return mapped;
	}

	@NonNull
	FetchStrategy getFetchStrategy() {
		return this.fetchStrategy;
	}

	private void closeAfterFailure(@NonNull RuntimeException thrown) {
		requireNonNull(thrown);

		if (this.exception == null)
			this.exception = thrown;

		if (!isClosed())
			transitionTo(returnsRows() ? ClosedCursorFetchStrategy.HARD_CLOSED : NonRowReturningFetchStrategy.HARD_CLOSED,
					thrown);
	}

	private void transitionTo(@NonNull FetchStrategy replacement,
														@Nullable Throwable thrown) {
		requireNonNull(replacement);

		FetchStrategy released = getFetchStrategy();
		this.fetchStrategy = replacement;

		if (released.getState() != FetchState.OPEN)
			return;

		Throwable cleanupFailure = null;

		try {
			long start = System.nanoTime();
			released.releaseCursor();
			this.fetchNanos += System.nanoTime() - start;
		} catch (Throwable cleanupException) {
			cleanupFailure = cleanupException;
		}

		this.releasedFetchStrategyName = released.getName();

		// A fetch in progress logs once its rows are decoded
		if (this.fetchDepth == 0)
			cleanupFailure = logResult(cleanupFailure);

		if (cleanupFailure != null) {
			if (thrown != null)
				thrown.addSuppressed(cleanupFailure);
			else
				throwCleanupFailure(cleanupFailure);
		}
	}

	/**
	 * Hands the {@link ResultLog} to the context's {@link ResultLogger}, if the cursor was released and the result has
	 * not been logged yet.
	 *
	 * @param cleanupFailure a failure already encountered while releasing the cursor, if any
	 * @return the failure to report, including any logger failure
	 */
	@Nullable
	private Throwable logResult(@Nullable Throwable cleanupFailure) {
		String fetchStrategyName = this.releasedFetchStrategyName;

		if (fetchStrategyName == null)
			return cleanupFailure;

		this.releasedFetchStrategyName = null;

		ResultLog resultLog = ResultLog.withExecutionContext(getExecutionContext())
				.fetchStrategyName(fetchStrategyName)
				.keys(returnsRows() ? getRowMetadata().getKeys() : List.of())
				.rowsEmitted(this.rowsEmitted)
				.fetchDuration(Duration.ofNanos(this.fetchNanos))
				.decodeDuration(Duration.ofNanos(this.decodeNanos))
				.exception(this.exception)
				.build();

		try {
			getExecutionContext().getResultLogger().log(resultLog);
		} catch (Throwable loggerFailure) {
			if (cleanupFailure == null)
				return loggerFailure;

			cleanupFailure.addSuppressed(loggerFailure);
		}

		return cleanupFailure;
	}

	private void throwCleanupFailure(@NonNull Throwable cleanupFailure) {
		requireNonNull(cleanupFailure);

		if (cleanupFailure instanceof SQLException sqlException)
			throw getExecutionContext().getExecutionErrorHandler().handle(sqlException, this);
		if (cleanupFailure instanceof RuntimeException runtimeException)
			throw runtimeException;
		if (cleanupFailure instanceof Error error)
			throw error;

		throw new DatabaseException(cleanupFailure);
	}

	@NonNull
	private List<Row> fetchManyRows(@Nullable Integer size) {
		return deferringResultLog(() -> {
			long start = System.nanoTime();
			List<Object[]> rawRows = getFetchStrategy().fetchMany(this, size);
			this.fetchNanos += System.nanoTime() - start;

			return toRows(rawRows);
		});
	}

	/**
	 * Runs a fetch and logs the result afterwards if the fetch released the cursor, so the rows that fetch returns are
	 * included in the {@link ResultLog}.
	 */
	@NonNull
	private <T> T deferringResultLog(@NonNull Supplier<T> fetch) {
		requireNonNull(fetch);

		T value;
		++this.fetchDepth;

		try {
			value = fetch.get();
		} catch (RuntimeException | Error e) {
			--this.fetchDepth;

			if (this.fetchDepth == 0 && this.releasedFetchStrategyName != null) {
				if (this.exception == null && e instanceof Exception failure)
					this.exception = failure;

				Throwable loggerFailure = logResult(null);

				if (loggerFailure != null && loggerFailure != e)
					e.addSuppressed(loggerFailure);
			}

			throw e;
		}

		--this.fetchDepth;

		if (this.fetchDepth == 0) {
			Throwable loggerFailure = logResult(null);

			if (loggerFailure != null)
				throwCleanupFailure(loggerFailure);
		}

		return value;
	}

	@NonNull
	private Optional<Row> onlyRow(boolean required) {
		Row row;
		boolean additionalRow;

		try {
			row = fetchOne().orElse(null);
			additionalRow = row != null && getFetchStrategy().fetchOne(this).isPresent();
		} catch (RuntimeException e) {
			closeAfterFailure(e);
			throw e;
		}

		close();

		if (row == null && required)
			throw new InvalidRequestException("No row was found when one was required");

		if (additionalRow)
			throw new InvalidRequestException("Multiple rows were found when exactly one was required");

		return Optional.ofNullable(row);
	}

	@NonNull
	private List<Row> toRows(@NonNull List<Object[]> rawRows) {
		requireNonNull(rawRows);

		List<Row> rows = new ArrayList<>(rawRows.size());

		for (Object[] rawRow : rawRows)
			rows.add(toRow(rawRow));

		return rows;
	}

	@NonNull
	private Row toRow(@NonNull Object[] rawRow) {
		requireNonNull(rawRow);

		long start = System.nanoTime();
		Row row = Row.fromRawValues(getRowMetadata(), rawRow);
		this.decodeNanos += System.nanoTime() - start;
		++this.rowsEmitted;

		return row;
	}

	@NotThreadSafe
	private final class RowIterator implements Iterator<Row> {
		@Nullable
		private Row next;

		@Override
		public boolean hasNext() {
			if (this.next == null)
				this.next = fetchOne().orElse(null);

			return this.next != null;
		}

		@Override
		@NonNull
		public Row next() {
			if (!hasNext())
				throw new NoSuchElementException();

			Row row = this.next;
			this.next = null;
			return row;
		}
	}

	@NotThreadSafe
	private final class PartitionIterator implements Iterator<List<Row>> {
		@Nullable
		private final Integer size;
		@Nullable
		private List<Row> next;

		private PartitionIterator(@Nullable Integer size) {
			this.size = size;
		}

		@Override
		public boolean hasNext() {
			if (this.next == null) {
				List<Row> partition = fetchManyRows(this.size);
				this.next = partition.isEmpty() ? null : partition;
			}

			return this.next != null;
		}

		@Override
		@NonNull
		public List<Row> next() {
			if (!hasNext())
				throw new NoSuchElementException();

			List<Row> partition = this.next;
			this.next = null;
			return partition;
		}
	}
}
