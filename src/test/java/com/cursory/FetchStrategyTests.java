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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class FetchStrategyTests {
	@NonNull
	private static ExecutionContext context(@NonNull ExecutionOptions executionOptions,
																					@NonNull List<ResultLog> resultLogs) {
		requireNonNull(executionOptions);
		requireNonNull(resultLogs);

		return ExecutionContext.withDialect(Dialect.forDatabaseType(DatabaseType.GENERIC))
				.executionOptions(executionOptions)
				.resultLogger(resultLogs::add)
				.build();
	}

	@NonNull
	private static List<ExecutionOptions> allRowReturningOptions() {
		return List.of(
				ExecutionOptions.defaults(),
				ExecutionOptions.builder().streamResults(true).build(),
				ExecutionOptions.builder().bufferFully(true).build(),
				ExecutionOptions.builder().yieldPer(3).build());
	}

	@Test
	public void testGrowthBufferedRefillSizes() {
		List<ResultLog> resultLogs = new ArrayList<>();
		FakeDriverCursor cursor = FakeDriverCursor.withIntegers(37);
		ExecutionOptions executionOptions = ExecutionOptions.builder()
				.streamResults(true)
				.maxRowBuffer(1000)
				.growthFactor(5)
				.build();

		CursorResult result = CursorResult.create(context(executionOptions, resultLogs), cursor);
		Assertions.assertTrue(result.getFetchStrategy() instanceof GrowthBufferedFetchStrategy);

		List<Object> values = new ArrayList<>();

		for (Optional<Row> row = result.fetchOne(); row.isPresent(); row = result.fetchOne()) {
			values.add(row.get().get(0));
			Assertions.assertEquals(FetchState.OPEN, result.getFetchState(), "Cursor released while rows were still emitted");
		}

		Assertions.assertEquals(37, values.size());
		Assertions.assertEquals(1, values.get(0));
		Assertions.assertEquals(37, values.get(36));
		Assertions.assertEquals(List.of(1, 5, 25, 125, 625), cursor.getRequestedSizes());
		Assertions.assertEquals(List.of(1, 5, 25, 6, 0), cursor.getDeliveredSizes());
		Assertions.assertEquals(FetchState.SOFT_CLOSED, result.getFetchState());
		Assertions.assertEquals(1, cursor.getCloseCount(), "Cursor should be released exactly once");
		Assertions.assertEquals(1, resultLogs.size(), "Result should be logged exactly once");
		Assertions.assertEquals(37L, resultLogs.get(0).getRowsEmitted());
		Assertions.assertEquals("GrowthBufferedFetchStrategy", resultLogs.get(0).getFetchStrategyName());

		// Further reads stay quiet
		Assertions.assertTrue(result.fetchOne().isEmpty());
		Assertions.assertEquals(1, cursor.getCloseCount());
		Assertions.assertEquals(1, resultLogs.size());
	}

	@Test
	public void testGrowthIsCappedAtMaxRowBuffer() {
		FakeDriverCursor cursor = FakeDriverCursor.withIntegers(100);
		ExecutionOptions executionOptions = ExecutionOptions.builder()
				.streamResults(true)
				.maxRowBuffer(10)
				.growthFactor(5)
				.build();

		CursorResult result = CursorResult.create(context(executionOptions, new ArrayList<>()), cursor);
		int count = 0;

		for (Row ignored : result)
			++count;

		Assertions.assertEquals(100, count);
		Assertions.assertEquals(1, cursor.getRequestedSizes().get(0));
		Assertions.assertEquals(5, cursor.getRequestedSizes().get(1));

		for (int requestedSize : cursor.getRequestedSizes().subList(2, cursor.getRequestedSizes().size()))
			Assertions.assertEquals(10, requestedSize);
	}

	@Test
	public void testGrowthNearIntegerLimitIsCapped() {
		FakeDriverCursor cursor = FakeDriverCursor.withIntegers(3);
		ExecutionOptions executionOptions = ExecutionOptions.builder()
				.streamResults(true)
				.maxRowBuffer(Integer.MAX_VALUE)
				.growthFactor(100_000)
				.build();

		CursorResult result = CursorResult.create(context(executionOptions, new ArrayList<>()), cursor);
		int count = 0;

		for (Row ignored : result)
			++count;

		Assertions.assertEquals(3, count);
		// The last refill asks for Integer.MAX_VALUE rows, which the fake cursor records as a drain
		Assertions.assertEquals(List.of(1, 100_000), cursor.getRequestedSizes());
		Assertions.assertEquals(List.of(1, 2, 0), cursor.getDeliveredSizes());
		Assertions.assertEquals(FetchState.SOFT_CLOSED, result.getFetchState());
	}

	@Test
	public void testSecondFetchAllIsEmptyForEveryStrategy() {
		for (ExecutionOptions executionOptions : allRowReturningOptions()) {
			FakeDriverCursor cursor = FakeDriverCursor.withIntegers(7);
			CursorResult result = CursorResult.create(context(executionOptions, new ArrayList<>()), cursor);

			Assertions.assertEquals(7, result.fetchAll().size(), executionOptions.toString());
			Assertions.assertEquals(FetchState.SOFT_CLOSED, result.getFetchState(), executionOptions.toString());
			Assertions.assertTrue(result.fetchAll().isEmpty(), executionOptions.toString());
			Assertions.assertTrue(result.fetchOne().isEmpty(), executionOptions.toString());
			Assertions.assertTrue(result.fetchMany(5).isEmpty(), executionOptions.toString());
			Assertions.assertEquals(1, cursor.getCloseCount(), executionOptions.toString());
		}
	}

	@Test
	public void testCloseTwiceIsNoOpForEveryStrategy() {
		for (ExecutionOptions executionOptions : allRowReturningOptions()) {
			List<ResultLog> resultLogs = new ArrayList<>();
			FakeDriverCursor cursor = FakeDriverCursor.withIntegers(7);
			CursorResult result = CursorResult.create(context(executionOptions, resultLogs), cursor);

			result.fetchOne();
			result.close();
			result.close();

			Assertions.assertTrue(result.isClosed(), executionOptions.toString());
			Assertions.assertEquals(FetchState.HARD_CLOSED, result.getFetchState(), executionOptions.toString());
			Assertions.assertEquals(1, cursor.getCloseCount(), executionOptions.toString());
			Assertions.assertEquals(1, resultLogs.size(), executionOptions.toString());

			ResourceClosedException e = Assertions.assertThrows(ResourceClosedException.class, result::fetchOne);
			Assertions.assertEquals("This result object is closed.", e.getMessage());
			Assertions.assertThrows(ResourceClosedException.class, result::fetchAll);
			Assertions.assertThrows(ResourceClosedException.class, () -> result.fetchMany(2));
		}
	}

	@Test
	public void testCloseAfterSoftCloseMovesToHardClosed() {
		FakeDriverCursor cursor = FakeDriverCursor.withIntegers(2);
		CursorResult result = CursorResult.create(context(ExecutionOptions.defaults(), new ArrayList<>()), cursor);

		result.fetchAll();
		Assertions.assertTrue(result.isSoftClosed());
		Assertions.assertFalse(result.isClosed());

		result.close();
		Assertions.assertTrue(result.isClosed());
		Assertions.assertEquals(1, cursor.getCloseCount());
		Assertions.assertThrows(ResourceClosedException.class, result::fetchAll);
	}

	@Test
	public void testNonRowReturningStatement() {
		List<ResultLog> resultLogs = new ArrayList<>();
		FakeDriverCursor cursor = FakeDriverCursor.withoutRows(3, 42L);
		CursorResult result = CursorResult.create(context(ExecutionOptions.defaults(), resultLogs), cursor);

		Assertions.assertFalse(result.returnsRows());
		Assertions.assertEquals(FetchState.SOFT_CLOSED, result.getFetchState());
		Assertions.assertTrue(result.getFetchStrategy() instanceof NonRowReturningFetchStrategy);
		Assertions.assertEquals(1, cursor.getCloseCount(), "Cursor should be released immediately");
		Assertions.assertEquals(1, resultLogs.size());

		// Side-channel values survive the release
		Assertions.assertEquals(3L, result.getRowCount());
		Assertions.assertEquals(Optional.of(42L), result.getLastRowId());

		ResourceClosedException e = Assertions.assertThrows(ResourceClosedException.class, result::fetchOne);
		Assertions.assertEquals("This result object does not return rows. It has been closed automatically.", e.getMessage());
		Assertions.assertThrows(ResourceClosedException.class, result::fetchAll);
		Assertions.assertThrows(ResourceClosedException.class, result::keys);

		result.close();
		result.close();
		Assertions.assertTrue(result.isClosed());
		Assertions.assertThrows(ResourceClosedException.class, result::fetchOne);
		Assertions.assertEquals(1, cursor.getCloseCount());
	}

	@Test
	public void testFullyBufferedDrainsAtCreation() {
		FakeDriverCursor cursor = FakeDriverCursor.withIntegers(5);
		CursorResult result = CursorResult.create(context(ExecutionOptions.builder().bufferFully(true).build(),
				new ArrayList<>()), cursor);

		Assertions.assertEquals(0, cursor.getRemainingRowCount(), "Rows should be drained up front");
		Assertions.assertEquals(FetchState.OPEN, result.getFetchState());
		Assertions.assertEquals(2, result.fetchMany(2).size());
		Assertions.assertEquals(3, result.fetchMany(10).size());
		Assertions.assertEquals(FetchState.OPEN, result.getFetchState(), "Not exhausted until a fetch comes back empty");
		Assertions.assertTrue(result.fetchMany(10).isEmpty());
		Assertions.assertEquals(FetchState.SOFT_CLOSED, result.getFetchState());
	}

	@Test
	public void testDirectFetchManyUsesDriverDefaultSize() {
		FakeDriverCursor cursor = FakeDriverCursor.withIntegers(10).defaultFetchSize(4);
		CursorResult result = CursorResult.create(context(ExecutionOptions.defaults(), new ArrayList<>()), cursor);

		Assertions.assertTrue(result.getFetchStrategy() instanceof DirectFetchStrategy);
		Assertions.assertEquals(4, result.fetchMany().size());
		Assertions.assertEquals(List.of(4), cursor.getRequestedSizes());
	}

	@Test
	public void testYieldPerReplacesStrategyAndKeepsBufferedRows() {
		FakeDriverCursor cursor = FakeDriverCursor.withIntegers(20);
		CursorResult result = CursorResult.create(context(ExecutionOptions.builder().streamResults(true).build(),
				new ArrayList<>()), cursor);

		FetchStrategy growing = result.getFetchStrategy();
		Assertions.assertEquals(1, result.fetchOne().orElseThrow().get(0));
		Assertions.assertEquals(2, result.fetchOne().orElseThrow().get(0));

		result.yieldPer(6);

		Assertions.assertNotSame(growing, result.getFetchStrategy(), "Reconfiguration should replace the strategy");
		Assertions.assertEquals(0, cursor.getCloseCount(), "The cursor should be handed over, not released");

		// Rows 3 to 6 were already buffered by the growing strategy
		List<Row> partition = result.fetchMany();
		Assertions.assertEquals(6, partition.size());
		Assertions.assertEquals(3, partition.get(0).get(0));

		List<Integer> partitionSizes = new ArrayList<>();

		for (List<Row> rows : result.partitions())
			partitionSizes.add(rows.size());

		Assertions.assertEquals(List.of(6, 6), partitionSizes);
		Assertions.assertTrue(result.isSoftClosed());

		Assertions.assertEquals(25, ((GrowthBufferedFetchStrategy) growing).getBufferSize(),
				"The replaced strategy is left untouched");
	}

	@Test
	public void testYieldPerOnDirectStreamsInFixedBatches() {
		FakeDriverCursor cursor = FakeDriverCursor.withIntegers(10);
		CursorResult result = CursorResult.create(context(ExecutionOptions.builder().yieldPer(4).build(),
				new ArrayList<>()), cursor);

		Assertions.assertTrue(result.getFetchStrategy() instanceof GrowthBufferedFetchStrategy);

		int count = 0;

		for (Row ignored : result)
			++count;

		Assertions.assertEquals(10, count);
		Assertions.assertEquals(List.of(4, 4, 4, 4), cursor.getRequestedSizes());
	}

	@Test
	public void testDriverFailuresGoThroughErrorHandlerForEveryStrategy() {
		for (ExecutionOptions executionOptions : List.of(ExecutionOptions.defaults(),
				ExecutionOptions.builder().yieldPer(3).build())) {
			List<ResultLog> resultLogs = new ArrayList<>();
			List<Exception> handled = new ArrayList<>();
			FakeDriverCursor cursor = FakeDriverCursor.withIntegers(5);

			ExecutionContext executionContext = ExecutionContext.withDialect(Dialect.forDatabaseType(DatabaseType.GENERIC))
					.executionOptions(executionOptions)
					.resultLogger(resultLogs::add)
					.executionErrorHandler((exception, result) -> {
						handled.add(exception);
						return new DatabaseException("Fetch failed", exception);
					})
					.build();

			CursorResult result = CursorResult.create(executionContext, cursor);
			SQLException failure = new SQLException("connection reset", "08006", 17);
			cursor.failFetchesWith(failure);

			DatabaseException e = Assertions.assertThrows(DatabaseException.class, result::fetchOne);

			Assertions.assertEquals("Fetch failed", e.getMessage(), executionOptions.toString());
			Assertions.assertSame(failure, e.getCause(), executionOptions.toString());
			Assertions.assertEquals(List.of(failure), handled, executionOptions.toString());
			Assertions.assertTrue(result.isClosed(), executionOptions.toString());
			Assertions.assertEquals(1, cursor.getCloseCount(), executionOptions.toString());
			Assertions.assertEquals(1, resultLogs.size(), executionOptions.toString());
			Assertions.assertSame(e, resultLogs.get(0).getException().orElse(null), executionOptions.toString());
		}
	}

	@Test
	public void testFailureDuringFullBufferingIsHandled() {
		FakeDriverCursor cursor = FakeDriverCursor.withIntegers(5).failFetchesWith(new SQLException("boom"));

		DatabaseException e = Assertions.assertThrows(DatabaseException.class,
				() -> CursorResult.create(context(ExecutionOptions.builder().bufferFully(true).build(), new ArrayList<>()),
						cursor));

		Assertions.assertEquals("boom", e.getCause().getMessage());
		Assertions.assertEquals(1, cursor.getCloseCount());
	}

	@Test
	public void testCursorCloseFailureIsSuppressedBehindFetchFailure() {
		SQLException closeFailure = new SQLException("close failed");
		FakeDriverCursor cursor = FakeDriverCursor.withIntegers(5);
		CursorResult result = CursorResult.create(context(ExecutionOptions.defaults(), new ArrayList<>()), cursor);

		cursor.failFetchesWith(new SQLException("fetch failed")).failCloseWith(closeFailure);

		DatabaseException e = Assertions.assertThrows(DatabaseException.class, result::fetchOne);

		Assertions.assertEquals("fetch failed", e.getCause().getMessage());
		Assertions.assertEquals(1, e.getSuppressed().length);
		Assertions.assertSame(closeFailure, e.getSuppressed()[0]);
	}

	@Test
	public void testCursorCloseFailureSurfacesWithoutPrimaryFailure() {
		FakeDriverCursor cursor = FakeDriverCursor.withIntegers(1).failCloseWith(new SQLException("close failed", "HY000"));
		CursorResult result = CursorResult.create(context(ExecutionOptions.defaults(), new ArrayList<>()), cursor);

		DatabaseException e = Assertions.assertThrows(DatabaseException.class, result::close);

		Assertions.assertEquals(Optional.of("HY000"), e.getSqlState());
		Assertions.assertTrue(result.isClosed());
	}
}
