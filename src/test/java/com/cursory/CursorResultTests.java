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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class CursorResultTests {
	@NonNull
	private static final List<RawColumnDescriptor> EMPLOYEE_DESCRIPTION = List.of(
			RawColumnDescriptor.of("id", Types.INTEGER),
			RawColumnDescriptor.of("name", Types.VARCHAR),
			RawColumnDescriptor.of("salary", Types.INTEGER));

	@NonNull
	private static FakeDriverCursor employees(int count) {
		List<Object[]> rows = new ArrayList<>(count);

		for (int i = 1; i <= count; ++i)
			rows.add(new Object[]{i, "Employee " + i, i * 1000});

		return FakeDriverCursor.withRows(EMPLOYEE_DESCRIPTION, rows);
	}

	@NonNull
	private static CursorResult result(@NonNull DriverCursor driverCursor,
																		 @NonNull List<ResultLog> resultLogs) {
		requireNonNull(driverCursor);
		requireNonNull(resultLogs);

		ExecutionContext executionContext = ExecutionContext.withDialect(Dialect.forDatabaseType(DatabaseType.GENERIC))
				.statementDescription("SELECT id, name, salary FROM employee")
				.resultLogger(resultLogs::add)
				.build();

		return CursorResult.create(executionContext, driverCursor);
	}

	@NonNull
	private static CursorResult result(@NonNull DriverCursor driverCursor) {
		return result(driverCursor, new ArrayList<>());
	}

	@Test
	public void testFirstClosesResult() {
		FakeDriverCursor cursor = employees(3);
		CursorResult result = result(cursor);

		Row row = result.first().orElseThrow();

		Assertions.assertEquals(1, row.get("id"));
		Assertions.assertTrue(result.isClosed());
		Assertions.assertEquals(1, cursor.getCloseCount());
		Assertions.assertThrows(ResourceClosedException.class, result::fetchOne);
		Assertions.assertTrue(result(employees(0)).first().isEmpty());
	}

	@Test
	public void testOne() {
		Assertions.assertEquals("Employee 1", result(employees(1)).one().get("name"));

		InvalidRequestException none = Assertions.assertThrows(InvalidRequestException.class,
				() -> result(employees(0)).one());
		Assertions.assertEquals("No row was found when one was required", none.getMessage());

		FakeDriverCursor cursor = employees(2);
		CursorResult result = result(cursor);

		InvalidRequestException multiple = Assertions.assertThrows(InvalidRequestException.class, result::one);
		Assertions.assertEquals("Multiple rows were found when exactly one was required", multiple.getMessage());
		Assertions.assertTrue(result.isClosed());
		Assertions.assertEquals(1, cursor.getCloseCount());
	}

	@Test
	public void testOneOrNull() {
		Assertions.assertTrue(result(employees(0)).oneOrNull().isEmpty());
		Assertions.assertEquals(1, result(employees(1)).oneOrNull().orElseThrow().get("id"));
		Assertions.assertThrows(InvalidRequestException.class, () -> result(employees(2)).oneOrNull());
	}

	@Test
	public void testScalar() {
		Assertions.assertEquals(1, result(employees(3)).scalar().orElseThrow());
		Assertions.assertTrue(result(employees(0)).scalar().isEmpty());

		FakeDriverCursor nullValue = FakeDriverCursor.withRows(List.of(RawColumnDescriptor.of("n", Types.INTEGER)),
				List.<Object[]>of(new Object[]{null}));
		Assertions.assertTrue(result(nullValue).scalar().isEmpty());
	}

	@Test
	public void testScalars() {
		Assertions.assertEquals(List.of(1, 2, 3), result(employees(3)).scalars());
		Assertions.assertEquals(List.of("Employee 1", "Employee 2"), result(employees(2)).scalars("name"));
		Assertions.assertEquals(List.of(1000, 2000), result(employees(2)).scalars(-1));
	}

	@Test
	public void testColumnsDecodesOnlyRetainedColumns() {
		Map<String, Integer> decodeCounts = new HashMap<>();
		ResultDecoderLookup countingLookup = (dialect, declaredType, rawColumnDescriptor) -> rawValue -> {
			decodeCounts.merge(rawColumnDescriptor.getName(), 1, Integer::sum);
			return rawValue;
		};

		ExecutionContext executionContext = ExecutionContext.withDialect(Dialect.withDatabaseType(DatabaseType.GENERIC)
						.resultDecoderLookup(countingLookup)
						.build())
				.build();

		CursorResult result = CursorResult.create(executionContext, employees(4)).columns("salary", "id");
		List<Row> rows = result.fetchAll();

		Assertions.assertEquals(List.of("salary", "id"), result.keys());
		Assertions.assertEquals(List.of(1000, 1), rows.get(0).values());
		Assertions.assertEquals(4000, rows.get(3).get("salary"));
		Assertions.assertThrows(NoSuchColumnException.class, () -> rows.get(0).get("name"));
		Assertions.assertEquals(Map.of("salary", 4, "id", 4), decodeCounts);
	}

	@Test
	public void testColumnsRejectsUnknownKeys() {
		Assertions.assertThrows(NoSuchColumnException.class, () -> result(employees(1)).columns("missing"));
		Assertions.assertThrows(ResourceClosedException.class,
				() -> result(FakeDriverCursor.withoutRows(1, null)).columns("id"));
	}

	@Test
	public void testMappings() {
		MappingResult mappingResult = result(employees(3)).mappings();

		Assertions.assertEquals(List.of("id", "name", "salary"), mappingResult.keys());
		Assertions.assertEquals("Employee 1", mappingResult.fetchOne().orElseThrow().get("name"));

		List<RowMapping> remaining = mappingResult.fetchAll();

		Assertions.assertEquals(2, remaining.size());
		Assertions.assertEquals(3, remaining.get(1).get("id"));
		Assertions.assertTrue(mappingResult.fetchOne().isEmpty());

		Assertions.assertEquals(Map.of("id", 1, "name", "Employee 1", "salary", 1000),
				result(employees(1)).mappings().one().asMap());
		Assertions.assertEquals(List.of(1, 2), result(employees(2)).mappings().stream()
				.map(rowMapping -> rowMapping.get("id"))
				.collect(Collectors.toList()));
	}

	@Test
	public void testPartitions() {
		List<Integer> sizes = new ArrayList<>();

		for (List<Row> partition : result(employees(5)).partitions(2))
			sizes.add(partition.size());

		Assertions.assertEquals(List.of(2, 2, 1), sizes);
		Assertions.assertThrows(InvalidRequestException.class, () -> result(employees(1)).partitions(0));
		Assertions.assertThrows(InvalidRequestException.class, () -> result(employees(1)).fetchMany(0));
		Assertions.assertThrows(InvalidRequestException.class, () -> result(employees(1)).yieldPer(0));
	}

	@Test
	public void testIterationAndStream() {
		List<Object> ids = new ArrayList<>();

		for (Row row : result(employees(3)))
			ids.add(row.get("id"));

		Assertions.assertEquals(List.of(1, 2, 3), ids);

		FakeDriverCursor cursor = employees(10);
		CursorResult result = result(cursor);

		try (Stream<Row> stream = result.stream()) {
			Assertions.assertEquals(List.of(1, 2), stream.limit(2).map(row -> row.get(0)).collect(Collectors.toList()));
		}

		Assertions.assertTrue(result.isClosed(), "Closing the stream closes the result");
		Assertions.assertEquals(1, cursor.getCloseCount());
	}

	@Test
	public void testNonRowReturningStatement() {
		CursorResult result = result(FakeDriverCursor.withoutRows(3, 42L));

		Assertions.assertFalse(result.returnsRows());
		Assertions.assertEquals(3, result.getRowCount());
		Assertions.assertEquals(42L, result.getLastRowId().orElseThrow());
		Assertions.assertThrows(ResourceClosedException.class, result::keys);
		Assertions.assertThrows(ResourceClosedException.class, result::first);
	}

	@Test
	public void testResultIsLoggedOnceWhenCursorIsReleased() {
		List<ResultLog> resultLogs = new ArrayList<>();
		CursorResult result = result(employees(2), resultLogs);

		result.fetchOne();
		Assertions.assertTrue(resultLogs.isEmpty(), "Nothing is logged while the cursor is held");

		result.fetchAll();
		result.close();
		result.close();

		Assertions.assertEquals(1, resultLogs.size());

		ResultLog resultLog = resultLogs.get(0);

		Assertions.assertEquals(2L, resultLog.getRowsEmitted());
		Assertions.assertEquals(List.of("id", "name", "salary"), resultLog.getKeys());
		Assertions.assertEquals("SELECT id, name, salary FROM employee",
				resultLog.getExecutionContext().getStatementDescription().orElseThrow());
		Assertions.assertTrue(resultLog.getException().isEmpty());
		Assertions.assertEquals(resultLog.getFetchDuration().plus(resultLog.getDecodeDuration()), resultLog.getTotalDuration());
	}

	@Test
	public void testResultLogCountsRowsOfTheExhaustingFetch() {
		List<ResultLog> directLogs = new ArrayList<>();
		CursorResult direct = result(employees(3), directLogs);

		Assertions.assertEquals(3, direct.fetchAll().size());
		Assertions.assertEquals(1, directLogs.size());
		Assertions.assertEquals(3L, directLogs.get(0).getRowsEmitted());

		List<ResultLog> streamingLogs = new ArrayList<>();
		ExecutionContext streaming = ExecutionContext.withDialect(Dialect.forDatabaseType(DatabaseType.GENERIC))
				.executionOptions(ExecutionOptions.builder().streamResults(true).build())
				.resultLogger(streamingLogs::add)
				.build();
		CursorResult streamed = CursorResult.create(streaming, employees(3));
		int fetched = 0;

		for (Row ignored : streamed)
			++fetched;

		Assertions.assertEquals(3, fetched);
		Assertions.assertEquals(1, streamingLogs.size());
		Assertions.assertEquals(3L, streamingLogs.get(0).getRowsEmitted());
		Assertions.assertEquals("GrowthBufferedFetchStrategy", streamingLogs.get(0).getFetchStrategyName());
	}

	@Test
	public void testFailureIsRecordedInResultLog() {
		List<ResultLog> resultLogs = new ArrayList<>();
		CursorResult result = result(employees(2).failFetchesWith(new SQLException("connection reset", "08006")), resultLogs);

		DatabaseException e = Assertions.assertThrows(DatabaseException.class, result::fetchAll);

		Assertions.assertEquals("08006", e.getSqlState().orElseThrow());
		Assertions.assertEquals(1, resultLogs.size());
		Assertions.assertSame(e, resultLogs.get(0).getException().orElseThrow());
	}

	@Test
	public void testResultLoggerFailures() {
		ExecutionContext failingLogger = ExecutionContext.withDialect(Dialect.forDatabaseType(DatabaseType.GENERIC))
				.resultLogger(resultLog -> {
					throw new IllegalStateException("logger is broken");
				})
				.build();

		CursorResult result = CursorResult.create(failingLogger, employees(2));
		IllegalStateException loggerFailure = Assertions.assertThrows(IllegalStateException.class, result::close);

		Assertions.assertEquals("logger is broken", loggerFailure.getMessage());
		Assertions.assertTrue(result.isClosed());

		CursorResult failingFetch = CursorResult.create(failingLogger,
				employees(2).failFetchesWith(new SQLException("connection reset")));
		DatabaseException fetchFailure = Assertions.assertThrows(DatabaseException.class, failingFetch::fetchOne);

		Assertions.assertEquals(1, fetchFailure.getSuppressed().length);
		Assertions.assertTrue(fetchFailure.getSuppressed()[0] instanceof IllegalStateException);
	}

	@Test
	public void testDefaultResultLoggerFormatting() {
		ExecutionContext executionContext = ExecutionContext.withDialect(Dialect.forDatabaseType(DatabaseType.GENERIC))
				.statementDescription("SELECT " + "x, ".repeat(50) + "y FROM t")
				.build();

		ResultLog resultLog = ResultLog.withExecutionContext(executionContext)
				.fetchStrategyName("DirectFetchStrategy")
				.keys(List.of("x", "y"))
				.rowsEmitted(1L)
				.fetchDuration(Duration.ofMillis(3))
				.decodeDuration(Duration.ofMillis(1))
				.exception(new DatabaseException(new SQLException("boom")))
				.build();

		String formatted = new DefaultResultLogger("com.cursory.test", Level.INFO).formatResultLog(resultLog);
		String[] lines = formatted.split("\n");

		Assertions.assertEquals(4, lines.length);
		Assertions.assertTrue(lines[0].endsWith("..."), "Long descriptions are ellipsized");
		Assertions.assertEquals("Columns: x, y", lines[1]);
		Assertions.assertEquals("1 row via DirectFetchStrategy, PT0.003S fetching, PT0.001S decoding", lines[2]);
		Assertions.assertEquals("Failed due to java.sql.SQLException: boom", lines[3]);
	}

	@Test
	public void testDefaultResultLoggerIsUsedWhenNoneIsSpecified() {
		ExecutionContext executionContext = ExecutionContext.withDialect(Dialect.forDatabaseType(DatabaseType.GENERIC)).build();
		Assertions.assertTrue(executionContext.getResultLogger() instanceof DefaultResultLogger);
	}

	@Test
	public void testRowsSurviveClose() {
		CursorResult result = result(employees(2));
		List<Row> rows = result.fetchAll();
		result.close();

		Optional<Object> name = rows.get(1).get("name", Object.class);
		Assertions.assertEquals("Employee 2", name.orElseThrow());
		Assertions.assertEquals(List.of("id", "name", "salary"), result.keys(), "Keys remain available after close");
	}

	@Nullable
	private static Object firstValue(@NonNull CursorResult result) {
		return result.first().map(row -> row.get(0)).orElse(null);
	}

	@Test
	public void testFirstOnSoftClosedResult() {
		CursorResult result = result(employees(1));
		result.fetchAll();

		Assertions.assertTrue(result.isSoftClosed());
		Assertions.assertNull(firstValue(result));
		Assertions.assertTrue(result.isClosed());
	}
}
