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

import org.hsqldb.jdbc.JDBCDataSource;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Runs results end-to-end against an in-memory HSQLDB.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class JdbcDriverCursorTests {
	@NonNull
	private static final Dialect HSQLDB = Dialect.forDatabaseType(DatabaseType.HSQLDB);

	@Test
	public void testDatabaseTypeDetection() {
		Assertions.assertEquals(DatabaseType.HSQLDB, DatabaseType.fromDataSource(createInMemoryDataSource("testDatabaseTypeDetection")));
	}

	@Test
	public void testInsertReportsRowCountAndLastRowId() throws SQLException {
		DataSource dataSource = createInMemoryDataSource("testInsertReportsRowCountAndLastRowId");

		try (Connection connection = dataSource.getConnection()) {
			createTestSchema(connection);

			CursorResult result = CursorResult.create(context(null),
					JdbcDriverCursor.execute(connection, "INSERT INTO employee (name, salary) VALUES (?, ?)",
							List.of("Employee One", new BigDecimal("1000.00"))));

			Assertions.assertFalse(result.returnsRows());
			Assertions.assertEquals(1, result.getRowCount());
			Assertions.assertEquals(1L, ((Number) result.getLastRowId().orElseThrow()).longValue());
			Assertions.assertTrue(result.isSoftClosed());

			CursorResult update = CursorResult.create(context(null),
					JdbcDriverCursor.execute(connection, "UPDATE employee SET salary = salary + 1", List.of()));

			Assertions.assertEquals(1, update.getRowCount());
			Assertions.assertTrue(update.getLastRowId().isEmpty());
		}
	}

	@Test
	public void testRawSqlKeysAreNormalized() throws SQLException {
		DataSource dataSource = createInMemoryDataSource("testRawSqlKeysAreNormalized");

		try (Connection connection = dataSource.getConnection()) {
			createTestSchema(connection);
			insertEmployees(connection, 3);

			CursorResult result = CursorResult.create(context(null),
					JdbcDriverCursor.execute(connection, "SELECT COUNT(*) AS n, MAX(name) AS \"MaxName\" FROM employee", List.of()));

			Row row = result.one();

			Assertions.assertEquals(List.of("n", "MaxName"), row.fields());
			Assertions.assertEquals(3, ((Number) row.get("n")).intValue());
			Assertions.assertEquals("Employee 3", row.get("MaxName"));
		}
	}

	@Test
	public void testDeclaredColumnsAreMatchedPositionally() throws SQLException {
		DataSource dataSource = createInMemoryDataSource("testDeclaredColumnsAreMatchedPositionally");
		Table employee = Table.withName("employee")
				.column("employee_id", SqlType.BIGINT)
				.column("name", SqlType.VARCHAR)
				.build();
		Select select = Select.columns(employee.getColumn("employee_id"), employee.getColumn("name"))
				.from(employee)
				.orderBy(employee.getColumn("employee_id"))
				.build();

		try (Connection connection = dataSource.getConnection()) {
			createTestSchema(connection);
			insertEmployees(connection, 2);

			CursorResult result = CursorResult.create(context(CompiledStatement.forSelectable(select, new CacheKeyGenerator())),
					JdbcDriverCursor.execute(connection, "SELECT employee_id, name FROM employee ORDER BY employee_id", List.of()));

			List<Row> rows = result.fetchAll();

			Assertions.assertEquals(2, rows.size());
			Assertions.assertEquals(List.of("employee_id", "name"), result.keys());
			Assertions.assertEquals(1L, rows.get(0).get(employee.getColumn("employee_id")));
			Assertions.assertEquals("Employee 2", rows.get(1).get(employee.getColumn("name")));
			Assertions.assertTrue(result.isSoftClosed());
		}
	}

	@Test
	public void testStreamingAgainstRealDriver() throws SQLException {
		DataSource dataSource = createInMemoryDataSource("testStreamingAgainstRealDriver");

		try (Connection connection = dataSource.getConnection()) {
			createTestSchema(connection);
			insertEmployees(connection, 40);

			ExecutionContext executionContext = ExecutionContext.withDialect(HSQLDB)
					.executionOptions(ExecutionOptions.builder().streamResults(true).maxRowBuffer(10).build())
					.build();

			CursorResult result = CursorResult.create(executionContext,
					JdbcDriverCursor.execute(connection, "SELECT name FROM employee ORDER BY employee_id", List.of()));

			int count = 0;

			for (List<Row> partition : result.partitions(7)) {
				Assertions.assertTrue(partition.size() <= 7);
				count += partition.size();
			}

			Assertions.assertEquals(40, count);
			Assertions.assertTrue(result.isSoftClosed());
		}
	}

	@Test
	public void testDriverErrorsCarrySqlState() throws SQLException {
		DataSource dataSource = createInMemoryDataSource("testDriverErrorsCarrySqlState");

		try (Connection connection = dataSource.getConnection()) {
			SQLException e = Assertions.assertThrows(SQLException.class,
					() -> JdbcDriverCursor.execute(connection, "SELECT * FROM missing_table", List.of()));

			DatabaseException databaseException = new DatabaseException(e);

			Assertions.assertEquals(e.getSQLState(), databaseException.getSqlState().orElseThrow());
		}
	}

	@NonNull
	private ExecutionContext context(@Nullable CompiledStatement compiledStatement) {
		return ExecutionContext.withDialect(HSQLDB)
				.compiledStatement(compiledStatement)
				.build();
	}

	private void createTestSchema(@NonNull Connection connection) throws SQLException {
		requireNonNull(connection);

		JdbcDriverCursor.execute(connection, "CREATE TABLE employee (employee_id BIGINT GENERATED BY DEFAULT AS IDENTITY (START WITH 1) PRIMARY KEY, "
				+ "name VARCHAR(255) NOT NULL, salary DECIMAL(12,2))", List.of()).close();
	}

	private void insertEmployees(@NonNull Connection connection,
															 int count) throws SQLException {
		requireNonNull(connection);

		for (int i = 1; i <= count; ++i)
			JdbcDriverCursor.execute(connection, "INSERT INTO employee (name, salary) VALUES (?, ?)",
					List.of(format("Employee %d", i), new BigDecimal(i * 100))).close();
	}

	@NonNull
	protected DataSource createInMemoryDataSource(@NonNull String databaseName) {
		requireNonNull(databaseName);

		JDBCDataSource dataSource = new JDBCDataSource();
		dataSource.setUrl(format("jdbc:hsqldb:mem:%s", databaseName));
		dataSource.setUser("sa");
		dataSource.setPassword("");

		return dataSource;
	}
}
