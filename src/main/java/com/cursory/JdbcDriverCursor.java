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
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * {@link DriverCursor} over a JDBC {@link PreparedStatement}.
 * <p>
 * The statement's update count is reported as the row count. For {@code INSERT}s, the first generated key is reported
 * as the last row ID. Closing the cursor closes the result set and the statement, not the connection.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public final class JdbcDriverCursor implements DriverCursor {
	private static final int DEFAULT_FETCH_SIZE = 1;

	@NonNull
	private final PreparedStatement preparedStatement;
	@Nullable
	private final ResultSet resultSet;
	@Nullable
	private final List<RawColumnDescriptor> description;
	private final long rowCount;
	@Nullable
	private final Object lastRowId;
	private boolean exhausted;

	private JdbcDriverCursor(@NonNull PreparedStatement preparedStatement,
													 boolean generatedKeysRequested) throws SQLException {
		requireNonNull(preparedStatement);

		this.preparedStatement = preparedStatement;

		ResultSet resultSet = preparedStatement.getResultSet();

		if (resultSet != null) {
			this.resultSet = resultSet;
			this.description = describe(this.resultSet.getMetaData());
			this.rowCount = -1;
			this.lastRowId = null;
		} else {
			this.resultSet = null;
			this.description = null;
			this.rowCount = preparedStatement.getUpdateCount();
			this.lastRowId = generatedKeysRequested ? readGeneratedKey(preparedStatement) : null;
		}
	}

	/**
	 * Prepares and executes {@code sql} on {@code connection}.
	 *
	 * @param connection the connection to execute on, left open when the cursor is closed
	 * @param sql        the SQL to execute
	 * @param parameters positional parameters, bound with {@link PreparedStatement#setObject(int, Object)}
	 * @return a cursor over the statement's results
	 * @throws SQLException if preparation or execution fails
	 */
	@NonNull
	public static JdbcDriverCursor execute(@NonNull Connection connection,
																				 @NonNull String sql,
																				 @NonNull List<?> parameters) throws SQLException {
		requireNonNull(connection);
		requireNonNull(sql);
		requireNonNull(parameters);

		boolean insert = isInsert(sql);
		PreparedStatement preparedStatement = insert
				? connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)
				: connection.prepareStatement(sql);

		try {
			for (int i = 0; i < parameters.size(); ++i)
				preparedStatement.setObject(i + 1, parameters.get(i));

			preparedStatement.execute();
			return new JdbcDriverCursor(preparedStatement, insert);
		} catch (SQLException | RuntimeException e) {
			try {
				preparedStatement.close();
			} catch (SQLException cleanupException) {
				e.addSuppressed(cleanupException);
			}

			throw e;
		}
	}

	@Override
	@NonNull
	public Optional<List<RawColumnDescriptor>> getDescription() {
		return Optional.ofNullable(this.description);
	}

	@Override
	@NonNull
	public Optional<Object[]> fetchOne() throws SQLException {
		if (this.resultSet == null || this.exhausted)
			return Optional.empty();

		if (!this.resultSet.next()) {
			this.exhausted = true;
			return Optional.empty();
		}

		return Optional.of(readRow(this.resultSet));
	}

	@Override
	@NonNull
	public List<Object[]> fetchMany(int size) throws SQLException {
		if (size < 1)
			throw new IllegalArgumentException("Fetch size must be at least 1");

		if (this.resultSet == null || this.exhausted)
			return Collections.emptyList();

		this.resultSet.setFetchSize(size);

		List<Object[]> rows = new ArrayList<>(Math.min(size, 1024));

		while (rows.size() < size) {
			Object[] row = fetchOne().orElse(null);

			if (row == null)
				break;

			rows.add(row);
		}

		return rows;
	}

	@Override
	@NonNull
	public List<Object[]> fetchMany() throws SQLException {
		int fetchSize = this.resultSet == null ? 0 : this.resultSet.getFetchSize();
		return fetchMany(fetchSize < 1 ? DEFAULT_FETCH_SIZE : fetchSize);
	}

	@Override
	@NonNull
	public List<Object[]> fetchAll() throws SQLException {
		List<Object[]> rows = new ArrayList<>();

		for (Object[] row = fetchOne().orElse(null); row != null; row = fetchOne().orElse(null))
			rows.add(row);

		return rows;
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
		SQLException closeFailure = null;

		if (this.resultSet != null) {
			try {
				this.resultSet.close();
			} catch (SQLException e) {
				closeFailure = e;
			}
		}

		try {
			this.preparedStatement.close();
		} catch (SQLException e) {
			if (closeFailure == null)
				closeFailure = e;
			else
				closeFailure.addSuppressed(e);
		}

		if (closeFailure != null)
			throw closeFailure;
	}

	@NonNull
	private static List<RawColumnDescriptor> describe(@NonNull ResultSetMetaData resultSetMetaData) throws SQLException {
		requireNonNull(resultSetMetaData);

		int columnCount = resultSetMetaData.getColumnCount();
		List<RawColumnDescriptor> description = new ArrayList<>(columnCount);

		for (int i = 1; i <= columnCount; ++i)
			description.add(new RawColumnDescriptor(resultSetMetaData.getColumnLabel(i), resultSetMetaData.getColumnType(i),
					resultSetMetaData.getColumnTypeName(i)));

		return Collections.unmodifiableList(description);
	}

	@NonNull
	private static Object[] readRow(@NonNull ResultSet resultSet) throws SQLException {
		requireNonNull(resultSet);

		int columnCount = resultSet.getMetaData().getColumnCount();
		Object[] row = new Object[columnCount];

		for (int i = 0; i < columnCount; ++i)
			row[i] = resultSet.getObject(i + 1);

		return row;
	}

	@Nullable
	private static Object readGeneratedKey(@NonNull PreparedStatement preparedStatement) throws SQLException {
		requireNonNull(preparedStatement);

		try (ResultSet generatedKeys = preparedStatement.getGeneratedKeys()) {
			if (generatedKeys != null && generatedKeys.next())
				return generatedKeys.getObject(1);
		}

		return null;
	}

	private static boolean isInsert(@NonNull String sql) {
		return sql.stripLeading().toLowerCase(Locale.ENGLISH).startsWith("insert");
	}
}
