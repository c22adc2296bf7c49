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

import javax.annotation.concurrent.NotThreadSafe;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * A live database cursor as seen by a {@link CursorResult}: column descriptions, blocking fetch primitives and the
 * side-channel values of the executed statement.
 * <p>
 * Rows are returned as raw, undecoded value arrays. Implementations are not expected to be threadsafe.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public interface DriverCursor extends AutoCloseable {
	/**
	 * Descriptions of the columns this cursor returns.
	 *
	 * @return the column descriptions, or empty if the statement does not return rows
	 * @throws SQLException if the driver fails
	 */
	@NonNull
	Optional<List<RawColumnDescriptor>> getDescription() throws SQLException;

	/**
	 * Fetches the next row.
	 *
	 * @return the row, or empty if the cursor is exhausted
	 * @throws SQLException if the driver fails
	 */
	@NonNull
	Optional<Object[]> fetchOne() throws SQLException;

	/**
	 * Fetches up to {@code size} rows.
	 *
	 * @param size the maximum number of rows to fetch
	 * @return the rows, empty if the cursor is exhausted
	 * @throws SQLException if the driver fails
	 */
	@NonNull
	List<Object[]> fetchMany(int size) throws SQLException;

	/**
	 * Fetches up to the driver's default number of rows.
	 *
	 * @return the rows, empty if the cursor is exhausted
	 * @throws SQLException if the driver fails
	 */
	@NonNull
	List<Object[]> fetchMany() throws SQLException;

	@NonNull
	List<Object[]> fetchAll() throws SQLException;

	/**
	 * Number of rows affected by the statement.
	 *
	 * @return the affected row count, or {@code -1} if the driver does not report one
	 */
	long getRowCount();

	/**
	 * Database-generated key of the last inserted row.
	 *
	 * @return the generated key, if any
	 */
	@NonNull
	Optional<Object> getLastRowId();

	@Override
	void close() throws SQLException;
}
