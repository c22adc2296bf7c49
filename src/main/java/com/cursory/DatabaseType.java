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

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * Identifies different types of databases, which determines how the names they report for result columns are treated.
 *
 * @since 1.0.0
 */
public enum DatabaseType {
	/**
	 * A database which reports column names as written.
	 */
	GENERIC(false),
	/**
	 * A PostgreSQL database. Unquoted identifiers are folded to lowercase by the server.
	 */
	POSTGRESQL(false),
	/**
	 * An Oracle database. Unquoted identifiers are reported in uppercase.
	 */
	ORACLE(true),
	/**
	 * An HSQLDB database. Unquoted identifiers are reported in uppercase.
	 */
	HSQLDB(true);

	private final boolean uppercaseIdentifiers;

	DatabaseType(boolean uppercaseIdentifiers) {
		this.uppercaseIdentifiers = uppercaseIdentifiers;
	}

	/**
	 * Does this database report case-insensitive identifiers in uppercase, so that names need normalizing to the
	 * lowercase convention?
	 *
	 * @return {@code true} if reported column names should be normalized
	 */
	public boolean isUppercaseIdentifiers() {
		return this.uppercaseIdentifiers;
	}

	/**
	 * Determines the type of database to which the given {@code dataSource} connects.
	 * <p>
	 * Note: this will establish a {@link Connection} to the database.
	 *
	 * @param dataSource the database connection factory
	 * @return the type of database
	 * @throws DatabaseException if an exception occurs while attempting to read database metadata
	 */
	@NonNull
	public static DatabaseType fromDataSource(@NonNull DataSource dataSource) {
		requireNonNull(dataSource);

		try (Connection connection = dataSource.getConnection()) {
			return fromDatabaseMetaData(connection.getMetaData());
		} catch (SQLException e) {
			throw new DatabaseException("Unable to connect to database to determine its type", e);
		}
	}

	@NonNull
	static DatabaseType fromDatabaseMetaData(@NonNull DatabaseMetaData databaseMetaData) throws SQLException {
		requireNonNull(databaseMetaData);

		String databaseProductName = databaseMetaData.getDatabaseProductName();
		String url = databaseMetaData.getURL();

		// All of our checks are against databases with English names
		String databaseProductNameLowercase = databaseProductName == null ? "" : databaseProductName.toLowerCase(Locale.ENGLISH);
		String urlLowercase = url == null ? "" : url.toLowerCase(Locale.ENGLISH);

		if (databaseProductNameLowercase.startsWith("oracle") || urlLowercase.startsWith("jdbc:oracle:"))
			return DatabaseType.ORACLE;

		if (databaseProductNameLowercase.contains("postgresql") || urlLowercase.startsWith("jdbc:postgresql:"))
			return DatabaseType.POSTGRESQL;

		if (databaseProductNameLowercase.startsWith("hsql") || urlLowercase.startsWith("jdbc:hsqldb:"))
			return DatabaseType.HSQLDB;

		return DatabaseType.GENERIC;
	}
}
