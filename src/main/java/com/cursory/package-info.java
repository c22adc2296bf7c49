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

/**
 * Cursory is the execution-result layer of a JDBC toolkit: it turns a driver cursor plus a statement's declared
 * columns into reusable row metadata and immutable, multiply-addressable rows.
 *
 * <pre>
 * // Describe the statement
 * Table user = Table.withName("app_user").column("id", SqlType.INTEGER).column("name", SqlType.VARCHAR).build();
 * Select select = Select.columns(user.getColumn("id"), user.getColumn("name")).build();
 * CompiledStatement compiledStatement = CompiledStatement.forSelectable(select, new CacheKeyGenerator());
 *
 * // Execute it and read the rows
 * ExecutionContext executionContext = ExecutionContext.withDialect(Dialect.forDatabaseType(DatabaseType.HSQLDB))
 *   .compiledStatement(compiledStatement)
 *   .statementDescription("SELECT id, name FROM app_user")
 *   .build();
 *
 * try (CursorResult result = CursorResult.create(executionContext,
 *     JdbcDriverCursor.execute(connection, "SELECT id, name FROM app_user", List.of()))) {
 *   for (Row row : result) {
 *     Object id = row.get(0);
 *     Object name = row.get(user.getColumn("name"));
 *   }
 * }</pre>
 *
 * @since 1.0.0
 */
package com.cursory;
