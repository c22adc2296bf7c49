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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A table (or an alias of one) and its columns.
 *
 * @since 1.0.0
 */
public final class Table implements Traversable {
	@NonNull
	private static final TraversalSpec<Table> TRAVERSAL_SPEC = TraversalSpec.forType(Table.class)
			.add("name", VisitationKind.PLAIN_VALUE, Table::getName)
			.add("schema", VisitationKind.PLAIN_VALUE, table -> table.getSchema().orElse(null))
			.add("aliasOf", VisitationKind.NODE, table -> table.getAliasOf().orElse(null))
			.build();

	@NonNull
	private final String name;
	@Nullable
	private final String schema;
	@Nullable
	private final Table aliasOf;
	@NonNull
	private final Map<String, Column> columnsByName;

	private Table(@NonNull String name,
								@Nullable String schema,
								@Nullable Table aliasOf,
								@NonNull Map<String, TypeDescriptor> columnTypesByName) {
		requireNonNull(name);
		requireNonNull(columnTypesByName);

		this.name = name;
		this.schema = schema;
		this.aliasOf = aliasOf;

		Map<String, Column> columnsByName = new LinkedHashMap<>(columnTypesByName.size());

		for (Map.Entry<String, TypeDescriptor> entry : columnTypesByName.entrySet()) {
			Column baseColumn = aliasOf == null ? null : aliasOf.getColumn(entry.getKey());
			columnsByName.put(entry.getKey(), new Column(entry.getKey(), entry.getValue(), this, baseColumn));
		}

		this.columnsByName = Collections.unmodifiableMap(columnsByName);
	}

	@NonNull
	public static Builder withName(@NonNull String name) {
		requireNonNull(name);
		return new Builder(name);
	}

	/**
	 * Creates an alias of this table whose columns proxy this table's columns.
	 *
	 * @param aliasName the name of the alias
	 * @return the aliased table
	 */
	@NonNull
	public Table alias(@NonNull String aliasName) {
		requireNonNull(aliasName);

		Map<String, TypeDescriptor> columnTypesByName = new LinkedHashMap<>();

		for (Column column : getColumns())
			columnTypesByName.put(column.getName(), column.getType());

		return new Table(aliasName, null, this, columnTypesByName);
	}

	@NonNull
	public Column getColumn(@NonNull String name) {
		requireNonNull(name);

		Column column = this.columnsByName.get(name);

		if (column == null)
			throw new IllegalArgumentException(format("Table '%s' has no column named '%s'", getName(), name));

		return column;
	}

	@NonNull
	public List<Column> getColumns() {
		return new ArrayList<>(this.columnsByName.values());
	}

	@Override
	@NonNull
	public String getVisitName() {
		return "table";
	}

	@Override
	@NonNull
	public Optional<TraversalSpec<?>> getTraversalSpec() {
		return Optional.of(TRAVERSAL_SPEC);
	}

	@Override
	public String toString() {
		return format("%s{name=%s}", getClass().getSimpleName(), getName());
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	@NonNull
	public Optional<String> getSchema() {
		return Optional.ofNullable(this.schema);
	}

	@NonNull
	public Optional<Table> getAliasOf() {
		return Optional.ofNullable(this.aliasOf);
	}

	/**
	 * Builder used to construct instances of {@link Table}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final String name;
		@NonNull
		private final Map<String, TypeDescriptor> columnTypesByName;
		@Nullable
		private String schema;

		private Builder(@NonNull String name) {
			this.name = requireNonNull(name);
			this.columnTypesByName = new LinkedHashMap<>();
		}

		@NonNull
		public Builder schema(@Nullable String schema) {
			this.schema = schema;
			return this;
		}

		@NonNull
		public Builder column(@NonNull String name,
													@NonNull TypeDescriptor type) {
			requireNonNull(name);
			requireNonNull(type);
			this.columnTypesByName.put(name, type);
			return this;
		}

		@NonNull
		public Table build() {
			return new Table(this.name, this.schema, null, this.columnTypesByName);
		}
	}
}
