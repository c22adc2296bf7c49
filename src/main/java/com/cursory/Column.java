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

import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A column of a {@link Table}. Instances are created by {@link Table.Builder}.
 *
 * @since 1.0.0
 */
public final class Column extends ColumnElement {
	@NonNull
	private static final TraversalSpec<Column> TRAVERSAL_SPEC = TraversalSpec.forType(Column.class)
			.add("name", VisitationKind.PLAIN_VALUE, Column::getName)
			.add("type", VisitationKind.TYPE, Column::getType)
			.add("table", VisitationKind.NODE, Column::getTable)
			.build();

	@NonNull
	private final String name;
	@NonNull
	private final TypeDescriptor type;
	@NonNull
	private final Table table;
	@Nullable
	private final Column baseColumn;

	Column(@NonNull String name,
				 @NonNull TypeDescriptor type,
				 @NonNull Table table,
				 @Nullable Column baseColumn) {
		this.name = requireNonNull(name);
		this.type = requireNonNull(type);
		this.table = requireNonNull(table);
		this.baseColumn = baseColumn;
	}

	@Override
	@NonNull
	public Set<ColumnElement> getProxySet() {
		Set<ColumnElement> proxySet = super.getProxySet();

		if (this.baseColumn != null)
			proxySet.addAll(this.baseColumn.getProxySet());

		return proxySet;
	}

	@Override
	@NonNull
	public String getVisitName() {
		return "column";
	}

	@Override
	@NonNull
	public Optional<TraversalSpec<?>> getTraversalSpec() {
		return Optional.of(TRAVERSAL_SPEC);
	}

	@Override
	public String toString() {
		return format("%s{name=%s, table=%s}", getClass().getSimpleName(), getName(), getTable().getName());
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	@Override
	@NonNull
	public TypeDescriptor getType() {
		return this.type;
	}

	@NonNull
	public Table getTable() {
		return this.table;
	}

	@NonNull
	public Optional<Column> getBaseColumn() {
		return Optional.ofNullable(this.baseColumn);
	}
}
