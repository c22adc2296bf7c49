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
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A {@code SELECT} statement.
 *
 * @since 1.0.0
 */
public final class Select implements Selectable {
	@NonNull
	private static final TraversalSpec<Select> TRAVERSAL_SPEC = TraversalSpec.forType(Select.class)
			.add("columns", VisitationKind.NODE_LIST, Select::getExportedColumns)
			.add("froms", VisitationKind.NODE_LIST, Select::getFroms)
			.add("where", VisitationKind.NODE, select -> select.getWhere().orElse(null))
			.add("groupBy", VisitationKind.NODE_LIST, Select::getGroupBy)
			.add("orderBy", VisitationKind.NODE_LIST, Select::getOrderBy)
			.add("limit", VisitationKind.PLAIN_VALUE, select -> select.getLimit().orElse(null))
			.add("correlate", VisitationKind.UNORDERED_NODE_SET, Select::getCorrelate)
			.add("hints", VisitationKind.PLAIN_MAP, Select::getHints)
			.build();

	@NonNull
	private final List<ColumnElement> columns;
	@NonNull
	private final List<Table> froms;
	@Nullable
	private final Traversable where;
	@NonNull
	private final List<ColumnElement> groupBy;
	@NonNull
	private final List<ColumnElement> orderBy;
	@Nullable
	private final Integer limit;
	@NonNull
	private final Set<Table> correlate;
	@NonNull
	private final Map<String, String> hints;

	private Select(@NonNull Builder builder) {
		requireNonNull(builder);

		this.columns = List.copyOf(builder.columns);
		this.where = builder.where;
		this.groupBy = List.copyOf(builder.groupBy);
		this.orderBy = List.copyOf(builder.orderBy);
		this.limit = builder.limit;
		this.hints = Collections.unmodifiableMap(new LinkedHashMap<>(builder.hints));

		Set<Table> correlate = Collections.newSetFromMap(new IdentityHashMap<>());
		correlate.addAll(builder.correlate);
		this.correlate = Collections.unmodifiableSet(correlate);

		List<Table> froms = new ArrayList<>(builder.froms);

		// FROM entries implied by the select list come after explicit ones
		for (ColumnElement column : this.columns) {
			Table table = column instanceof Column ? ((Column) column).getTable() : null;

			if (table != null && !containsIdentical(froms, table) && !this.correlate.contains(table))
				froms.add(table);
		}

		this.froms = Collections.unmodifiableList(froms);
	}

	@NonNull
	public static Builder columns(@NonNull ColumnElement... columns) {
		requireNonNull(columns);
		return new Builder(Arrays.asList(columns));
	}

	private static boolean containsIdentical(@NonNull List<Table> tables,
																					 @NonNull Table table) {
		for (Table candidate : tables)
			if (candidate == table)
				return true;

		return false;
	}

	@Override
	@NonNull
	public List<ColumnElement> getExportedColumns() {
		return this.columns;
	}

	@NonNull
	public List<Table> getFroms() {
		return this.froms;
	}

	@NonNull
	public Optional<Traversable> getWhere() {
		return Optional.ofNullable(this.where);
	}

	@NonNull
	public List<ColumnElement> getGroupBy() {
		return this.groupBy;
	}

	@NonNull
	public List<ColumnElement> getOrderBy() {
		return this.orderBy;
	}

	@NonNull
	public Optional<Integer> getLimit() {
		return Optional.ofNullable(this.limit);
	}

	@NonNull
	public Set<Table> getCorrelate() {
		return this.correlate;
	}

	/**
	 * Dialect-specific optimizer hints, keyed by dialect name.
	 *
	 * @return the hints
	 */
	@NonNull
	public Map<String, String> getHints() {
		return this.hints;
	}

	@Override
	@NonNull
	public String getVisitName() {
		return "select";
	}

	@Override
	@NonNull
	public Optional<TraversalSpec<?>> getTraversalSpec() {
		return Optional.of(TRAVERSAL_SPEC);
	}

	@Override
	public String toString() {
		return format("%s{columns=%s, froms=%s}", getClass().getSimpleName(), getExportedColumns(), getFroms());
	}

	/**
	 * Builder used to construct instances of {@link Select}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final List<ColumnElement> columns;
		@NonNull
		private final List<Table> froms;
		@NonNull
		private final List<ColumnElement> groupBy;
		@NonNull
		private final List<ColumnElement> orderBy;
		@NonNull
		private final List<Table> correlate;
		@NonNull
		private final Map<String, String> hints;
		@Nullable
		private Traversable where;
		@Nullable
		private Integer limit;

		private Builder(@NonNull List<ColumnElement> columns) {
			requireNonNull(columns);
			this.columns = new ArrayList<>(columns);
			this.froms = new ArrayList<>();
			this.groupBy = new ArrayList<>();
			this.orderBy = new ArrayList<>();
			this.correlate = new ArrayList<>();
			this.hints = new LinkedHashMap<>();
		}

		@NonNull
		public Builder from(@NonNull Table... tables) {
			requireNonNull(tables);
			this.froms.addAll(Arrays.asList(tables));
			return this;
		}

		@NonNull
		public Builder where(@Nullable Traversable where) {
			this.where = where;
			return this;
		}

		@NonNull
		public Builder groupBy(@NonNull ColumnElement... groupBy) {
			requireNonNull(groupBy);
			this.groupBy.addAll(Arrays.asList(groupBy));
			return this;
		}

		@NonNull
		public Builder orderBy(@NonNull ColumnElement... orderBy) {
			requireNonNull(orderBy);
			this.orderBy.addAll(Arrays.asList(orderBy));
			return this;
		}

		@NonNull
		public Builder limit(@Nullable Integer limit) {
			this.limit = limit;
			return this;
		}

		@NonNull
		public Builder correlate(@NonNull Table... tables) {
			requireNonNull(tables);
			this.correlate.addAll(Arrays.asList(tables));
			return this;
		}

		@NonNull
		public Builder hint(@NonNull String dialectName,
												@NonNull String hint) {
			requireNonNull(dialectName);
			requireNonNull(hint);
			this.hints.put(dialectName, hint);
			return this;
		}

		@NonNull
		public Select build() {
			return new Select(this);
		}
	}
}
