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

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * What the SQL compiler knows about a statement's result columns.
 *
 * @since 1.0.0
 */
@Immutable
public final class CompiledStatement {
	@NonNull
	private final Traversable statement;
	@NonNull
	private final List<ResultColumn> resultColumns;
	private final boolean columnsOrdered;
	private final boolean textualOrdered;
	private final boolean looseColumnNameMatching;
	@Nullable
	private final CacheKey cacheKey;

	private CompiledStatement(@NonNull Builder builder) {
		requireNonNull(builder);

		this.statement = builder.statement;
		this.resultColumns = List.copyOf(builder.resultColumns);
		this.columnsOrdered = builder.columnsOrdered == null ? true : builder.columnsOrdered;
		this.textualOrdered = builder.textualOrdered == null ? false : builder.textualOrdered;
		this.looseColumnNameMatching = builder.looseColumnNameMatching == null ? false : builder.looseColumnNameMatching;
		this.cacheKey = builder.cacheKey;
	}

	@NonNull
	public static Builder withStatement(@NonNull Traversable statement) {
		requireNonNull(statement);
		return new Builder(statement);
	}

	/**
	 * Derives result columns from a statement's exported columns, the way a compiler would when rendering its select
	 * list.
	 * <p>
	 * Each column's name is its column or label name; anonymous labels and unnamed expressions get generated names.
	 * The exported column object is the column's alternative key. A {@link TextualSelect} is matched positionally if it
	 * says so, otherwise by name with loose matching.
	 *
	 * @param statement         the statement to describe
	 * @param cacheKeyGenerator generates the statement's cache key
	 * @return the compiled statement
	 */
	@NonNull
	public static CompiledStatement forSelectable(@NonNull Selectable statement,
																								@NonNull CacheKeyGenerator cacheKeyGenerator) {
		requireNonNull(statement);
		requireNonNull(cacheKeyGenerator);

		AnonMap anonMap = new AnonMap();
		List<ResultColumn> resultColumns = new ArrayList<>(statement.getExportedColumns().size());
		int position = 0;

		for (ColumnElement columnElement : statement.getExportedColumns()) {
			++position;

			String name;

			if (columnElement instanceof Column column)
				name = column.getName();
			else if (columnElement instanceof Label label)
				name = label.getName().orElseGet(() -> ((AnonymousName) label.getNameForTraversal()).apply(anonMap));
			else
				name = format("col_%d", position);

			resultColumns.add(new ResultColumn(name, name, List.of(columnElement), columnElement.getType()));
		}

		boolean textual = statement instanceof TextualSelect;
		boolean positional = textual && ((TextualSelect) statement).isPositional();

		return withStatement(statement)
				.resultColumns(resultColumns)
				.columnsOrdered(!textual || positional)
				.textualOrdered(positional)
				.looseColumnNameMatching(textual && !positional)
				.cacheKey(cacheKeyGenerator.generate(statement).orElse(null))
				.build();
	}

	@NonNull
	public Traversable getStatement() {
		return this.statement;
	}

	@NonNull
	public List<ResultColumn> getResultColumns() {
		return this.resultColumns;
	}

	/**
	 * Are {@link #getResultColumns()} in the same order as the columns the driver will report?
	 *
	 * @return {@code true} if the declared columns are ordered
	 */
	public boolean isColumnsOrdered() {
		return this.columnsOrdered;
	}

	/**
	 * Is this literal SQL whose declared columns must be matched positionally, without trusting the driver's names?
	 *
	 * @return {@code true} for textual positional statements
	 */
	public boolean isTextualOrdered() {
		return this.textualOrdered;
	}

	public boolean isLooseColumnNameMatching() {
		return this.looseColumnNameMatching;
	}

	@NonNull
	public Optional<CacheKey> getCacheKey() {
		return Optional.ofNullable(this.cacheKey);
	}

	@Override
	public String toString() {
		return format("%s{statement=%s, resultColumns=%s, columnsOrdered=%s, textualOrdered=%s, looseColumnNameMatching=%s}",
				getClass().getSimpleName(), getStatement(), getResultColumns(), isColumnsOrdered(), isTextualOrdered(),
				isLooseColumnNameMatching());
	}

	/**
	 * Builder used to construct instances of {@link CompiledStatement}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final Traversable statement;
		@NonNull
		private List<ResultColumn> resultColumns;
		@Nullable
		private Boolean columnsOrdered;
		@Nullable
		private Boolean textualOrdered;
		@Nullable
		private Boolean looseColumnNameMatching;
		@Nullable
		private CacheKey cacheKey;

		private Builder(@NonNull Traversable statement) {
			this.statement = requireNonNull(statement);
			this.resultColumns = List.of();
		}

		@NonNull
		public Builder resultColumns(@NonNull List<ResultColumn> resultColumns) {
			this.resultColumns = requireNonNull(resultColumns);
			return this;
		}

		@NonNull
		public Builder columnsOrdered(@Nullable Boolean columnsOrdered) {
			this.columnsOrdered = columnsOrdered;
			return this;
		}

		@NonNull
		public Builder textualOrdered(@Nullable Boolean textualOrdered) {
			this.textualOrdered = textualOrdered;
			return this;
		}

		@NonNull
		public Builder looseColumnNameMatching(@Nullable Boolean looseColumnNameMatching) {
			this.looseColumnNameMatching = looseColumnNameMatching;
			return this;
		}

		@NonNull
		public Builder cacheKey(@Nullable CacheKey cacheKey) {
			this.cacheKey = cacheKey;
			return this;
		}

		@NonNull
		public CompiledStatement build() {
			return new CompiledStatement(this);
		}
	}
}
