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
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Options for {@link StructuralComparator#compare(Traversable, Traversable, ComparisonOptions)}.
 *
 * @since 1.0.0
 */
@Immutable
public final class ComparisonOptions {
	@NonNull
	private static final ComparisonOptions DEFAULTS = builder().build();

	private final boolean compareValues;
	private final boolean useLineage;
	@NonNull
	private final Map<ColumnElement, Set<ColumnElement>> equivalents;

	private ComparisonOptions(@NonNull Builder builder) {
		requireNonNull(builder);

		this.compareValues = builder.compareValues;
		this.useLineage = builder.useLineage;

		Map<ColumnElement, Set<ColumnElement>> equivalents = new IdentityHashMap<>();

		for (Map.Entry<ColumnElement, Set<ColumnElement>> entry : builder.equivalents.entrySet()) {
			Set<ColumnElement> columnElements = Collections.newSetFromMap(new IdentityHashMap<>());
			columnElements.addAll(entry.getValue());
			equivalents.put(entry.getKey(), Collections.unmodifiableSet(columnElements));
		}

		this.equivalents = Collections.unmodifiableMap(equivalents);
	}

	/**
	 * Structural comparison which also compares bind parameter values, without lineage.
	 *
	 * @return the default options
	 */
	@NonNull
	public static ComparisonOptions defaults() {
		return DEFAULTS;
	}

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Should bind parameter values take part in the comparison? Defaults to {@code true}.
	 *
	 * @return {@code true} if values are compared
	 */
	public boolean isCompareValues() {
		return this.compareValues;
	}

	/**
	 * Should columns and labels compare equal when they derive from a common column, and tables only by identity?
	 * Defaults to {@code false}.
	 *
	 * @return {@code true} if lineage comparison is enabled
	 */
	public boolean isUseLineage() {
		return this.useLineage;
	}

	/**
	 * Additional columns considered equivalent to a given column in lineage mode.
	 *
	 * @return equivalent columns, keyed by identity
	 */
	@NonNull
	public Map<ColumnElement, Set<ColumnElement>> getEquivalents() {
		return this.equivalents;
	}

	@Override
	public String toString() {
		return format("%s{compareValues=%s, useLineage=%s, equivalents=%s}", getClass().getSimpleName(),
				isCompareValues(), isUseLineage(), getEquivalents());
	}

	/**
	 * Builder used to construct instances of {@link ComparisonOptions}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		private boolean compareValues;
		private boolean useLineage;
		@NonNull
		private final Map<ColumnElement, Set<ColumnElement>> equivalents;

		private Builder() {
			this.compareValues = true;
			this.equivalents = new IdentityHashMap<>();
		}

		@NonNull
		public Builder compareValues(@Nullable Boolean compareValues) {
			this.compareValues = compareValues == null ? true : compareValues;
			return this;
		}

		@NonNull
		public Builder useLineage(@Nullable Boolean useLineage) {
			this.useLineage = useLineage == null ? false : useLineage;
			return this;
		}

		@NonNull
		public Builder equivalent(@NonNull ColumnElement columnElement,
															@NonNull Set<? extends ColumnElement> equivalentColumnElements) {
			requireNonNull(columnElement);
			requireNonNull(equivalentColumnElements);
			this.equivalents.put(columnElement, Set.copyOf(equivalentColumnElements));
			return this;
		}

		@NonNull
		public ComparisonOptions build() {
			return new ComparisonOptions(this);
		}
	}
}
