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
import java.io.Serializable;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * One row of a {@link CursorResult}: an immutable sequence of decoded values plus the {@link RowMetadata} shared by
 * every row of the same result.
 * <p>
 * Values are addressed by position ({@link #get(int)}, negative positions count from the end) or by any key the
 * metadata knows ({@link #get(Object)}): a column name, a declaring {@link ColumnElement}, or an integer position.
 * {@link #mapping()} offers the same values keyed by name only.
 * <p>
 * Equality, hash code and ordering are defined over the values alone; two rows from different results with equal
 * values are equal.
 *
 * @since 1.0.0
 */
@Immutable
public final class Row implements Iterable<Object>, Comparable<Row>, Serializable {
	private static final long serialVersionUID = 1L;

	@NonNull
	private final RowMetadata rowMetadata;
	@NonNull
	private final Object[] values;

	Row(@NonNull RowMetadata rowMetadata,
			@NonNull Object[] values) {
		requireNonNull(rowMetadata);
		requireNonNull(values);

		this.rowMetadata = rowMetadata;
		this.values = values;
	}

	/**
	 * Decodes {@code rawValues} with the decoders recorded in {@code rowMetadata}.
	 *
	 * @param rowMetadata the metadata of the result the row belongs to
	 * @param rawValues   the row as returned by the driver
	 * @return the decoded row
	 */
	@NonNull
	static Row fromRawValues(@NonNull RowMetadata rowMetadata,
													 @NonNull Object[] rawValues) {
		requireNonNull(rowMetadata);
		requireNonNull(rawValues);

		return new Row(rowMetadata, rowMetadata.processRow(rawValues));
	}

	/**
	 * The value at {@code index}; {@code -1} is the last column.
	 *
	 * @param index the column position
	 * @return the value, possibly {@code null}
	 * @throws IndexOutOfBoundsException if there is no such position
	 */
	@Nullable
	public Object get(int index) {
		int size = size();
		return this.values[Objects.checkIndex(index < 0 ? index + size : index, size)];
	}

	/**
	 * The value for {@code key}, which may be a column name, a declaring column object or an integer position.
	 *
	 * @param key the key
	 * @return the value, possibly {@code null}
	 * @throws NoSuchColumnException      if no column answers to {@code key}
	 * @throws AmbiguousColumnException   if more than one column answers to {@code key}
	 * @throws ResourceClosedException    if the statement does not return rows
	 */
	@Nullable
	public Object get(@NonNull Object key) {
		requireNonNull(key);
		return this.values[getRowMetadata().indexForKey(key)];
	}

	/**
	 * The value for {@code key}, cast to {@code type}.
	 *
	 * @param key  the key
	 * @param type the expected value type
	 * @param <T>  the expected value type
	 * @return the value, or empty if it is {@code null}
	 * @throws ClassCastException if the value is not a {@code type}
	 */
	@NonNull
	public <T> Optional<T> get(@NonNull Object key,
														 @NonNull Class<T> type) {
		requireNonNull(key);
		requireNonNull(type);

		return Optional.ofNullable(type.cast(get(key)));
	}

	/**
	 * Attribute-style access by column name.
	 *
	 * @param attributeName the column name
	 * @return the value, possibly {@code null}
	 * @throws NoSuchAttributeException if the name is unknown
	 * @throws AmbiguousColumnException if the name is ambiguous
	 */
	@Nullable
	public Object getAttribute(@NonNull String attributeName) {
		requireNonNull(attributeName);

		try {
			return get((Object) attributeName);
		} catch (AmbiguousColumnException e) {
			throw e;
		} catch (NoSuchColumnException e) {
			throw new NoSuchAttributeException(attributeName, e);
		}
	}

	/**
	 * The values from {@code fromIndex}, inclusive, to {@code toIndex}, exclusive.
	 *
	 * @param fromIndex start position
	 * @param toIndex   end position
	 * @return the values in that range
	 */
	@NonNull
	public List<Object> slice(int fromIndex,
														int toIndex) {
		return values().subList(fromIndex, toIndex);
	}

	@NonNull
	public RowMapping mapping() {
		return new RowMapping(this);
	}

	/**
	 * Column names, in column order.
	 *
	 * @return the column names
	 */
	@NonNull
	public List<String> fields() {
		return getRowMetadata().getKeys();
	}

	@NonNull
	public Map<String, Object> asMap() {
		return mapping().asMap();
	}

	@NonNull
	public List<Object> values() {
		return Collections.unmodifiableList(Arrays.asList(this.values));
	}

	public boolean contains(@Nullable Object value) {
		for (Object v : this.values)
			if (Objects.equals(v, value))
				return true;

		return false;
	}

	public int size() {
		return this.values.length;
	}

	@Override
	@NonNull
	public Iterator<Object> iterator() {
		return values().iterator();
	}

	/**
	 * Compares values pairwise, then by length. {@code null} sorts first.
	 *
	 * @throws ClassCastException if a pair of values cannot be compared
	 */
	@Override
	@SuppressWarnings("unchecked")
	public int compareTo(@NonNull Row row) {
		requireNonNull(row);

		int count = Math.min(size(), row.size());

		for (int i = 0; i < count; ++i) {
			Object left = this.values[i];
			Object right = row.values[i];

			if (left == right)
				continue;

			if (left == null)
				return -1;

			if (right == null)
				return 1;

			if (!(left instanceof Comparable))
				throw new ClassCastException(format("Row value of type %s at position %d is not comparable",
						left.getClass().getName(), i));

			int comparison = ((Comparable<Object>) left).compareTo(right);

			if (comparison != 0)
				return comparison;
		}

		return Integer.compare(size(), row.size());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Row row))
			return false;

		return Arrays.equals(this.values, row.values);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(this.values);
	}

	@Override
	public String toString() {
		return Arrays.stream(this.values)
				.map(value -> value instanceof CharSequence ? format("'%s'", value) : String.valueOf(value))
				.collect(joining(", ", "(", ")"));
	}

	@NonNull
	RowMetadata getRowMetadata() {
		return this.rowMetadata;
	}

	@NonNull
	Object[] getValues() {
		return this.values;
	}
}
