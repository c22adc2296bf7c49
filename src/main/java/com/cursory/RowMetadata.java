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

import java.io.Serializable;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Describes the columns of a result: their keys, the position each key resolves to and how values are decoded.
 * <p>
 * Instances are immutable once built and may be shared by any number of {@link Row}s and caches.
 *
 * @since 1.0.0
 */
public abstract class RowMetadata implements Serializable {
	private static final long serialVersionUID = 1L;

	RowMetadata() {
		// Implementations live in this package
	}

	/**
	 * Does the statement this metadata describes return rows at all?
	 *
	 * @return {@code true} if there are result columns
	 */
	public abstract boolean returnsRows();

	/**
	 * The result's column names in column order.
	 *
	 * @return the column names
	 * @throws ResourceClosedException if the statement does not return rows
	 */
	@NonNull
	public abstract List<String> getKeys();

	/**
	 * Is {@code key} a known key? Ambiguous keys are known.
	 *
	 * @param key a column name, integer index or declaring object
	 * @return {@code true} if the key is in the keymap
	 */
	public abstract boolean hasKey(@Nullable Object key);

	/**
	 * The position {@code key} resolves to.
	 *
	 * @param key a column name, integer index (negative counts from the end) or declaring object
	 * @return the zero-based column index
	 * @throws NoSuchColumnException      if the key is unknown
	 * @throws AmbiguousColumnException   if the key matches more than one column
	 * @throws ResourceClosedException    if the statement does not return rows
	 */
	public abstract int indexForKey(@NonNull Object key);

	/**
	 * Metadata for a subset of this metadata's columns, in the order given.
	 *
	 * @param keys the keys of the columns to keep
	 * @return the reduced metadata
	 */
	@NonNull
	public abstract RowMetadata reduce(@NonNull List<?> keys);

	/**
	 * One decoder per column, in column order.
	 *
	 * @return the decoders
	 */
	@NonNull
	abstract List<ValueDecoder> getDecoders();

	/**
	 * For reduced metadata, the position within the original row of each retained column.
	 *
	 * @return the original indexes, or {@code null} if this metadata was not reduced
	 */
	@Nullable
	abstract List<Integer> getTranslatedIndexes();

	/**
	 * Decodes a raw driver row into the values of a {@link Row} described by this metadata. Each retained value is
	 * decoded exactly once; columns dropped by {@link #reduce(List)} are not decoded at all.
	 *
	 * @param rawValues the row as returned by the driver
	 * @return the decoded values, in this metadata's column order
	 */
	@NonNull
	Object[] processRow(@NonNull Object[] rawValues) {
		requireNonNull(rawValues);

		List<ValueDecoder> decoders = getDecoders();
		List<Integer> translatedIndexes = getTranslatedIndexes();
		int size = translatedIndexes == null ? rawValues.length : translatedIndexes.size();
		Object[] values = new Object[size];

		for (int i = 0; i < size; ++i) {
			int rawIndex = translatedIndexes == null ? i : translatedIndexes.get(i);
			Object rawValue = rawValues[rawIndex];
			ValueDecoder decoder = rawIndex < decoders.size() ? decoders.get(rawIndex) : ValueDecoder.passThrough();
			values[i] = decoder.isPassThrough() ? rawValue : decoder.decode(rawValue);
		}

		return values;
	}
}
