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
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Metadata for statements which do not return rows, such as {@code UPDATE} without {@code RETURNING}.
 *
 * @since 1.0.0
 */
@Immutable
final class NoRowsMetadata extends RowMetadata {
	private static final long serialVersionUID = 1L;

	@NonNull
	static final NoRowsMetadata INSTANCE = new NoRowsMetadata();

	@NonNull
	static final String DOES_NOT_RETURN_ROWS_MESSAGE = "This result object does not return rows. It has been closed automatically.";

	private NoRowsMetadata() {}

	@Override
	public boolean returnsRows() {
		return false;
	}

	@Override
	@NonNull
	public List<String> getKeys() {
		throw new ResourceClosedException(DOES_NOT_RETURN_ROWS_MESSAGE);
	}

	@Override
	public boolean hasKey(@Nullable Object key) {
		throw new ResourceClosedException(DOES_NOT_RETURN_ROWS_MESSAGE);
	}

	@Override
	public int indexForKey(@NonNull Object key) {
		requireNonNull(key);
		throw new ResourceClosedException(DOES_NOT_RETURN_ROWS_MESSAGE);
	}

	@Override
	@NonNull
	public RowMetadata reduce(@NonNull List<?> keys) {
		requireNonNull(keys);
		throw new ResourceClosedException(DOES_NOT_RETURN_ROWS_MESSAGE);
	}

	@Override
	@NonNull
	List<ValueDecoder> getDecoders() {
		return List.of();
	}

	@Override
	@Nullable
	List<Integer> getTranslatedIndexes() {
		return null;
	}

	private Object readResolve() {
		return INSTANCE;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName();
	}
}
