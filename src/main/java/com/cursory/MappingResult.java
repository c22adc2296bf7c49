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

import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A {@link CursorResult} that produces {@link RowMapping}s. Reads consume rows of the underlying result.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public final class MappingResult implements Iterable<RowMapping>, AutoCloseable {
	@NonNull
	private final CursorResult cursorResult;

	MappingResult(@NonNull CursorResult cursorResult) {
		this.cursorResult = requireNonNull(cursorResult);
	}

	@NonNull
	public Optional<RowMapping> fetchOne() {
		return getCursorResult().fetchOne().map(Row::mapping);
	}

	@NonNull
	public List<RowMapping> fetchMany(int size) {
		return toMappings(getCursorResult().fetchMany(size));
	}

	@NonNull
	public List<RowMapping> fetchAll() {
		return toMappings(getCursorResult().fetchAll());
	}

	@NonNull
	public Optional<RowMapping> first() {
		return getCursorResult().first().map(Row::mapping);
	}

	@NonNull
	public RowMapping one() {
		return getCursorResult().one().mapping();
	}

	@NonNull
	public Optional<RowMapping> oneOrNull() {
		return getCursorResult().oneOrNull().map(Row::mapping);
	}

	@NonNull
	public List<String> keys() {
		return getCursorResult().keys();
	}

	@Override
	@NonNull
	public Iterator<RowMapping> iterator() {
		Iterator<Row> rows = getCursorResult().iterator();

		return new Iterator<>() {
			@Override
			public boolean hasNext() {
				return rows.hasNext();
			}

			@Override
			public RowMapping next() {
				return rows.next().mapping();
			}
		};
	}

	@NonNull
	public Stream<RowMapping> stream() {
		return getCursorResult().stream().map(Row::mapping);
	}

	@Override
	public void close() {
		getCursorResult().close();
	}

	@Override
	public String toString() {
		return format("%s{cursorResult=%s}", getClass().getSimpleName(), getCursorResult());
	}

	@NonNull
	private static List<RowMapping> toMappings(@NonNull List<Row> rows) {
		List<RowMapping> mappings = new ArrayList<>(rows.size());

		for (Row row : rows)
			mappings.add(row.mapping());

		return mappings;
	}

	@NonNull
	CursorResult getCursorResult() {
		return this.cursorResult;
	}
}
