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
import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A view of a {@link Row} keyed by column name or declaring column object.
 * <p>
 * Integer keys are rejected so positional access cannot be confused with a lookup by key; use {@link Row#get(int)}.
 *
 * @since 1.0.0
 */
@Immutable
public final class RowMapping {
	@NonNull
	private final Row row;

	RowMapping(@NonNull Row row) {
		this.row = requireNonNull(row);
	}

	/**
	 * The value for {@code key}.
	 *
	 * @param key a column name or declaring column object
	 * @return the value, possibly {@code null}
	 * @throws InvalidRequestException  if {@code key} is an {@link Integer}
	 * @throws NoSuchColumnException    if no column answers to {@code key}
	 * @throws AmbiguousColumnException if more than one column answers to {@code key}
	 */
	@Nullable
	public Object get(@NonNull Object key) {
		requireNonNull(key);

		if (key instanceof Integer)
			throw new InvalidRequestException(format("Integer key %s is not supported by %s, use %s for positional access",
					key, getClass().getSimpleName(), Row.class.getSimpleName()));

		return getRow().get(key);
	}

	public boolean containsKey(@Nullable Object key) {
		if (key == null || key instanceof Integer)
			return false;

		return getRow().getRowMetadata().hasKey(key);
	}

	@NonNull
	public List<String> keys() {
		return getRow().fields();
	}

	@NonNull
	public List<Object> values() {
		return getRow().values();
	}

	@NonNull
	public List<Map.Entry<String, Object>> items() {
		List<String> keys = keys();
		List<Object> values = values();
		List<Map.Entry<String, Object>> items = new ArrayList<>(keys.size());

		for (int i = 0; i < keys.size(); ++i)
			items.add(new SimpleImmutableEntry<>(keys.get(i), values.get(i)));

		return Collections.unmodifiableList(items);
	}

	/**
	 * Copies this mapping into an ordered map. Where two columns share a name, the later column wins.
	 *
	 * @return the keys and values, in column order
	 */
	@NonNull
	public Map<String, Object> asMap() {
		List<String> keys = keys();
		List<Object> values = values();
		Map<String, Object> map = new LinkedHashMap<>(keys.size());

		for (int i = 0; i < keys.size(); ++i)
			map.put(keys.get(i), values.get(i));

		return Collections.unmodifiableMap(map);
	}

	public int size() {
		return getRow().size();
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof RowMapping rowMapping))
			return false;

		return keys().equals(rowMapping.keys()) && getRow().equals(rowMapping.getRow());
	}

	@Override
	public int hashCode() {
		return getRow().hashCode();
	}

	@Override
	public String toString() {
		return asMap().toString();
	}

	@NonNull
	Row getRow() {
		return this.row;
	}
}
