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

import javax.annotation.concurrent.Immutable;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The structural identity of a construct tree, suitable as a key in a compiled-statement or metadata cache.
 * <p>
 * Equality and hashing consider only the structural key. The bind parameters extracted during generation are carried
 * alongside so that a cached statement can be executed with this tree's literal values.
 *
 * @since 1.0.0
 */
@Immutable
public final class CacheKey {
	@NonNull
	private final List<Object> key;
	@NonNull
	private final List<BindParameter> bindParameters;

	CacheKey(@NonNull List<Object> key,
					 @NonNull List<BindParameter> bindParameters) {
		requireNonNull(key);
		requireNonNull(bindParameters);

		this.key = key;
		this.bindParameters = List.copyOf(bindParameters);
	}

	/**
	 * The nested structural key. Elements are strings, numbers, enum constants, classes and nested lists.
	 *
	 * @return the structural key
	 */
	@NonNull
	public List<Object> getKey() {
		return this.key;
	}

	/**
	 * Bind parameters encountered during generation, in traversal order.
	 *
	 * @return the extracted bind parameters
	 */
	@NonNull
	public List<BindParameter> getBindParameters() {
		return this.bindParameters;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof CacheKey))
			return false;

		return getKey().equals(((CacheKey) object).getKey());
	}

	@Override
	public int hashCode() {
		return getKey().hashCode();
	}

	@Override
	public String toString() {
		return format("%s{key=%s, bindParameters=%s}", getClass().getSimpleName(), getKey(), getBindParameters());
	}
}
