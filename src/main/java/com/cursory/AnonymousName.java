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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A generated name (e.g. for an unnamed label or bind parameter) whose text is only fixed once it is rendered.
 * <p>
 * For caching purposes the name is replaced by an id from the current {@link AnonMap}, so two statements which differ
 * only in their generated names produce the same key.
 *
 * @since 1.0.0
 */
@Immutable
public final class AnonymousName {
	@NonNull
	private final String prefix;

	public AnonymousName(@NonNull String prefix) {
		this.prefix = requireNonNull(prefix);
	}

	/**
	 * Resolves this name against {@code anonMap}.
	 *
	 * @param anonMap the traversal's anon map
	 * @return the name's text for the traversal, e.g. {@code "anon_1"}
	 */
	@NonNull
	public String apply(@NonNull AnonMap anonMap) {
		requireNonNull(anonMap);
		return format("%s_%s", getPrefix(), anonMap.idFor(this));
	}

	@NonNull
	public String getPrefix() {
		return this.prefix;
	}

	@Override
	public String toString() {
		return format("%s{prefix=%s}", getClass().getSimpleName(), getPrefix());
	}
}
