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
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Terminal stand-in installed once a result no longer owns a driver cursor.
 *
 * @since 1.0.0
 */
@Immutable
abstract class NoCursorFetchStrategy extends FetchStrategy {
	@NonNull
	private final FetchState state;

	NoCursorFetchStrategy(@NonNull FetchState state) {
		requireNonNull(state);

		if (state == FetchState.OPEN)
			throw new IllegalArgumentException("A strategy without a cursor cannot be open");

		this.state = state;
	}

	/**
	 * What every read answers: an empty result, or an exception.
	 */
	abstract void checkReadable();

	@Override
	@NonNull
	FetchState getState() {
		return this.state;
	}

	@Override
	@NonNull
	Optional<Object[]> fetchOne(@NonNull CursorResult result) {
		requireNonNull(result);
		checkReadable();
		return Optional.empty();
	}

	@Override
	@NonNull
	List<Object[]> fetchMany(@NonNull CursorResult result,
													 @Nullable Integer size) {
		requireNonNull(result);
		checkReadable();
		return List.of();
	}

	@Override
	@NonNull
	List<Object[]> fetchAll(@NonNull CursorResult result) {
		requireNonNull(result);
		checkReadable();
		return List.of();
	}
}
