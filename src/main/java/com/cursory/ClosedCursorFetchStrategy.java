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

/**
 * For statements that returned rows but whose cursor has been released. Reads return nothing after a soft close and
 * fail after a hard close.
 *
 * @since 1.0.0
 */
@Immutable
final class ClosedCursorFetchStrategy extends NoCursorFetchStrategy {
	@NonNull
	static final ClosedCursorFetchStrategy SOFT_CLOSED = new ClosedCursorFetchStrategy(FetchState.SOFT_CLOSED);
	@NonNull
	static final ClosedCursorFetchStrategy HARD_CLOSED = new ClosedCursorFetchStrategy(FetchState.HARD_CLOSED);

	@NonNull
	static final String CLOSED_MESSAGE = "This result object is closed.";

	private ClosedCursorFetchStrategy(@NonNull FetchState state) {
		super(state);
	}

	@Override
	void checkReadable() {
		if (getState() == FetchState.HARD_CLOSED)
			throw new ResourceClosedException(CLOSED_MESSAGE);
	}
}
