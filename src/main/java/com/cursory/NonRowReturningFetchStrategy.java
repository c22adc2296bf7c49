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
 * For statements that never return rows. Every read fails, whether or not the result has been closed.
 *
 * @since 1.0.0
 */
@Immutable
final class NonRowReturningFetchStrategy extends NoCursorFetchStrategy {
	@NonNull
	static final NonRowReturningFetchStrategy SOFT_CLOSED = new NonRowReturningFetchStrategy(FetchState.SOFT_CLOSED);
	@NonNull
	static final NonRowReturningFetchStrategy HARD_CLOSED = new NonRowReturningFetchStrategy(FetchState.HARD_CLOSED);

	private NonRowReturningFetchStrategy(@NonNull FetchState state) {
		super(state);
	}

	@Override
	void checkReadable() {
		throw new ResourceClosedException(NoRowsMetadata.DOES_NOT_RETURN_ROWS_MESSAGE);
	}
}
