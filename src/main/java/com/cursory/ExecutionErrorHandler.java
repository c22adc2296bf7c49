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

import javax.annotation.concurrent.ThreadSafe;

/**
 * Converts failures raised while fetching from a driver cursor into the exception thrown to the caller.
 * <p>
 * Every fetch strategy routes driver failures through the result's handler. Implementations should be threadsafe.
 *
 * @since 1.0.0
 */
@ThreadSafe
@FunctionalInterface
public interface ExecutionErrorHandler {
	/**
	 * Maps {@code exception} to the exception to throw.
	 *
	 * @param exception the failure, usually a {@link java.sql.SQLException}
	 * @param result    the result being read
	 * @return the exception to throw
	 */
	@NonNull
	RuntimeException handle(@NonNull Exception exception,
													@NonNull CursorResult result);

	/**
	 * Rethrows {@link RuntimeException}s unchanged and wraps anything else in a {@link DatabaseException}.
	 *
	 * @return the default handler
	 */
	@NonNull
	static ExecutionErrorHandler wrappingInDatabaseException() {
		return (exception, result) -> exception instanceof RuntimeException runtimeException
				? runtimeException : new DatabaseException(exception);
	}
}
