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
import java.sql.SQLException;

import static java.util.Objects.requireNonNull;

/**
 * Base class for strategies that own a live {@link DriverCursor}.
 *
 * @since 1.0.0
 */
@NotThreadSafe
abstract class CursorFetchStrategy extends FetchStrategy {
	@NonNull
	private final DriverCursor driverCursor;

	CursorFetchStrategy(@NonNull DriverCursor driverCursor) {
		this.driverCursor = requireNonNull(driverCursor);
	}

	@Override
	@NonNull
	FetchState getState() {
		return FetchState.OPEN;
	}

	@Override
	void releaseCursor() throws SQLException {
		getDriverCursor().close();
	}

	@NonNull
	DriverCursor getDriverCursor() {
		return this.driverCursor;
	}
}
