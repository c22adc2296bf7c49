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

/**
 * Lifecycle of a {@link CursorResult}, as reported by its current {@link FetchStrategy}.
 * <p>
 * {@code OPEN} moves to {@code SOFT_CLOSED} as soon as a fetch exhausts the cursor, or immediately for statements that
 * do not return rows. Any state moves to {@code HARD_CLOSED} on {@link CursorResult#close()}, which is terminal.
 *
 * @since 1.0.0
 */
public enum FetchState {
	/**
	 * The driver cursor is live.
	 */
	OPEN,
	/**
	 * The driver cursor has been released. Reads return no rows; the row count and last row ID remain available.
	 */
	SOFT_CLOSED,
	/**
	 * The result was explicitly closed. Reads fail with {@link ResourceClosedException}.
	 */
	HARD_CLOSED
}
