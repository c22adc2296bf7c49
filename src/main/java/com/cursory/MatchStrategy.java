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
 * How declared result columns were lined up with the driver's columns when {@link RowMetadata} was resolved.
 *
 * @since 1.0.0
 */
public enum MatchStrategy {
	/**
	 * Declared columns are ordered and their count matches the driver's, so the i-th declared column is the i-th raw
	 * column. Raw column names are not read.
	 */
	POSITIONAL,
	/**
	 * Literal SQL with ordered declared columns: matched by position, with names taken from the driver.
	 */
	TEXTUAL_POSITIONAL,
	/**
	 * Raw column names are matched against declared rendered names (and, with loose matching, their alternative keys).
	 */
	NAME,
	/**
	 * Nothing was declared; every raw column is keyed by its own name.
	 */
	NONE
}
