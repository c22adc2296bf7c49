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

import java.util.List;

/**
 * A statement which exports result columns.
 *
 * @since 1.0.0
 */
public interface Selectable extends Traversable {
	/**
	 * The column expressions this statement exports, in select-list order.
	 *
	 * @return the exported columns
	 */
	@NonNull
	List<ColumnElement> getExportedColumns();
}
