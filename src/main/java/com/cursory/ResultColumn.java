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
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A result column as declared by a compiled statement.
 * <p>
 * {@code name} is the primary lookup key, {@code renderedName} is the name as it appears in the SQL text, and
 * {@code objects} are alternative keys (column objects, labels, alternate names) through which the column can also be
 * read.
 *
 * @since 1.0.0
 */
@Immutable
public final class ResultColumn {
	@NonNull
	private final String name;
	@NonNull
	private final String renderedName;
	@NonNull
	private final List<Object> objects;
	@NonNull
	private final TypeDescriptor type;

	public ResultColumn(@NonNull String name,
											@NonNull String renderedName,
											@NonNull List<?> objects,
											@NonNull TypeDescriptor type) {
		requireNonNull(name);
		requireNonNull(renderedName);
		requireNonNull(objects);
		requireNonNull(type);

		this.name = name;
		this.renderedName = renderedName;
		this.objects = List.copyOf(objects);
		this.type = type;
	}

	/**
	 * Shorthand for a column whose rendered name is the same as its name.
	 *
	 * @param name    the column name
	 * @param type    the column type
	 * @param objects alternative keys for the column
	 * @return a result column
	 */
	@NonNull
	public static ResultColumn of(@NonNull String name,
																@NonNull TypeDescriptor type,
																@NonNull Object... objects) {
		requireNonNull(objects);
		return new ResultColumn(name, name, Arrays.asList(objects), type);
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	@NonNull
	public String getRenderedName() {
		return this.renderedName;
	}

	@NonNull
	public List<Object> getObjects() {
		return this.objects;
	}

	@NonNull
	public TypeDescriptor getType() {
		return this.type;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ResultColumn resultColumn))
			return false;

		return Objects.equals(getName(), resultColumn.getName())
				&& Objects.equals(getRenderedName(), resultColumn.getRenderedName())
				&& Objects.equals(getObjects(), resultColumn.getObjects())
				&& Objects.equals(getType(), resultColumn.getType());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), getRenderedName(), getObjects(), getType());
	}

	@Override
	public String toString() {
		return format("%s{name=%s, renderedName=%s, objects=%s, type=%s}", getClass().getSimpleName(), getName(),
				getRenderedName(), getObjects(), getType());
	}
}
