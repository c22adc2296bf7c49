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
import java.util.function.Function;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One named attribute of a {@link TraversalSpec}.
 *
 * @param <T> the node type the accessor reads from
 * @since 1.0.0
 */
@Immutable
public final class TraversalEntry<T extends Traversable> {
	@NonNull
	private final String attributeName;
	@NonNull
	private final VisitationKind visitationKind;
	@NonNull
	private final Function<T, ?> accessor;

	TraversalEntry(@NonNull String attributeName,
								 @NonNull VisitationKind visitationKind,
								 @NonNull Function<T, ?> accessor) {
		this.attributeName = requireNonNull(attributeName);
		this.visitationKind = requireNonNull(visitationKind);
		this.accessor = requireNonNull(accessor);
	}

	/**
	 * Reads this entry's attribute from {@code node}.
	 *
	 * @param node the node declaring this entry
	 * @return the attribute value, may be {@code null}
	 */
	@Nullable
	@SuppressWarnings("unchecked")
	public Object valueFrom(@NonNull Traversable node) {
		requireNonNull(node);
		return getAccessor().apply((T) node);
	}

	@Override
	public String toString() {
		return format("%s{attributeName=%s, visitationKind=%s}", getClass().getSimpleName(), getAttributeName(),
				getVisitationKind());
	}

	@NonNull
	public String getAttributeName() {
		return this.attributeName;
	}

	@NonNull
	public VisitationKind getVisitationKind() {
		return this.visitationKind;
	}

	@NonNull
	private Function<T, ?> getAccessor() {
		return this.accessor;
	}
}
