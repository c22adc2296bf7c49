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

import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A literal value sent to the database separately from the statement text.
 * <p>
 * The value never contributes to a {@link CacheKey}; instead the parameter is collected into
 * {@link CacheKey#getBindParameters()} so a cached statement can be re-executed with new values.
 *
 * @since 1.0.0
 */
public final class BindParameter extends ColumnElement {
	@NonNull
	private static final TraversalSpec<BindParameter> TRAVERSAL_SPEC = TraversalSpec.forType(BindParameter.class)
			.add("key", VisitationKind.ANON_NAME, BindParameter::getKeyForTraversal)
			.add("type", VisitationKind.TYPE, BindParameter::getType)
			.add("value", VisitationKind.BOUND_VALUE, bindParameter -> bindParameter.getValue().orElse(null))
			.build();

	@NonNull
	private final Object key;
	@Nullable
	private final Object value;
	@NonNull
	private final TypeDescriptor type;

	private BindParameter(@NonNull Object key,
												@Nullable Object value,
												@NonNull TypeDescriptor type) {
		this.key = requireNonNull(key);
		this.value = value;
		this.type = requireNonNull(type);
	}

	@NonNull
	public static BindParameter of(@Nullable Object value,
																 @NonNull TypeDescriptor type) {
		return new BindParameter(new AnonymousName("param"), value, type);
	}

	@NonNull
	public static BindParameter named(@NonNull String key,
																		@Nullable Object value,
																		@NonNull TypeDescriptor type) {
		return new BindParameter(requireNonNull(key), value, type);
	}

	@NonNull
	public Optional<Object> getValue() {
		return Optional.ofNullable(this.value);
	}

	@NonNull
	Object getKeyForTraversal() {
		return this.key;
	}

	@Override
	@NonNull
	public TypeDescriptor getType() {
		return this.type;
	}

	@Override
	@NonNull
	public String getVisitName() {
		return "bindparam";
	}

	@Override
	@NonNull
	public Optional<TraversalSpec<?>> getTraversalSpec() {
		return Optional.of(TRAVERSAL_SPEC);
	}

	@Override
	public String toString() {
		return format("%s{key=%s, value=%s}", getClass().getSimpleName(), this.key, this.value);
	}
}
