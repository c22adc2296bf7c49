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

import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@code CASE WHEN condition THEN result ... ELSE otherwise END}.
 *
 * @since 1.0.0
 */
public final class CaseExpression extends ColumnElement {
	@NonNull
	private static final TraversalSpec<CaseExpression> TRAVERSAL_SPEC = TraversalSpec.forType(CaseExpression.class)
			.add("whens", VisitationKind.NODE_TUPLES, CaseExpression::getWhens)
			.add("otherwise", VisitationKind.NODE, caseExpression -> caseExpression.getOtherwise().orElse(null))
			.add("type", VisitationKind.TYPE, CaseExpression::getType)
			.build();

	@NonNull
	private final List<List<ColumnElement>> whens;
	@Nullable
	private final ColumnElement otherwise;
	@NonNull
	private final TypeDescriptor type;

	private CaseExpression(@NonNull Builder builder) {
		requireNonNull(builder);

		if (builder.whens.isEmpty())
			throw new IllegalArgumentException("CASE requires at least one WHEN clause");

		this.whens = Collections.unmodifiableList(new ArrayList<>(builder.whens));
		this.otherwise = builder.otherwise;
		this.type = builder.whens.get(0).get(1).getType();
	}

	@NonNull
	public static Builder when(@NonNull ColumnElement condition,
														 @NonNull ColumnElement result) {
		return new Builder().when(condition, result);
	}

	/**
	 * The {@code [condition, result]} pairs, in order.
	 *
	 * @return the when clauses
	 */
	@NonNull
	public List<List<ColumnElement>> getWhens() {
		return this.whens;
	}

	@NonNull
	public Optional<ColumnElement> getOtherwise() {
		return Optional.ofNullable(this.otherwise);
	}

	@Override
	@NonNull
	public TypeDescriptor getType() {
		return this.type;
	}

	@Override
	@NonNull
	public String getVisitName() {
		return "case";
	}

	@Override
	@NonNull
	public Optional<TraversalSpec<?>> getTraversalSpec() {
		return Optional.of(TRAVERSAL_SPEC);
	}

	@Override
	public String toString() {
		return format("%s{whens=%s, otherwise=%s}", getClass().getSimpleName(), getWhens(), this.otherwise);
	}

	/**
	 * Builder used to construct instances of {@link CaseExpression}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final List<List<ColumnElement>> whens;
		@Nullable
		private ColumnElement otherwise;

		private Builder() {
			this.whens = new ArrayList<>();
		}

		@NonNull
		public Builder when(@NonNull ColumnElement condition,
												@NonNull ColumnElement result) {
			requireNonNull(condition);
			requireNonNull(result);
			this.whens.add(List.of(condition, result));
			return this;
		}

		@NonNull
		public Builder otherwise(@Nullable ColumnElement otherwise) {
			this.otherwise = otherwise;
			return this;
		}

		@NonNull
		public CaseExpression build() {
			return new CaseExpression(this);
		}
	}
}
