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
 * {@code left operator right}.
 *
 * @since 1.0.0
 */
public final class BinaryExpression extends ColumnElement {
	@NonNull
	private static final TraversalSpec<BinaryExpression> TRAVERSAL_SPEC = TraversalSpec.forType(BinaryExpression.class)
			.add("left", VisitationKind.NODE, BinaryExpression::getLeft)
			.add("right", VisitationKind.NODE, BinaryExpression::getRight)
			.add("operator", VisitationKind.PLAIN_VALUE, BinaryExpression::getOperator)
			.add("negate", VisitationKind.PLAIN_VALUE, binaryExpression -> binaryExpression.getNegate().orElse(null))
			.add("type", VisitationKind.TYPE, BinaryExpression::getType)
			.build();

	@NonNull
	private final ColumnElement left;
	@NonNull
	private final ColumnElement right;
	@NonNull
	private final Operator operator;
	@Nullable
	private final Operator negate;

	BinaryExpression(@NonNull ColumnElement left,
									 @NonNull ColumnElement right,
									 @NonNull Operator operator,
									 @Nullable Operator negate) {
		this.left = requireNonNull(left);
		this.right = requireNonNull(right);
		this.operator = requireNonNull(operator);
		this.negate = negate;
	}

	@NonNull
	public ColumnElement getLeft() {
		return this.left;
	}

	@NonNull
	public ColumnElement getRight() {
		return this.right;
	}

	@NonNull
	public Operator getOperator() {
		return this.operator;
	}

	/**
	 * The operator to use when this expression is negated, e.g. {@code <>} for {@code =}.
	 *
	 * @return the negation operator, if any
	 */
	@NonNull
	public Optional<Operator> getNegate() {
		return Optional.ofNullable(this.negate);
	}

	@Override
	@NonNull
	public TypeDescriptor getType() {
		return getOperator().isComparison() ? SqlType.BOOLEAN : getLeft().getType();
	}

	@Override
	@NonNull
	public String getVisitName() {
		return "binary";
	}

	@Override
	@NonNull
	public Optional<TraversalSpec<?>> getTraversalSpec() {
		return Optional.of(TRAVERSAL_SPEC);
	}

	@Override
	public String toString() {
		return format("%s{left=%s, operator=%s, right=%s}", getClass().getSimpleName(), getLeft(), getOperator(), getRight());
	}
}
