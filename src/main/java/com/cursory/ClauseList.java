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

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A flat list of clauses joined by one operator, e.g. {@code a AND b AND c}.
 *
 * @since 1.0.0
 */
public final class ClauseList implements Traversable {
	@NonNull
	private static final TraversalSpec<ClauseList> TRAVERSAL_SPEC = TraversalSpec.forType(ClauseList.class)
			.add("clauses", VisitationKind.NODE_LIST, ClauseList::getClauses)
			.add("operator", VisitationKind.PLAIN_VALUE, ClauseList::getOperator)
			.build();

	@NonNull
	private final Operator operator;
	@NonNull
	private final List<Traversable> clauses;

	public ClauseList(@NonNull Operator operator,
										@NonNull List<? extends Traversable> clauses) {
		requireNonNull(operator);
		requireNonNull(clauses);

		this.operator = operator;
		this.clauses = List.copyOf(clauses);
	}

	@NonNull
	public static ClauseList and(@NonNull Traversable... clauses) {
		requireNonNull(clauses);
		return new ClauseList(Operator.AND, Arrays.asList(clauses));
	}

	@NonNull
	public static ClauseList or(@NonNull Traversable... clauses) {
		requireNonNull(clauses);
		return new ClauseList(Operator.OR, Arrays.asList(clauses));
	}

	@NonNull
	public Operator getOperator() {
		return this.operator;
	}

	@NonNull
	public List<Traversable> getClauses() {
		return this.clauses;
	}

	@Override
	@NonNull
	public String getVisitName() {
		return "clauselist";
	}

	@Override
	@NonNull
	public Optional<TraversalSpec<?>> getTraversalSpec() {
		return Optional.of(TRAVERSAL_SPEC);
	}

	@Override
	public String toString() {
		return format("%s{operator=%s, clauses=%s}", getClass().getSimpleName(), getOperator(), getClauses());
	}
}
