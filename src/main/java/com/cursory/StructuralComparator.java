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
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Decides whether two construct trees are structurally equivalent.
 * <p>
 * Nodes are visited breadth-first and each pair of nodes is compared at most once, so shared subtrees and cycles are
 * handled. Associative clause lists compare as unordered collections, and binary expressions with a commutative
 * operator match with their operands in either order.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class StructuralComparator {
	@NonNull
	private final Map<VisitationKind, AttributeComparison> attributeComparisons;

	public StructuralComparator() {
		Map<VisitationKind, AttributeComparison> attributeComparisons = new EnumMap<>(VisitationKind.class);
		attributeComparisons.put(VisitationKind.NODE, this::compareNodeAttribute);
		attributeComparisons.put(VisitationKind.NODE_LIST, this::compareNodeLists);
		attributeComparisons.put(VisitationKind.NODE_TUPLES, this::compareNodeTuples);
		attributeComparisons.put(VisitationKind.PLAIN_VALUE, (run, left, right) -> Objects.equals(left, right));
		attributeComparisons.put(VisitationKind.TYPE, this::compareTypes);
		attributeComparisons.put(VisitationKind.ANON_NAME, this::compareAnonNames);
		attributeComparisons.put(VisitationKind.UNORDERED_NODE_SET, this::compareUnorderedNodeSets);
		attributeComparisons.put(VisitationKind.PLAIN_MAP, (run, left, right) -> Objects.equals(left, right));
		attributeComparisons.put(VisitationKind.STRING_NODE_MAP, this::compareStringNodeMaps);
		attributeComparisons.put(VisitationKind.BOUND_VALUE, this::compareBoundValues);
		attributeComparisons.put(VisitationKind.UNKNOWN_STRUCTURE, (run, left, right) -> {
			throw new UnsupportedOperationException(format("Attributes of kind %s.%s cannot be compared",
					VisitationKind.class.getSimpleName(), VisitationKind.UNKNOWN_STRUCTURE.name()));
		});

		for (VisitationKind visitationKind : VisitationKind.values())
			if (!attributeComparisons.containsKey(visitationKind))
				throw new IllegalStateException(format("No comparison for %s.%s",
						VisitationKind.class.getSimpleName(), visitationKind.name()));

		this.attributeComparisons = Collections.unmodifiableMap(attributeComparisons);
	}

	public boolean compare(@Nullable Traversable left,
												 @Nullable Traversable right) {
		return compare(left, right, ComparisonOptions.defaults());
	}

	public boolean compare(@Nullable Traversable left,
												 @Nullable Traversable right,
												 @NonNull ComparisonOptions comparisonOptions) {
		requireNonNull(comparisonOptions);
		return new ComparisonRun(comparisonOptions).compare(left, right);
	}

	/**
	 * Node-specific comparison performed before a pair's attributes are walked.
	 *
	 * @param run   the comparison in progress
	 * @param left  the left node
	 * @param right the right node, with the same visit name as {@code left}
	 * @return how to proceed with this pair
	 */
	@NonNull
	protected NodeComparison compareNodes(@NonNull ComparisonRun run,
																				@NonNull Traversable left,
																				@NonNull Traversable right) {
		requireNonNull(run);
		requireNonNull(left);
		requireNonNull(right);

		ComparisonOptions comparisonOptions = run.getComparisonOptions();

		if (comparisonOptions.isUseLineage()) {
			if (left instanceof Table)
				return left == right ? NodeComparison.skipTraversal() : NodeComparison.failed();

			if ((left instanceof Column || left instanceof Label) && right instanceof ColumnElement rightColumnElement)
				return compareColumnLineage((ColumnElement) left, rightColumnElement, comparisonOptions);
		}

		if (left instanceof ClauseList leftClauseList && right instanceof ClauseList rightClauseList) {
			if (leftClauseList.getOperator() != rightClauseList.getOperator())
				return NodeComparison.failed();

			if (leftClauseList.getOperator().isAssociative()) {
				if (!compareUnordered(leftClauseList.getClauses(), rightClauseList.getClauses(), comparisonOptions))
					return NodeComparison.failed();

				return NodeComparison.handled("operator", "clauses");
			}

			return NodeComparison.handled("operator");
		}

		if (left instanceof BinaryExpression leftBinary && right instanceof BinaryExpression rightBinary) {
			if (leftBinary.getOperator() != rightBinary.getOperator()
					|| !Objects.equals(leftBinary.getNegate(), rightBinary.getNegate()))
				return NodeComparison.failed();

			if (leftBinary.getOperator().isCommutative()) {
				boolean matches = (compare(leftBinary.getLeft(), rightBinary.getLeft(), comparisonOptions)
						&& compare(leftBinary.getRight(), rightBinary.getRight(), comparisonOptions))
						|| (compare(leftBinary.getLeft(), rightBinary.getRight(), comparisonOptions)
						&& compare(leftBinary.getRight(), rightBinary.getLeft(), comparisonOptions));

				// Result type follows the left operand
				return matches ? NodeComparison.handled("operator", "negate", "left", "right", "type") : NodeComparison.failed();
			}

			return NodeComparison.handled("operator", "negate");
		}

		return NodeComparison.proceed();
	}

	@NonNull
	protected NodeComparison compareColumnLineage(@NonNull ColumnElement left,
																								@NonNull ColumnElement right,
																								@NonNull ComparisonOptions comparisonOptions) {
		requireNonNull(left);
		requireNonNull(right);
		requireNonNull(comparisonOptions);

		List<ColumnElement> candidates = new ArrayList<>();
		candidates.add(right);
		candidates.addAll(comparisonOptions.getEquivalents().getOrDefault(right, Set.of()));

		for (ColumnElement candidate : candidates)
			if (left.sharesLineage(candidate) || left == candidate)
				return NodeComparison.skipTraversal();

		return NodeComparison.failed();
	}

	protected boolean compareUnordered(@NonNull Collection<?> left,
																		 @NonNull Collection<?> right,
																		 @NonNull ComparisonOptions comparisonOptions) {
		requireNonNull(left);
		requireNonNull(right);
		requireNonNull(comparisonOptions);

		if (left.size() != right.size())
			return false;

		for (Object leftNode : left) {
			boolean matched = false;

			for (Object rightNode : right) {
				if (compare((Traversable) leftNode, (Traversable) rightNode, comparisonOptions)) {
					matched = true;
					break;
				}
			}

			if (!matched)
				return false;
		}

		return true;
	}

	private boolean compareNodeAttribute(@NonNull ComparisonRun run,
																			 @NonNull Object left,
																			 @NonNull Object right) {
		run.enqueue((Traversable) left, (Traversable) right);
		return true;
	}

	private boolean compareNodeLists(@NonNull ComparisonRun run,
																	 @NonNull Object left,
																	 @NonNull Object right) {
		Collection<?> leftNodes = (Collection<?>) left;
		Collection<?> rightNodes = (Collection<?>) right;

		if (leftNodes.size() != rightNodes.size())
			return false;

		Iterator<?> rightIterator = rightNodes.iterator();

		for (Object leftNode : leftNodes)
			run.enqueue((Traversable) leftNode, (Traversable) rightIterator.next());

		return true;
	}

	private boolean compareNodeTuples(@NonNull ComparisonRun run,
																		@NonNull Object left,
																		@NonNull Object right) {
		Collection<?> leftTuples = (Collection<?>) left;
		Collection<?> rightTuples = (Collection<?>) right;

		if (leftTuples.size() != rightTuples.size())
			return false;

		Iterator<?> rightIterator = rightTuples.iterator();

		for (Object leftTuple : leftTuples)
			if (!compareNodeLists(run, leftTuple, rightIterator.next()))
				return false;

		return true;
	}

	private boolean compareTypes(@NonNull ComparisonRun run,
															 @NonNull Object left,
															 @NonNull Object right) {
		return ((TypeDescriptor) left).hasAffinityWith((TypeDescriptor) right);
	}

	private boolean compareAnonNames(@NonNull ComparisonRun run,
																	 @NonNull Object left,
																	 @NonNull Object right) {
		Object leftName = left instanceof AnonymousName anonymousName ? anonymousName.apply(run.getLeftAnonMap()) : left;
		Object rightName = right instanceof AnonymousName anonymousName ? anonymousName.apply(run.getRightAnonMap()) : right;
		return leftName.equals(rightName);
	}

	private boolean compareUnorderedNodeSets(@NonNull ComparisonRun run,
																					 @NonNull Object left,
																					 @NonNull Object right) {
		return compareUnordered((Collection<?>) left, (Collection<?>) right, run.getComparisonOptions());
	}

	private boolean compareStringNodeMaps(@NonNull ComparisonRun run,
																				@NonNull Object left,
																				@NonNull Object right) {
		Map<?, ?> leftMap = (Map<?, ?>) left;
		Map<?, ?> rightMap = (Map<?, ?>) right;

		if (!leftMap.keySet().equals(rightMap.keySet()))
			return false;

		for (Map.Entry<?, ?> entry : leftMap.entrySet())
			run.enqueue((Traversable) entry.getValue(), (Traversable) rightMap.get(entry.getKey()));

		return true;
	}

	private boolean compareBoundValues(@NonNull ComparisonRun run,
																		 @NonNull Object left,
																		 @NonNull Object right) {
		return !run.getComparisonOptions().isCompareValues() || Objects.deepEquals(left, right);
	}

	/**
	 * The outcome of {@link #compareNodes(ComparisonRun, Traversable, Traversable)}.
	 *
	 * @since 1.0.0
	 */
	protected static final class NodeComparison {
		@NonNull
		private static final NodeComparison FAILED = new NodeComparison(true, false, Set.of());
		@NonNull
		private static final NodeComparison SKIP_TRAVERSAL = new NodeComparison(false, true, Set.of());
		@NonNull
		private static final NodeComparison PROCEED = new NodeComparison(false, false, Set.of());

		private final boolean failed;
		private final boolean skipTraversal;
		@NonNull
		private final Set<String> handledAttributeNames;

		private NodeComparison(boolean failed,
													 boolean skipTraversal,
													 @NonNull Set<String> handledAttributeNames) {
			this.failed = failed;
			this.skipTraversal = skipTraversal;
			this.handledAttributeNames = requireNonNull(handledAttributeNames);
		}

		@NonNull
		public static NodeComparison failed() {
			return FAILED;
		}

		@NonNull
		public static NodeComparison skipTraversal() {
			return SKIP_TRAVERSAL;
		}

		@NonNull
		public static NodeComparison proceed() {
			return PROCEED;
		}

		/**
		 * The named attributes were compared successfully; compare the rest normally.
		 *
		 * @param attributeNames the attributes already compared
		 * @return a comparison result
		 */
		@NonNull
		public static NodeComparison handled(@NonNull String... attributeNames) {
			requireNonNull(attributeNames);
			return new NodeComparison(false, false, Set.of(attributeNames));
		}
	}

	/**
	 * State of one top-level comparison.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	protected final class ComparisonRun {
		@NonNull
		private final ComparisonOptions comparisonOptions;
		@NonNull
		private final Deque<NodePair> pending;
		@NonNull
		private final Set<NodePair> compared;
		@NonNull
		private final AnonMap leftAnonMap;
		@NonNull
		private final AnonMap rightAnonMap;

		private ComparisonRun(@NonNull ComparisonOptions comparisonOptions) {
			this.comparisonOptions = requireNonNull(comparisonOptions);
			this.pending = new ArrayDeque<>();
			this.compared = new HashSet<>();
			this.leftAnonMap = new AnonMap();
			this.rightAnonMap = new AnonMap();
		}

		void enqueue(@Nullable Traversable left,
								 @Nullable Traversable right) {
			this.pending.addLast(new NodePair(left, right));
		}

		boolean compare(@Nullable Traversable left,
										@Nullable Traversable right) {
			enqueue(left, right);

			while (!this.pending.isEmpty()) {
				NodePair nodePair = this.pending.pollFirst();
				Traversable leftNode = nodePair.getLeft();
				Traversable rightNode = nodePair.getRight();

				if (leftNode == rightNode)
					continue;

				if (leftNode == null || rightNode == null)
					return false;

				if (!this.compared.add(nodePair))
					continue;

				if (!leftNode.getVisitName().equals(rightNode.getVisitName()))
					return false;

				NodeComparison nodeComparison = compareNodes(this, leftNode, rightNode);

				if (nodeComparison.failed)
					return false;

				if (nodeComparison.skipTraversal)
					continue;

				if (!compareAttributes(leftNode, rightNode, nodeComparison.handledAttributeNames))
					return false;
			}

			return true;
		}

		private boolean compareAttributes(@NonNull Traversable leftNode,
																			@NonNull Traversable rightNode,
																			@NonNull Set<String> handledAttributeNames) {
			TraversalSpec<?> leftSpec = leftNode.getTraversalSpec().orElse(null);
			TraversalSpec<?> rightSpec = rightNode.getTraversalSpec().orElse(null);

			// Nodes without structure are only equal to themselves
			if (leftSpec == null || rightSpec == null)
				return false;

			List<? extends TraversalEntry<?>> leftEntries = leftSpec.getEntries();
			List<? extends TraversalEntry<?>> rightEntries = rightSpec.getEntries();

			if (leftEntries.size() != rightEntries.size())
				return false;

			for (int i = 0; i < leftEntries.size(); ++i) {
				TraversalEntry<?> leftEntry = leftEntries.get(i);
				TraversalEntry<?> rightEntry = rightEntries.get(i);

				if (!leftEntry.getAttributeName().equals(rightEntry.getAttributeName())
						|| leftEntry.getVisitationKind() != rightEntry.getVisitationKind())
					return false;

				if (handledAttributeNames.contains(leftEntry.getAttributeName()))
					continue;

				Object leftValue = leftEntry.valueFrom(leftNode);
				Object rightValue = rightEntry.valueFrom(rightNode);

				if (leftEntry.getVisitationKind() == VisitationKind.BOUND_VALUE && !getComparisonOptions().isCompareValues())
					continue;

				if (leftValue == null || rightValue == null) {
					if (leftValue != rightValue)
						return false;

					continue;
				}

				if (!attributeComparisons.get(leftEntry.getVisitationKind()).compare(this, leftValue, rightValue))
					return false;
			}

			return true;
		}

		@NonNull
		ComparisonOptions getComparisonOptions() {
			return this.comparisonOptions;
		}

		@NonNull
		AnonMap getLeftAnonMap() {
			return this.leftAnonMap;
		}

		@NonNull
		AnonMap getRightAnonMap() {
			return this.rightAnonMap;
		}
	}

	@FunctionalInterface
	private interface AttributeComparison {
		boolean compare(@NonNull ComparisonRun run,
										@NonNull Object left,
										@NonNull Object right);
	}

	/**
	 * A pair of nodes, equal to another pair only if both sides are identical.
	 */
	private static final class NodePair {
		@Nullable
		private final Traversable left;
		@Nullable
		private final Traversable right;

		private NodePair(@Nullable Traversable left,
										 @Nullable Traversable right) {
			this.left = left;
			this.right = right;
		}

		@Nullable
		Traversable getLeft() {
			return this.left;
		}

		@Nullable
		Traversable getRight() {
			return this.right;
		}

		@Override
		public boolean equals(Object object) {
			if (this == object)
				return true;

			if (!(object instanceof NodePair nodePair))
				return false;

			return this.left == nodePair.left && this.right == nodePair.right;
		}

		@Override
		public int hashCode() {
			return 31 * System.identityHashCode(this.left) + System.identityHashCode(this.right);
		}
	}
}
