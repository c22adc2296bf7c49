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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Everything a {@link CursorResult} needs to know about the execution that produced it.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class ExecutionContext {
	@NonNull
	private final Dialect dialect;
	@Nullable
	private final CompiledStatement compiledStatement;
	@Nullable
	private final Traversable invokedStatement;
	@Nullable
	private final String statementDescription;
	@NonNull
	private final ExecutionOptions executionOptions;
	@NonNull
	private final RowMetadataResolver rowMetadataResolver;
	@NonNull
	private final ExecutionErrorHandler executionErrorHandler;
	@NonNull
	private final ResultLogger resultLogger;

	protected ExecutionContext(@NonNull Builder builder) {
		requireNonNull(builder);

		this.dialect = builder.dialect;
		this.compiledStatement = builder.compiledStatement;
		this.invokedStatement = builder.invokedStatement;
		this.statementDescription = builder.statementDescription;
		this.executionOptions = builder.executionOptions == null ? ExecutionOptions.defaults() : builder.executionOptions;
		this.rowMetadataResolver = builder.rowMetadataResolver == null
				? RowMetadataResolver.withDefaultConfiguration() : builder.rowMetadataResolver;
		this.executionErrorHandler = builder.executionErrorHandler == null
				? ExecutionErrorHandler.wrappingInDatabaseException() : builder.executionErrorHandler;
		this.resultLogger = builder.resultLogger == null ? new DefaultResultLogger() : builder.resultLogger;
	}

	@NonNull
	public static Builder withDialect(@NonNull Dialect dialect) {
		requireNonNull(dialect);
		return new Builder(dialect);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(4);

		components.add(format("dialect=%s", getDialect()));

		String statementDescription = getStatementDescription().orElse(null);

		if (statementDescription != null)
			components.add(format("statementDescription=%s", statementDescription));

		if (this.compiledStatement != null)
			components.add(format("compiledStatement=%s", this.compiledStatement));

		components.add(format("executionOptions=%s", getExecutionOptions()));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@NonNull
	public Dialect getDialect() {
		return this.dialect;
	}

	/**
	 * The compiler's description of the statement, absent for raw SQL strings.
	 *
	 * @return the compiled statement, if any
	 */
	@NonNull
	public Optional<CompiledStatement> getCompiledStatement() {
		return Optional.ofNullable(this.compiledStatement);
	}

	/**
	 * The statement the caller actually executed. This differs from the compiled statement's own statement when a
	 * cached compilation of a structurally identical statement is reused.
	 *
	 * @return the invoked statement, or the compiled statement's statement if none was given
	 */
	@NonNull
	public Optional<Traversable> getInvokedStatement() {
		if (this.invokedStatement != null)
			return Optional.of(this.invokedStatement);

		return getCompiledStatement().map(CompiledStatement::getStatement);
	}

	/**
	 * Human-readable description of the statement (usually its SQL), for logging.
	 *
	 * @return the description, if any
	 */
	@NonNull
	public Optional<String> getStatementDescription() {
		return Optional.ofNullable(this.statementDescription);
	}

	@NonNull
	public ExecutionOptions getExecutionOptions() {
		return this.executionOptions;
	}

	@NonNull
	public RowMetadataResolver getRowMetadataResolver() {
		return this.rowMetadataResolver;
	}

	@NonNull
	public ExecutionErrorHandler getExecutionErrorHandler() {
		return this.executionErrorHandler;
	}

	@NonNull
	public ResultLogger getResultLogger() {
		return this.resultLogger;
	}

	/**
	 * Builder used to construct instances of {@link ExecutionContext}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final Dialect dialect;
		@Nullable
		private CompiledStatement compiledStatement;
		@Nullable
		private Traversable invokedStatement;
		@Nullable
		private String statementDescription;
		@Nullable
		private ExecutionOptions executionOptions;
		@Nullable
		private RowMetadataResolver rowMetadataResolver;
		@Nullable
		private ExecutionErrorHandler executionErrorHandler;
		@Nullable
		private ResultLogger resultLogger;

		private Builder(@NonNull Dialect dialect) {
			this.dialect = requireNonNull(dialect);
		}

		@NonNull
		public Builder compiledStatement(@Nullable CompiledStatement compiledStatement) {
			this.compiledStatement = compiledStatement;
			return this;
		}

		@NonNull
		public Builder invokedStatement(@Nullable Traversable invokedStatement) {
			this.invokedStatement = invokedStatement;
			return this;
		}

		@NonNull
		public Builder statementDescription(@Nullable String statementDescription) {
			this.statementDescription = statementDescription;
			return this;
		}

		@NonNull
		public Builder executionOptions(@Nullable ExecutionOptions executionOptions) {
			this.executionOptions = executionOptions;
			return this;
		}

		@NonNull
		public Builder rowMetadataResolver(@Nullable RowMetadataResolver rowMetadataResolver) {
			this.rowMetadataResolver = rowMetadataResolver;
			return this;
		}

		@NonNull
		public Builder executionErrorHandler(@Nullable ExecutionErrorHandler executionErrorHandler) {
			this.executionErrorHandler = executionErrorHandler;
			return this;
		}

		@NonNull
		public Builder resultLogger(@Nullable ResultLogger resultLogger) {
			this.resultLogger = resultLogger;
			return this;
		}

		@NonNull
		public ExecutionContext build() {
			return new ExecutionContext(this);
		}
	}
}
