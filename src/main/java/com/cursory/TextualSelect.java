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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Literal SQL text with caller-declared result columns.
 * <p>
 * When {@code positional}, the declared columns are matched to the driver's columns by position, regardless of the
 * names the driver reports.
 *
 * @since 1.0.0
 */
public final class TextualSelect implements Selectable {
	@NonNull
	private static final TraversalSpec<TextualSelect> TRAVERSAL_SPEC = TraversalSpec.forType(TextualSelect.class)
			.add("text", VisitationKind.PLAIN_VALUE, TextualSelect::getText)
			.add("bindParameters", VisitationKind.STRING_NODE_MAP, TextualSelect::getBindParameters)
			.add("columns", VisitationKind.NODE_LIST, TextualSelect::getExportedColumns)
			.add("positional", VisitationKind.PLAIN_VALUE, TextualSelect::isPositional)
			.build();

	@NonNull
	private final String text;
	@NonNull
	private final Map<String, BindParameter> bindParameters;
	@NonNull
	private final List<ColumnElement> columns;
	private final boolean positional;

	public TextualSelect(@NonNull String text,
											 @NonNull Map<String, BindParameter> bindParameters,
											 @NonNull List<? extends ColumnElement> columns,
											 boolean positional) {
		requireNonNull(text);
		requireNonNull(bindParameters);
		requireNonNull(columns);

		this.text = text;
		this.bindParameters = Collections.unmodifiableMap(new LinkedHashMap<>(bindParameters));
		this.columns = List.copyOf(columns);
		this.positional = positional;
	}

	@NonNull
	public static TextualSelect of(@NonNull String text,
																 @NonNull List<? extends ColumnElement> columns,
																 boolean positional) {
		return new TextualSelect(text, Map.of(), columns, positional);
	}

	@NonNull
	public String getText() {
		return this.text;
	}

	@NonNull
	public Map<String, BindParameter> getBindParameters() {
		return this.bindParameters;
	}

	@Override
	@NonNull
	public List<ColumnElement> getExportedColumns() {
		return this.columns;
	}

	public boolean isPositional() {
		return this.positional;
	}

	@Override
	@NonNull
	public String getVisitName() {
		return "textual_select";
	}

	@Override
	@NonNull
	public Optional<TraversalSpec<?>> getTraversalSpec() {
		return Optional.of(TRAVERSAL_SPEC);
	}

	@Override
	public String toString() {
		return format("%s{text=%s, positional=%s}", getClass().getSimpleName(), getText(), isPositional());
	}
}
