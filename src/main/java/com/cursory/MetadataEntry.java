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
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One keymap record: which position a key resolves to and how to decode the value found there.
 * <p>
 * A record without an index marks its key as ambiguous.
 *
 * @since 1.0.0
 */
@Immutable
final class MetadataEntry {
	@Nullable
	private final Integer index;
	@NonNull
	private final List<Object> objects;
	@NonNull
	private final Object lookupKey;
	@Nullable
	private final String renderedName;
	@NonNull
	private final ValueDecoder decoder;
	@Nullable
	private final String untranslatedName;

	MetadataEntry(@Nullable Integer index,
								@NonNull List<Object> objects,
								@NonNull Object lookupKey,
								@Nullable String renderedName,
								@NonNull ValueDecoder decoder,
								@Nullable String untranslatedName) {
		requireNonNull(objects);
		requireNonNull(lookupKey);
		requireNonNull(decoder);

		this.index = index;
		this.objects = List.copyOf(objects);
		this.lookupKey = lookupKey;
		this.renderedName = renderedName;
		this.decoder = decoder;
		this.untranslatedName = untranslatedName;
	}

	@NonNull
	static MetadataEntry ambiguous(@NonNull Object key) {
		return new MetadataEntry(null, List.of(), key, null, ValueDecoder.passThrough(), null);
	}

	@NonNull
	MetadataEntry withIndex(int index) {
		return new MetadataEntry(index, getObjects(), getLookupKey(), getRenderedName(), getDecoder(), getUntranslatedName());
	}

	boolean isAmbiguous() {
		return this.index == null;
	}

	@Nullable
	Integer getIndex() {
		return this.index;
	}

	@NonNull
	List<Object> getObjects() {
		return this.objects;
	}

	@NonNull
	Object getLookupKey() {
		return this.lookupKey;
	}

	@Nullable
	String getRenderedName() {
		return this.renderedName;
	}

	@NonNull
	ValueDecoder getDecoder() {
		return this.decoder;
	}

	@Nullable
	String getUntranslatedName() {
		return this.untranslatedName;
	}

	@Override
	public String toString() {
		return format("%s{index=%s, lookupKey=%s, renderedName=%s, objects=%s}", getClass().getSimpleName(), getIndex(),
				getLookupKey(), getRenderedName(), getObjects());
	}
}
