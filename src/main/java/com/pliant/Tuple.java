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

package com.pliant;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * An immutable, ordered, fixed-size group of values which may be of different types.
 * <p>
 * Unlike {@link List#of(Object[])}, elements may be {@code null}.
 * A {@code Tuple} is deliberately not a {@link List}, so a list-typed target never mistakes it for one.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@Immutable
public final class Tuple implements Iterable<Object> {
	@NonNull
	private static final Tuple EMPTY;

	static {
		EMPTY = new Tuple(List.of());
	}

	@NonNull
	private final List<@Nullable Object> elements;

	@NonNull
	public static Tuple empty() {
		return EMPTY;
	}

	@NonNull
	public static Tuple of(@Nullable Object... elements) {
		if (elements == null || elements.length == 0)
			return EMPTY;

		return new Tuple(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(elements))));
	}

	@NonNull
	public static Tuple copyOf(@NonNull Collection<?> elements) {
		requireNonNull(elements);

		if (elements.size() == 0)
			return EMPTY;

		return new Tuple(Collections.unmodifiableList(new ArrayList<>(elements)));
	}

	private Tuple(@NonNull List<@Nullable Object> elements) {
		requireNonNull(elements);
		this.elements = elements;
	}

	public int size() {
		return this.elements.size();
	}

	public boolean isEmpty() {
		return this.elements.isEmpty();
	}

	@Nullable
	public Object get(int index) {
		return this.elements.get(index);
	}

	/**
	 * An unmodifiable list view of this tuple's elements.
	 *
	 * @return the elements
	 */
	@NonNull
	public List<@Nullable Object> asList() {
		return this.elements;
	}

	@Override
	@NonNull
	public Iterator<Object> iterator() {
		return this.elements.iterator();
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Tuple tuple))
			return false;

		return this.elements.equals(tuple.elements);
	}

	@Override
	public int hashCode() {
		return this.elements.hashCode();
	}

	@Override
	@NonNull
	public String toString() {
		if (size() == 1)
			return "(" + Utilities.safeString(get(0)) + ",)";

		return this.elements.stream()
				.map(Utilities::safeString)
				.collect(Collectors.joining(", ", "(", ")"));
	}
}
