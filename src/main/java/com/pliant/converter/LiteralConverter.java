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

package com.pliant.converter;

import com.pliant.TypeDescriptor;
import com.pliant.Utilities;
import com.pliant.Vocabulary;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converts values to one of the constants of a literal type.
 * <p>
 * A value equal to a constant and of exactly the same class is that constant. Otherwise the value is converted to
 * each constant's class in turn and matches a constant if the result equals it; text constants are compared ignoring
 * case, spaces, underscores and hyphens. Conversion fails unless exactly one constant matches.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
final class LiteralConverter extends TypeConverter {
	@NonNull
	private static final String IGNORED_CHARACTERS = "_-";

	LiteralConverter(@NonNull TypeDescriptor typeDescriptor,
									 @NonNull List<@NonNull TypeConverter> nested,
									 @Nullable Vocabulary vocabulary) {
		super(typeDescriptor, nested, vocabulary, Utilities.joinSequence(typeDescriptor.getNested().stream()
				.map(TypeDescriptor::getName)
				.collect(Collectors.toList()), "", " or "));
	}

	@Override
	public boolean noConversionNeeded(@Nullable Object value) {
		for (TypeDescriptor constant : getTypeDescriptor().getNested())
			if (isExactMatch(value, constant.getLiteralValue()))
				return true;

		return false;
	}

	@Override
	@NonNull
	public Set<@NonNull Class<?>> getValueTypes() {
		return Set.of(Object.class);
	}

	@Override
	protected boolean acceptsValue(@Nullable Object value) {
		return true;
	}

	@Override
	@Nullable
	protected Object convertString(@NonNull String value) {
		return convertToConstant(value);
	}

	@Override
	@Nullable
	protected Object convertNonString(@Nullable Object value) {
		return convertToConstant(value);
	}

	@Nullable
	private Object convertToConstant(@Nullable Object value) {
		List<TypeDescriptor> constants = getTypeDescriptor().getNested();
		List<Object> matches = new ArrayList<>();

		for (int i = 0; i < constants.size(); i++) {
			Object expected = constants.get(i).getLiteralValue();

			if (isExactMatch(value, expected))
				return expected;

			Object converted;

			try {
				converted = getNested().get(i).convert(value);
			} catch (ValueConversionException ignored) {
				continue;
			}

			if (expected instanceof String expectedString && converted instanceof String convertedString
					? Utilities.equalsNormalized(convertedString, expectedString, IGNORED_CHARACTERS)
					: Objects.equals(converted, expected))
				matches.add(expected);
		}

		if (matches.size() == 1)
			return matches.get(0);

		if (matches.size() > 1)
			throw new IllegalArgumentException("No unique match found.");

		throw new IllegalArgumentException();
	}

	// 1 and true are different constants, as are 1 and 1L
	private static boolean isExactMatch(@Nullable Object value,
																		 @Nullable Object expected) {
		if (value == null || expected == null)
			return value == expected;

		return value.equals(expected) && value.getClass() == expected.getClass();
	}
}
