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
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converts values to the first member type of a union that accepts them, trying members in declaration order.
 * <p>
 * If no member accepts the value but some member type is unrecognized, the value is returned unchanged: it may well
 * be valid for the unrecognized type.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
final class UnionConverter extends TypeConverter {
	UnionConverter(@NonNull TypeDescriptor typeDescriptor,
								 @NonNull List<@NonNull TypeConverter> nested,
								 @Nullable Vocabulary vocabulary) {
		super(typeDescriptor, nested, vocabulary, Utilities.joinSequence(nested.stream()
				.map(TypeConverter::getTypeName)
				.collect(Collectors.toList()), "", " or "));
	}

	@Override
	public boolean noConversionNeeded(@Nullable Object value) {
		for (TypeConverter typeConverter : getNested())
			if (typeConverter.noConversionNeeded(value))
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
		return convertToMember(value);
	}

	@Override
	@Nullable
	protected Object convertNonString(@Nullable Object value) {
		return convertToMember(value);
	}

	@Nullable
	private Object convertToMember(@Nullable Object value) {
		boolean unrecognizedMember = false;

		for (TypeConverter typeConverter : getNested()) {
			if (!typeConverter.isRecognized()) {
				unrecognizedMember = true;
				continue;
			}

			try {
				return typeConverter.convert(value);
			} catch (ValueConversionException ignored) {
				// Try the next member
			}
		}

		if (unrecognizedMember)
			return value;

		throw new IllegalArgumentException();
	}
}
