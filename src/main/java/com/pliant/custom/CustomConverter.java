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

package com.pliant.custom;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Optional;
import java.util.Set;

/**
 * Application-supplied conversion from {@code F} to {@code T}.
 * <p>
 * Custom converters take priority over built-in ones: once registered with a {@link CustomConverterRegistry}, a
 * converter for {@code T} is used whenever the declared type is exactly {@code T}.
 * <p>
 * To signal that a value cannot be converted, throw {@link IllegalArgumentException} with a message explaining why.
 * The message is included in the resulting error. Other exceptions are reported as a generic failure.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface CustomConverter<F, T> {
	/**
	 * Converts {@code from} to an instance of {@code T}.
	 *
	 * @param from the value from which to convert. May be {@code null} if {@link #getValueTypes()} allows it
	 * @return the {@code T} representation of {@code from}
	 * @throws Exception if {@code from} cannot be converted
	 */
	@NonNull
	Optional<T> convert(@Nullable F from) throws Exception;

	/**
	 * The 'converting from' type.
	 *
	 * @return the type represented by {@code F}
	 */
	@NonNull
	Type getFromType();

	/**
	 * The 'converting to' type.
	 *
	 * @return the type represented by {@code T}
	 */
	@NonNull
	Type getToType();

	/**
	 * Name of the target type as shown in error messages.
	 *
	 * @return the name, by default the simple name of {@link #getToType()}
	 */
	@NonNull
	default String getName() {
		Type toType = getToType();

		if (toType instanceof Class<?> toClass)
			return toClass.getSimpleName();
		if (toType instanceof ParameterizedType parameterizedType && parameterizedType.getRawType() instanceof Class<?> rawClass)
			return rawClass.getSimpleName();

		return toType.getTypeName();
	}

	/**
	 * Runtime types of values this converter accepts. {@code Void.class} stands for {@code null}.
	 *
	 * @return the accepted types, or an empty set if any value is accepted. By default the raw 'from' type,
	 * with {@code Object} meaning any value
	 */
	@NonNull
	default Set<@NonNull Class<?>> getValueTypes() {
		Type fromType = getFromType();
		Class<?> fromClass = null;

		if (fromType instanceof Class<?> typeClass)
			fromClass = typeClass;
		else if (fromType instanceof ParameterizedType parameterizedType && parameterizedType.getRawType() instanceof Class<?> rawClass)
			fromClass = rawClass;

		if (fromClass == null || fromClass == Object.class)
			return Set.of();

		return Set.of(fromClass);
	}

	/**
	 * Documentation describing the values this converter accepts.
	 *
	 * @return the documentation, if available
	 */
	@NonNull
	default Optional<String> getDocumentation() {
		return Optional.empty();
	}
}
