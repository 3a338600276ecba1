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

import com.pliant.Utilities;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Immutable lookup of {@link CustomConverter} instances by target type.
 * <p>
 * Lookup is by exact type: a converter registered for {@code Money} is not used for subclasses of {@code Money}.
 * If more than one converter targets the same type, the one registered last wins.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class CustomConverterRegistry {
	@NonNull
	private static final CustomConverterRegistry EMPTY_INSTANCE;

	static {
		EMPTY_INSTANCE = new CustomConverterRegistry(Map.of());
	}

	@NonNull
	private final Map<@NonNull Type, @NonNull CustomConverter<?, ?>> customConvertersByType;

	/**
	 * Acquires a registry with no custom converters.
	 *
	 * @return the empty registry
	 */
	@NonNull
	public static CustomConverterRegistry empty() {
		return EMPTY_INSTANCE;
	}

	/**
	 * Acquires a registry holding the given custom converters.
	 *
	 * @param customConverters the converters, later ones taking precedence over earlier ones for the same type
	 * @return the registry
	 */
	@NonNull
	public static CustomConverterRegistry of(@NonNull CustomConverter<?, ?>... customConverters) {
		requireNonNull(customConverters);
		return of(Arrays.asList(customConverters));
	}

	/**
	 * Acquires a registry holding the given custom converters.
	 *
	 * @param customConverters the converters, later ones taking precedence over earlier ones for the same type
	 * @return the registry
	 */
	@NonNull
	public static CustomConverterRegistry of(@NonNull Collection<@NonNull CustomConverter<?, ?>> customConverters) {
		requireNonNull(customConverters);

		Map<Type, CustomConverter<?, ?>> customConvertersByType = new LinkedHashMap<>();

		for (CustomConverter<?, ?> customConverter : customConverters) {
			requireNonNull(customConverter);
			customConvertersByType.put(normalizedType(customConverter.getToType()), customConverter);
		}

		return new CustomConverterRegistry(Collections.unmodifiableMap(customConvertersByType));
	}

	private CustomConverterRegistry(@NonNull Map<@NonNull Type, @NonNull CustomConverter<?, ?>> customConvertersByType) {
		requireNonNull(customConvertersByType);
		this.customConvertersByType = customConvertersByType;
	}

	/**
	 * Gets the custom converter for exactly {@code type}.
	 *
	 * @param type the target type
	 * @return the converter, or {@link Optional#empty()} if none is registered for {@code type}
	 */
	@NonNull
	public Optional<CustomConverter<?, ?>> getConverter(@Nullable Type type) {
		if (type == null)
			return Optional.empty();

		return Optional.ofNullable(this.customConvertersByType.get(normalizedType(type)));
	}

	/**
	 * Types with a registered custom converter, in registration order.
	 *
	 * @return the target types
	 */
	@NonNull
	public Set<@NonNull Type> getTypes() {
		return this.customConvertersByType.keySet();
	}

	// int -> Integer, List<Money> -> List
	@NonNull
	private static Type normalizedType(@NonNull Type type) {
		requireNonNull(type);

		if (type instanceof ParameterizedType parameterizedType)
			type = parameterizedType.getRawType();

		if (type instanceof Class<?> typeClass)
			return Utilities.boxedType(typeClass);

		return type;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{types=%s}", getClass().getSimpleName(), getTypes());
	}
}
