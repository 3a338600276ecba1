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

import javax.annotation.concurrent.ThreadSafe;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Convenience superclass which determines {@link CustomConverter} 'from' and 'to' types from generic type arguments.
 * <p>
 * For example:
 * <pre>{@code  CustomConverter<Integer, Money> moneyConverter = new AbstractCustomConverter<>() {
 *   @NonNull
 *   public Optional<Money> convert(@Nullable Integer cents) {
 *     return Optional.of(Money.ofCents(cents));
 *   }
 * };}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public abstract class AbstractCustomConverter<F, T> implements CustomConverter<F, T> {
	@NonNull
	private final Type fromType;
	@NonNull
	private final Type toType;

	/**
	 * Supports subclasses that have both 'from' and 'to' generic types.
	 */
	public AbstractCustomConverter() {
		List<Type> genericTypes = genericTypesForClass(getClass());

		if (genericTypes.size() != 2)
			throw new IllegalStateException(format("Unable to extract generic %s type information from %s",
					CustomConverter.class.getSimpleName(), getClass().getName()));

		this.fromType = genericTypes.get(0);
		this.toType = genericTypes.get(1);
	}

	/**
	 * Supports subclasses that have only a 'to' generic type, like {@link FromStringCustomConverter}.
	 *
	 * @param fromType an explicitly-provided 'from' type
	 */
	protected AbstractCustomConverter(@NonNull Type fromType) {
		requireNonNull(fromType);

		List<Type> genericTypes = genericTypesForClass(getClass());

		if (genericTypes.size() != 1)
			throw new IllegalStateException(format("Unable to extract generic %s type information from %s",
					CustomConverter.class.getSimpleName(), getClass().getName()));

		this.fromType = fromType;
		this.toType = genericTypes.get(0);
	}

	@Override
	@NonNull
	public Type getFromType() {
		return this.fromType;
	}

	@Override
	@NonNull
	public Type getToType() {
		return this.toType;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{fromType=%s, toType=%s}", getClass().getSimpleName(), getFromType(), getToType());
	}

	// Only direct subclasses (including anonymous ones) are supported
	@NonNull
	static List<@NonNull Type> genericTypesForClass(@Nullable Class<?> customConverterClass) {
		if (customConverterClass == null)
			return List.of();

		Type genericSuperclass = customConverterClass.getGenericSuperclass();

		if (!(genericSuperclass instanceof ParameterizedType parameterizedType))
			return List.of();

		if (!(parameterizedType.getRawType() instanceof Class<?> rawType) || !CustomConverter.class.isAssignableFrom(rawType))
			return List.of();

		Type[] genericTypes = parameterizedType.getActualTypeArguments();

		for (Type genericType : genericTypes)
			if (!(genericType instanceof Class<?>) && !(genericType instanceof ParameterizedType))
				return List.of();

		return Arrays.asList(genericTypes);
	}
}
