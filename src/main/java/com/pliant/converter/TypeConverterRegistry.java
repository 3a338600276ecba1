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

import com.google.common.collect.ImmutableSet;
import com.pliant.SpecialForm;
import com.pliant.Tuple;
import com.pliant.TypeDescriptor;
import com.pliant.TypeReference;
import com.pliant.Utilities;
import com.pliant.Vocabulary;
import com.pliant.custom.CustomConverter;
import com.pliant.custom.CustomConverterRegistry;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;

/**
 * Builds {@link TypeConverter} trees for declared types.
 * <p>
 * A converter is chosen for a declared type as follows, first match wins:
 * <ol>
 *   <li>unknown declared types get an {@link UnknownConverter}</li>
 *   <li>a {@link CustomConverter} registered for exactly the declared type</li>
 *   <li>the built-in converter registered for exactly the declared type</li>
 *   <li>the first built-in converter, in registration order, whose type is a supertype of the declared type</li>
 *   <li>otherwise an {@link UnknownConverter}</li>
 * </ol>
 * Converters for nested types are built the same way, so the resulting tree mirrors the {@link TypeDescriptor}.
 * <p>
 * For example:
 * <pre>{@code  TypeConverter converter = TypeConverterRegistry.converterFor(new TypeReference<List<Integer>>() {});
 * List<Integer> numbers = (List<Integer>) converter.convert("[1, '2', 3.0]");}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class TypeConverterRegistry {
	@NonNull
	private static final Logger LOGGER = Logger.getLogger(TypeConverterRegistry.class.getName());
	@NonNull
	private static final List<@NonNull Registration> REGISTRATIONS;
	@NonNull
	private static final Map<@NonNull Type, @NonNull Registration> REGISTRATIONS_BY_TYPE;

	static {
		List<Registration> registrations = new ArrayList<>();

		registrations.add(new Registration(Set.of(), TypeConverterRegistry::isEnum,
				(typeDescriptor, customConverterRegistry, vocabulary) -> new EnumConverter(typeDescriptor,
						nestedConvertersFor(typeDescriptor, customConverterRegistry, vocabulary), vocabulary)));
		registrations.add(new Registration(Set.of(Object.class), typeDescriptor -> isExactly(typeDescriptor, Object.class),
				(typeDescriptor, customConverterRegistry, vocabulary) -> new ScalarConverters.AnyConverter(typeDescriptor,
						nestedConvertersFor(typeDescriptor, customConverterRegistry, vocabulary), vocabulary)));
		registrations.add(Registration.forSubtypesOf(Set.of(String.class),
				(typeDescriptor, customConverterRegistry, vocabulary) -> new ScalarConverters.StringConverter(typeDescriptor,
						nestedConvertersFor(typeDescriptor, customConverterRegistry, vocabulary), vocabulary)));
		registrations.add(Registration.forSubtypesOf(Set.of(Boolean.class),
				(typeDescriptor, customConverterRegistry, vocabulary) -> new ScalarConverters.BooleanConverter(typeDescriptor,
						nestedConvertersFor(typeDescriptor, customConverterRegistry, vocabulary), vocabulary)));
		registrations.add(Registration.forSubtypesOf(Set.of(Integer.class, Long.class, Short.class, Byte.class, BigInteger.class),
				(typeDescriptor, customConverterRegistry, vocabulary) -> new NumericConverters.IntegerConverter(typeDescriptor,
						nestedConvertersFor(typeDescriptor, customConverterRegistry, vocabulary), vocabulary)));
		// Any other kind of number is handled as a float
		registrations.add(Registration.forSubtypesOf(Set.of(Double.class, Float.class, Number.class),
				(typeDescriptor, customConverterRegistry, vocabulary) -> new NumericConverters.FloatConverter(typeDescriptor,
						nestedConvertersFor(typeDescriptor, customConverterRegistry, vocabulary), vocabulary)));
		registrations.add(Registration.forSubtypesOf(Set.of(BigDecimal.class),
				(typeDescriptor, customConverterRegistry, vocabulary) -> new NumericConverters.DecimalConverter(typeDescriptor,
						nestedConvertersFor(typeDescriptor, customConverterRegistry, vocabulary), vocabulary)));
		registrations.add(Registration.forSubtypesOf(Set.of(byte[].class),
				(typeDescriptor, customConverterRegistry, vocabulary) -> new ScalarConverters.BytesConverter(typeDescriptor,
						nestedConvertersFor(typeDescriptor, customConverterRegistry, vocabulary), vocabulary)));
		registrations.add(Registration.forSubtypesOf(Set.of(ByteBuffer.class),
				(typeDescriptor, customConverterRegistry, vocabulary) -> new ScalarConverters.ByteBufferConverter(typeDescriptor,
						nestedConvertersFor(typeDescriptor, customConverterRegistry, vocabulary), vocabulary)));
		registrations.add(Registration.forSubtypesOf(Set.of(LocalDateTime.class),
				(typeDescriptor, customConverterRegistry, vocabulary) -> new TemporalConverters.DateTimeConverter(typeDescriptor,
						nestedConvertersFor(typeDescriptor, customConverterRegistry, vocabulary), vocabulary)));
		registrations.add(Registration.forSubtypesOf(Set.of(LocalDate.class),
				(typeDescriptor, customConverterRegistry, vocabulary) -> new TemporalConverters.DateConverter(typeDescriptor,
						nestedConvertersFor(typeDescriptor, customConverterRegistry, vocabulary), vocabulary)));
		registrations.add(Registration.forSubtypesOf(Set.of(Duration.class),
				(typeDescriptor, customConverterRegistry, vocabulary) -> new TemporalConverters.DurationConverter(typeDescriptor,
						nestedConvertersFor(typeDescriptor, customConverterRegistry, vocabulary), vocabulary)));
		registrations.add(Registration.forSubtypesOf(Set.of(Path.class),
				(typeDescriptor, customConverterRegistry, vocabulary) -> new ScalarConverters.PathConverter(typeDescriptor,
						nestedConvertersFor(typeDescriptor, customConverterRegistry, vocabulary), vocabulary)));
		registrations.add(new Registration(Set.of(Void.class), typeDescriptor -> isExactly(typeDescriptor, Void.class),
				(typeDescriptor, customConverterRegistry, vocabulary) -> new ScalarConverters.NoneConverter(typeDescriptor,
						nestedConvertersFor(typeDescriptor, customConverterRegistry, vocabulary), vocabulary)));
		registrations.add(Registration.forSubtypesOf(Set.of(List.class),
				(typeDescriptor, customConverterRegistry, vocabulary) -> new CollectionConverters.ListConverter(typeDescriptor,
						nestedConvertersFor(typeDescriptor, customConverterRegistry, vocabulary), vocabulary)));
		registrations.add(Registration.forSubtypesOf(Set.of(Tuple.class),
				(typeDescriptor, customConverterRegistry, vocabulary) -> new CollectionConverters.TupleConverter(typeDescriptor,
						nestedConvertersFor(typeDescriptor, customConverterRegistry, vocabulary), vocabulary)));
		registrations.add(new Registration(Set.of(SpecialForm.RECORD), TypeDescriptor::isRecord,
				(typeDescriptor, customConverterRegistry, vocabulary) -> new RecordConverter(typeDescriptor,
						fieldConvertersFor(typeDescriptor, customConverterRegistry, vocabulary), vocabulary)));
		registrations.add(Registration.forSubtypesOf(Set.of(Map.class),
				(typeDescriptor, customConverterRegistry, vocabulary) -> new CollectionConverters.DictionaryConverter(typeDescriptor,
						nestedConvertersFor(typeDescriptor, customConverterRegistry, vocabulary), vocabulary)));
		registrations.add(Registration.forSubtypesOf(Set.of(Set.class),
				(typeDescriptor, customConverterRegistry, vocabulary) -> new CollectionConverters.SetConverter(typeDescriptor,
						nestedConvertersFor(typeDescriptor, customConverterRegistry, vocabulary), vocabulary)));
		registrations.add(Registration.forSubtypesOf(Set.of(ImmutableSet.class),
				(typeDescriptor, customConverterRegistry, vocabulary) -> new CollectionConverters.FrozenSetConverter(typeDescriptor,
						nestedConvertersFor(typeDescriptor, customConverterRegistry, vocabulary), vocabulary)));
		registrations.add(new Registration(Set.of(SpecialForm.UNION), TypeDescriptor::isUnion,
				(typeDescriptor, customConverterRegistry, vocabulary) -> new UnionConverter(typeDescriptor,
						nestedConvertersFor(typeDescriptor, customConverterRegistry, vocabulary), vocabulary)));
		registrations.add(new Registration(Set.of(SpecialForm.LITERAL), typeDescriptor -> isExactly(typeDescriptor, SpecialForm.LITERAL),
				(typeDescriptor, customConverterRegistry, vocabulary) -> new LiteralConverter(typeDescriptor,
						nestedConvertersFor(typeDescriptor, customConverterRegistry, vocabulary), vocabulary)));

		Map<Type, Registration> registrationsByType = new LinkedHashMap<>();

		for (Registration registration : registrations)
			for (Type type : registration.types())
				registrationsByType.putIfAbsent(type, registration);

		REGISTRATIONS = Collections.unmodifiableList(registrations);
		REGISTRATIONS_BY_TYPE = Collections.unmodifiableMap(registrationsByType);
	}

	private TypeConverterRegistry() {
		// Non-instantiable
	}

	/**
	 * Builds a converter for the declared type using only built-in converters.
	 *
	 * @param typeReference the declared type
	 * @return the converter, an {@link UnknownConverter} if the type is not recognized
	 */
	@NonNull
	public static TypeConverter converterFor(@NonNull TypeReference<?> typeReference) {
		requireNonNull(typeReference);
		return converterFor(TypeDescriptor.of(typeReference), null, null);
	}

	/**
	 * Builds a converter for the declared type using only built-in converters.
	 *
	 * @param typeDescriptor the declared type
	 * @return the converter, an {@link UnknownConverter} if the type is not recognized
	 */
	@NonNull
	public static TypeConverter converterFor(@NonNull TypeDescriptor typeDescriptor) {
		return converterFor(typeDescriptor, null, null);
	}

	/**
	 * Builds a converter for the declared type, preferring custom converters over built-in ones.
	 *
	 * @param typeDescriptor          the declared type
	 * @param customConverterRegistry custom converters, may be {@code null}
	 * @return the converter, an {@link UnknownConverter} if the type is not recognized
	 */
	@NonNull
	public static TypeConverter converterFor(@NonNull TypeDescriptor typeDescriptor,
																					 @Nullable CustomConverterRegistry customConverterRegistry) {
		return converterFor(typeDescriptor, customConverterRegistry, null);
	}

	/**
	 * Builds a converter for the declared type, preferring custom converters over built-in ones.
	 *
	 * @param typeDescriptor          the declared type
	 * @param customConverterRegistry custom converters, may be {@code null}
	 * @param vocabulary              boolean vocabulary, may be {@code null} to use {@link com.pliant.DefaultVocabulary#withDefaults()}
	 * @return the converter, an {@link UnknownConverter} if the type is not recognized
	 */
	@NonNull
	public static TypeConverter converterFor(@NonNull TypeDescriptor typeDescriptor,
																					 @Nullable CustomConverterRegistry customConverterRegistry,
																					 @Nullable Vocabulary vocabulary) {
		requireNonNull(typeDescriptor);

		Type type = typeDescriptor.getType().orElse(null);

		if (type == null)
			return new UnknownConverter(typeDescriptor, nestedConvertersFor(typeDescriptor, customConverterRegistry, vocabulary), vocabulary);

		if (customConverterRegistry != null) {
			Optional<CustomConverter<?, ?>> customConverter = customConverterRegistry.getConverter(type);

			// Nested types of a custom type never use custom converters
			if (customConverter.isPresent())
				return new CustomConverterAdapter(typeDescriptor, customConverter.get(),
						nestedConvertersFor(typeDescriptor, null, vocabulary), vocabulary);
		}

		Type normalizedType = type instanceof Class<?> typeClass ? Utilities.boxedType(typeClass) : type;
		Registration registration = REGISTRATIONS_BY_TYPE.get(normalizedType);

		if (registration != null)
			return registration.converterFactory().create(typeDescriptor, customConverterRegistry, vocabulary);

		for (Registration fallbackRegistration : REGISTRATIONS) {
			if (fallbackRegistration.handles().test(typeDescriptor)) {
				TypeConverter typeConverter = fallbackRegistration.converterFactory().create(typeDescriptor, customConverterRegistry, vocabulary);

				if (LOGGER.isLoggable(FINE))
					LOGGER.fine(format("No exact converter for %s, using %s", typeDescriptor, typeConverter));

				return typeConverter;
			}
		}

		if (LOGGER.isLoggable(FINE))
			LOGGER.fine(format("Unrecognized type %s", typeDescriptor));

		return new UnknownConverter(typeDescriptor, nestedConvertersFor(typeDescriptor, customConverterRegistry, vocabulary), vocabulary);
	}

	@NonNull
	private static List<@NonNull TypeConverter> nestedConvertersFor(@NonNull TypeDescriptor typeDescriptor,
																																	@Nullable CustomConverterRegistry customConverterRegistry,
																																	@Nullable Vocabulary vocabulary) {
		List<TypeConverter> nested = new ArrayList<>(typeDescriptor.getNested().size());

		for (TypeDescriptor nestedTypeDescriptor : typeDescriptor.getNested())
			nested.add(converterFor(nestedTypeDescriptor, customConverterRegistry, vocabulary));

		return nested;
	}

	@NonNull
	private static Map<@NonNull String, @NonNull TypeConverter> fieldConvertersFor(@NonNull TypeDescriptor typeDescriptor,
																																								 @Nullable CustomConverterRegistry customConverterRegistry,
																																								 @Nullable Vocabulary vocabulary) {
		Map<String, TypeConverter> fieldConverters = new LinkedHashMap<>();

		for (Map.Entry<String, TypeDescriptor> field : typeDescriptor.getFields().entrySet())
			fieldConverters.put(field.getKey(), converterFor(field.getValue(), customConverterRegistry, vocabulary));

		return fieldConverters;
	}

	private static boolean isExactly(@NonNull TypeDescriptor typeDescriptor,
																	 @NonNull Type type) {
		Type declaredType = typeDescriptor.getType().orElse(null);

		if (declaredType instanceof Class<?> declaredClass)
			declaredType = Utilities.boxedType(declaredClass);

		return type.equals(declaredType);
	}

	private static boolean isEnum(@NonNull TypeDescriptor typeDescriptor) {
		return typeDescriptor.getType().orElse(null) instanceof Class<?> declaredClass && declaredClass.isEnum();
	}

	private static boolean isSubtypeOfAny(@NonNull TypeDescriptor typeDescriptor,
																				@NonNull Set<@NonNull Type> types) {
		if (!(typeDescriptor.getType().orElse(null) instanceof Class<?> declaredClass))
			return false;

		Class<?> boxedDeclaredClass = Utilities.boxedType(declaredClass);

		for (Type type : types)
			if (type instanceof Class<?> typeClass && typeClass.isAssignableFrom(boxedDeclaredClass))
				return true;

		return false;
	}

	@FunctionalInterface
	private interface TypeConverterFactory {
		@NonNull
		TypeConverter create(@NonNull TypeDescriptor typeDescriptor,
												 @Nullable CustomConverterRegistry customConverterRegistry,
												 @Nullable Vocabulary vocabulary);
	}

	/**
	 * A built-in converter: the types it is registered for, how it recognizes other declared types it can handle,
	 * and how to build it.
	 */
	private record Registration(@NonNull Set<@NonNull Type> types,
															@NonNull Predicate<@NonNull TypeDescriptor> handles,
															@NonNull TypeConverterFactory converterFactory) {
		@NonNull
		static Registration forSubtypesOf(@NonNull Set<@NonNull Type> types,
																			@NonNull TypeConverterFactory converterFactory) {
			return new Registration(types, typeDescriptor -> isSubtypeOfAny(typeDescriptor, types), converterFactory);
		}
	}
}
