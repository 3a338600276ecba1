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
import javax.annotation.concurrent.NotThreadSafe;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Structural, read-only description of a declared type: its primary type, its generic parameters
 * (or named fields, for records) and a display name.
 * <p>
 * Descriptors are normally acquired from Java types:
 * <pre>{@code  TypeDescriptor listOfInts = TypeDescriptor.of(new TypeReference<List<Integer>>() {});
 * TypeDescriptor intOrNone = TypeDescriptor.union(TypeDescriptor.of(Integer.class), TypeDescriptor.of(Void.class));
 * TypeDescriptor onOff = TypeDescriptor.literal("on", "off");
 * TypeDescriptor user = TypeDescriptor.recordNamed("User")
 *   .field("id", TypeDescriptor.of(Integer.class))
 *   .optionalField("name", TypeDescriptor.of(String.class))
 *   .build();}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@Immutable
public final class TypeDescriptor {
	@NonNull
	private final String name;
	@Nullable
	private final Type type;
	@NonNull
	private final List<@NonNull TypeDescriptor> nested;
	@NonNull
	private final Map<@NonNull String, @NonNull TypeDescriptor> fields;
	@NonNull
	private final Set<@NonNull String> requiredFields;
	private final boolean literalValuePresent;
	@Nullable
	private final Object literalValue;

	/**
	 * Describes a Java type, expanding parameterized types into nested descriptors.
	 * <p>
	 * A {@code null} type describes an unknown type.
	 *
	 * @param type the type to describe
	 * @return a descriptor for {@code type}
	 */
	@NonNull
	public static TypeDescriptor of(@Nullable Type type) {
		if (type == null)
			return unknown("Unknown");

		if (type instanceof SpecialForm specialForm)
			return new TypeDescriptor(specialForm.getDisplayName(), specialForm, List.of(), Map.of(), Set.of(), false, null);

		if (type instanceof Class<?> typeClass)
			return new TypeDescriptor(nameForClass(typeClass), typeClass, List.of(), Map.of(), Set.of(), false, null);

		if (type instanceof ParameterizedType parameterizedType) {
			Class<?> rawType = (Class<?>) parameterizedType.getRawType();
			List<TypeDescriptor> nested = Arrays.stream(parameterizedType.getActualTypeArguments())
					.map(TypeDescriptor::of)
					.collect(Collectors.toList());

			return parameterized(rawType, nested.toArray(new TypeDescriptor[0]));
		}

		if (type instanceof WildcardType wildcardType) {
			Type[] lowerBounds = wildcardType.getLowerBounds();
			return of(lowerBounds.length > 0 ? lowerBounds[0] : wildcardType.getUpperBounds()[0]);
		}

		if (type instanceof TypeVariable<?> typeVariable)
			return of(typeVariable.getBounds()[0]);

		return unknown(type.getTypeName());
	}

	/**
	 * Describes the type captured by a {@link TypeReference}.
	 *
	 * @param typeReference the type token
	 * @return a descriptor for the referenced type
	 */
	@NonNull
	public static TypeDescriptor of(@NonNull TypeReference<?> typeReference) {
		requireNonNull(typeReference);
		return of(typeReference.getType());
	}

	/**
	 * Describes a generic type with explicit parameters, e.g. {@code List<Integer>}.
	 *
	 * @param type   the raw type
	 * @param nested the type parameters
	 * @return a descriptor for the parameterized type
	 */
	@NonNull
	public static TypeDescriptor parameterized(@NonNull Class<?> type,
																						 @NonNull TypeDescriptor... nested) {
		requireNonNull(type);
		requireNonNull(nested);

		return new TypeDescriptor(nameForClass(type), type, List.of(nested), Map.of(), Set.of(), false, null);
	}

	/**
	 * Describes a union: a value matching any one of {@code members}, tried in order.
	 *
	 * @param members the member types
	 * @return a union descriptor
	 */
	@NonNull
	public static TypeDescriptor union(@NonNull TypeDescriptor... members) {
		requireNonNull(members);
		return new TypeDescriptor(SpecialForm.UNION.getDisplayName(), SpecialForm.UNION, List.of(members), Map.of(), Set.of(), false, null);
	}

	/**
	 * Describes a literal type whose only valid values are {@code values}.
	 *
	 * @param values the allowed constants; may include {@code null}
	 * @return a literal descriptor
	 */
	@NonNull
	public static TypeDescriptor literal(@Nullable Object... values) {
		List<TypeDescriptor> nested = new ArrayList<>();

		if (values == null)
			nested.add(literalValue(null));
		else
			for (Object value : values)
				nested.add(literalValue(value));

		return new TypeDescriptor(SpecialForm.LITERAL.getDisplayName(), SpecialForm.LITERAL, Collections.unmodifiableList(nested), Map.of(), Set.of(), false, null);
	}

	/**
	 * Describes a single constant of a literal type. Its type is the constant's runtime type.
	 *
	 * @param value the constant
	 * @return a descriptor carrying {@code value}
	 */
	@NonNull
	public static TypeDescriptor literalValue(@Nullable Object value) {
		Class<?> type;

		if (value == null)
			type = Void.class;
		else if (value instanceof Enum<?> enumValue)
			type = enumValue.getDeclaringClass();
		else
			type = value.getClass();

		return new TypeDescriptor(representationOf(value), type, List.of(), Map.of(), Set.of(), true, value);
	}

	/**
	 * The trailing marker of a homogeneous tuple, as in {@code Tuple<Integer, ...>}.
	 *
	 * @return the ellipsis descriptor
	 */
	@NonNull
	public static TypeDescriptor ellipsis() {
		return of(SpecialForm.ELLIPSIS);
	}

	/**
	 * Describes a type that could not be resolved.
	 *
	 * @param name the name the type was declared with
	 * @return a descriptor with no primary type
	 */
	@NonNull
	public static TypeDescriptor unknown(@NonNull String name) {
		requireNonNull(name);
		return new TypeDescriptor(name, null, List.of(), Map.of(), Set.of(), false, null);
	}

	/**
	 * Acquires a builder for a record type: a mapping with a fixed, named field schema.
	 *
	 * @param name the record type's name
	 * @return the builder
	 */
	@NonNull
	public static RecordBuilder recordNamed(@NonNull String name) {
		requireNonNull(name);
		return new RecordBuilder(name);
	}

	private TypeDescriptor(@NonNull String name,
												 @Nullable Type type,
												 @NonNull List<@NonNull TypeDescriptor> nested,
												 @NonNull Map<@NonNull String, @NonNull TypeDescriptor> fields,
												 @NonNull Set<@NonNull String> requiredFields,
												 boolean literalValuePresent,
												 @Nullable Object literalValue) {
		requireNonNull(name);
		requireNonNull(nested);
		requireNonNull(fields);
		requireNonNull(requiredFields);

		this.name = name;
		this.type = type;
		this.nested = nested;
		this.fields = fields;
		this.requiredFields = requiredFields;
		this.literalValuePresent = literalValuePresent;
		this.literalValue = literalValue;
	}

	@NonNull
	private static String nameForClass(@NonNull Class<?> type) {
		requireNonNull(type);

		if (type == Void.class || type == void.class)
			return "None";

		return type.getSimpleName();
	}

	@NonNull
	private static String representationOf(@Nullable Object value) {
		if (value == null)
			return "None";
		if (value instanceof String)
			return "'" + value + "'";
		if (value instanceof Enum<?> enumValue)
			return format("%s.%s", enumValue.getDeclaringClass().getSimpleName(), enumValue.name());

		return Utilities.safeString(value);
	}

	/**
	 * The name this type was declared with, without its parameters.
	 *
	 * @return the name
	 */
	@NonNull
	public String getName() {
		return this.name;
	}

	/**
	 * The primary type: a {@link Class}, a {@link SpecialForm}, or empty if the type is unknown.
	 *
	 * @return the primary type
	 */
	@NonNull
	public Optional<Type> getType() {
		return Optional.ofNullable(this.type);
	}

	/**
	 * Ordered generic parameters. Empty for records, whose parameters are {@link #getFields()}.
	 *
	 * @return the nested descriptors
	 */
	@NonNull
	public List<@NonNull TypeDescriptor> getNested() {
		return this.nested;
	}

	/**
	 * A record's fields in declaration order.
	 *
	 * @return the field descriptors by name
	 */
	@NonNull
	public Map<@NonNull String, @NonNull TypeDescriptor> getFields() {
		return this.fields;
	}

	@NonNull
	public Set<@NonNull String> getRequiredFields() {
		return this.requiredFields;
	}

	public boolean isUnion() {
		return this.type == SpecialForm.UNION;
	}

	public boolean isRecord() {
		return this.type == SpecialForm.RECORD;
	}

	/**
	 * Is this descriptor one constant of a literal type?
	 *
	 * @return {@code true} if {@link #getLiteralValue()} is meaningful
	 */
	public boolean isLiteralValue() {
		return this.literalValuePresent;
	}

	@Nullable
	public Object getLiteralValue() {
		return this.literalValue;
	}

	@Override
	@NonNull
	public String toString() {
		if (isUnion())
			return getNested().stream().map(TypeDescriptor::toString).collect(Collectors.joining(" | "));

		if (isRecord() || isLiteralValue() || getNested().size() == 0)
			return getName();

		return getNested().stream()
				.map(TypeDescriptor::toString)
				.collect(Collectors.joining(", ", getName() + "<", ">"));
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof TypeDescriptor typeDescriptor))
			return false;

		return Objects.equals(getName(), typeDescriptor.getName())
				&& Objects.equals(this.type, typeDescriptor.type)
				&& Objects.equals(getNested(), typeDescriptor.getNested())
				&& Objects.equals(getFields(), typeDescriptor.getFields())
				&& Objects.equals(getRequiredFields(), typeDescriptor.getRequiredFields())
				&& isLiteralValue() == typeDescriptor.isLiteralValue()
				&& Objects.equals(getLiteralValue(), typeDescriptor.getLiteralValue());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), this.type, getNested(), getFields(), getRequiredFields(), isLiteralValue(), getLiteralValue());
	}

	/**
	 * Builder used to construct record descriptors via {@link TypeDescriptor#recordNamed(String)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class RecordBuilder {
		@NonNull
		private final String name;
		@NonNull
		private final Map<@NonNull String, @NonNull TypeDescriptor> fields;
		@NonNull
		private final Set<@NonNull String> requiredFields;

		protected RecordBuilder(@NonNull String name) {
			requireNonNull(name);

			this.name = name;
			this.fields = new LinkedHashMap<>();
			this.requiredFields = new LinkedHashSet<>();
		}

		@NonNull
		public RecordBuilder field(@NonNull String name,
															 @NonNull TypeDescriptor typeDescriptor) {
			return field(name, typeDescriptor, true);
		}

		@NonNull
		public RecordBuilder optionalField(@NonNull String name,
																			 @NonNull TypeDescriptor typeDescriptor) {
			return field(name, typeDescriptor, false);
		}

		@NonNull
		public RecordBuilder field(@NonNull String name,
															 @NonNull TypeDescriptor typeDescriptor,
															 boolean required) {
			requireNonNull(name);
			requireNonNull(typeDescriptor);

			this.fields.put(name, typeDescriptor);

			if (required)
				this.requiredFields.add(name);
			else
				this.requiredFields.remove(name);

			return this;
		}

		@NonNull
		public TypeDescriptor build() {
			return new TypeDescriptor(this.name, SpecialForm.RECORD, List.of(),
					Collections.unmodifiableMap(new LinkedHashMap<>(this.fields)),
					Collections.unmodifiableSet(new LinkedHashSet<>(this.requiredFields)), false, null);
		}
	}
}
