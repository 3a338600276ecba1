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

import com.pliant.DefaultVocabulary;
import com.pliant.TypeDescriptor;
import com.pliant.Utilities;
import com.pliant.Vocabulary;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.lang.reflect.Type;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Converts values to one declared type, described by a {@link TypeDescriptor}.
 * <p>
 * Converters form a tree that mirrors the descriptor: a converter for {@code Map<String, List<Integer>>} owns
 * nested converters for {@code String} and {@code List<Integer>}, and so on. Trees are built by
 * {@link TypeConverterRegistry#converterFor(TypeDescriptor)} and are not modified afterwards.
 * <p>
 * Conversion follows the same steps for every converter:
 * <ol>
 *   <li>values that already satisfy the declared type are returned as-is (see {@link #noConversionNeeded(Object)})</li>
 *   <li>values whose runtime type is not one of {@link #getValueTypes()} are rejected without an attempt</li>
 *   <li>text goes through {@link #convertString(String)}, anything else through {@link #convertNonString(Object)}</li>
 *   <li>failures are reported as a {@link ValueConversionException} with a uniform, human-readable message</li>
 * </ol>
 * Instances are safe to reuse from a single thread.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public abstract class TypeConverter {
	/**
	 * The kind reported in error messages when none is specified.
	 */
	@NonNull
	public static final String DEFAULT_KIND = "Argument";

	@NonNull
	private final TypeDescriptor typeDescriptor;
	@NonNull
	private final List<@NonNull TypeConverter> nested;
	@NonNull
	private final String typeName;
	@Nullable
	private Vocabulary vocabulary;

	/**
	 * Creates a converter.
	 *
	 * @param typeDescriptor the declared type
	 * @param nested         converters for the declared type's nested types, in order
	 * @param vocabulary     boolean vocabulary, or {@code null} to create the default one on first use
	 * @param typeName       display name of the declared type, see {@link #typeNameFor(String, TypeDescriptor, List)}
	 */
	protected TypeConverter(@NonNull TypeDescriptor typeDescriptor,
													@NonNull List<@NonNull TypeConverter> nested,
													@Nullable Vocabulary vocabulary,
													@NonNull String typeName) {
		requireNonNull(typeDescriptor);
		requireNonNull(nested);
		requireNonNull(typeName);

		this.typeDescriptor = typeDescriptor;
		this.nested = List.copyOf(nested);
		this.vocabulary = vocabulary;
		this.typeName = typeName;
	}

	/**
	 * The display name for a converter: its own short name (e.g. {@code "integer"}) when the declared type has no
	 * nested types, otherwise the full structural rendering of the declared type (e.g. {@code "List<Integer>"}).
	 *
	 * @param shortName      the converter's short name, or {@code null} if it has none
	 * @param typeDescriptor the declared type
	 * @param nested         the nested converters
	 * @return the display name
	 */
	@NonNull
	protected static String typeNameFor(@Nullable String shortName,
																			@NonNull TypeDescriptor typeDescriptor,
																			@NonNull Collection<?> nested) {
		requireNonNull(typeDescriptor);
		requireNonNull(nested);

		if (shortName != null && nested.size() == 0)
			return shortName;

		return typeDescriptor.toString();
	}

	/**
	 * Converts {@code value} to the declared type.
	 *
	 * @param value the value to convert, may be {@code null}
	 * @return the converted value
	 * @throws ValueConversionException if the value cannot be converted
	 */
	@Nullable
	public Object convert(@Nullable Object value) throws ValueConversionException {
		return convert(value, null, DEFAULT_KIND);
	}

	/**
	 * Converts {@code value} to the declared type, naming it in any error message.
	 *
	 * @param value the value to convert, may be {@code null}
	 * @param name  the name of the argument being converted, may be {@code null}
	 * @return the converted value
	 * @throws ValueConversionException if the value cannot be converted
	 */
	@Nullable
	public Object convert(@Nullable Object value,
												@Nullable String name) throws ValueConversionException {
		return convert(value, name, DEFAULT_KIND);
	}

	/**
	 * Converts {@code value} to the declared type.
	 *
	 * @param value the value to convert, may be {@code null}
	 * @param name  the name of what is being converted, may be {@code null}
	 * @param kind  what is being converted, e.g. {@code "Argument"} or {@code "Item"}; capitalized in messages
	 * @return the converted value
	 * @throws ValueConversionException if the value cannot be converted
	 */
	@Nullable
	public Object convert(@Nullable Object value,
												@Nullable String name,
												@NonNull String kind) throws ValueConversionException {
		requireNonNull(kind);

		if (noConversionNeeded(value))
			return value;

		if (!acceptsValue(value))
			throw conversionFailure(value, name, kind, null);

		try {
			if (value instanceof String string)
				return convertString(string);

			return convertNonString(value);
		} catch (IllegalArgumentException | ValueConversionException e) {
			throw conversionFailure(value, name, kind, e);
		}
	}

	/**
	 * Does {@code value} already satisfy the declared type?
	 *
	 * @param value the value to check
	 * @return {@code true} if {@link #convert(Object)} would return {@code value} unchanged
	 */
	public boolean noConversionNeeded(@Nullable Object value) {
		Type type = getTypeDescriptor().getType().orElse(null);

		if (type instanceof Class<?> typeClass)
			return Utilities.boxedType(typeClass).isInstance(value);

		return false;
	}

	/**
	 * Fails if the declared type, or any type nested inside it, is unrecognized.
	 *
	 * @throws UnrecognizedTypeException if an unrecognized type is found
	 */
	public void validate() {
		validateNested(getNested());
	}

	protected void validateNested(@NonNull Collection<@NonNull TypeConverter> nested) {
		requireNonNull(nested);

		for (TypeConverter typeConverter : nested)
			typeConverter.validate();
	}

	/**
	 * Whether a converter strategy was found for the declared type.
	 *
	 * @return {@code false} only for the unknown-type placeholder
	 */
	public boolean isRecognized() {
		return true;
	}

	/**
	 * Runtime types this converter attempts to convert from. {@code Void.class} stands for {@code null}.
	 *
	 * @return the accepted value types
	 */
	@NonNull
	public Set<@NonNull Class<?>> getValueTypes() {
		return Set.of(String.class);
	}

	protected boolean acceptsValue(@Nullable Object value) {
		for (Class<?> valueType : getValueTypes())
			if (value == null ? valueType == Void.class : valueType.isInstance(value))
				return true;

		return false;
	}

	/**
	 * Converts text to the declared type.
	 *
	 * @param value the text
	 * @return the converted value
	 * @throws IllegalArgumentException  if the text cannot be converted. The message, if any, becomes the error detail
	 * @throws ValueConversionException if a nested conversion fails
	 */
	@Nullable
	protected abstract Object convertString(@NonNull String value) throws ValueConversionException;

	/**
	 * Converts a non-text value of one of the {@link #getValueTypes()} to the declared type.
	 * Converters that accept anything other than text override this.
	 *
	 * @param value the value
	 * @return the converted value
	 * @throws IllegalArgumentException  if the value cannot be converted
	 * @throws ValueConversionException if a nested conversion fails
	 */
	@Nullable
	protected Object convertNonString(@Nullable Object value) throws ValueConversionException {
		throw new IllegalArgumentException();
	}

	@NonNull
	protected ValueConversionException conversionFailure(@Nullable Object value,
																											 @Nullable String name,
																											 @NonNull String kind,
																											 @Nullable Exception cause) {
		requireNonNull(kind);

		String valueType = value instanceof String ? "" : format(" (%s)", Utilities.typeName(value));
		String valueDescription = Utilities.safeString(value);
		String capitalizedKind = isLowerCase(kind) ? kind.substring(0, 1).toUpperCase(Locale.ENGLISH) + kind.substring(1) : kind;
		String detail = cause == null ? null : cause.getMessage();
		String ending = detail == null || detail.length() == 0 ? "." : ": " + detail;
		String cannotBeConverted = format("cannot be converted to %s%s", getTypeName(), ending);

		String message = name == null
				? format("%s '%s'%s %s", capitalizedKind, valueDescription, valueType, cannotBeConverted)
				: format("%s '%s' got value '%s'%s that %s", capitalizedKind, name, valueDescription, valueType, cannotBeConverted);

		return new ValueConversionException(message, cause, value, getTypeName(), name, kind);
	}

	private static boolean isLowerCase(@NonNull String string) {
		boolean cased = false;

		for (int i = 0; i < string.length(); i++) {
			char c = string.charAt(i);

			if (Character.isUpperCase(c) || Character.isTitleCase(c))
				return false;

			if (Character.isLowerCase(c))
				cased = true;
		}

		return cased;
	}

	/**
	 * Evaluates text as a literal expression which must produce an instance of {@code expectedType}.
	 *
	 * @param value        the text
	 * @param expectedType the expected container type
	 * @param expectedName name of the expected kind for messages, e.g. {@code "list"}
	 * @return the evaluated value
	 * @throws IllegalArgumentException if the text is not a valid expression or yields the wrong kind of value
	 */
	@NonNull
	protected <T> T literalEval(@NonNull String value,
															@NonNull Class<T> expectedType,
															@NonNull String expectedName) {
		requireNonNull(value);
		requireNonNull(expectedType);
		requireNonNull(expectedName);

		// There's no literal syntax for an empty set
		if (expectedType == Set.class && value.equals("set()"))
			return expectedType.cast(new LinkedHashSet<>());

		Object evaluated = LiteralEvaluator.evaluate(value);

		if (!expectedType.isInstance(evaluated))
			throw new IllegalArgumentException(format("Value is %s, not %s.", Utilities.typeName(evaluated), expectedName));

		return expectedType.cast(evaluated);
	}

	@NonNull
	protected String removeNumberSeparators(@NonNull String value) {
		requireNonNull(value);

		if (value.indexOf(' ') >= 0)
			value = value.replace(" ", "");
		if (value.indexOf('_') >= 0)
			value = value.replace("_", "");

		return value;
	}

	/**
	 * The boolean vocabulary, created on first use if none was supplied.
	 *
	 * @return the vocabulary
	 */
	@NonNull
	protected Vocabulary getVocabulary() {
		if (this.vocabulary == null)
			this.vocabulary = DefaultVocabulary.withDefaults();

		return this.vocabulary;
	}

	@NonNull
	public TypeDescriptor getTypeDescriptor() {
		return this.typeDescriptor;
	}

	/**
	 * Converters for the declared type's nested types.
	 *
	 * @return the nested converters, in declaration order
	 */
	@NonNull
	public List<@NonNull TypeConverter> getNested() {
		return this.nested;
	}

	/**
	 * Human-readable name of the declared type, used in error messages.
	 *
	 * @return the type name
	 */
	@NonNull
	public String getTypeName() {
		return this.typeName;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{typeName=%s}", getClass().getSimpleName(), getTypeName());
	}
}
