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
import java.io.File;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static java.lang.String.format;
import static java.nio.charset.StandardCharsets.ISO_8859_1;

/**
 * Converters for leaf types that have no nested types: {@code Object}, {@link String}, {@link Boolean},
 * {@code byte[]}, {@link ByteBuffer}, {@link Path} and the None type ({@link Void}).
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
final class ScalarConverters {
	private ScalarConverters() {
		// Non-instantiable
	}

	@NonNull
	private static byte[] encodeLatin1(@NonNull String value) {
		byte[] bytes = new byte[value.length()];

		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);

			if (c > 0xFF)
				throw new IllegalArgumentException(format("Character '%s' at index %d cannot be mapped to a byte.",
						value.substring(i, Character.isHighSurrogate(c) && i + 1 < value.length() ? i + 2 : i + 1), i));

			bytes[i] = (byte) c;
		}

		return bytes;
	}

	/**
	 * Declared type {@code Object}: everything is accepted as-is.
	 */
	@NotThreadSafe
	static final class AnyConverter extends TypeConverter {
		AnyConverter(@NonNull TypeDescriptor typeDescriptor,
								 @NonNull List<@NonNull TypeConverter> nested,
								 @Nullable Vocabulary vocabulary) {
			super(typeDescriptor, nested, vocabulary, typeNameFor("Any", typeDescriptor, nested));
		}

		@Override
		public boolean noConversionNeeded(@Nullable Object value) {
			return true;
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
		@NonNull
		protected Object convertString(@NonNull String value) {
			return value;
		}

		@Override
		@Nullable
		protected Object convertNonString(@Nullable Object value) {
			return value;
		}
	}

	@NotThreadSafe
	static final class StringConverter extends TypeConverter {
		StringConverter(@NonNull TypeDescriptor typeDescriptor,
										@NonNull List<@NonNull TypeConverter> nested,
										@Nullable Vocabulary vocabulary) {
			super(typeDescriptor, nested, vocabulary, typeNameFor("string", typeDescriptor, nested));
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
		@NonNull
		protected Object convertString(@NonNull String value) {
			return value;
		}

		@Override
		@NonNull
		protected Object convertNonString(@Nullable Object value) {
			if (value instanceof byte[] bytes)
				return new String(bytes, ISO_8859_1);

			return Utilities.safeString(value);
		}
	}

	/**
	 * Text matching neither the true nor the false vocabulary is returned unchanged, as are numbers.
	 * Callers that need a strict {@link Boolean} check the result type.
	 */
	@NotThreadSafe
	static final class BooleanConverter extends TypeConverter {
		BooleanConverter(@NonNull TypeDescriptor typeDescriptor,
										 @NonNull List<@NonNull TypeConverter> nested,
										 @Nullable Vocabulary vocabulary) {
			super(typeDescriptor, nested, vocabulary, typeNameFor("boolean", typeDescriptor, nested));
		}

		@Override
		@NonNull
		public Set<@NonNull Class<?>> getValueTypes() {
			return Set.of(String.class, Number.class, Void.class);
		}

		@Override
		@Nullable
		protected Object convertString(@NonNull String value) {
			String normalized = Utilities.titleCase(value);

			if (normalized.equals("None"))
				return null;

			Vocabulary vocabulary = getVocabulary();

			if (vocabulary.getTrueStrings().contains(normalized))
				return true;
			if (vocabulary.getFalseStrings().contains(normalized))
				return false;

			return value;
		}

		@Override
		@Nullable
		protected Object convertNonString(@Nullable Object value) {
			return value;
		}
	}

	/**
	 * Text is encoded as Latin-1, so every character code must be at most 255.
	 */
	@NotThreadSafe
	static final class BytesConverter extends TypeConverter {
		BytesConverter(@NonNull TypeDescriptor typeDescriptor,
									 @NonNull List<@NonNull TypeConverter> nested,
									 @Nullable Vocabulary vocabulary) {
			super(typeDescriptor, nested, vocabulary, typeNameFor("bytes", typeDescriptor, nested));
		}

		@Override
		@NonNull
		public Set<@NonNull Class<?>> getValueTypes() {
			return Set.of(String.class, ByteBuffer.class);
		}

		@Override
		@NonNull
		protected Object convertString(@NonNull String value) {
			return encodeLatin1(value);
		}

		@Override
		@NonNull
		protected Object convertNonString(@Nullable Object value) {
			// Leave the caller's buffer position untouched
			ByteBuffer byteBuffer = ((ByteBuffer) value).duplicate();
			byte[] bytes = new byte[byteBuffer.remaining()];
			byteBuffer.get(bytes);
			return bytes;
		}
	}

	@NotThreadSafe
	static final class ByteBufferConverter extends TypeConverter {
		ByteBufferConverter(@NonNull TypeDescriptor typeDescriptor,
												@NonNull List<@NonNull TypeConverter> nested,
												@Nullable Vocabulary vocabulary) {
			super(typeDescriptor, nested, vocabulary, typeNameFor("byte buffer", typeDescriptor, nested));
		}

		@Override
		@NonNull
		public Set<@NonNull Class<?>> getValueTypes() {
			return Set.of(String.class, byte[].class);
		}

		@Override
		@NonNull
		protected Object convertString(@NonNull String value) {
			return ByteBuffer.wrap(encodeLatin1(value));
		}

		@Override
		@NonNull
		protected Object convertNonString(@Nullable Object value) {
			return ByteBuffer.wrap(((byte[]) value).clone());
		}
	}

	@NotThreadSafe
	static final class PathConverter extends TypeConverter {
		PathConverter(@NonNull TypeDescriptor typeDescriptor,
									@NonNull List<@NonNull TypeConverter> nested,
									@Nullable Vocabulary vocabulary) {
			super(typeDescriptor, nested, vocabulary, typeNameFor("Path", typeDescriptor, nested));
		}

		@Override
		@NonNull
		public Set<@NonNull Class<?>> getValueTypes() {
			return Set.of(String.class, Path.class, File.class);
		}

		@Override
		@NonNull
		protected Object convertString(@NonNull String value) {
			return Paths.get(value);
		}

		@Override
		@NonNull
		protected Object convertNonString(@Nullable Object value) {
			if (value instanceof File file)
				return file.toPath();

			return Paths.get(value.toString());
		}
	}

	/**
	 * The None type: only {@code null} and the text {@code NONE} (in any case) are valid.
	 */
	@NotThreadSafe
	static final class NoneConverter extends TypeConverter {
		NoneConverter(@NonNull TypeDescriptor typeDescriptor,
									@NonNull List<@NonNull TypeConverter> nested,
									@Nullable Vocabulary vocabulary) {
			super(typeDescriptor, nested, vocabulary, typeNameFor("None", typeDescriptor, nested));
		}

		@Override
		public boolean noConversionNeeded(@Nullable Object value) {
			return value == null;
		}

		@Override
		@Nullable
		protected Object convertString(@NonNull String value) {
			if (value.toUpperCase(Locale.ENGLISH).equals("NONE"))
				return null;

			throw new IllegalArgumentException();
		}
	}
}
