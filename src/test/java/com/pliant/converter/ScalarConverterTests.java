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
import org.jspecify.annotations.NonNull;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.io.File;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ScalarConverterTests {
	@Test
	public void anyAcceptsEverythingUnchanged() throws ValueConversionException {
		TypeConverter typeConverter = converterFor(Object.class);
		Object value = new Object();

		assertEquals("Any", typeConverter.getTypeName());
		assertSame(value, typeConverter.convert(value));
		assertEquals("text", typeConverter.convert("text"));
		assertNull(typeConverter.convert(null));
	}

	@Test
	public void stringConversion() throws ValueConversionException {
		TypeConverter typeConverter = converterFor(String.class);

		assertEquals("string", typeConverter.getTypeName());
		assertEquals("hello", typeConverter.convert("hello"));
		assertEquals("5", typeConverter.convert(5));
		assertEquals("None", typeConverter.convert(null));
		assertEquals("café", typeConverter.convert("café".getBytes(StandardCharsets.ISO_8859_1)));
	}

	@Test
	public void booleanVocabulary() throws ValueConversionException {
		TypeConverter typeConverter = converterFor(Boolean.class);

		assertEquals("boolean", typeConverter.getTypeName());
		assertEquals(true, typeConverter.convert("True"));
		assertEquals(true, typeConverter.convert("yes"));
		assertEquals(true, typeConverter.convert("ON"));
		assertEquals(true, typeConverter.convert("1"));
		assertEquals(false, typeConverter.convert("false"));
		assertEquals(false, typeConverter.convert("oFF"));
		assertEquals(false, typeConverter.convert("0"));
		assertEquals(false, typeConverter.convert(""));
		assertNull(typeConverter.convert("none"));
		assertEquals(false, typeConverter.convert(false));
	}

	@Test
	public void booleanLeavesUnrecognizedValuesUnchanged() throws ValueConversionException {
		TypeConverter typeConverter = converterFor(Boolean.class);

		assertEquals("maybe", typeConverter.convert("maybe"));
		assertEquals(1, typeConverter.convert(1));
		assertNull(typeConverter.convert(null));
	}

	@Test
	public void booleanRejectsOtherValueTypes() {
		ValueConversionException e = assertThrows(ValueConversionException.class,
				() -> converterFor(Boolean.class).convert(List.of()));

		assertEquals("Argument '[]' (list) cannot be converted to boolean.", e.getMessage());
	}

	@Test
	public void booleanWithAdditionalLanguages() throws ValueConversionException {
		TypeConverter typeConverter = TypeConverterRegistry.converterFor(TypeDescriptor.of(Boolean.class), null,
				DefaultVocabulary.forLanguages("fi", "de"));

		assertEquals(true, typeConverter.convert("kyllä"));
		assertEquals(false, typeConverter.convert("NEIN"));
		assertEquals(true, typeConverter.convert("yes"));

		// Finnish words are not known unless requested
		assertEquals("kyllä", converterFor(Boolean.class).convert("kyllä"));
	}

	@Test
	public void unsupportedConfiguredLanguageIsAConfigurationError() {
		String previous = System.getProperty(DefaultVocabulary.LANGUAGES_SYSTEM_PROPERTY_NAME);

		try {
			System.setProperty(DefaultVocabulary.LANGUAGES_SYSTEM_PROPERTY_NAME, "xx");

			IllegalStateException e = assertThrows(IllegalStateException.class,
					() -> converterFor(Boolean.class).convert("yes"));
			assertTrue(e.getMessage().startsWith("Invalid value 'xx' for system property 'pliant.languages'."), e.getMessage());
		} finally {
			if (previous == null)
				System.clearProperty(DefaultVocabulary.LANGUAGES_SYSTEM_PROPERTY_NAME);
			else
				System.setProperty(DefaultVocabulary.LANGUAGES_SYSTEM_PROPERTY_NAME, previous);
		}
	}

	@Test
	public void bytesFromText() throws ValueConversionException {
		TypeConverter typeConverter = converterFor(byte[].class);

		assertEquals("bytes", typeConverter.getTypeName());
		assertArrayEquals(new byte[]{'a', 'b', 'c'}, (byte[]) typeConverter.convert("abc"));
		assertArrayEquals(new byte[]{(byte) 0xE9}, (byte[]) typeConverter.convert("é"));
	}

	@Test
	public void bytesRejectNonLatin1Characters() {
		ValueConversionException e = assertThrows(ValueConversionException.class,
				() -> converterFor(byte[].class).convert("ab€"));

		assertEquals("Argument 'ab€' cannot be converted to bytes: Character '€' at index 2 cannot be mapped to a byte.",
				e.getMessage());
	}

	@Test
	public void bytesFromByteBufferLeaveBufferUntouched() throws ValueConversionException {
		ByteBuffer byteBuffer = ByteBuffer.wrap(new byte[]{1, 2, 3});

		assertArrayEquals(new byte[]{1, 2, 3}, (byte[]) converterFor(byte[].class).convert(byteBuffer));
		assertEquals(0, byteBuffer.position());
	}

	@Test
	public void byteBufferConversion() throws ValueConversionException {
		TypeConverter typeConverter = converterFor(ByteBuffer.class);
		byte[] bytes = new byte[]{1, 2};

		assertEquals("byte buffer", typeConverter.getTypeName());
		assertEquals(ByteBuffer.wrap(new byte[]{'h', 'i'}), typeConverter.convert("hi"));

		ByteBuffer converted = (ByteBuffer) typeConverter.convert(bytes);
		bytes[0] = 9;

		// Input arrays are copied
		assertEquals(ByteBuffer.wrap(new byte[]{1, 2}), converted);
	}

	@Test
	public void pathConversion() throws ValueConversionException {
		TypeConverter typeConverter = converterFor(Path.class);
		Path path = Path.of("/tmp/data");

		assertEquals("Path", typeConverter.getTypeName());
		assertEquals(path, typeConverter.convert("/tmp/data"));
		assertSame(path, typeConverter.convert(path));
		assertEquals(path, typeConverter.convert(new File("/tmp/data")));
	}

	@Test
	public void noneConversion() throws ValueConversionException {
		TypeConverter typeConverter = converterFor(Void.class);

		assertEquals("None", typeConverter.getTypeName());
		assertNull(typeConverter.convert("None"));
		assertNull(typeConverter.convert("NONE"));
		assertNull(typeConverter.convert("none"));
		assertNull(typeConverter.convert(null));

		ValueConversionException e = assertThrows(ValueConversionException.class, () -> typeConverter.convert("null"));
		assertEquals("Argument 'null' cannot be converted to None.", e.getMessage());
	}

	@NonNull
	private static TypeConverter converterFor(@NonNull Class<?> type) {
		return TypeConverterRegistry.converterFor(TypeDescriptor.of(type));
	}
}
