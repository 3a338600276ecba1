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
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;

import static com.pliant.TypeDescriptor.of;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class UnionConverterTests {
	@Test
	public void optionalInteger() throws ValueConversionException {
		TypeConverter typeConverter = TypeConverterRegistry.converterFor(TypeDescriptor.union(of(Integer.class), of(Void.class)));

		assertEquals("integer or None", typeConverter.getTypeName());
		assertEquals(5, typeConverter.convert("5"));
		assertEquals(5, typeConverter.convert(5));
		assertNull(typeConverter.convert("None"));
		assertNull(typeConverter.convert(null));

		ValueConversionException e = assertThrows(ValueConversionException.class, () -> typeConverter.convert("abc"));
		assertEquals("Argument 'abc' cannot be converted to integer or None.", e.getMessage());
	}

	@Test
	public void membersAreTriedInOrder() throws ValueConversionException {
		assertEquals(5, TypeConverterRegistry.converterFor(TypeDescriptor.union(of(Integer.class), of(Boolean.class))).convert("5"));
		assertEquals(true, TypeConverterRegistry.converterFor(TypeDescriptor.union(of(Integer.class), of(Boolean.class))).convert("yes"));
		// Unrecognized text is returned unchanged by the boolean converter, so integer is never tried
		assertEquals("5", TypeConverterRegistry.converterFor(TypeDescriptor.union(of(Boolean.class), of(Integer.class))).convert("5"));
		assertEquals(1.5, TypeConverterRegistry.converterFor(TypeDescriptor.union(of(Integer.class), of(Double.class))).convert("1.5"));
	}

	@Test
	public void valuesAlreadyMatchingAMemberAreNotConverted() throws ValueConversionException {
		assertEquals("5", TypeConverterRegistry.converterFor(TypeDescriptor.union(of(Integer.class), of(String.class))).convert("5"));
		assertEquals(2.5, TypeConverterRegistry.converterFor(TypeDescriptor.union(of(String.class), of(Double.class))).convert(2.5));
	}

	@Test
	public void typeNamesJoinMembers() {
		TypeConverter typeConverter = TypeConverterRegistry.converterFor(TypeDescriptor.union(
				TypeDescriptor.parameterized(List.class, of(Integer.class)), of(Boolean.class), of(Void.class)));

		assertEquals("List<Integer>, boolean or None", typeConverter.getTypeName());
	}

	@Test
	public void unrecognizedMembersLetValuesThrough() throws ValueConversionException {
		TypeConverter typeConverter = TypeConverterRegistry.converterFor(TypeDescriptor.union(of(Integer.class), of(Thread.class)));

		assertEquals(5, typeConverter.convert("5"));
		assertEquals("abc", typeConverter.convert("abc"));
		assertThrows(UnrecognizedTypeException.class, typeConverter::validate);
	}
}
