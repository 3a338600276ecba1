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

import com.pliant.IntegerBackedEnum;
import com.pliant.TypeDescriptor;
import org.jspecify.annotations.NonNull;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class EnumConverterTests {
	@Test
	public void membersByName() throws ValueConversionException {
		TypeConverter typeConverter = converterFor(Color.class);

		assertEquals("Color", typeConverter.getTypeName());
		assertSame(Color.RED, typeConverter.convert("RED"));
		assertSame(Color.RED, typeConverter.convert("red"));
		assertSame(Color.LIGHT_BLUE, typeConverter.convert("light blue"));
		assertSame(Color.LIGHT_BLUE, typeConverter.convert("Light-Blue"));
		assertSame(Color.GREEN, typeConverter.convert(Color.GREEN));
	}

	@Test
	public void unknownMembers() {
		ValueConversionException e = assertThrows(ValueConversionException.class, () -> converterFor(Color.class).convert("purple"));

		assertEquals("Argument 'purple' cannot be converted to Color: "
				+ "Color does not have member 'purple'. Available: 'GREEN', 'LIGHT_BLUE' and 'RED'", e.getMessage());
	}

	@Test
	public void exactNameWinsOverAmbiguousNormalizedMatch() throws ValueConversionException {
		TypeConverter typeConverter = converterFor(Shade.class);

		assertSame(Shade.DARK_RED, typeConverter.convert("DARK_RED"));
		assertSame(Shade.DARKRED, typeConverter.convert("DARKRED"));

		ValueConversionException e = assertThrows(ValueConversionException.class, () -> typeConverter.convert("dark red"));
		assertEquals("Argument 'dark red' cannot be converted to Shade: "
				+ "Shade has multiple members matching 'dark red'. Available: 'DARKRED' and 'DARK_RED'", e.getMessage());
	}

	@Test
	public void nonTextIsRejectedForPlainEnums() {
		ValueConversionException e = assertThrows(ValueConversionException.class, () -> converterFor(Color.class).convert(1));
		assertEquals("Argument '1' (integer) cannot be converted to Color.", e.getMessage());
	}

	@Test
	public void integerBackedMembers() throws ValueConversionException {
		TypeConverter typeConverter = converterFor(Priority.class);

		assertSame(Priority.HIGH, typeConverter.convert("high"));
		assertSame(Priority.HIGH, typeConverter.convert("10"));
		assertSame(Priority.HIGH, typeConverter.convert(" 10 "));
		assertSame(Priority.LOW, typeConverter.convert(1));
		assertSame(Priority.LOW, typeConverter.convert(1L));
		assertSame(Priority.LOW, typeConverter.convert(BigInteger.ONE));
	}

	@Test
	public void unknownIntegerBackedMembers() {
		TypeConverter typeConverter = converterFor(Priority.class);

		ValueConversionException e = assertThrows(ValueConversionException.class, () -> typeConverter.convert(5));
		assertEquals("Argument '5' (integer) cannot be converted to Priority: "
				+ "Priority does not have value '5'. Available: '1' and '10'", e.getMessage());

		// Text that is neither a member name nor a member value lists both
		e = assertThrows(ValueConversionException.class, () -> typeConverter.convert("5"));
		assertEquals("Argument '5' cannot be converted to Priority: "
				+ "Priority does not have member '5'. Available: 'HIGH (10)' and 'LOW (1)'", e.getMessage());

		e = assertThrows(ValueConversionException.class, () -> typeConverter.convert("medium"));
		assertEquals("Argument 'medium' cannot be converted to Priority: "
				+ "Priority does not have member 'medium'. Available: 'HIGH (10)' and 'LOW (1)'", e.getMessage());

		// Floats are not integer values
		assertThrows(ValueConversionException.class, () -> typeConverter.convert(1.0));
	}

	@NonNull
	private static TypeConverter converterFor(@NonNull Class<?> type) {
		return TypeConverterRegistry.converterFor(TypeDescriptor.of(type));
	}

	private enum Color {
		RED, GREEN, LIGHT_BLUE
	}

	private enum Shade {
		DARK_RED, DARKRED
	}

	private enum Priority implements IntegerBackedEnum {
		LOW(1),
		HIGH(10);

		private final int value;

		Priority(int value) {
			this.value = value;
		}

		@Override
		public int getValue() {
			return this.value;
		}
	}
}
