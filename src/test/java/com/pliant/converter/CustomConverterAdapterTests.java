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
import com.pliant.TypeReference;
import com.pliant.custom.AbstractCustomConverter;
import com.pliant.custom.CustomConverter;
import com.pliant.custom.CustomConverterRegistry;
import com.pliant.custom.FromStringCustomConverter;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class CustomConverterAdapterTests {
	@Test
	public void convertsWithCustomConverter() throws ValueConversionException {
		TypeConverter typeConverter = moneyConverter();

		assertEquals("Money", typeConverter.getTypeName());
		assertEquals(new Money(1250), typeConverter.convert("12.50"));

		Money money = new Money(1);
		assertSame(money, typeConverter.convert(money));
	}

	@Test
	public void valuesOutsideValueTypesAreRejected() {
		ValueConversionException e = assertThrows(ValueConversionException.class, () -> moneyConverter().convert(12));
		assertEquals("Argument '12' (integer) cannot be converted to Money.", e.getMessage());
	}

	@Test
	public void illegalArgumentMessagesAreReported() {
		ValueConversionException e = assertThrows(ValueConversionException.class, () -> moneyConverter().convert("lots", "price"));
		assertEquals("Argument 'price' got value 'lots' that cannot be converted to Money: Not an amount.", e.getMessage());
	}

	@Test
	public void otherExceptionsAreReportedGenerically() {
		CustomConverter<String, Money> failingConverter = new FromStringCustomConverter<>() {
			@Override
			@NonNull
			public Optional<Money> convert(@Nullable String from) throws IOException {
				throw new IOException("Ledger unavailable");
			}
		};

		TypeConverter typeConverter = TypeConverterRegistry.converterFor(TypeDescriptor.of(Money.class),
				CustomConverterRegistry.of(failingConverter));

		ValueConversionException e = assertThrows(ValueConversionException.class, () -> typeConverter.convert("1"));
		assertEquals("Argument '1' cannot be converted to Money.", e.getMessage());
		assertInstanceOf(IllegalArgumentException.class, e.getCause());
	}

	@Test
	public void emptyResultMeansNone() throws ValueConversionException {
		CustomConverter<String, Money> emptyConverter = new FromStringCustomConverter<>() {
			@Override
			@NonNull
			public Optional<Money> convert(@Nullable String from) {
				return Optional.empty();
			}
		};

		assertNull(TypeConverterRegistry.converterFor(TypeDescriptor.of(Money.class),
				CustomConverterRegistry.of(emptyConverter)).convert("anything"));
	}

	@Test
	public void objectFromTypeAcceptsAnyValue() throws ValueConversionException {
		CustomConverter<Object, Money> anyConverter = new AbstractCustomConverter<>() {
			@Override
			@NonNull
			public Optional<Money> convert(@Nullable Object from) {
				return Optional.of(new Money(from == null ? 0 : from.toString().length()));
			}
		};

		TypeConverter typeConverter = TypeConverterRegistry.converterFor(TypeDescriptor.of(Money.class),
				CustomConverterRegistry.of(anyConverter));

		assertEquals(Set.of(), typeConverter.getValueTypes());
		assertEquals(new Money(3), typeConverter.convert(List.of(1)));
		assertEquals(new Money(0), typeConverter.convert(null));
	}

	@Test
	public void customNamesAndDocumentation() {
		CustomConverter<String, Money> documentedConverter = new FromStringCustomConverter<>() {
			@Override
			@NonNull
			public Optional<Money> convert(@Nullable String from) {
				return Optional.of(new Money(0));
			}

			@Override
			@NonNull
			public String getName() {
				return "amount";
			}

			@Override
			@NonNull
			public Optional<String> getDocumentation() {
				return Optional.of("Amounts such as `12.50`.");
			}
		};

		CustomConverterAdapter typeConverter = (CustomConverterAdapter) TypeConverterRegistry.converterFor(
				TypeDescriptor.of(Money.class), CustomConverterRegistry.of(documentedConverter));

		assertEquals("amount", typeConverter.getTypeName());
		assertEquals("Amounts such as `12.50`.", typeConverter.getDocumentation().orElse(null));
		assertSame(documentedConverter, typeConverter.getCustomConverter());
	}

	@Test
	public void nestedTypesOfCustomTypesUseBuiltInConverters() throws ValueConversionException {
		CustomConverter<String, Integer> lengthConverter = new FromStringCustomConverter<>() {
			@Override
			@NonNull
			public Optional<Integer> convert(@Nullable String from) {
				return Optional.of(from.length());
			}
		};

		CustomConverterRegistry customConverterRegistry = CustomConverterRegistry.of(lengthConverter, new WalletConverter());
		TypeConverter typeConverter = TypeConverterRegistry.converterFor(TypeDescriptor.of(new TypeReference<Wallet<Integer>>() {}),
				customConverterRegistry);

		assertInstanceOf(CustomConverterAdapter.class, typeConverter);
		assertInstanceOf(NumericConverters.IntegerConverter.class, typeConverter.getNested().get(0));

		// Custom converters still apply to nested types of built-in types
		TypeConverter listConverter = TypeConverterRegistry.converterFor(TypeDescriptor.of(new TypeReference<List<Integer>>() {}),
				customConverterRegistry);

		assertInstanceOf(CustomConverterAdapter.class, listConverter.getNested().get(0));
		assertEquals(List.of(2, 3, 7), listConverter.convert("['ab', 'abc', 7]"));
	}

	@NonNull
	private static TypeConverter moneyConverter() {
		return TypeConverterRegistry.converterFor(TypeDescriptor.of(Money.class), CustomConverterRegistry.of(new MoneyConverter()));
	}

	public record Money(long cents) {}

	public record Wallet<T>(T owner) {}

	@ThreadSafe
	private static class MoneyConverter extends FromStringCustomConverter<Money> {
		@Override
		@NonNull
		public Optional<Money> convert(@Nullable String from) {
			try {
				return Optional.of(new Money(new BigDecimal(from).movePointRight(2).longValueExact()));
			} catch (NumberFormatException | ArithmeticException e) {
				throw new IllegalArgumentException("Not an amount.", e);
			}
		}
	}

	@ThreadSafe
	@SuppressWarnings("rawtypes")
	private static class WalletConverter extends FromStringCustomConverter<Wallet> {
		@Override
		@NonNull
		public Optional<Wallet> convert(@Nullable String from) {
			return Optional.of(new Wallet<>(from));
		}
	}
}
