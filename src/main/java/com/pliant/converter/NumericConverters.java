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
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Converters for integers, floating point numbers and decimals.
 * <p>
 * Spaces and underscores are accepted as digit separators in text, so {@code "1 000 000"} and {@code "1_000"}
 * are valid numbers.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
final class NumericConverters {
	@NonNull
	private static final String PRECISION_LOSS_MESSAGE = "Conversion would lose precision.";
	@NonNull
	private static final String OUT_OF_RANGE_MESSAGE = "Value is out of range.";
	// Same limit as Python's default int digit limit
	private static final int MAXIMUM_BIG_INTEGER_DIGITS = 4_300;

	private NumericConverters() {
		// Non-instantiable
	}

	@NonNull
	private static Class<?> declaredClass(@NonNull TypeConverter typeConverter,
																				@NonNull Class<?> defaultClass) {
		Type type = typeConverter.getTypeDescriptor().getType().orElse(null);
		return type instanceof Class<?> typeClass ? Utilities.boxedType(typeClass) : defaultClass;
	}

	/**
	 * Integers in base 10, or in base 16, 8 or 2 with a {@code 0x}, {@code 0o} or {@code 0b} prefix.
	 * Base 10 text such as {@code "1.0"} or {@code "1e3"} is accepted if it denotes a whole number.
	 */
	@NotThreadSafe
	static final class IntegerConverter extends TypeConverter {
		IntegerConverter(@NonNull TypeDescriptor typeDescriptor,
										 @NonNull List<@NonNull TypeConverter> nested,
										 @Nullable Vocabulary vocabulary) {
			super(typeDescriptor, nested, vocabulary, typeNameFor("integer", typeDescriptor, nested));
		}

		@Override
		@NonNull
		public Set<@NonNull Class<?>> getValueTypes() {
			return Set.of(String.class, Number.class);
		}

		@Override
		@NonNull
		protected Object convertString(@NonNull String value) {
			String normalized = removeNumberSeparators(value).toLowerCase(Locale.ENGLISH);
			int radix = 10;

			for (String prefix : List.of("0x", "0o", "0b")) {
				int prefixIndex = normalized.indexOf(prefix);

				if (prefixIndex < 0 || normalized.indexOf(prefix, prefixIndex + 1) >= 0)
					continue;

				String sign = normalized.substring(0, prefixIndex);

				if (sign.equals("") || sign.equals("-") || sign.equals("+")) {
					normalized = sign + normalized.substring(prefixIndex + prefix.length());
					radix = prefix.equals("0x") ? 16 : prefix.equals("0o") ? 8 : 2;
					break;
				}
			}

			try {
				return narrow(new BigInteger(normalized, radix));
			} catch (NumberFormatException e) {
				if (radix != 10)
					throw new IllegalArgumentException();
			}

			BigDecimal decimal;

			try {
				decimal = new BigDecimal(normalized);
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException();
			}

			return narrow(toBigIntegerExact(decimal));
		}

		@Override
		@NonNull
		protected Object convertNonString(@Nullable Object value) {
			if (value instanceof BigInteger bigInteger)
				return narrow(bigInteger);
			if (value instanceof BigDecimal bigDecimal)
				return narrow(toBigIntegerExact(bigDecimal));
			if (value instanceof Double || value instanceof Float) {
				double doubleValue = ((Number) value).doubleValue();

				if (!Double.isFinite(doubleValue))
					throw new IllegalArgumentException(PRECISION_LOSS_MESSAGE);

				return narrow(toBigIntegerExact(new BigDecimal(doubleValue)));
			}
			if (value instanceof Number number)
				return narrow(toBigIntegerExact(new BigDecimal(number.toString())));

			throw new IllegalArgumentException();
		}

		@NonNull
		private BigInteger toBigIntegerExact(@NonNull BigDecimal decimal) {
			// Checked on the exponent first so "1e200000000" is never expanded
			if (decimal.signum() != 0) {
				long integerDigits = (long) decimal.precision() - decimal.scale();

				if (integerDigits <= 0)
					throw new IllegalArgumentException(PRECISION_LOSS_MESSAGE);
				if (integerDigits > maximumIntegerDigits())
					throw new IllegalArgumentException(OUT_OF_RANGE_MESSAGE);
			}

			try {
				return decimal.toBigIntegerExact();
			} catch (ArithmeticException e) {
				throw new IllegalArgumentException(PRECISION_LOSS_MESSAGE);
			}
		}

		// Fits the value into the declared integer class
		@NonNull
		private Number narrow(@NonNull BigInteger value) {
			Class<?> declaredClass = declaredClass(this, Integer.class);

			try {
				if (declaredClass == Integer.class)
					return value.intValueExact();
				if (declaredClass == Long.class)
					return value.longValueExact();
				if (declaredClass == Short.class)
					return value.shortValueExact();
				if (declaredClass == Byte.class)
					return value.byteValueExact();
			} catch (ArithmeticException e) {
				throw new IllegalArgumentException(OUT_OF_RANGE_MESSAGE);
			}

			return value;
		}

		private int maximumIntegerDigits() {
			Class<?> declaredClass = declaredClass(this, Integer.class);

			if (declaredClass == Integer.class)
				return 10;
			if (declaredClass == Long.class)
				return 19;
			if (declaredClass == Short.class)
				return 5;
			if (declaredClass == Byte.class)
				return 3;

			return MAXIMUM_BIG_INTEGER_DIGITS;
		}
	}

	/**
	 * Also used for other {@link Number} types, which are converted to {@link Double}.
	 */
	@NotThreadSafe
	static final class FloatConverter extends TypeConverter {
		@NonNull
		private static final Pattern FLOAT_PATTERN;

		static {
			FLOAT_PATTERN = Pattern.compile("^[-+]?((\\d+\\.?\\d*|\\.\\d+)(e[-+]?\\d+)?|inf|infinity|nan)$");
		}

		FloatConverter(@NonNull TypeDescriptor typeDescriptor,
									 @NonNull List<@NonNull TypeConverter> nested,
									 @Nullable Vocabulary vocabulary) {
			super(typeDescriptor, nested, vocabulary, typeNameFor("float", typeDescriptor, nested));
		}

		@Override
		@NonNull
		public Set<@NonNull Class<?>> getValueTypes() {
			return Set.of(String.class, Number.class);
		}

		@Override
		@NonNull
		protected Object convertString(@NonNull String value) {
			String normalized = removeNumberSeparators(value).toLowerCase(Locale.ENGLISH);

			if (!FLOAT_PATTERN.matcher(normalized).matches())
				throw new IllegalArgumentException();

			boolean negative = normalized.startsWith("-");
			String unsigned = normalized.startsWith("-") || normalized.startsWith("+") ? normalized.substring(1) : normalized;
			double doubleValue;

			if (unsigned.equals("inf") || unsigned.equals("infinity"))
				doubleValue = negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
			else if (unsigned.equals("nan"))
				doubleValue = Double.NaN;
			else
				doubleValue = Double.parseDouble(normalized);

			return narrow(doubleValue);
		}

		@Override
		@NonNull
		protected Object convertNonString(@Nullable Object value) {
			return narrow(((Number) value).doubleValue());
		}

		@NonNull
		private Number narrow(double value) {
			return declaredClass(this, Double.class) == Float.class ? (Number) (float) value : (Number) value;
		}
	}

	/**
	 * Floating point input is converted using its shortest decimal representation, so {@code 0.1} becomes
	 * {@code 0.1} rather than its exact binary expansion.
	 */
	@NotThreadSafe
	static final class DecimalConverter extends TypeConverter {
		DecimalConverter(@NonNull TypeDescriptor typeDescriptor,
										 @NonNull List<@NonNull TypeConverter> nested,
										 @Nullable Vocabulary vocabulary) {
			super(typeDescriptor, nested, vocabulary, typeNameFor("decimal", typeDescriptor, nested));
		}

		@Override
		@NonNull
		public Set<@NonNull Class<?>> getValueTypes() {
			return Set.of(String.class, Number.class);
		}

		@Override
		@NonNull
		protected Object convertString(@NonNull String value) {
			try {
				return new BigDecimal(removeNumberSeparators(value));
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException();
			}
		}

		@Override
		@NonNull
		protected Object convertNonString(@Nullable Object value) {
			if (value instanceof BigInteger bigInteger)
				return new BigDecimal(bigInteger);
			if (value instanceof Double || value instanceof Float) {
				double doubleValue = ((Number) value).doubleValue();

				if (!Double.isFinite(doubleValue))
					throw new IllegalArgumentException();

				return BigDecimal.valueOf(doubleValue);
			}
			if (value instanceof Number number) {
				try {
					return new BigDecimal(number.toString());
				} catch (NumberFormatException e) {
					throw new IllegalArgumentException();
				}
			}

			throw new IllegalArgumentException();
		}
	}
}
