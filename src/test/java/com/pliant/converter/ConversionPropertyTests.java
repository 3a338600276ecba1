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
import com.pliant.Tuple;
import com.pliant.TypeDescriptor;
import com.pliant.TypeReference;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ConversionPropertyTests {
	@ParameterizedTest
	@MethodSource("scalarArguments")
	public void scalarConversionIsIdempotent(@NonNull TypeDescriptor typeDescriptor,
																					 @Nullable Object value) throws ValueConversionException {
		TypeConverter typeConverter = TypeConverterRegistry.converterFor(typeDescriptor);

		Object converted = typeConverter.convert(value);
		Object convertedAgain = typeConverter.convert(converted);

		assertTrue(Objects.deepEquals(converted, convertedAgain),
				() -> String.format("%s: %s became %s", typeDescriptor, converted, convertedAgain));
	}

	static Stream<Arguments> scalarArguments() {
		return Stream.of(
				Arguments.of(TypeDescriptor.of(Object.class), "x"),
				Arguments.of(TypeDescriptor.of(String.class), 5),
				Arguments.of(TypeDescriptor.of(Boolean.class), "yes"),
				Arguments.of(TypeDescriptor.of(Boolean.class), "maybe"),
				Arguments.of(TypeDescriptor.of(Integer.class), "0x1F"),
				Arguments.of(TypeDescriptor.of(Integer.class), 3.0),
				Arguments.of(TypeDescriptor.of(Long.class), "1_000"),
				Arguments.of(TypeDescriptor.of(Short.class), "12"),
				Arguments.of(TypeDescriptor.of(BigInteger.class), "1e30"),
				Arguments.of(TypeDescriptor.of(Double.class), "1.5"),
				Arguments.of(TypeDescriptor.of(Double.class), 7),
				Arguments.of(TypeDescriptor.of(Float.class), "inf"),
				Arguments.of(TypeDescriptor.of(BigDecimal.class), "1.10"),
				Arguments.of(TypeDescriptor.of(BigDecimal.class), 0.1),
				Arguments.of(TypeDescriptor.of(byte[].class), "ab"),
				Arguments.of(TypeDescriptor.of(ByteBuffer.class), "ab"),
				Arguments.of(TypeDescriptor.of(Path.class), "/tmp/x"),
				Arguments.of(TypeDescriptor.of(LocalDateTime.class), "2024-09-30 10:07:42"),
				Arguments.of(TypeDescriptor.of(LocalDate.class), "2024-09-30"),
				Arguments.of(TypeDescriptor.of(Duration.class), "1h 30m"),
				Arguments.of(TypeDescriptor.of(Void.class), "None"),
				Arguments.of(TypeDescriptor.of(Level.class), "high")
		);
	}

	@ParameterizedTest
	@MethodSource("containerArguments")
	public void containerLiteralsRoundTrip(@NonNull TypeDescriptor typeDescriptor,
																				 @NonNull Object container) throws ValueConversionException {
		String text = literal(container);
		Object converted = TypeConverterRegistry.converterFor(typeDescriptor).convert(text);

		assertEquals(container, converted, () -> String.format("%s from %s", typeDescriptor, text));
	}

	static Stream<Arguments> containerArguments() {
		Map<String, List<Integer>> nested = new LinkedHashMap<>();
		nested.put("a", List.of(1, 2));
		nested.put("b", List.of());

		return Stream.of(
				Arguments.of(TypeDescriptor.of(new TypeReference<List<Integer>>() {}), List.of(1, 2, 3)),
				Arguments.of(TypeDescriptor.of(new TypeReference<List<String>>() {}), List.of("a", "it's", "back\\slash")),
				Arguments.of(TypeDescriptor.of(List.class), Arrays.asList(1, "a", true, null, 2.5)),
				Arguments.of(TypeDescriptor.parameterized(Tuple.class, TypeDescriptor.of(Integer.class), TypeDescriptor.of(String.class)),
						Tuple.of(1, "a")),
				Arguments.of(TypeDescriptor.parameterized(Tuple.class, TypeDescriptor.of(Integer.class), TypeDescriptor.ellipsis()),
						Tuple.of(7)),
				Arguments.of(TypeDescriptor.of(Tuple.class), Tuple.empty()),
				Arguments.of(TypeDescriptor.of(new TypeReference<Set<Integer>>() {}), new LinkedHashSet<>(List.of(1, 2))),
				Arguments.of(TypeDescriptor.of(new TypeReference<Set<Integer>>() {}), Set.of()),
				Arguments.of(TypeDescriptor.parameterized(ImmutableSet.class, TypeDescriptor.of(String.class)), ImmutableSet.of("x", "y")),
				Arguments.of(TypeDescriptor.of(new TypeReference<Map<String, List<Integer>>>() {}), nested),
				Arguments.of(TypeDescriptor.of(new TypeReference<Map<Integer, Boolean>>() {}), Map.of(1, true))
		);
	}

	// Renders a native value as literal expression text
	@NonNull
	private static String literal(@Nullable Object value) {
		if (value == null)
			return "None";
		if (value instanceof Boolean bool)
			return bool ? "True" : "False";
		if (value instanceof String string)
			return "'" + string.replace("\\", "\\\\").replace("'", "\\'") + "'";
		if (value instanceof List<?> list)
			return list.stream().map(ConversionPropertyTests::literal).collect(Collectors.joining(", ", "[", "]"));
		if (value instanceof Tuple tuple)
			return tuple.size() == 1 ? "(" + literal(tuple.get(0)) + ",)"
					: tuple.asList().stream().map(ConversionPropertyTests::literal).collect(Collectors.joining(", ", "(", ")"));
		if (value instanceof Set<?> set)
			return set.isEmpty() ? "set()"
					: set.stream().map(ConversionPropertyTests::literal).collect(Collectors.joining(", ", "{", "}"));
		if (value instanceof Map<?, ?> map)
			return map.entrySet().stream()
					.map(entry -> literal(entry.getKey()) + ": " + literal(entry.getValue()))
					.collect(Collectors.joining(", ", "{", "}"));

		return value.toString();
	}

	private enum Level {
		LOW,
		HIGH
	}
}
