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

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Locale.ENGLISH;
import static java.util.Objects.requireNonNull;

/**
 * A non-instantiable collection of utility methods.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Utilities {
	@NonNull
	private static final Map<@NonNull Class<?>, @NonNull Class<?>> PRIMITIVE_TYPES_TO_NONPRIMITIVE_EQUIVALENTS;
	@NonNull
	private static final Pattern HEAD_WHITESPACE_PATTERN;
	@NonNull
	private static final Pattern TAIL_WHITESPACE_PATTERN;

	static {
		// See https://docs.oracle.com/javase/tutorial/java/nutsandbolts/datatypes.html
		PRIMITIVE_TYPES_TO_NONPRIMITIVE_EQUIVALENTS = Map.of(
				int.class, Integer.class,
				long.class, Long.class,
				double.class, Double.class,
				float.class, Float.class,
				boolean.class, Boolean.class,
				char.class, Character.class,
				byte.class, Byte.class,
				short.class, Short.class,
				void.class, Void.class
		);

		// See https://www.regular-expressions.info/unicode.html
		// \p{Z} or \p{Separator}: any kind of whitespace or invisible separator.
		HEAD_WHITESPACE_PATTERN = Pattern.compile("^(\\p{Z}|\\s)+");
		TAIL_WHITESPACE_PATTERN = Pattern.compile("(\\p{Z}|\\s)+$");
	}

	private Utilities() {
		// Non-instantiable
	}

	/**
	 * A "stronger" version of {@link String#trim()} which discards any kind of whitespace or invisible separator.
	 *
	 * @param string the string to trim
	 * @return the trimmed string, or {@code null} if the input string is {@code null}
	 */
	@Nullable
	public static String trimAggressively(@Nullable String string) {
		if (string == null)
			return null;

		string = HEAD_WHITESPACE_PATTERN.matcher(string).replaceAll("");

		if (string.length() == 0)
			return string;

		return TAIL_WHITESPACE_PATTERN.matcher(string).replaceAll("");
	}

	/**
	 * Aggressively trims Unicode whitespace from the given string and returns {@code null} if the result is empty.
	 *
	 * @param string the input string; may be {@code null}
	 * @return a trimmed, non-empty string; or {@code null} if input was {@code null} or trimmed to empty
	 */
	@Nullable
	public static String trimAggressivelyToNull(@Nullable String string) {
		if (string == null)
			return null;

		string = trimAggressively(string);
		return string.length() == 0 ? null : string;
	}

	/**
	 * Normalizes a string for loose comparison: lowercases it and removes whitespace and any of the
	 * {@code ignoredCharacters}.
	 *
	 * @param string            the string to normalize
	 * @param ignoredCharacters characters to drop, e.g. {@code "_-"}
	 * @return the normalized string
	 */
	@NonNull
	public static String normalize(@NonNull String string,
																 @NonNull String ignoredCharacters) {
		requireNonNull(string);
		requireNonNull(ignoredCharacters);

		StringBuilder normalized = new StringBuilder(string.length());

		for (int i = 0; i < string.length(); i++) {
			char c = string.charAt(i);

			if (Character.isWhitespace(c) || Character.isSpaceChar(c) || ignoredCharacters.indexOf(c) >= 0)
				continue;

			normalized.append(c);
		}

		return normalized.toString().toLowerCase(ENGLISH);
	}

	/**
	 * Case-, space- and {@code ignoredCharacters}-insensitive string equality.
	 *
	 * @param first             the first string
	 * @param second            the second string
	 * @param ignoredCharacters characters to disregard when comparing
	 * @return {@code true} if the normalized forms are equal
	 */
	public static boolean equalsNormalized(@NonNull String first,
																				 @NonNull String second,
																				 @NonNull String ignoredCharacters) {
		requireNonNull(first);
		requireNonNull(second);
		requireNonNull(ignoredCharacters);

		return normalize(first, ignoredCharacters).equals(normalize(second, ignoredCharacters));
	}

	/**
	 * Python-style title casing: the first letter of each run of letters is uppercased and the rest lowercased.
	 * <p>
	 * For example, {@code "yES"} becomes {@code "Yes"} and {@code "no way"} becomes {@code "No Way"}.
	 *
	 * @param string the string to title-case
	 * @return the title-cased string
	 */
	@NonNull
	public static String titleCase(@NonNull String string) {
		requireNonNull(string);

		StringBuilder titleCased = new StringBuilder(string.length());
		boolean previousWasLetter = false;

		for (int i = 0; i < string.length(); i++) {
			char c = string.charAt(i);

			if (Character.isLetter(c)) {
				titleCased.append(previousWasLetter ? Character.toLowerCase(c) : Character.toTitleCase(c));
				previousWasLetter = true;
			} else {
				titleCased.append(c);
				previousWasLetter = false;
			}
		}

		return titleCased.toString();
	}

	/**
	 * Renders items as a human-readable sequence, e.g. {@code 'a', 'b' and 'c'}.
	 *
	 * @param items         the items to render
	 * @param quote         the quote to put around each item
	 * @param lastSeparator separator between the last two items, e.g. {@code " and "}
	 * @return the rendered sequence, or the empty string if there are no items
	 */
	@NonNull
	public static String joinSequence(@NonNull Collection<?> items,
																		@NonNull String quote,
																		@NonNull String lastSeparator) {
		requireNonNull(items);
		requireNonNull(quote);
		requireNonNull(lastSeparator);

		List<String> quotedItems = new ArrayList<>(items.size());

		for (Object item : items)
			quotedItems.add(quote + safeString(item) + quote);

		if (quotedItems.size() == 0)
			return "";

		if (quotedItems.size() == 1)
			return quotedItems.get(0);

		return String.join(", ", quotedItems.subList(0, quotedItems.size() - 1))
				+ lastSeparator + quotedItems.get(quotedItems.size() - 1);
	}

	/**
	 * Renders items as {@code 'a', 'b' and 'c'}.
	 *
	 * @param items the items to render
	 * @return the rendered sequence
	 */
	@NonNull
	public static String joinSequence(@NonNull Collection<?> items) {
		return joinSequence(items, "'", " and ");
	}

	/**
	 * English plural suffix for a count.
	 *
	 * @param count the number of things
	 * @return {@code "s"} unless {@code count} is exactly 1
	 */
	@NonNull
	public static String pluralSuffix(int count) {
		return count == 1 ? "" : "s";
	}

	/**
	 * A human-friendly name for the runtime type of a value, suitable for error messages.
	 *
	 * @param value the value to describe, may be {@code null}
	 * @return the type name, e.g. {@code "integer"} or {@code "dictionary"}
	 */
	@NonNull
	public static String typeName(@Nullable Object value) {
		if (value == null)
			return "None";
		if (value instanceof String)
			return "string";
		if (value instanceof Boolean)
			return "boolean";
		if (value instanceof Integer || value instanceof Long || value instanceof Short
				|| value instanceof Byte || value instanceof BigInteger)
			return "integer";
		if (value instanceof Double || value instanceof Float)
			return "float";
		if (value instanceof BigDecimal)
			return "decimal";
		if (value instanceof byte[])
			return "bytes";
		if (value instanceof ByteBuffer)
			return "byte buffer";
		if (value instanceof List)
			return "list";
		if (value instanceof Tuple)
			return "tuple";
		if (value instanceof Map)
			return "dictionary";
		if (value instanceof Set)
			return "set";

		return value.getClass().getSimpleName();
	}

	/**
	 * Renders a value for use in an error message.
	 * <p>
	 * {@code null} is rendered as {@code None} and arrays render their contents.
	 *
	 * @param value the value to render, may be {@code null}
	 * @return a string representation that never throws
	 */
	@NonNull
	public static String safeString(@Nullable Object value) {
		if (value == null)
			return "None";

		try {
			if (value instanceof byte[] bytes)
				return Arrays.toString(bytes);
			if (value instanceof Object[] objects)
				return Arrays.deepToString(objects);

			return String.valueOf(value);
		} catch (RuntimeException e) {
			return format("<Unrepresentable %s: %s>", value.getClass().getSimpleName(), e);
		}
	}

	/**
	 * Maps primitive classes to their wrapper equivalents, e.g. {@code int.class} to {@code Integer.class}.
	 *
	 * @param type the type to box
	 * @return the wrapper type for primitives, otherwise {@code type} itself
	 */
	@NonNull
	public static Class<?> boxedType(@NonNull Class<?> type) {
		requireNonNull(type);

		Class<?> nonprimitiveEquivalent = PRIMITIVE_TYPES_TO_NONPRIMITIVE_EQUIVALENTS.get(type);
		return nonprimitiveEquivalent == null ? type : nonprimitiveEquivalent;
	}
}
