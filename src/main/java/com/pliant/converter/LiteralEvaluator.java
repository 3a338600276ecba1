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

import com.pliant.Tuple;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Evaluates literal expressions such as {@code [1, 'two', (3.0, None)]} or {@code {'a': {1, 2}}}.
 * <p>
 * Only literals are supported: strings (single, double and triple quoted, with {@code r}, {@code b} and {@code u}
 * prefixes), integers, floats, {@code True}, {@code False}, {@code None}, lists, tuples, dictionaries and sets.
 * Anything else fails with an {@link IllegalArgumentException} whose message is {@code Invalid expression.}
 * <p>
 * Results use these Java types: {@link String}, {@link Integer}/{@link Long}/{@link BigInteger} (smallest that fits),
 * {@link Double}, {@link Boolean}, {@code null}, {@code byte[]}, {@link ArrayList}, {@link Tuple},
 * {@link LinkedHashMap} and {@link LinkedHashSet}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
final class LiteralEvaluator {
	@NonNull
	private static final String INVALID_EXPRESSION_MESSAGE = "Invalid expression.";
	@NonNull
	private static final BigInteger INTEGER_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
	@NonNull
	private static final BigInteger INTEGER_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
	@NonNull
	private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
	@NonNull
	private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);
	@NonNull
	private static final Set<@NonNull String> STRING_PREFIXES = Set.of("r", "u", "b", "br", "rb");
	private static final int MAXIMUM_NESTING_DEPTH = 200;

	@NonNull
	private final String text;
	private int position;
	private int depth;

	/**
	 * Evaluates a literal expression.
	 *
	 * @param text the expression
	 * @return the evaluated value
	 * @throws IllegalArgumentException if {@code text} is not a valid literal expression
	 */
	@Nullable
	static Object evaluate(@NonNull String text) {
		requireNonNull(text);
		return new LiteralEvaluator(text).evaluate();
	}

	private LiteralEvaluator(@NonNull String text) {
		requireNonNull(text);

		this.text = text;
		this.position = 0;
		this.depth = 0;
	}

	@Nullable
	private Object evaluate() {
		// Leading indentation is ignored, other leading whitespace is not
		while (!eof() && (peek() == ' ' || peek() == '\t'))
			consume();

		if (!eof() && (peek() == '\n' || peek() == '\r'))
			throw invalidExpression();

		Object value = parseValue();
		skipWhitespace();

		if (eof())
			return value;

		// Top-level tuples need no parentheses, as in "1, 2"
		if (peek() != ',')
			throw invalidExpression();

		List<Object> items = new ArrayList<>();
		items.add(value);

		while (!eof() && peek() == ',') {
			consume();
			skipWhitespace();

			if (eof())
				break;

			items.add(parseValue());
			skipWhitespace();
		}

		if (!eof())
			throw invalidExpression();

		return Tuple.copyOf(items);
	}

	@Nullable
	private Object parseValue() {
		skipWhitespace();

		if (eof())
			throw invalidExpression();

		char c = peek();

		if (c == '[' || c == '(' || c == '{') {
			if (++this.depth > MAXIMUM_NESTING_DEPTH)
				throw invalidExpression();

			try {
				if (c == '[')
					return parseList();
				if (c == '(')
					return parseParenthesized();

				return parseDictionaryOrSet();
			} finally {
				this.depth--;
			}
		}
		if (c == '\'' || c == '"' || isStringPrefixStart())
			return parseStrings();
		if (c == '+' || c == '-')
			return parseSignedNumber();
		if (isDigit(c) || (c == '.' && isDigit(peekNext())))
			return parseNumber(false);
		if (Character.isLetter(c) || c == '_')
			return parseName();

		throw invalidExpression();
	}

	@NonNull
	private List<@Nullable Object> parseList() {
		consume();
		List<Object> items = new ArrayList<>();

		while (true) {
			skipWhitespace();

			if (!eof() && peek() == ']') {
				consume();
				return items;
			}

			items.add(parseValue());
			skipWhitespace();

			if (eof())
				throw invalidExpression();

			char c = consume();

			if (c == ']')
				return items;
			if (c != ',')
				throw invalidExpression();
		}
	}

	@Nullable
	private Object parseParenthesized() {
		consume();
		List<Object> items = new ArrayList<>();
		boolean sawComma = false;

		while (true) {
			skipWhitespace();

			if (!eof() && peek() == ')') {
				consume();
				break;
			}

			items.add(parseValue());
			skipWhitespace();

			if (eof())
				throw invalidExpression();

			char c = consume();

			if (c == ')')
				break;
			if (c != ',')
				throw invalidExpression();

			sawComma = true;
		}

		// "(1)" is just 1, "(1,)" and "()" are tuples
		if (items.size() == 1 && !sawComma)
			return items.get(0);

		return Tuple.copyOf(items);
	}

	@NonNull
	private Object parseDictionaryOrSet() {
		consume();
		skipWhitespace();

		if (!eof() && peek() == '}') {
			consume();
			return new LinkedHashMap<>();
		}

		Object first = parseValue();
		skipWhitespace();

		if (!eof() && peek() == ':') {
			consume();
			Map<Object, Object> dictionary = new LinkedHashMap<>();
			dictionary.put(hashable(first), parseValue());

			while (true) {
				skipWhitespace();

				if (eof())
					throw invalidExpression();

				char c = consume();

				if (c == '}')
					return dictionary;
				if (c != ',')
					throw invalidExpression();

				skipWhitespace();

				if (!eof() && peek() == '}') {
					consume();
					return dictionary;
				}

				Object key = parseValue();
				skipWhitespace();

				if (eof() || consume() != ':')
					throw invalidExpression();

				dictionary.put(hashable(key), parseValue());
			}
		}

		Set<Object> set = new LinkedHashSet<>();
		set.add(hashable(first));

		while (true) {
			skipWhitespace();

			if (eof())
				throw invalidExpression();

			char c = consume();

			if (c == '}')
				return set;
			if (c != ',')
				throw invalidExpression();

			skipWhitespace();

			if (!eof() && peek() == '}') {
				consume();
				return set;
			}

			set.add(hashable(parseValue()));
		}
	}

	// Mutable containers cannot be set members or dictionary keys
	@Nullable
	private Object hashable(@Nullable Object value) {
		if (value instanceof List || value instanceof Map || value instanceof Set || value instanceof byte[])
			throw invalidExpression();

		return value;
	}

	@NonNull
	private Object parseSignedNumber() {
		boolean negative = false;

		while (!eof() && (peek() == '+' || peek() == '-')) {
			if (consume() == '-')
				negative = !negative;

			skipWhitespace();
		}

		if (eof() || !(isDigit(peek()) || (peek() == '.' && isDigit(peekNext()))))
			throw invalidExpression();

		return parseNumber(negative);
	}

	@NonNull
	private Object parseNumber(boolean negative) {
		int start = this.position;

		if (peek() == '0' && (peekNext() == 'x' || peekNext() == 'X' || peekNext() == 'o' || peekNext() == 'O'
				|| peekNext() == 'b' || peekNext() == 'B')) {
			consume();
			char prefix = Character.toLowerCase(consume());
			int radix = prefix == 'x' ? 16 : prefix == 'o' ? 8 : 2;
			String digits = consumeDigits(radix);

			if (digits.length() == 0)
				throw invalidExpression();

			return narrow(negate(new BigInteger(digits, radix), negative));
		}

		String integerPart = consumeDigits(10);
		boolean isFloat = false;

		if (!eof() && peek() == '.') {
			consume();
			consumeDigits(10);
			isFloat = true;
		}

		if (!eof() && (peek() == 'e' || peek() == 'E')) {
			consume();

			if (!eof() && (peek() == '+' || peek() == '-'))
				consume();

			if (consumeDigits(10).length() == 0)
				throw invalidExpression();

			isFloat = true;
		}

		// Things like "1abc" or "3j"
		if (!eof() && (Character.isLetterOrDigit(peek()) || peek() == '_'))
			throw invalidExpression();

		String number = this.text.substring(start, this.position).replace("_", "");

		if (isFloat) {
			double value = Double.parseDouble(number);
			return negative ? -value : value;
		}

		// Leading zeros are only allowed for zero itself
		if (integerPart.length() > 1 && integerPart.charAt(0) == '0' && !integerPart.chars().allMatch(c -> c == '0'))
			throw invalidExpression();

		return narrow(negate(new BigInteger(integerPart), negative));
	}

	// Consumes digits of the given radix, allowing single underscores between them
	@NonNull
	private String consumeDigits(int radix) {
		StringBuilder digits = new StringBuilder();

		while (!eof()) {
			char c = peek();

			if (Character.digit(c, radix) >= 0 && c < 128) {
				digits.append(consume());
			} else if (c == '_' && digits.length() > 0 && Character.digit(peekNext(), radix) >= 0) {
				consume();
			} else {
				break;
			}
		}

		return digits.toString();
	}

	@NonNull
	private BigInteger negate(@NonNull BigInteger value,
														boolean negative) {
		return negative ? value.negate() : value;
	}

	@NonNull
	private Number narrow(@NonNull BigInteger value) {
		if (value.compareTo(INTEGER_MIN) >= 0 && value.compareTo(INTEGER_MAX) <= 0)
			return value.intValue();
		if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0)
			return value.longValue();

		return value;
	}

	@Nullable
	private Object parseName() {
		int start = this.position;

		while (!eof() && (Character.isLetterOrDigit(peek()) || peek() == '_'))
			consume();

		String name = this.text.substring(start, this.position);

		switch (name) {
			case "True":
				return Boolean.TRUE;
			case "False":
				return Boolean.FALSE;
			case "None":
				return null;
			default:
				throw invalidExpression();
		}
	}

	private boolean isStringPrefixStart() {
		int i = this.position;

		while (i < this.text.length() && i - this.position < 2 && "rRbBuU".indexOf(this.text.charAt(i)) >= 0)
			i++;

		if (i == this.position || i >= this.text.length() || (this.text.charAt(i) != '\'' && this.text.charAt(i) != '"'))
			return false;

		// Valid prefixes in any case: r, u, b, br and rb
		return STRING_PREFIXES.contains(this.text.substring(this.position, i).toLowerCase(Locale.ENGLISH));
	}

	// Adjacent strings are concatenated, as in 'a' "b"
	@NonNull
	private Object parseStrings() {
		Object result = parseString();

		while (true) {
			int mark = this.position;
			skipWhitespace();

			if (eof() || !(peek() == '\'' || peek() == '"' || isStringPrefixStart())) {
				this.position = mark;
				return result;
			}

			Object next = parseString();

			if (result instanceof String string && next instanceof String nextString) {
				result = string + nextString;
			} else if (result instanceof byte[] bytes && next instanceof byte[] nextBytes) {
				byte[] concatenated = new byte[bytes.length + nextBytes.length];
				System.arraycopy(bytes, 0, concatenated, 0, bytes.length);
				System.arraycopy(nextBytes, 0, concatenated, bytes.length, nextBytes.length);
				result = concatenated;
			} else {
				throw invalidExpression();
			}
		}
	}

	@NonNull
	private Object parseString() {
		boolean raw = false;
		boolean bytes = false;

		while (peek() != '\'' && peek() != '"') {
			char prefix = Character.toLowerCase(consume());

			if (prefix == 'r')
				raw = true;
			else if (prefix == 'b')
				bytes = true;
		}

		char quote = consume();
		boolean triple = this.position + 1 < this.text.length()
				&& this.text.charAt(this.position) == quote && this.text.charAt(this.position + 1) == quote;

		if (triple) {
			consume();
			consume();
		}

		StringBuilder value = new StringBuilder();

		while (true) {
			if (eof())
				throw invalidExpression();

			char c = consume();

			if (c == quote) {
				if (!triple)
					break;

				if (this.position + 1 < this.text.length()
						&& this.text.charAt(this.position) == quote && this.text.charAt(this.position + 1) == quote) {
					consume();
					consume();
					break;
				}

				value.append(c);
			} else if (c == '\\') {
				if (eof())
					throw invalidExpression();

				if (raw) {
					// Raw strings keep the backslash but still can't end on an escaped quote
					value.append(c).append(consume());
				} else {
					appendEscape(value, bytes);
				}
			} else if ((c == '\n' || c == '\r') && !triple) {
				throw invalidExpression();
			} else {
				value.append(c);
			}
		}

		return bytes ? toBytes(value.toString()) : value.toString();
	}

	private void appendEscape(@NonNull StringBuilder value,
														boolean bytes) {
		char c = consume();

		switch (c) {
			case '\n':
				return;
			case '\\':
			case '\'':
			case '"':
				value.append(c);
				return;
			case 'a':
				value.append('\u0007');
				return;
			case 'b':
				value.append('\b');
				return;
			case 'f':
				value.append('\f');
				return;
			case 'n':
				value.append('\n');
				return;
			case 'r':
				value.append('\r');
				return;
			case 't':
				value.append('\t');
				return;
			case 'v':
				value.append('\u000B');
				return;
			case 'x':
				value.append((char) consumeHex(2));
				return;
			case 'u':
				if (bytes)
					break;
				value.append((char) consumeHex(4));
				return;
			case 'U':
				if (bytes)
					break;
				value.appendCodePoint(consumeHex(8));
				return;
			default:
				if (c >= '0' && c <= '7') {
					int octal = c - '0';

					for (int i = 0; i < 2 && !eof() && peek() >= '0' && peek() <= '7'; i++)
						octal = octal * 8 + (consume() - '0');

					value.append((char) octal);
					return;
				}
		}

		// Unknown escapes are kept as-is
		value.append('\\').append(c);
	}

	private int consumeHex(int length) {
		if (this.position + length > this.text.length())
			throw invalidExpression();

		String hex = this.text.substring(this.position, this.position + length);

		for (int i = 0; i < hex.length(); i++)
			if (Character.digit(hex.charAt(i), 16) < 0)
				throw invalidExpression();

		this.position += length;
		int codePoint = Integer.parseInt(hex, 16);

		if (!Character.isValidCodePoint(codePoint))
			throw invalidExpression();

		return codePoint;
	}

	@NonNull
	private byte[] toBytes(@NonNull String value) {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream(value.length());

		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);

			if (c > 0xFF)
				throw invalidExpression();

			bytes.write(c);
		}

		return bytes.toByteArray();
	}

	private void skipWhitespace() {
		while (!eof() && Character.isWhitespace(peek()))
			consume();
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private boolean eof() {
		return this.position >= this.text.length();
	}

	private char peek() {
		return this.text.charAt(this.position);
	}

	private char peekNext() {
		return this.position + 1 < this.text.length() ? this.text.charAt(this.position + 1) : '\0';
	}

	private char consume() {
		return this.text.charAt(this.position++);
	}

	@NonNull
	private IllegalArgumentException invalidExpression() {
		return new IllegalArgumentException(INVALID_EXPRESSION_MESSAGE);
	}
}
