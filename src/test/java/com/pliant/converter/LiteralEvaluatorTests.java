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
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class LiteralEvaluatorTests {
	@Test
	public void numbers() {
		assertEquals(42, LiteralEvaluator.evaluate("42"));
		assertEquals(-42, LiteralEvaluator.evaluate("-42"));
		assertEquals(42, LiteralEvaluator.evaluate("- -42"));
		assertEquals(1000, LiteralEvaluator.evaluate("1_000"));
		assertEquals(255, LiteralEvaluator.evaluate("0xff"));
		assertEquals(8, LiteralEvaluator.evaluate("0o10"));
		assertEquals(-5, LiteralEvaluator.evaluate("-0b101"));
		assertEquals(0, LiteralEvaluator.evaluate("000"));
		assertEquals(9999999999L, LiteralEvaluator.evaluate("9999999999"));
		assertEquals(new BigInteger("99999999999999999999"), LiteralEvaluator.evaluate("99999999999999999999"));
		assertEquals(1.5, LiteralEvaluator.evaluate("1.5"));
		assertEquals(0.5, LiteralEvaluator.evaluate(".5"));
		assertEquals(1e3, LiteralEvaluator.evaluate("1e3"));
		assertEquals(-2.5, LiteralEvaluator.evaluate("-2.5"));
	}

	@Test
	public void invalidNumbers() {
		assertInvalid("01");
		assertInvalid("\u0661\u0662");
		assertInvalid("1abc");
		assertInvalid("3j");
		assertInvalid("0x");
		assertInvalid("1e");
		assertInvalid("1__0");
		assertInvalid("-");
	}

	@Test
	public void constants() {
		assertEquals(true, LiteralEvaluator.evaluate("True"));
		assertEquals(false, LiteralEvaluator.evaluate("False"));
		assertNull(LiteralEvaluator.evaluate("None"));

		assertInvalid("true");
		assertInvalid("null");
		assertInvalid("foo");
	}

	@Test
	public void strings() {
		assertEquals("abc", LiteralEvaluator.evaluate("'abc'"));
		assertEquals("abc", LiteralEvaluator.evaluate("\"abc\""));
		assertEquals("it's", LiteralEvaluator.evaluate("\"it's\""));
		assertEquals("a\tb\n", LiteralEvaluator.evaluate("'a\\tb\\n'"));
		assertEquals("é€", LiteralEvaluator.evaluate("'\\xe9\\u20ac'"));
		assertEquals("A", LiteralEvaluator.evaluate("'\\101'"));
		assertEquals("a\\tb", LiteralEvaluator.evaluate("r'a\\tb'"));
		assertEquals("\\q", LiteralEvaluator.evaluate("'\\q'"));
		assertEquals("ab", LiteralEvaluator.evaluate("'a' \"b\""));
		assertEquals("line1\nline2", LiteralEvaluator.evaluate("'''line1\nline2'''"));
		assertEquals("x", LiteralEvaluator.evaluate("u'x'"));
	}

	@Test
	public void byteStrings() {
		assertArrayEquals(new byte[]{'h', 'i'}, (byte[]) LiteralEvaluator.evaluate("b'hi'"));
		assertArrayEquals(new byte[]{(byte) 0xFF, 'a'}, (byte[]) LiteralEvaluator.evaluate("b'\\xff' b'a'"));

		assertInvalid("b'€'");
		assertInvalid("b'a' 'b'");
		assertInvalid("bu'a'");
	}

	@Test
	public void stringPrefixes() {
		assertEquals("a\\n", LiteralEvaluator.evaluate("R'a\\n'"));
		assertEquals("x", LiteralEvaluator.evaluate("U'x'"));
		assertArrayEquals(new byte[]{'\\', 'n'}, (byte[]) LiteralEvaluator.evaluate("br'\\n'"));
		assertArrayEquals(new byte[]{'\\', 'n'}, (byte[]) LiteralEvaluator.evaluate("Rb'\\n'"));

		assertInvalid("rr'x'");
		assertInvalid("ur'x'");
		assertInvalid("bb'x'");
		assertInvalid("ub'x'");
		assertInvalid("rbr'x'");
	}

	@Test
	public void invalidStrings() {
		assertInvalid("'abc");
		assertInvalid("'a\nb'");
		assertInvalid("'\\x4'");
	}

	@Test
	public void lists() {
		assertEquals(List.of(), LiteralEvaluator.evaluate("[]"));
		assertEquals(List.of(1, "a", true), LiteralEvaluator.evaluate("[1, 'a', True]"));
		assertEquals(List.of(1, 2), LiteralEvaluator.evaluate("[1, 2,]"));
		assertEquals(Arrays.asList(1, null), LiteralEvaluator.evaluate("[1, None]"));
		assertEquals(List.of(List.of(1), List.of()), LiteralEvaluator.evaluate("[[1], []]"));

		assertInvalid("[1 2]");
		assertInvalid("[,]");
	}

	@Test
	public void tuples() {
		assertEquals(Tuple.empty(), LiteralEvaluator.evaluate("()"));
		assertEquals(Tuple.of(1), LiteralEvaluator.evaluate("(1,)"));
		assertEquals(1, LiteralEvaluator.evaluate("(1)"));
		assertEquals(Tuple.of(1, "b"), LiteralEvaluator.evaluate("(1, 'b')"));
		assertEquals(Tuple.of(1, 2), LiteralEvaluator.evaluate("1, 2"));
		assertEquals(Tuple.of(1), LiteralEvaluator.evaluate("1,"));
	}

	@Test
	public void dictionariesAndSets() {
		assertEquals(Map.of(), LiteralEvaluator.evaluate("{}"));
		assertEquals(Map.of("a", 1, 2, List.of()), LiteralEvaluator.evaluate("{'a': 1, 2: []}"));
		assertEquals(Map.of(Tuple.of(1, 2), "t"), LiteralEvaluator.evaluate("{(1, 2): 't'}"));
		assertEquals(Set.of(1, "a"), LiteralEvaluator.evaluate("{1, 'a', 1}"));

		// Mutable values cannot be keys or members
		assertInvalid("{[1]: 2}");
		assertInvalid("{[1]}");
		assertInvalid("{'a': 1, 'b'}");
		assertInvalid("{1, 'a': 2}");
	}

	@Test
	public void nestingIsLimited() {
		List<Object> nested = new ArrayList<>();
		Object evaluated = LiteralEvaluator.evaluate("[".repeat(200) + "]".repeat(200));

		for (int i = 0; i < 199; i++)
			nested = List.of(nested);

		assertEquals(nested, evaluated);

		assertInvalid("[".repeat(201) + "]".repeat(201));
		assertInvalid("(".repeat(100_000) + ")".repeat(100_000));
		assertInvalid("{1: ".repeat(100_000) + "1" + "}".repeat(100_000));
		assertInvalid("[".repeat(100_000));
	}

	@Test
	public void whitespace() {
		assertEquals(List.of(1, 2), LiteralEvaluator.evaluate("  [ 1 ,\n 2 ]  "));
		assertEquals(1, LiteralEvaluator.evaluate("\t1"));

		assertInvalid("\n1");
		assertInvalid("");
		assertInvalid("   ");
		assertInvalid("1 2");
	}

	private static void assertInvalid(String text) {
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> LiteralEvaluator.evaluate(text),
				() -> "Expected invalid expression: " + text);
		assertEquals("Invalid expression.", e.getMessage());
	}
}
