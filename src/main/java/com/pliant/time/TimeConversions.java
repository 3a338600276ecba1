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

package com.pliant.time;

import com.pliant.Utilities;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Parses timestamps and time intervals from text and numbers.
 * <p>
 * Timestamps are read by taking the digits of the text as {@code yyyyMMddHHmmss} followed by up to six fraction
 * digits, so {@code 2024-09-30}, {@code 2024-09-30 10:07:42.123} and {@code 20240930T100742} are all accepted.
 * <p>
 * Time intervals may be given as seconds ({@code 1.5}), timer strings ({@code 01:02:03.5}), time strings
 * ({@code 1 day 2 hours 3 min 4 s 5 ms}, {@code 1h30m}) or ISO-8601 durations ({@code PT1H30M}).
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class TimeConversions {
	@NonNull
	private static final Pattern TIMER_PATTERN;
	@NonNull
	private static final Pattern TIME_STRING_COMPONENT_PATTERN;
	@NonNull
	private static final Pattern NUMBER_PATTERN;
	@NonNull
	private static final List<@NonNull String> TIME_UNITS_IN_ORDER;
	@NonNull
	private static final Map<@NonNull String, @NonNull String> TIME_UNITS_BY_NAME;
	@NonNull
	private static final Map<@NonNull String, @NonNull BigDecimal> NANOS_BY_TIME_UNIT;
	@NonNull
	private static final BigDecimal MAXIMUM_DURATION_NANOS;
	@NonNull
	private static final BigDecimal MAXIMUM_EPOCH_NANOS;

	static {
		TIMER_PATTERN = Pattern.compile("^([-+])?(\\d+:)?(\\d+):(\\d+)(\\.\\d+)?$");
		TIME_STRING_COMPONENT_PATTERN = Pattern.compile("(\\d+(?:\\.\\d*)?|\\.\\d+)([a-z]+)");
		NUMBER_PATTERN = Pattern.compile("^[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?$");

		TIME_UNITS_IN_ORDER = List.of("d", "h", "m", "s", "ms", "us", "ns");

		TIME_UNITS_BY_NAME = Map.ofEntries(
				Map.entry("days", "d"), Map.entry("day", "d"), Map.entry("d", "d"),
				Map.entry("hours", "h"), Map.entry("hour", "h"), Map.entry("h", "h"),
				Map.entry("minutes", "m"), Map.entry("minute", "m"), Map.entry("mins", "m"), Map.entry("min", "m"), Map.entry("m", "m"),
				Map.entry("seconds", "s"), Map.entry("second", "s"), Map.entry("secs", "s"), Map.entry("sec", "s"), Map.entry("s", "s"),
				Map.entry("milliseconds", "ms"), Map.entry("millisecond", "ms"), Map.entry("millis", "ms"), Map.entry("ms", "ms"),
				Map.entry("microseconds", "us"), Map.entry("microsecond", "us"), Map.entry("us", "us"), Map.entry("μs", "us"),
				Map.entry("nanoseconds", "ns"), Map.entry("nanosecond", "ns"), Map.entry("ns", "ns"));

		NANOS_BY_TIME_UNIT = Map.of(
				"d", BigDecimal.valueOf(86_400_000_000_000L),
				"h", BigDecimal.valueOf(3_600_000_000_000L),
				"m", BigDecimal.valueOf(60_000_000_000L),
				"s", BigDecimal.valueOf(1_000_000_000L),
				"ms", BigDecimal.valueOf(1_000_000L),
				"us", BigDecimal.valueOf(1_000L),
				"ns", BigDecimal.ONE);

		MAXIMUM_DURATION_NANOS = BigDecimal.valueOf(Long.MAX_VALUE);
		MAXIMUM_EPOCH_NANOS = BigDecimal.valueOf(Instant.MAX.getEpochSecond() + 1).movePointRight(9);
	}

	private TimeConversions() {
		// Non-instantiable
	}

	/**
	 * Converts a timestamp to a {@link LocalDateTime}.
	 * <p>
	 * Accepts {@link LocalDateTime}, {@link LocalDate} (at midnight), {@link Instant} and {@link Date} (in the system
	 * time zone), numbers (seconds since the epoch, in the system time zone) and text.
	 *
	 * @param value the timestamp
	 * @return the converted timestamp
	 * @throws IllegalArgumentException if the value is not a valid timestamp
	 */
	@NonNull
	public static LocalDateTime convertDate(@NonNull Object value) {
		requireNonNull(value);

		if (value instanceof LocalDateTime localDateTime)
			return localDateTime;
		if (value instanceof LocalDate localDate)
			return localDate.atStartOfDay();
		if (value instanceof Instant instant)
			return LocalDateTime.ofInstant(instant, ZoneId.systemDefault());
		if (value instanceof Date date)
			return LocalDateTime.ofInstant(date.toInstant(), ZoneId.systemDefault());
		if (value instanceof Number number)
			return LocalDateTime.ofInstant(epochSecondsToInstant(number), ZoneId.systemDefault());
		if (value instanceof String string)
			return parseTimestamp(string);

		throw new IllegalArgumentException(format("Unsupported timestamp type %s.", Utilities.typeName(value)));
	}

	/**
	 * Converts a time interval to a {@link Duration}.
	 * <p>
	 * Accepts {@link Duration}, numbers (seconds) and text.
	 *
	 * @param value the time interval
	 * @return the converted interval
	 * @throws IllegalArgumentException if the value is not a valid time interval
	 */
	@NonNull
	public static Duration convertTime(@NonNull Object value) {
		requireNonNull(value);

		if (value instanceof Duration duration)
			return duration;
		if (value instanceof Number number) {
			BigDecimal seconds = toBigDecimal(number);

			if (seconds == null)
				throw new IllegalArgumentException(format("Invalid time string '%s'.", value));

			return nanosToDuration(seconds.movePointRight(9), value);
		}
		if (value instanceof String string)
			return parseTime(string);

		throw new IllegalArgumentException(format("Unsupported time type %s.", Utilities.typeName(value)));
	}

	@NonNull
	private static LocalDateTime parseTimestamp(@NonNull String timestamp) {
		requireNonNull(timestamp);

		StringBuilder digits = new StringBuilder(20);

		for (int i = 0; i < timestamp.length(); i++) {
			char c = timestamp.charAt(i);

			if (c >= '0' && c <= '9')
				digits.append(c);
		}

		if (digits.length() < 8 || digits.length() > 20)
			throw invalidTimestamp(timestamp);

		while (digits.length() < 20)
			digits.append('0');

		try {
			return LocalDateTime.of(
					Integer.parseInt(digits.substring(0, 4)),
					Integer.parseInt(digits.substring(4, 6)),
					Integer.parseInt(digits.substring(6, 8)),
					Integer.parseInt(digits.substring(8, 10)),
					Integer.parseInt(digits.substring(10, 12)),
					Integer.parseInt(digits.substring(12, 14)),
					Integer.parseInt(digits.substring(14, 20)) * 1_000);
		} catch (DateTimeException e) {
			throw invalidTimestamp(timestamp);
		}
	}

	@NonNull
	private static Duration parseTime(@NonNull String time) {
		requireNonNull(time);

		String normalized = time.trim();

		if (NUMBER_PATTERN.matcher(normalized).matches())
			return nanosToDuration(new BigDecimal(normalized).movePointRight(9), time);

		Matcher timerMatcher = TIMER_PATTERN.matcher(normalized);

		if (timerMatcher.matches())
			return timerToDuration(timerMatcher, time);

		if (normalized.length() > 1 && (normalized.startsWith("P") || normalized.startsWith("-P"))) {
			try {
				return Duration.parse(normalized);
			} catch (DateTimeParseException e) {
				throw invalidTimeString(time);
			}
		}

		return timeStringToDuration(normalized, time);
	}

	@NonNull
	private static Duration timerToDuration(@NonNull Matcher timerMatcher,
																					@NonNull String original) {
		boolean negative = "-".equals(timerMatcher.group(1));
		String hours = timerMatcher.group(2);
		String fraction = timerMatcher.group(5);

		BigDecimal seconds = new BigDecimal(timerMatcher.group(4))
				.add(new BigDecimal(timerMatcher.group(3)).multiply(BigDecimal.valueOf(60)));

		if (hours != null)
			seconds = seconds.add(new BigDecimal(hours.substring(0, hours.length() - 1)).multiply(BigDecimal.valueOf(3_600)));

		if (fraction != null)
			seconds = seconds.add(new BigDecimal("0" + fraction));

		BigDecimal nanos = seconds.movePointRight(9);
		return nanosToDuration(negative ? nanos.negate() : nanos, original);
	}

	@NonNull
	private static Duration timeStringToDuration(@NonNull String normalized,
																							 @NonNull String original) {
		String remaining = normalized.toLowerCase(Locale.ENGLISH).replace(" ", "");
		boolean negative = false;

		if (remaining.startsWith("-")) {
			negative = true;
			remaining = remaining.substring(1);
		}

		if (remaining.length() == 0)
			throw invalidTimeString(original);

		Matcher matcher = TIME_STRING_COMPONENT_PATTERN.matcher(remaining);
		BigDecimal nanos = BigDecimal.ZERO;
		int position = 0;
		int previousUnitIndex = -1;

		while (matcher.find()) {
			if (matcher.start() != position)
				throw invalidTimeString(original);

			String unit = TIME_UNITS_BY_NAME.get(matcher.group(2));

			if (unit == null)
				throw invalidTimeString(original);

			// Each unit may appear once, largest first
			int unitIndex = TIME_UNITS_IN_ORDER.indexOf(unit);

			if (unitIndex <= previousUnitIndex)
				throw invalidTimeString(original);

			nanos = nanos.add(new BigDecimal(matcher.group(1)).multiply(NANOS_BY_TIME_UNIT.get(unit)));
			previousUnitIndex = unitIndex;
			position = matcher.end();
		}

		if (position != remaining.length())
			throw invalidTimeString(original);

		return nanosToDuration(negative ? nanos.negate() : nanos, original);
	}

	@NonNull
	private static Instant epochSecondsToInstant(@NonNull Number epochSeconds) {
		BigDecimal seconds = toBigDecimal(epochSeconds);

		if (seconds == null)
			throw invalidTimestamp(epochSeconds);

		try {
			BigDecimal nanos = roundToWholeNanos(seconds.movePointRight(9), MAXIMUM_EPOCH_NANOS);
			BigDecimal[] secondsAndNanos = nanos.divideAndRemainder(BigDecimal.valueOf(1_000_000_000L));
			return Instant.ofEpochSecond(secondsAndNanos[0].longValueExact(), secondsAndNanos[1].longValueExact());
		} catch (ArithmeticException | DateTimeException e) {
			throw invalidTimestamp(epochSeconds);
		}
	}

	@NonNull
	private static Duration nanosToDuration(@NonNull BigDecimal nanos,
																					@NonNull Object original) {
		try {
			return Duration.ofNanos(roundToWholeNanos(nanos, MAXIMUM_DURATION_NANOS).longValueExact());
		} catch (ArithmeticException e) {
			throw invalidTimeString(original);
		}
	}

	// Magnitudes are compared by exponent before rounding, so "1e200000000" is never expanded
	@NonNull
	private static BigDecimal roundToWholeNanos(@NonNull BigDecimal nanos,
																							@NonNull BigDecimal maximumNanos) {
		if (nanos.abs().compareTo(maximumNanos) > 0)
			throw new ArithmeticException("Value is out of range.");

		// Below 0.1 nanoseconds
		if ((long) nanos.precision() - nanos.scale() < 0)
			return BigDecimal.ZERO;

		return nanos.setScale(0, RoundingMode.HALF_EVEN);
	}

	@Nullable
	private static BigDecimal toBigDecimal(@NonNull Number number) {
		if (number instanceof BigDecimal bigDecimal)
			return bigDecimal;
		if (number instanceof Double || number instanceof Float) {
			double doubleValue = number.doubleValue();
			return Double.isFinite(doubleValue) ? BigDecimal.valueOf(doubleValue) : null;
		}

		return new BigDecimal(number.toString());
	}

	@NonNull
	private static IllegalArgumentException invalidTimestamp(@NonNull Object timestamp) {
		return new IllegalArgumentException(format("Invalid timestamp '%s'.", timestamp));
	}

	@NonNull
	private static IllegalArgumentException invalidTimeString(@NonNull Object time) {
		return new IllegalArgumentException(format("Invalid time string '%s'.", time));
	}
}
