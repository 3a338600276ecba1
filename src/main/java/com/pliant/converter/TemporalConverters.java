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
import com.pliant.Vocabulary;
import com.pliant.time.TimeConversions;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

/**
 * Converters for {@link LocalDateTime}, {@link java.time.LocalDate} and {@link java.time.Duration}.
 * Parsing itself is done by {@link TimeConversions}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
final class TemporalConverters {
	private TemporalConverters() {
		// Non-instantiable
	}

	@NotThreadSafe
	static final class DateTimeConverter extends TypeConverter {
		DateTimeConverter(@NonNull TypeDescriptor typeDescriptor,
											@NonNull List<@NonNull TypeConverter> nested,
											@Nullable Vocabulary vocabulary) {
			super(typeDescriptor, nested, vocabulary, typeNameFor("datetime", typeDescriptor, nested));
		}

		@Override
		@NonNull
		public Set<@NonNull Class<?>> getValueTypes() {
			return Set.of(String.class, Number.class);
		}

		@Override
		@NonNull
		protected Object convertString(@NonNull String value) {
			return TimeConversions.convertDate(value);
		}

		@Override
		@NonNull
		protected Object convertNonString(@Nullable Object value) {
			return TimeConversions.convertDate(value);
		}
	}

	/**
	 * Timestamps are accepted only if their time part is midnight.
	 */
	@NotThreadSafe
	static final class DateConverter extends TypeConverter {
		DateConverter(@NonNull TypeDescriptor typeDescriptor,
									@NonNull List<@NonNull TypeConverter> nested,
									@Nullable Vocabulary vocabulary) {
			super(typeDescriptor, nested, vocabulary, typeNameFor("date", typeDescriptor, nested));
		}

		@Override
		@NonNull
		protected Object convertString(@NonNull String value) {
			LocalDateTime dateTime = TimeConversions.convertDate(value);

			if (!dateTime.toLocalTime().equals(LocalTime.MIDNIGHT))
				throw new IllegalArgumentException("Value is datetime, not date.");

			return dateTime.toLocalDate();
		}
	}

	@NotThreadSafe
	static final class DurationConverter extends TypeConverter {
		DurationConverter(@NonNull TypeDescriptor typeDescriptor,
											@NonNull List<@NonNull TypeConverter> nested,
											@Nullable Vocabulary vocabulary) {
			super(typeDescriptor, nested, vocabulary, typeNameFor("duration", typeDescriptor, nested));
		}

		@Override
		@NonNull
		public Set<@NonNull Class<?>> getValueTypes() {
			return Set.of(String.class, Number.class);
		}

		@Override
		@NonNull
		protected Object convertString(@NonNull String value) {
			return TimeConversions.convertTime(value);
		}

		@Override
		@NonNull
		protected Object convertNonString(@Nullable Object value) {
			return TimeConversions.convertTime(value);
		}
	}
}
