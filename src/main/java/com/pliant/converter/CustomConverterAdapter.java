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
import com.pliant.custom.CustomConverter;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;

/**
 * Exposes an application-supplied {@link CustomConverter} as a {@link TypeConverter}.
 * <p>
 * {@link IllegalArgumentException}s thrown by the custom converter explain the failure and their message is reported.
 * Any other exception is logged and reported as a generic failure.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
final class CustomConverterAdapter extends TypeConverter {
	@NonNull
	private static final Logger LOGGER = Logger.getLogger(CustomConverterAdapter.class.getName());

	@NonNull
	private final CustomConverter<Object, ?> customConverter;

	@SuppressWarnings("unchecked")
	CustomConverterAdapter(@NonNull TypeDescriptor typeDescriptor,
												 @NonNull CustomConverter<?, ?> customConverter,
												 @NonNull List<@NonNull TypeConverter> nested,
												 @Nullable Vocabulary vocabulary) {
		super(typeDescriptor, nested, vocabulary, requireNonNull(customConverter).getName());
		this.customConverter = (CustomConverter<Object, ?>) customConverter;
	}

	@Override
	@NonNull
	public Set<@NonNull Class<?>> getValueTypes() {
		return getCustomConverter().getValueTypes();
	}

	@Override
	protected boolean acceptsValue(@Nullable Object value) {
		return getValueTypes().size() == 0 || super.acceptsValue(value);
	}

	@Override
	@Nullable
	protected Object convertString(@NonNull String value) throws ValueConversionException {
		return convertWithCustomConverter(value);
	}

	@Override
	@Nullable
	protected Object convertNonString(@Nullable Object value) throws ValueConversionException {
		return convertWithCustomConverter(value);
	}

	@Nullable
	private Object convertWithCustomConverter(@Nullable Object value) throws ValueConversionException {
		try {
			return getCustomConverter().convert(value).orElse(null);
		} catch (IllegalArgumentException | ValueConversionException e) {
			throw e;
		} catch (Exception e) {
			if (LOGGER.isLoggable(FINE))
				LOGGER.log(FINE, format("Custom converter %s failed to convert value '%s'", getCustomConverter(), value), e);

			throw new IllegalArgumentException();
		}
	}

	/**
	 * Documentation of the values the custom converter accepts.
	 *
	 * @return the documentation, if any
	 */
	@NonNull
	public Optional<String> getDocumentation() {
		return getCustomConverter().getDocumentation();
	}

	@NonNull
	CustomConverter<Object, ?> getCustomConverter() {
		return this.customConverter;
	}
}
