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
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Converts mappings to a record type: a dictionary with a fixed set of named fields, some of them required.
 * <p>
 * Keys that are not fields of the record are rejected, as are mappings lacking a required field. The input mapping
 * is never modified; a converted copy is returned.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
final class RecordConverter extends TypeConverter {
	@NonNull
	private final Map<@NonNull String, @NonNull TypeConverter> fieldConverters;

	RecordConverter(@NonNull TypeDescriptor typeDescriptor,
									@NonNull Map<@NonNull String, @NonNull TypeConverter> fieldConverters,
									@Nullable Vocabulary vocabulary) {
		super(typeDescriptor, List.of(), vocabulary, typeNameFor(null, typeDescriptor, List.of()));
		requireNonNull(fieldConverters);
		this.fieldConverters = Collections.unmodifiableMap(new LinkedHashMap<>(fieldConverters));
	}

	@Override
	public boolean noConversionNeeded(@Nullable Object value) {
		if (!(value instanceof Map<?, ?> map))
			return false;

		for (Map.Entry<?, ?> entry : map.entrySet()) {
			TypeConverter fieldConverter = entry.getKey() instanceof String key ? getFieldConverters().get(key) : null;

			if (fieldConverter == null || !fieldConverter.noConversionNeeded(entry.getValue()))
				return false;
		}

		return map.keySet().containsAll(getRequiredFields());
	}

	@Override
	public void validate() {
		validateNested(getFieldConverters().values());
	}

	@Override
	@NonNull
	public Set<@NonNull Class<?>> getValueTypes() {
		return Set.of(String.class, Map.class);
	}

	@Override
	@NonNull
	protected Object convertString(@NonNull String value) throws ValueConversionException {
		return convertItems(literalEval(value, Map.class, "dict"));
	}

	@Override
	@NonNull
	protected Object convertNonString(@Nullable Object value) throws ValueConversionException {
		return convertItems((Map<?, ?>) value);
	}

	@NonNull
	private Map<@NonNull Object, @Nullable Object> convertItems(@NonNull Map<?, ?> items) throws ValueConversionException {
		Map<Object, Object> convertedItems = new LinkedHashMap<>(items);
		List<Object> notAllowed = new ArrayList<>();

		for (Map.Entry<?, ?> entry : items.entrySet()) {
			TypeConverter fieldConverter = entry.getKey() instanceof String key ? getFieldConverters().get(key) : null;

			if (fieldConverter == null) {
				notAllowed.add(entry.getKey());
				continue;
			}

			// Fields of unrecognized types are left as they are
			if (fieldConverter.isRecognized())
				convertedItems.put(entry.getKey(), fieldConverter.convert(entry.getValue(), (String) entry.getKey(), "Item"));
		}

		if (notAllowed.size() > 0) {
			String error = format("Item%s %s not allowed.", Utilities.pluralSuffix(notAllowed.size()), sortedSequence(notAllowed));
			List<Object> available = new ArrayList<>();

			for (String field : getFieldConverters().keySet())
				if (!items.containsKey(field))
					available.add(field);

			if (available.size() > 0)
				error += format(" Available item%s: %s", Utilities.pluralSuffix(available.size()), sortedSequence(available));

			throw new IllegalArgumentException(error);
		}

		List<Object> missing = new ArrayList<>();

		for (String requiredField : getRequiredFields())
			if (!items.containsKey(requiredField))
				missing.add(requiredField);

		if (missing.size() > 0)
			throw new IllegalArgumentException(format("Required item%s %s missing.",
					Utilities.pluralSuffix(missing.size()), sortedSequence(missing)));

		return convertedItems;
	}

	@NonNull
	private static String sortedSequence(@NonNull List<Object> items) {
		List<Object> sortedItems = new ArrayList<>(items);
		sortedItems.sort(Comparator.comparing(Utilities::safeString));
		return Utilities.joinSequence(sortedItems);
	}

	@NonNull
	private Set<@NonNull String> getRequiredFields() {
		return getTypeDescriptor().getRequiredFields();
	}

	/**
	 * Converters for the record's fields, in declaration order.
	 *
	 * @return the field converters
	 */
	@NonNull
	public Map<@NonNull String, @NonNull TypeConverter> getFieldConverters() {
		return this.fieldConverters;
	}
}
