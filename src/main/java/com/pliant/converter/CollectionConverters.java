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
import com.pliant.SpecialForm;
import com.pliant.Tuple;
import com.pliant.TypeDescriptor;
import com.pliant.Utilities;
import com.pliant.Vocabulary;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.lang.String.format;

/**
 * Converters for lists, tuples, sets, frozen sets and dictionaries.
 * <p>
 * Text is evaluated as a literal expression, e.g. {@code "[1, 2]"} for a list or {@code "{'a': 1}"} for a
 * dictionary. If the declared type has nested types, every item is converted with the corresponding nested converter
 * and a failure names the offending item.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
final class CollectionConverters {
	@NonNull
	private static final String ITEM_KIND = "Item";
	@NonNull
	private static final String KEY_KIND = "Key";

	private CollectionConverters() {
		// Non-instantiable
	}

	@NonNull
	private static List<@Nullable Object> itemsOf(@NonNull Object value) {
		if (value instanceof Tuple tuple)
			return tuple.asList();
		if (value instanceof Map<?, ?> map)
			return new ArrayList<>(map.keySet());

		return new ArrayList<>((Collection<?>) value);
	}

	private static boolean allItemsNeedNoConversion(@NonNull Iterable<?> items,
																									@NonNull TypeConverter itemConverter) {
		for (Object item : items)
			if (!itemConverter.noConversionNeeded(item))
				return false;

		return true;
	}

	@NotThreadSafe
	static final class ListConverter extends TypeConverter {
		ListConverter(@NonNull TypeDescriptor typeDescriptor,
									@NonNull List<@NonNull TypeConverter> nested,
									@Nullable Vocabulary vocabulary) {
			super(typeDescriptor, nested, vocabulary, typeNameFor("list", typeDescriptor, nested));
		}

		@Override
		public boolean noConversionNeeded(@Nullable Object value) {
			if (!super.noConversionNeeded(value))
				return false;

			return getNested().size() == 0 || allItemsNeedNoConversion((List<?>) value, getNested().get(0));
		}

		@Override
		@NonNull
		public Set<@NonNull Class<?>> getValueTypes() {
			return Set.of(String.class, List.class, Tuple.class);
		}

		@Override
		@NonNull
		protected Object convertString(@NonNull String value) throws ValueConversionException {
			return convertItems(itemsOf(literalEval(value, List.class, "list")));
		}

		@Override
		@NonNull
		protected Object convertNonString(@Nullable Object value) throws ValueConversionException {
			return convertItems(itemsOf(value));
		}

		@NonNull
		private List<@Nullable Object> convertItems(@NonNull List<@Nullable Object> items) throws ValueConversionException {
			if (getNested().size() == 0)
				return new ArrayList<>(items);

			TypeConverter itemConverter = getNested().get(0);
			List<Object> convertedItems = new ArrayList<>(items.size());

			for (int i = 0; i < items.size(); i++)
				convertedItems.add(itemConverter.convert(items.get(i), String.valueOf(i), ITEM_KIND));

			return convertedItems;
		}
	}

	/**
	 * A tuple is either fixed-length, with one nested type per position ({@code Tuple<Integer, String>}), or
	 * homogeneous, with one nested type followed by an ellipsis ({@code Tuple<Integer, ...>}).
	 */
	@NotThreadSafe
	static final class TupleConverter extends TypeConverter {
		private final boolean homogeneous;

		TupleConverter(@NonNull TypeDescriptor typeDescriptor,
									 @NonNull List<@NonNull TypeConverter> nested,
									 @Nullable Vocabulary vocabulary) {
			super(typeDescriptor, nested, vocabulary, typeNameFor("tuple", typeDescriptor, nested));

			List<TypeDescriptor> nestedDescriptors = typeDescriptor.getNested();
			this.homogeneous = nestedDescriptors.size() > 0
					&& nestedDescriptors.get(nestedDescriptors.size() - 1).getType().orElse(null) == SpecialForm.ELLIPSIS;
		}

		@Override
		public boolean noConversionNeeded(@Nullable Object value) {
			if (!super.noConversionNeeded(value))
				return false;

			Tuple tuple = (Tuple) value;

			if (getNested().size() == 0)
				return true;

			if (isHomogeneous())
				return allItemsNeedNoConversion(tuple, getNested().get(0));

			if (tuple.size() != getNested().size())
				return false;

			for (int i = 0; i < tuple.size(); i++)
				if (!getNested().get(i).noConversionNeeded(tuple.get(i)))
					return false;

			return true;
		}

		@Override
		public void validate() {
			if (isHomogeneous())
				validateNested(getNested().subList(0, getNested().size() - 1));
			else
				super.validate();
		}

		@Override
		@NonNull
		public Set<@NonNull Class<?>> getValueTypes() {
			return Set.of(String.class, List.class, Tuple.class);
		}

		@Override
		@NonNull
		protected Object convertString(@NonNull String value) throws ValueConversionException {
			return convertItems(literalEval(value, Tuple.class, "tuple").asList());
		}

		@Override
		@NonNull
		protected Object convertNonString(@Nullable Object value) throws ValueConversionException {
			return convertItems(itemsOf(value));
		}

		@NonNull
		private Tuple convertItems(@NonNull List<@Nullable Object> items) throws ValueConversionException {
			List<TypeConverter> nested = getNested();

			if (nested.size() == 0)
				return Tuple.copyOf(items);

			if (!isHomogeneous() && items.size() != nested.size())
				throw new IllegalArgumentException(format("Expected %d item%s, got %d.",
						nested.size(), Utilities.pluralSuffix(nested.size()), items.size()));

			List<Object> convertedItems = new ArrayList<>(items.size());

			for (int i = 0; i < items.size(); i++) {
				TypeConverter itemConverter = isHomogeneous() ? nested.get(0) : nested.get(i);
				convertedItems.add(itemConverter.convert(items.get(i), String.valueOf(i), ITEM_KIND));
			}

			return Tuple.copyOf(convertedItems);
		}

		boolean isHomogeneous() {
			return this.homogeneous;
		}
	}

	@NotThreadSafe
	static class SetConverter extends TypeConverter {
		SetConverter(@NonNull TypeDescriptor typeDescriptor,
								 @NonNull List<@NonNull TypeConverter> nested,
								 @Nullable Vocabulary vocabulary) {
			this(typeDescriptor, nested, vocabulary, "set");
		}

		protected SetConverter(@NonNull TypeDescriptor typeDescriptor,
													 @NonNull List<@NonNull TypeConverter> nested,
													 @Nullable Vocabulary vocabulary,
													 @NonNull String shortName) {
			super(typeDescriptor, nested, vocabulary, typeNameFor(shortName, typeDescriptor, nested));
		}

		@Override
		public boolean noConversionNeeded(@Nullable Object value) {
			if (!super.noConversionNeeded(value))
				return false;

			return getNested().size() == 0 || allItemsNeedNoConversion((Set<?>) value, getNested().get(0));
		}

		@Override
		@NonNull
		public Set<@NonNull Class<?>> getValueTypes() {
			return Set.of(String.class, Collection.class, Tuple.class, Map.class);
		}

		@Override
		@NonNull
		protected Object convertString(@NonNull String value) throws ValueConversionException {
			return convertItems(literalEval(value, Set.class, "set"));
		}

		@Override
		@NonNull
		protected Object convertNonString(@Nullable Object value) throws ValueConversionException {
			return convertItems(itemsOf(value));
		}

		@NonNull
		protected Set<@Nullable Object> convertItems(@NonNull Collection<?> items) throws ValueConversionException {
			Set<Object> convertedItems = new LinkedHashSet<>();

			if (getNested().size() == 0) {
				convertedItems.addAll(items);
				return convertedItems;
			}

			TypeConverter itemConverter = getNested().get(0);

			for (Object item : items)
				convertedItems.add(itemConverter.convert(item, null, ITEM_KIND));

			return convertedItems;
		}
	}

	/**
	 * Frozen sets are Guava {@link ImmutableSet}s, so they cannot contain {@code null}.
	 */
	@NotThreadSafe
	static final class FrozenSetConverter extends SetConverter {
		FrozenSetConverter(@NonNull TypeDescriptor typeDescriptor,
											 @NonNull List<@NonNull TypeConverter> nested,
											 @Nullable Vocabulary vocabulary) {
			super(typeDescriptor, nested, vocabulary, "frozen set");
		}

		@Override
		@NonNull
		protected Object convertString(@NonNull String value) throws ValueConversionException {
			if (value.equals("frozenset()"))
				return ImmutableSet.of();

			return freeze((Set<?>) super.convertString(value));
		}

		@Override
		@NonNull
		protected Object convertNonString(@Nullable Object value) throws ValueConversionException {
			return freeze((Set<?>) super.convertNonString(value));
		}

		@NonNull
		private ImmutableSet<Object> freeze(@NonNull Set<?> items) {
			if (items.contains(null))
				throw new IllegalArgumentException("Frozen set cannot contain None.");

			return ImmutableSet.<Object>copyOf(items);
		}
	}

	/**
	 * Keys are converted with the first nested converter, values with the second. A failing value is named by its key.
	 */
	@NotThreadSafe
	static final class DictionaryConverter extends TypeConverter {
		DictionaryConverter(@NonNull TypeDescriptor typeDescriptor,
												@NonNull List<@NonNull TypeConverter> nested,
												@Nullable Vocabulary vocabulary) {
			super(typeDescriptor, nested, vocabulary, typeNameFor("dictionary", typeDescriptor, nested));
		}

		@Override
		public boolean noConversionNeeded(@Nullable Object value) {
			if (!super.noConversionNeeded(value))
				return false;

			if (!hasKeyAndValueConverters())
				return true;

			TypeConverter keyConverter = getNested().get(0);
			TypeConverter valueConverter = getNested().get(1);

			for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet())
				if (!keyConverter.noConversionNeeded(entry.getKey()) || !valueConverter.noConversionNeeded(entry.getValue()))
					return false;

			return true;
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
		private Map<@Nullable Object, @Nullable Object> convertItems(@NonNull Map<?, ?> items) throws ValueConversionException {
			Map<Object, Object> convertedItems = new LinkedHashMap<>();

			if (!hasKeyAndValueConverters()) {
				convertedItems.putAll(items);
				return convertedItems;
			}

			TypeConverter keyConverter = getNested().get(0);
			TypeConverter valueConverter = getNested().get(1);

			for (Map.Entry<?, ?> entry : items.entrySet()) {
				Object key = keyConverter.convert(entry.getKey(), null, KEY_KIND);
				Object value = valueConverter.convert(entry.getValue(), Utilities.safeString(entry.getKey()), ITEM_KIND);
				convertedItems.put(key, value);
			}

			return convertedItems;
		}

		private boolean hasKeyAndValueConverters() {
			return getNested().size() == 2;
		}
	}
}
