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

import com.pliant.IntegerBackedEnum;
import com.pliant.TypeDescriptor;
import com.pliant.Utilities;
import com.pliant.Vocabulary;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static java.lang.String.format;

/**
 * Converts member names, and for {@link IntegerBackedEnum}s also member values, to enum constants.
 * <p>
 * Names are first matched exactly and then ignoring case, spaces, underscores and hyphens, so {@code "dark-red"}
 * matches {@code DARK_RED}. If the loose match is ambiguous, conversion fails.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
final class EnumConverter extends TypeConverter {
	@NonNull
	private static final String IGNORED_CHARACTERS = "_-";

	@NonNull
	private final Class<? extends Enum<?>> enumClass;

	@SuppressWarnings("unchecked")
	EnumConverter(@NonNull TypeDescriptor typeDescriptor,
								@NonNull List<@NonNull TypeConverter> nested,
								@Nullable Vocabulary vocabulary) {
		super(typeDescriptor, nested, vocabulary, typeNameFor(null, typeDescriptor, nested));
		this.enumClass = (Class<? extends Enum<?>>) typeDescriptor.getType()
				.filter(type -> type instanceof Class<?> typeClass && typeClass.isEnum())
				.orElseThrow(() -> new IllegalArgumentException(format("%s is not an enum type.", typeDescriptor)));
	}

	@Override
	@NonNull
	public Set<@NonNull Class<?>> getValueTypes() {
		if (isIntegerBacked())
			return Set.of(String.class, Integer.class, Long.class, Short.class, Byte.class, BigInteger.class);

		return Set.of(String.class);
	}

	@Override
	@NonNull
	protected Object convertString(@NonNull String value) {
		for (Enum<?> member : getMembers())
			if (member.name().equals(value))
				return member;

		return findByNormalizedNameOrIntegerValue(value);
	}

	@Override
	@NonNull
	protected Object convertNonString(@Nullable Object value) {
		return findByIntegerValue(new BigInteger(value.toString()));
	}

	@NonNull
	private Enum<?> findByNormalizedNameOrIntegerValue(@NonNull String value) {
		List<String> memberNames = new ArrayList<>();

		for (Enum<?> member : getMembers())
			memberNames.add(member.name());

		memberNames.sort(null);

		List<String> matches = new ArrayList<>();

		for (String memberName : memberNames)
			if (Utilities.equalsNormalized(memberName, value, IGNORED_CHARACTERS))
				matches.add(memberName);

		if (matches.size() == 1)
			return memberNamed(matches.get(0));

		if (matches.size() > 1)
			throw new IllegalArgumentException(format("%s has multiple members matching '%s'. Available: %s",
					getTypeName(), value, Utilities.joinSequence(matches)));

		List<String> available = memberNames;

		if (isIntegerBacked()) {
			try {
				return findByIntegerValue(new BigInteger(value.trim()));
			} catch (IllegalArgumentException e) {
				available = new ArrayList<>(memberNames.size());

				for (String memberName : memberNames)
					available.add(format("%s (%d)", memberName, ((IntegerBackedEnum) memberNamed(memberName)).getValue()));
			}
		}

		throw new IllegalArgumentException(format("%s does not have member '%s'. Available: %s",
				getTypeName(), value, Utilities.joinSequence(available)));
	}

	@NonNull
	private Enum<?> findByIntegerValue(@NonNull BigInteger value) {
		List<Integer> values = new ArrayList<>();

		for (Enum<?> member : getMembers()) {
			int memberValue = ((IntegerBackedEnum) member).getValue();

			if (BigInteger.valueOf(memberValue).equals(value))
				return member;

			values.add(memberValue);
		}

		values.sort(null);

		throw new IllegalArgumentException(format("%s does not have value '%s'. Available: %s",
				getTypeName(), value, Utilities.joinSequence(values)));
	}

	@NonNull
	private Enum<?> memberNamed(@NonNull String name) {
		for (Enum<?> member : getMembers())
			if (member.name().equals(name))
				return member;

		throw new IllegalStateException(format("%s has no member named %s", getTypeName(), name));
	}

	@NonNull
	private List<@NonNull Enum<?>> getMembers() {
		return Arrays.asList(this.enumClass.getEnumConstants());
	}

	private boolean isIntegerBacked() {
		return IntegerBackedEnum.class.isAssignableFrom(this.enumClass);
	}
}
