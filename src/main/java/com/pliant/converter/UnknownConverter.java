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
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.List;

/**
 * Placeholder for declared types no converter recognizes.
 * <p>
 * Values pass through unchanged, but {@link #validate()} always fails so that callers can reject such types
 * before converting anything.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public final class UnknownConverter extends TypeConverter {
	UnknownConverter(@NonNull TypeDescriptor typeDescriptor,
									 @NonNull List<@NonNull TypeConverter> nested,
									 @Nullable Vocabulary vocabulary) {
		super(typeDescriptor, nested, vocabulary, typeNameFor(null, typeDescriptor, nested));
	}

	@Override
	@Nullable
	public Object convert(@Nullable Object value,
												@Nullable String name,
												@NonNull String kind) {
		return value;
	}

	@Override
	public boolean noConversionNeeded(@Nullable Object value) {
		return false;
	}

	@Override
	public void validate() {
		throw new UnrecognizedTypeException(getTypeName());
	}

	@Override
	public boolean isRecognized() {
		return false;
	}

	@Override
	@Nullable
	protected Object convertString(@NonNull String value) {
		return value;
	}
}
