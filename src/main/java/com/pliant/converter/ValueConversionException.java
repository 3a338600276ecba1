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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Thrown if a value cannot be converted to a declared type.
 * <p>
 * For example, a {@link TypeConverter} for {@code Integer} throws this exception if the value is {@code "abc"}.
 * The message is always human-readable and names the offending value and the target type, e.g.
 * {@code Argument 'count' got value 'abc' that cannot be converted to integer.}
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class ValueConversionException extends Exception {
	@Nullable
	private final Object value;
	@NonNull
	private final String typeName;
	@Nullable
	private final String name;
	@NonNull
	private final String kind;

	/**
	 * Creates an exception that describes the value conversion error.
	 *
	 * @param message  a message describing the error
	 * @param cause    the underlying failure, if any
	 * @param value    the value that could not be converted
	 * @param typeName the name of the type the value was converted to
	 * @param name     the name of the argument or item being converted, if any
	 * @param kind     what was being converted, e.g. {@code "Argument"} or {@code "Item"}
	 */
	public ValueConversionException(@NonNull String message,
																	@Nullable Throwable cause,
																	@Nullable Object value,
																	@NonNull String typeName,
																	@Nullable String name,
																	@NonNull String kind) {
		super(requireNonNull(message), cause);

		requireNonNull(typeName);
		requireNonNull(kind);

		this.value = value;
		this.typeName = typeName;
		this.name = name;
		this.kind = kind;
	}

	/**
	 * The value that could not be converted.
	 *
	 * @return the value, or {@link Optional#empty()} if it was {@code null}
	 */
	@NonNull
	public Optional<Object> getValue() {
		return Optional.ofNullable(this.value);
	}

	/**
	 * The display name of the type the value was converted to.
	 *
	 * @return the type name
	 */
	@NonNull
	public String getTypeName() {
		return this.typeName;
	}

	/**
	 * The name of the argument or item being converted.
	 *
	 * @return the name, or {@link Optional#empty()} if not available
	 */
	@NonNull
	public Optional<String> getName() {
		return Optional.ofNullable(this.name);
	}

	@NonNull
	public String getKind() {
		return this.kind;
	}
}
