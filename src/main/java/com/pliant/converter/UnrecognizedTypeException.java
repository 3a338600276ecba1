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

import javax.annotation.concurrent.NotThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown by {@link TypeConverter#validate()} when a declared type, or any type nested inside it, has no converter.
 * <p>
 * This is a configuration-time failure: it should stop processing before any values are converted.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class UnrecognizedTypeException extends RuntimeException {
	@NonNull
	private final String typeName;

	/**
	 * Creates an exception for the given unrecognized type.
	 *
	 * @param typeName the display name of the unrecognized type
	 */
	public UnrecognizedTypeException(@NonNull String typeName) {
		super(format("Unrecognized type '%s'.", requireNonNull(typeName)));
		this.typeName = typeName;
	}

	@NonNull
	public String getTypeName() {
		return this.typeName;
	}
}
