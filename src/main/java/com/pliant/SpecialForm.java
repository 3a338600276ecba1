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

package com.pliant;

import org.jspecify.annotations.NonNull;

import java.lang.reflect.Type;

/**
 * Declared type shapes that have no {@link Class} of their own.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum SpecialForm implements Type {
	/**
	 * One of several alternative types, tried in declaration order.
	 */
	UNION("Union"),
	/**
	 * One of an explicit set of constant values.
	 */
	LITERAL("Literal"),
	/**
	 * A mapping with a fixed, named field schema.
	 */
	RECORD("Record"),
	/**
	 * Trailing marker in a tuple's parameters meaning "zero or more of the preceding type".
	 */
	ELLIPSIS("...");

	@NonNull
	private final String displayName;

	SpecialForm(@NonNull String displayName) {
		this.displayName = displayName;
	}

	@NonNull
	public String getDisplayName() {
		return this.displayName;
	}

	@Override
	@NonNull
	public String getTypeName() {
		return getDisplayName();
	}
}
