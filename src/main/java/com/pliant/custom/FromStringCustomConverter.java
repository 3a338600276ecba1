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

package com.pliant.custom;

import javax.annotation.concurrent.ThreadSafe;

/**
 * Convenience superclass for {@link CustomConverter}s that convert from {@link String} to other types.
 * <p>
 * For example:
 * <pre>{@code  public record Jwt(
 *   String header,
 *   String payload,
 *   String signature
 * ) {}
 *
 * CustomConverter<String, Jwt> jwtConverter = new FromStringCustomConverter<>() {
 *   @NonNull
 *   public Optional<Jwt> convert(@Nullable String from) {
 *     // JWT is of the form "a.b.c", break it into pieces
 *     String[] components = from.split("\\.");
 *
 *     if (components.length != 3)
 *       throw new IllegalArgumentException("Expected three dot-separated components.");
 *
 *     return Optional.of(new Jwt(components[0], components[1], components[2]));
 *   }
 * };}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public abstract class FromStringCustomConverter<T> extends AbstractCustomConverter<String, T> {
	/**
	 * Ensures that the 'from' type of this converter is {@link String}.
	 */
	public FromStringCustomConverter() {
		super(String.class);
	}
}
