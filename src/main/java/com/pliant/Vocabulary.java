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

import java.util.Set;

/**
 * Source of the words that boolean conversion recognizes as {@code true} and {@code false}.
 * <p>
 * Words are title-cased, e.g. {@code "Yes"}, and are compared against title-cased input.
 * See {@link DefaultVocabulary} for the standard implementation.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface Vocabulary {
	/**
	 * Title-cased words meaning {@code true}.
	 *
	 * @return the words
	 */
	@NonNull
	Set<@NonNull String> getTrueStrings();

	/**
	 * Title-cased words meaning {@code false}.
	 *
	 * @return the words
	 */
	@NonNull
	Set<@NonNull String> getFalseStrings();
}
