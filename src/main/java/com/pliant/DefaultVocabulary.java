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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.Immutable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINER;

/**
 * {@link Vocabulary} backed by the bundled {@code vocabulary.properties} word lists.
 * <p>
 * English is always included, as are the language-neutral words {@code 1} and {@code 0}, {@code None} and the
 * empty string (the latter two mean {@code false}).
 * <p>
 * {@link #withDefaults()} additionally includes the comma-separated language codes named by the
 * {@value #LANGUAGES_SYSTEM_PROPERTY_NAME} system property, if set.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@Immutable
public final class DefaultVocabulary implements Vocabulary {
	/**
	 * System property holding comma-separated language codes to include by default, e.g. {@code "fi,de"}.
	 */
	@NonNull
	public static final String LANGUAGES_SYSTEM_PROPERTY_NAME = "pliant.languages";

	@NonNull
	private static final String ENGLISH_LANGUAGE_CODE = "en";
	@NonNull
	private static final String VOCABULARY_RESOURCE_NAME = "vocabulary.properties";
	@NonNull
	private static final Logger LOGGER = Logger.getLogger(DefaultVocabulary.class.getName());

	@NonNull
	private final List<@NonNull String> languageCodes;
	@NonNull
	private final Set<@NonNull String> trueStrings;
	@NonNull
	private final Set<@NonNull String> falseStrings;

	/**
	 * Acquires a vocabulary for English plus any languages named by {@value #LANGUAGES_SYSTEM_PROPERTY_NAME}.
	 *
	 * @return the default vocabulary
	 * @throws IllegalStateException if the system property names an unsupported language
	 */
	@NonNull
	public static DefaultVocabulary withDefaults() {
		String languages = Utilities.trimAggressivelyToNull(System.getProperty(LANGUAGES_SYSTEM_PROPERTY_NAME));

		if (languages == null)
			return forLanguages(List.of());

		try {
			return forLanguages(Arrays.asList(languages.split(",")));
		} catch (IllegalArgumentException e) {
			throw new IllegalStateException(format("Invalid value '%s' for system property '%s'. %s",
					languages, LANGUAGES_SYSTEM_PROPERTY_NAME, e.getMessage()), e);
		}
	}

	/**
	 * Acquires a vocabulary for English plus the given languages.
	 *
	 * @param languageCodes language codes such as {@code "fi"}
	 * @return the vocabulary
	 * @throws IllegalArgumentException if a language is not supported
	 */
	@NonNull
	public static DefaultVocabulary forLanguages(@NonNull String... languageCodes) {
		requireNonNull(languageCodes);
		return forLanguages(Arrays.asList(languageCodes));
	}

	/**
	 * Acquires a vocabulary for English plus the given languages.
	 *
	 * @param languageCodes language codes such as {@code "fi"}
	 * @return the vocabulary
	 * @throws IllegalArgumentException if a language is not supported
	 */
	@NonNull
	public static DefaultVocabulary forLanguages(@NonNull Collection<@NonNull String> languageCodes) {
		requireNonNull(languageCodes);

		Set<String> normalizedLanguageCodes = new LinkedHashSet<>();
		normalizedLanguageCodes.add(ENGLISH_LANGUAGE_CODE);

		for (String languageCode : languageCodes) {
			String normalizedLanguageCode = Utilities.trimAggressivelyToNull(languageCode);

			if (normalizedLanguageCode != null)
				normalizedLanguageCodes.add(normalizedLanguageCode.toLowerCase(Locale.ENGLISH));
		}

		return new DefaultVocabulary(List.copyOf(normalizedLanguageCodes));
	}

	private DefaultVocabulary(@NonNull List<@NonNull String> languageCodes) {
		requireNonNull(languageCodes);

		Map<String, WordLists> wordListsByLanguageCode = WordListsHolder.WORD_LISTS_BY_LANGUAGE_CODE;

		Set<String> trueStrings = new LinkedHashSet<>(List.of("True", "1"));
		Set<String> falseStrings = new LinkedHashSet<>(List.of("False", "0", "None", ""));

		for (String languageCode : languageCodes) {
			WordLists wordLists = wordListsByLanguageCode.get(languageCode);

			if (wordLists == null)
				throw new IllegalArgumentException(format("Unsupported language '%s'. Supported languages: %s",
						languageCode, Utilities.joinSequence(wordListsByLanguageCode.keySet())));

			for (String trueString : wordLists.trueStrings())
				trueStrings.add(Utilities.titleCase(trueString));

			for (String falseString : wordLists.falseStrings())
				falseStrings.add(Utilities.titleCase(falseString));
		}

		this.languageCodes = languageCodes;
		this.trueStrings = Collections.unmodifiableSet(trueStrings);
		this.falseStrings = Collections.unmodifiableSet(falseStrings);
	}

	@NonNull
	private static Map<@NonNull String, @NonNull WordLists> loadWordLists() {
		Properties properties = new Properties();

		try (InputStream inputStream = DefaultVocabulary.class.getResourceAsStream(VOCABULARY_RESOURCE_NAME)) {
			if (inputStream == null)
				throw new IllegalStateException(format("Unable to find vocabulary resource '%s'", VOCABULARY_RESOURCE_NAME));

			try (Reader reader = new InputStreamReader(inputStream, UTF_8)) {
				properties.load(reader);
			}
		} catch (IOException e) {
			throw new IllegalStateException(format("Unable to read vocabulary resource '%s'", VOCABULARY_RESOURCE_NAME), e);
		}

		Map<String, WordLists> wordListsByLanguageCode = new LinkedHashMap<>();

		for (String propertyName : properties.stringPropertyNames()) {
			int separatorIndex = propertyName.lastIndexOf('.');

			if (separatorIndex <= 0)
				continue;

			String languageCode = propertyName.substring(0, separatorIndex);
			wordListsByLanguageCode.computeIfAbsent(languageCode, ignored -> new WordLists(
					splitWords(properties.getProperty(languageCode + ".true")),
					splitWords(properties.getProperty(languageCode + ".false"))));
		}

		if (LOGGER.isLoggable(FINER))
			LOGGER.finer(format("Loaded boolean vocabulary for languages %s", wordListsByLanguageCode.keySet()));

		return Collections.unmodifiableMap(wordListsByLanguageCode);
	}

	@NonNull
	private static List<@NonNull String> splitWords(@Nullable String words) {
		if (words == null)
			return List.of();

		return Arrays.stream(words.split(","))
				.map(Utilities::trimAggressivelyToNull)
				.filter(Objects::nonNull)
				.toList();
	}

	/**
	 * Language codes this vocabulary was built from, English first.
	 *
	 * @return the language codes
	 */
	@NonNull
	public List<@NonNull String> getLanguageCodes() {
		return this.languageCodes;
	}

	@Override
	@NonNull
	public Set<@NonNull String> getTrueStrings() {
		return this.trueStrings;
	}

	@Override
	@NonNull
	public Set<@NonNull String> getFalseStrings() {
		return this.falseStrings;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{languageCodes=%s}", getClass().getSimpleName(), getLanguageCodes());
	}

	private record WordLists(@NonNull List<@NonNull String> trueStrings,
													 @NonNull List<@NonNull String> falseStrings) {}

	// Lazy-loading holder: the resource is read once, the first time a vocabulary is built
	private static final class WordListsHolder {
		@NonNull
		private static final Map<@NonNull String, @NonNull WordLists> WORD_LISTS_BY_LANGUAGE_CODE = loadWordLists();
	}
}
