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

package com.soklet.keyring.util;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Utilities for normalizing configuration values.
 * <p>
 * Never applied to service names, user names, targets or secrets: those are stored exactly as given.
 */
@ThreadSafe
public final class Normalizer {
	@NonNull
	private static final Pattern SURROUNDING_WHITESPACE_PATTERN;

	static {
		SURROUNDING_WHITESPACE_PATTERN = Pattern.compile("^[\\p{Z}\\s]+|[\\p{Z}\\s]+$");
	}

	/**
	 * A "stronger" version of {@link String#trim()} which discards any kind of whitespace or invisible separator.
	 */
	@NonNull
	public static Optional<String> trimAggressively(@Nullable String string) {
		if (string == null)
			return Optional.empty();

		return Optional.of(SURROUNDING_WHITESPACE_PATTERN.matcher(string).replaceAll(""));
	}

	/**
	 * Like {@link #trimAggressively(String)}, but collapses an empty result to {@code null}.
	 */
	@Nullable
	public static String trimAggressivelyToNull(@Nullable String string) {
		String trimmed = trimAggressively(string).orElse(null);
		return trimmed == null || trimmed.isEmpty() ? null : trimmed;
	}

	private Normalizer() {
		// Non-instantiable
	}
}
