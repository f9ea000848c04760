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

package com.soklet.keyring;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import static com.soklet.keyring.util.Normalizer.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Encapsulates keyring-wide configuration, i.e. which native keystores are enabled.
 * <p>
 * Settings are read from the first of these that exists:
 * <ol>
 *   <li>the file named by the {@value #CONFIGURATION_FILE_PROPERTY_NAME} system property</li>
 *   <li>the {@value #CONFIGURATION_RESOURCE_NAME} classpath resource</li>
 * </ol>
 * If neither exists, no keystores are enabled and the mock keystore is used everywhere.
 */
@ThreadSafe
public class Configuration {
	@NonNull
	public static final String CONFIGURATION_FILE_PROPERTY_NAME;
	@NonNull
	public static final String CONFIGURATION_RESOURCE_NAME;
	@NonNull
	private static final Gson GSON;

	static {
		CONFIGURATION_FILE_PROPERTY_NAME = "keyring.configurationFile";
		CONFIGURATION_RESOURCE_NAME = "keyring-settings.json";
		GSON = new GsonBuilder().disableHtmlEscaping().create();
	}

	@NonNull
	private final String source;
	@NonNull
	private final Set<@NonNull String> keystores;

	public Configuration() {
		String configurationFile = trimAggressivelyToNull(System.getProperty(CONFIGURATION_FILE_PROPERTY_NAME));

		if (configurationFile != null) {
			Path path = Path.of(configurationFile);
			this.source = path.toAbsolutePath().toString();
			this.keystores = normalizeKeystores(loadConfigFile(path));
			return;
		}

		ClassLoader classLoader = Configuration.class.getClassLoader();

		try (InputStream inputStream = classLoader == null ? null : classLoader.getResourceAsStream(CONFIGURATION_RESOURCE_NAME)) {
			if (inputStream == null) {
				this.source = "defaults";
				this.keystores = Set.of();
			} else {
				this.source = format("classpath:%s", CONFIGURATION_RESOURCE_NAME);
				this.keystores = normalizeKeystores(parseConfigFile(new String(inputStream.readAllBytes(), StandardCharsets.UTF_8), this.source));
			}
		} catch (IOException e) {
			throw new UncheckedIOException(format("Error reading classpath resource %s", CONFIGURATION_RESOURCE_NAME), e);
		}
	}

	public Configuration(@NonNull Path configurationFile) {
		requireNonNull(configurationFile);

		this.source = configurationFile.toAbsolutePath().toString();
		this.keystores = normalizeKeystores(loadConfigFile(configurationFile));
	}

	@Nullable
	private ConfigFile loadConfigFile(@NonNull Path configurationFile) {
		requireNonNull(configurationFile);

		if (!Files.isRegularFile(configurationFile))
			throw new IllegalArgumentException(format("Config file not found at %s", configurationFile.toAbsolutePath()));

		try {
			return parseConfigFile(Files.readString(configurationFile, StandardCharsets.UTF_8), configurationFile.toAbsolutePath().toString());
		} catch (IOException e) {
			throw new UncheckedIOException(format("Error reading from %s", configurationFile.toAbsolutePath()), e);
		}
	}

	@Nullable
	private ConfigFile parseConfigFile(@NonNull String json,
																		 @NonNull String source) {
		requireNonNull(json);
		requireNonNull(source);

		try {
			return GSON.fromJson(json, ConfigFile.class);
		} catch (JsonParseException e) {
			throw new IllegalArgumentException(format("Malformed keyring configuration in %s", source), e);
		}
	}

	@NonNull
	private Set<@NonNull String> normalizeKeystores(@Nullable ConfigFile configFile) {
		if (configFile == null || configFile.keystores() == null)
			return Set.of();

		Set<@NonNull String> keystores = new LinkedHashSet<>();

		for (String keystore : configFile.keystores()) {
			String normalizedKeystore = trimAggressivelyToNull(keystore);

			if (normalizedKeystore == null)
				throw new IllegalArgumentException(format("Blank keystore name in keyring configuration from %s", getSource()));

			keystores.add(normalizedKeystore);
		}

		return Collections.unmodifiableSet(keystores);
	}

	// Record that maps to the keyring-settings.json file format
	private record ConfigFile(
			@Nullable Set<@Nullable String> keystores
	) {}

	/**
	 * Where these settings came from, for diagnostics.
	 */
	@NonNull
	public String getSource() {
		return this.source;
	}

	/**
	 * Names of the enabled keystores, in configuration order.
	 */
	@NonNull
	public Set<@NonNull String> getKeystores() {
		return this.keystores;
	}
}
