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

import com.soklet.keyring.mock.MockCredentialBuilder;
import com.soklet.keyring.spi.KeystoreConfigurationException;
import com.soklet.keyring.spi.KeystoreProvider;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Picks the keystore whose {@link CredentialBuilder} becomes the platform default.
 * <p>
 * Selection happens once, at construction, and fails fast:
 * <ul>
 *   <li>every enabled keystore must have a {@link KeystoreProvider} on the classpath</li>
 *   <li>at most one enabled keystore may support the current platform</li>
 * </ul>
 * If no enabled keystore supports the current platform, the {@link MockCredentialBuilder} is used.
 */
@ThreadSafe
public class KeystoreSelector {
	@NonNull
	private final Platform platform;
	@Nullable
	private final KeystoreProvider selectedKeystoreProvider;
	@NonNull
	private final Logger logger;

	@NonNull
	public static KeystoreSelector fromConfiguration(@NonNull Configuration configuration) {
		requireNonNull(configuration);

		List<@NonNull KeystoreProvider> keystoreProviders = new ArrayList<>();
		ServiceLoader.load(KeystoreProvider.class).forEach(keystoreProviders::add);

		return new KeystoreSelector(configuration.getKeystores(), Platform.current(), keystoreProviders);
	}

	public KeystoreSelector(@NonNull Set<@NonNull String> enabledKeystores,
													@NonNull Platform platform,
													@NonNull List<@NonNull KeystoreProvider> keystoreProviders) {
		requireNonNull(enabledKeystores);
		requireNonNull(platform);
		requireNonNull(keystoreProviders);

		this.platform = platform;
		this.logger = LoggerFactory.getLogger(getClass());

		Map<@NonNull String, @NonNull KeystoreProvider> keystoreProvidersByName = new LinkedHashMap<>();

		for (KeystoreProvider keystoreProvider : keystoreProviders) {
			KeystoreProvider existingKeystoreProvider = keystoreProvidersByName.putIfAbsent(keystoreProvider.getName(), keystoreProvider);

			if (existingKeystoreProvider != null)
				throw new KeystoreConfigurationException(format("Keystore '%s' is provided by both %s and %s",
						keystoreProvider.getName(), existingKeystoreProvider.getClass().getName(), keystoreProvider.getClass().getName()));
		}

		getLogger().debug("Found {} keystore provider(s): {}", keystoreProvidersByName.size(), keystoreProvidersByName.keySet());

		List<@NonNull KeystoreProvider> applicableKeystoreProviders = new ArrayList<>();

		for (String enabledKeystore : enabledKeystores) {
			KeystoreProvider keystoreProvider = keystoreProvidersByName.get(enabledKeystore);

			if (keystoreProvider == null)
				throw new KeystoreConfigurationException(format("Keystore '%s' is enabled but no provider for it is on the classpath. Available: %s",
						enabledKeystore, keystoreProvidersByName.keySet()));

			if (keystoreProvider.getSupportedPlatforms().contains(platform))
				applicableKeystoreProviders.add(keystoreProvider);
		}

		if (applicableKeystoreProviders.size() > 1)
			throw new KeystoreConfigurationException(format("You can enable at most one keystore per platform, but %s are enabled for %s",
					applicableKeystoreProviders.stream().map(KeystoreProvider::getName).collect(Collectors.toList()), platform.name()));

		this.selectedKeystoreProvider = applicableKeystoreProviders.isEmpty() ? null : applicableKeystoreProviders.get(0);

		if (this.selectedKeystoreProvider == null)
			getLogger().info("No native keystore is enabled for {}, using the mock keystore", platform.name());
		else
			getLogger().info("Using keystore '{}' ({}) for {}", this.selectedKeystoreProvider.getName(),
					this.selectedKeystoreProvider.getDescription(), platform.name());
	}

	/**
	 * Creates the builder for the selected keystore.
	 * The registry calls this at most once, so each call creates a new builder.
	 */
	@NonNull
	public CredentialBuilder createDefaultCredentialBuilder() {
		KeystoreProvider keystoreProvider = getSelectedKeystoreProvider().orElse(null);

		if (keystoreProvider == null)
			return new MockCredentialBuilder();

		return requireNonNull(keystoreProvider.createCredentialBuilder(),
				format("Keystore '%s' created a null %s", keystoreProvider.getName(), CredentialBuilder.class.getSimpleName()));
	}

	@NonNull
	public Platform getPlatform() {
		return this.platform;
	}

	/**
	 * The selected native keystore, or empty if the mock keystore will be used.
	 */
	@NonNull
	public Optional<KeystoreProvider> getSelectedKeystoreProvider() {
		return Optional.ofNullable(this.selectedKeystoreProvider);
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
