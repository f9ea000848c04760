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

package com.soklet.keyring.spi;

import com.soklet.keyring.CredentialBuilder;
import com.soklet.keyring.Platform;
import org.jspecify.annotations.NonNull;

import java.util.Set;

/**
 * Entry point for a native keystore integration, e.g. the macOS keychain or the Secret Service over D-Bus.
 * <p>
 * Implementations are discovered with {@link java.util.ServiceLoader}: package the implementation in a jar with a
 * {@code META-INF/services/com.soklet.keyring.spi.KeystoreProvider} file naming it, put the jar on the classpath,
 * then enable it by name in {@code keyring-settings.json}:
 * <pre>{@code
 * {
 *   "keystores": ["secret-service"]
 * }
 * }</pre>
 * At most one enabled keystore may support any given {@link Platform}.
 */
public interface KeystoreProvider {
	/**
	 * Unique name used to enable this keystore in configuration, e.g. {@code "apple-native"}.
	 */
	@NonNull
	String getName();

	@NonNull
	default String getDescription() {
		return getName() + " keystore";
	}

	@NonNull
	Set<@NonNull Platform> getSupportedPlatforms();

	/**
	 * Called at most once per registry, the first time an entry is created without an override installed.
	 */
	@NonNull
	CredentialBuilder createCredentialBuilder();
}
