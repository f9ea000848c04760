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

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * Guice bindings for applications that would rather inject a {@link CredentialBuilderRegistry} than use the
 * process-wide one.
 * <p>
 * Override bindings for testing with {@code Modules.override(new KeyringModule(configuration)).with(...)},
 * e.g. to swap in a registry backed by a mock keystore.
 */
@ThreadSafe
public class KeyringModule extends AbstractModule {
	@NonNull
	private final Configuration configuration;

	public KeyringModule(@NonNull Configuration configuration) {
		requireNonNull(configuration);
		this.configuration = configuration;
	}

	@NonNull
	@Provides
	@Singleton
	public Configuration provideConfiguration() {
		return this.configuration;
	}

	@NonNull
	@Provides
	@Singleton
	public KeystoreSelector provideKeystoreSelector(@NonNull Configuration configuration) {
		requireNonNull(configuration);
		return KeystoreSelector.fromConfiguration(configuration);
	}

	// Each injector gets its own override slot, separate from the process-wide instance
	@NonNull
	@Provides
	@Singleton
	public CredentialBuilderRegistry provideCredentialBuilderRegistry(@NonNull KeystoreSelector keystoreSelector) {
		requireNonNull(keystoreSelector);
		return new CredentialBuilderRegistry(keystoreSelector::createDefaultCredentialBuilder);
	}

	// Not a singleton: reflects whatever override is installed at injection time
	@NonNull
	@Provides
	public CredentialBuilder provideCredentialBuilder(@NonNull CredentialBuilderRegistry credentialBuilderRegistry) {
		requireNonNull(credentialBuilderRegistry);
		return credentialBuilderRegistry.resolve();
	}
}
