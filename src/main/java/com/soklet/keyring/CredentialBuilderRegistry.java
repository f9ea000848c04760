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

import com.soklet.keyring.exception.KeyringException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Decides which {@link CredentialBuilder} backs {@link Entry#create(String, String)} and friends.
 * <p>
 * Holds at most one explicitly installed override. When none is installed, a platform-default builder is
 * constructed on first use, exactly once no matter how many threads race to use it, and cached for the life of
 * the registry. Installing an override never discards the cached platform default, and there is no way to
 * remove an override once installed; installing another one replaces it.
 * <p>
 * The override slot is guarded by a read/write lock: any number of threads may create entries at once, while
 * {@link #setDefaultCredentialBuilder(CredentialBuilder)} waits for all of them to finish. Because
 * {@link #build(String, String, String)} holds the read lock for the whole resolve-and-build, an install is
 * ordered entirely before or entirely after each entry creation, and the last install wins.
 * <p>
 * Most applications use the process-wide {@link #getDefaultInstance()}; applications that prefer explicit wiring
 * can construct their own (see {@link KeyringModule}).
 */
@ThreadSafe
public class CredentialBuilderRegistry {
	@NonNull
	private final Supplier<@NonNull CredentialBuilder> platformDefaultSupplier;
	@NonNull
	private final ReadWriteLock overrideLock;
	@NonNull
	private final Object platformDefaultLock;
	@NonNull
	private final Logger logger;
	@Nullable
	@GuardedBy("overrideLock")
	private CredentialBuilder override;
	@Nullable
	private volatile CredentialBuilder platformDefault;

	@NonNull
	public static CredentialBuilderRegistry getDefaultInstance() {
		return DefaultInstanceHolder.DEFAULT_INSTANCE;
	}

	public CredentialBuilderRegistry(@NonNull Supplier<@NonNull CredentialBuilder> platformDefaultSupplier) {
		requireNonNull(platformDefaultSupplier);

		this.platformDefaultSupplier = platformDefaultSupplier;
		this.overrideLock = new ReentrantReadWriteLock();
		this.platformDefaultLock = new Object();
		this.logger = LoggerFactory.getLogger(getClass());
	}

	/**
	 * Installs {@code credentialBuilder} for every subsequent entry creation, replacing any previous override.
	 * <p>
	 * Blocks until in-flight entry creations complete. Meant to be called once at startup, before entries are
	 * created from multiple threads.
	 */
	public void setDefaultCredentialBuilder(@NonNull CredentialBuilder credentialBuilder) {
		requireNonNull(credentialBuilder);

		getOverrideLock().writeLock().lock();

		try {
			this.override = credentialBuilder;
		} finally {
			getOverrideLock().writeLock().unlock();
		}

		getLogger().debug("Installed {} as the default credential builder", credentialBuilder.getClass().getName());
	}

	/**
	 * The override if one is installed, otherwise the platform default (constructing it if this is the first use).
	 */
	@NonNull
	public CredentialBuilder resolve() {
		getOverrideLock().readLock().lock();

		try {
			return resolveWhileHoldingReadLock();
		} finally {
			getOverrideLock().readLock().unlock();
		}
	}

	/**
	 * Resolves the current builder and builds a credential with it, without letting an install interleave.
	 */
	@NonNull
	public Credential build(@Nullable String target,
													@NonNull String service,
													@NonNull String user) throws KeyringException {
		requireNonNull(service);
		requireNonNull(user);

		getOverrideLock().readLock().lock();

		try {
			return resolveWhileHoldingReadLock().build(target, service, user);
		} finally {
			getOverrideLock().readLock().unlock();
		}
	}

	@NonNull
	public Optional<CredentialBuilder> getOverride() {
		getOverrideLock().readLock().lock();

		try {
			return Optional.ofNullable(this.override);
		} finally {
			getOverrideLock().readLock().unlock();
		}
	}

	@NonNull
	private CredentialBuilder resolveWhileHoldingReadLock() {
		CredentialBuilder override = this.override;
		return override == null ? getOrCreatePlatformDefault() : override;
	}

	@NonNull
	private CredentialBuilder getOrCreatePlatformDefault() {
		CredentialBuilder platformDefault = this.platformDefault;

		if (platformDefault != null)
			return platformDefault;

		synchronized (this.platformDefaultLock) {
			platformDefault = this.platformDefault;

			if (platformDefault == null) {
				// If the supplier throws, nothing is cached and the next caller tries again
				platformDefault = getPlatformDefaultSupplier().get();

				if (platformDefault == null)
					throw new IllegalStateException(format("Platform default %s supplier returned null",
							CredentialBuilder.class.getSimpleName()));

				this.platformDefault = platformDefault;
				getLogger().debug("Constructed platform default credential builder {}", platformDefault.getClass().getName());
			}

			return platformDefault;
		}
	}

	/**
	 * Creates a registry whose platform default is chosen by {@link KeystoreSelector} from a freshly loaded
	 * {@link Configuration}.
	 * <p>
	 * Nothing is read until the platform default is first needed. A misconfiguration then fails that entry creation
	 * with {@link com.soklet.keyring.spi.KeystoreConfigurationException} (or the configuration's own exception), is
	 * not cached, and fails again on the next attempt. Installing an override still works.
	 */
	@NonNull
	static CredentialBuilderRegistry createConfiguredInstance() {
		return new CredentialBuilderRegistry(() ->
				KeystoreSelector.fromConfiguration(new Configuration()).createDefaultCredentialBuilder());
	}

	// Class initialization gives us lazy, at-most-once construction of the process-wide instance.
	// Construction cannot fail: configuration is only read when the platform default is first resolved
	private static final class DefaultInstanceHolder {
		@NonNull
		private static final CredentialBuilderRegistry DEFAULT_INSTANCE;

		static {
			DEFAULT_INSTANCE = createConfiguredInstance();
		}
	}

	@NonNull
	private Supplier<@NonNull CredentialBuilder> getPlatformDefaultSupplier() {
		return this.platformDefaultSupplier;
	}

	@NonNull
	private ReadWriteLock getOverrideLock() {
		return this.overrideLock;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
