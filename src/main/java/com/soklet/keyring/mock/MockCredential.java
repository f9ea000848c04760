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

package com.soklet.keyring.mock;

import com.soklet.keyring.Credential;
import com.soklet.keyring.exception.KeyringException;
import com.soklet.keyring.model.Identity;
import com.soklet.keyring.util.Encodings;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Mock implementation of {@link Credential} which keeps its secret in memory.
 * <p>
 * Tests can make the next operation fail via {@link #setError(KeyringException)}, or pre-load a value
 * via {@link #presetSecret(byte[])} or {@link #presetPassword(String)}.
 */
@ThreadSafe
public class MockCredential implements Credential {
	@NonNull
	private final Identity identity;
	@NonNull
	private final Object lock;
	@NonNull
	private final Logger logger;
	@Nullable
	@GuardedBy("lock")
	private byte[] secret;
	@Nullable
	@GuardedBy("lock")
	private KeyringException error;

	public MockCredential(@NonNull Identity identity) {
		requireNonNull(identity);

		this.identity = identity;
		this.lock = new Object();
		this.logger = LoggerFactory.getLogger(getClass());
	}

	@Override
	public void setSecret(@NonNull byte[] secret) throws KeyringException {
		requireNonNull(secret);

		synchronized (this.lock) {
			throwInjectedErrorIfPresent("setSecret");
			this.secret = secret.clone();
		}
	}

	@NonNull
	@Override
	public byte[] getSecret() throws KeyringException {
		synchronized (this.lock) {
			throwInjectedErrorIfPresent("getSecret");

			if (this.secret == null)
				throw KeyringException.noEntry();

			return this.secret.clone();
		}
	}

	@Override
	public void deleteCredential() throws KeyringException {
		synchronized (this.lock) {
			throwInjectedErrorIfPresent("deleteCredential");

			if (this.secret == null)
				throw KeyringException.noEntry();

			this.secret = null;
		}
	}

	/**
	 * The next call to any of the secret or password accessors throws {@code error} instead of touching the stored
	 * value. The error is thrown once.
	 */
	public void setError(@NonNull KeyringException error) {
		requireNonNull(error);

		synchronized (this.lock) {
			this.error = error;
		}
	}

	public void presetSecret(@NonNull byte[] secret) {
		requireNonNull(secret);

		synchronized (this.lock) {
			this.secret = secret.clone();
		}
	}

	public void presetPassword(@NonNull String password) throws KeyringException {
		requireNonNull(password);
		presetSecret(Encodings.encodePassword(password));
	}

	@GuardedBy("lock")
	private void throwInjectedErrorIfPresent(@NonNull String operation) throws KeyringException {
		requireNonNull(operation);

		KeyringException error = this.error;

		if (error == null)
			return;

		this.error = null;
		getLogger().debug("Throwing injected {} from {} for {}", error.getFailureReason().name(), operation, getIdentity());
		throw error;
	}

	@NonNull
	public Identity getIdentity() {
		return this.identity;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{identity=%s}", getClass().getSimpleName(), getIdentity());
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
