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
import com.soklet.keyring.util.Encodings;
import org.jspecify.annotations.NonNull;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Contract for a keystore-specific object that stores the secret for exactly one identity.
 * <p>
 * Implementations must be safe to call from multiple threads. They make no promise about how concurrent access
 * to the same underlying record (from other credentials, threads or processes) is ordered by the keystore itself.
 * <p>
 * Keystores typically model a stored record more richly than an {@link com.soklet.keyring.model.Identity} does.
 * Callers who know which keystore is in use can reach that model with {@link #as(Class)}.
 */
public interface Credential {
	/**
	 * Stores {@code secret}, replacing any prior value.
	 * Implementations must store exactly these bytes.
	 */
	void setSecret(@NonNull byte[] secret) throws KeyringException;

	/**
	 * Returns the stored bytes, or throws {@link KeyringException.FailureReason#NO_ENTRY} if nothing is stored.
	 */
	@NonNull
	byte[] getSecret() throws KeyringException;

	/**
	 * Removes the stored record, or throws {@link KeyringException.FailureReason#NO_ENTRY} if nothing is stored.
	 */
	void deleteCredential() throws KeyringException;

	default void setPassword(@NonNull String password) throws KeyringException {
		requireNonNull(password);
		setSecret(Encodings.encodePassword(password));
	}

	@NonNull
	default String getPassword() throws KeyringException {
		return Encodings.decodePassword(getSecret());
	}

	@NonNull
	default <T> Optional<T> as(@NonNull Class<T> type) {
		requireNonNull(type);
		return type.isInstance(this) ? Optional.of(type.cast(this)) : Optional.empty();
	}
}
