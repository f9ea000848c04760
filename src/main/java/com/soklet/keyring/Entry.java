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

import javax.annotation.concurrent.ThreadSafe;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A password or secret stored in a platform keystore, identified by service and user (and optionally target).
 * <p>
 * Typical usage:
 * <pre>{@code
 * Entry entry = Entry.create("my-service", "alice");
 * entry.setPassword("hunter2");
 * String password = entry.getPassword();
 * entry.deleteCredential();
 * }</pre>
 * Every operation is forwarded to the single {@link Credential} this entry owns. Deleting the credential removes
 * the stored record only; the entry remains usable.
 * <p>
 * Entries are immutable and every {@link Credential} must be safe to call from multiple threads, so an entry can be
 * shared freely. Ordering of concurrent writes to the same stored record is up to the keystore.
 */
@ThreadSafe
public final class Entry {
	@NonNull
	private final Credential credential;

	/**
	 * Creates an entry using the process-wide default credential builder.
	 */
	@NonNull
	public static Entry create(@NonNull String service,
														 @NonNull String user) throws KeyringException {
		return create(CredentialBuilderRegistry.getDefaultInstance(), service, user);
	}

	/**
	 * Creates an entry using the process-wide default credential builder, with a target to tell apart entries that
	 * share a service and user.
	 */
	@NonNull
	public static Entry createWithTarget(@NonNull String target,
																			 @NonNull String service,
																			 @NonNull String user) throws KeyringException {
		return createWithTarget(CredentialBuilderRegistry.getDefaultInstance(), target, service, user);
	}

	@NonNull
	public static Entry create(@NonNull CredentialBuilderRegistry credentialBuilderRegistry,
														 @NonNull String service,
														 @NonNull String user) throws KeyringException {
		requireNonNull(credentialBuilderRegistry);
		requireNonNull(service);
		requireNonNull(user);

		return new Entry(credentialBuilderRegistry.build(null, service, user));
	}

	@NonNull
	public static Entry createWithTarget(@NonNull CredentialBuilderRegistry credentialBuilderRegistry,
																			 @NonNull String target,
																			 @NonNull String service,
																			 @NonNull String user) throws KeyringException {
		requireNonNull(credentialBuilderRegistry);
		requireNonNull(target);
		requireNonNull(service);
		requireNonNull(user);

		return new Entry(credentialBuilderRegistry.build(target, service, user));
	}

	/**
	 * Wraps a credential the caller built, bypassing credential builders entirely.
	 */
	@NonNull
	public static Entry createWithCredential(@NonNull Credential credential) {
		requireNonNull(credential);
		return new Entry(credential);
	}

	/**
	 * Installs the credential builder used by {@link #create(String, String)} and
	 * {@link #createWithTarget(String, String, String)} from now on.
	 * <p>
	 * Blocks until entries currently being created on other threads are done; call it at startup.
	 */
	public static void setDefaultCredentialBuilder(@NonNull CredentialBuilder credentialBuilder) {
		requireNonNull(credentialBuilder);
		CredentialBuilderRegistry.getDefaultInstance().setDefaultCredentialBuilder(credentialBuilder);
	}

	private Entry(@NonNull Credential credential) {
		requireNonNull(credential);
		this.credential = credential;
	}

	public void setPassword(@NonNull String password) throws KeyringException {
		requireNonNull(password);
		getCredential().setPassword(password);
	}

	public void setSecret(@NonNull byte[] secret) throws KeyringException {
		requireNonNull(secret);
		getCredential().setSecret(secret);
	}

	/**
	 * Fails with {@link KeyringException.FailureReason#NO_ENTRY} if nothing is stored,
	 * {@link KeyringException.FailureReason#AMBIGUOUS} if several stored records match, and
	 * {@link KeyringException.FailureReason#BAD_ENCODING} if the stored bytes are not UTF-8.
	 */
	@NonNull
	public String getPassword() throws KeyringException {
		return getCredential().getPassword();
	}

	@NonNull
	public byte[] getSecret() throws KeyringException {
		return getCredential().getSecret();
	}

	public void deleteCredential() throws KeyringException {
		getCredential().deleteCredential();
	}

	/**
	 * The keystore-specific credential backing this entry.
	 */
	@NonNull
	public Credential getCredential() {
		return this.credential;
	}

	/**
	 * The backing credential as {@code type}, if that is what it is.
	 */
	@NonNull
	public <T> Optional<T> getCredentialAs(@NonNull Class<T> type) {
		requireNonNull(type);
		return getCredential().as(type);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{credential=%s}", getClass().getSimpleName(), getCredential());
	}
}
