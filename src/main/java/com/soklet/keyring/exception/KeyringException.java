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

package com.soklet.keyring.exception;

import com.soklet.keyring.Credential;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Portable failure raised by every fallible keyring operation.
 * <p>
 * Backend-specific problems are classified into a {@link FailureReason}; anything a backend cannot classify
 * more precisely is a {@link FailureReason#PLATFORM_FAILURE} with the backend's exception attached as the cause.
 */
@NotThreadSafe
public class KeyringException extends Exception {
	@NonNull
	private final FailureReason failureReason;
	@Nullable
	private final byte[] badEncodingBytes;
	@Nullable
	private final String attribute;
	@Nullable
	private final String description;
	@Nullable
	private final Integer limit;
	// Not serialized: credentials are live keystore handles
	@Nullable
	private final transient List<@NonNull Credential> ambiguousCredentials;

	public enum FailureReason {
		// Nothing is stored for the identity
		NO_ENTRY,
		// More than one stored record matched the identity
		AMBIGUOUS,
		// Stored bytes are not valid UTF-8 and were read as a password
		BAD_ENCODING,
		// An attribute is longer than the backend permits
		TOO_LONG,
		// An attribute has a value the backend cannot accept
		INVALID,
		// The storage mechanism could not be reached
		NO_STORAGE_ACCESS,
		// Anything else the backend reported
		PLATFORM_FAILURE
	}

	@NonNull
	public static KeyringException noEntry() {
		return new KeyringException(FailureReason.NO_ENTRY, "No matching entry found in secure storage", null,
				null, null, null, null, List.of());
	}

	@NonNull
	public static KeyringException ambiguous(@NonNull List<@NonNull Credential> credentials) {
		requireNonNull(credentials);

		if (credentials.size() < 2)
			throw new IllegalArgumentException(format("An ambiguous entry is matched by at least 2 credentials, but %d were supplied",
					credentials.size()));

		return new KeyringException(FailureReason.AMBIGUOUS,
				format("Entry is matched by %d credentials", credentials.size()), null, null, null, null, null,
				List.copyOf(credentials));
	}

	@NonNull
	public static KeyringException badEncoding(@NonNull byte[] bytes) {
		requireNonNull(bytes);

		return new KeyringException(FailureReason.BAD_ENCODING, "Data is not UTF-8 encoded", null,
				bytes.clone(), null, null, null, List.of());
	}

	@NonNull
	public static KeyringException tooLong(@NonNull String attribute,
																				 @NonNull Integer limit) {
		requireNonNull(attribute);
		requireNonNull(limit);

		return new KeyringException(FailureReason.TOO_LONG,
				format("Attribute '%s' is longer than platform limit of %d chars", attribute, limit), null, null,
				attribute, null, limit, List.of());
	}

	@NonNull
	public static KeyringException invalid(@NonNull String attribute,
																				 @NonNull String description) {
		requireNonNull(attribute);
		requireNonNull(description);

		return new KeyringException(FailureReason.INVALID,
				format("Attribute '%s' is invalid: %s", attribute, description), null, null, attribute, description,
				null, List.of());
	}

	@NonNull
	public static KeyringException noStorageAccess(@NonNull Throwable cause) {
		requireNonNull(cause);

		return new KeyringException(FailureReason.NO_STORAGE_ACCESS,
				format("Couldn't access platform secure storage: %s", describe(cause)), cause, null, null, null,
				null, List.of());
	}

	@NonNull
	public static KeyringException platformFailure(@NonNull Throwable cause) {
		requireNonNull(cause);

		return new KeyringException(FailureReason.PLATFORM_FAILURE,
				format("Platform secure storage failure: %s", describe(cause)), cause, null, null, null, null,
				List.of());
	}

	private KeyringException(@NonNull FailureReason failureReason,
													 @NonNull String message,
													 @Nullable Throwable cause,
													 @Nullable byte[] badEncodingBytes,
													 @Nullable String attribute,
													 @Nullable String description,
													 @Nullable Integer limit,
													 @NonNull List<@NonNull Credential> ambiguousCredentials) {
		super(requireNonNull(message), cause);
		requireNonNull(failureReason);
		requireNonNull(ambiguousCredentials);

		this.failureReason = failureReason;
		this.badEncodingBytes = badEncodingBytes;
		this.attribute = attribute;
		this.description = description;
		this.limit = limit;
		this.ambiguousCredentials = ambiguousCredentials;
	}

	@NonNull
	private static String describe(@NonNull Throwable cause) {
		requireNonNull(cause);
		return cause.getMessage() == null ? cause.toString() : cause.getMessage();
	}

	@NonNull
	public FailureReason getFailureReason() {
		return this.failureReason;
	}

	/**
	 * The raw stored bytes, present only for {@link FailureReason#BAD_ENCODING}.
	 * Each call returns a fresh copy.
	 */
	@NonNull
	public Optional<byte[]> getBadEncodingBytes() {
		return this.badEncodingBytes == null ? Optional.empty() : Optional.of(this.badEncodingBytes.clone());
	}

	@NonNull
	public Optional<String> getAttribute() {
		return Optional.ofNullable(this.attribute);
	}

	@NonNull
	public Optional<String> getDescription() {
		return Optional.ofNullable(this.description);
	}

	@NonNull
	public Optional<Integer> getLimit() {
		return Optional.ofNullable(this.limit);
	}

	/**
	 * The credentials that matched, populated only for {@link FailureReason#AMBIGUOUS}.
	 * Empty on a deserialized copy.
	 */
	@NonNull
	public List<@NonNull Credential> getAmbiguousCredentials() {
		return this.ambiguousCredentials == null ? List.of() : this.ambiguousCredentials;
	}
}
