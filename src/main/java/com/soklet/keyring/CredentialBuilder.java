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

/**
 * Contract for mapping an identity onto a keystore-specific {@link Credential}.
 * <p>
 * Implementations are shared by every thread that creates entries, so {@link #build(String, String, String)}
 * must be safe to call concurrently and must not carry state from one call to the next.
 */
public interface CredentialBuilder {
	@NonNull
	Credential build(@Nullable String target,
									 @NonNull String service,
									 @NonNull String user) throws KeyringException;

	/**
	 * How long the credentials this builder produces keep their secrets.
	 */
	@NonNull
	default Persistence getPersistence() {
		return Persistence.UNSPECIFIED;
	}

	enum Persistence {
		// Lives only as long as the credential object itself
		ENTRY_ONLY,
		// Lives until the process exits
		PROCESS_ONLY,
		// Lives until the machine reboots
		UNTIL_REBOOT,
		// Lives until explicitly deleted
		UNTIL_DELETE,
		UNSPECIFIED
	}
}
