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

import com.soklet.keyring.Credential;
import com.soklet.keyring.CredentialBuilder;
import com.soklet.keyring.Platform;
import com.soklet.keyring.exception.KeyringException;
import com.soklet.keyring.model.Identity;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * Keystore for tests whose credentials share one map, so separately created entries for the same identity see
 * the same record.
 * <p>
 * Like some native keystores, a credential without a target matches every stored record with the same service and
 * user, which makes ambiguity possible. Registered in {@code META-INF/services} under test resources.
 */
@ThreadSafe
public class SharedMapKeystoreProvider implements KeystoreProvider {
	@NonNull
	public static final String NAME = "shared-map";

	@NonNull
	@Override
	public String getName() {
		return NAME;
	}

	@NonNull
	@Override
	public Set<@NonNull Platform> getSupportedPlatforms() {
		return EnumSet.allOf(Platform.class);
	}

	@NonNull
	@Override
	public CredentialBuilder createCredentialBuilder() {
		return new SharedMapCredentialBuilder();
	}

	@ThreadSafe
	public static class SharedMapCredentialBuilder implements CredentialBuilder {
		@NonNull
		private final Map<@NonNull Identity, byte[]> records;

		public SharedMapCredentialBuilder() {
			this.records = new ConcurrentHashMap<>();
		}

		@NonNull
		@Override
		public SharedMapCredential build(@Nullable String target,
																		 @NonNull String service,
																		 @NonNull String user) throws KeyringException {
			requireNonNull(service);
			requireNonNull(user);

			if (service.length() > 64)
				throw KeyringException.tooLong("service", 64);

			return new SharedMapCredential(this.records, new Identity(target, service, user));
		}

		@NonNull
		@Override
		public Persistence getPersistence() {
			return Persistence.PROCESS_ONLY;
		}
	}

	@ThreadSafe
	public static class SharedMapCredential implements Credential {
		@NonNull
		private final Map<@NonNull Identity, byte[]> records;
		@NonNull
		private final Identity identity;

		public SharedMapCredential(@NonNull Map<@NonNull Identity, byte[]> records,
															 @NonNull Identity identity) {
			requireNonNull(records);
			requireNonNull(identity);

			this.records = records;
			this.identity = identity;
		}

		@Override
		public void setSecret(@NonNull byte[] secret) throws KeyringException {
			requireNonNull(secret);
			this.records.put(findSingleMatch().orElse(this.identity), secret.clone());
		}

		@NonNull
		@Override
		public byte[] getSecret() throws KeyringException {
			Identity match = findSingleMatch().orElseThrow(KeyringException::noEntry);
			byte[] secret = this.records.get(match);

			if (secret == null)
				throw KeyringException.noEntry();

			return secret.clone();
		}

		@Override
		public void deleteCredential() throws KeyringException {
			Identity match = findSingleMatch().orElseThrow(KeyringException::noEntry);

			if (this.records.remove(match) == null)
				throw KeyringException.noEntry();
		}

		@NonNull
		private Optional<Identity> findSingleMatch() throws KeyringException {
			if (this.identity.target() != null)
				return this.records.containsKey(this.identity) ? Optional.of(this.identity) : Optional.empty();

			List<@NonNull Identity> matches = new ArrayList<>();

			for (Identity candidate : this.records.keySet())
				if (candidate.service().equals(this.identity.service()) && candidate.user().equals(this.identity.user()))
					matches.add(candidate);

			if (matches.size() > 1) {
				List<@NonNull Credential> credentials = new ArrayList<>(matches.size());

				for (Identity match : matches)
					credentials.add(new SharedMapCredential(this.records, match));

				throw KeyringException.ambiguous(credentials);
			}

			return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
		}

		@NonNull
		public Identity getIdentity() {
			return this.identity;
		}
	}
}
