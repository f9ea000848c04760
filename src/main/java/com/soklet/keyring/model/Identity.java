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

package com.soklet.keyring.model;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Names a logical secret: a service and user, optionally disambiguated by a target.
 * <p>
 * Empty strings are legal for every component. How an identity maps onto records in a keystore
 * (and whether two identities can collide there) is up to the keystore.
 */
public record Identity(
		@Nullable String target,
		@NonNull String service,
		@NonNull String user
) {
	public Identity {
		requireNonNull(service);
		requireNonNull(user);
	}

	@NonNull
	public static Identity of(@NonNull String service,
														@NonNull String user) {
		return new Identity(null, service, user);
	}

	@NonNull
	public static Identity withTarget(@NonNull String target,
																		@NonNull String service,
																		@NonNull String user) {
		requireNonNull(target);
		return new Identity(target, service, user);
	}

	@NonNull
	public Optional<String> getTarget() {
		return Optional.ofNullable(target());
	}

	@Override
	@NonNull
	public String toString() {
		if (target() == null)
			return format("%s{service=%s, user=%s}", getClass().getSimpleName(), service(), user());

		return format("%s{target=%s, service=%s, user=%s}", getClass().getSimpleName(), target(), service(), user());
	}
}
