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

import com.soklet.keyring.CredentialBuilder;
import com.soklet.keyring.model.Identity;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.concurrent.atomic.AtomicLong;

import static java.util.Objects.requireNonNull;

/**
 * Mock implementation of {@link CredentialBuilder} which needs no operating system resources.
 * <p>
 * Used when no native keystore is enabled for the current platform, and by tests.
 * Every credential it builds is independent: two entries for the same identity do not share storage.
 */
@ThreadSafe
public class MockCredentialBuilder implements CredentialBuilder {
	@NonNull
	private final AtomicLong buildCount;

	public MockCredentialBuilder() {
		this.buildCount = new AtomicLong();
	}

	@NonNull
	@Override
	public MockCredential build(@Nullable String target,
															@NonNull String service,
															@NonNull String user) {
		requireNonNull(service);
		requireNonNull(user);

		getBuildCount().incrementAndGet();
		return new MockCredential(new Identity(target, service, user));
	}

	@NonNull
	@Override
	public Persistence getPersistence() {
		return Persistence.ENTRY_ONLY;
	}

	@NonNull
	public Long getBuiltCredentialCount() {
		return getBuildCount().get();
	}

	@NonNull
	private AtomicLong getBuildCount() {
		return this.buildCount;
	}
}
