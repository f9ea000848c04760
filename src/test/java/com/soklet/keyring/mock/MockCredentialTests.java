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

import com.soklet.keyring.CredentialBuilder.Persistence;
import com.soklet.keyring.exception.KeyringException;
import com.soklet.keyring.exception.KeyringException.FailureReason;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

@ThreadSafe
public class MockCredentialTests {
	@Test
	public void testInjectedErrorIsThrownOnce() throws KeyringException {
		MockCredential credential = new MockCredentialBuilder().build(null, "svc", "alice");
		credential.presetPassword("hunter2");

		credential.setError(KeyringException.platformFailure(new RuntimeException("boom")));

		KeyringException e = Assertions.assertThrows(KeyringException.class, credential::getPassword);
		Assertions.assertEquals(FailureReason.PLATFORM_FAILURE, e.getFailureReason());
		Assertions.assertEquals("boom", e.getCause().getMessage());

		// The stored value survives, and the next call behaves normally
		Assertions.assertEquals("hunter2", credential.getPassword());
	}

	@Test
	public void testInjectedErrorBlocksDelete() throws KeyringException {
		MockCredentialBuilder credentialBuilder = new MockCredentialBuilder();
		MockCredential credential = credentialBuilder.build(null, "svc", "alice");
		credential.presetSecret(new byte[]{42});
		credential.setError(KeyringException.ambiguous(List.of(credential, credentialBuilder.build("other", "svc", "alice"))));

		Assertions.assertEquals(FailureReason.AMBIGUOUS,
				Assertions.assertThrows(KeyringException.class, credential::deleteCredential).getFailureReason());
		Assertions.assertArrayEquals(new byte[]{42}, credential.getSecret(), "Failed delete removed the value");

		credential.deleteCredential();
		Assertions.assertEquals(FailureReason.NO_ENTRY,
				Assertions.assertThrows(KeyringException.class, credential::deleteCredential).getFailureReason());
	}

	@Test
	public void testStoredBytesAreIsolatedFromCallers() throws KeyringException {
		MockCredential credential = new MockCredentialBuilder().build(null, "svc", "alice");
		byte[] secret = new byte[]{1, 2, 3};

		credential.setSecret(secret);
		secret[0] = 9;

		byte[] retrieved = credential.getSecret();
		Assertions.assertArrayEquals(new byte[]{1, 2, 3}, retrieved);

		retrieved[1] = 9;
		Assertions.assertArrayEquals(new byte[]{1, 2, 3}, credential.getSecret());
	}

	@Test
	public void testCredentialsAreIndependent() throws KeyringException {
		MockCredentialBuilder credentialBuilder = new MockCredentialBuilder();
		MockCredential first = credentialBuilder.build(null, "svc", "alice");
		MockCredential second = credentialBuilder.build(null, "svc", "alice");

		first.presetPassword("first");

		Assertions.assertEquals(Persistence.ENTRY_ONLY, credentialBuilder.getPersistence());
		Assertions.assertEquals(2L, credentialBuilder.getBuiltCredentialCount());
		Assertions.assertEquals("first", first.getPassword());
		Assertions.assertEquals(FailureReason.NO_ENTRY,
				Assertions.assertThrows(KeyringException.class, second::getPassword).getFailureReason());
	}

	@Test
	public void testConcurrentWritesAreDataRaceFree() throws Exception {
		MockCredential credential = new MockCredentialBuilder().build(null, "svc", "alice");
		ExecutorService executorService = Executors.newFixedThreadPool(8);

		try {
			List<Future<?>> futures = new ArrayList<>();

			for (int i = 0; i < 8; i++) {
				byte value = (byte) i;

				futures.add(executorService.submit(() -> {
					for (int j = 0; j < 500; j++) {
						credential.setSecret(new byte[]{value, value, value});
						byte[] secret = credential.getSecret();

						// Every read sees one complete write
						Assertions.assertEquals(3, secret.length);
						Assertions.assertTrue(secret[0] == secret[1] && secret[1] == secret[2], "Observed a torn write");
					}

					return null;
				}));
			}

			for (Future<?> future : futures)
				future.get(30, TimeUnit.SECONDS);
		} finally {
			executorService.shutdownNow();
		}
	}
}
