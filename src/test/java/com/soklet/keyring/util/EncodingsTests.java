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

package com.soklet.keyring.util;

import com.soklet.keyring.exception.KeyringException;
import com.soklet.keyring.exception.KeyringException.FailureReason;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;

@ThreadSafe
public class EncodingsTests {
	@Test
	public void testMultiByteEncoding() throws KeyringException {
		String password = "このきれいな花は桜です";
		Assertions.assertArrayEquals(password.getBytes(StandardCharsets.UTF_8), Encodings.encodePassword(password));
		Assertions.assertEquals(password, Encodings.decodePassword(password.getBytes(StandardCharsets.UTF_8)));
	}

	@Test
	public void testMalformedBytesAreReportedNotReplaced() {
		// Overlong encoding of '/', plus a truncated multi-byte sequence
		byte[] malformed = new byte[]{(byte) 0xC0, (byte) 0xAF, (byte) 0xE3, (byte) 0x81};

		KeyringException e = Assertions.assertThrows(KeyringException.class, () -> Encodings.decodePassword(malformed));

		Assertions.assertEquals(FailureReason.BAD_ENCODING, e.getFailureReason());
		Assertions.assertArrayEquals(malformed, e.getBadEncodingBytes().get());

		// Callers get copies, never the exception's own array
		e.getBadEncodingBytes().get()[0] = 0;
		Assertions.assertArrayEquals(malformed, e.getBadEncodingBytes().get());
	}

	@Test
	public void testUnpairedSurrogateIsInvalid() {
		KeyringException e = Assertions.assertThrows(KeyringException.class, () -> Encodings.encodePassword("\uDC00"));

		Assertions.assertEquals(FailureReason.INVALID, e.getFailureReason());
		Assertions.assertEquals("password", e.getAttribute().get());
		Assertions.assertTrue(e.getDescription().isPresent());
	}
}
