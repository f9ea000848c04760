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
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

import static java.util.Objects.requireNonNull;

/**
 * Strict UTF-8 conversions between passwords and stored secrets.
 * <p>
 * Unlike {@link String#String(byte[], java.nio.charset.Charset)} and {@link String#getBytes(java.nio.charset.Charset)},
 * malformed input is reported instead of being replaced.
 */
@ThreadSafe
public final class Encodings {
	@NonNull
	public static byte[] encodePassword(@NonNull String password) throws KeyringException {
		requireNonNull(password);

		try {
			ByteBuffer byteBuffer = StandardCharsets.UTF_8.newEncoder()
					.onMalformedInput(CodingErrorAction.REPORT)
					.onUnmappableCharacter(CodingErrorAction.REPORT)
					.encode(CharBuffer.wrap(password));

			byte[] bytes = new byte[byteBuffer.remaining()];
			byteBuffer.get(bytes);
			return bytes;
		} catch (CharacterCodingException e) {
			// Only reachable with unpaired surrogates
			throw KeyringException.invalid("password", "not representable as UTF-8");
		}
	}

	@NonNull
	public static String decodePassword(@NonNull byte[] bytes) throws KeyringException {
		requireNonNull(bytes);

		try {
			return StandardCharsets.UTF_8.newDecoder()
					.onMalformedInput(CodingErrorAction.REPORT)
					.onUnmappableCharacter(CodingErrorAction.REPORT)
					.decode(ByteBuffer.wrap(bytes))
					.toString();
		} catch (CharacterCodingException e) {
			throw KeyringException.badEncoding(bytes);
		}
	}

	private Encodings() {
		// Non-instantiable
	}
}
