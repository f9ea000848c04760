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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;

@ThreadSafe
public class NormalizerTests {
	@Test
	public void testTrimAggressively() {
		Assertions.assertEquals("secret-service", Normalizer.trimAggressivelyToNull("  secret-service\t"));
		Assertions.assertNull(Normalizer.trimAggressivelyToNull("   "));
		Assertions.assertNull(Normalizer.trimAggressivelyToNull(null));
		Assertions.assertEquals("", Normalizer.trimAggressively("  ").get());
	}

	@Test
	public void testTrimAggressivelyHandlesUnicodeSeparators() {
		Assertions.assertEquals("apple-native", Normalizer.trimAggressivelyToNull("\u00A0apple-native\u2003"));
		Assertions.assertEquals("secret service", Normalizer.trimAggressivelyToNull(" secret service "), "Inner whitespace must survive");
	}
}
