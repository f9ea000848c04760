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

import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Thrown when the set of enabled keystores cannot work on this platform, e.g. two are enabled for it.
 */
@NotThreadSafe
public class KeystoreConfigurationException extends RuntimeException {
	public KeystoreConfigurationException(@Nullable String message) {
		super(message);
	}

	public KeystoreConfigurationException(@Nullable String message,
																				@Nullable Throwable cause) {
		super(message, cause);
	}
}
