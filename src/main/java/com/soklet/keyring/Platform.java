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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * Operating system families that keystores can target.
 */
public enum Platform {
	LINUX,
	FREEBSD,
	OPENBSD,
	MACOS,
	IOS,
	WINDOWS,
	OTHER;

	@NonNull
	public static Platform current() {
		return fromOsName(System.getProperty("os.name"));
	}

	@NonNull
	public static Platform fromOsName(@Nullable String osName) {
		if (osName == null)
			return OTHER;

		String normalizedOsName = osName.trim().toLowerCase(Locale.ROOT);

		if (normalizedOsName.startsWith("linux"))
			return LINUX;
		if (normalizedOsName.startsWith("freebsd"))
			return FREEBSD;
		if (normalizedOsName.startsWith("openbsd"))
			return OPENBSD;
		if (normalizedOsName.startsWith("mac") || normalizedOsName.startsWith("darwin"))
			return MACOS;
		if (normalizedOsName.startsWith("ios"))
			return IOS;
		if (normalizedOsName.startsWith("windows"))
			return WINDOWS;

		return OTHER;
	}
}
