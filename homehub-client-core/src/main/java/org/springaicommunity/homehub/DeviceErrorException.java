/*
 * Copyright 2024 Spring AI Community
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.springaicommunity.homehub;

/**
 * Structured error returned by the device, such as an unknown path or a non-writable
 * parameter. The code and description are passed through exactly as the device sent
 * them.
 *
 * @since 0.1.0
 */
public class DeviceErrorException extends HomeHubException {

	private final long code;

	private final String description;

	public DeviceErrorException(DeviceStatus status) {
		this(status.code(), status.description());
	}

	public DeviceErrorException(long code, String description) {
		super(description);
		this.code = code;
		this.description = description;
	}

	public long getCode() {
		return code;
	}

	public String getDescription() {
		return description;
	}

}
