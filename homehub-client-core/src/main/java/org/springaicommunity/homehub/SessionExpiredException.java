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
 * Thrown when the device rejects a request because the session it names is no longer
 * valid. The session state has already been invalidated when this is thrown; the caller
 * decides whether to log in again and re-issue the call.
 *
 * @since 0.1.0
 */
public class SessionExpiredException extends HomeHubException {

	static final String MESSAGE = "Invalid user session";

	private final DeviceStatus status;

	public SessionExpiredException(DeviceStatus status) {
		super(MESSAGE);
		this.status = status;
	}

	/**
	 * The status as reported by the device, including its own description text.
	 * @return the device status
	 */
	public DeviceStatus getStatus() {
		return status;
	}

}
