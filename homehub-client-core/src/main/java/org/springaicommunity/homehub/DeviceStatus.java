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
 * Status block carried by a reply, either for the whole request or for a single action.
 *
 * <p>
 * The device reports success with one of a few non-zero "no error" codes as well as
 * plain zero, so success is decided by {@link #isSuccess()} rather than by comparing
 * against zero.
 * </p>
 *
 * @param code the numeric device code
 * @param description the device's description of the code
 * @author Mark Pollack
 * @since 0.1.0
 */
public record DeviceStatus(long code, String description) {

	/** XMO_REQUEST_NO_ERR: the request as a whole was processed. */
	public static final long REQUEST_NO_ERROR = 16777216L;

	/** XMO_INVALID_SESSION_ERR: the session id is unknown or has timed out. */
	public static final long INVALID_SESSION = 16777219L;

	/** XMO_NO_ERR: the action was processed. */
	public static final long NO_ERROR = 16777238L;

	/** Status used when a reply carries no error block at all. */
	public static final DeviceStatus OK = new DeviceStatus(0L, "");

	public DeviceStatus {
		description = description != null ? description : "";
	}

	public boolean isSuccess() {
		return code == 0L || code == REQUEST_NO_ERROR || code == NO_ERROR;
	}

	public boolean isInvalidSession() {
		return code == INVALID_SESSION;
	}

}
