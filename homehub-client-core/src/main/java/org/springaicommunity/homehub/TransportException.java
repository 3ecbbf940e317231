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
 * Thrown when the HTTP exchange with the device fails: connection refused, timeout,
 * interruption or a non-200 status.
 *
 * <p>
 * The request may or may not have reached the device, so the session's request counter
 * is in an unknown position from the device's point of view. Requests are never retried
 * automatically.
 * </p>
 *
 * @since 0.1.0
 */
public class TransportException extends HomeHubException {

	public TransportException(String message) {
		super(message);
	}

	public TransportException(String message, Throwable cause) {
		super(message, cause);
	}

}
