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
 * Base exception for all Home Hub client failures.
 *
 * <p>
 * Unchecked so that catalogue methods stay free of throws clauses. Callers that need to
 * react to a particular failure (for example to log in again after the device expired
 * the session) catch the specific subclass.
 * </p>
 *
 * @author Mark Pollack
 * @since 0.1.0
 * @see NotAuthenticatedException
 * @see SessionExpiredException
 * @see DeviceErrorException
 * @see TransportException
 * @see MalformedResponseException
 */
public class HomeHubException extends RuntimeException {

	public HomeHubException(String message) {
		super(message);
	}

	public HomeHubException(String message, Throwable cause) {
		super(message, cause);
	}

}
