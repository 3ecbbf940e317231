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
 * Lifecycle of a {@link HomeHubSession}.
 *
 * <pre>
 * LOGGED_OUT -> AUTHENTICATING -> LOGGED_IN -> EXPIRED
 *     ^               |                           |
 *     +--- (failed) --+                           |
 * AUTHENTICATING <------------- (login) ----------+
 * </pre>
 *
 * @since 0.1.0
 */
public enum SessionPhase {

	/** No session id. Only {@link HomeHubSession#login()} moves out of this phase. */
	LOGGED_OUT,

	/** A login exchange is in flight. */
	AUTHENTICATING,

	/** A session id is held; calls are allowed. */
	LOGGED_IN,

	/** The device reported the session as invalid. Treated as logged out. */
	EXPIRED

}
