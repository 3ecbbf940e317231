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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One outbound message: the session it belongs to, the request id and the ordered
 * actions to run.
 *
 * @param requestId the request counter value consumed by this envelope
 * @param sessionId the session id, or {@link #ANONYMOUS_SESSION} before login
 * @param nonce the device nonce the auth key was derived from
 * @param cnonce the client nonce
 * @param authKey digest binding the envelope to the session's secrets
 * @param actions the actions, numbered by batch position
 * @since 0.1.0
 */
public record RequestEnvelope(long requestId, String sessionId, String nonce, String cnonce, String authKey,
		List<Action> actions) {

	/** Session id sent while no session has been issued. */
	public static final String ANONYMOUS_SESSION = "0";

	public RequestEnvelope {
		Objects.requireNonNull(sessionId, "sessionId cannot be null");
		Objects.requireNonNull(nonce, "nonce cannot be null");
		Objects.requireNonNull(cnonce, "cnonce cannot be null");
		Objects.requireNonNull(authKey, "authKey cannot be null");
		Objects.requireNonNull(actions, "actions cannot be null");
		if (actions.isEmpty()) {
			throw new IllegalArgumentException("An envelope needs at least one action");
		}
		actions = List.copyOf(actions);
	}

	/**
	 * Builds the envelope for the given actions, consuming exactly one request id from
	 * the state however many actions are batched.
	 * @param state the session state
	 * @param actions the actions to send
	 * @return the envelope
	 */
	public static RequestEnvelope create(SessionState state, List<Action> actions) {
		if (actions.isEmpty()) {
			throw new IllegalArgumentException("An envelope needs at least one action");
		}
		List<Action> numbered = new ArrayList<>(actions.size());
		for (int i = 0; i < actions.size(); i++) {
			numbered.add(actions.get(i).withId(i));
		}
		synchronized (state) {
			long requestId = state.nextRequestId();
			String sessionId = state.isLoggedIn() ? state.sessionId() : ANONYMOUS_SESSION;
			String authKey = AuthDigest.authKey(state.userName(), state.password(), state.nonce(), requestId,
					state.cnonce());
			return new RequestEnvelope(requestId, sessionId, state.nonce(), state.cnonce(), authKey, numbered);
		}
	}

}
