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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the device's session protocol: the login handshake, the call primitive and
 * detection of expired sessions.
 *
 * <p>
 * The device accepts one authenticated session at a time and tracks a strictly
 * increasing request counter, so {@link #login()} and {@link #call(List)} are serialized
 * on a single lock. Both block until the transport completes or times out.
 * </p>
 *
 * <p>
 * Nothing is retried here. When the device reports the session as invalid the state is
 * invalidated and a {@link SessionExpiredException} is thrown. Logging in again and
 * re-issuing the call is left to the caller.
 * </p>
 *
 * <pre>{@code
 * HomeHubSession session = new HomeHubSession(config.credentials(), transport);
 * session.login();
 * ResponseEnvelope reply = session.call(Action.getValue("Device/DeviceInfo/SoftwareVersion"));
 * String version = reply.reply(0).value().asText();
 * }</pre>
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public class HomeHubSession {

	private static final Logger logger = LoggerFactory.getLogger(HomeHubSession.class);

	static final String LOGIN_METHOD = "logIn";

	private final SessionState state;

	private final HomeHubTransport transport;

	private final EnvelopeCodec codec;

	private final ReentrantLock lock = new ReentrantLock();

	private volatile SessionPhase phase = SessionPhase.LOGGED_OUT;

	public HomeHubSession(Credentials credentials, HomeHubTransport transport) {
		this(new SessionState(credentials), transport, new EnvelopeCodec());
	}

	public HomeHubSession(SessionState state, HomeHubTransport transport, EnvelopeCodec codec) {
		this.state = Objects.requireNonNull(state, "state cannot be null");
		this.transport = Objects.requireNonNull(transport, "transport cannot be null");
		this.codec = Objects.requireNonNull(codec, "codec cannot be null");
	}

	/**
	 * Performs the login handshake and stores the session id and nonce the device
	 * issues.
	 * @return true if the device issued a session
	 * @throws DeviceErrorException if the device rejects the login
	 * @throws TransportException if the exchange fails
	 * @throws MalformedResponseException if the reply cannot be decoded
	 */
	public boolean login() {
		lock.lock();
		try {
			transition(SessionPhase.AUTHENTICATING);
			boolean loggedIn = false;
			try {
				RequestEnvelope envelope = RequestEnvelope.create(state, List.of(loginAction(state.userName())));
				ResponseEnvelope reply = send(envelope);

				DeviceStatus failure = reply.firstFailure().orElse(null);
				if (failure != null) {
					throw new DeviceErrorException(failure);
				}

				JsonNode parameters = reply.reply(0).parameters();
				state.applyLoginResult(token(parameters.get("id")), token(parameters.get("nonce")));
				loggedIn = state.isLoggedIn();
				return loggedIn;
			}
			finally {
				transition(loggedIn || state.isLoggedIn() ? SessionPhase.LOGGED_IN : SessionPhase.LOGGED_OUT);
			}
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Sends one or more actions in a single envelope.
	 * @param actions the actions; numbered by position before sending
	 * @return the decoded reply
	 * @throws NotAuthenticatedException if no session is held; nothing is sent
	 * @throws SessionExpiredException if the device no longer accepts the session
	 * @throws DeviceErrorException for any other device-reported error
	 * @throws TransportException if the exchange fails
	 * @throws MalformedResponseException if the reply cannot be decoded
	 */
	public ResponseEnvelope call(List<Action> actions) {
		lock.lock();
		try {
			if (!state.isLoggedIn()) {
				throw new NotAuthenticatedException("Not logged in; call login() before issuing actions");
			}
			RequestEnvelope envelope = RequestEnvelope.create(state, actions);
			ResponseEnvelope reply = send(envelope);

			DeviceStatus expired = findInvalidSession(reply);
			if (expired != null) {
				state.invalidate();
				transition(SessionPhase.EXPIRED);
				throw new SessionExpiredException(expired);
			}
			DeviceStatus failure = reply.firstFailure().orElse(null);
			if (failure != null) {
				throw new DeviceErrorException(failure);
			}
			return reply;
		}
		finally {
			lock.unlock();
		}
	}

	public ResponseEnvelope call(Action... actions) {
		return call(Arrays.asList(actions));
	}

	public boolean isLoggedIn() {
		return state.isLoggedIn();
	}

	public SessionPhase phase() {
		return phase;
	}

	public SessionState state() {
		return state;
	}

	private ResponseEnvelope send(RequestEnvelope envelope) {
		logger.debug("Sending request {} with {} action(s)", envelope.requestId(), envelope.actions().size());
		byte[] body = transport.exchange(codec.encode(envelope));
		return codec.decode(body);
	}

	private void transition(SessionPhase next) {
		if (phase != next) {
			logger.debug("Session phase {} -> {}", phase, next);
			phase = next;
		}
	}

	private static DeviceStatus findInvalidSession(ResponseEnvelope reply) {
		if (reply.status().isInvalidSession()) {
			return reply.status();
		}
		for (ResponseEnvelope.ActionReply action : reply.replies().values()) {
			if (action.status().isInvalidSession()) {
				return action.status();
			}
		}
		return null;
	}

	// Numeric ids are kept as their literal text
	private static String token(JsonNode node) {
		return node == null || node.isNull() ? "" : node.asText();
	}

	static Action loginAction(String userName) {
		Map<String, Object> contextFlags = new LinkedHashMap<>();
		contextFlags.put("get-content-name", true);
		contextFlags.put("local-time", true);

		Map<String, Object> capabilityFlags = new LinkedHashMap<>();
		capabilityFlags.put("name", true);
		capabilityFlags.put("default-value", false);
		capabilityFlags.put("restriction", true);
		capabilityFlags.put("description", false);

		Map<String, Object> sessionOptions = new LinkedHashMap<>();
		sessionOptions.put("nss", List.of(Map.of("name", "gtw", "uri", "http://sagemcom.com/gateway-data")));
		sessionOptions.put("language", "ident");
		sessionOptions.put("context-flags", contextFlags);
		sessionOptions.put("capability-depth", 2);
		sessionOptions.put("capability-flags", capabilityFlags);
		sessionOptions.put("time-format", "ISO_8601");

		Map<String, Object> parameters = new LinkedHashMap<>();
		parameters.put("user", userName);
		parameters.put("persistent", "true");
		parameters.put("session-options", sessionOptions);
		return Action.of(LOGIN_METHOD, "", parameters);
	}

}
