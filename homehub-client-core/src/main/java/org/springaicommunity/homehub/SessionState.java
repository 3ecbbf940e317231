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

import java.security.SecureRandom;
import java.util.Objects;

/**
 * Per-session identifiers and the rules for mutating them.
 *
 * <p>
 * Owned by a single {@link HomeHubSession}. The request counter starts at zero and is
 * consumed exactly once per outbound envelope, the login envelope included. It is never
 * reset; a fresh counter requires a fresh state instance. Session id, nonce and client
 * nonce are opaque tokens. They often look numeric but are never parsed as numbers.
 * </p>
 *
 * <p>
 * All accessors and mutators synchronize on this instance, so a caller that needs a
 * consistent view across several reads can hold the same monitor.
 * </p>
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public final class SessionState {

	private static final SecureRandom RANDOM = new SecureRandom();

	private final String cnonce;

	private String userName;

	private String password;

	private String sessionId = "";

	private String nonce = "";

	private long requestCounter;

	public SessionState(Credentials credentials) {
		this(credentials, Integer.toString(RANDOM.nextInt(Integer.MAX_VALUE)));
	}

	/**
	 * Creates a state with a fixed client nonce.
	 * @param credentials the account credentials
	 * @param cnonce the client nonce sent with every request
	 */
	public SessionState(Credentials credentials, String cnonce) {
		Objects.requireNonNull(credentials, "credentials cannot be null");
		this.userName = credentials.userName();
		this.password = credentials.password();
		this.cnonce = Objects.requireNonNull(cnonce, "cnonce cannot be null");
	}

	/**
	 * Returns the current request counter and advances it by one.
	 * @return the request id for the next outbound envelope
	 */
	public synchronized long nextRequestId() {
		return requestCounter++;
	}

	/**
	 * Records the session issued by a successful login.
	 * @param sessionId the device-issued session id
	 * @param nonce the device-issued challenge
	 */
	public synchronized void applyLoginResult(String sessionId, String nonce) {
		this.sessionId = sessionId != null ? sessionId : "";
		this.nonce = nonce != null ? nonce : "";
	}

	/**
	 * Drops the session id so the next call path has to log in again. Nonce and
	 * credentials are kept.
	 */
	public synchronized void invalidate() {
		this.sessionId = "";
	}

	public synchronized boolean isLoggedIn() {
		return !sessionId.isEmpty();
	}

	/**
	 * Replaces the credentials used for subsequent auth keys.
	 * @param userName the new user name
	 * @param password the new password
	 */
	public synchronized void updateCredentials(String userName, String password) {
		this.userName = Objects.requireNonNull(userName, "userName cannot be null");
		this.password = Objects.requireNonNull(password, "password cannot be null");
	}

	public synchronized String sessionId() {
		return sessionId;
	}

	public synchronized String nonce() {
		return nonce;
	}

	public synchronized String userName() {
		return userName;
	}

	synchronized String password() {
		return password;
	}

	public String cnonce() {
		return cnonce;
	}

	/**
	 * The value the next call to {@link #nextRequestId()} will return.
	 * @return the pending request id
	 */
	public synchronized long peekRequestId() {
		return requestCounter;
	}

	@Override
	public synchronized String toString() {
		return "SessionState{userName='" + userName + "', sessionId='" + sessionId + "', nonce='" + nonce
				+ "', requestCounter=" + requestCounter + "}";
	}

}
