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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Digest scheme the device uses to bind each request to the session's secrets.
 *
 * <p>
 * The password never travels on the wire. Each request instead carries an auth key
 * derived from the credentials, the device nonce, the request id and the client nonce:
 * </p>
 *
 * <pre>
 * credentialHash = md5(user ":" nonce ":" md5(password))
 * authKey        = md5(credentialHash ":" requestId ":" cnonce ":JSON:/cgi/json-req")
 * </pre>
 *
 * @since 0.1.0
 */
final class AuthDigest {

	static final String REQUEST_URI = "/cgi/json-req";

	private AuthDigest() {
	}

	static String authKey(String userName, String password, String nonce, long requestId, String cnonce) {
		String credentialHash = md5Hex(userName + ":" + nonce + ":" + md5Hex(password));
		return md5Hex(credentialHash + ":" + requestId + ":" + cnonce + ":JSON:" + REQUEST_URI);
	}

	static String md5Hex(String value) {
		try {
			MessageDigest digest = MessageDigest.getInstance("MD5");
			return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
		}
		catch (NoSuchAlgorithmException e) {
			// MD5 is a required algorithm on every Java platform
			throw new IllegalStateException("MD5 not available", e);
		}
	}

}
