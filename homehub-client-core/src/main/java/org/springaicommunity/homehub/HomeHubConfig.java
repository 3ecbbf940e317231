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

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for a Home Hub connection.
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public final class HomeHubConfig {

	static final String URL_ENV = "HUB_URL";

	static final String USERNAME_ENV = "HUB_USERNAME";

	static final String PASSWORD_ENV = "HUB_PASSWORD";

	static final String DEBUG_ENV = "HUB_DEBUG";

	private static final String DEFAULT_TARGET_URL = "http://192.168.1.254";

	private static final String DEFAULT_USER_NAME = "admin";

	private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

	private final String targetUrl;

	private final Credentials credentials;

	private final boolean debugLogging;

	private final Duration timeout;

	private HomeHubConfig(Builder builder) {
		String url = builder.targetUrl != null ? builder.targetUrl : DEFAULT_TARGET_URL;
		this.targetUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
		this.credentials = new Credentials(builder.userName != null ? builder.userName : DEFAULT_USER_NAME,
				Objects.requireNonNull(builder.password, "Password cannot be null"));
		this.debugLogging = builder.debugLogging;
		this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
	}

	public String targetUrl() {
		return targetUrl;
	}

	public Credentials credentials() {
		return credentials;
	}

	public String userName() {
		return credentials.userName();
	}

	public boolean debugLogging() {
		return debugLogging;
	}

	public Duration timeout() {
		return timeout;
	}

	/**
	 * Creates a new builder seeded from the HUB_URL, HUB_USERNAME, HUB_PASSWORD and
	 * HUB_DEBUG environment variables.
	 * @return a new builder
	 * @throws IllegalStateException if HUB_PASSWORD is not set
	 */
	public static Builder builder() {
		String password = System.getenv(PASSWORD_ENV);
		if (password == null || password.isBlank()) {
			throw new IllegalStateException(PASSWORD_ENV + " environment variable is not set");
		}
		Builder builder = new Builder().password(password);
		String url = System.getenv(URL_ENV);
		if (url != null && !url.isBlank()) {
			builder.targetUrl(url);
		}
		String userName = System.getenv(USERNAME_ENV);
		if (userName != null && !userName.isBlank()) {
			builder.userName(userName);
		}
		return builder.debugLogging(Boolean.parseBoolean(System.getenv(DEBUG_ENV)));
	}

	/**
	 * Creates a new builder with the specified password.
	 * @param password the admin password
	 * @return a new builder
	 */
	public static Builder builder(String password) {
		return new Builder().password(password);
	}

	public static class Builder {

		private String targetUrl;

		private String userName;

		private String password;

		private boolean debugLogging;

		private Duration timeout;

		public Builder targetUrl(String targetUrl) {
			this.targetUrl = targetUrl;
			return this;
		}

		public Builder userName(String userName) {
			this.userName = userName;
			return this;
		}

		public Builder password(String password) {
			this.password = password;
			return this;
		}

		public Builder debugLogging(boolean debugLogging) {
			this.debugLogging = debugLogging;
			return this;
		}

		public Builder timeout(Duration timeout) {
			this.timeout = timeout;
			return this;
		}

		public HomeHubConfig build() {
			return new HomeHubConfig(this);
		}

	}

}
