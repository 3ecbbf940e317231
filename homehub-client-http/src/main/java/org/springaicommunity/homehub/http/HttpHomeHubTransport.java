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
package org.springaicommunity.homehub.http;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.homehub.HomeHubConfig;
import org.springaicommunity.homehub.HomeHubTransport;
import org.springaicommunity.homehub.TransportException;

/**
 * HTTP transport for the Home Hub JSON API.
 *
 * <p>
 * Envelopes are posted to {@code <targetUrl>/cgi/json-req} as the {@code req} field of
 * a URL-encoded form, which is how the hub's own web UI talks to it. Authentication
 * travels inside the envelope, so no HTTP authentication headers are sent. Files the
 * hub generates (event log, statistics export) are downloaded with a plain GET.
 * </p>
 *
 * <p>
 * Request and reply bodies are logged at DEBUG, or at INFO when
 * {@link HomeHubConfig#debugLogging()} is enabled.
 * </p>
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public class HttpHomeHubTransport implements HomeHubTransport {

	private static final Logger logger = LoggerFactory.getLogger(HttpHomeHubTransport.class);

	static final String REQUEST_PATH = "/cgi/json-req";

	static final String REQUEST_FIELD = "req";

	private static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded; charset=UTF-8";

	private final HomeHubConfig config;

	private final HttpClient httpClient;

	public HttpHomeHubTransport(HomeHubConfig config) {
		this(config, HttpClient.newBuilder().connectTimeout(config.timeout()).build());
	}

	public HttpHomeHubTransport(HomeHubConfig config, HttpClient httpClient) {
		this.config = Objects.requireNonNull(config, "config cannot be null");
		this.httpClient = Objects.requireNonNull(httpClient, "httpClient cannot be null");
	}

	@Override
	public byte[] exchange(byte[] envelope) {
		String json = new String(envelope, StandardCharsets.UTF_8);
		String form = REQUEST_FIELD + "=" + URLEncoder.encode(json, StandardCharsets.UTF_8);

		HttpRequest httpRequest = HttpRequest.newBuilder()
			.uri(URI.create(config.targetUrl() + REQUEST_PATH))
			.header("Content-Type", FORM_CONTENT_TYPE)
			.header("Accept", "application/json")
			.POST(HttpRequest.BodyPublishers.ofString(form))
			.timeout(config.timeout())
			.build();

		trace("Request to {}: {}", httpRequest.uri(), json);
		byte[] body = send(httpRequest, "exchange envelope");
		trace("Reply from {}: {}", httpRequest.uri(), new String(body, StandardCharsets.UTF_8));
		return body;
	}

	@Override
	public byte[] fetch(String path) {
		String normalized = path.startsWith("/") ? path : "/" + path;
		HttpRequest httpRequest = HttpRequest.newBuilder()
			.uri(URI.create(config.targetUrl() + normalized))
			.GET()
			.timeout(config.timeout())
			.build();

		trace("Fetching {}", httpRequest.uri());
		byte[] body = send(httpRequest, "fetch " + normalized);
		trace("Fetched {} bytes from {}", body.length, httpRequest.uri());
		return body;
	}

	private byte[] send(HttpRequest httpRequest, String operation) {
		try {
			HttpResponse<byte[]> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
			if (response.statusCode() != 200) {
				throw new TransportException("Failed to " + operation + ": " + response.statusCode() + " - "
						+ new String(response.body(), StandardCharsets.UTF_8));
			}
			return response.body();
		}
		catch (HttpTimeoutException e) {
			throw new TransportException("Timed out after " + config.timeout() + " trying to " + operation, e);
		}
		catch (IOException | InterruptedException e) {
			if (e instanceof InterruptedException) {
				Thread.currentThread().interrupt();
			}
			throw new TransportException("Failed to " + operation + " at " + config.targetUrl(), e);
		}
	}

	private void trace(String format, Object... args) {
		if (config.debugLogging()) {
			logger.info(format, args);
		}
		else {
			logger.debug(format, args);
		}
	}

}
