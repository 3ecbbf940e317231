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
 * Moves encoded envelopes to and from the device.
 *
 * <p>
 * Implementations know nothing about sessions or envelopes. Every failure, including a
 * non-success HTTP status, is reported as a {@link TransportException}. Implementations
 * must not retry: the device is stateful and a repeated write could be applied twice.
 * </p>
 *
 * @since 0.1.0
 */
public interface HomeHubTransport {

	/**
	 * Sends an encoded request envelope and returns the raw reply.
	 * @param envelope the encoded request
	 * @return the reply body
	 * @throws TransportException if the exchange fails
	 */
	byte[] exchange(byte[] envelope);

	/**
	 * Downloads a file the device generated in response to an earlier action, such as
	 * the event log or a statistics export.
	 * @param path the path relative to the device's base URL, starting with a slash
	 * @return the file contents
	 * @throws TransportException if the download fails
	 */
	default byte[] fetch(String path) {
		throw new TransportException("File download is not supported by " + getClass().getSimpleName());
	}

}
