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

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Converts envelopes to and from the device's JSON wire format.
 *
 * <p>
 * Requests are written as:
 * </p>
 *
 * <pre>{@code
 * {"request":{"id":3,"session-id":"987879","priority":false,
 *   "actions":[{"id":0,"method":"getValue","xpath":"Device/DeviceInfo/SoftwareVersion","parameters":{}}],
 *   "cnonce":"41023","auth-key":"5f2c...","nonce":"2355345"}}
 * }</pre>
 *
 * <p>
 * and replies are read from:
 * </p>
 *
 * <pre>{@code
 * {"reply":{"uid":0,"id":3,"error":{"code":16777216,"description":"XMO_REQUEST_NO_ERR"},
 *   "actions":[{"uid":1,"id":0,"error":{"code":16777238,"description":"XMO_NO_ERR"},
 *     "callbacks":[{"uid":1,"result":{...},"xpath":"Device/...","parameters":{"value":"SG4B10002244"}}]}],
 *   "events":[]}}
 * }</pre>
 *
 * <p>
 * The codec is stateless and thread-safe. Map-valued parameters are written with sorted
 * keys, so identical envelopes always encode to identical bytes.
 * </p>
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public class EnvelopeCodec {

	private final ObjectMapper objectMapper;

	public EnvelopeCodec() {
		this.objectMapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
			.configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
	}

	/**
	 * Encodes a request envelope.
	 * @param envelope the envelope
	 * @return the UTF-8 JSON bytes
	 */
	public byte[] encode(RequestEnvelope envelope) {
		List<WireAction> actions = new ArrayList<>(envelope.actions().size());
		for (Action action : envelope.actions()) {
			actions.add(new WireAction(action.id(), action.method(), action.xpath(), action.parameters()));
		}
		WireRequest request = new WireRequest(envelope.requestId(), envelope.sessionId(), false, actions,
				envelope.cnonce(), envelope.authKey(), envelope.nonce());
		try {
			return objectMapper.writeValueAsBytes(new WireRequestBody(request));
		}
		catch (JsonProcessingException e) {
			throw new HomeHubException("Failed to serialize request " + envelope.requestId(), e);
		}
	}

	/**
	 * Decodes a reply.
	 * @param body the raw reply bytes
	 * @return the decoded envelope
	 * @throws MalformedResponseException if the bytes are not a JSON reply envelope
	 */
	public ResponseEnvelope decode(byte[] body) {
		WireResponseBody response;
		try {
			response = objectMapper.readValue(body, WireResponseBody.class);
		}
		catch (IOException e) {
			throw new MalformedResponseException("Failed to parse device reply", e);
		}
		if (response == null || response.reply() == null) {
			throw new MalformedResponseException("Device reply has no 'reply' object");
		}

		WireReply reply = response.reply();
		Map<Integer, ResponseEnvelope.ActionReply> replies = new HashMap<>();
		if (reply.actions() != null) {
			for (WireActionReply action : reply.actions()) {
				if (action == null) {
					throw new MalformedResponseException("Reply action entry is null");
				}
				if (action.id() == null) {
					throw new MalformedResponseException("Reply action entry has no id");
				}
				List<ResponseEnvelope.Callback> callbacks = new ArrayList<>();
				if (action.callbacks() != null) {
					for (WireCallback callback : action.callbacks()) {
						if (callback == null) {
							throw new MalformedResponseException("Reply callback entry of action " + action.id()
									+ " is null");
						}
						callbacks.add(new ResponseEnvelope.Callback(callback.xpath(), toStatus(callback.result()),
								callback.parameters()));
					}
				}
				ResponseEnvelope.ActionReply previous = replies.put(action.id(),
						new ResponseEnvelope.ActionReply(action.id(), toStatus(action.error()), callbacks));
				if (previous != null) {
					throw new MalformedResponseException("Reply carries action " + action.id() + " more than once");
				}
			}
		}
		return new ResponseEnvelope(reply.id(), toStatus(reply.error()), replies);
	}

	private static DeviceStatus toStatus(WireError error) {
		return error != null ? new DeviceStatus(error.code(), error.description()) : DeviceStatus.OK;
	}

	// Outbound wire DTOs

	record WireRequestBody(WireRequest request) {
	}

	@JsonPropertyOrder({ "id", "session-id", "priority", "actions", "cnonce", "auth-key", "nonce" })
	record WireRequest(long id, @JsonProperty("session-id") String sessionId, boolean priority,
			List<WireAction> actions, String cnonce, @JsonProperty("auth-key") String authKey, String nonce) {
	}

	@JsonPropertyOrder({ "id", "method", "xpath", "parameters" })
	record WireAction(int id, String method, @JsonInclude(JsonInclude.Include.NON_EMPTY) String xpath,
			Map<String, Object> parameters) {
	}

	// Inbound wire DTOs

	record WireResponseBody(WireReply reply) {
	}

	record WireReply(long id, WireError error, List<WireActionReply> actions) {
	}

	record WireError(long code, String description) {
	}

	record WireActionReply(Integer id, WireError error, List<WireCallback> callbacks) {
	}

	record WireCallback(String xpath, WireError result, JsonNode parameters) {
	}

}
