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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * One decoded reply from the device.
 *
 * <p>
 * Replies to batched actions are indexed by the action id the device echoes back, so
 * lookups do not depend on the order in which the device lists them.
 * </p>
 *
 * @param requestId the request id echoed by the device
 * @param status the request-level status
 * @param replies per-action replies keyed by action id
 * @since 0.1.0
 */
public record ResponseEnvelope(long requestId, DeviceStatus status, Map<Integer, ActionReply> replies) {

	public ResponseEnvelope {
		status = status != null ? status : DeviceStatus.OK;
		replies = replies != null ? Collections.unmodifiableMap(new TreeMap<>(replies)) : Map.of();
	}

	/**
	 * Returns the reply to the action at the given batch position.
	 * @param actionId the action id
	 * @return the reply
	 * @throws MalformedResponseException if the device sent no reply for that action
	 */
	public ActionReply reply(int actionId) {
		ActionReply reply = replies.get(actionId);
		if (reply == null) {
			throw new MalformedResponseException("Reply carries no result for action " + actionId);
		}
		return reply;
	}

	public ActionReply reply(Action action) {
		return reply(action.id());
	}

	/**
	 * Finds the first non-successful status, looking at the request-level status first
	 * and then at the actions in id order.
	 * @return the first failure, if any
	 */
	public Optional<DeviceStatus> firstFailure() {
		if (!status.isSuccess()) {
			return Optional.of(status);
		}
		for (ActionReply reply : replies.values()) {
			if (!reply.status().isSuccess()) {
				return Optional.of(reply.status());
			}
		}
		return Optional.empty();
	}

	/**
	 * Reply to a single action.
	 *
	 * @param id the action id echoed by the device
	 * @param status the action-level status
	 * @param callbacks the values returned for the action
	 */
	public record ActionReply(int id, DeviceStatus status, List<Callback> callbacks) {

		public ActionReply {
			status = status != null ? status : DeviceStatus.OK;
			callbacks = callbacks != null ? List.copyOf(callbacks) : List.of();
		}

		/**
		 * Parameters of the first callback, which is where single-valued methods put
		 * their result.
		 * @return the parameters object
		 * @throws MalformedResponseException if there is no callback
		 */
		public JsonNode parameters() {
			if (callbacks.isEmpty()) {
				throw new MalformedResponseException("Action " + id + " returned no callbacks");
			}
			return callbacks.get(0).parameters();
		}

		/**
		 * The {@code value} parameter of the first callback.
		 * @return the value node
		 * @throws MalformedResponseException if the reply carries no value
		 */
		public JsonNode value() {
			JsonNode value = parameters().get("value");
			if (value == null || value.isNull()) {
				throw new MalformedResponseException("Action " + id + " returned no value");
			}
			return value;
		}

	}

	/**
	 * One value returned for an action.
	 *
	 * @param xpath the path the value was read from
	 * @param result the callback status
	 * @param parameters the returned parameters, an empty object when absent
	 */
	public record Callback(String xpath, DeviceStatus result, JsonNode parameters) {

		public Callback {
			xpath = xpath != null ? xpath : "";
			result = result != null ? result : DeviceStatus.OK;
			parameters = parameters != null ? parameters : JsonNodeFactory.instance.objectNode();
		}

	}

}
