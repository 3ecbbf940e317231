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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link EnvelopeCodec} and {@link RequestEnvelope}.
 */
class EnvelopeCodecTest {

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final EnvelopeCodec codec = new EnvelopeCodec();

	private final SessionState state = new SessionState(new Credentials("admin", "passw0rd"), "1234");

	@Test
	void encodeShouldRenderSessionAndActions() throws Exception {
		state.applyLoginResult("987879", "2355345");
		RequestEnvelope envelope = RequestEnvelope.create(state,
				List.of(Action.getValue("Device/DeviceInfo/SoftwareVersion")));

		JsonNode request = MAPPER.readTree(codec.encode(envelope)).get("request");

		assertThat(request.get("id").asLong()).isZero();
		assertThat(request.get("session-id").asText()).isEqualTo("987879");
		assertThat(request.get("priority").asBoolean()).isFalse();
		assertThat(request.get("cnonce").asText()).isEqualTo("1234");
		assertThat(request.get("auth-key").asText())
			.isEqualTo(AuthDigest.authKey("admin", "passw0rd", "2355345", 0, "1234"));
		JsonNode action = request.get("actions").get(0);
		assertThat(action.get("id").asInt()).isZero();
		assertThat(action.get("method").asText()).isEqualTo("getValue");
		assertThat(action.get("xpath").asText()).isEqualTo("Device/DeviceInfo/SoftwareVersion");
		assertThat(action.get("parameters").isObject()).isTrue();
	}

	@Test
	void encodeShouldKeepTokensAsStrings() throws Exception {
		state.applyLoginResult("987879", "2355345");
		RequestEnvelope envelope = RequestEnvelope.create(state, List.of(Action.getValue("Device")));

		JsonNode request = MAPPER.readTree(codec.encode(envelope)).get("request");

		assertThat(request.get("session-id").isTextual()).isTrue();
		assertThat(request.get("nonce").isTextual()).isTrue();
		assertThat(request.get("nonce").asText()).isEqualTo("2355345");
		assertThat(request.get("cnonce").isTextual()).isTrue();
	}

	@Test
	void encodeShouldUseAnonymousSessionBeforeLogin() throws Exception {
		RequestEnvelope envelope = RequestEnvelope.create(state, List.of(Action.of("logIn", "", Map.of("user", "admin"))));

		JsonNode request = MAPPER.readTree(codec.encode(envelope)).get("request");

		assertThat(request.get("session-id").asText()).isEqualTo(RequestEnvelope.ANONYMOUS_SESSION);
		assertThat(request.get("actions").get(0).has("xpath")).isFalse();
	}

	@Test
	void encodeShouldBeDeterministic() {
		Map<String, Object> first = new LinkedHashMap<>();
		first.put("StartDate", "20161231");
		first.put("EndDate", "20161231");
		Map<String, Object> second = new LinkedHashMap<>();
		second.put("EndDate", "20161231");
		second.put("StartDate", "20161231");
		RequestEnvelope a = new RequestEnvelope(4, "987879", "2355345", "1234", "key",
				List.of(Action.of("uploadBMStatisticsFile", "Device/Services/BandwidthMonitoring", first)));
		RequestEnvelope b = new RequestEnvelope(4, "987879", "2355345", "1234", "key",
				List.of(Action.of("uploadBMStatisticsFile", "Device/Services/BandwidthMonitoring", second)));

		assertThat(codec.encode(a)).isEqualTo(codec.encode(a)).isEqualTo(codec.encode(b));
	}

	@Test
	void createShouldConsumeOneRequestIdPerBatch() {
		RequestEnvelope first = RequestEnvelope.create(state,
				List.of(Action.getValue("Device/A"), Action.getValue("Device/B"), Action.getValue("Device/C")));
		RequestEnvelope second = RequestEnvelope.create(state, List.of(Action.getValue("Device/D")));

		assertThat(first.requestId()).isEqualTo(0);
		assertThat(second.requestId()).isEqualTo(1);
		assertThat(first.actions().stream().map(Action::id).toList()).containsExactly(0, 1, 2);
	}

	@Test
	void createShouldRejectEmptyBatchWithoutConsumingRequestId() {
		assertThatThrownBy(() -> RequestEnvelope.create(state, List.of()))
			.isInstanceOf(IllegalArgumentException.class);
		assertThat(state.peekRequestId()).isZero();
	}

	@Test
	void decodeShouldExposeStatusAndValues() {
		ResponseEnvelope reply = codec.decode(bytes(DeviceReplies.value("Device/DeviceInfo/SoftwareVersion",
				"\"SG4B10002244\"")));

		assertThat(reply.requestId()).isEqualTo(1);
		assertThat(reply.status().isSuccess()).isTrue();
		assertThat(reply.firstFailure()).isEmpty();
		ResponseEnvelope.ActionReply action = reply.reply(0);
		assertThat(action.status().code()).isEqualTo(DeviceStatus.NO_ERROR);
		assertThat(action.callbacks()).hasSize(1);
		assertThat(action.callbacks().get(0).xpath()).isEqualTo("Device/DeviceInfo/SoftwareVersion");
		assertThat(action.value().asText()).isEqualTo("SG4B10002244");
	}

	@Test
	void decodeShouldMatchRepliesToActionsRegardlessOfOrder() {
		state.applyLoginResult("987879", "2355345");
		RequestEnvelope envelope = RequestEnvelope.create(state, List.of(Action.getValue("Device/A"),
				Action.getValue("Device/B"), Action.getValue("Device/C")));
		String body = DeviceReplies.actions(DeviceReplies.action(2, "Device/C", "\"c\""),
				DeviceReplies.action(0, "Device/A", "\"a\""), DeviceReplies.action(1, "Device/B", "\"b\""));

		ResponseEnvelope reply = codec.decode(bytes(body));

		for (Action action : envelope.actions()) {
			ResponseEnvelope.ActionReply actionReply = reply.reply(action);
			assertThat(actionReply.callbacks().get(0).xpath()).isEqualTo(action.xpath());
		}
		assertThat(reply.reply(envelope.actions().get(1)).value().asText()).isEqualTo("b");
	}

	@Test
	void decodeShouldReportFirstFailure() {
		ResponseEnvelope reply = codec.decode(bytes(DeviceReplies.actionError(16777221L, "XMO_UNKNOWN_PATH_ERR")));

		assertThat(reply.status().isSuccess()).isTrue();
		assertThat(reply.firstFailure()).contains(new DeviceStatus(16777221L, "XMO_UNKNOWN_PATH_ERR"));
	}

	@Test
	void decodeShouldTreatMissingErrorBlockAsSuccess() {
		ResponseEnvelope reply = codec.decode(bytes("{\"reply\":{\"id\":3,\"actions\":[{\"id\":0,\"callbacks\":[]}]}}"));

		assertThat(reply.status()).isEqualTo(DeviceStatus.OK);
		assertThat(reply.reply(0).status().isSuccess()).isTrue();
	}

	@Test
	void decodeShouldIgnoreUnknownProperties() {
		ResponseEnvelope reply = codec
			.decode(bytes("{\"reply\":{\"uid\":0,\"id\":0,\"extra\":{\"x\":1},\"error\":{\"code\":0,\"description\":\"\"},"
					+ "\"actions\":[],\"events\":[{\"kind\":\"ignored\"}]}}"));

		assertThat(reply.replies()).isEmpty();
	}

	@Test
	void decodeShouldRejectInvalidJson() {
		assertThatThrownBy(() -> codec.decode(bytes("<html>Not Found</html>")))
			.isInstanceOf(MalformedResponseException.class);
		assertThatThrownBy(() -> codec.decode(bytes("{\"reply\": { \"uid\": 0 \"id\": 0 }}")))
			.isInstanceOf(MalformedResponseException.class);
		assertThatThrownBy(() -> codec.decode(new byte[0])).isInstanceOf(MalformedResponseException.class);
	}

	@Test
	void decodeShouldRejectJsonWithoutReply() {
		assertThatThrownBy(() -> codec.decode(bytes("{\"request\":{}}")))
			.isInstanceOf(MalformedResponseException.class)
			.hasMessageContaining("reply");
	}

	@Test
	void decodeShouldRejectNullActionEntry() {
		assertThatThrownBy(() -> codec.decode(bytes("{\"reply\":{\"id\":1,\"actions\":[null]}}")))
			.isInstanceOf(MalformedResponseException.class)
			.hasMessageContaining("action entry is null");
	}

	@Test
	void decodeShouldRejectNullCallbackEntry() {
		assertThatThrownBy(
				() -> codec.decode(bytes("{\"reply\":{\"id\":1,\"actions\":[{\"id\":0,\"callbacks\":[null]}]}}")))
			.isInstanceOf(MalformedResponseException.class)
			.hasMessageContaining("callback entry");
	}

	@Test
	void decodeShouldRejectRepeatedActionId() {
		String body = DeviceReplies.actions(DeviceReplies.action(0, "Device/A", "\"a\""),
				DeviceReplies.action(0, "Device/B", "\"b\""));

		assertThatThrownBy(() -> codec.decode(bytes(body))).isInstanceOf(MalformedResponseException.class)
			.hasMessageContaining("more than once");
	}

	@Test
	void decodeShouldRejectActionWithoutId() {
		assertThatThrownBy(() -> codec.decode(bytes("{\"reply\":{\"id\":1,\"actions\":[{\"callbacks\":[]}]}}")))
			.isInstanceOf(MalformedResponseException.class)
			.hasMessageContaining("no id");
	}

	@Test
	void replyLookupShouldFailForMissingAction() {
		ResponseEnvelope reply = codec.decode(bytes(DeviceReplies.value("Device/A", "1")));

		assertThatThrownBy(() -> reply.reply(5)).isInstanceOf(MalformedResponseException.class);
	}

	@Test
	void valueShouldFailWhenCallbackHasNoValue() {
		ResponseEnvelope reply = codec.decode(bytes(DeviceReplies.value("Device/A", "null")));

		assertThatThrownBy(() -> reply.reply(0).value()).isInstanceOf(MalformedResponseException.class);
	}

	private static byte[] bytes(String json) {
		return json.getBytes(StandardCharsets.UTF_8);
	}

}
