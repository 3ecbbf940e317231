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
 * Reply bodies shaped like the ones the hub sends.
 */
final class DeviceReplies {

	private static final String REQUEST_OK = "{\"code\":16777216,\"description\":\"XMO_REQUEST_NO_ERR\"}";

	private static final String ACTION_OK = "{\"code\":16777238,\"description\":\"XMO_NO_ERR\"}";

	private DeviceReplies() {
	}

	static String login(String sessionIdJson, String nonceJson) {
		return "{\"reply\":{\"uid\":0,\"id\":0,\"error\":" + REQUEST_OK + ",\"actions\":[{\"uid\":1,\"id\":0,"
				+ "\"error\":" + ACTION_OK + ",\"callbacks\":[{\"uid\":1,\"result\":" + ACTION_OK
				+ ",\"xpath\":\"\",\"parameters\":{\"id\":" + sessionIdJson + ",\"nonce\":" + nonceJson
				+ "}}]}],\"events\":[]}}";
	}

	static String value(String xpath, String valueJson) {
		return "{\"reply\":{\"uid\":0,\"id\":1,\"error\":" + REQUEST_OK + ",\"actions\":[" + action(0, xpath, valueJson)
				+ "],\"events\":[]}}";
	}

	static String action(int id, String xpath, String valueJson) {
		return "{\"uid\":" + (id + 1) + ",\"id\":" + id + ",\"error\":" + ACTION_OK + ",\"callbacks\":[{\"uid\":1,"
				+ "\"result\":" + ACTION_OK + ",\"xpath\":\"" + xpath + "\",\"parameters\":{\"value\":" + valueJson
				+ "}}]}";
	}

	static String actions(String... actions) {
		return "{\"reply\":{\"uid\":0,\"id\":1,\"error\":" + REQUEST_OK + ",\"actions\":[" + String.join(",", actions)
				+ "],\"events\":[]}}";
	}

	static String requestError(long code, String description) {
		return "{\"reply\":{\"uid\":0,\"id\":0,\"error\":{\"code\":" + code + ",\"description\":\"" + description
				+ "\"},\"actions\":[],\"events\":[]}}";
	}

	static String actionError(long code, String description) {
		return "{\"reply\":{\"uid\":0,\"id\":1,\"error\":" + REQUEST_OK + ",\"actions\":[{\"uid\":1,\"id\":0,"
				+ "\"error\":{\"code\":" + code + ",\"description\":\"" + description + "\"},\"callbacks\":[]}],"
				+ "\"events\":[]}}";
	}

	static String sessionExpired() {
		return requestError(DeviceStatus.INVALID_SESSION, "Invalid user session");
	}

}
