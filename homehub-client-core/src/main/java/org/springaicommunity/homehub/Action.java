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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single remote call carried inside a request envelope.
 *
 * <p>
 * The {@code xpath} addresses an object or attribute in the device's data model, for
 * example {@code Device/DeviceInfo/SoftwareVersion}. It is matched literally and
 * case-sensitively by the device. The {@code id} is the position of the action inside
 * its batch; the device echoes it back so replies can be matched to actions.
 * </p>
 *
 * @param id the position of the action inside its batch
 * @param method the remote method, for example {@code getValue}
 * @param xpath the addressing key, may be empty for session-level methods
 * @param parameters method parameters, rendered as a JSON object
 * @since 0.1.0
 */
public record Action(int id, String method, String xpath, Map<String, Object> parameters) {

	public static final String GET_VALUE = "getValue";

	public static final String SET_VALUE = "setValue";

	public Action {
		Objects.requireNonNull(method, "method cannot be null");
		Objects.requireNonNull(xpath, "xpath cannot be null");
		parameters = parameters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
	}

	public static Action of(String method, String xpath, Map<String, Object> parameters) {
		return new Action(0, method, xpath, parameters);
	}

	public static Action getValue(String xpath) {
		return of(GET_VALUE, xpath, Map.of());
	}

	public static Action setValue(String xpath, Object value) {
		return of(SET_VALUE, xpath, Map.of("value", value));
	}

	/**
	 * Returns a copy of this action placed at the given batch position.
	 * @param id the batch position
	 * @return the renumbered action
	 */
	public Action withId(int id) {
		return id == this.id ? this : new Action(id, method, xpath, parameters);
	}

}
