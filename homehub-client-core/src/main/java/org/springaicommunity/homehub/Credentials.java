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

import java.util.Objects;

/**
 * User name and password for the device's administrative account.
 *
 * @param userName the user name
 * @param password the password
 * @since 0.1.0
 */
public record Credentials(String userName, String password) {

	public Credentials {
		Objects.requireNonNull(userName, "userName cannot be null");
		Objects.requireNonNull(password, "password cannot be null");
	}

	@Override
	public String toString() {
		return "Credentials{userName='" + userName + "', password='****'}";
	}

}
