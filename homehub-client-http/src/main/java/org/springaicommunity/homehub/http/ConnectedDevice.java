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

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A host the hub has seen on the local network.
 *
 * @param id the hub's host id
 * @param ipAddress the host's IP address
 * @param physicalAddress the host's MAC address
 * @param interfaceType how the host is attached, for example {@code Ethernet}
 * @param hostName the host name the hub resolved, possibly empty
 * @param active whether the host is currently connected
 * @since 0.1.0
 */
public record ConnectedDevice(int id, String ipAddress, String physicalAddress, String interfaceType,
		String hostName, boolean active) {

	private static final String ROW_FORMAT = "%-5s%-20s%-25s%-7s\n";

	public ConnectedDevice {
		Objects.requireNonNull(ipAddress, "ipAddress cannot be null");
		Objects.requireNonNull(physicalAddress, "physicalAddress cannot be null");
		Objects.requireNonNull(interfaceType, "interfaceType cannot be null");
		Objects.requireNonNull(hostName, "hostName cannot be null");
	}

	static ConnectedDevice fromHost(JsonNode host) {
		return new ConnectedDevice(host.path("uid").asInt(), host.path("IPAddress").asText(""),
				host.path("PhysAddress").asText(""), host.path("InterfaceType").asText(""),
				host.path("HostName").asText(""), host.path("Active").asBoolean(false));
	}

	/**
	 * Renders devices as a fixed-width table with ID, IP address, physical address and
	 * type columns.
	 * @param devices the devices
	 * @return the table, one line per device after a three-line header
	 */
	public static String formatTable(List<ConnectedDevice> devices) {
		StringBuilder table = new StringBuilder("\n");
		table.append(String.format(ROW_FORMAT, "--", "----------", "----------------", "----"));
		table.append(String.format(ROW_FORMAT, "ID", "IP Address", "Physical Address", "Type"));
		table.append(String.format(ROW_FORMAT, "--", "----------", "----------------", "----"));
		for (ConnectedDevice device : devices) {
			table.append(String.format(ROW_FORMAT, device.id(), device.ipAddress(), device.physicalAddress(),
					device.interfaceType()));
		}
		return table.toString();
	}

}
