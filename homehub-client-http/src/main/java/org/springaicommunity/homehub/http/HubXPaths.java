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

/**
 * Addressing keys for the values {@link HomeHub} reads and writes. Matched literally and
 * case-sensitively by the hub.
 *
 * @since 0.1.0
 */
final class HubXPaths {

	static final String SOFTWARE_VERSION = "Device/DeviceInfo/SoftwareVersion";

	static final String HARDWARE_VERSION = "Device/DeviceInfo/HardwareVersion";

	static final String SERIAL_NUMBER = "Device/DeviceInfo/SerialNumber";

	static final String MODEL_NAME = "Device/DeviceInfo/ModelName";

	static final String MAINTENANCE_FIRMWARE_VERSION = "Device/DeviceInfo/AdditionalSoftwareVersion";

	static final String LOCAL_TIME = "Device/Time/CurrentLocalTime";

	static final String DATA_PUMP_VERSION = "Device/DSL/Lines/Line[@uid='1']/FirmwareVersion";

	static final String BROADBAND_PRODUCT_TYPE = "Device/DSL/Lines/Line[@uid='1']/X_BT_ProductType";

	static final String DOWNSTREAM_CURRENT_RATE = "Device/DSL/Channels/Channel[@uid='1']/DownstreamCurrRate";

	static final String UPSTREAM_CURRENT_RATE = "Device/DSL/Channels/Channel[@uid='1']/UpstreamCurrRate";

	static final String WAN_INTERFACE = "Device/IP/Interfaces/Interface[@uid='3']";

	static final String BYTES_RECEIVED = WAN_INTERFACE + "/Stats/BytesReceived";

	static final String BYTES_SENT = WAN_INTERFACE + "/Stats/BytesSent";

	static final String INTERNET_STATUS = WAN_INTERFACE + "/Status";

	static final String PUBLIC_IP_ADDRESS = WAN_INTERFACE + "/IPv4Addresses/IPv4Address[@uid='1']/IPAddress";

	static final String PUBLIC_SUBNET_MASK = WAN_INTERFACE + "/IPv4Addresses/IPv4Address[@uid='1']/SubnetMask";

	static final String DHCP_POOL = "Device/DHCPv4/Server/Pools/Pool[@uid='1']";

	static final String DHCP_AUTHORITATIVE = DHCP_POOL + "/X_SAGEMCOM_Authoritative";

	static final String DHCP_POOL_START = DHCP_POOL + "/MinAddress";

	static final String DHCP_POOL_END = DHCP_POOL + "/MaxAddress";

	static final String DHCP_SUBNET_MASK = DHCP_POOL + "/SubnetMask";

	static final String LIGHT = "Device/UserInterface/Lights/Light[@uid='1']";

	static final String LIGHT_STATUS = LIGHT + "/Status";

	static final String LIGHT_BRIGHTNESS = LIGHT + "/Brightness";

	static final String LIGHT_ENABLE = LIGHT + "/Enable";

	static final String WIFI_SSID = "Device/WiFi/SSIDs/SSID[@uid='1']/SSID";

	static final String WIFI_SECURITY_MODE = "Device/WiFi/AccessPoints/AccessPoint[@uid='1']/Security/ModeEnabled";

	static final String SAMBA_HOST = "Device/Services/StorageServices/NetworkServer/NetBIOSName";

	static final String SAMBA_IP = "Device/Services/StorageServices/NetworkServer/IPAddress";

	static final String HOSTS = "Device/Hosts/Hosts";

	static final String HOST = HOSTS + "/Host[@uid='%d']";

	static final String BANDWIDTH_MONITORING = "Device/Services/BandwidthMonitoring";

	static final String DEVICE = "Device";

	private HubXPaths() {
	}

}
