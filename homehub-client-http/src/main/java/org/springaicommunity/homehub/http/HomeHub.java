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

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.homehub.Action;
import org.springaicommunity.homehub.HomeHubConfig;
import org.springaicommunity.homehub.HomeHubSession;
import org.springaicommunity.homehub.HomeHubTransport;
import org.springaicommunity.homehub.MalformedResponseException;
import org.springaicommunity.homehub.NotAuthenticatedException;
import org.springaicommunity.homehub.ResponseEnvelope;
import org.springaicommunity.homehub.SessionExpiredException;
import org.springaicommunity.homehub.SessionPhase;

/**
 * Typed operations on a Home Hub router.
 *
 * <p>
 * Each operation sends one action through a {@link HomeHubSession} and converts the
 * returned value. Operations block until the hub replies or the configured timeout
 * elapses, and are serialized with every other call on the same instance.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * HomeHub hub = HomeHub.builder(HomeHubConfig.builder("s3cret").targetUrl("http://192.168.1.254").build())
 *     .autoLogin(true)
 *     .build();
 * System.out.println(hub.softwareVersion());
 * hub.setLightBrightness(50);
 * }</pre>
 *
 * <p>
 * With {@link Builder#autoLogin(boolean)} enabled the hub logs in before an operation
 * whenever no session is held, including after an expiry. An operation that failed with
 * {@link SessionExpiredException} is not re-issued; the caller decides whether to try it
 * again.
 * </p>
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public final class HomeHub {

	private static final Logger logger = LoggerFactory.getLogger(HomeHub.class);

	static final String EVENT_LOG_PATH = "/eventLog";

	static final String BANDWIDTH_STATISTICS_PATH = "/stats.csv";

	static final String UPLOAD_BANDWIDTH_STATISTICS = "uploadBMStatisticsFile";

	static final String REBOOT = "reboot";

	private static final DateTimeFormatter STATISTICS_DATE = DateTimeFormatter.BASIC_ISO_DATE;

	private final HomeHubConfig config;

	private final HomeHubTransport transport;

	private final HomeHubSession session;

	private final boolean autoLogin;

	private final Clock clock;

	private final ReentrantLock lock = new ReentrantLock();

	private HomeHub(Builder builder) {
		this.config = builder.config;
		this.transport = builder.transport != null ? builder.transport : new HttpHomeHubTransport(builder.config);
		this.session = new HomeHubSession(builder.config.credentials(), this.transport);
		this.autoLogin = builder.autoLogin;
		this.clock = builder.clock != null ? builder.clock : Clock.systemDefaultZone();
	}

	/**
	 * Creates a builder configured from the HUB_* environment variables.
	 * @return a new Builder instance
	 * @throws IllegalStateException if HUB_PASSWORD is not set
	 */
	public static Builder builder() {
		return new Builder(HomeHubConfig.builder().build());
	}

	public static Builder builder(HomeHubConfig config) {
		return new Builder(config);
	}

	// Session

	/**
	 * Logs in to the hub.
	 * @return true if the hub issued a session
	 * @see HomeHubSession#login()
	 */
	public boolean login() {
		lock.lock();
		try {
			logger.debug("Logging in to {} as {}", config.targetUrl(), config.userName());
			return session.login();
		}
		finally {
			lock.unlock();
		}
	}

	public boolean isLoggedIn() {
		return session.isLoggedIn();
	}

	public SessionPhase phase() {
		return session.phase();
	}

	public HomeHubSession session() {
		return session;
	}

	// Device information

	public String softwareVersion() {
		return getString(HubXPaths.SOFTWARE_VERSION);
	}

	public String hardwareVersion() {
		return getString(HubXPaths.HARDWARE_VERSION);
	}

	public String serialNumber() {
		return getString(HubXPaths.SERIAL_NUMBER);
	}

	/**
	 * The hub's product name, for example {@code Home Hub 60 Type A}.
	 * @return the model name
	 */
	public String version() {
		return getString(HubXPaths.MODEL_NAME);
	}

	public String maintenanceFirmwareVersion() {
		return getString(HubXPaths.MAINTENANCE_FIRMWARE_VERSION);
	}

	/**
	 * The hub's local time in ISO-8601 form, as reported by the hub.
	 * @return the local time
	 */
	public String localTime() {
		return getString(HubXPaths.LOCAL_TIME);
	}

	// Broadband

	public String dataPumpVersion() {
		return getString(HubXPaths.DATA_PUMP_VERSION);
	}

	public String broadbandProductType() {
		return getString(HubXPaths.BROADBAND_PRODUCT_TYPE);
	}

	/**
	 * Current downstream sync speed in kbit/s.
	 * @return the sync speed
	 */
	public int downstreamSyncSpeed() {
		return getInt(HubXPaths.DOWNSTREAM_CURRENT_RATE);
	}

	/**
	 * Current upstream sync speed in kbit/s.
	 * @return the sync speed
	 */
	public int upstreamSyncSpeed() {
		return getInt(HubXPaths.UPSTREAM_CURRENT_RATE);
	}

	public long dataReceived() {
		return getLong(HubXPaths.BYTES_RECEIVED);
	}

	public long dataSent() {
		return getLong(HubXPaths.BYTES_SENT);
	}

	public String internetConnectionStatus() {
		return getString(HubXPaths.INTERNET_STATUS);
	}

	public String publicIpAddress() {
		return getString(HubXPaths.PUBLIC_IP_ADDRESS);
	}

	public String publicSubnetMask() {
		return getString(HubXPaths.PUBLIC_SUBNET_MASK);
	}

	// DHCP

	public boolean dhcpAuthoritative() {
		return getBoolean(HubXPaths.DHCP_AUTHORITATIVE);
	}

	public String dhcpPoolStart() {
		return getString(HubXPaths.DHCP_POOL_START);
	}

	public String dhcpPoolEnd() {
		return getString(HubXPaths.DHCP_POOL_END);
	}

	public String dhcpSubnetMask() {
		return getString(HubXPaths.DHCP_SUBNET_MASK);
	}

	// Hub light

	public String lightStatus() {
		return getString(HubXPaths.LIGHT_STATUS);
	}

	public int lightBrightness() {
		return getInt(HubXPaths.LIGHT_BRIGHTNESS);
	}

	/**
	 * Sets the brightness of the hub's status light.
	 * @param brightness percentage between 0 and 100
	 */
	public void setLightBrightness(int brightness) {
		if (brightness < 0 || brightness > 100) {
			throw new IllegalArgumentException("Brightness must be between 0 and 100: " + brightness);
		}
		execute(Action.setValue(HubXPaths.LIGHT_BRIGHTNESS, brightness), reply -> null);
	}

	public void setLightEnabled(boolean enabled) {
		execute(Action.setValue(HubXPaths.LIGHT_ENABLE, enabled), reply -> null);
	}

	// Wireless and file sharing

	public String wifiSsid() {
		return getString(HubXPaths.WIFI_SSID);
	}

	public String wifiSecurityMode() {
		return getString(HubXPaths.WIFI_SECURITY_MODE);
	}

	public String sambaHost() {
		return getString(HubXPaths.SAMBA_HOST);
	}

	public String sambaIp() {
		return getString(HubXPaths.SAMBA_IP);
	}

	// Hosts

	/**
	 * Lists every host the hub knows about.
	 * @return the hosts, in the order the hub lists them
	 */
	public List<ConnectedDevice> connectedDevices() {
		return execute(Action.getValue(HubXPaths.HOSTS), reply -> {
			JsonNode value = reply.value();
			JsonNode hosts = value.has("Host") ? value.get("Host") : value;
			if (!hosts.isArray()) {
				throw new MalformedResponseException("Expected a list of hosts at " + HubXPaths.HOSTS);
			}
			List<ConnectedDevice> devices = new ArrayList<>();
			for (JsonNode host : hosts) {
				devices.add(ConnectedDevice.fromHost(host));
			}
			return devices;
		});
	}

	/**
	 * Reads a single host by its hub id.
	 * @param id the host id
	 * @return the host
	 */
	public ConnectedDevice deviceInfo(int id) {
		return execute(Action.getValue(String.format(HubXPaths.HOST, id)),
				reply -> ConnectedDevice.fromHost(reply.value()));
	}

	// Batched reads

	/**
	 * Reads several values in one request.
	 * @param xpaths the addressing keys to read
	 * @return the raw value per key, in request order
	 */
	public Map<String, JsonNode> values(List<String> xpaths) {
		List<Action> actions = new ArrayList<>(xpaths.size());
		for (String xpath : xpaths) {
			actions.add(Action.getValue(xpath));
		}
		ResponseEnvelope reply = call(actions);
		Map<String, JsonNode> values = new LinkedHashMap<>();
		for (int i = 0; i < xpaths.size(); i++) {
			values.put(xpaths.get(i), reply.reply(i).value());
		}
		return values;
	}

	// Maintenance

	/**
	 * Reboots the hub. The session does not survive the reboot.
	 */
	public void reboot() {
		execute(Action.of(REBOOT, HubXPaths.DEVICE, Map.of("source", "GUI")), reply -> null);
		logger.info("Reboot requested for {}", config.targetUrl());
	}

	/**
	 * Downloads the hub's event log.
	 * @return the log text
	 */
	public String eventLog() {
		lock.lock();
		try {
			requireSession();
			return new String(transport.fetch(EVENT_LOG_PATH), StandardCharsets.UTF_8);
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Asks the hub to export today's per-device traffic statistics and downloads the
	 * export.
	 * @return one row per device
	 */
	public List<BandwidthUsage> bandwidthMonitor() {
		String today = LocalDate.now(clock).format(STATISTICS_DATE);
		Map<String, Object> parameters = new LinkedHashMap<>();
		parameters.put("StartDate", today);
		parameters.put("EndDate", today);
		String csv;
		lock.lock();
		try {
			execute(Action.of(UPLOAD_BANDWIDTH_STATISTICS, HubXPaths.BANDWIDTH_MONITORING, parameters), reply -> null);
			csv = new String(transport.fetch(BANDWIDTH_STATISTICS_PATH), StandardCharsets.UTF_8);
		}
		finally {
			lock.unlock();
		}
		return BandwidthUsage.parseCsv(csv);
	}

	// Plumbing

	private String getString(String xpath) {
		return execute(Action.getValue(xpath), reply -> reply.value().asText());
	}

	private int getInt(String xpath) {
		return execute(Action.getValue(xpath), reply -> {
			JsonNode value = reply.value();
			if (value.isNumber()) {
				if (!value.canConvertToInt()) {
					throw new MalformedResponseException("Expected an integer at " + xpath + " but got " + value);
				}
				return value.asInt();
			}
			try {
				return Integer.parseInt(value.asText().trim());
			}
			catch (NumberFormatException e) {
				throw new MalformedResponseException("Expected an integer at " + xpath + " but got " + value, e);
			}
		});
	}

	private long getLong(String xpath) {
		return execute(Action.getValue(xpath), reply -> {
			JsonNode value = reply.value();
			if (value.isNumber()) {
				if (!value.canConvertToLong()) {
					throw new MalformedResponseException("Expected an integer at " + xpath + " but got " + value);
				}
				return value.asLong();
			}
			try {
				return Long.parseLong(value.asText().trim());
			}
			catch (NumberFormatException e) {
				throw new MalformedResponseException("Expected an integer at " + xpath + " but got " + value, e);
			}
		});
	}

	private boolean getBoolean(String xpath) {
		return execute(Action.getValue(xpath), reply -> {
			JsonNode value = reply.value();
			if (value.isBoolean()) {
				return value.asBoolean();
			}
			String text = value.asText().trim();
			if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
				return Boolean.parseBoolean(text);
			}
			throw new MalformedResponseException("Expected a boolean at " + xpath + " but got " + value);
		});
	}

	private <T> T execute(Action action, Function<ResponseEnvelope.ActionReply, T> extractor) {
		ResponseEnvelope reply = call(List.of(action));
		return extractor.apply(reply.reply(0));
	}

	private ResponseEnvelope call(List<Action> actions) {
		lock.lock();
		try {
			ensureSession();
			return session.call(actions);
		}
		finally {
			lock.unlock();
		}
	}

	private void ensureSession() {
		if (autoLogin && !session.isLoggedIn()) {
			login();
		}
	}

	private void requireSession() {
		ensureSession();
		if (!session.isLoggedIn()) {
			throw new NotAuthenticatedException("Not logged in; call login() before downloading files");
		}
	}

	public static class Builder {

		private final HomeHubConfig config;

		private HomeHubTransport transport;

		private boolean autoLogin;

		private Clock clock;

		private Builder(HomeHubConfig config) {
			this.config = Objects.requireNonNull(config, "config cannot be null");
		}

		/**
		 * Replaces the HTTP transport, for example with a recording stub in tests.
		 * @param transport the transport to use
		 * @return this builder
		 */
		public Builder transport(HomeHubTransport transport) {
			this.transport = transport;
			return this;
		}

		public Builder autoLogin(boolean autoLogin) {
			this.autoLogin = autoLogin;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		public HomeHub build() {
			return new HomeHub(this);
		}

	}

}
