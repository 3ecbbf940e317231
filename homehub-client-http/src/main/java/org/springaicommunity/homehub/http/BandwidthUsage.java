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

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

import org.springaicommunity.homehub.MalformedResponseException;

/**
 * One row of the hub's bandwidth monitoring export: traffic for one device on one day.
 *
 * @param physicalAddress the device's MAC address
 * @param date the day the traffic was counted
 * @param downloaded traffic received by the device, in the hub's reporting unit
 * @param uploaded traffic sent by the device, in the hub's reporting unit
 * @since 0.1.0
 */
public record BandwidthUsage(String physicalAddress, LocalDate date, long downloaded, long uploaded) {

	/**
	 * Parses the CSV export, one {@code mac,yyyy-MM-dd,downloaded,uploaded} row per line.
	 * Blank lines are skipped.
	 * @param csv the export contents
	 * @return the rows in file order
	 * @throws MalformedResponseException if a row does not have that shape
	 */
	static List<BandwidthUsage> parseCsv(String csv) {
		List<BandwidthUsage> rows = new ArrayList<>();
		for (String line : csv.split("\\r?\\n")) {
			if (line.isBlank()) {
				continue;
			}
			String[] fields = line.trim().split(",");
			if (fields.length != 4) {
				throw new MalformedResponseException("Unexpected bandwidth statistics row: " + line);
			}
			try {
				rows.add(new BandwidthUsage(fields[0], LocalDate.parse(fields[1]), Long.parseLong(fields[2]),
						Long.parseLong(fields[3])));
			}
			catch (DateTimeParseException | NumberFormatException e) {
				throw new MalformedResponseException("Unexpected bandwidth statistics row: " + line, e);
			}
		}
		return rows;
	}

}
