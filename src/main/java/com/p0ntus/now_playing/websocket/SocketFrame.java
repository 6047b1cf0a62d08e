package com.p0ntus.now_playing.websocket;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import com.p0ntus.now_playing.dto.AggregationResult;

/**
 * One JSON text frame of the now-playing session protocol.
 * Client requests carry only an event name; server updates carry a result in {@code data}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SocketFrame(
		@JsonProperty("event") String event,
		@JsonProperty("data") AggregationResult data) {

	public static final String REQUEST_REFRESH = "requestRefresh";
	public static final String START_AUTO_REFRESH = "startAutoRefresh";
	public static final String STATUS_UPDATE = "statusUpdate";

	public static SocketFrame request(String event) {
		return new SocketFrame(event, null);
	}

	public static SocketFrame statusUpdate(AggregationResult result) {
		return new SocketFrame(STATUS_UPDATE, result);
	}
}
