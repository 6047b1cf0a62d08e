package com.p0ntus.now_playing.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Progress of one aggregation run. A run moves forward through LOADING and PARTIAL
 * and ends in exactly one of COMPLETE or ERROR.
 */
public enum AggregationStatus {

	LOADING("loading"),
	PARTIAL("partial"),
	COMPLETE("complete"),
	ERROR("error");

	private final String wireName;

	AggregationStatus(String wireName) {
		this.wireName = wireName;
	}

	@JsonValue
	public String wireName() {
		return wireName;
	}

	public boolean isTerminal() {
		return this == COMPLETE || this == ERROR;
	}
}
