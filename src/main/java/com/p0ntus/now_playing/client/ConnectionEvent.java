package com.p0ntus.now_playing.client;

/**
 * Transport-level event published by {@link NowPlayingSocketClient}.
 *
 * @param type    what happened
 * @param attempt reconnection attempt number, 0 when not part of a reconnection
 */
public record ConnectionEvent(Type type, int attempt) {

	public enum Type {
		CONNECT("connect", true),
		DISCONNECT("disconnect", false),
		RECONNECT_ATTEMPT("reconnect_attempt", false),
		RECONNECT("reconnect", true),
		RECONNECT_FAILED("reconnect_failed", false);

		private final String eventName;
		private final boolean live;

		Type(String eventName, boolean live) {
			this.eventName = eventName;
			this.live = live;
		}

		public String eventName() {
			return eventName;
		}

		/**
		 * Whether the connection is usable right after this event.
		 */
		public boolean isLive() {
			return live;
		}
	}

	public static ConnectionEvent of(Type type) {
		return new ConnectionEvent(type, 0);
	}
}
