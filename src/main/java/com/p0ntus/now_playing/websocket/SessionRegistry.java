package com.p0ntus.now_playing.websocket;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Live sessions by connection id. Removing a session is the single place where its
 * timers and forwarding streams are released.
 */
@Component
public class SessionRegistry {

	private final Map<String, Session> sessions = new ConcurrentHashMap<>();

	public SessionRegistry(MeterRegistry meterRegistry) {
		Gauge.builder("now.playing.sessions.active", sessions, Map::size)
				.description("Number of connected now-playing clients")
				.register(meterRegistry);
	}

	public Session open(String connectionId) {
		Session session = new Session(connectionId);
		Session previous = sessions.put(connectionId, session);
		if (previous != null) {
			previous.close();
		}
		return session;
	}

	public Optional<Session> get(String connectionId) {
		return Optional.ofNullable(sessions.get(connectionId));
	}

	/**
	 * Removes and closes the session.
	 *
	 * @return true when a session was still registered under the id
	 */
	public boolean close(String connectionId) {
		Session session = sessions.remove(connectionId);
		if (session == null) {
			return false;
		}
		session.close();
		return true;
	}

	public int size() {
		return sessions.size();
	}
}
