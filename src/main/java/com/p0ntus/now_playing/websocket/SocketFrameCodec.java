package com.p0ntus.now_playing.websocket;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON encoding of {@link SocketFrame}s, shared by the server handler and the client.
 */
public class SocketFrameCodec {

	private static final Logger logger = LoggerFactory.getLogger(SocketFrameCodec.class);

	private final ObjectMapper objectMapper;

	public SocketFrameCodec(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public String encode(SocketFrame frame) {
		try {
			return objectMapper.writeValueAsString(frame);
		} catch (JsonProcessingException ex) {
			throw new IllegalStateException("Unable to encode " + frame.event() + " frame", ex);
		}
	}

	/**
	 * @return the decoded frame, or empty when the text is not a frame with an event name
	 */
	public Optional<SocketFrame> decode(String text) {
		try {
			SocketFrame frame = objectMapper.readValue(text, SocketFrame.class);
			if (frame == null || frame.event() == null) {
				logger.debug("Ignoring frame without event name");
				return Optional.empty();
			}
			return Optional.of(frame);
		} catch (JsonProcessingException ex) {
			logger.debug("Ignoring malformed frame: {}", ex.getOriginalMessage());
			return Optional.empty();
		}
	}
}
