package com.deliverydispatch.dispatch.gateway;

import com.deliverydispatch.dispatch.connection.ConnectionChannel;
import com.deliverydispatch.dispatch.model.OutboundEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * Writes outbound events as JSON text frames. The session is expected to be wrapped in a
 * {@link org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator}.
 */
public class WebSocketConnectionChannel implements ConnectionChannel {

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    public WebSocketConnectionChannel(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public void send(OutboundEvent event) throws IOException {
        session.sendMessage(new TextMessage(objectMapper.writeValueAsString(event)));
    }

    @Override
    public void close(String reason) throws IOException {
        session.close(CloseStatus.SESSION_NOT_RELIABLE.withReason(reason));
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
