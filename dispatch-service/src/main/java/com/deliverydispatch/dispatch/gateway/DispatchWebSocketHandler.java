package com.deliverydispatch.dispatch.gateway;

import com.deliverydispatch.dispatch.config.DispatchProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Transport adapter: session lifecycle and text frames go to {@link DispatchGateway}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DispatchWebSocketHandler extends TextWebSocketHandler {

    private final DispatchGateway gateway;
    private final DispatchProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession decorated = new ConcurrentWebSocketSessionDecorator(session,
                properties.getSocket().getSendTimeLimitMs(),
                properties.getSocket().getSendBufferSizeLimit());
        gateway.open(session.getId(), new WebSocketConnectionChannel(decorated, objectMapper));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        gateway.handle(session.getId(), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on connection {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.debug("Connection {} closed ({})", session.getId(), status);
        gateway.close(session.getId());
    }
}
