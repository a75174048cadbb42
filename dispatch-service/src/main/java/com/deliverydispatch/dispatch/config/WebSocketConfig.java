package com.deliverydispatch.dispatch.config;

import com.deliverydispatch.dispatch.gateway.DispatchWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final DispatchWebSocketHandler handler;
    private final DispatchProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, properties.getSocket().getPath())
                .setAllowedOriginPatterns(properties.getSocket().getAllowedOriginPatterns());
    }
}
