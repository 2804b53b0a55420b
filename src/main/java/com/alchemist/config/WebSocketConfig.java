package com.alchemist.config;

import com.alchemist.handler.CombatWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Mounts the combat socket at {@code alchemist.combat.socket.path}; the socket and the debug API are open.
 */
@Configuration @EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {
    private final CombatWebSocketHandler handler;
    private final CombatProperties.Socket socket;

    public WebSocketConfig(CombatWebSocketHandler handler, CombatProperties properties) {
        this.handler = handler;
        this.socket = properties.getSocket();
    }

    @Override public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, socket.getPath()).setAllowedOrigins(socket.getAllowedOrigins());
    }

    @Bean public SecurityFilterChain combatSecurity(HttpSecurity http) throws Exception {
        http.csrf(c -> c.disable())
                .authorizeHttpRequests(a -> a.requestMatchers(socket.getPath(), "/api/**").permitAll()
                        .anyRequest().authenticated());
        return http.build();
    }
}
