package com.fixfinder.backend.realtime;

import com.fixfinder.backend.auth.JwtService;
import com.fixfinder.backend.user.UserRepository;
import io.jsonwebtoken.JwtException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Authenticates the WebSocket upgrade. The token comes from the {@code token} query parameter
 * (browsers cannot set headers on a WebSocket) or from {@code Authorization: Bearer}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionAuthInterceptor implements HandshakeInterceptor {

    public static final String USER_ID = "userId";

    private final JwtService jwtService;
    private final UserRepository userRepository;

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String token = resolveToken(request);
        if (token == null) {
            log.debug("WebSocket handshake without token from {}", request.getRemoteAddress());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }

        Long userId;
        try {
            userId = jwtService.extractUserId(token);
        } catch (JwtException | IllegalArgumentException ex) {
            log.debug("WebSocket handshake with invalid token: {}", ex.getMessage());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
        if (!userRepository.existsById(userId)) {
            log.debug("WebSocket token subject {} has no matching user", userId);
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }

        attributes.put(USER_ID, userId);
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        // nothing to do
    }

    static String resolveToken(ServerHttpRequest request) {
        String fromQuery = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams().getFirst("token");
        if (fromQuery != null && !fromQuery.isBlank()) {
            return fromQuery;
        }
        String header = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith("Bearer ")) {
            return header.substring(7);
        }
        return null;
    }
}
