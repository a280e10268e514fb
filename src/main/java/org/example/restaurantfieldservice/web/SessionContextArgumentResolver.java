package org.example.restaurantfieldservice.web;

import lombok.RequiredArgsConstructor;
import org.example.restaurantfieldservice.exception.AuthenticationException;
import org.example.restaurantfieldservice.security.AuthService;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Resolves a {@link SessionContext} controller parameter from the
 * {@code Authorization: Bearer <token>} header. A handler that declares one
 * cannot be reached anonymously.
 */
@Component
@RequiredArgsConstructor
public class SessionContextArgumentResolver implements HandlerMethodArgumentResolver {

    static final String BEARER_PREFIX = "Bearer ";

    private final AuthService authService;

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return SessionContext.class.equals(parameter.getParameterType());
    }

    @Override
    public SessionContext resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                          NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        return authService.resolveSession(extractToken(webRequest.getHeader(HttpHeaders.AUTHORIZATION)));
    }

    /**
     * @throws AuthenticationException if the header is missing or not a bearer token
     */
    public static String extractToken(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            throw new AuthenticationException("Missing bearer token");
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw new AuthenticationException("Missing bearer token");
        }
        return token;
    }
}
