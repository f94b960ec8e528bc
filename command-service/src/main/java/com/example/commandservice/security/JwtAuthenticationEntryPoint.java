package com.example.commandservice.security;

import com.example.commandservice.dto.response.CommandResult;
import com.example.commandservice.exception.ErrorCode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Writes the 401 envelope: AUTH_REQUIRED without credentials, INVALID_TOKEN for a rejected token.
 */
@Component
@RequiredArgsConstructor
public class JwtAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request,
                         HttpServletResponse response,
                         AuthenticationException authException) throws IOException {

        CommandResult body = request.getAttribute(JwtAuthenticationFilter.AUTH_ERROR_ATTRIBUTE) == ErrorCode.INVALID_TOKEN
                ? CommandResult.failure(ErrorCode.INVALID_TOKEN, "Invalid or expired token")
                : CommandResult.failure(ErrorCode.AUTH_REQUIRED, "Authentication required");

        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
