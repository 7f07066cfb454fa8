package com.cofre.backend.security;

import java.util.UUID;

import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

/**
 * Resolve o dono das operações a partir do token. Nunca confiamos em id de dono vindo
 * do corpo ou da query da requisição.
 */
@Component("securityService")
public class SecurityService {

    public UUID getAuthenticatedPersonIdOrThrow() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();

        if (auth == null || !auth.isAuthenticated() || auth.getName() == null) {
            throw new AuthenticationCredentialsNotFoundException("Não autenticado");
        }

        try {
            return UUID.fromString(auth.getName()); // subject do JWT
        } catch (IllegalArgumentException e) {
            throw new AuthenticationCredentialsNotFoundException("Token sem identificador de pessoa válido");
        }
    }
}
