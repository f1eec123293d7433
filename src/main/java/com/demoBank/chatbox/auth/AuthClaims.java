package com.demoBank.chatbox.auth;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Identity extracted from a validated bearer token.
 */
@Value
@Builder
public class AuthClaims {
    
    private static final Set<String> ADMIN_ROLES = Set.of("admin", "chat_admin");
    
    String userId;
    String name;
    List<String> roles;
    
    public boolean isAdmin() {
        return roles != null && roles.stream().anyMatch(ADMIN_ROLES::contains);
    }
}
