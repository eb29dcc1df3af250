package com.strategyvault.auth;

import com.strategyvault.domain.enums.VaultRole;

/**
 * Capability check consumed by the strategy controller. Role assignment lives
 * outside this service; implementations only answer the question.
 */
public interface AuthorizationService {

    boolean hasRole(String caller, VaultRole role);
}
