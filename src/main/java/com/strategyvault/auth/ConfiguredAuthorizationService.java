package com.strategyvault.auth;

import com.strategyvault.config.VaultProperties;
import com.strategyvault.domain.enums.VaultRole;
import java.util.List;
import java.util.Set;

/**
 * Role assignment from {@code vault.auth.*}. Admins hold every role.
 */
public class ConfiguredAuthorizationService implements AuthorizationService {

    private final Set<String> managers;
    private final Set<String> operators;
    private final Set<String> admins;

    public ConfiguredAuthorizationService(VaultProperties.Auth auth) {
        this.managers = toSet(auth.getManagers());
        this.operators = toSet(auth.getOperators());
        this.admins = toSet(auth.getAdmins());
    }

    @Override
    public boolean hasRole(String caller, VaultRole role) {
        if (caller == null) {
            return false;
        }
        if (admins.contains(caller)) {
            return true;
        }
        return switch (role) {
            case STRATEGY_MANAGER -> managers.contains(caller);
            case OPERATOR -> operators.contains(caller);
            case ADMIN -> false;
        };
    }

    private static Set<String> toSet(List<String> callers) {
        return callers == null ? Set.of() : Set.copyOf(callers);
    }
}
