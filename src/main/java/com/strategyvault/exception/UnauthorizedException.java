package com.strategyvault.exception;

import com.strategyvault.domain.enums.VaultRole;

public class UnauthorizedException extends BaseException {

    public UnauthorizedException(String caller, VaultRole role) {
        super(ErrorCode.FORBIDDEN, "Caller " + caller + " lacks role " + role);
    }
}
