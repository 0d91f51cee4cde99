package com.stakeledger.service;

import com.stakeledger.config.StakeLedgerProperties;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Role grants read from {@code stakeledger.access.roles}.
 */
@Service
public class ConfiguredAccessControl implements AccessControl {

    private final StakeLedgerProperties properties;

    public ConfiguredAccessControl(StakeLedgerProperties properties) {
        this.properties = properties;
    }

    @Override
    public boolean hasRole(String account, String role) {
        if (account == null || account.isBlank() || role == null) {
            return false;
        }
        List<String> grantees = properties.getAccess().getRoles().get(role);
        return grantees != null && grantees.contains(account.trim());
    }
}
