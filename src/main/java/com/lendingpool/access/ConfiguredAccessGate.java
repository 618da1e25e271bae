package com.lendingpool.access;

import com.lendingpool.config.LendingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Grants read from {@code lending.access.grants}, e.g.
 * <pre>
 * lending:
 *   access:
 *     grants:
 *       ops-admin: [LIST_ASSET, SET_RISK_PARAMETERS, PAUSE_POOL]
 * </pre>
 * Fail-closed: unknown callers and blank ids are denied.
 */
@Component
@Slf4j
public class ConfiguredAccessGate implements AccessGate {

    private final Map<String, Set<AdminAction>> grants;

    public ConfiguredAccessGate(LendingProperties props) {
        this.grants = Map.copyOf(props.getAccess().getGrants());
        log.info("Access gate loaded with {} operator(s)", grants.size());
    }

    @Override
    public boolean authorize(String caller, AdminAction action) {
        if (caller == null || caller.isBlank() || action == null) {
            return false;
        }
        Set<AdminAction> granted = grants.get(caller);
        boolean allowed = granted != null && granted.contains(action);
        if (!allowed) {
            log.warn("Denied {} for caller {}", action, caller);
        }
        return allowed;
    }
}
