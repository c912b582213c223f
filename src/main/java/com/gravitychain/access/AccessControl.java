package com.gravitychain.access;

import com.gravitychain.account.Address;
import com.gravitychain.exception.access.UnauthorizedCallerException;
import lombok.extern.java.Log;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the role table and guards every restricted entry point.
 */
@Log
@Component
public class AccessControl {

    private final Map<SystemRole, Address> roleTable = new EnumMap<>(SystemRole.class);

    public AccessControl(RoleProperties roleProperties) {
        for (SystemRole role : SystemRole.values()) {
            String configured = roleProperties.getAddresses().get(role);
            roleTable.put(role, Address.fromHex(configured != null ? configured : role.getDefaultAddress()));
        }
        log.fine(String.format("Role table resolved: %s", roleTable));
    }

    public Address addressOf(SystemRole role) {
        return roleTable.get(role);
    }

    public Map<SystemRole, Address> getRoleTable() {
        return Collections.unmodifiableMap(roleTable);
    }

    public boolean hasRole(Address caller, SystemRole role) {
        return roleTable.get(role).equals(caller);
    }

    /**
     * @throws UnauthorizedCallerException if the caller holds none of the given roles
     */
    public void requireCaller(Address caller, SystemRole... allowed) {
        for (SystemRole role : allowed) {
            if (hasRole(caller, role)) {
                return;
            }
        }

        List<Address> expected = Arrays.stream(allowed)
                .map(roleTable::get)
                .toList();
        throw new UnauthorizedCallerException(caller, expected);
    }

    public void requireCaller(Address caller, Address expected) {
        if (!expected.equals(caller)) {
            throw new UnauthorizedCallerException(caller, List.of(expected));
        }
    }
}
