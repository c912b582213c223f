package com.gravitychain.access;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.Map;

/**
 * Overrides for the role table, e.g. {@code gravity.roles.addresses.governance=0x...}.
 * Roles without an override keep their {@link SystemRole#getDefaultAddress()}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "gravity.roles")
public class RoleProperties {

    private Map<SystemRole, String> addresses = new EnumMap<>(SystemRole.class);
}
