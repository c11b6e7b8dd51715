package com.whereq.netpilot.safety;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only show commands offered as suggestions per platform
 */
public final class CommandCatalog {

    private static final Map<String, List<String>> SUGGESTIONS = Map.of(
        "ios", List.of(
            "show version",
            "show ip interface brief",
            "show running-config",
            "show interfaces",
            "show cdp neighbors",
            "show vlan",
            "show ip route",
            "show inventory",
            "show environment"),
        "nxos", List.of(
            "show version",
            "show ip interface brief",
            "show running-config",
            "show interface status",
            "show cdp neighbors",
            "show vlan",
            "show ip route",
            "show inventory",
            "show environment",
            "show port-channel summary"),
        "eos", List.of(
            "show version",
            "show ip interface brief",
            "show running-config",
            "show interfaces status",
            "show lldp neighbors",
            "show vlan",
            "show ip route",
            "show inventory",
            "show environment all"),
        "junos", List.of(
            "show version",
            "show interfaces terse",
            "show configuration",
            "show chassis hardware",
            "show system alarms",
            "show route",
            "show lldp neighbors",
            "show ethernet-switching table"));

    private CommandCatalog() {
    }

    /**
     * Suggestions for a platform, empty for unknown platforms
     */
    public static List<String> suggestionsFor(String platform) {
        if (platform == null) {
            return List.of();
        }
        return SUGGESTIONS.getOrDefault(platform.trim().toLowerCase(Locale.ROOT), List.of());
    }
}
