package com.whereq.netpilot.safety;

/**
 * Why a command is considered dangerous
 */
public enum CommandCategory {
    RELOAD,
    FACTORY_ERASE,
    FILE_DELETE,
    DISK_FORMAT,
    CONFIG_REPLACE,
    INTERFACE_SHUTDOWN,
    ROUTING_PROCESS,
    VRF_MUTATION,
    LICENSING,
    DEBUG,
    PERSISTENCE,
    CUSTOM
}
