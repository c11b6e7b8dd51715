package com.whereq.netpilot.safety;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable, versioned table of dangerous command rules, injected into the classifier.
 * Rules are evaluated in order and the first match wins.
 */
@Value
public class CommandRuleSet {

    public static final String BUILTIN_VERSION = "builtin-2";

    String version;
    List<CommandRule> rules;

    public CommandRuleSet(String version, List<CommandRule> rules) {
        this.version = version;
        this.rules = List.copyOf(rules);
    }

    /**
     * New rule set with {@code extra} appended after the existing rules
     */
    public CommandRuleSet withRules(String newVersion, List<CommandRule> extra) {
        List<CommandRule> merged = new ArrayList<>(rules);
        merged.addAll(extra);
        return new CommandRuleSet(newVersion, merged);
    }

    public static CommandRuleSet builtin() {
        return new CommandRuleSet(BUILTIN_VERSION, List.of(
            CommandRule.of("reload", CommandCategory.RELOAD,
                "reload|reboot|(?:request\\s+)?system\\s+reboot|request\\s+system\\s+(?:halt|power-off)|install\\s+all"),
            CommandRule.of("factory-erase", CommandCategory.FACTORY_ERASE,
                "write\\s+erase|erase(?:\\s+\\S+)?|zeroize|request\\s+system\\s+zeroize|crypto\\s+key\\s+zeroize"),
            CommandRule.of("disk-format", CommandCategory.DISK_FORMAT,
                "format(?:\\s+\\S+)?"),
            CommandRule.of("config-replace", CommandCategory.CONFIG_REPLACE,
                "config(?:ure)?\\s+replace|rollback|load\\s+(?:override|replace)|copy\\s+\\S+\\s+(?:running-config|run)"),
            CommandRule.of("interface-shutdown", CommandCategory.INTERFACE_SHUTDOWN,
                "(?:no\\s+)?shut(?:down)?"),
            CommandRule.of("routing-process", CommandCategory.ROUTING_PROCESS,
                "(?:no\\s+)?router\\s+(?:bgp|ospf|ospfv3|eigrp|isis|rip)|(?:set|delete)\\s+protocols"),
            CommandRule.of("vrf-mutation", CommandCategory.VRF_MUTATION,
                "(?:no\\s+)?(?:ip\\s+)?vrf(?:\\s+(?:definition|context|instance|forwarding))?|(?:set|delete)\\s+routing-instances"),
            CommandRule.of("file-delete", CommandCategory.FILE_DELETE,
                "delete\\s+\\S+"),
            CommandRule.of("licensing", CommandCategory.LICENSING,
                "license|request\\s+(?:system\\s+)?license"),
            CommandRule.of("debug", CommandCategory.DEBUG,
                "debug"),
            CommandRule.of("persist-config", CommandCategory.PERSISTENCE,
                "write(?:\\s+(?:memory|mem|startup-config))?$|copy\\s+\\S+\\s+(?:startup-config|start)|commit(?!\\s+check(?:\\s|$))(?:\\s+\\S+)*|save")
        ));
    }
}
