package com.whereq.netpilot.safety;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Flags service-impacting or destructive commands against an injected rule table.
 * Classification is computed fresh on every call and is advisory; submission policy lives in the admission controller.
 */
@Slf4j
public class CommandSafetyClassifier {

    private final CommandRuleSet ruleSet;

    public CommandSafetyClassifier(CommandRuleSet ruleSet) {
        this.ruleSet = ruleSet;
        log.info("Command safety classifier loaded rule set {} with {} rules",
            ruleSet.getVersion(), ruleSet.getRules().size());
    }

    /**
     * Commands flagged as dangerous, in input order
     */
    public List<String> classify(List<String> commands) {
        return inspect(commands).stream()
            .map(CommandMatch::getCommand)
            .toList();
    }

    /**
     * Flagged commands together with the rule that matched each
     */
    public List<CommandMatch> inspect(List<String> commands) {
        List<CommandMatch> matches = new ArrayList<>();
        if (commands == null) {
            return matches;
        }
        for (String command : commands) {
            match(command).ifPresent(rule ->
                matches.add(new CommandMatch(command, rule.getName(), rule.getCategory())));
        }
        return matches;
    }

    public boolean isDangerous(String command) {
        return match(command).isPresent();
    }

    public String getRuleSetVersion() {
        return ruleSet.getVersion();
    }

    private Optional<CommandRule> match(String command) {
        if (command == null || command.isBlank()) {
            return Optional.empty();
        }
        return ruleSet.getRules().stream()
            .filter(rule -> rule.matches(command))
            .findFirst();
    }
}
