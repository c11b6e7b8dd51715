package com.whereq.netpilot.config;

import com.whereq.netpilot.dispatch.DispatchCoordinator;
import com.whereq.netpilot.executor.DeviceExecutor;
import com.whereq.netpilot.inventory.InventoryService;
import com.whereq.netpilot.inventory.StaticInventoryService;
import com.whereq.netpilot.resolver.TargetResolver;
import com.whereq.netpilot.safety.CommandCategory;
import com.whereq.netpilot.safety.CommandRule;
import com.whereq.netpilot.safety.CommandRuleSet;
import com.whereq.netpilot.safety.CommandSafetyClassifier;
import com.whereq.netpilot.transport.DeviceTransport;
import com.whereq.netpilot.transport.UnconfiguredDeviceTransport;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Wiring of the job engine core. Inventory and device transport are external integrations;
 * deployments replace the fallbacks below by declaring their own beans.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Configuration
public class NetPilotConfiguration {

    @Bean
    public CommandSafetyClassifier commandSafetyClassifier(NetPilotProperties properties) {
        return new CommandSafetyClassifier(buildRuleSet(properties.getSafety().getExtraRules()));
    }

    @Bean
    @ConditionalOnMissingBean
    public InventoryService inventoryService(NetPilotProperties properties) {
        return new StaticInventoryService(properties.getInventory().getDevices());
    }

    @Bean
    public TargetResolver targetResolver(InventoryService inventoryService) {
        return new TargetResolver(inventoryService);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeviceTransport deviceTransport() {
        log.warn("No DeviceTransport bean found; device operations will fail until one is provided");
        return new UnconfiguredDeviceTransport();
    }

    @Bean
    public DeviceExecutor deviceExecutor(DeviceTransport deviceTransport, MeterRegistry meterRegistry) {
        return new DeviceExecutor(deviceTransport, meterRegistry);
    }

    @Bean
    public DispatchCoordinator dispatchCoordinator(DeviceExecutor deviceExecutor, NetPilotProperties properties) {
        return new DispatchCoordinator(deviceExecutor, properties.getDispatch().getMaxConcurrency());
    }

    static CommandRuleSet buildRuleSet(List<NetPilotProperties.RuleDefinition> definitions) {
        CommandRuleSet builtin = CommandRuleSet.builtin();
        if (definitions == null || definitions.isEmpty()) {
            return builtin;
        }
        List<CommandRule> extra = new ArrayList<>();
        for (NetPilotProperties.RuleDefinition definition : definitions) {
            if (definition.getName() == null || definition.getPattern() == null) {
                throw new IllegalArgumentException("Safety rules need a name and a pattern: " + definition);
            }
            CommandCategory category = definition.getCategory() != null
                ? CommandCategory.valueOf(definition.getCategory().trim().toUpperCase().replace('-', '_'))
                : CommandCategory.CUSTOM;
            extra.add(CommandRule.of(definition.getName(), category, definition.getPattern()));
        }
        return builtin.withRules(builtin.getVersion() + "+" + extra.size() + "-custom", extra);
    }
}
