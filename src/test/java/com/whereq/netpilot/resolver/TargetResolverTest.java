package com.whereq.netpilot.resolver;

import com.whereq.netpilot.exception.InvalidTargetException;
import com.whereq.netpilot.inventory.StaticInventoryService;
import com.whereq.netpilot.model.DeviceRecord;
import com.whereq.netpilot.model.DeviceTarget;
import com.whereq.netpilot.model.TargetSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for TargetResolver.
 */
@DisplayName("TargetResolver Tests")
class TargetResolverTest {

    private TargetResolver resolver;

    @BeforeEach
    void setUp() {
        StaticInventoryService inventory = new StaticInventoryService(List.of(
            device(3, "acme", "hq", "access", true),
            device(1, "acme", "hq", "core", true),
            device(2, "acme", "branch", "access", true),
            device(4, "acme", "hq", "access", false),
            device(9, "globex", "hq", "core", true)));
        resolver = new TargetResolver(inventory);
    }

    @Test
    @DisplayName("Should resolve explicit ids deduplicated and sorted by device id")
    void testExplicitDedupAndOrder() {
        TargetSpec spec = TargetSpec.builder().deviceIds(List.of(3L, 1L, 3L, 2L)).build();

        StepVerifier.create(resolver.resolve(spec, "acme"))
            .assertNext(targets -> assertEquals(List.of(1L, 2L, 3L), ids(targets)))
            .verifyComplete();
    }

    @Test
    @DisplayName("Should reject explicit ids from another tenant instead of dropping them")
    void testCrossTenantRejected() {
        TargetSpec spec = TargetSpec.builder().deviceIds(List.of(1L, 9L, 42L)).build();

        StepVerifier.create(resolver.resolve(spec, "acme"))
            .expectErrorSatisfies(error -> {
                assertInstanceOf(InvalidTargetException.class, error);
                assertEquals(List.of(9L, 42L), ((InvalidTargetException) error).getDeviceIds());
            })
            .verify();
    }

    @Test
    @DisplayName("Should apply filters within the caller's tenant only")
    void testFilterResolution() {
        TargetSpec spec = TargetSpec.builder().site("HQ").build();

        StepVerifier.create(resolver.resolve(spec, "acme"))
            .assertNext(targets -> assertEquals(List.of(1L, 3L), ids(targets)))
            .verifyComplete();
    }

    @Test
    @DisplayName("Should include disabled devices only when asked")
    void testDisabledDevices() {
        TargetSpec spec = TargetSpec.builder().site("hq").role("access").enabledOnly(false).build();

        StepVerifier.create(resolver.resolve(spec, "acme"))
            .assertNext(targets -> assertEquals(List.of(3L, 4L), ids(targets)))
            .verifyComplete();
    }

    @Test
    @DisplayName("Should narrow explicit ids with filters")
    void testExplicitNarrowedByFilter() {
        TargetSpec spec = TargetSpec.builder().deviceIds(List.of(1L, 2L, 3L)).role("access").build();

        StepVerifier.create(resolver.resolve(spec, "acme"))
            .assertNext(targets -> assertEquals(List.of(2L, 3L), ids(targets)))
            .verifyComplete();
    }

    @Test
    @DisplayName("Should return an empty list when nothing matches")
    void testEmptyResolution() {
        TargetSpec spec = TargetSpec.builder().site("nowhere").build();

        StepVerifier.create(resolver.resolve(spec, "acme"))
            .assertNext(targets -> assertTrue(targets.isEmpty()))
            .verifyComplete();
    }

    @Test
    @DisplayName("Should resolve the same spec to the same list on repeated calls")
    void testIdempotent() {
        TargetSpec spec = TargetSpec.builder().site("hq").build();

        List<DeviceTarget> first = resolver.resolve(spec, "acme").block();
        List<DeviceTarget> second = resolver.resolve(spec, "acme").block();

        assertEquals(first, second);
    }

    @Test
    @DisplayName("Should fail when no spec is given")
    void testNullSpec() {
        StepVerifier.create(resolver.resolve(null, "acme"))
            .expectError(InvalidTargetException.class)
            .verify();
    }

    private static List<Long> ids(List<DeviceTarget> targets) {
        return targets.stream().map(DeviceTarget::getDeviceId).toList();
    }

    private static DeviceRecord device(long id, String tenant, String site, String role, boolean enabled) {
        return DeviceRecord.builder()
            .id(id)
            .tenantId(tenant)
            .hostname("sw-" + id)
            .mgmtAddress("10.0.0." + id)
            .vendor("cisco")
            .platform("ios")
            .site(site)
            .role(role)
            .enabled(enabled)
            .build();
    }
}
