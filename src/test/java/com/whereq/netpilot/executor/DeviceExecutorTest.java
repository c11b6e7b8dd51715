package com.whereq.netpilot.executor;

import com.whereq.netpilot.model.ConfigMode;
import com.whereq.netpilot.model.DeviceErrorKind;
import com.whereq.netpilot.model.DeviceResultStatus;
import com.whereq.netpilot.model.DeviceTarget;
import com.whereq.netpilot.support.ScriptedDeviceTransport;
import com.whereq.netpilot.transport.TransportResponse;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for DeviceExecutor.
 */
@DisplayName("DeviceExecutor Tests")
class DeviceExecutorTest {

    private static final DeviceTarget TARGET = DeviceTarget.builder()
        .deviceId(7)
        .hostname("edge-7")
        .mgmtAddress("10.0.0.7")
        .platform("ios")
        .build();

    private ScriptedDeviceTransport transport;
    private SimpleMeterRegistry meterRegistry;
    private DeviceExecutor executor;

    @BeforeEach
    void setUp() {
        transport = new ScriptedDeviceTransport();
        meterRegistry = new SimpleMeterRegistry();
        executor = new DeviceExecutor(transport, meterRegistry);
    }

    @Test
    @DisplayName("Should render command output per command on success")
    void testCommandSuccess() {
        StepVerifier.create(executor.execute(TARGET, new CommandBatch(List.of("show version", "show clock")),
                Duration.ofSeconds(5)))
            .assertNext(result -> {
                assertEquals(DeviceResultStatus.SUCCESS, result.getStatus());
                assertEquals(7, result.getDeviceId());
                assertEquals("# show version\nedge-7: ok\n# show clock\nedge-7: ok\n", result.getOutput());
                assertNull(result.getErrorKind());
                assertNotNull(result.getStartedAt());
                assertNotNull(result.getFinishedAt());
            })
            .verifyComplete();

        assertEquals(1, meterRegistry.get("netpilot.device.execution")
            .tag("kind", "run_commands").tag("outcome", "success").timer().count());
    }

    @Test
    @DisplayName("Should turn a hung device into a TIMEOUT failure")
    void testTimeout() {
        transport.hang(7);

        StepVerifier.create(executor.execute(TARGET, new ConfigFetch(), Duration.ofMillis(200)))
            .assertNext(result -> {
                assertEquals(DeviceResultStatus.FAILED, result.getStatus());
                assertEquals(DeviceErrorKind.TIMEOUT, result.getErrorKind());
            })
            .expectComplete()
            .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Should keep the error kind reported by the transport")
    void testTransportErrorKind() {
        transport.fail(7, DeviceErrorKind.AUTH_FAILURE);

        StepVerifier.create(executor.execute(TARGET, new ConfigFetch(), Duration.ofSeconds(5)))
            .assertNext(result -> {
                assertEquals(DeviceResultStatus.FAILED, result.getStatus());
                assertEquals(DeviceErrorKind.AUTH_FAILURE, result.getErrorKind());
                assertEquals("Authentication failed", result.getErrorMessage());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("Should categorize unexpected runtime errors instead of propagating them")
    void testUnexpectedError() {
        DeviceExecutor failing = new DeviceExecutor((target, request, timeout) -> {
            throw new IllegalStateException("wrapped", new ConnectException("refused"));
        }, meterRegistry);

        StepVerifier.create(failing.execute(TARGET, new ConfigFetch(), Duration.ofSeconds(5)))
            .assertNext(result -> {
                assertEquals(DeviceResultStatus.FAILED, result.getStatus());
                assertEquals(DeviceErrorKind.UNREACHABLE, result.getErrorKind());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("Should turn a missing transport response into a PROTOCOL_ERROR failure")
    void testNullResponse() {
        transport.script(7, (target, request) -> null);

        StepVerifier.create(executor.execute(TARGET, new ConfigFetch(), Duration.ofSeconds(5)))
            .assertNext(result -> {
                assertEquals(DeviceResultStatus.FAILED, result.getStatus());
                assertEquals(DeviceErrorKind.PROTOCOL_ERROR, result.getErrorKind());
                assertEquals("Transport returned no response", result.getErrorMessage());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("Should report an empty diff as no changes")
    void testEmptyDiff() {
        transport.script(7, (target, request) -> TransportResponse.builder().output("  ").build());

        StepVerifier.create(executor.execute(TARGET, new ConfigDiff("ntp server 1.1.1.1", ConfigMode.MERGE),
                Duration.ofSeconds(5)))
            .assertNext(result -> assertEquals("No changes", result.getOutput()))
            .verifyComplete();
    }
}
