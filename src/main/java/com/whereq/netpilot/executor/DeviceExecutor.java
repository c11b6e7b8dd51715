package com.whereq.netpilot.executor;

import com.whereq.netpilot.model.DeviceErrorKind;
import com.whereq.netpilot.model.DeviceResult;
import com.whereq.netpilot.model.DeviceResultStatus;
import com.whereq.netpilot.model.DeviceTarget;
import com.whereq.netpilot.transport.DeviceTransport;
import com.whereq.netpilot.transport.DeviceTransportException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeoutException;

/**
 * Runs one work unit against one device and normalizes the outcome into a {@link DeviceResult}.
 * The returned Mono never errors: transport failures and timeouts become failed results.
 */
@Slf4j
public class DeviceExecutor {

    private final DeviceTransport transport;
    private final MeterRegistry meterRegistry;

    public DeviceExecutor(DeviceTransport transport, MeterRegistry meterRegistry) {
        this.transport = transport;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Execute a unit of work on a device
     *
     * @param target resolved device
     * @param unit work to perform
     * @param timeout per-device budget
     * @return Mono with the device result
     */
    public Mono<DeviceResult> execute(DeviceTarget target, WorkUnit unit, Duration timeout) {
        return Mono.defer(() -> {
            Instant startedAt = Instant.now();
            Timer.Sample sample = Timer.start(meterRegistry);

            return Mono.fromCallable(() -> transport.send(target, unit.toRequest(), timeout))
                .subscribeOn(Schedulers.boundedElastic())
                .switchIfEmpty(Mono.error(() -> new DeviceTransportException(
                    DeviceErrorKind.PROTOCOL_ERROR, "Transport returned no response")))
                .timeout(timeout)
                .map(response -> DeviceResult.builder()
                    .deviceId(target.getDeviceId())
                    .hostname(target.getHostname())
                    .status(DeviceResultStatus.SUCCESS)
                    .output(unit.render(response))
                    .startedAt(startedAt)
                    .finishedAt(Instant.now())
                    .build())
                .onErrorResume(error -> Mono.just(failure(target, unit, error, startedAt, timeout)))
                .doOnNext(result -> sample.stop(Timer.builder("netpilot.device.execution")
                    .description("Per-device execution time")
                    .tag("kind", unit.getKind().getWireName())
                    .tag("outcome", result.getStatus().getWireName())
                    .register(meterRegistry)));
        });
    }

    private DeviceResult failure(DeviceTarget target, WorkUnit unit, Throwable error, Instant startedAt, Duration timeout) {
        DeviceErrorKind kind;
        String message;
        if (error instanceof DeviceTransportException transportError) {
            kind = transportError.getKind();
            message = transportError.getMessage();
        } else if (error instanceof TimeoutException) {
            kind = DeviceErrorKind.TIMEOUT;
            message = "No response within " + timeout.toSeconds() + "s";
        } else {
            kind = DeviceErrorKind.categorize(error);
            message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        }

        log.warn("{} failed on device {} ({}): {} - {}",
            unit.getKind().getWireName(), target.getHostname(), target.getDeviceId(), kind, message);

        return DeviceResult.builder()
            .deviceId(target.getDeviceId())
            .hostname(target.getHostname())
            .status(DeviceResultStatus.FAILED)
            .errorKind(kind)
            .errorMessage(message)
            .startedAt(startedAt)
            .finishedAt(Instant.now())
            .build();
    }
}
