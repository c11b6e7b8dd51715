package com.whereq.netpilot.support;

import com.whereq.netpilot.model.DeviceErrorKind;
import com.whereq.netpilot.model.DeviceTarget;
import com.whereq.netpilot.transport.DeviceTransport;
import com.whereq.netpilot.transport.DeviceTransportException;
import com.whereq.netpilot.transport.TransportRequest;
import com.whereq.netpilot.transport.TransportResponse;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Device transport test double. Devices answer with a per-device script; unscripted devices
 * echo the request. Records every call and the highest number of calls in flight.
 */
public class ScriptedDeviceTransport implements DeviceTransport {

    @FunctionalInterface
    public interface Script {
        TransportResponse answer(DeviceTarget target, TransportRequest request) throws Exception;
    }

    public static class Call {
        public final long deviceId;
        public final TransportRequest request;

        Call(long deviceId, TransportRequest request) {
            this.deviceId = deviceId;
            this.request = request;
        }
    }

    private final Map<Long, Script> scripts = new ConcurrentHashMap<>();
    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private volatile Duration latency = Duration.ZERO;

    public ScriptedDeviceTransport script(long deviceId, Script script) {
        scripts.put(deviceId, script);
        return this;
    }

    public ScriptedDeviceTransport hang(long deviceId) {
        return script(deviceId, (target, request) -> {
            Thread.sleep(Duration.ofMinutes(5).toMillis());
            return TransportResponse.builder().output("late").build();
        });
    }

    public ScriptedDeviceTransport fail(long deviceId, DeviceErrorKind kind) {
        return script(deviceId, (target, request) -> {
            throw new DeviceTransportException(kind, kind.getDescription());
        });
    }

    public ScriptedDeviceTransport output(long deviceId, String output) {
        return script(deviceId, (target, request) -> TransportResponse.builder().output(output).build());
    }

    public ScriptedDeviceTransport latency(Duration latency) {
        this.latency = latency;
        return this;
    }

    @Override
    public TransportResponse send(DeviceTarget target, TransportRequest request, Duration timeout)
            throws DeviceTransportException {
        calls.add(new Call(target.getDeviceId(), request));
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
        try {
            if (!latency.isZero()) {
                Thread.sleep(latency.toMillis());
            }
            Script script = scripts.get(target.getDeviceId());
            if (script == null) {
                return echo(target, request);
            }
            return script.answer(target, request);
        } catch (DeviceTransportException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeviceTransportException(DeviceErrorKind.TIMEOUT, "interrupted", e);
        } catch (Exception e) {
            throw new DeviceTransportException(DeviceErrorKind.PROTOCOL_ERROR, e.getMessage(), e);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private TransportResponse echo(DeviceTarget target, TransportRequest request) {
        TransportResponse.TransportResponseBuilder builder = TransportResponse.builder();
        switch (request.getOperation()) {
            case RUN_COMMANDS -> request.getCommands()
                .forEach(command -> builder.commandOutput(command, target.getHostname() + ": ok"));
            case GET_CONFIG -> builder.output("hostname " + target.getHostname() + "\n");
            case COMPARE_CONFIG -> builder.output("+ " + request.getSnippet());
            case APPLY_CONFIG -> builder.output("Committed " + request.getSnippet());
        }
        return builder.build();
    }

    public List<Call> getCalls() {
        return calls;
    }

    public List<Call> callsFor(long deviceId) {
        return calls.stream().filter(call -> call.deviceId == deviceId).toList();
    }

    public int getMaxInFlight() {
        return maxInFlight.get();
    }
}
