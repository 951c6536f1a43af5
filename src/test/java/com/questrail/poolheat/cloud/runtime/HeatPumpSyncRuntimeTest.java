package com.questrail.poolheat.cloud.runtime;

import com.questrail.poolheat.api.AuthenticationException;
import com.questrail.poolheat.api.CommandHandle;
import com.questrail.poolheat.api.CommandStatus;
import com.questrail.poolheat.api.ControllerStatus;
import com.questrail.poolheat.api.DeviceField;
import com.questrail.poolheat.api.DeviceId;
import com.questrail.poolheat.api.DeviceState;
import com.questrail.poolheat.api.FailureReason;
import com.questrail.poolheat.api.FieldValue;
import com.questrail.poolheat.api.OperatingMode;
import com.questrail.poolheat.api.Subscription;
import com.questrail.poolheat.api.TransportException;
import com.questrail.poolheat.cloud.config.HeatPumpSyncConfig;
import com.questrail.poolheat.cloud.observability.RecordingSyncObservabilitySink;
import com.questrail.poolheat.cloud.time.DeterministicScheduler;
import com.questrail.poolheat.cloud.time.ManualMonotonicClock;
import com.questrail.poolheat.cloud.transport.FakeCloudTransport;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runtime wiring end to end against the fake cloud, on deterministic time with
 * inline executors.
 */
class HeatPumpSyncRuntimeTest {

    private static final DeviceId HP1 = DeviceId.of("hp-1");
    private static final DeviceId HP2 = DeviceId.of("hp-2");

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    private final RecordingSyncObservabilitySink sink = new RecordingSyncObservabilitySink();
    private final FakeCloudTransport transport = new FakeCloudTransport()
            .addDevice(FakeCloudTransport.heatPump(HP1.value()), FakeCloudTransport.idleValues());

    private HeatPumpSyncRuntime runtime() {
        return HeatPumpSyncRuntime.builder()
                .withConfig(HeatPumpSyncConfig.builder().withCredential("pool@example.com", "pw").build())
                .withTransport(transport)
                .withObservabilitySink(sink)
                .withScheduler(scheduler)
                .withPollExecutor(Runnable::run)
                .withCommandExecutor(Runnable::run)
                .build();
    }

    @Test
    void disconnectedUntilFirstSuccessfulPoll() {
        HeatPumpSyncRuntime runtime = runtime();

        assertEquals(ControllerStatus.DISCONNECTED, runtime.getStatus());
        assertTrue(runtime.devices().isEmpty());
        assertEquals(Optional.empty(), runtime.getState(HP1));

        runtime.start();

        assertEquals(ControllerStatus.CONNECTED, runtime.getStatus());
        assertEquals(1, runtime.devices().size());
        assertEquals(Optional.of(OperatingMode.HEAT), runtime.getState(HP1).orElseThrow().operatingMode());
    }

    @Test
    void convenienceCommandsRoundTripThroughPolling() {
        HeatPumpSyncRuntime runtime = runtime();
        List<DeviceState> seen = new ArrayList<>();
        runtime.subscribeAll(seen::add);
        runtime.start();

        CommandHandle mode = runtime.setOperatingMode(HP1, OperatingMode.COOL);
        CommandHandle target = runtime.setTargetTemperature(HP1, 30);
        assertEquals(Optional.of(OperatingMode.COOL), runtime.getState(HP1).orElseThrow().operatingMode());

        scheduler.advanceAndRun(Duration.ofSeconds(5));

        assertEquals(CommandStatus.CONFIRMED, mode.status());
        assertEquals(CommandStatus.CONFIRMED, target.status());
        DeviceState last = seen.get(seen.size() - 1);
        assertTrue(last.pendingFields().isEmpty());
        assertEquals(Optional.of(FieldValue.of(30)), last.value(DeviceField.TARGET_TEMPERATURE));
        for (int i = 1; i < seen.size(); i++) {
            assertTrue(seen.get(i).revision() > seen.get(i - 1).revision());
        }
    }

    @Test
    void refreshNowPollsImmediately() {
        HeatPumpSyncRuntime runtime = runtime();
        runtime.start();

        transport.setValue(HP1, DeviceField.INLET_WATER_TEMPERATURE, FieldValue.of(27));
        runtime.refreshNow();

        assertEquals(2, transport.getStatesCount());
        assertEquals(Optional.of(FieldValue.of(27)),
                runtime.getState(HP1).orElseThrow().value(DeviceField.INLET_WATER_TEMPERATURE));
    }

    @Test
    void rejectedCredentialIsAuthFailed() {
        transport.failNextLogin(new AuthenticationException("account or password error"));
        HeatPumpSyncRuntime runtime = runtime();

        runtime.start();

        assertEquals(ControllerStatus.AUTH_FAILED, runtime.getStatus());

        scheduler.advanceAndRun(Duration.ofSeconds(30));
        assertEquals(ControllerStatus.CONNECTED, runtime.getStatus());
    }

    @Test
    void oneUnavailableDeviceIsDegradedAllIsDisconnected() {
        transport.addDevice(FakeCloudTransport.heatPump(HP2.value()), FakeCloudTransport.idleValues());
        HeatPumpSyncRuntime runtime = runtime();
        runtime.start();
        assertEquals(ControllerStatus.CONNECTED, runtime.getStatus());

        transport.setDeviceFailure(HP2, TransportException.fatal("device offline", null));
        scheduler.advanceAndRun(Duration.ofSeconds(30));
        assertEquals(ControllerStatus.DEGRADED, runtime.getStatus());

        transport.setDeviceFailure(HP1, TransportException.fatal("device offline", null));
        scheduler.advanceAndRun(Duration.ofSeconds(30));
        assertEquals(ControllerStatus.DISCONNECTED, runtime.getStatus());
    }

    @Test
    void abandonedCycleIsDegraded() {
        HeatPumpSyncRuntime runtime = runtime();
        runtime.start();

        transport.failNextGetStates(TransportException.retryable("HTTP 504", null));
        scheduler.advanceAndRun(Duration.ofSeconds(30));

        assertEquals(ControllerStatus.DEGRADED, runtime.getStatus());
    }

    @Test
    void shutdownExpiresCommandsAndStopsEverything() {
        transport.setApplyOnSend(false);
        HeatPumpSyncRuntime runtime = runtime();
        runtime.start();
        CommandHandle handle = runtime.setPower(HP1, false);

        runtime.shutdown();
        runtime.shutdown();

        assertEquals(CommandStatus.EXPIRED, handle.status());
        assertEquals(Optional.of(FailureReason.SHUTDOWN), handle.outcome().join().failureReason());
        assertThrows(IllegalStateException.class, () -> runtime.setPower(HP1, true));
        assertThrows(IllegalStateException.class, runtime::start);

        scheduler.advanceAndRun(Duration.ofMinutes(5));
        assertEquals(1, transport.getStatesCount());
    }

    @Test
    void unsubscribedListenerIsNotCalled() {
        HeatPumpSyncRuntime runtime = runtime();
        List<DeviceState> seen = new ArrayList<>();
        Subscription subscription = runtime.subscribe(HP1, seen::add);
        runtime.start();
        int before = seen.size();

        subscription.unsubscribe();
        runtime.setPower(HP1, false);

        assertEquals(before, seen.size());
    }
}
