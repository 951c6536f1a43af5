package com.questrail.poolheat.cloud.internal.exec;

import com.questrail.poolheat.api.AuthenticationException;
import com.questrail.poolheat.api.CommandFailedException;
import com.questrail.poolheat.api.CommandHandle;
import com.questrail.poolheat.api.CommandOutcome;
import com.questrail.poolheat.api.CommandStatus;
import com.questrail.poolheat.api.CommandSupersededException;
import com.questrail.poolheat.api.CommandTimeoutException;
import com.questrail.poolheat.api.DeviceField;
import com.questrail.poolheat.api.DeviceId;
import com.questrail.poolheat.api.DeviceState;
import com.questrail.poolheat.api.FailureReason;
import com.questrail.poolheat.api.FieldValue;
import com.questrail.poolheat.api.StateListener;
import com.questrail.poolheat.api.StateSource;
import com.questrail.poolheat.api.TransportException;
import com.questrail.poolheat.api.UnknownDeviceException;
import com.questrail.poolheat.api.UnsupportedCommandException;
import com.questrail.poolheat.cloud.observability.CommandLifecycleEvent;
import com.questrail.poolheat.cloud.transport.FakeCloudTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.questrail.poolheat.cloud.internal.exec.EngineHarness.HP;
import static org.junit.jupiter.api.Assertions.*;

/**
 * CommandDispatcherTest
 * -----------------------------------------------------------------------------
 * Command lifecycle end to end against the fake cloud:
 *
 *   issue → optimistic → send (retry) → accepted → poll corroborates → confirmed
 *
 * Fully deterministic: manual clock, deterministic scheduler, inline executors.
 */
class CommandDispatcherTest {

    private EngineHarness h;

    @BeforeEach
    void setUp() {
        h = new EngineHarness().withHeatPump();
        h.poller.start();
        assertEquals(Optional.of(FieldValue.of(26)), h.state().value(DeviceField.TARGET_TEMPERATURE));
    }

    @Test
    void targetTemperatureIsOptimisticThenConfirmedByPoll() {
        CommandHandle handle = h.dispatcher.issue(HP, DeviceField.TARGET_TEMPERATURE, FieldValue.of(30));

        DeviceState optimistic = h.state();
        assertEquals(Optional.of(FieldValue.of(30)), optimistic.value(DeviceField.TARGET_TEMPERATURE));
        assertEquals(StateSource.OPTIMISTIC, optimistic.source());
        assertEquals(CommandStatus.PENDING, handle.status());
        assertEquals(1, h.transport.sent().size());

        // Expedited confirmation poll after 5s.
        h.advanceSeconds(5);

        assertEquals(CommandStatus.CONFIRMED, handle.status());
        CommandOutcome outcome = handle.await(Duration.ofSeconds(1));
        assertTrue(outcome.isConfirmed());
        assertEquals(1, outcome.attempts());

        DeviceState confirmed = h.state();
        assertEquals(StateSource.CONFIRMED, confirmed.source());
        assertEquals(Optional.of(FieldValue.of(30)), confirmed.value(DeviceField.TARGET_TEMPERATURE));
        assertTrue(confirmed.revision() > optimistic.revision());
        assertEquals(0, h.dispatcher.pendingCount());
    }

    @Test
    void retryableFailuresAreRetriedThenExhaustedAndReverted() {
        for (int i = 0; i < 3; i++) {
            h.transport.failNextSend(TransportException.retryable("HTTP 503", null));
        }

        CommandHandle handle = h.dispatcher.issue(HP, DeviceField.POWER, FieldValue.of(false));
        assertEquals(Optional.of(false), h.state().power());

        h.advanceSeconds(1);
        assertEquals(CommandStatus.PENDING, handle.status());
        h.advanceSeconds(2);

        assertEquals(CommandStatus.FAILED, handle.status());
        CommandOutcome outcome = handle.outcome().join();
        assertEquals(Optional.of(FailureReason.TRANSPORT_EXHAUSTED), outcome.failureReason());
        assertEquals(3, outcome.attempts());
        assertEquals(Optional.of(true), h.state().power(), "reverted to confirmed value");
        assertTrue(h.state().pendingFields().isEmpty());
        assertTrue(h.transport.sent().isEmpty());

        CommandFailedException e = assertThrows(CommandFailedException.class, () -> handle.await(Duration.ofSeconds(1)));
        assertEquals(FailureReason.TRANSPORT_EXHAUSTED, e.reason());
    }

    @Test
    void retrySucceedsWithinBudget() {
        h.transport.failNextSend(TransportException.retryable("timeout", null));

        CommandHandle handle = h.dispatcher.issue(HP, DeviceField.OPERATING_MODE, FieldValue.of(2));
        h.advanceSeconds(1);
        h.advanceSeconds(5);

        assertEquals(CommandStatus.CONFIRMED, handle.status());
        assertEquals(2, handle.outcome().join().attempts());
    }

    @Test
    void acceptedButNeverCorroboratedExpires() {
        h.transport.setApplyOnSend(false);

        CommandHandle handle = h.dispatcher.issue(HP, DeviceField.TARGET_TEMPERATURE, FieldValue.of(30));
        h.advanceSeconds(5);
        assertEquals(CommandStatus.PENDING, handle.status());
        assertEquals(Optional.of(FieldValue.of(30)), h.state().value(DeviceField.TARGET_TEMPERATURE));

        h.advanceSeconds(84);
        assertEquals(CommandStatus.PENDING, handle.status());

        h.advanceSeconds(1);
        assertEquals(CommandStatus.EXPIRED, handle.status());
        assertEquals(Optional.of(FailureReason.TIMEOUT), handle.outcome().join().failureReason());
        assertEquals(Optional.of(FieldValue.of(26)), h.state().value(DeviceField.TARGET_TEMPERATURE));
        assertThrows(CommandTimeoutException.class, () -> handle.await(Duration.ofSeconds(1)));
    }

    @Test
    void overlappingCommandsOnSameFieldSupersede() {
        h.transport.setApplyOnSend(false);

        CommandHandle first = h.dispatcher.issue(HP, DeviceField.TARGET_TEMPERATURE, FieldValue.of(28));
        CommandHandle second = h.dispatcher.issue(HP, DeviceField.TARGET_TEMPERATURE, FieldValue.of(30));

        assertEquals(CommandStatus.FAILED, first.status());
        assertEquals(Optional.of(FailureReason.SUPERSEDED), first.outcome().join().failureReason());
        assertThrows(CommandSupersededException.class, () -> first.await(Duration.ofSeconds(1)));
        assertEquals(CommandStatus.PENDING, second.status());
        assertEquals(Optional.of(FieldValue.of(30)), h.state().value(DeviceField.TARGET_TEMPERATURE));

        h.transport.setValue(HP, DeviceField.TARGET_TEMPERATURE, FieldValue.of(30));
        h.advanceSeconds(5);
        assertEquals(CommandStatus.CONFIRMED, second.status());
    }

    @Test
    void commandsOnDifferentFieldsAreIndependent() {
        CommandHandle power = h.dispatcher.issue(HP, DeviceField.POWER, FieldValue.of(false));
        CommandHandle target = h.dispatcher.issue(HP, DeviceField.TARGET_TEMPERATURE, FieldValue.of(35));

        assertEquals(2, h.state().pendingFields().size());
        h.advanceSeconds(5);

        assertEquals(CommandStatus.CONFIRMED, power.status());
        assertEquals(CommandStatus.CONFIRMED, target.status());
    }

    @Test
    void invalidCommandsAreRejectedSynchronously() {
        long revision = h.state().revision();

        assertThrows(UnsupportedCommandException.class,
                () -> h.dispatcher.issue(HP, DeviceField.INLET_WATER_TEMPERATURE, FieldValue.of(20)));
        assertThrows(UnsupportedCommandException.class,
                () -> h.dispatcher.issue(HP, DeviceField.TARGET_TEMPERATURE, FieldValue.of(45)));
        assertThrows(UnsupportedCommandException.class,
                () -> h.dispatcher.issue(HP, DeviceField.TARGET_TEMPERATURE, FieldValue.of(new BigDecimal("30.5"))));
        assertThrows(UnsupportedCommandException.class,
                () -> h.dispatcher.issue(HP, DeviceField.POWER, FieldValue.of(1)));
        assertThrows(UnsupportedCommandException.class,
                () -> h.dispatcher.issue(HP, DeviceField.RUNNING_MODE, FieldValue.of(7)));
        assertThrows(UnsupportedCommandException.class,
                () -> h.dispatcher.issue(HP, DeviceField.WATER_PUMP_MODE, FieldValue.of(1)));
        assertThrows(UnknownDeviceException.class,
                () -> h.dispatcher.issue(DeviceId.of("hp-9"), DeviceField.POWER, FieldValue.of(true)));

        assertTrue(h.transport.sent().isEmpty());
        assertEquals(revision, h.state().revision());
        assertEquals(0, h.dispatcher.pendingCount());
    }

    @Test
    void devicesWithoutDescriptorsAreHeldToDefaultLimits() {
        EngineHarness bare = new EngineHarness();
        bare.transport.addDevice(FakeCloudTransport.heatPumpWithDefaultLimits(HP.value()), FakeCloudTransport.idleValues());
        bare.poller.start();

        assertThrows(UnsupportedCommandException.class,
                () -> bare.dispatcher.issue(HP, DeviceField.OPERATING_MODE, FieldValue.of(7)));
        assertThrows(UnsupportedCommandException.class,
                () -> bare.dispatcher.issue(HP, DeviceField.TARGET_TEMPERATURE, FieldValue.of(500)));
        assertThrows(UnsupportedCommandException.class,
                () -> bare.dispatcher.issue(HP, DeviceField.TARGET_TEMPERATURE, FieldValue.of(7)));
        assertThrows(UnsupportedCommandException.class,
                () -> bare.dispatcher.issue(HP, DeviceField.WATER_PUMP_TIME, FieldValue.of(-3)));
        assertThrows(UnsupportedCommandException.class,
                () -> bare.dispatcher.issue(HP, DeviceField.WATER_PUMP_TIME, FieldValue.of(42)));
        assertTrue(bare.transport.sent().isEmpty());

        bare.dispatcher.issue(HP, DeviceField.TARGET_TEMPERATURE, FieldValue.of(8));
        bare.dispatcher.issue(HP, DeviceField.WATER_PUMP_TIME, FieldValue.of(45));
        assertEquals(2, bare.transport.sent().size());
    }

    @Test
    void fatalSendFailsWithoutRetry() {
        h.transport.failNextSend(TransportException.fatal("cloud error 500001", null));

        CommandHandle handle = h.dispatcher.issue(HP, DeviceField.RUNNING_MODE, FieldValue.of(2));

        CommandOutcome outcome = handle.outcome().join();
        assertEquals(Optional.of(FailureReason.FATAL_TRANSPORT), outcome.failureReason());
        assertEquals(1, outcome.attempts());
    }

    @Test
    void authenticationFailureFailsCommand() {
        h.sessions.invalidate();
        h.transport.failNextLogin(new AuthenticationException("password changed"));

        CommandHandle handle = h.dispatcher.issue(HP, DeviceField.POWER, FieldValue.of(false));

        assertEquals(Optional.of(FailureReason.AUTHENTICATION), handle.outcome().join().failureReason());
        assertEquals(Optional.of(true), h.state().power());
    }

    @Test
    void shutdownExpiresPendingAndRejectsNewCommands() {
        h.transport.setApplyOnSend(false);
        CommandHandle handle = h.dispatcher.issue(HP, DeviceField.POWER, FieldValue.of(false));

        h.dispatcher.shutdown();

        assertEquals(CommandStatus.EXPIRED, handle.status());
        assertEquals(Optional.of(FailureReason.SHUTDOWN), handle.outcome().join().failureReason());
        assertThrows(IllegalStateException.class,
                () -> h.dispatcher.issue(HP, DeviceField.POWER, FieldValue.of(true)));
    }

    @Test
    void listenersReceiveTerminalOutcomeAfterStateChange() {
        List<String> seen = new ArrayList<>();
        h.store.subscribe(HP, new StateListener() {
            @Override
            public void onStateChanged(DeviceState state) {
                seen.add("state:" + state.source());
            }

            @Override
            public void onCommandResolved(CommandOutcome outcome) {
                seen.add("outcome:" + outcome.status());
            }
        });

        h.dispatcher.issue(HP, DeviceField.TARGET_TEMPERATURE, FieldValue.of(32));
        h.advanceSeconds(5);

        assertEquals(List.of("state:OPTIMISTIC", "state:CONFIRMED", "outcome:CONFIRMED"), seen);
    }

    @Test
    void lifecycleIsReportedToSink() {
        h.dispatcher.issue(HP, DeviceField.TARGET_TEMPERATURE, FieldValue.of(30));
        h.advanceSeconds(5);

        List<CommandLifecycleEvent.Kind> kinds = h.sink.eventsOfType(CommandLifecycleEvent.class).stream()
                .map(CommandLifecycleEvent::kind)
                .toList();
        assertEquals(List.of(
                CommandLifecycleEvent.Kind.ISSUED,
                CommandLifecycleEvent.Kind.SEND_ATTEMPT,
                CommandLifecycleEvent.Kind.ACCEPTED,
                CommandLifecycleEvent.Kind.CONFIRMED), kinds);
    }
}
