package com.questrail.poolheat.cloud;

import com.questrail.poolheat.api.CommandHandle;
import com.questrail.poolheat.api.ControllerStatus;
import com.questrail.poolheat.api.Device;
import com.questrail.poolheat.api.DeviceField;
import com.questrail.poolheat.api.DeviceId;
import com.questrail.poolheat.api.DeviceState;
import com.questrail.poolheat.api.FieldValue;
import com.questrail.poolheat.api.HeatPumpController;
import com.questrail.poolheat.api.StateListener;
import com.questrail.poolheat.api.Subscription;
import com.questrail.poolheat.cloud.config.FairlandEndpointConfig;
import com.questrail.poolheat.cloud.config.HeatPumpSyncConfig;
import com.questrail.poolheat.cloud.observability.SyncObservabilitySink;
import com.questrail.poolheat.cloud.runtime.HeatPumpSyncRuntime;
import com.questrail.poolheat.cloud.transport.fairland.FairlandCloudTransport;
import com.questrail.poolheat.cloud.transport.fairland.FairlandJsonCodec;
import com.questrail.poolheat.cloud.transport.fairland.HttpExchange;
import com.questrail.poolheat.cloud.transport.fairland.netty.NettyHttpExchange;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * FairlandHeatPumpController
 * =============================================================================
 * Production implementation of the HeatPumpController API for the Fairland
 * IoT cloud. Owns the HTTP exchange and the runtime built around it.
 */
public final class FairlandHeatPumpController implements HeatPumpController {

    private final HttpExchange http;
    private final HeatPumpSyncRuntime runtime;

    public FairlandHeatPumpController(
            HeatPumpSyncConfig config,
            FairlandEndpointConfig endpoint,
            SyncObservabilitySink observabilitySink) {
        this(config, endpoint, observabilitySink,
                new NettyHttpExchange(
                        Objects.requireNonNull(endpoint, "endpoint").connectTimeout(),
                        endpoint.requestTimeout()));
    }

    FairlandHeatPumpController(
            HeatPumpSyncConfig config,
            FairlandEndpointConfig endpoint,
            SyncObservabilitySink observabilitySink,
            HttpExchange http) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(endpoint, "endpoint");
        this.http = Objects.requireNonNull(http, "http");

        this.runtime = HeatPumpSyncRuntime.builder()
            .withConfig(config)
            .withTransport(new FairlandCloudTransport(endpoint, http, new FairlandJsonCodec()))
            .withObservabilitySink(observabilitySink)
            .build();
    }

    public void start() {
        runtime.start();
    }

    @Override
    public void shutdown() {
        try {
            runtime.shutdown();
        } finally {
            http.close();
        }
    }

    @Override
    public Optional<DeviceState> getState(DeviceId deviceId) {
        return runtime.getState(deviceId);
    }

    @Override
    public List<Device> devices() {
        return runtime.devices();
    }

    @Override
    public CommandHandle issueCommand(DeviceId deviceId, DeviceField field, FieldValue value) {
        return runtime.issueCommand(deviceId, field, value);
    }

    @Override
    public Subscription subscribe(DeviceId deviceId, StateListener listener) {
        return runtime.subscribe(deviceId, listener);
    }

    @Override
    public Subscription subscribeAll(StateListener listener) {
        return runtime.subscribeAll(listener);
    }

    @Override
    public void refreshNow() {
        runtime.refreshNow();
    }

    @Override
    public ControllerStatus getStatus() {
        return runtime.getStatus();
    }
}
