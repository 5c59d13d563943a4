package com.questrail.bacnet.runtime;

import com.questrail.bacnet.backup.BackupRestore;
import com.questrail.bacnet.backup.BackupStore;
import com.questrail.bacnet.backup.JsonFileBackupStore;
import com.questrail.bacnet.bridge.RequestBridge;
import com.questrail.bacnet.config.LocalDeviceConfig;
import com.questrail.bacnet.device.LocalDeviceManager;
import com.questrail.bacnet.discovery.DiscoveryPolicy;
import com.questrail.bacnet.discovery.DiscoveryService;
import com.questrail.bacnet.internal.time.MonotonicClock;
import com.questrail.bacnet.internal.time.MonotonicScheduler;
import com.questrail.bacnet.internal.time.ScheduledExecutorScheduler;
import com.questrail.bacnet.internal.time.SystemMonotonicClock;
import com.questrail.bacnet.internal.time.SystemWallClock;
import com.questrail.bacnet.observability.BacnetObservabilitySink;
import com.questrail.bacnet.observability.NullObservabilitySink;
import com.questrail.bacnet.remote.RemoteObjectAccessor;
import com.questrail.bacnet.transport.BacnetTransportFactory;
import com.questrail.bacnet.transport.DatagramEndpoint;
import com.questrail.bacnet.transport.codec.BacnetApduCodec;
import com.questrail.bacnet.transport.ip.BacnetIpTransport;
import com.questrail.bacnet.transport.ip.netty.NettyUdpDatagramEndpoint;

import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * BacnetNode
 * =============================================================================
 * Composition root and lifecycle owner of one BACnet node.
 *
 * <p>A node owns one {@link LocalDeviceManager} and the services built on it,
 * plus two executors: a scheduler thread for APDU timers and a single
 * background thread for discovery. Several nodes can share a JVM as long as
 * their devices bind different ports.</p>
 *
 * <pre>
 *   BacnetNode node = BacnetNode.builder()
 *           .withCodec(codec)
 *           .withConfig(LocalDeviceConfig.builder().withDeviceId(1234).build())
 *           .build();
 *   node.boot();
 *   ...
 *   node.shutdown();
 * </pre>
 */
public final class BacnetNode
{
    private final LocalDeviceManager devices;
    private final RequestBridge bridge;
    private final DiscoveryService discovery;
    private final RemoteObjectAccessor remote;
    private final BackupRestore backupRestore;
    private final ScheduledExecutorService timerExecutor;
    private final ExecutorService discoveryExecutor;

    private BacnetNode(
            LocalDeviceManager devices,
            RequestBridge bridge,
            DiscoveryService discovery,
            RemoteObjectAccessor remote,
            BackupRestore backupRestore,
            ScheduledExecutorService timerExecutor,
            ExecutorService discoveryExecutor) {
        this.devices = devices;
        this.bridge = bridge;
        this.discovery = discovery;
        this.remote = remote;
        this.backupRestore = backupRestore;
        this.timerExecutor = timerExecutor;
        this.discoveryExecutor = discoveryExecutor;
    }

    public LocalDeviceManager devices() {
        return devices;
    }

    public RequestBridge bridge() {
        return bridge;
    }

    public DiscoveryService discovery() {
        return discovery;
    }

    public RemoteObjectAccessor remote() {
        return remote;
    }

    public BackupRestore backupRestore() {
        return backupRestore;
    }

    /** Restore or create the local device, then discover in the background. */
    public CompletableFuture<Set<Integer>> boot() {
        return backupRestore.boot();
    }

    /** Terminate the local device and stop both executors. */
    public void shutdown() {
        devices.terminate();
        stopExecutor(discoveryExecutor);
        stopExecutor(timerExecutor);
    }

    private static void stopExecutor(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        }
        catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder
    {
        private LocalDeviceConfig config;
        private BacnetApduCodec codec;
        private BacnetTransportFactory transportFactory;
        private Function<InetSocketAddress, DatagramEndpoint> endpointFactory = NettyUdpDatagramEndpoint::new;
        private BackupStore backupStore;
        private DiscoveryPolicy discoveryPolicy = DiscoveryPolicy.defaults();
        private BacnetObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Duration requestGrace = RequestBridge.DEFAULT_GRACE;

        /** Configuration used when booting without a backup. */
        public Builder withConfig(LocalDeviceConfig config) {
            this.config = config;
            return this;
        }

        public Builder withCodec(BacnetApduCodec codec) {
            this.codec = codec;
            return this;
        }

        /** Use a transport other than BACnet/IP; the codec is then not needed. */
        public Builder withTransportFactory(BacnetTransportFactory factory) {
            this.transportFactory = factory;
            return this;
        }

        public Builder withEndpointFactory(Function<InetSocketAddress, DatagramEndpoint> factory) {
            this.endpointFactory = factory;
            return this;
        }

        public Builder withBackupStore(BackupStore store) {
            this.backupStore = store;
            return this;
        }

        public Builder withBackupFile(Path file) {
            this.backupStore = new JsonFileBackupStore(file);
            return this;
        }

        public Builder withDiscoveryPolicy(DiscoveryPolicy policy) {
            this.discoveryPolicy = policy;
            return this;
        }

        public Builder withObservabilitySink(BacnetObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withRequestGrace(Duration grace) {
            this.requestGrace = grace;
            return this;
        }

        public BacnetNode build() {
            Objects.requireNonNull(discoveryPolicy, "discoveryPolicy");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(requestGrace, "requestGrace");
            if (transportFactory == null) {
                Objects.requireNonNull(codec, "codec");
                Objects.requireNonNull(endpointFactory, "endpointFactory");
            }

            // 1. Time and executors
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            ScheduledExecutorService timerExec = Executors.newScheduledThreadPool(1);
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(timerExec, clock);
            ExecutorService discoveryExec = Executors.newSingleThreadExecutor();

            // 2. Transport
            BacnetTransportFactory transports = transportFactory != null
                    ? transportFactory
                    : BacnetIpTransport.factory(endpointFactory, codec, scheduler, clock);

            // 3. Services
            LocalDeviceManager devices = new LocalDeviceManager(transports, observabilitySink, SystemWallClock.INSTANCE);
            RequestBridge bridge = new RequestBridge(devices, observabilitySink, clock, SystemWallClock.INSTANCE, requestGrace);
            DiscoveryService discovery = new DiscoveryService(devices, discoveryPolicy, observabilitySink, SystemWallClock.INSTANCE);
            RemoteObjectAccessor remote = new RemoteObjectAccessor(bridge);

            BackupStore store = backupStore != null
                    ? backupStore
                    : new JsonFileBackupStore(Path.of(JsonFileBackupStore.DEFAULT_FILE_NAME));
            LocalDeviceConfig defaults = config != null ? config : LocalDeviceConfig.defaults();
            BackupRestore backupRestore = new BackupRestore(devices, store, discovery, discoveryExec, defaults);

            return new BacnetNode(devices, bridge, discovery, remote, backupRestore, timerExec, discoveryExec);
        }
    }
}
