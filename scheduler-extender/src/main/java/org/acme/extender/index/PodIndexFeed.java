package org.acme.extender.index;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import io.quarkus.logging.Log;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.acme.extender.config.ExtenderConfig;

/**
 * Keeps {@link PodNodeIndex} warm from a cluster-wide pod informer. Startup does not complete
 * until the initial listing has been applied.
 */
@ApplicationScoped
public class PodIndexFeed {

    private final KubernetesClient client;
    private final PodNodeIndex index;
    private final ExtenderConfig config;

    private volatile SharedIndexInformer<Pod> informer;

    @Inject
    public PodIndexFeed(KubernetesClient client, PodNodeIndex index, ExtenderConfig config) {
        this.client = client;
        this.index = index;
        this.config = config;
    }

    void onStart(@Observes StartupEvent ev) throws InterruptedException {
        Duration resync = config.index().resyncPeriod();
        Duration timeout = config.index().syncTimeout();
        Log.infof("Starting pod informer (resync every %s)", resync);

        PodEventHandler handler = new PodEventHandler(index);
        informer = client.pods().inAnyNamespace().runnableInformer(resync.toMillis());
        informer.addEventHandler(handler);
        try {
            informer.start().toCompletableFuture().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Log.errorf(e.getCause(), "Pod informer failed before the initial sync");
            throw new IllegalStateException("Pod informer failed before the initial sync", e.getCause());
        } catch (TimeoutException e) {
            Log.errorf("Pod informer did not list pods within %s", timeout);
            throw new IllegalStateException("Pod index did not synchronize within " + timeout, e);
        }

        // notifications reach the handler after the store is filled, wait for the handler to catch up
        List<String> listed = informer.getStore().list().stream().map(PodNodeIndex::keyOf).toList();
        if (!handler.awaitApplied(listed, timeout)) {
            Log.errorf("Pod index did not apply the initial %d pods within %s", listed.size(), timeout);
            throw new IllegalStateException("Pod index did not synchronize within " + timeout);
        }
        index.markSynced();
        Log.infof("Pod index synchronized: %d active pods across %d nodes", index.podCount(), index.nodeCount());
    }

    @PreDestroy
    void onShutdown() {
        SharedIndexInformer<Pod> current = informer;
        if (current != null) {
            Log.info("Stopping pod informer");
            current.stop();
        }
    }
}
