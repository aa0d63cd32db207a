package org.acme.extender.index;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.quarkus.logging.Log;
import java.time.Duration;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Applies pod watch events to the index. Events whose object cannot be identified as a pod are
 * logged and dropped; the stream keeps flowing.
 * <p>
 * This handler is the only writer of the index. Until {@link #awaitApplied} returns, it also
 * remembers which pods it has applied so the initial listing can be checked off.
 */
public class PodEventHandler implements ResourceEventHandler<Pod> {

    private final PodNodeIndex index;

    private final Object syncLock = new Object();
    private Set<String> appliedDuringSync = new HashSet<>();
    private Set<String> pending;
    private CountDownLatch drained;

    public PodEventHandler(PodNodeIndex index) {
        this.index = index;
    }

    @Override
    public void onAdd(Pod pod) {
        apply("add", pod, false);
    }

    @Override
    public void onUpdate(Pod oldPod, Pod newPod) {
        apply("update", newPod, false);
    }

    @Override
    public void onDelete(Pod pod, boolean deletedFinalStateUnknown) {
        apply("delete", pod, true);
    }

    /**
     * Waits until an event for every given pod key has been applied, counting events applied
     * before the call. Stops tracking afterwards, whatever the outcome.
     *
     * @return {@code false} if the timeout elapsed first
     */
    public boolean awaitApplied(Collection<String> keys, Duration timeout) throws InterruptedException {
        CountDownLatch latch;
        synchronized (syncLock) {
            if (appliedDuringSync == null) {
                throw new IllegalStateException("Initial sync already awaited");
            }
            pending = new HashSet<>(keys);
            pending.removeAll(appliedDuringSync);
            drained = new CountDownLatch(pending.isEmpty() ? 0 : 1);
            latch = drained;
        }
        try {
            return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } finally {
            synchronized (syncLock) {
                appliedDuringSync = null;
                pending = null;
            }
        }
    }

    private void apply(String event, Pod pod, boolean delete) {
        String key;
        try {
            if (delete) {
                index.delete(pod);
            } else {
                index.upsert(pod);
            }
            key = PodNodeIndex.keyOf(pod);
        } catch (IllegalArgumentException e) {
            Log.warnf("Skipping pod %s event: %s", event, e.getMessage());
            return;
        }
        recordApplied(key);
        Log.tracef("Applied pod %s event for %s", event, key);
    }

    private void recordApplied(String key) {
        synchronized (syncLock) {
            if (appliedDuringSync == null) {
                return;
            }
            appliedDuringSync.add(key);
            if (pending != null && pending.remove(key) && pending.isEmpty()) {
                drained.countDown();
            }
        }
    }
}
