package org.acme.extender.index;

import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.Pod;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Node name to active pods, fed by the pod watch stream.
 * <p>
 * Writes come from a single informer thread and are applied under the write lock, one event at a
 * time. Readers share the read lock and always receive copies, so a scoring request never sees a
 * half-applied event or a pod listed under two nodes.
 */
@ApplicationScoped
public class PodNodeIndex implements NodePodSource {

    private static final String PHASE_SUCCEEDED = "Succeeded";
    private static final String PHASE_FAILED = "Failed";

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Map<String, Pod>> podsByNode = new HashMap<>();
    private final Map<String, String> nodeByPod = new HashMap<>();
    private final CountDownLatch initialSync = new CountDownLatch(1);

    public void upsert(Pod pod) {
        String key = keyOf(pod);
        lock.writeLock().lock();
        try {
            removeLocked(key);
            if (isActive(pod)) {
                String nodeName = pod.getSpec().getNodeName();
                podsByNode.computeIfAbsent(nodeName, ignored -> new LinkedHashMap<>()).put(key, pod);
                nodeByPod.put(key, nodeName);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void delete(Pod pod) {
        String key = keyOf(pod);
        lock.writeLock().lock();
        try {
            removeLocked(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Pod> podsOnNode(String nodeName) {
        if (nodeName == null || nodeName.isBlank()) {
            throw new IndexLookupException("Cannot look up pods for a node without a name");
        }
        lock.readLock().lock();
        try {
            Map<String, Pod> pods = podsByNode.get(nodeName);
            return pods == null ? List.of() : List.copyOf(pods.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int podCount() {
        lock.readLock().lock();
        try {
            return nodeByPod.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int nodeCount() {
        lock.readLock().lock();
        try {
            return podsByNode.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Opens the readiness gate. Only the first call has an effect.
     */
    public void markSynced() {
        initialSync.countDown();
    }

    public boolean isSynced() {
        return initialSync.getCount() == 0;
    }

    public void awaitInitialSync() throws InterruptedException {
        initialSync.await();
    }

    /**
     * @return {@code true} if the initial listing was applied before the timeout elapsed
     */
    public boolean awaitInitialSync(Duration timeout) throws InterruptedException {
        return initialSync.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * A pod is indexed only while it is bound to a node and has not terminated.
     */
    static boolean isActive(Pod pod) {
        String nodeName = pod.getSpec() == null ? null : pod.getSpec().getNodeName();
        if (nodeName == null || nodeName.isEmpty()) {
            return false;
        }
        String phase = pod.getStatus() == null ? null : pod.getStatus().getPhase();
        return !PHASE_SUCCEEDED.equals(phase) && !PHASE_FAILED.equals(phase);
    }

    static String keyOf(Pod pod) {
        ObjectMeta meta = Optional.ofNullable(pod).map(Pod::getMetadata)
                .orElseThrow(() -> new IllegalArgumentException("Pod has no metadata"));
        if (meta.getName() == null || meta.getName().isEmpty()) {
            throw new IllegalArgumentException("Pod has no name");
        }
        String namespace = meta.getNamespace() == null ? "" : meta.getNamespace();
        return namespace + "/" + meta.getName();
    }

    private void removeLocked(String key) {
        String previousNode = nodeByPod.remove(key);
        if (previousNode == null) {
            return;
        }
        Map<String, Pod> pods = podsByNode.get(previousNode);
        if (pods != null) {
            pods.remove(key);
            if (pods.isEmpty()) {
                podsByNode.remove(previousNode);
            }
        }
    }
}
