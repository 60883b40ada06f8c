package tech.cids.platform.discovery.progress;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Keeps the latest progress per application and fans updates out to listeners.
 *
 * <p>Listeners run on a dedicated notifier thread, so a slow or failing listener never
 * holds up a discovery. The latest snapshot per application can be polled at any time.
 */
@ApplicationScoped
public class DiscoveryProgressTracker {

    private static final Logger LOG = Logger.getLogger(DiscoveryProgressTracker.class);

    private final Map<String, DiscoveryProgress> latest = new ConcurrentHashMap<>();
    private final List<DiscoveryProgressListener> listeners = new CopyOnWriteArrayList<>();
    private final Executor notifier;
    private final ExecutorService ownedNotifier;

    public DiscoveryProgressTracker() {
        this.ownedNotifier = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "cids-discovery-progress");
            thread.setDaemon(true);
            return thread;
        });
        this.notifier = ownedNotifier;
    }

    /**
     * @param notifier runs listener callbacks; not shut down by this tracker
     */
    public DiscoveryProgressTracker(Executor notifier) {
        this.ownedNotifier = null;
        this.notifier = notifier;
    }

    public void addListener(DiscoveryProgressListener listener) {
        listeners.add(listener);
    }

    public void removeListener(DiscoveryProgressListener listener) {
        listeners.remove(listener);
    }

    public DiscoveryProgress report(String appId, String discoveryRunId, DiscoveryStep step, String message) {
        DiscoveryProgress progress = new DiscoveryProgress(appId, discoveryRunId, step, step.percentage(),
            message, Instant.now());
        latest.put(appId, progress);
        LOG.debugf("Discovery [%s] for app %s: %s (%d%%)", discoveryRunId, appId, step, step.percentage());

        for (DiscoveryProgressListener listener : listeners) {
            try {
                notifier.execute(() -> notify(listener, progress));
            } catch (RejectedExecutionException e) {
                LOG.debugf("Progress notifier is shut down, dropping %s update for app %s", step, appId);
            }
        }
        return progress;
    }

    public Optional<DiscoveryProgress> latest(String appId) {
        return Optional.ofNullable(latest.get(appId));
    }

    public void clear(String appId) {
        latest.remove(appId);
    }

    private static void notify(DiscoveryProgressListener listener, DiscoveryProgress progress) {
        try {
            listener.onProgress(progress);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Discovery progress listener failed for app %s at step %s",
                progress.appId(), progress.step());
        }
    }

    @PreDestroy
    void shutdown() {
        if (ownedNotifier != null) {
            ownedNotifier.shutdownNow();
        }
    }
}
