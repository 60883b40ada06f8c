package tech.cids.platform.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Capability source answering from a per-URL script. Once a script runs out, its last entry repeats.
 */
class ScriptedCapabilitySource implements CapabilitySource {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, Deque<Object>> scripts = new ConcurrentHashMap<>();
    private final AtomicInteger fetches = new AtomicInteger();
    private final AtomicInteger healthChecks = new AtomicInteger();
    private final CountDownLatch fetchStarted = new CountDownLatch(1);
    private volatile CountDownLatch gate;

    /**
     * @param responses JSON strings or {@link DiscoveryException}s, served in order
     */
    ScriptedCapabilitySource respond(String url, Object... responses) {
        Deque<Object> script = new ArrayDeque<>();
        for (Object response : responses) {
            script.add(response);
        }
        scripts.put(url, script);
        return this;
    }

    /**
     * Every fetch waits for the gate to open. An interrupted wait fails like an interrupted request.
     */
    ScriptedCapabilitySource holdFetches(CountDownLatch gate) {
        this.gate = gate;
        return this;
    }

    @Override
    public void checkHealth(String discoveryUrl) {
        healthChecks.incrementAndGet();
    }

    @Override
    public JsonNode fetch(String discoveryUrl, boolean versioned) throws DiscoveryException {
        fetches.incrementAndGet();
        fetchStarted.countDown();
        CountDownLatch held = gate;
        if (held != null) {
            try {
                held.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DiscoveryException(DiscoveryErrorType.TIMEOUT_ERROR, "Request to " + discoveryUrl
                    + " was interrupted", e);
            }
        }
        return next(discoveryUrl);
    }

    private synchronized JsonNode next(String discoveryUrl) throws DiscoveryException {
        Deque<Object> script = scripts.get(discoveryUrl);
        if (script == null || script.isEmpty()) {
            throw new DiscoveryException(DiscoveryErrorType.CONFIGURATION_ERROR, "HTTP 404 from " + discoveryUrl);
        }
        Object next = script.size() > 1 ? script.poll() : script.peek();
        if (next instanceof DiscoveryException e) {
            throw e;
        }
        try {
            return objectMapper.readTree((String) next);
        } catch (Exception e) {
            throw new IllegalStateException("Scripted response is not JSON", e);
        }
    }

    void awaitFirstFetch() throws InterruptedException {
        fetchStarted.await();
    }

    int fetches() {
        return fetches.get();
    }

    int healthChecks() {
        return healthChecks.get();
    }
}
