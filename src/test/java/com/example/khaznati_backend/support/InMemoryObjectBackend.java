package com.example.khaznati_backend.support;

import com.example.khaznati_backend.exception.BackendUnavailableException;
import com.example.khaznati_backend.exception.NotFoundException;
import com.example.khaznati_backend.service.Interfaces.ObjectBackend;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Backend keeping objects in a map. Put and get can be made to fail through hooks; every call is recorded.
 */
public class InMemoryObjectBackend implements ObjectBackend {

    @FunctionalInterface
    public interface PutHook {
        /** Returns the exception to throw for this call, or {@code null} to store the payload. */
        RuntimeException before(int callNumber, byte[] payload);
    }

    @FunctionalInterface
    public interface GetHook {
        void before(String locator);
    }

    public record PutCall(int callNumber, byte firstByte, int size, Instant at, boolean stored) {
    }

    private final String name;
    private final Clock clock;
    private final Map<String, byte[]> objects = new ConcurrentHashMap<>();
    private final List<PutCall> putCalls = Collections.synchronizedList(new ArrayList<>());
    private final List<String> getCalls = Collections.synchronizedList(new ArrayList<>());
    private final List<String> deleteCalls = Collections.synchronizedList(new ArrayList<>());
    private final Set<String> failingDeletes = ConcurrentHashMap.newKeySet();
    private final AtomicInteger putCounter = new AtomicInteger();
    private final AtomicInteger keyCounter = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    private volatile PutHook putHook = (n, payload) -> null;
    private volatile GetHook getHook = locator -> { };

    public InMemoryObjectBackend(String name, Clock clock) {
        this.name = name;
        this.clock = clock;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String put(byte[] data) {
        int call = putCounter.incrementAndGet();
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
        try {
            RuntimeException failure = putHook.before(call, data);
            byte first = data.length == 0 ? 0 : data[0];
            if (failure != null) {
                putCalls.add(new PutCall(call, first, data.length, clock.instant(), false));
                throw failure;
            }
            String locator = name + "-" + keyCounter.incrementAndGet();
            objects.put(locator, data.clone());
            putCalls.add(new PutCall(call, first, data.length, clock.instant(), true));
            return locator;
        } finally {
            inFlight.decrementAndGet();
        }
    }

    @Override
    public byte[] get(String locator) {
        getCalls.add(locator);
        getHook.before(locator);
        byte[] data = objects.get(locator);
        if (data == null) {
            throw new NotFoundException("No object " + locator);
        }
        return data.clone();
    }

    @Override
    public void delete(String locator) {
        deleteCalls.add(locator);
        if (failingDeletes.contains(locator)) {
            throw new BackendUnavailableException("delete refused for " + locator);
        }
        objects.remove(locator);
    }

    /** Stores {@code data} directly, bypassing hooks and call counters. */
    public String seed(byte[] data) {
        String locator = name + "-" + keyCounter.incrementAndGet();
        objects.put(locator, data.clone());
        return locator;
    }

    public void onPut(PutHook hook) {
        this.putHook = hook;
    }

    public void onGet(GetHook hook) {
        this.getHook = hook;
    }

    public void failDeleteOf(String locator) {
        failingDeletes.add(locator);
    }

    public Map<String, byte[]> objects() {
        return objects;
    }

    public List<PutCall> putCalls() {
        synchronized (putCalls) {
            return new ArrayList<>(putCalls);
        }
    }

    public List<String> getCalls() {
        synchronized (getCalls) {
            return new ArrayList<>(getCalls);
        }
    }

    public List<String> deleteCalls() {
        synchronized (deleteCalls) {
            return new ArrayList<>(deleteCalls);
        }
    }

    public int maxInFlightPuts() {
        return maxInFlight.get();
    }
}
