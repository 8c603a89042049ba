package org.caureq.caureqspeedboard.service.state;

import org.caureq.caureqspeedboard.domain.SpeedReport;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Writers share the read side of the lock so different nodes never wait on each other;
 * the map's per-key put keeps same-node replacement atomic. Snapshots take the write side,
 * which drains in-flight puts and yields a point-in-time copy.
 */
@Component
public class InMemoryNodeStateStore implements NodeStateStore {

    private final ConcurrentHashMap<String, SpeedReport> reports = new ConcurrentHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public Optional<SpeedReport> get(String nodeId) {
        return Optional.ofNullable(reports.get(nodeId));
    }

    @Override
    public Optional<SpeedReport> put(SpeedReport report) {
        Objects.requireNonNull(report, "report");
        Objects.requireNonNull(report.nodeId(), "report.nodeId");
        lock.readLock().lock();
        try {
            return Optional.ofNullable(reports.put(report.nodeId(), report));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Map<String, SpeedReport> snapshot() {
        lock.writeLock().lock();
        try {
            return Map.copyOf(reports);
        } finally {
            lock.writeLock().unlock();
        }
    }
}
