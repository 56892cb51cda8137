package com.tradesim.store;

import com.tradesim.domain.model.SessionSnapshot;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/** Process-local session store backed by a {@link ConcurrentHashMap}. Contents do not survive a restart. */
@Repository
public class InMemorySessionStore implements SessionStore {

    private final Map<String, SessionSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public void save(SessionSnapshot snapshot) {
        snapshots.put(snapshot.getId(), snapshot);
    }

    @Override
    public Optional<SessionSnapshot> findById(String id) {
        return Optional.ofNullable(snapshots.get(id));
    }

    @Override
    public List<SessionSnapshot> findAll() {
        return snapshots.values().stream()
                .sorted(Comparator.comparing(SessionSnapshot::getCreatedAt).thenComparing(SessionSnapshot::getId))
                .toList();
    }

    @Override
    public boolean delete(String id) {
        return snapshots.remove(id) != null;
    }

    public int size() {
        return snapshots.size();
    }
}
