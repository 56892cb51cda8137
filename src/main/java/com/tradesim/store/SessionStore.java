package com.tradesim.store;

import com.tradesim.domain.model.SessionSnapshot;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of sessions. Holds immutable snapshots only: sessions push a fresh snapshot
 * after each state transition and readers never see a live session object.
 */
public interface SessionStore {

    void save(SessionSnapshot snapshot);

    Optional<SessionSnapshot> findById(String id);

    /** All sessions, oldest first. */
    List<SessionSnapshot> findAll();

    /** @return true if a session was removed */
    boolean delete(String id);
}
