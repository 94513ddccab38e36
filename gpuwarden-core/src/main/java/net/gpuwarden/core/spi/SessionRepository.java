package net.gpuwarden.core.spi;

import net.gpuwarden.core.model.NewSession;
import net.gpuwarden.core.model.Provider;
import net.gpuwarden.core.model.Session;
import net.gpuwarden.core.model.ShutdownReason;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface SessionRepository {
    Session insert(NewSession s, Instant now) throws Exception;

    Optional<Session> findById(long id) throws Exception;

    Optional<Session> findActiveByWorker(long workerId) throws Exception;

    List<Session> findActive() throws Exception;

    List<Session> findActiveByProvider(Provider provider) throws Exception;

    /** isActive 이면서 autoShutdownAt < now */
    List<Session> findActiveOverdue(Instant now) throws Exception;

    List<Session> findByWorker(long workerId) throws Exception;

    /** 단조 증가만 허용 (GREATEST) */
    boolean updateDuration(long id, long durationMs, Instant now) throws Exception;

    /** isActive = 'Y' 인 경우에만 종료. 이미 닫혔으면 false */
    boolean close(long id, ShutdownReason reason, long durationMs, Instant endedAt) throws Exception;
}
