package com.github.dimitryivaniuta.cmdb.scheduler;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface JobLockRepository extends JpaRepository<JobLockRecord, String> {

    /**
     * Inserts the lock, or takes it over when the current holder has expired.
     *
     * @return 1 when acquired, 0 when held by someone else
     */
    @Modifying
    @Query(value = """
            INSERT INTO job_lock (lock_name, owner_id, acquired_at, expires_at)
            VALUES (:name, :owner, :now, :expiresAt)
            ON CONFLICT (lock_name) DO UPDATE
               SET owner_id = EXCLUDED.owner_id,
                   acquired_at = EXCLUDED.acquired_at,
                   expires_at = EXCLUDED.expires_at
             WHERE job_lock.expires_at <= EXCLUDED.acquired_at
            """, nativeQuery = true)
    int tryAcquire(@Param("name") String name,
                   @Param("owner") String owner,
                   @Param("now") Instant now,
                   @Param("expiresAt") Instant expiresAt);

    @Modifying
    @Query("delete from JobLockRecord l where l.lockName = :name and l.ownerId = :owner")
    int release(@Param("name") String name, @Param("owner") String owner);

    List<JobLockRecord> findByExpiresAtAfterOrderByLockNameAsc(Instant now);

    @Modifying
    @Query("delete from JobLockRecord l where l.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
