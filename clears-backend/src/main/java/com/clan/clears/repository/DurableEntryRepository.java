package com.clan.clears.repository;

import com.clan.clears.entity.DurableEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface DurableEntryRepository extends JpaRepository<DurableEntry, String> {

    /**
     * 同一键前缀下的全部条目，例如所有 {@code member_clears:} 结果。
     */
    List<DurableEntry> findByKeyStartingWithOrderByKeyAsc(String prefix);

    @Modifying
    @Query("DELETE FROM DurableEntry e WHERE e.expiresAt IS NOT NULL AND e.expiresAt < :now")
    int deleteExpired(@Param("now") Instant now);
}
