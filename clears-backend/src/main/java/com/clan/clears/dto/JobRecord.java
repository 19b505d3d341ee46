package com.clan.clears.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * 单个成员任务的持久化状态，每次状态迁移后写入。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRecord {

    private String key;

    private String membershipId;

    private int membershipType;

    private String characterId;

    private CounterOptions options;

    @Builder.Default
    private JobState state = JobState.PENDING;

    @Builder.Default
    private JobProgress progress = new JobProgress();

    // 租约开始时间，没有执行持有任务时为 null
    private Instant lockedAt;

    private String error;

    private int attempts;

    private Instant createdAt;

    private Instant lastUpdatedAt;

    private Instant completedAt;

    private PerMemberResult result;

    @JsonIgnore
    public boolean holdsLiveLease(Instant now, Duration ttl) {
        return lockedAt != null && lockedAt.plus(ttl).isAfter(now);
    }
}
