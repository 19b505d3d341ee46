package com.clan.clears.service;

import com.clan.clears.dto.ClearsSnapshot;
import com.clan.clears.dto.CoordinatorState;
import com.clan.clears.dto.JobRecord;
import com.clan.clears.dto.MembersView;
import com.clan.clears.dto.ReadMode;
import com.clan.clears.dto.RunUpdateRequest;
import com.clan.clears.dto.RunUpdateResult;
import com.clan.clears.dto.StatsView;

import java.util.List;
import java.util.Optional;

/**
 * 通关统计的读取与触发接口。
 */
public interface ClanStatsService {

    /**
     * 当前最佳快照：优先规范快照，其次部分快照，都没有时返回未找到。
     *
     * @param waitMs    {@link ReadMode#SYNC} 的等待上限，可为 null
     * @param userLimit {@link ReadMode#SYNC} 的成员上限，可为 null
     */
    StatsView getStats(ReadMode mode, Long waitMs, Integer userLimit);

    MembersView getMembers(ReadMode mode);

    /**
     * 已存储的规范快照。
     */
    ClearsSnapshot getCanonicalSnapshot();

    /**
     * 由已存储的成员结果重建的汇总，没有结果时为空。
     */
    Optional<ClearsSnapshot> buildPartialSnapshot();

    RunUpdateResult runUpdate(RunUpdateRequest request);

    List<JobRecord> getJobStatus(String membershipId);

    CoordinatorState getDebugState();
}
