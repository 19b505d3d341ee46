package com.clan.clears.actor;

import com.clan.clears.dto.JobRecord;
import com.clan.clears.dto.JobState;

import java.util.concurrent.CompletableFuture;

/**
 * 任务受理回执，附带一个在任务完成时返回记录的句柄。
 * 只有任务放弃重试后句柄才会失败。
 */
public record JobSubmission(String key, JobState state, CompletableFuture<JobRecord> completion) {
}
