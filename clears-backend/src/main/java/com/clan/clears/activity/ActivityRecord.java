package com.clan.clears.activity;

import com.clan.clears.util.JsonPaths;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * 单条原始历史记录的类型化视图。每个字段都按别名列表依次读取，兼容上游的多种记录结构。
 */
public record ActivityRecord(Long referenceId, boolean completed, Instant period, String instanceId) {

    static final String[] REFERENCE_ID = {"activityDetails.referenceId", "activityHash", "referenceId"};
    static final String[] COMPLETED = {"values.completed.basic.value", "values.completed.value", "isCompleted", "completed"};
    static final String[] SUCCESS = {"values.success.basic.value", "values.success.value"};
    static final String[] PERIOD = {"period", "periodStart"};
    static final String[] INSTANCE_ID = {"activityDetails.instanceId", "activityDetails.instanceIdHash"};

    public static ActivityRecord from(JsonNode node) {
        Long referenceId = JsonPaths.firstLong(node, REFERENCE_ID).orElse(null);
        boolean completed = JsonPaths.firstFlag(node, COMPLETED).orElse(false)
                || JsonPaths.firstFlag(node, SUCCESS).orElse(false);
        Instant period = JsonPaths.firstInstant(node, PERIOD).orElse(null);
        String instanceId = JsonPaths.firstText(node, INSTANCE_ID).orElse(null);
        return new ActivityRecord(referenceId, completed, period, instanceId);
    }

    /** 同时具有实例编号和时间时才参与“最近一次通关”的追踪。 */
    public boolean isTraceable() {
        return instanceId != null && period != null;
    }
}
