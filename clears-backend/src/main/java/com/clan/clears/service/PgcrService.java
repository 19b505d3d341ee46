package com.clan.clears.service;

import com.clan.clears.dto.PostGameReport;

public interface PgcrService {

    /**
     * 单个活动实例的精简战后报告，缓存有效期内直接读缓存。
     */
    PostGameReport getReport(String instanceId);
}
