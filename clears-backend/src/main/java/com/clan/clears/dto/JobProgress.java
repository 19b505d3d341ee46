package com.clan.clears.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 成员任务的检查点。崩溃后只保留角色列表，计数会重新拉取。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobProgress {

    private List<String> characters = new ArrayList<>();
}
