package com.clan.clears.activity;

/**
 * 历史记录的模式过滤，按声明顺序查询。
 */
public enum ModeFilter {
    DUNGEON(82),
    // 旧地牢的历史条目
    STORY(2),
    // 不带 mode 参数
    ALL(null);

    private final Integer modeId;

    ModeFilter(Integer modeId) {
        this.modeId = modeId;
    }

    public Integer getModeId() {
        return modeId;
    }
}
