package com.clan.clears.actor;

import com.clan.clears.dto.CounterOptions;

import java.util.List;

/**
 * {@link MemberJobActor#process} 的输入。{@code characterId} 把任务限定到单个角色，
 * {@code characters} 预先写入检查点，可为 null。
 */
public record JobRequest(String membershipId, int membershipType, String characterId,
                         List<String> characters, CounterOptions options) {

    public static JobRequest forMember(String membershipId, int membershipType, CounterOptions options) {
        return new JobRequest(membershipId, membershipType, null, null, options);
    }
}
