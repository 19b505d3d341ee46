package com.clan.clears.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PgcrPlayer {

    private String membershipId;

    private int membershipType;

    private String displayName;

    private String characterId;

    private boolean completed;

    private long timePlayedSeconds;

    private int kills;

    private int deaths;

    private int assists;
}
