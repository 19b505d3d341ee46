package com.clan.clears.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * DurableEntry实体类：共享键值存储中的一条 JSON 文档
 */
@Entity
@Data
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "durable_entry")
public class DurableEntry implements Serializable {

    /**
     * entry_key: 例如 {@code job:4611686018467000000} 或 {@code clears_snapshot}
     */
    @Id
    @Column(name = "entry_key", length = 191)
    private String key;

    @Lob
    @Column(name = "entry_value", nullable = false)
    private String value;

    // 为 null 表示永不过期
    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
