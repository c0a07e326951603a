package com.fastchat.memory.service.impl.entity;

import lombok.Data;

import java.time.LocalDateTime;

@Data
public class ArchivedMessageEntity {

    private String id;
    private String sessionId;
    private String branchId;
    private String parentMessageId;
    private String role;
    private String content;
    private Long messageTimestamp;
    private Integer version;
    /** JSON object. */
    private String metadata;
    private LocalDateTime archivedAt;
}
