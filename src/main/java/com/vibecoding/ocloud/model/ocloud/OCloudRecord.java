package com.vibecoding.ocloud.model.ocloud;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * O-Cloud 저장 레코드 (spec/status를 JSON으로 보관)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "ocloud")
public class OCloudRecord {
    @Id
    private String name;                // O-Cloud 이름

    private String namespace;

    @Lob
    @Column(nullable = false)
    private String specJson;            // OCloudSpec JSON

    @Lob
    private String statusJson;          // OCloudStatus JSON

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
