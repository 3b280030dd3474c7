package com.vibecoding.ocloud.model.ocloud;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 상태 조건 (타입별 하나)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Condition {
    public static final String TRUE = "True";
    public static final String FALSE = "False";

    private String type;
    private String status;              // "True" / "False"
    private LocalDateTime lastTransitionTime;
    private String reason;
    private String message;
}
