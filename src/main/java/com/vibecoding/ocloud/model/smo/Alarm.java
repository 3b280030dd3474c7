package com.vibecoding.ocloud.model.smo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * SMO 로 전송하는 알람
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alarm {
    private String id;
    private String type;
    private String severity;
    private String source;
    private String description;
    private Map<String, Object> details;
    private LocalDateTime timestamp;
    private boolean acknowledged;
}
