package com.vibecoding.ocloud.model.o2;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * O2 알람
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class O2Alarm {
    private String id;
    private String type;
    private String severity;
    private String source;
    private String description;
    private LocalDateTime timestamp;
    private boolean acknowledged;
}
