package com.vibecoding.ocloud.model.o2;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 이벤트 구독
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class O2Subscription {
    private String id;
    private String type;
    private String callback;
    private Map<String, String> filter;
    private boolean active;
}
