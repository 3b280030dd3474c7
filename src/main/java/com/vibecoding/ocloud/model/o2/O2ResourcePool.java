package com.vibecoding.ocloud.model.o2;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * O2 리소스 풀
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class O2ResourcePool {
    private String id;
    private String name;
    private String description;
    private String type;
    private String location;
    private O2ResourceCapacity capacity;
    private O2ResourceCapacity available;
}
