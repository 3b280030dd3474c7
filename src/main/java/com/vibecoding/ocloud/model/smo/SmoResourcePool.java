package com.vibecoding.ocloud.model.smo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * SMO 형식의 리소스 풀
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SmoResourcePool {
    private String name;
    private String type;
    private String location;
    private SmoResourceCapacity capacity;
}
