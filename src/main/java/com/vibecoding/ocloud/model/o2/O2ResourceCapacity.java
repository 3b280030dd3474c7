package com.vibecoding.ocloud.model.o2;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * O2 리소스 용량
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class O2ResourceCapacity {
    private long computeUnits;
    private long memoryGB;
    private long storageGB;
}
