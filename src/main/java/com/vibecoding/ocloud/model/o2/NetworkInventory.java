package com.vibecoding.ocloud.model.o2;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 네트워크 인벤토리
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NetworkInventory {
    private int poolCount;
    private long totalCores;
    private long availableCores;
    private long totalMemoryGB;
    private long availableMemoryGB;
}
