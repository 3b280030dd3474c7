package com.vibecoding.ocloud.model.o2;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 스토리지 인벤토리
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StorageInventory {
    private int poolCount;
    private long totalCapacityGB;
    private long availableCapacityGB;
}
