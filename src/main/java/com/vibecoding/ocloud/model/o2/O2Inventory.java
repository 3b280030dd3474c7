package com.vibecoding.ocloud.model.o2;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 전체 인벤토리
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class O2Inventory {
    private LocalDateTime timestamp;
    private ComputeInventory compute;
    private NetworkInventory network;
    private StorageInventory storage;
}
