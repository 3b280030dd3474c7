package com.vibecoding.ocloud.model.orchestration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * E2/A1/O1/O2 인터페이스 묶음
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InterfaceSpec {
    private InterfaceConfig e2;
    private InterfaceConfig a1;
    private InterfaceConfig o1;
    private InterfaceConfig o2;
}
