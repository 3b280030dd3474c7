package com.vibecoding.ocloud.model.ocloud;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * O-Cloud 관측 상태
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OCloudStatus {
    private OCloudPhase phase;
    private String message;
    private ResourceInventory resourceInventory;
    private String smoStatus;
    private String o2Status;
    private LocalDateTime lastReconciled;

    @Builder.Default
    private List<Condition> conditions = new ArrayList<>();

    /**
     * 조건 추가 또는 갱신 (타입 기준, 상태가 바뀔 때만 전이 시각 갱신)
     */
    public void upsertCondition(Condition condition) {
        if (conditions == null) {
            conditions = new ArrayList<>();
        }
        for (int i = 0; i < conditions.size(); i++) {
            Condition existing = conditions.get(i);
            if (existing.getType().equals(condition.getType())) {
                if (existing.getStatus().equals(condition.getStatus())
                    && Objects.equals(existing.getReason(), condition.getReason())
                    && Objects.equals(existing.getMessage(), condition.getMessage())) {
                    condition.setLastTransitionTime(existing.getLastTransitionTime());
                }
                conditions.set(i, condition);
                return;
            }
        }
        conditions.add(condition);
        conditions.sort(Comparator.comparing(Condition::getType));
    }

    /**
     * 타입으로 조건 조회
     */
    public Optional<Condition> findCondition(String type) {
        if (conditions == null) {
            return Optional.empty();
        }
        return conditions.stream()
            .filter(c -> c.getType().equals(type))
            .findFirst();
    }
}
