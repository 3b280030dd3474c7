package com.vibecoding.ocloud.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibecoding.ocloud.model.ocloud.OCloud;
import com.vibecoding.ocloud.model.ocloud.OCloudRecord;
import com.vibecoding.ocloud.model.ocloud.OCloudSpec;
import com.vibecoding.ocloud.model.ocloud.OCloudStatus;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * O-Cloud 저장소
 * - spec/status 는 JSON 문자열로 DB 에 저장 (JPA)
 * - spec 은 API 호출자만, status 는 재조정기만 변경
 */
@Repository
@RequiredArgsConstructor
public class OCloudRepository {

    private static final Logger log = LoggerFactory.getLogger(OCloudRepository.class);

    private final OCloudRecordRepository recordRepository;
    private final ObjectMapper objectMapper;

    /**
     * spec 저장 (기존 status 유지)
     */
    public OCloud saveSpec(String name, String namespace, OCloudSpec spec) {
        LocalDateTime now = LocalDateTime.now();
        OCloudRecord record = recordRepository.findById(name)
            .orElseGet(() -> OCloudRecord.builder().name(name).createdAt(now).build());

        record.setNamespace(namespace);
        record.setSpecJson(write(spec));
        record.setUpdatedAt(now);
        recordRepository.save(record);

        log.info("Saved O-Cloud spec to DB: {}", name);
        return toOCloud(record);
    }

    /**
     * status 저장
     */
    public void saveStatus(String name, OCloudStatus status) {
        Optional<OCloudRecord> recordOpt = recordRepository.findById(name);
        if (recordOpt.isEmpty()) {
            log.debug("O-Cloud {} removed before status update, skipping", name);
            return;
        }

        OCloudRecord record = recordOpt.get();
        record.setStatusJson(write(status));
        record.setUpdatedAt(LocalDateTime.now());
        recordRepository.save(record);
        log.debug("Saved O-Cloud status to DB: {} ({})", name, status.getPhase());
    }

    /**
     * O-Cloud 조회
     */
    public Optional<OCloud> findByName(String name) {
        return recordRepository.findById(name).map(this::toOCloud);
    }

    /**
     * 전체 O-Cloud 조회 (이름순)
     */
    public List<OCloud> findAll() {
        return recordRepository.findAll().stream()
            .map(this::toOCloud)
            .sorted((a, b) -> a.getName().compareTo(b.getName()))
            .collect(Collectors.toList());
    }

    public List<String> findAllNames() {
        return recordRepository.findAll().stream()
            .map(OCloudRecord::getName)
            .sorted()
            .collect(Collectors.toList());
    }

    public boolean existsByName(String name) {
        return recordRepository.existsById(name);
    }

    /**
     * O-Cloud 삭제
     */
    public void deleteByName(String name) {
        recordRepository.deleteById(name);
        log.info("Deleted O-Cloud from DB: {}", name);
    }

    private OCloud toOCloud(OCloudRecord record) {
        return OCloud.builder()
            .name(record.getName())
            .namespace(record.getNamespace())
            .spec(read(record.getSpecJson(), OCloudSpec.class))
            .status(record.getStatusJson() != null ? read(record.getStatusJson(), OCloudStatus.class) : null)
            .build();
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize O-Cloud data: " + e.getMessage(), e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize O-Cloud data: " + e.getMessage(), e);
        }
    }
}
