package com.edgegate.backend.trading.gate;

import com.edgegate.backend.exception.PersistenceException;
import com.edgegate.backend.model.EdgeSampleEntity;
import com.edgegate.backend.repository.EdgeSampleRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
@RequiredArgsConstructor
public class JpaEdgeHistoryStore implements EdgeHistoryStore {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final EdgeSampleRepository edgeSampleRepository;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    @Transactional
    public void append(EdgeStatsKey key, EdgeSample sample, int capacity) {
        try {
            edgeSampleRepository.save(EdgeSampleEntity.builder()
                    .symbol(key.symbol())
                    .direction(key.direction())
                    .timeframe(key.timeframe())
                    .netEdge(sample.netEdge())
                    .recordedAt(sample.timestamp())
                    .signalType(sample.signalType())
                    .metadata(writeMetadata(sample.metadata()))
                    .build());
            prune(key, capacity);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to store edge sample for " + key, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Map<EdgeStatsKey, List<EdgeSample>> loadAll() {
        Map<EdgeStatsKey, List<EdgeSample>> result = new LinkedHashMap<>();
        try {
            for (EdgeSampleEntity entity : edgeSampleRepository.findAllByOrderByIdAsc()) {
                EdgeStatsKey key = new EdgeStatsKey(entity.getSymbol(), entity.getDirection(), entity.getTimeframe());
                result.computeIfAbsent(key, k -> new ArrayList<>()).add(toSample(entity));
            }
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load edge history", e);
        }
        return result;
    }

    @Override
    @Transactional
    public void clear(EdgeStatsKey key) {
        try {
            edgeSampleRepository.deleteBySymbolAndDirectionAndTimeframe(key.symbol(), key.direction(), key.timeframe());
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to clear edge history for " + key, e);
        }
    }

    @Override
    @Transactional
    public void clearAll() {
        try {
            edgeSampleRepository.deleteAllInBatch();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to clear edge history", e);
        }
    }

    private void prune(EdgeStatsKey key, int capacity) {
        long stored = edgeSampleRepository.countBySymbolAndDirectionAndTimeframe(key.symbol(), key.direction(), key.timeframe());
        if (stored <= capacity) {
            return;
        }
        List<Long> ids = edgeSampleRepository.findIdsNewestFirst(key.symbol(), key.direction(), key.timeframe());
        Long oldestKept = ids.get(capacity - 1);
        int removed = edgeSampleRepository.deleteOlderThan(key.symbol(), key.direction(), key.timeframe(), oldestKept);
        log.debug("Pruned {} edge samples for {}", removed, key);
    }

    private EdgeSample toSample(EdgeSampleEntity entity) {
        return new EdgeSample(entity.getNetEdge(), entity.getRecordedAt(), entity.getSignalType(), readMetadata(entity));
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize edge sample metadata {}", metadata.keySet(), e);
            return null;
        }
    }

    private Map<String, Object> readMetadata(EdgeSampleEntity entity) {
        if (entity.getMetadata() == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(entity.getMetadata(), METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable metadata on edge sample {}", entity.getId(), e);
            return Map.of();
        }
    }
}
