package com.tracking.engine.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tracking.engine.config.SyncConfig;
import com.tracking.engine.dto.RecordView;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds upload bodies.
 *
 * Shape: {@code {"<rootProperty>": <record or [records]>, ...params}}. With
 * {@code batchSync} the root property holds an array, otherwise the single
 * record object.
 */
@Component
@RequiredArgsConstructor
public class SyncPayloadBuilder {

    private final ObjectMapper objectMapper;

    public SyncBatch build(List<RecordView> records, SyncConfig config) {
        ObjectNode root = objectMapper.createObjectNode();
        config.params().forEach((key, value) -> root.set(key, objectMapper.valueToTree(value)));

        if (config.batchSync()) {
            ArrayNode array = root.putArray(config.rootProperty());
            records.forEach(record -> array.add(record.body()));
        } else {
            root.set(config.rootProperty(), records.get(0).body());
        }

        try {
            return new SyncBatch(
                records.stream().map(RecordView::id).toList(),
                objectMapper.writeValueAsString(root)
            );
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize sync payload", e);
        }
    }
}
