package com.locplat.translation.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of field extraction: individually handled fields keyed by path, plus the
 * optional batch group serialized under {@value #BATCH_KEY}.
 */
public class ExtractionResult {

    public static final String BATCH_KEY = "__batch__";

    private final Map<String, ExtractedField> fields = new LinkedHashMap<>();

    private BatchGroup batch;

    public void addField(ExtractedField field) {
        fields.put(field.path(), field);
    }

    @JsonAnyGetter
    public Map<String, ExtractedField> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    @JsonAnySetter
    void putField(String path, ExtractedField field) {
        fields.put(path, field);
    }

    @JsonProperty(BATCH_KEY)
    public BatchGroup getBatch() {
        return batch;
    }

    @JsonProperty(BATCH_KEY)
    public void setBatch(BatchGroup batch) {
        this.batch = batch;
    }

    @JsonIgnore
    public boolean hasBatch() {
        return batch != null && !batch.isEmpty();
    }

    /**
     * Number of distinct field paths, batched or not.
     */
    @JsonIgnore
    public int totalFieldCount() {
        return fields.size() + (batch == null ? 0 : batch.size());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return totalFieldCount() == 0;
    }
}
