package com.locplat.translation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per client and collection description of which fields to translate and how to
 * write the translations back. Treated as read-only for the duration of a call.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldMappingConfig {

    @JsonProperty("client_id")
    private String clientId;

    @JsonProperty("collection_name")
    private String collectionName;

    /** Ordered; this order is also the batch order. */
    @Builder.Default
    @JsonProperty("field_paths")
    private List<String> fieldPaths = new ArrayList<>();

    @Builder.Default
    @JsonProperty("field_types")
    private Map<String, FieldType> fieldTypes = new LinkedHashMap<>();

    /** language code -> replacement field paths used for that right-to-left language. */
    @Builder.Default
    @JsonProperty("rtl_field_mapping")
    private Map<String, List<String>> rtlFieldMapping = new LinkedHashMap<>();

    @JsonProperty("batch_processing")
    private boolean batchProcessing;

    @Builder.Default
    @JsonProperty("preserve_html_structure")
    private boolean preserveHtml = true;

    @Builder.Default
    @JsonProperty("content_sanitization")
    private boolean contentSanitization = true;

    @Builder.Default
    @JsonProperty("translation_pattern")
    private TranslationPattern translationPattern = TranslationPattern.COLLECTION_TRANSLATIONS;

    @JsonProperty("primary_collection")
    private String primaryCollection;

    /**
     * Config returned when nothing is stored for a client/collection pair.
     */
    public static FieldMappingConfig defaultFor(String clientId, String collectionName) {
        return FieldMappingConfig.builder()
                .clientId(clientId)
                .collectionName(collectionName)
                .build();
    }

    @JsonIgnore
    public boolean hasFieldPaths() {
        return fieldPaths != null && !fieldPaths.isEmpty();
    }

    /**
     * Field paths to use for the given target language, honouring the RTL override.
     */
    public List<String> effectiveFieldPaths(String language) {
        List<String> paths = fieldPaths == null ? List.of() : fieldPaths;
        if (language != null && LanguageDirection.isRightToLeft(language) && rtlFieldMapping != null) {
            List<String> override = rtlFieldMapping.get(language);
            if (override != null) {
                return override;
            }
        }
        return paths;
    }

    public FieldType explicitTypeFor(String path) {
        return fieldTypes == null ? null : fieldTypes.get(path);
    }
}
