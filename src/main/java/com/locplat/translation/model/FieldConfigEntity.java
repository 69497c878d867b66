package com.locplat.translation.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Setter
@Getter
@Entity
@Table(name = "field_configs",
        uniqueConstraints = @UniqueConstraint(columnNames = {"client_id", "collection_name"}))
public class FieldConfigEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "client_id", nullable = false)
    private String clientId;

    @Column(name = "collection_name", nullable = false)
    private String collectionName;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "field_paths", columnDefinition = "jsonb", nullable = false)
    private List<String> fieldPaths = new ArrayList<>();

    // Stored as type names so unknown values survive a round trip through the database.
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "field_types", columnDefinition = "jsonb")
    private Map<String, String> fieldTypes = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "rtl_field_mapping", columnDefinition = "jsonb")
    private Map<String, List<String>> rtlFieldMapping = new LinkedHashMap<>();

    @Column(name = "primary_collection")
    private String primaryCollection;

    @Column(name = "translation_pattern", length = 50)
    private String translationPattern;

    @Column(name = "batch_processing")
    private boolean batchProcessing;

    @Column(name = "preserve_html_structure")
    private boolean preserveHtml = true;

    @Column(name = "content_sanitization")
    private boolean contentSanitization = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Column(name = "last_used_at")
    private OffsetDateTime lastUsedAt;

    @PrePersist
    void onCreate() {
        OffsetDateTime now = OffsetDateTime.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = OffsetDateTime.now();
    }
}
