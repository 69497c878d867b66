package com.locplat.translation.config;

import com.locplat.translation.model.RelationshipEdge;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static relationship schema, bound from {@code app.relationships.<collection>[n].*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "app")
public class RelationshipProperties {

    private Map<String, List<RelationshipEdge>> relationships = new LinkedHashMap<>();
}
