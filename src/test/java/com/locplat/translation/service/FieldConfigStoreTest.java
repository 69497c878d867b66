package com.locplat.translation.service;

import com.locplat.translation.model.FieldConfigEntity;
import com.locplat.translation.model.FieldMappingConfig;
import com.locplat.translation.model.FieldType;
import com.locplat.translation.model.TranslationPattern;
import com.locplat.translation.repository.FieldConfigRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FieldConfigStoreTest {

    @Mock
    private FieldConfigRepository configRepository;

    @Mock
    private FieldMappingCache mappingCache;

    private FieldConfigStore store;

    @BeforeEach
    void setUp() {
        store = new FieldConfigStore(configRepository, mappingCache, 300);
    }

    @Test
    void loadsFromRepositoryOnceAndPopulatesCaches() {
        when(mappingCache.getConfig("acme", "articles")).thenReturn(Optional.empty());
        when(configRepository.findByClientIdAndCollectionName("acme", "articles"))
                .thenReturn(Optional.of(entity()));

        FieldMappingConfig first = store.getConfig("acme", "articles");
        FieldMappingConfig second = store.getConfig("acme", "articles");

        assertThat(second).isSameAs(first);
        assertThat(first.getFieldPaths()).containsExactly("title", "body");
        assertThat(first.getFieldTypes()).containsEntry("body", FieldType.WYSIWYG);
        assertThat(first.getTranslationPattern()).isEqualTo(TranslationPattern.MERGE_IN_PLACE);
        verify(configRepository, times(1)).findByClientIdAndCollectionName("acme", "articles");
        verify(mappingCache).putConfig(first);
    }

    @Test
    void sharedCacheHitSkipsRepository() {
        FieldMappingConfig cached = FieldMappingConfig.builder().clientId("acme").collectionName("articles")
                .fieldPaths(List.of("title")).build();
        when(mappingCache.getConfig("acme", "articles")).thenReturn(Optional.of(cached));

        assertThat(store.getConfig("acme", "articles")).isSameAs(cached);
        verify(configRepository, never()).findByClientIdAndCollectionName(any(), any());
    }

    @Test
    void missingConfigFallsBackToDefault() {
        when(mappingCache.getConfig("acme", "pages")).thenReturn(Optional.empty());
        when(configRepository.findByClientIdAndCollectionName("acme", "pages")).thenReturn(Optional.empty());

        FieldMappingConfig config = store.getConfig("acme", "pages");

        assertThat(config.hasFieldPaths()).isFalse();
        assertThat(config.getTranslationPattern()).isEqualTo(TranslationPattern.COLLECTION_TRANSLATIONS);
        assertThat(config.isPreserveHtml()).isTrue();
    }

    @Test
    void saveUpdatesExistingRowAndInvalidatesCaches() {
        FieldConfigEntity existing = entity();
        when(mappingCache.getConfig("acme", "articles")).thenReturn(Optional.empty());
        when(configRepository.findByClientIdAndCollectionName("acme", "articles"))
                .thenReturn(Optional.of(existing));
        when(configRepository.save(any(FieldConfigEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));
        store.getConfig("acme", "articles");

        FieldMappingConfig updated = FieldMappingConfig.builder()
                .clientId("acme")
                .collectionName("articles")
                .fieldPaths(List.of("title", "summary"))
                .fieldTypes(Map.of("summary", FieldType.TEXTAREA))
                .batchProcessing(true)
                .build();
        FieldMappingConfig saved = store.saveConfig(updated);

        ArgumentCaptor<FieldConfigEntity> captor = ArgumentCaptor.forClass(FieldConfigEntity.class);
        verify(configRepository).save(captor.capture());
        assertThat(captor.getValue()).isSameAs(existing);
        assertThat(captor.getValue().getFieldTypes()).containsEntry("summary", "textarea");
        assertThat(captor.getValue().getTranslationPattern()).isEqualTo("collection_translations");
        assertThat(saved.getFieldPaths()).containsExactly("title", "summary");
        verify(mappingCache).invalidateConfig("acme", "articles");

        assertThat(store.getConfig("acme", "articles").getFieldPaths()).containsExactly("title", "summary");
    }

    @Test
    void invalidateClientDropsLocalEntries() {
        when(mappingCache.getConfig("acme", "articles")).thenReturn(Optional.empty());
        when(configRepository.findByClientIdAndCollectionName("acme", "articles"))
                .thenReturn(Optional.of(entity()));
        when(mappingCache.invalidateClient("acme")).thenReturn(1L);
        store.getConfig("acme", "articles");

        assertThat(store.invalidateClient("acme")).isEqualTo(1);
        store.getConfig("acme", "articles");

        verify(configRepository, times(2)).findByClientIdAndCollectionName("acme", "articles");
    }

    private static FieldConfigEntity entity() {
        FieldConfigEntity entity = new FieldConfigEntity();
        entity.setClientId("acme");
        entity.setCollectionName("articles");
        entity.setFieldPaths(new ArrayList<>(List.of("title", "body")));
        entity.setFieldTypes(new LinkedHashMap<>(Map.of("body", "wysiwyg")));
        entity.setTranslationPattern("merge_in_place");
        return entity;
    }
}
