package com.locplat.translation.service;

import com.locplat.translation.model.FieldTranslation;
import com.locplat.translation.model.HtmlTextRun;
import com.locplat.translation.model.LanguageDirection;
import com.locplat.translation.model.TranslationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates rich-text fields run by run so markup never reaches the provider.
 * A run that fails to translate keeps its source text; the rest of the field still
 * gets translated.
 */
@Service
public class HtmlFieldTranslator {

    private static final Logger logger = LoggerFactory.getLogger(HtmlFieldTranslator.class);

    private final HtmlTextNodeCodec htmlCodec;
    private final CachedTranslationService translationService;

    public HtmlFieldTranslator(HtmlTextNodeCodec htmlCodec, CachedTranslationService translationService) {
        this.htmlCodec = htmlCodec;
        this.translationService = translationService;
    }

    public FieldTranslation translate(String html, TranslationSettings settings, String context) {
        List<HtmlTextRun> runs;
        try {
            runs = htmlCodec.decode(html);
        } catch (RuntimeException e) {
            logger.warn("Could not parse HTML field, translating it as plain text: {}", e.getMessage());
            return translationService.translate(html, settings, context);
        }

        boolean rtl = LanguageDirection.isRightToLeft(settings.targetLang());
        if (runs.isEmpty()) {
            return result(html, settings, 1.0, 0, List.of(), rtl);
        }

        Map<String, String> translations = new LinkedHashMap<>();
        List<String> failedRuns = new ArrayList<>();
        String provider = settings.provider();
        String model = settings.model();
        for (HtmlTextRun run : runs) {
            if (translations.containsKey(run.text())) {
                continue;
            }
            try {
                FieldTranslation translated = translationService.translate(run.text(), settings,
                        HtmlTranslationInstructions.forTextRun(run.text(), settings.targetLang()));
                translations.put(run.text(), translated.translatedText());
                provider = translated.provider();
                model = translated.model();
            } catch (TranslationException e) {
                logger.warn("Keeping original text for HTML run '{}': {}", abbreviate(run.text()), e.getMessage());
                failedRuns.add(run.text());
            }
        }

        String encoded = htmlCodec.encode(html, translations);
        double quality = rtl ? 0.9 : 1.0;
        TranslationSettings used = new TranslationSettings(provider, model, settings.sourceLang(),
                settings.targetLang(), settings.collection());
        return result(encoded, used, quality, runs.size(), failedRuns, rtl);
    }

    private FieldTranslation result(String html, TranslationSettings settings, double quality, int runCount,
                                    List<String> failedRuns, boolean rtl) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("html_preserved", true);
        metadata.put("text_nodes", runCount);
        metadata.put("rtl_optimized", rtl);
        if (!failedRuns.isEmpty()) {
            metadata.put("failed_text_nodes", failedRuns.size());
        }
        return new FieldTranslation(html, settings.provider(), settings.model(), settings.sourceLang(),
                settings.targetLang(), quality, metadata);
    }

    private static String abbreviate(String text) {
        return text.length() <= 40 ? text : text.substring(0, 37) + "...";
    }
}
