package com.locplat.translation.service;

import com.locplat.translation.model.LanguageDirection;

/**
 * Context sent along with each HTML text run. Right-to-left targets are asked to
 * keep a natural reading order; both variants forbid adding words.
 */
final class HtmlTranslationInstructions {

    private HtmlTranslationInstructions() {
    }

    static String forTextRun(String text, String targetLang) {
        if (LanguageDirection.isRightToLeft(targetLang)) {
            return TranslationPromptBuilder.HTML_FRAGMENT_MARKER + " to " + targetLang
                    + ". Translate ONLY this exact text segment: '" + text + "'. Use natural " + targetLang
                    + " word order and sentence flow that reads naturally from right to left."
                    + " Do not add any additional words, explanations, or content.";
        }
        return TranslationPromptBuilder.HTML_FRAGMENT_MARKER
                + ". Translate ONLY this exact text segment: '" + text + "'."
                + " Do not add any additional words, explanations, or content. Preserve the exact meaning and length.";
    }
}
