package com.locplat.translation.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Builds provider prompts from untrusted field text. Text and context are length-capped
 * and phrases that try to override the instructions are redacted.
 */
@Component
public class TranslationPromptBuilder {

    static final int MAX_TEXT_CHARS = 2000;
    static final int MAX_CONTEXT_CHARS = 500;
    static final String HTML_FRAGMENT_MARKER = "HTML fragment translation";

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0b\\x0c\\x0e-\\x1f\\x7f-\\x9f]");
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n\\s*\\n\\s*\\n+");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t]+");

    private static final List<Pattern> INJECTION_PATTERNS = List.of(
            Pattern.compile("(?i)ignore\\s+(?:previous|all|above|prior)\\s+(?:instructions?|prompts?|context)"),
            Pattern.compile("(?i)(?:system|assistant|user)\\s*:"),
            Pattern.compile("(?i)(?:new|different|alternative)\\s+(?:instructions?|prompts?|task)"),
            Pattern.compile("(?i)(?:act|behave|pretend)\\s+(?:as|like)\\s+(?:a\\s+)?(?:different|new)"),
            Pattern.compile("(?i)(?:forget|ignore|disregard|override)\\s+(?:everything|all)"),
            Pattern.compile("(?i)jailbreak|prompt\\s*injection|adversarial")
    );

    private static final Map<String, String> LANGUAGE_NAMES = Map.ofEntries(
            Map.entry("en", "English"), Map.entry("ar", "Arabic"), Map.entry("bs", "Bosnian"),
            Map.entry("he", "Hebrew"), Map.entry("fa", "Persian"), Map.entry("ur", "Urdu"),
            Map.entry("es", "Spanish"), Map.entry("fr", "French"), Map.entry("de", "German"),
            Map.entry("it", "Italian"), Map.entry("pt", "Portuguese"), Map.entry("ru", "Russian"),
            Map.entry("zh", "Chinese"), Map.entry("ja", "Japanese"), Map.entry("ko", "Korean"),
            Map.entry("tr", "Turkish"), Map.entry("nl", "Dutch"), Map.entry("pl", "Polish")
    );

    public String sanitizeText(String text) {
        return sanitize(text, MAX_TEXT_CHARS);
    }

    public String sanitizeContext(String context) {
        return sanitize(context, MAX_CONTEXT_CHARS);
    }

    /**
     * Builds the full user prompt.
     *
     * @throws TranslationException when nothing translatable is left after sanitizing
     */
    public String buildPrompt(String provider, String text, String sourceLang, String targetLang, String context) {
        String safeText = sanitizeText(text);
        if (safeText.isBlank()) {
            throw new TranslationException(provider, "Text content invalid or empty after sanitization");
        }
        String safeContext = context == null ? "" : sanitizeContext(context);
        String sourceName = languageName(sourceLang);
        String targetName = languageName(targetLang);
        boolean htmlFragment = safeContext.contains(HTML_FRAGMENT_MARKER);

        StringBuilder prompt = new StringBuilder("You are a professional translator. ");
        if (htmlFragment) {
            prompt.append("Translate this ").append(sourceName).append(" text fragment to ").append(targetName)
                    .append(". Translate ONLY the given text, do not add any extra words or content:")
                    .append(" Preserve the exact meaning.");
        } else {
            prompt.append("Translate the following ").append(sourceName).append(" text to ").append(targetName).append(':');
            if ("ar".equalsIgnoreCase(targetLang)) {
                prompt.append(" Please maintain cultural sensitivity and appropriate formal register.");
            }
            if ("bs".equalsIgnoreCase(targetLang)) {
                prompt.append(" Use Latin script unless otherwise specified.");
            }
            if (!safeContext.isEmpty()) {
                prompt.append(" Context: ").append(safeContext);
            }
        }
        prompt.append("\n\nText to translate: ").append(safeText);
        prompt.append("\n\nProvide only the translation, no explanations.");
        return prompt.toString();
    }

    private String sanitize(String value, int maxChars) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        String sanitized = value.length() > maxChars ? value.substring(0, maxChars) : value;
        sanitized = CONTROL_CHARS.matcher(sanitized).replaceAll("");
        for (Pattern pattern : INJECTION_PATTERNS) {
            sanitized = pattern.matcher(sanitized).replaceAll("[REDACTED]");
        }
        sanitized = EXCESS_BLANK_LINES.matcher(sanitized).replaceAll("\n\n");
        sanitized = HORIZONTAL_SPACE.matcher(sanitized).replaceAll(" ");
        return sanitized.strip();
    }

    private String languageName(String code) {
        if (code == null) {
            return "source";
        }
        return LANGUAGE_NAMES.getOrDefault(code.toLowerCase(Locale.ROOT), code.toUpperCase(Locale.ROOT));
    }
}
