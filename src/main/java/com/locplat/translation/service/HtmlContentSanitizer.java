package com.locplat.translation.service;

import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Drops script and style elements from HTML, strips control characters and caps the length.
 */
@Component
public class HtmlContentSanitizer implements ContentSanitizer {

    private static final Logger logger = LoggerFactory.getLogger(HtmlContentSanitizer.class);

    // Keeps tab, LF and CR.
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0b\\x0c\\x0e-\\x1f\\x7f]");

    private final HtmlTextNodeCodec htmlCodec;

    public HtmlContentSanitizer(HtmlTextNodeCodec htmlCodec) {
        this.htmlCodec = htmlCodec;
    }

    @Override
    public String sanitize(String text, int maxLength) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String sanitized = text;
        if (htmlCodec.isHtml(sanitized)) {
            Document document = htmlCodec.parse(sanitized);
            if (!document.select("script, style").isEmpty()) {
                document.select("script, style").remove();
                sanitized = document.body().html();
            }
        }
        sanitized = CONTROL_CHARS.matcher(sanitized).replaceAll("");
        if (maxLength > 0 && sanitized.length() > maxLength) {
            logger.warn("Truncating field content from {} to {} characters", sanitized.length(), maxLength);
            sanitized = sanitized.substring(0, maxLength);
        }
        return sanitized;
    }
}
