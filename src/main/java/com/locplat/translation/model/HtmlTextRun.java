package com.locplat.translation.model;

import java.util.Map;

/**
 * A non-blank text run found in an HTML fragment together with its enclosing element.
 */
public record HtmlTextRun(String text, String parentTag, Map<String, String> parentAttributes) {
}
