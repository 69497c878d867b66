package com.locplat.translation.model;

import java.util.List;

public record ValidationResult(boolean valid, List<String> errors, List<String> warnings) {
}
