package com.kmg.altbuddy.dto;

import java.util.List;

public record LanguagesResponse(List<String> supportedLanguages, String defaultLanguage) {
}
