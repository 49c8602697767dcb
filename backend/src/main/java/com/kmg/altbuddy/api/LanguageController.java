package com.kmg.altbuddy.api;

import com.kmg.altbuddy.dto.LanguagesResponse;
import com.kmg.altbuddy.service.JobValidator;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/languages")
public class LanguageController {
    private final JobValidator jobValidator;

    public LanguageController(JobValidator jobValidator) {
        this.jobValidator = jobValidator;
    }

    @GetMapping
    public LanguagesResponse languages() {
        return new LanguagesResponse(jobValidator.allowedLanguages(), jobValidator.defaultLanguage());
    }
}
