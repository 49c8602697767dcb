package com.kmg.altbuddy.service;

import com.kmg.altbuddy.config.AltBuddyProperties;
import com.kmg.altbuddy.model.JobKind;
import com.kmg.altbuddy.model.JobSpec;
import com.kmg.altbuddy.model.ProviderOverrides;
import com.kmg.altbuddy.model.SessionFolders;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Component
public class AnalyzerCommandBuilder {
    private final AltBuddyProperties properties;

    public AnalyzerCommandBuilder(AltBuddyProperties properties) {
        this.properties = properties;
    }

    public List<String> build(JobSpec spec, SessionFolders folders, Path outputDir, Path progressFile) {
        List<String> command = new ArrayList<>(properties.getAnalyzer().getCommand());

        if (spec.kind() == JobKind.PAGE_ANALYSIS) {
            command.add("-w");
            command.add(spec.target());
            command.add("--images-folder");
            command.add(folders.images().toString());
        } else {
            command.add("-p");
            command.add("--images-folder");
            command.add(spec.target());
            if (spec.contextFolder() != null) {
                command.add("--context-folder");
                command.add(spec.contextFolder());
            }
        }

        command.add("--alt-text-folder");
        command.add(outputDir.toString());
        command.add("--language");
        command.addAll(spec.languages());
        if (spec.numImages() != null) {
            command.add("--num-images");
            command.add(String.valueOf(spec.numImages()));
        }

        addOverrides(command, spec.overrides());
        if (spec.advancedTranslation()) {
            command.add("--advanced-translation");
        }
        if (spec.geoBoost()) {
            command.add("--geo-boost");
        }
        if (spec.kind() == JobKind.PAGE_ANALYSIS) {
            command.add("--report");
        }

        command.add("--progress-file");
        command.add(progressFile.toAbsolutePath().toString());
        return command;
    }

    private void addOverrides(List<String> command, ProviderOverrides overrides) {
        addOption(command, "--vision-provider", overrides.visionProvider());
        addOption(command, "--vision-model", overrides.visionModel());
        addOption(command, "--processing-provider", overrides.processingProvider());
        addOption(command, "--processing-model", overrides.processingModel());
        addOption(command, "--translation-provider", overrides.translationProvider());
        addOption(command, "--translation-model", overrides.translationModel());
    }

    private void addOption(List<String> command, String option, String value) {
        if (value != null && !value.isBlank()) {
            command.add(option);
            command.add(value);
        }
    }
}
