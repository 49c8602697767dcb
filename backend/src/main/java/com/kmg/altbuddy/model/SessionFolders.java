package com.kmg.altbuddy.model;

import java.nio.file.Path;
import java.util.List;

public record SessionFolders(
        String sessionId,
        SessionType type,
        Path images,
        Path altText,
        Path reports
) {
    public List<Path> all() {
        return List.of(images, altText, reports);
    }
}
