package com.kmg.altbuddy.service;

import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

@Service
public class ImageFolderService {
    private static final Set<String> SUPPORTED = Set.of("png", "jpg", "jpeg", "gif", "webp", "bmp", "svg");

    public int countImages(Path folder) {
        return listSupportedImages(folder).size();
    }

    public List<Path> listSupportedImages(Path folder) {
        Path path = folder.toAbsolutePath().normalize();
        if (!Files.isDirectory(path)) {
            throw new JobValidationException("Images folder not found: " + path);
        }
        try (Stream<Path> stream = Files.walk(path)) {
            return stream.filter(Files::isRegularFile)
                    .filter(this::isSupported)
                    .sorted(Comparator.comparing(Path::toString))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list images in " + path, e);
        }
    }

    public boolean isSupported(Path path) {
        String name = path.getFileName().toString();
        int idx = name.lastIndexOf('.');
        if (idx < 0) {
            return false;
        }
        return SUPPORTED.contains(name.substring(idx + 1).toLowerCase());
    }
}
