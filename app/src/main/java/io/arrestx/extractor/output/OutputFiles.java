package io.arrestx.extractor.output;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

final class OutputFiles {

    private OutputFiles() {
    }

    static void prepareParent(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
