package org.dxworks.ommltex;

import java.nio.file.Path;
import java.util.Optional;

public class InputFormatDetector {

    public static Optional<InputFormat> detectFormat(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase();

        // Word lock files (~$name.docx) are not archives
        if (fileName.startsWith("~$")) {
            return Optional.empty();
        }

        if (fileName.endsWith(".docx") || fileName.endsWith(".docm")) {
            return Optional.of(InputFormat.DOCX);
        } else if (fileName.endsWith(".xml")) {
            return Optional.of(InputFormat.XML);
        }

        return Optional.empty();
    }
}
