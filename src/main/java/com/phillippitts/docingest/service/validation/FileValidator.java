package com.phillippitts.docingest.service.validation;

import com.phillippitts.docingest.config.properties.IngestionProperties;
import com.phillippitts.docingest.domain.DocumentCategory;
import com.phillippitts.docingest.domain.SubmittedFile;
import com.phillippitts.docingest.exception.InvalidFileException;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Validates a submitted file before it enters the pipeline.
 *
 * <p>Checks, in order: a usable name, a positive size, an accepted extension, the size limit,
 * and, when the target category is in the catalog, that the category accepts the extension.
 */
@Component
public class FileValidator {

    private final IngestionProperties.Validation props;

    public FileValidator(IngestionProperties properties) {
        this.props = properties.getValidation();
    }

    /**
     * @throws InvalidFileException when the file cannot be ingested under {@code targetCategory}
     */
    public void validate(SubmittedFile file, String targetCategory) {
        if (file == null) {
            throw new InvalidFileException("File is null");
        }
        String name = file.name();
        if (name == null || name.isBlank()) {
            throw new InvalidFileException("File name is missing");
        }
        long size = effectiveSize(file);
        if (size <= 0) {
            throw new InvalidFileException(name, "File is empty");
        }
        String extension = extensionOf(name);
        if (extension.isEmpty() || !props.getAllowedExtensions().contains(extension)) {
            throw new InvalidFileException(name, "Unsupported file type"
                    + (extension.isEmpty() ? "" : " ." + extension)
                    + "; allowed: " + String.join(", ", props.getAllowedExtensions()));
        }
        if (size > props.getMaxFileBytes()) {
            throw new InvalidFileException(name, "File too large: " + size + " bytes. Max: "
                    + props.getMaxFileBytes() + " bytes (" + (props.getMaxFileBytes() / (1024 * 1024)) + " MB)");
        }
        DocumentCategory.fromKey(targetCategory).ifPresent(category -> {
            if (!category.accepts(extension)) {
                throw new InvalidFileException(name, "Category " + category.key() + " does not accept ."
                        + extension + " files");
            }
        });
    }

    /**
     * @return lowercase extension without the dot, or "" when there is none
     */
    public static String extensionOf(String name) {
        if (name == null) {
            return "";
        }
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).trim().toLowerCase(Locale.ROOT);
    }

    private static long effectiveSize(SubmittedFile file) {
        if (file.content() != null) {
            return file.content().length;
        }
        return file.size();
    }
}
