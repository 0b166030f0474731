package com.identityplatform.common.model;

import com.identityplatform.common.exception.InvalidIdentificationRequestException;

import java.util.Locale;
import java.util.Set;

/**
 * Input of one orchestration request: the image for the verifier and the question for the chatbot.
 *
 * @param image         raw image bytes
 * @param imageFilename original file name; its extension selects the multipart content type
 * @param query         normative question forwarded to the chatbot
 * @param provider      chatbot LLM provider hint, {@code null} for the configured default
 * @param topK          chatbot retrieval depth, {@code null} for the configured default
 */
public record IdentificationRequest(
    byte[] image,
    String imageFilename,
    String query,
    String provider,
    Integer topK
) {

    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of("jpg", "jpeg", "png");

    public IdentificationRequest {
        if (image == null || image.length == 0) {
            throw new InvalidIdentificationRequestException("image", "image must not be empty");
        }
        if (imageFilename == null || imageFilename.isBlank()) {
            throw new InvalidIdentificationRequestException("image", "image file name is required");
        }
        if (!SUPPORTED_EXTENSIONS.contains(extensionOf(imageFilename))) {
            throw new InvalidIdentificationRequestException("image",
                "unsupported image extension, expected one of " + SUPPORTED_EXTENSIONS + ": " + imageFilename);
        }
        if (query == null || query.isBlank()) {
            throw new InvalidIdentificationRequestException("query", "query must not be blank");
        }
        if (topK != null && topK <= 0) {
            throw new InvalidIdentificationRequestException("k", "k must be positive, got " + topK);
        }
    }

    public String imageExtension() {
        return extensionOf(imageFilename);
    }

    /** {@code image/jpeg} for .jpg and .jpeg, {@code image/png} for .png. */
    public String imageContentType() {
        return "png".equals(imageExtension()) ? "image/png" : "image/jpeg";
    }

    private static String extensionOf(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
