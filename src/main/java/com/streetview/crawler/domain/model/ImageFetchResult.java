package com.streetview.crawler.domain.model;

import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * Outcome of fetching one directional image: either the image bytes or the
 * reason the fetch failed.
 */
@Getter
@ToString(exclude = "content")
public class ImageFetchResult {
    private final byte[] content;
    private final String failureReason;

    private ImageFetchResult(byte[] content, String failureReason) {
        this.content = content;
        this.failureReason = failureReason;
    }

    public static ImageFetchResult success(byte[] content) {
        if (content == null) {
            throw new IllegalArgumentException("Content must not be null");
        }
        return new ImageFetchResult(content, null);
    }

    public static ImageFetchResult failure(String reason) {
        return new ImageFetchResult(null, reason == null ? "unknown" : reason);
    }

    public boolean isSuccess() {
        return content != null;
    }

    public Optional<AcquiredImage> toAcquiredImage(ImageRequest request) {
        return isSuccess() ? Optional.of(new AcquiredImage(request, content)) : Optional.empty();
    }
}
