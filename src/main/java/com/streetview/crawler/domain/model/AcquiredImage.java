package com.streetview.crawler.domain.model;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(exclude = "content")
public class AcquiredImage {
    private final ImageRequest request;
    private final byte[] content;

    public AcquiredImage(ImageRequest request, byte[] content) {
        if (request == null || content == null) {
            throw new IllegalArgumentException("Request and content must not be null");
        }
        this.request = request;
        this.content = content;
    }
}
