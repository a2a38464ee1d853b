package com.aigreentick.services.groupcast.transport.dto;

/**
 * Text message, optionally carrying an image. With an image the text becomes its caption.
 */
public record MessageContent(String text, String imagePath) {

    public boolean hasImage() {
        return imagePath != null && !imagePath.isBlank();
    }
}
