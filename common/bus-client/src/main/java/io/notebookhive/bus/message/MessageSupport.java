package io.notebookhive.bus.message;

final class MessageSupport {

    private MessageSupport() {
    }

    static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be null or blank");
        }
        return value.strip();
    }

    static String textOrNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }

    static String textOrDefault(String value, String fallback) {
        String text = textOrNull(value);
        return text == null ? fallback : text;
    }
}
