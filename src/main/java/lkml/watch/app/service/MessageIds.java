package lkml.watch.app.service;

/**
 * Helpers for Message-ID / In-Reply-To header values.
 */
public final class MessageIds {

    private MessageIds() {
    }

    /**
     * Primary reference of an In-Reply-To style header: the first whitespace or comma separated token,
     * without angle brackets. Returns null when nothing usable is left.
     */
    public static String primaryReference(String header) {
        if (header == null) {
            return null;
        }
        for (String token : header.trim().split("[\\s,]+")) {
            String id = normalize(token);
            if (id != null) {
                return id;
            }
        }
        return null;
    }

    /**
     * Strips surrounding whitespace and angle brackets from a single message id.
     */
    public static String normalize(String messageId) {
        if (messageId == null) {
            return null;
        }
        String id = messageId.trim();
        while (id.startsWith("<")) {
            id = id.substring(1);
        }
        while (id.endsWith(">")) {
            id = id.substring(0, id.length() - 1);
        }
        id = id.trim();
        return id.isEmpty() ? null : id;
    }
}
