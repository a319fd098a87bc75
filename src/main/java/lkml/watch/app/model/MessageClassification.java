package lkml.watch.app.model;

import lombok.Builder;
import lombok.Value;

/**
 * Structured result of parsing a message subject and its reply headers.
 */
@Value
@Builder
public class MessageClassification {
    boolean patch;
    boolean reply;
    boolean coverLetter;
    boolean seriesPatch;
    Integer version;
    Integer index;
    Integer total;
    String seriesMessageId;

    public static MessageClassification plain(boolean reply) {
        return MessageClassification.builder().reply(reply).build();
    }
}
