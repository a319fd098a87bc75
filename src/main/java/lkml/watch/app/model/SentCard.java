package lkml.watch.app.model;

import lombok.Value;

/**
 * Platform identity of a card that was delivered.
 */
@Value
public class SentCard {
    String messageId;
    String channelId;
}
