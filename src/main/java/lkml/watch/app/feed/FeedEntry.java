package lkml.watch.app.feed;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One raw mailing-list entry as delivered by a {@link FeedSource}.
 */
@Value
@Builder
public class FeedEntry {
    String subsystem;
    String messageIdHeader;
    String messageId;
    String subject;
    String author;
    String authorEmail;
    String inReplyToHeader;
    String content;
    String url;
    Instant receivedAt;
}
