package lkml.watch.app.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "feed_messages", indexes = {
        @Index(name = "idx_feed_messages_series", columnList = "seriesMessageId"),
        @Index(name = "idx_feed_messages_in_reply_to", columnList = "inReplyToHeader")
})
@Data
public class FeedMessage {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    private String subsystemName;

    // Dedup key across every subsystem and node
    @Column(nullable = false, unique = true, length = 512)
    private String messageIdHeader;

    private String messageId;

    @Column(length = 2048)
    private String inReplyToHeader;

    @Column(length = 1024)
    private String subject;

    private String author;

    private String authorEmail;

    @Column(columnDefinition = "TEXT")
    private String content;

    @Column(length = 1024)
    private String url;

    private Instant receivedAt;

    // Classification
    private boolean patch;
    private boolean reply;
    private boolean seriesPatch;
    private boolean coverLetter;
    private Integer patchVersion;
    private Integer patchIndex;
    private Integer patchTotal;

    @Column(length = 512)
    private String seriesMessageId;

    // Set once the lifecycle has fully handled the message; unprocessed replies are retried next cycle
    @Column(nullable = false, columnDefinition = "boolean default false")
    private boolean processed;
}
