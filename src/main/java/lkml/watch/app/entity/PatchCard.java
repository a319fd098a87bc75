package lkml.watch.app.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "patch_cards", indexes = {
        @Index(name = "idx_patch_cards_series", columnList = "seriesMessageId")
})
@Data
public class PatchCard {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    // Root message of the patch or series; one card per header
    @Column(nullable = false, unique = true, length = 512)
    private String messageIdHeader;

    private String subsystemName;

    @Column(length = 1024)
    private String subject;

    private String author;

    @Column(length = 1024)
    private String url;

    private Instant expiresAt;

    private boolean seriesPatch;

    @Column(length = 512)
    private String seriesMessageId;

    private Integer patchVersion;
    private Integer patchIndex;
    private Integer patchTotal;

    private boolean hasThread;

    // Platform identity, set once by the first successful send
    private String platformMessageId;
    private String platformChannelId;

    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
