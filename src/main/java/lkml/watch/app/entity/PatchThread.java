package lkml.watch.app.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Entity
@Table(name = "patch_threads")
@Data
public class PatchThread {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, unique = true, length = 512)
    private String patchCardMessageIdHeader;

    @Column(nullable = false, unique = true)
    private String threadId;

    @Column(length = 100)
    private String threadName;

    private boolean active = true;

    private String overviewMessageId;

    @Convert(converter = SubPatchMessagesConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<Integer, String> subPatchMessages = new LinkedHashMap<>();

    private Instant createdAt;

    private Instant archivedAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
