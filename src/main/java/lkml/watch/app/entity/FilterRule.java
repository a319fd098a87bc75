package lkml.watch.app.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named predicate over message attributes.
 * Supported condition keys: {@code author}, {@code author_email}, {@code subject_keywords}, {@code subject_regex}.
 * String values wrapped in slashes ({@code /.../}) are case-insensitive regular expressions,
 * anything else is a case-insensitive substring. List values match when any element matches.
 */
@Entity
@Table(name = "filter_rules")
@Data
public class FilterRule {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, unique = true)
    private String name;

    private boolean enabled = true;

    private boolean exclusive;

    @Convert(converter = FilterConditionsConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> conditions = new LinkedHashMap<>();

    @Column(columnDefinition = "TEXT")
    private String description;

    private String createdBy;

    private Instant createdAt;

    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
