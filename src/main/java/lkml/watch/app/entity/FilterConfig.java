package lkml.watch.app.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;

@Entity
@Table(name = "filter_config")
@Data
public class FilterConfig {
    public static final String AUTO_WATCH_ENABLED = "auto_watch_enabled";

    @Id
    private String configKey;

    @Column(length = 1024)
    private String configValue;
}
