package lkml.watch.app.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;

@Entity
@Table(name = "subsystems")
@Data
public class Subsystem {
    @Id
    private String name; // list name on the archive, e.g. "netdev"

    private boolean subscribed;
}
