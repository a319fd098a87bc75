package lkml.watch.app.model;

import lkml.watch.app.entity.FeedMessage;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Parent/child view over a set of messages. Derived on demand, never persisted.
 */
@Value
public class ReplyHierarchy {
    Map<String, Entry> entries;
    List<String> rootIds;

    public List<String> childrenOf(String messageIdHeader) {
        Entry entry = entries.get(messageIdHeader);
        return entry == null ? List.of() : entry.getChildren();
    }

    public FeedMessage messageOf(String messageIdHeader) {
        Entry entry = entries.get(messageIdHeader);
        return entry == null ? null : entry.getMessage();
    }

    @Value
    public static class Entry {
        FeedMessage message;
        List<String> children;
    }
}
