package lkml.watch.app.model;

import lkml.watch.app.entity.FeedMessage;
import lombok.Value;

@Value
public class MessageSaveResult {
    FeedMessage message;
    boolean created;
}
