package lkml.watch.app.model;

import lkml.watch.app.entity.FeedMessage;
import lombok.Value;

import java.util.List;

@Value
public class ThreadNode {
    FeedMessage message;
    List<ThreadNode> children;
    NodeType type;

    public enum NodeType {
        COVER_LETTER,
        SUB_PATCH,
        REPLY
    }
}
