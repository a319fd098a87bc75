package lkml.watch.app.model;

import lombok.Value;

/**
 * Everything a thread sender needs to render the overview message of a card.
 */
@Value
public class ThreadOverview {
    PatchCardView card;
    ThreadNode root;
    ReplyHierarchy hierarchy;
}
