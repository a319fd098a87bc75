package lkml.watch.app.sender;

import lkml.watch.app.model.PatchCardView;
import lkml.watch.app.model.ReplyNotice;
import lkml.watch.app.model.SentCard;

/**
 * Delivers cards to the chat platform(s). Timeouts and retries are the implementation's concern.
 */
public interface PatchCardSender {
    /**
     * Render and post a card.
     * @return the platform identity of the posted card, or null when nothing was posted
     */
    SentCard send(PatchCardView card);

    /**
     * Post a standalone notice for a reply whose patch has no discussion thread.
     */
    void sendReplyNotification(ReplyNotice notice);
}
