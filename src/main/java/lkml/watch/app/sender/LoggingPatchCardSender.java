package lkml.watch.app.sender;

import lkml.watch.app.model.PatchCardView;
import lkml.watch.app.model.ReplyNotice;
import lkml.watch.app.model.SentCard;
import lombok.extern.slf4j.Slf4j;

/**
 * Fallback used when no platform is configured. Posts nothing, so no card is ever persisted.
 */
@Slf4j
public class LoggingPatchCardSender implements PatchCardSender {

    @Override
    public SentCard send(PatchCardView card) {
        log.info("No card platform configured, not posting card for {} ({})",
                card.getMessageIdHeader(), card.getSubject());
        return null;
    }

    @Override
    public void sendReplyNotification(ReplyNotice notice) {
        log.info("No card platform configured, dropping reply notice from {} on '{}'",
                notice.getReplyAuthor(), notice.getRootSubject());
    }
}
