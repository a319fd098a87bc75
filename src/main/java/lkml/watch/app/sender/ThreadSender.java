package lkml.watch.app.sender;

import lkml.watch.app.model.ThreadCreation;
import lkml.watch.app.model.ThreadOverview;

public interface ThreadSender {
    /**
     * Open a discussion thread anchored on a posted card and send the initial overview.
     * @return the created thread, or null when the platform refused
     */
    ThreadCreation createThreadAndSendOverview(String threadName, String anchorMessageId, ThreadOverview overview);

    boolean updateThreadOverview(String threadId, String messageId, ThreadOverview overview);

    boolean sendThreadUpdateNotification(String channelId, String threadId, String cardMessageId);
}
