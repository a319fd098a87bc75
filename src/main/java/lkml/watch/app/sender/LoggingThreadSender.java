package lkml.watch.app.sender;

import lkml.watch.app.model.ThreadCreation;
import lkml.watch.app.model.ThreadOverview;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingThreadSender implements ThreadSender {

    @Override
    public ThreadCreation createThreadAndSendOverview(String threadName, String anchorMessageId, ThreadOverview overview) {
        log.info("No thread platform configured, not opening thread '{}'", threadName);
        return null;
    }

    @Override
    public boolean updateThreadOverview(String threadId, String messageId, ThreadOverview overview) {
        log.info("No thread platform configured, not updating thread {}", threadId);
        return false;
    }

    @Override
    public boolean sendThreadUpdateNotification(String channelId, String threadId, String cardMessageId) {
        return false;
    }
}
