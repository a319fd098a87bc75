package lkml.watch.app.config;

import lkml.watch.app.feed.EmptyFeedSource;
import lkml.watch.app.feed.FeedSource;
import lkml.watch.app.sender.LoggingPatchCardSender;
import lkml.watch.app.sender.LoggingThreadSender;
import lkml.watch.app.sender.PatchCardSender;
import lkml.watch.app.sender.ThreadSender;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Fallback collaborators. A platform integration registers its own beans and these back off.
 */
@Configuration
public class CollaboratorConfig {

    @Bean
    @ConditionalOnMissingBean(PatchCardSender.class)
    public PatchCardSender patchCardSender() {
        return new LoggingPatchCardSender();
    }

    @Bean
    @ConditionalOnMissingBean(ThreadSender.class)
    public ThreadSender threadSender() {
        return new LoggingThreadSender();
    }

    @Bean
    @ConditionalOnMissingBean(FeedSource.class)
    public FeedSource feedSource() {
        return new EmptyFeedSource();
    }
}
