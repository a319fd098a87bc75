package lkml.watch.app.feed;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Slf4j
public class EmptyFeedSource implements FeedSource {

    @Override
    public List<FeedEntry> fetchNewEntries(String subsystem) {
        log.debug("No feed source configured, nothing to fetch for {}", subsystem);
        return List.of();
    }
}
