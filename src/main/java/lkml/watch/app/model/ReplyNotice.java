package lkml.watch.app.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReplyNotice {
    String replyAuthor;
    String replySubject;
    String replyUrl;
    String replySubsystem;
    String replyDate;
    String rootSubject;
    String rootUrl;
}
