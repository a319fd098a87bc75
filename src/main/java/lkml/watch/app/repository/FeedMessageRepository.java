package lkml.watch.app.repository;

import lkml.watch.app.entity.FeedMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
public interface FeedMessageRepository extends JpaRepository<FeedMessage, String> {
    Optional<FeedMessage> findByMessageIdHeader(String messageIdHeader);

    List<FeedMessage> findBySeriesMessageId(String seriesMessageId);

    // In-Reply-To may carry angle brackets or several ids, so a substring match is needed on top of equality
    @Query("SELECT m FROM FeedMessage m WHERE m.inReplyToHeader = :id " +
            "OR m.inReplyToHeader LIKE CONCAT('%', :id, '%') ORDER BY m.receivedAt ASC")
    List<FeedMessage> findRepliesTo(@Param("id") String messageIdHeader, Pageable pageable);

    @Transactional
    @Modifying
    @Query("UPDATE FeedMessage m SET m.processed = true WHERE m.messageIdHeader = :header")
    int markProcessed(@Param("header") String messageIdHeader);
}
