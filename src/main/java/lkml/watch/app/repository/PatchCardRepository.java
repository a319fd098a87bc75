package lkml.watch.app.repository;

import lkml.watch.app.entity.PatchCard;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface PatchCardRepository extends JpaRepository<PatchCard, String> {
    Optional<PatchCard> findByMessageIdHeader(String messageIdHeader);

    boolean existsByMessageIdHeader(String messageIdHeader);

    // Series summary card: the earliest card of the series that already has a platform message
    @Query("SELECT c FROM PatchCard c WHERE c.seriesMessageId = :seriesId " +
            "AND c.platformMessageId IS NOT NULL AND c.platformMessageId <> '' ORDER BY c.createdAt ASC")
    List<PatchCard> findSentBySeriesMessageId(@Param("seriesId") String seriesMessageId);

    List<PatchCard> findBySeriesMessageIdOrderByCreatedAtAsc(String seriesMessageId);

    List<PatchCard> findByHasThreadFalseAndExpiresAtLessThanEqual(Instant now);

    @Transactional
    @Modifying
    @Query("UPDATE PatchCard c SET c.hasThread = true WHERE c.messageIdHeader = :header")
    int markHasThread(@Param("header") String messageIdHeader);
}
