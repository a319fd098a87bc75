package lkml.watch.app.service;

import lkml.watch.app.entity.FeedMessage;
import lkml.watch.app.entity.Subsystem;
import lkml.watch.app.feed.FeedEntry;
import lkml.watch.app.feed.FeedSource;
import lkml.watch.app.model.MessageClassification;
import lkml.watch.app.model.MessageSaveResult;
import lkml.watch.app.model.MonitoringResult;
import lkml.watch.app.model.MonitoringResult.SubsystemResult;
import lkml.watch.app.repository.SubsystemRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically pulls new entries for every subscribed subsystem and feeds them through
 * classification, storage and the card/thread lifecycle.
 * <p>
 * Subsystems run concurrently on the monitor executor, each under its own processing lock.
 * Entries of one subsystem are handled one at a time.
 */
@Slf4j
@Service
public class MonitoringService {
    static final String SUBSYSTEM_LOCK_PREFIX = "subsystem:";

    private final SubsystemRepository subsystemRepository;
    private final FeedSource feedSource;
    private final MessageClassifier messageClassifier;
    private final FeedMessageStore feedMessageStore;
    private final FeedMessageService feedMessageService;
    private final ProcessingLockService processingLockService;
    private final Executor feedMonitorExecutor;
    private final AtomicBoolean running;

    public MonitoringService(
            SubsystemRepository subsystemRepository,
            FeedSource feedSource,
            MessageClassifier messageClassifier,
            FeedMessageStore feedMessageStore,
            FeedMessageService feedMessageService,
            ProcessingLockService processingLockService,
            @Qualifier("feedMonitorExecutor") Executor feedMonitorExecutor,
            @Value("${lkml.monitor.auto-start:true}") boolean autoStart) {
        this.subsystemRepository = subsystemRepository;
        this.feedSource = feedSource;
        this.messageClassifier = messageClassifier;
        this.feedMessageStore = feedMessageStore;
        this.feedMessageService = feedMessageService;
        this.processingLockService = processingLockService;
        this.feedMonitorExecutor = feedMonitorExecutor;
        this.running = new AtomicBoolean(autoStart);
    }

    @Scheduled(fixedDelayString = "${lkml.monitor.interval-ms:300000}")
    public void scheduledCycle() {
        if (!running.get()) {
            log.debug("Monitoring is stopped, skipping scheduled cycle");
            return;
        }
        runCycle(true);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Monitoring started");
        }
    }

    /**
     * Subsystems not yet started in the current cycle are skipped; a running one finishes its entries.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Monitoring stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Runs one full cycle now, regardless of the running flag.
     */
    public MonitoringResult runOnce() {
        return runCycle(false);
    }

    MonitoringResult runCycle(boolean stoppable) {
        MonitoringResult result = new MonitoringResult();
        result.setStartTime(Instant.now());
        log.info("Monitoring cycle started");

        List<Subsystem> subsystems;
        try {
            subsystems = subsystemRepository.findBySubscribedTrueOrderByNameAsc();
        } catch (RuntimeException e) {
            log.error("Failed to load subscribed subsystems: {}", e.getMessage(), e);
            result.getErrors().add("Failed to load subscribed subsystems: " + e.getMessage());
            result.setEndTime(Instant.now());
            return result;
        }
        result.setTotalSubsystems(subsystems.size());
        if (subsystems.isEmpty()) {
            log.info("No subscribed subsystems");
            result.setEndTime(Instant.now());
            return result;
        }

        List<CompletableFuture<SubsystemResult>> futures = new ArrayList<>();
        for (Subsystem subsystem : subsystems) {
            String name = subsystem.getName();
            futures.add(CompletableFuture
                    .supplyAsync(() -> stoppable && !running.get() ? skipped(name) : processSubsystem(name),
                            feedMonitorExecutor)
                    .exceptionally(ex -> {
                        log.error("Monitoring of subsystem {} failed: {}", name, ex.getMessage(), ex);
                        SubsystemResult failed = new SubsystemResult(name);
                        failed.setError(name + ": " + ex.getMessage());
                        return failed;
                    }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        for (CompletableFuture<SubsystemResult> future : futures) {
            SubsystemResult subsystemResult = future.join();
            result.getResults().add(subsystemResult);
            if (subsystemResult.getError() != null) {
                result.getErrors().add(subsystemResult.getError());
            }
            if (subsystemResult.isSkipped()) {
                continue;
            }
            result.setProcessedSubsystems(result.getProcessedSubsystems() + 1);
            result.setTotalNewCount(result.getTotalNewCount() + subsystemResult.getNewCount());
            result.setTotalReplyCount(result.getTotalReplyCount() + subsystemResult.getReplyCount());
        }

        result.setEndTime(Instant.now());
        log.info("Monitoring cycle finished: {}/{} subsystems, {} new patches, {} replies, {} errors",
                result.getProcessedSubsystems(), result.getTotalSubsystems(),
                result.getTotalNewCount(), result.getTotalReplyCount(), result.getErrorCount());
        return result;
    }

    private SubsystemResult skipped(String subsystem) {
        log.info("Monitoring stopped, skipping subsystem {}", subsystem);
        SubsystemResult result = new SubsystemResult(subsystem);
        result.setSkipped(true);
        return result;
    }

    SubsystemResult processSubsystem(String subsystem) {
        SubsystemResult result = new SubsystemResult(subsystem);
        String lockKey = SUBSYSTEM_LOCK_PREFIX + subsystem;
        String nodeId = processingLockService.getNodeId();
        if (!processingLockService.tryLock(lockKey, nodeId)) {
            log.debug("Subsystem {} is being processed by another node, skipping", subsystem);
            result.setSkipped(true);
            return result;
        }

        try {
            List<FeedEntry> entries;
            try {
                entries = feedSource.fetchNewEntries(subsystem);
            } catch (RuntimeException e) {
                log.error("Failed to fetch entries for subsystem {}: {}", subsystem, e.getMessage(), e);
                result.setError(subsystem + ": " + e.getMessage());
                return result;
            }
            log.info("Entries to process count {} for subsystem {}", entries.size(), subsystem);

            for (FeedEntry entry : entries) {
                try {
                    processEntry(entry, subsystem, result);
                } catch (Exception e) {
                    log.error("Failed to process message {} in subsystem {}: {}",
                            entry.getMessageIdHeader(), subsystem, e.getMessage(), e);
                    result.setFailedCount(result.getFailedCount() + 1);
                }
            }
        } finally {
            processingLockService.releaseLock(lockKey, nodeId);
        }
        return result;
    }

    private void processEntry(FeedEntry entry, String subsystem, SubsystemResult result) {
        String header = MessageIds.normalize(entry.getMessageIdHeader());
        if (header == null) {
            log.warn("Entry '{}' in subsystem {} has no message id, skipping", entry.getSubject(), subsystem);
            return;
        }

        MessageClassification classification =
                messageClassifier.classify(entry.getSubject(), header, entry.getInReplyToHeader());
        MessageSaveResult saved = feedMessageStore.save(toFeedMessage(entry, header, subsystem, classification));

        if (classification.isPatch()) {
            // Re-run even for stored patches so a card whose send failed is retried
            if (saved.isCreated()) {
                result.setNewCount(result.getNewCount() + 1);
            }
            feedMessageService.processMessage(saved.getMessage(), classification);
        } else if (classification.isReply()) {
            if (saved.getMessage().isProcessed()) {
                log.debug("Reply {} already processed", header);
                return;
            }
            if (saved.isCreated()) {
                result.setReplyCount(result.getReplyCount() + 1);
            }
            if (feedMessageService.processMessage(saved.getMessage(), classification)) {
                feedMessageStore.markProcessed(saved.getMessage());
            } else {
                log.debug("Reply {} left unprocessed for the next cycle", header);
            }
        }
    }

    static FeedMessage toFeedMessage(FeedEntry entry, String header, String subsystem,
                                     MessageClassification classification) {
        FeedMessage message = new FeedMessage();
        message.setSubsystemName(entry.getSubsystem() != null ? entry.getSubsystem() : subsystem);
        message.setMessageIdHeader(header);
        message.setMessageId(entry.getMessageId());
        message.setInReplyToHeader(entry.getInReplyToHeader());
        message.setSubject(entry.getSubject());
        message.setAuthor(entry.getAuthor());
        message.setAuthorEmail(entry.getAuthorEmail());
        message.setContent(entry.getContent());
        message.setUrl(entry.getUrl());
        message.setReceivedAt(entry.getReceivedAt());
        message.setPatch(classification.isPatch());
        message.setReply(classification.isReply());
        message.setSeriesPatch(classification.isSeriesPatch());
        message.setCoverLetter(classification.isCoverLetter());
        message.setPatchVersion(classification.getVersion());
        message.setPatchIndex(classification.getIndex());
        message.setPatchTotal(classification.getTotal());
        message.setSeriesMessageId(classification.getSeriesMessageId());
        return message;
    }
}
