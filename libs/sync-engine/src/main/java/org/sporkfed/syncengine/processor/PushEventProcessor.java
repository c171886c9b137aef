package org.sporkfed.syncengine.processor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sporkfed.syncengine.config.SyncConfig;
import org.sporkfed.syncengine.config.SyncConfigLoader;
import org.sporkfed.syncengine.config.SyncRule;
import org.sporkfed.syncengine.logging.SyncEventLogger;
import org.sporkfed.syncengine.logging.SyncLogTag;
import org.sporkfed.syncengine.model.PushEvent;
import org.sporkfed.syncengine.model.PushProcessingResult;
import org.sporkfed.syncengine.model.RuleOutcome;
import org.sporkfed.syncengine.model.SyncContext;
import org.sporkfed.syncengine.model.SyncContextFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static org.sporkfed.syncengine.logging.SyncEventLogger.fields;

/**
 * Entry point for a push notification.
 * <p>
 * Pushes that are not to the default branch, or that carry no head commit, are dropped before any
 * remote call. Otherwise the rule file is loaded and every rule runs concurrently on the rule
 * executor. The call returns once all rules have finished; one rule failing never affects another.
 */
@Service
public class PushEventProcessor {

    private static final Logger log = LoggerFactory.getLogger(PushEventProcessor.class);

    private final SyncConfigLoader configLoader;
    private final RuleProcessor ruleProcessor;
    private final SyncEventLogger eventLogger;
    private final Executor ruleExecutor;

    public PushEventProcessor(
            SyncConfigLoader configLoader,
            RuleProcessor ruleProcessor,
            SyncEventLogger eventLogger,
            @Qualifier("ruleExecutor") Executor ruleExecutor
    ) {
        this.configLoader = configLoader;
        this.ruleProcessor = ruleProcessor;
        this.eventLogger = eventLogger;
        this.ruleExecutor = ruleExecutor;
    }

    public PushProcessingResult process(PushEvent event, SyncContext context) {
        return process(event, ignored -> context);
    }

    /**
     * @param contextFactory invoked only for pushes that pass the branch and head-commit filters
     */
    public PushProcessingResult process(PushEvent event, SyncContextFactory contextFactory) {
        String repository = event.repositoryCoordinates().getFullName();

        if (!event.isDefaultBranchPush()) {
            eventLogger.info(SyncLogTag.IGNORE_NON_DEFAULT_BRANCH, "Push is not to the default branch",
                    fields("repository", repository, "ref", event.ref(), "default_branch", event.defaultBranch()));
            return PushProcessingResult.ignored("Push is not to the default branch");
        }
        if (!event.hasHeadCommit()) {
            eventLogger.info(SyncLogTag.IGNORE_NO_HEAD_COMMIT, "Push has no head commit",
                    fields("repository", repository, "ref", event.ref()));
            return PushProcessingResult.ignored("Push has no head commit");
        }

        SyncContext context = contextFactory.create(event);
        SyncConfig config = configLoader.load(context);
        if (config.rules().isEmpty()) {
            eventLogger.info(SyncLogTag.IGNORE_NO_RULES, "No sync rules configured",
                    fields("repository", repository, "path", configLoader.getConfigPath()));
            return PushProcessingResult.ignored("No sync rules configured");
        }

        log.info("Processing {} sync rule(s) for {} at {} (delivery {})",
                config.rules().size(), repository, event.headCommitId(), event.deliveryId());

        List<CompletableFuture<RuleOutcome>> futures = config.rules().stream()
                .map(rule -> processAsync(context, rule))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<RuleOutcome> outcomes = futures.stream().map(CompletableFuture::join).toList();
        PushProcessingResult result = PushProcessingResult.processed(outcomes);
        log.info("Finished sync for {}: {} proposed, {} up to date, {} failed",
                repository,
                result.count(RuleOutcome.PROPOSED),
                result.count(RuleOutcome.UP_TO_DATE),
                result.count(RuleOutcome.FAILED));
        return result;
    }

    private CompletableFuture<RuleOutcome> processAsync(SyncContext context, SyncRule rule) {
        return CompletableFuture
                .supplyAsync(() -> ruleProcessor.process(context, rule), ruleExecutor)
                .exceptionally(e -> {
                    eventLogger.error(SyncLogTag.RULE_PROCESSING_ERROR, "Rule processing failed",
                            fields("repository", context.repository().getFullName(), "rule", rule.toString()), e);
                    return RuleOutcome.FAILED;
                });
    }
}
