package org.sporkfed.syncengine.processor;

import org.sporkfed.syncengine.config.SyncRule;
import org.sporkfed.syncengine.logging.SyncEventLogger;
import org.sporkfed.syncengine.logging.SyncLogTag;
import org.sporkfed.syncengine.model.EntryType;
import org.sporkfed.syncengine.model.FetchSide;
import org.sporkfed.syncengine.model.FileEntry;
import org.sporkfed.syncengine.model.RemoteEntry;
import org.sporkfed.syncengine.model.RepoCoordinates;
import org.sporkfed.syncengine.model.RuleOutcome;
import org.sporkfed.syncengine.model.SyncAction;
import org.sporkfed.syncengine.model.SyncContext;
import org.sporkfed.syncengine.model.SyncDecision;
import org.sporkfed.syncengine.model.TargetResolution;
import org.sporkfed.syncengine.service.BranchResetException;
import org.sporkfed.syncengine.service.BranchResetService;
import org.sporkfed.syncengine.service.PullRequestProposer;
import org.sporkfed.syncengine.service.RemoteEntryFetcher;
import org.sporkfed.syncengine.service.SyncDecider;
import org.sporkfed.syncengine.service.SyncProposal;
import org.sporkfed.syncengine.service.TargetResolver;
import org.springframework.stereotype.Service;

import java.util.Map;

import static org.sporkfed.syncengine.logging.SyncEventLogger.fields;

/**
 * Runs a single rule: fetch the upstream file, resolve and compare the target, and when they
 * differ stage the upstream content on a fresh sync branch and propose it.
 */
@Service
public class RuleProcessor {

    public static final String SYNC_BRANCH_PREFIX = "sporkfed/";

    private final RemoteEntryFetcher entryFetcher;
    private final TargetResolver targetResolver;
    private final SyncDecider syncDecider;
    private final BranchResetService branchResetService;
    private final PullRequestProposer pullRequestProposer;
    private final SyncEventLogger eventLogger;

    public RuleProcessor(
            RemoteEntryFetcher entryFetcher,
            TargetResolver targetResolver,
            SyncDecider syncDecider,
            BranchResetService branchResetService,
            PullRequestProposer pullRequestProposer,
            SyncEventLogger eventLogger
    ) {
        this.entryFetcher = entryFetcher;
        this.targetResolver = targetResolver;
        this.syncDecider = syncDecider;
        this.branchResetService = branchResetService;
        this.pullRequestProposer = pullRequestProposer;
        this.eventLogger = eventLogger;
    }

    public RuleOutcome process(SyncContext context, SyncRule rule) {
        RepoCoordinates upstream = rule.upstream().coordinates();
        String sourcePath = rule.upstream().path();
        Map<String, Object> ruleFields = fields(
                "repository", context.repository().getFullName(),
                "upstream", upstream.getFullName(),
                "source_path", sourcePath,
                "target_path", rule.target().path()
        );

        RemoteEntry source = entryFetcher.fetch(context, FetchSide.SOURCE, upstream, sourcePath, rule.upstream().branch());
        if (source.type() == EntryType.ABSENT) {
            eventLogger.warn(SyncLogTag.SOURCE_PATH_NOT_FOUND, "Source path not found", ruleFields);
            return RuleOutcome.SOURCE_NOT_FOUND;
        }
        if (!(source instanceof FileEntry sourceFile)) {
            ruleFields.put("type", source.type().getTypeString());
            eventLogger.warn(SyncLogTag.UNSUPPORTED_SOURCE_TYPE, "Source must be a regular file", ruleFields);
            return RuleOutcome.UNSUPPORTED_SOURCE;
        }

        if (!sourceFile.hasInlineContent()) {
            ruleFields.put("encoding", sourceFile.encoding());
            eventLogger.warn(SyncLogTag.UNSUPPORTED_SOURCE_ENCODING, "Source content is not inlined as base64", ruleFields);
            return RuleOutcome.UNSUPPORTED_SOURCE;
        }

        RemoteEntry targetRoot = entryFetcher.fetch(context, FetchSide.TARGET, context.repository(),
                rule.target().path(), rule.target().branch());
        TargetResolution resolution = targetResolver.resolve(sourceFile, targetRoot, rule.target().path());
        SyncDecision decision = syncDecider.decide(sourceFile, resolution.effectiveEntry());
        ruleFields.put("effective_path", resolution.effectivePath());

        if (decision.action() == SyncAction.REJECTED) {
            ruleFields.put("type", resolution.effectiveEntry().type().getTypeString());
            eventLogger.warn(SyncLogTag.UNSUPPORTED_TARGET_TYPE, decision.reason(), ruleFields);
            return RuleOutcome.UNSUPPORTED_TARGET;
        }
        if (decision.action() == SyncAction.NOOP) {
            ruleFields.put("sha", sourceFile.sha());
            eventLogger.info(SyncLogTag.IGNORE_NO_CHANGES, decision.reason(), ruleFields);
            return RuleOutcome.UP_TO_DATE;
        }

        String branch = syncBranchName(resolution.effectivePath());
        try {
            branchResetService.reset(context, branch, context.defaultBranch());
        } catch (BranchResetException e) {
            return RuleOutcome.BRANCH_RESET_FAILED;
        }

        boolean create = decision.action() == SyncAction.CREATE;
        pullRequestProposer.writeAndPropose(context, new SyncProposal(
                branch,
                context.defaultBranch(),
                resolution.effectivePath(),
                sourceFile.content(),
                create ? null : resolution.effectiveEntry().contentIdentity().orElse(null),
                create
        ));
        return RuleOutcome.PROPOSED;
    }

    public static String syncBranchName(String effectivePath) {
        return SYNC_BRANCH_PREFIX + effectivePath;
    }
}
