package org.sporkfed.syncengine.processor;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.sporkfed.syncengine.config.SyncRule;
import org.sporkfed.syncengine.logging.SyncEventLogger;
import org.sporkfed.syncengine.logging.SyncLogTag;
import org.sporkfed.syncengine.model.AbsentEntry;
import org.sporkfed.syncengine.model.DirectoryEntry;
import org.sporkfed.syncengine.model.FetchSide;
import org.sporkfed.syncengine.model.FileEntry;
import org.sporkfed.syncengine.model.RepoCoordinates;
import org.sporkfed.syncengine.model.RuleOutcome;
import org.sporkfed.syncengine.model.SymlinkEntry;
import org.sporkfed.syncengine.model.SyncContext;
import org.sporkfed.syncengine.service.BranchResetException;
import org.sporkfed.syncengine.service.BranchResetService;
import org.sporkfed.syncengine.service.EntryClassifier;
import org.sporkfed.syncengine.service.PullRequestProposer;
import org.sporkfed.syncengine.service.RemoteEntryFetcher;
import org.sporkfed.syncengine.service.SyncDecider;
import org.sporkfed.syncengine.service.SyncProposal;
import org.sporkfed.syncengine.service.TargetResolver;
import org.sporkfed.vcsclient.VcsClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RuleProcessorTest {

    private static final RepoCoordinates UPSTREAM = new RepoCoordinates("upstream-org", "templates");
    private static final RepoCoordinates SITE = new RepoCoordinates("octo", "site");

    @Mock
    private VcsClient vcsClient;

    @Mock
    private RemoteEntryFetcher entryFetcher;

    @Mock
    private BranchResetService branchResetService;

    @Mock
    private PullRequestProposer pullRequestProposer;

    @Mock
    private SyncEventLogger eventLogger;

    private RuleProcessor processor;
    private SyncContext context;

    @BeforeEach
    void setUp() {
        processor = new RuleProcessor(entryFetcher, new TargetResolver(), new SyncDecider(),
                branchResetService, pullRequestProposer, eventLogger);
        context = new SyncContext(vcsClient, SITE, "main");
    }

    private static SyncRule rule(String sourcePath, String upstreamBranch, String targetPath) {
        return new SyncRule(
                new SyncRule.Upstream(new SyncRule.Repo("upstream-org", "templates"), upstreamBranch, sourcePath),
                new SyncRule.Target(targetPath, null)
        );
    }

    private static FileEntry sourceFile(String sha, String name, String path) {
        return new FileEntry(sha, "aGVsbG8K\n", "base64", name, path);
    }

    @Nested
    @DisplayName("source checks")
    class SourceChecks {

        @Test
        @DisplayName("should skip the rule when the source path is missing")
        void shouldSkipMissingSource() {
            when(entryFetcher.fetch(context, FetchSide.SOURCE, UPSTREAM, "README.md", null))
                    .thenReturn(AbsentEntry.INSTANCE);

            assertThat(processor.process(context, rule("README.md", null, "README.md")))
                    .isEqualTo(RuleOutcome.SOURCE_NOT_FOUND);

            verify(eventLogger).warn(eq(SyncLogTag.SOURCE_PATH_NOT_FOUND), anyString(), anyMap());
            verifyNoInteractions(branchResetService, pullRequestProposer);
        }

        @Test
        @DisplayName("should reject a source that is not a regular file")
        void shouldRejectNonFileSource() {
            when(entryFetcher.fetch(context, FetchSide.SOURCE, UPSTREAM, "docs", "release"))
                    .thenReturn(new DirectoryEntry("docs", List.of()));

            assertThat(processor.process(context, rule("docs", "release", "docs")))
                    .isEqualTo(RuleOutcome.UNSUPPORTED_SOURCE);

            verify(eventLogger).warn(eq(SyncLogTag.UNSUPPORTED_SOURCE_TYPE), anyString(), anyMap());
        }

        @Test
        @DisplayName("should reject a source too large to be inlined")
        void shouldRejectNonBase64Source() {
            when(entryFetcher.fetch(context, FetchSide.SOURCE, UPSTREAM, "big.bin", null))
                    .thenReturn(new FileEntry("h1", "", "none", "big.bin", "big.bin"));

            assertThat(processor.process(context, rule("big.bin", null, "big.bin")))
                    .isEqualTo(RuleOutcome.UNSUPPORTED_SOURCE);

            verify(eventLogger).warn(eq(SyncLogTag.UNSUPPORTED_SOURCE_ENCODING), anyString(), anyMap());
        }
    }

    @Nested
    @DisplayName("target decisions")
    class TargetDecisions {

        @Test
        @DisplayName("should make no changes when target and source match")
        void shouldNoopWhenUpToDate() {
            when(entryFetcher.fetch(context, FetchSide.SOURCE, UPSTREAM, "README.md", null))
                    .thenReturn(sourceFile("h1", "README.md", "README.md"));
            when(entryFetcher.fetch(context, FetchSide.TARGET, SITE, "README.md", null))
                    .thenReturn(new FileEntry("h1", null, null, "README.md", "README.md"));

            assertThat(processor.process(context, rule("README.md", null, "README.md")))
                    .isEqualTo(RuleOutcome.UP_TO_DATE);

            verify(eventLogger).info(eq(SyncLogTag.IGNORE_NO_CHANGES), anyString(), anyMap());
            verifyNoInteractions(branchResetService, pullRequestProposer);
        }

        @Test
        @DisplayName("should refuse to overwrite a symlink target")
        void shouldRejectSymlinkTarget() {
            when(entryFetcher.fetch(context, FetchSide.SOURCE, UPSTREAM, "README.md", null))
                    .thenReturn(sourceFile("h1", "README.md", "README.md"));
            when(entryFetcher.fetch(context, FetchSide.TARGET, SITE, "README.md", null))
                    .thenReturn(new SymlinkEntry("l1", "README.md", "README.md"));

            assertThat(processor.process(context, rule("README.md", null, "README.md")))
                    .isEqualTo(RuleOutcome.UNSUPPORTED_TARGET);

            verify(eventLogger).warn(eq(SyncLogTag.UNSUPPORTED_TARGET_TYPE), anyString(), anyMap());
            verifyNoInteractions(branchResetService, pullRequestProposer);
        }

        @Test
        @DisplayName("should propose an update on a branch named after the effective path")
        void shouldProposeUpdate() {
            when(entryFetcher.fetch(context, FetchSide.SOURCE, UPSTREAM, "README.md", null))
                    .thenReturn(sourceFile("h1", "README.md", "README.md"));
            when(entryFetcher.fetch(context, FetchSide.TARGET, SITE, "README.md", null))
                    .thenReturn(new FileEntry("h2", null, null, "README.md", "README.md"));

            assertThat(processor.process(context, rule("README.md", null, "README.md")))
                    .isEqualTo(RuleOutcome.PROPOSED);

            verify(branchResetService).reset(context, "sporkfed/README.md", "main");
            verify(pullRequestProposer).writeAndPropose(context,
                    new SyncProposal("sporkfed/README.md", "main", "README.md", "aGVsbG8K\n", "h2", false));
        }

        @Test
        @DisplayName("should create the file inside a directory target")
        void shouldCreateInsideDirectory() {
            when(entryFetcher.fetch(context, FetchSide.SOURCE, UPSTREAM, "templates/b.txt", null))
                    .thenReturn(sourceFile("h1", "b.txt", "templates/b.txt"));
            when(entryFetcher.fetch(context, FetchSide.TARGET, SITE, "a", null))
                    .thenReturn(new DirectoryEntry("a", List.of(new FileEntry("x", null, null, "c.txt", "a/c.txt"))));

            assertThat(processor.process(context, rule("templates/b.txt", null, "a")))
                    .isEqualTo(RuleOutcome.PROPOSED);

            verify(branchResetService).reset(context, "sporkfed/a/b.txt", "main");
            verify(pullRequestProposer).writeAndPropose(context,
                    new SyncProposal("sporkfed/a/b.txt", "main", "a/b.txt", "aGVsbG8K\n", null, true));
        }

        @Test
        @DisplayName("should stop before writing when the branch cannot be reset")
        void shouldStopOnBranchResetFailure() {
            when(entryFetcher.fetch(context, FetchSide.SOURCE, UPSTREAM, "README.md", null))
                    .thenReturn(sourceFile("h1", "README.md", "README.md"));
            when(entryFetcher.fetch(context, FetchSide.TARGET, SITE, "README.md", null))
                    .thenReturn(AbsentEntry.INSTANCE);
            when(branchResetService.reset(context, "sporkfed/README.md", "main"))
                    .thenThrow(new BranchResetException("no tip", new IllegalStateException()));

            assertThat(processor.process(context, rule("README.md", null, "README.md")))
                    .isEqualTo(RuleOutcome.BRANCH_RESET_FAILED);

            verifyNoInteractions(pullRequestProposer);
        }
    }

    @Nested
    @DisplayName("rejected targets")
    class RejectedTargets {

        private final ObjectMapper objectMapper = new ObjectMapper();
        private RuleProcessor wiredProcessor;

        @BeforeEach
        void setUp() throws Exception {
            wiredProcessor = new RuleProcessor(
                    new RemoteEntryFetcher(new EntryClassifier(), eventLogger),
                    new TargetResolver(),
                    new SyncDecider(),
                    new BranchResetService(eventLogger),
                    new PullRequestProposer(eventLogger),
                    eventLogger
            );
            when(vcsClient.getContents("upstream-org", "templates", "b.txt", null)).thenReturn(objectMapper.readTree("""
                    {"type": "file", "sha": "h1", "content": "aGVsbG8K", "encoding": "base64",
                     "name": "b.txt", "path": "b.txt"}
                    """));
        }

        private void assertRejectedWithoutWrites(String targetPath) throws Exception {
            assertThat(wiredProcessor.process(context, rule("b.txt", null, targetPath)))
                    .isEqualTo(RuleOutcome.UNSUPPORTED_TARGET);

            verify(eventLogger).warn(eq(SyncLogTag.UNSUPPORTED_TARGET_TYPE), anyString(), anyMap());
            verify(vcsClient, never()).deleteRef(anyString(), anyString(), anyString());
            verify(vcsClient, never()).createRef(anyString(), anyString(), anyString(), anyString());
            verify(vcsClient, never()).createOrUpdateFileContents(
                    anyString(), anyString(), anyString(), anyString(), anyString(), anyString(), any());
            verify(vcsClient, never()).createPullRequest(anyString(), anyString(), anyString(), anyString(), anyString());
        }

        @Test
        @DisplayName("should not touch branches when the resolved path is a sub-directory")
        void shouldRejectNestedDirectory() throws Exception {
            when(vcsClient.getContents("octo", "site", "a", null)).thenReturn(objectMapper.readTree("""
                    [
                      {"type": "dir", "sha": "d1", "name": "b.txt", "path": "a/b.txt"},
                      {"type": "file", "sha": "f1", "name": "c.txt", "path": "a/c.txt"}
                    ]
                    """));

            assertRejectedWithoutWrites("a");
        }

        @Test
        @DisplayName("should not touch branches when the target is a submodule")
        void shouldRejectSubmodule() throws Exception {
            when(vcsClient.getContents("octo", "site", "vendor/b.txt", null)).thenReturn(objectMapper.readTree("""
                    {"type": "submodule", "sha": "s1", "name": "b.txt", "path": "vendor/b.txt"}
                    """));

            assertRejectedWithoutWrites("vendor/b.txt");
        }

        @Test
        @DisplayName("should not touch branches when a directory listing holds a submodule with the source name")
        void shouldRejectSubmoduleInsideDirectory() throws Exception {
            when(vcsClient.getContents("octo", "site", "vendor", null)).thenReturn(objectMapper.readTree("""
                    [{"type": "submodule", "sha": "s1", "name": "b.txt", "path": "vendor/b.txt"}]
                    """));

            assertRejectedWithoutWrites("vendor");
        }
    }

    @Test
    @DisplayName("should prefix sync branches")
    void shouldNameSyncBranch() {
        assertThat(RuleProcessor.syncBranchName("a/b.txt")).isEqualTo("sporkfed/a/b.txt");
    }
}
