package org.sporkfed.syncengine.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.sporkfed.syncengine.model.AbsentEntry;
import org.sporkfed.syncengine.model.DirectoryEntry;
import org.sporkfed.syncengine.model.FileEntry;
import org.sporkfed.syncengine.model.SymlinkEntry;
import org.sporkfed.syncengine.model.SyncAction;
import org.sporkfed.syncengine.model.TargetResolution;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TargetResolverTest {

    private final TargetResolver resolver = new TargetResolver();
    private final FileEntry source = new FileEntry("s1", "aGVsbG8K", "base64", "b.txt", "upstream/b.txt");

    @Test
    @DisplayName("should place the source file inside a directory target")
    void shouldResolveInsideDirectory() {
        FileEntry existing = new FileEntry("t1", null, null, "b.txt", "a/b.txt");
        DirectoryEntry directory = new DirectoryEntry("a", List.of(
                new FileEntry("t0", null, null, "c.txt", "a/c.txt"),
                existing
        ));

        TargetResolution resolution = resolver.resolve(source, directory, "a");

        assertThat(resolution.effectivePath()).isEqualTo("a/b.txt");
        assertThat(resolution.effectiveEntry()).isEqualTo(existing);
    }

    @Test
    @DisplayName("should resolve to absent when the directory has no entry with the source name")
    void shouldResolveAbsentInsideDirectory() {
        DirectoryEntry directory = new DirectoryEntry("a", List.of(new SymlinkEntry("l1", "x", "a/x")));

        TargetResolution resolution = resolver.resolve(source, directory, "a/");

        assertThat(resolution.effectivePath()).isEqualTo("a/b.txt");
        assertThat(resolution.effectiveEntry()).isSameAs(AbsentEntry.INSTANCE);
    }

    @Test
    @DisplayName("should resolve to the sub-directory when one has the source name")
    void shouldResolveNestedDirectory() {
        DirectoryEntry directory = new DirectoryEntry("a", List.of(
                DirectoryEntry.unexpanded("a/b.txt"),
                new FileEntry("t0", null, null, "c.txt", "a/c.txt")
        ));

        TargetResolution resolution = resolver.resolve(source, directory, "a");

        assertThat(resolution.effectivePath()).isEqualTo("a/b.txt");
        assertThat(resolution.effectiveEntry()).isEqualTo(DirectoryEntry.unexpanded("a/b.txt"));
        assertThat(new SyncDecider().decide(source, resolution.effectiveEntry()).action())
                .isEqualTo(SyncAction.REJECTED);
    }

    @Test
    @DisplayName("should keep the configured path for non-directory targets")
    void shouldKeepConfiguredPath() {
        FileEntry target = new FileEntry("t1", null, null, "README.md", "README.md");

        assertThat(resolver.resolve(source, target, "README.md"))
                .isEqualTo(new TargetResolution("README.md", target));
        assertThat(resolver.resolve(source, AbsentEntry.INSTANCE, "docs/NEW.md"))
                .isEqualTo(new TargetResolution("docs/NEW.md", AbsentEntry.INSTANCE));
    }

    @Test
    @DisplayName("should join directory and name without duplicate slashes")
    void shouldJoinChildPath() {
        assertThat(TargetResolver.childPath("a//", "b.txt")).isEqualTo("a/b.txt");
        assertThat(TargetResolver.childPath("", "b.txt")).isEqualTo("b.txt");
    }
}
