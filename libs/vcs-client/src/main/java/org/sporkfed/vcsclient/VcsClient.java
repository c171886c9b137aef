package org.sporkfed.vcsclient;

import com.fasterxml.jackson.databind.JsonNode;
import org.sporkfed.vcsclient.model.VcsFileCommit;
import org.sporkfed.vcsclient.model.VcsGitRef;
import org.sporkfed.vcsclient.model.VcsPullRequest;

import java.io.IOException;
import java.util.List;

/**
 * Repository operations needed to mirror a file into a repository through a pull request.
 * <p>
 * Implementations report non-success responses with a {@link VcsClientException} subtype and
 * transport failures with {@link IOException}.
 */
public interface VcsClient {

    /**
     * Get the raw contents payload for a path.
     *
     * @param owner repository owner
     * @param repo repository name
     * @param path path inside the repository
     * @param ref branch, tag or commit; {@code null} for the repository default branch
     * @return a single entry object, or an array of entries when the path is a directory
     */
    JsonNode getContents(String owner, String repo, String path, String ref) throws IOException;

    /**
     * Resolve a git reference such as {@code heads/main}.
     */
    VcsGitRef getRef(String owner, String repo, String ref) throws IOException;

    /**
     * Delete a git reference such as {@code heads/feature}. Fails when the reference does not exist.
     */
    void deleteRef(String owner, String repo, String ref) throws IOException;

    /**
     * Create a fully-qualified reference ({@code refs/heads/...}) pointing at a commit.
     */
    VcsGitRef createRef(String owner, String repo, String ref, String sha) throws IOException;

    /**
     * Create or replace a file on a branch.
     *
     * @param base64Content new file body, base64 encoded
     * @param expectedSha blob sha of the file being replaced, {@code null} when creating
     */
    VcsFileCommit createOrUpdateFileContents(
            String owner,
            String repo,
            String path,
            String base64Content,
            String message,
            String branch,
            String expectedSha
    ) throws IOException;

    List<VcsPullRequest> listPullRequests(String owner, String repo, String state, String base, String head)
            throws IOException;

    VcsPullRequest createPullRequest(String owner, String repo, String title, String base, String head)
            throws IOException;
}
