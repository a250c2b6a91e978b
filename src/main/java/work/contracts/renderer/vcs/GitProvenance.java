package work.contracts.renderer.vcs;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.contracts.renderer.api.ErrorKind;
import work.contracts.renderer.api.RenderException;

/**
 * Revision lookups against the git repository that contains the rendered modules. A module's
 * revision is the last commit touching it, and is only reported when the committed blob matches
 * the file on disk.
 */
public final class GitProvenance implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GitProvenance.class);

    private final Repository repository;
    private final Path workTree;

    private GitProvenance(Repository repository) {
        this.repository = repository;
        this.workTree = repository.getWorkTree().toPath().toAbsolutePath().normalize();
    }

    /** Opens the repository at or above {@code start}. */
    public static GitProvenance open(Path start) {
        LOG.info("Looking for repo at or above `{}`", start);
        var builder = new FileRepositoryBuilder().findGitDir(start.toAbsolutePath().toFile());
        if (builder.getGitDir() == null) {
            throw new RenderException(ErrorKind.PROVENANCE_MISMATCH, "Could not find git repository using path `" + start + "`");
        }
        try {
            var repository = builder.setMustExist(true).build();
            if (repository.isBare()) {
                repository.close();
                throw new RenderException(ErrorKind.PROVENANCE_MISMATCH, "Repo has no working dir - this is the sign of a bare repo");
            }
            var provenance = new GitProvenance(repository);
            LOG.info("Using repo at `{}`", provenance.workTree);
            return provenance;
        } catch (IOException ex) {
            throw new RenderException(ErrorKind.PROVENANCE_MISMATCH, "Failed to open git repository at " + builder.getGitDir(), null, null, ex);
        }
    }

    public Path workTree() {
        return workTree;
    }

    public String relativePath(Path file) {
        var absolute = file.toAbsolutePath().normalize();
        if (!absolute.startsWith(workTree)) {
            return absolute.toString();
        }
        return workTree.relativize(absolute).toString().replace('\\', '/');
    }

    /**
     * Commit id of the last change to {@code file}, provided the committed content has the same
     * checksum as the working copy.
     */
    public String validatedCommit(Path file, String checksum, String algorithm) {
        var relative = relativePath(file);
        var commit = lastCommitTouching(relative);
        var committed = committedChecksum(relative, commit, algorithm);
        if (!committed.equals(checksum)) {
            throw new RenderException(
                ErrorKind.PROVENANCE_MISMATCH,
                "The checksum of " + relative + " does not match the latest checksum in the Git repo. "
                    + "Ensure that all changes are committed."
            );
        }
        return commit.getName();
    }

    private RevCommit lastCommitTouching(String relative) {
        try (var git = new Git(repository)) {
            var commits = git.log().addPath(relative).setMaxCount(1).call().iterator();
            if (!commits.hasNext()) {
                throw new RenderException(ErrorKind.PROVENANCE_MISMATCH, "Unable to find file " + relative + " in the Git repo.");
            }
            return commits.next();
        } catch (GitAPIException ex) {
            throw new RenderException(ErrorKind.PROVENANCE_MISMATCH, "Unable to find file " + relative + " in the Git repo.", null, null, ex);
        }
    }

    private String committedChecksum(String relative, RevCommit commit, String algorithm) {
        try (var walk = TreeWalk.forPath(repository, relative, commit.getTree())) {
            if (walk == null) {
                throw new RenderException(
                    ErrorKind.PROVENANCE_MISMATCH,
                    "Unable to find the file " + relative + " in commit " + commit.getName() + ". Ensure that remote is up-to-date."
                );
            }
            var bytes = repository.open(walk.getObjectId(0)).getBytes();
            return Checksums.hexDigest(algorithm, new String(bytes, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new RenderException(ErrorKind.PROVENANCE_MISMATCH, "Failed to read " + relative + " at " + commit.getName(), null, null, ex);
        }
    }

    @Override
    public void close() {
        repository.close();
    }
}
