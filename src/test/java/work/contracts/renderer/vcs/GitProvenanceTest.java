package work.contracts.renderer.vcs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.contracts.renderer.support.RenderFixtures.configuration;
import static work.contracts.renderer.support.RenderFixtures.lines;
import static work.contracts.renderer.support.RenderFixtures.write;

import java.nio.file.Path;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.revwalk.RevCommit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.contracts.renderer.api.ContractRenderer;
import work.contracts.renderer.api.ErrorKind;
import work.contracts.renderer.api.RenderException;

class GitProvenanceTest {
    private static final PersonIdent AUTHOR = new PersonIdent("Renderer Tests", "tests@example.com");
    private static final String FEES = lines("RATE = 1", "def charge():", "    return RATE");

    @TempDir
    Path dir;

    @Test
    void reportsTheLastCommitTouchingAFile() throws GitAPIException {
        var fees = write(dir, "library/fees.py", FEES);
        var commit = commitAll("add fees");

        try (var provenance = GitProvenance.open(dir.resolve("library"))) {
            assertEquals("library/fees.py", provenance.relativePath(fees));
            assertEquals(commit.getName(), provenance.validatedCommit(fees, Checksums.hexDigest("md5", FEES), "md5"));
        }
    }

    @Test
    void rejectsUncommittedChanges() throws GitAPIException {
        var fees = write(dir, "library/fees.py", FEES);
        commitAll("add fees");
        var changed = FEES + "EXTRA = 2\n";
        write(dir, "library/fees.py", changed);

        try (var provenance = GitProvenance.open(dir)) {
            var error = assertThrows(
                RenderException.class,
                () -> provenance.validatedCommit(fees, Checksums.hexDigest("md5", changed), "md5")
            );
            assertEquals(ErrorKind.PROVENANCE_MISMATCH, error.kind());
            assertTrue(error.getMessage().contains("does not match the latest checksum"), error.getMessage());
        }
    }

    @Test
    void rejectsFilesThatWereNeverCommitted() throws GitAPIException {
        write(dir, "library/fees.py", FEES);
        commitAll("add fees");
        var draft = write(dir, "library/draft.py", "X = 1\n");

        try (var provenance = GitProvenance.open(dir)) {
            var error = assertThrows(RenderException.class, () -> provenance.validatedCommit(draft, "0", "md5"));
            assertTrue(error.getMessage().startsWith("Unable to find file library/draft.py"), error.getMessage());
        }
    }

    @Test
    void addsRevisionsToRenderedHeaders() throws GitAPIException {
        write(dir, "library/fees.py", FEES);
        var template = write(dir, "contract.py", lines("api = \"4.0.0\"", "import library.fees as fees", "x = fees.charge()"));
        var commit = commitAll("add contract");

        var output = new ContractRenderer().render(configuration(template, dir)
            .useGit(true)
            .useFullFilepathInHeaders(true)
            .build()).requireOutput();

        assertTrue(output.contains("#    library/fees.py\n"), output);
        assertTrue(output.contains("# md5:" + Checksums.hexDigest("md5", FEES) + " git:" + commit.getName() + "\n"), output);
    }

    private RevCommit commitAll(String message) throws GitAPIException {
        try (var git = Git.init().setDirectory(dir.toFile()).call()) {
            git.add().addFilepattern(".").call();
            return git.commit()
                .setMessage(message)
                .setAuthor(AUTHOR)
                .setCommitter(AUTHOR)
                .setSign(false)
                .call();
        }
    }
}
