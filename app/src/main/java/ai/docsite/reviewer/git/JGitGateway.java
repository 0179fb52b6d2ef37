package ai.docsite.reviewer.git;

import ai.docsite.reviewer.history.CommitLogFormat;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.MergeResult;
import org.eclipse.jgit.api.PullResult;
import org.eclipse.jgit.api.RebaseResult;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.errors.IncorrectObjectTypeException;
import org.eclipse.jgit.errors.MissingObjectException;
import org.eclipse.jgit.errors.NoWorkTreeException;
import org.eclipse.jgit.errors.RevisionSyntaxException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectLoader;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevSort;
import org.eclipse.jgit.revwalk.RevTree;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.revwalk.filter.CommitTimeRevFilter;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.eclipse.jgit.treewalk.filter.PathFilter;
import org.eclipse.jgit.util.io.DisabledOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link GitGateway} backed by an in-process JGit {@link Repository}.
 */
public class JGitGateway implements GitGateway {

    private static final Logger LOGGER = LoggerFactory.getLogger(JGitGateway.class);

    private final Path projectRoot;
    private final Repository repository;

    public JGitGateway(Path projectRoot) {
        this.projectRoot = realPath(Objects.requireNonNull(projectRoot, "projectRoot"));
        this.repository = openRepository(this.projectRoot);
    }

    JGitGateway(Path projectRoot, Repository repository) {
        this.projectRoot = realPath(Objects.requireNonNull(projectRoot, "projectRoot"));
        this.repository = Objects.requireNonNull(repository, "repository");
    }

    @Override
    public String log(OffsetDateTime since) {
        Objects.requireNonNull(since, "since");
        try (RevWalk walk = new RevWalk(repository);
             DiffFormatter formatter = new DiffFormatter(DisabledOutputStream.INSTANCE)) {
            ObjectId head = repository.resolve(Constants.HEAD);
            if (head == null) {
                LOGGER.info("Repository at {} has no commits yet", repository.getDirectory());
                return "";
            }
            formatter.setRepository(repository);
            formatter.setDetectRenames(true);

            walk.sort(RevSort.COMMIT_TIME_DESC);
            walk.setRevFilter(CommitTimeRevFilter.after(Date.from(since.toInstant())));
            walk.markStart(walk.parseCommit(head));

            StringBuilder output = new StringBuilder();
            int count = 0;
            for (RevCommit commit : walk) {
                PersonIdent author = commit.getAuthorIdent();
                CommitLogFormat.appendRecord(output,
                        commit.getName(),
                        author.getName(),
                        author.getEmailAddress(),
                        authorTime(author),
                        commit.getShortMessage(),
                        touchedFiles(walk, formatter, commit));
                count++;
            }
            LOGGER.debug("Rendered {} commits after {}", count, since);
            return output.toString();
        } catch (IOException ex) {
            throw new GitGatewayException("Failed to read log since " + since, ex);
        }
    }

    @Override
    public Optional<String> showFileAt(String ref, String path) {
        if (GitGateway.EMPTY_TREE.equals(ref)) {
            return Optional.empty();
        }
        ObjectId id = resolve(ref);
        if (id == null) {
            return Optional.empty();
        }
        String normalized = normalizePath(path);
        try (RevWalk walk = new RevWalk(repository)) {
            RevTree tree = walk.parseTree(id);
            try (TreeWalk treeWalk = TreeWalk.forPath(repository, normalized, tree)) {
                if (treeWalk == null) {
                    return Optional.empty();
                }
                ObjectLoader loader = repository.open(treeWalk.getObjectId(0), Constants.OBJ_BLOB);
                return Optional.of(new String(loader.getBytes(), StandardCharsets.UTF_8));
            }
        } catch (MissingObjectException | IncorrectObjectTypeException ex) {
            LOGGER.debug("No content for {} at {}: {}", normalized, ref, ex.getMessage());
            return Optional.empty();
        } catch (IOException ex) {
            throw new GitGatewayException("Failed to read " + normalized + " at " + ref, ex);
        }
    }

    @Override
    public String diffBetween(String baseRef, String headRef, String path) {
        ObjectId base = resolveTreeish(baseRef);
        ObjectId head = resolveTreeish(headRef);
        if ((base == null && !GitGateway.EMPTY_TREE.equals(baseRef))
                || (head == null && !GitGateway.EMPTY_TREE.equals(headRef))) {
            return "";
        }
        String normalized = normalizePath(path);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (DiffFormatter formatter = new DiffFormatter(out)) {
            formatter.setRepository(repository);
            formatter.setPathFilter(PathFilter.create(normalized));
            formatter.format(base, head);
            formatter.flush();
        } catch (MissingObjectException | IncorrectObjectTypeException ex) {
            LOGGER.debug("No diff for {} between {} and {}: {}", normalized, baseRef, headRef, ex.getMessage());
            return "";
        } catch (IOException ex) {
            throw new GitGatewayException("Failed to diff " + normalized + " between " + baseRef + " and " + headRef, ex);
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    @Override
    public String patchOfCommit(String commitId) {
        ObjectId id = resolve(commitId);
        if (id == null) {
            return "";
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (RevWalk walk = new RevWalk(repository);
             DiffFormatter formatter = new DiffFormatter(out)) {
            formatter.setRepository(repository);
            formatter.setDetectRenames(true);
            RevCommit commit = walk.parseCommit(id);
            if (commit.getParentCount() == 0) {
                formatter.format((RevTree) null, commit.getTree());
            } else {
                for (RevCommit parent : commit.getParents()) {
                    RevCommit parsedParent = walk.parseCommit(parent);
                    formatter.format(parsedParent.getTree(), commit.getTree());
                }
            }
            formatter.flush();
        } catch (MissingObjectException | IncorrectObjectTypeException ex) {
            LOGGER.debug("No patch for {}: {}", commitId, ex.getMessage());
            return "";
        } catch (IOException ex) {
            throw new GitGatewayException("Failed to read patch of " + commitId, ex);
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    @Override
    public Optional<String> resolveParent(String commitId) {
        ObjectId id = resolve(commitId);
        if (id == null) {
            LOGGER.warn("Commit {} does not resolve; treating it as a root commit", commitId);
            return Optional.empty();
        }
        try (RevWalk walk = new RevWalk(repository)) {
            RevCommit commit = walk.parseCommit(id);
            if (commit.getParentCount() == 0) {
                return Optional.empty();
            }
            return Optional.of(commit.getParent(0).getName());
        } catch (MissingObjectException | IncorrectObjectTypeException ex) {
            LOGGER.warn("Commit {} could not be parsed; treating it as a root commit", commitId);
            return Optional.empty();
        } catch (IOException ex) {
            throw new GitGatewayException("Failed to resolve parent of " + commitId, ex);
        }
    }

    @Override
    public String repositoryRootPrefix() {
        Path workTree;
        try {
            workTree = realPath(repository.getWorkTree().toPath());
        } catch (NoWorkTreeException ex) {
            return "";
        }
        if (projectRoot.equals(workTree) || !projectRoot.startsWith(workTree)) {
            return "";
        }
        return normalizePath(workTree.relativize(projectRoot).toString()) + "/";
    }

    @Override
    public String sync() {
        try (Git git = Git.wrap(repository)) {
            PullResult result = git.pull().call();
            String source = result.getFetchedFrom() == null ? "remote" : result.getFetchedFrom();
            if (!result.isSuccessful()) {
                throw new GitGatewayException("Pull from " + source + " did not succeed: " + describe(result));
            }
            String summary = "Pulled from " + source + ": " + describe(result);
            LOGGER.info(summary);
            return summary;
        } catch (GitAPIException ex) {
            throw new GitGatewayException("Failed to pull into " + projectRoot, ex);
        }
    }

    @Override
    public void close() {
        repository.close();
    }

    private List<String> touchedFiles(RevWalk walk, DiffFormatter formatter, RevCommit commit) throws IOException {
        if (commit.getParentCount() > 1) {
            return List.of();
        }
        RevTree parentTree = null;
        if (commit.getParentCount() == 1) {
            parentTree = walk.parseCommit(commit.getParent(0)).getTree();
        }
        List<String> files = new ArrayList<>();
        for (DiffEntry entry : formatter.scan(parentTree, commit.getTree())) {
            files.add(entry.getChangeType() == DiffEntry.ChangeType.DELETE ? entry.getOldPath() : entry.getNewPath());
        }
        return files;
    }

    private ObjectId resolveTreeish(String ref) {
        if (GitGateway.EMPTY_TREE.equals(ref)) {
            return null;
        }
        return resolve(ref);
    }

    private ObjectId resolve(String ref) {
        if (ref == null || ref.isBlank()) {
            return null;
        }
        try {
            return repository.resolve(ref);
        } catch (RevisionSyntaxException ex) {
            LOGGER.debug("Ignoring malformed revision {}", ref);
            return null;
        } catch (IOException ex) {
            throw new GitGatewayException("Failed to resolve " + ref, ex);
        }
    }

    private static OffsetDateTime authorTime(PersonIdent ident) {
        return OffsetDateTime.ofInstant(ident.getWhen().toInstant(), ident.getTimeZone().toZoneId());
    }

    private static String describe(PullResult result) {
        MergeResult merge = result.getMergeResult();
        if (merge != null) {
            return merge.getMergeStatus().toString();
        }
        RebaseResult rebase = result.getRebaseResult();
        if (rebase != null) {
            return rebase.getStatus().toString();
        }
        return "no changes";
    }

    private static Repository openRepository(Path root) {
        FileRepositoryBuilder builder = new FileRepositoryBuilder()
                .setMustExist(true)
                .findGitDir(root.toFile());
        if (builder.getGitDir() == null) {
            throw new GitGatewayException("No git repository found at or above " + root);
        }
        try {
            return builder.build();
        } catch (IOException ex) {
            throw new GitGatewayException("Failed to open repository at " + builder.getGitDir(), ex);
        }
    }

    private static Path realPath(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        if (!Files.exists(absolute)) {
            throw new GitGatewayException("Project root does not exist: " + absolute);
        }
        try {
            return absolute.toRealPath();
        } catch (IOException ex) {
            throw new GitGatewayException("Failed to resolve project root " + absolute, ex);
        }
    }

    private static String normalizePath(String path) {
        String normalized = path.replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        return normalized;
    }
}
