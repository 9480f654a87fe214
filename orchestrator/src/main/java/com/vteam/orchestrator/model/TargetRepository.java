package com.vteam.orchestrator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Where the workflow's generated artifacts will eventually be committed.
 * Immutable once the workflow exists; there are no setters.
 *
 * Embedded in the rfe_workflows row (repo_url, repo_branch, repo_clone_path).
 */
@Embeddable
public class TargetRepository {

    private static final Set<String> SCHEMES = Set.of("http", "https", "ssh", "git");

    // scp-like syntax git understands: git@github.com:org/repo.git
    private static final Pattern SCP_LIKE = Pattern.compile("^[\\w.-]+@[\\w.-]+:[\\w./~-]+$");

    @Column(name = "repo_url", nullable = false)
    private String url;

    @Column(name = "repo_branch", nullable = false)
    private String branch;

    @Column(name = "repo_clone_path", nullable = false)
    private String clonePath;

    protected TargetRepository() {}   // required by JPA

    private TargetRepository(String url, String branch, String clonePath) {
        this.url       = url;
        this.branch    = branch;
        this.clonePath = clonePath;
    }

    /**
     * Validate and normalise a repository reference.
     * branch defaults to "main"; clonePath defaults to repos/&lt;repo-name&gt;.
     *
     * @throws WorkflowException VALIDATION on a malformed URL or clone path
     */
    public static TargetRepository of(String url, String branch, String clonePath) {
        if (url == null || url.isBlank()) {
            throw WorkflowException.validation("Target repository URL is required");
        }
        String trimmed = url.trim();
        if (!isWellFormed(trimmed)) {
            throw WorkflowException.validation("Malformed repository URL: " + url);
        }
        String b = (branch == null || branch.isBlank()) ? "main" : branch.trim();
        String cp = (clonePath == null || clonePath.isBlank())
                ? "repos/" + repoName(trimmed)
                : clonePath.trim();
        if (cp.startsWith("/") || cp.contains("..")) {
            throw WorkflowException.validation("Clone path must be relative to the workspace: " + clonePath);
        }
        return new TargetRepository(trimmed, b, cp);
    }

    static boolean isWellFormed(String url) {
        if (SCP_LIKE.matcher(url).matches()) return true;
        try {
            URI uri = new URI(url);
            return uri.getScheme() != null
                    && SCHEMES.contains(uri.getScheme().toLowerCase(Locale.ROOT))
                    && uri.getHost() != null
                    && uri.getPath() != null
                    && uri.getPath().length() > 1;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    /** "https://github.com/org/repo.git" → "repo". */
    static String repoName(String url) {
        String s = url;
        while (s.endsWith("/")) s = s.substring(0, s.length() - 1);
        if (s.endsWith(".git")) s = s.substring(0, s.length() - 4);
        int cut = Math.max(s.lastIndexOf('/'), s.lastIndexOf(':'));
        return s.substring(cut + 1);
    }

    public String getUrl()       { return url; }
    public String getBranch()    { return branch; }
    public String getClonePath() { return clonePath; }
}
