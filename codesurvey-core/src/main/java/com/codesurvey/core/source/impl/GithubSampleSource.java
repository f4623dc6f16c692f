package com.codesurvey.core.source.impl;

import com.codesurvey.core.source.AbstractSource;
import com.codesurvey.core.source.Repo;
import com.codesurvey.core.source.RepoCandidate;
import com.codesurvey.core.source.SourceException;
import com.codesurvey.core.util.FileUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Source of repositories sampled from the GitHub repository search API.
 *
 * <p>Repositories are drawn from randomly selected pages of search results and cloned
 * into temporary directories on worker threads. The stream never ends on its own; bound
 * the run with {@code maxRepos}.
 *
 * <p>Credentials are optional and only raise the API rate limit.
 *
 * @see <a href="https://docs.github.com/en/rest/search/search#search-repositories">GitHub search API</a>
 */
public class GithubSampleSource extends AbstractSource {

    public static final String DEFAULT_NAME = "github_sample";

    static final int REPOS_PER_PAGE = 100;
    /** GitHub only returns the first 1,000 search results. */
    static final int MAX_RESULTS = 1000;

    private static final String API_BASE = "https://api.github.com";
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private final Settings settings;
    private final HttpClient httpClient;

    /**
     * Search and authentication settings.
     *
     * @param searchQuery free-text search query, may be empty
     * @param language language tag constraint, or {@code null}
     * @param maxKb maximum repository size in kilobytes, or {@code null}
     * @param sort search sort order (GitHub only serves 1,000 results per query)
     * @param authUsername GitHub username, or {@code null}
     * @param authToken GitHub token, or {@code null}
     * @param randomSeed seed for page sampling, or {@code null} for a random seed
     */
    public record Settings(
        String searchQuery,
        String language,
        Integer maxKb,
        String sort,
        String authUsername,
        String authToken,
        Long randomSeed
    ) {
        public Settings {
            if (searchQuery == null) {
                searchQuery = "";
            }
            if (sort == null) {
                sort = "updated";
            }
            if (language != null) {
                language = language.toLowerCase(Locale.ROOT);
            }
        }

        public static Settings forLanguage(String language) {
            return new Settings("", language, 50_000, "updated", null, null, null);
        }
    }

    public GithubSampleSource(Settings settings) {
        this(settings, null);
    }

    public GithubSampleSource(Settings settings, String name) {
        this(settings, name, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(30)).build());
    }

    GithubSampleSource(Settings settings, String name, HttpClient httpClient) {
        super(name);
        this.settings = settings;
        this.httpClient = httpClient;
    }

    @Override
    protected String getDefaultName() {
        return DEFAULT_NAME;
    }

    @Override
    public Repo fetchRepo(String repoKey) {
        JsonNode repoData = getJson(API_BASE + "/repos/" + repoKey);
        return cloneRepo(repoData);
    }

    @Override
    public Iterator<RepoCandidate> repoCandidates() {
        Random random = settings.randomSeed() != null ? new Random(settings.randomSeed()) : new Random();
        Deque<JsonNode> buffered = new ArrayDeque<>();
        int[] pageCount = {1};

        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return true;
            }

            @Override
            public RepoCandidate next() {
                while (buffered.isEmpty()) {
                    log.info("Source \"{}\" searching GitHub for repos", GithubSampleSource.this);
                    SearchPage page = searchRepos(1 + random.nextInt(pageCount[0]));
                    pageCount[0] = page.pageCount();
                    buffered.addAll(page.repos());
                }
                JsonNode repoData = buffered.removeFirst();
                return repoThunk(repoData.path("full_name").asText(), () -> cloneRepo(repoData));
            }
        };
    }

    /**
     * One page of search results.
     *
     * @param pageCount number of pages that can be sampled for this query
     * @param repos repository entries matching the language constraint
     */
    record SearchPage(int pageCount, List<JsonNode> repos) {}

    String buildSearchQuery() {
        List<String> parts = new ArrayList<>();
        if (!settings.searchQuery().isBlank()) {
            parts.add(settings.searchQuery());
        }
        if (settings.language() != null) {
            parts.add("language:" + settings.language());
        }
        if (settings.maxKb() != null) {
            parts.add("size:<=" + settings.maxKb());
        }
        return String.join(" ", parts);
    }

    SearchPage searchRepos(int page) {
        String url = API_BASE + "/search/repositories"
            + "?q=" + URLEncoder.encode(buildSearchQuery(), StandardCharsets.UTF_8)
            + "&sort=" + URLEncoder.encode(settings.sort(), StandardCharsets.UTF_8)
            + "&per_page=" + REPOS_PER_PAGE
            + "&page=" + page;
        return parseSearchPage(getJson(url));
    }

    SearchPage parseSearchPage(JsonNode response) {
        int totalCount = response.path("total_count").asInt(0);
        int sampleable = Math.min(MAX_RESULTS, totalCount);
        int pageCount = Math.max(1, (sampleable + REPOS_PER_PAGE - 1) / REPOS_PER_PAGE);

        List<JsonNode> repos = new ArrayList<>();
        for (JsonNode item : response.path("items")) {
            String itemLanguage = item.path("language").asText("").toLowerCase(Locale.ROOT);
            if (settings.language() == null || settings.language().equals(itemLanguage)) {
                repos.add(item);
            }
        }
        return new SearchPage(pageCount, repos);
    }

    Repo cloneRepo(JsonNode repoData) {
        String fullName = repoData.path("full_name").asText();
        Path directory;
        try {
            directory = GitCloner.cloneToTempDirectory(repoData.path("clone_url").asText(), GitSource.DEFAULT_CLONE_DEPTH);
        } catch (SourceException e) {
            throw new SourceException("Source " + this + " failed to clone from GitHub: " + e.getMessage(), e);
        }
        return repo(
            fullName,
            directory,
            () -> FileUtils.deleteRecursively(directory),
            Map.of("stars", repoData.path("stargazers_count").asInt(0))
        );
    }

    private JsonNode getJson(String url) {
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(url))
            .header("Accept", "application/vnd.github+json")
            .timeout(Duration.ofSeconds(60))
            .GET();
        if (settings.authUsername() != null && settings.authToken() != null) {
            String credentials = settings.authUsername() + ":" + settings.authToken();
            request.header("Authorization", "Basic "
                + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
        }

        try {
            HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new SourceException("GitHub API request failed with status "
                    + response.statusCode() + ": " + url);
            }
            return JSON_MAPPER.readTree(response.body());
        } catch (IOException e) {
            throw new SourceException("GitHub API request failed: " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceException("Interrupted while calling GitHub API: " + url, e);
        }
    }
}
