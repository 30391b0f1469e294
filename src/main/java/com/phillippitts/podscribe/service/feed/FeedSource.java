package com.phillippitts.podscribe.service.feed;

import com.phillippitts.podscribe.config.properties.FeedProperties;
import com.phillippitts.podscribe.config.properties.ImportProperties;
import com.phillippitts.podscribe.domain.EpisodeCandidate;
import com.phillippitts.podscribe.exception.FeedFetchException;
import com.phillippitts.podscribe.exception.FeedParseException;
import com.phillippitts.podscribe.util.FileNames;
import com.phillippitts.podscribe.util.Hashing;
import com.phillippitts.podscribe.util.HttpDeadlines;
import com.rometools.rome.feed.synd.SyndEnclosure;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;

/**
 * Fetches one RSS/Atom feed and turns its entries into episode candidates.
 *
 * <p>Processing flow:
 * <ol>
 * <li>GET the feed with the shared {@link HttpClient}; the whole exchange is bounded by the request timeout</li>
 * <li>Parse with Rome {@link SyndFeedInput}</li>
 * <li>Pick the audio enclosure of each entry; entries without one are dropped</li>
 * <li>Derive a stable identifier from feed URL and GUID</li>
 * </ol>
 *
 * <p>Candidates are returned in feed document order. Lookback filtering and de-duplication happen later
 * in {@link com.phillippitts.podscribe.service.selection.CandidateSelector}.
 */
@Component
public class FeedSource {

    private static final Logger LOG = LogManager.getLogger(FeedSource.class);

    private final HttpClient httpClient;
    private final FeedProperties feedProperties;
    private final List<String> audioExtensions;

    public FeedSource(HttpClient httpClient, FeedProperties feedProperties, ImportProperties importProperties) {
        this.httpClient = httpClient;
        this.feedProperties = feedProperties;
        this.audioExtensions = importProperties.normalizedExtensions();
    }

    /**
     * Fetches and parses one feed.
     *
     * @param feedUrl   feed URL as configured
     * @param feedOrder position of the feed in the configured list
     * @return candidates in feed order
     * @throws FeedFetchException on transport failure, timeout or non-2xx status
     * @throws FeedParseException if the body is not a parseable feed
     */
    public List<EpisodeCandidate> fetch(String feedUrl, int feedOrder) {
        LOG.debug("Fetching feed #{}: {}", feedOrder, feedUrl);
        HttpResponse<byte[]> response;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(feedUrl))
                    .timeout(feedProperties.getRequestTimeout())
                    .header("Accept", "application/rss+xml, application/atom+xml, application/xml;q=0.9, */*;q=0.8")
                    .GET()
                    .build();
            response = HttpDeadlines.await(httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray()),
                    feedProperties.getRequestTimeout());
        } catch (IOException | IllegalArgumentException e) {
            throw new FeedFetchException(feedUrl, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FeedFetchException(feedUrl, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new FeedFetchException(feedUrl, status);
        }
        return parse(feedUrl, feedOrder, new ByteArrayInputStream(response.body()));
    }

    /**
     * Parses feed XML into candidates. The body is already in memory, so any read error here is a content
     * problem (bad encoding declaration, malformed XML) and surfaces as {@link FeedParseException}.
     */
    List<EpisodeCandidate> parse(String feedUrl, int feedOrder, InputStream xml) {
        SyndFeed feed;
        try {
            SyndFeedInput input = new SyndFeedInput();
            input.setAllowDoctypes(false);
            feed = input.build(new XmlReader(xml));
        } catch (FeedException | IOException | IllegalArgumentException e) {
            throw new FeedParseException(feedUrl, e);
        }

        List<SyndEntry> entries = feed.getEntries();
        List<EpisodeCandidate> candidates = new ArrayList<>(entries.size());
        int dropped = 0;
        for (SyndEntry entry : entries) {
            String title = entry.getTitle() == null ? null : entry.getTitle().strip();
            String audioUrl = extractAudioUrl(entry);
            if (audioUrl == null) {
                LOG.warn("Skipping entry without audio enclosure: feed={}, title='{}'", feedUrl, title);
                dropped++;
                continue;
            }
            Instant publishedAt = extractPublishedAt(entry);
            String identifier = identifierFor(feedUrl, entry.getUri(), title, publishedAt);
            candidates.add(EpisodeCandidate.feed(identifier, title, audioUrl, publishedAt, feedUrl, feedOrder));
            LOG.debug("Feed entry: title='{}', publishedAt={}, id={}", title, publishedAt,
                    identifier.substring(0, 8));
        }
        LOG.info("Parsed feed '{}' ({}): {} entries, {} with audio, {} dropped",
                feed.getTitle(), feedUrl, entries.size(), candidates.size(), dropped);
        return candidates;
    }

    /**
     * Hash of (feed URL, GUID); entries without a GUID fall back to (feed URL, title, publish time).
     */
    static String identifierFor(String feedUrl, String guid, String title, Instant publishedAt) {
        if (guid != null && !guid.isBlank()) {
            return Hashing.sha256Hex(feedUrl, guid.strip());
        }
        return Hashing.sha256Hex(feedUrl, title == null ? "" : title,
                publishedAt == null ? "" : publishedAt.toString());
    }

    private String extractAudioUrl(SyndEntry entry) {
        for (SyndEnclosure enclosure : entry.getEnclosures()) {
            String url = enclosure.getUrl();
            if (url == null || url.isBlank()) {
                continue;
            }
            String type = enclosure.getType();
            if (type != null && type.toLowerCase(Locale.ROOT).startsWith("audio")) {
                return url.strip();
            }
            if ((type == null || type.isBlank()) && hasAudioExtension(url)) {
                return url.strip();
            }
        }
        String link = entry.getLink();
        if (link != null && hasAudioExtension(link)) {
            return link.strip();
        }
        return null;
    }

    private boolean hasAudioExtension(String url) {
        String path = url;
        try {
            String p = URI.create(url.strip()).getPath();
            if (p != null) {
                path = p;
            }
        } catch (IllegalArgumentException e) {
            LOG.debug("Unparseable link '{}': {}", url, e.getMessage());
        }
        return audioExtensions.contains(FileNames.extension(path));
    }

    private static Instant extractPublishedAt(SyndEntry entry) {
        Date date = entry.getPublishedDate();
        if (date == null) {
            date = entry.getUpdatedDate();
        }
        return date == null ? null : date.toInstant();
    }
}
