package com.phillippitts.podscribe.service.notification;

import com.phillippitts.podscribe.exception.NotificationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Posts finished transcripts to a Discord webhook.
 *
 * <p>Transcripts up to the attachment limit are uploaded as a {@code multipart/form-data} request with
 * a {@code payload_json} part and the file; larger ones are announced by name in a plain JSON message.
 */
public class DiscordWebhookNotifier implements Notifier {

    private static final Logger LOG = LogManager.getLogger(DiscordWebhookNotifier.class);

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final RestClient restClient;
    private final String webhookUrl;
    private final long maxAttachmentBytes;

    public DiscordWebhookNotifier(RestClient restClient, String webhookUrl, long maxAttachmentBytes) {
        this.restClient = restClient;
        this.webhookUrl = webhookUrl;
        this.maxAttachmentBytes = maxAttachmentBytes;
    }

    @Override
    public void notify(String title, Path transcriptPath) {
        if (!Files.isRegularFile(transcriptPath)) {
            throw new NotificationException("Transcript not found: " + transcriptPath);
        }
        String content = "Transcription complete for: **" + title + "**";
        String fileName = transcriptPath.getFileName().toString();
        try {
            long size = Files.size(transcriptPath);
            if (size > maxAttachmentBytes) {
                String sizeMb = String.format(Locale.ROOT, "%.2f", size / BYTES_PER_MB);
                LOG.warn("Transcript {} is ~{}MB, sending message without file", fileName, sizeMb);
                sendMessage(content + "\n(Transcript `" + fileName + "` too large to attach: " + sizeMb + "MB)");
            } else {
                sendWithAttachment(content, transcriptPath);
            }
            LOG.info("Sent Discord notification for {}", fileName);
        } catch (RestClientResponseException e) {
            throw new NotificationException("Discord webhook returned HTTP " + e.getStatusCode().value()
                    + " for " + fileName + ": " + e.getResponseBodyAsString(), e);
        } catch (RestClientException | IOException e) {
            throw new NotificationException("Discord webhook delivery failed for " + fileName, e);
        }
    }

    private void sendMessage(String content) {
        restClient.post()
                .uri(webhookUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new JSONObject().put("content", content).toString())
                .retrieve()
                .toBodilessEntity();
    }

    private void sendWithAttachment(String content, Path transcriptPath) {
        HttpHeaders fileHeaders = new HttpHeaders();
        fileHeaders.setContentType(MediaType.TEXT_PLAIN);

        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
        parts.add("payload_json", new JSONObject().put("content", content).toString());
        parts.add("file", new HttpEntity<>(new FileSystemResource(transcriptPath), fileHeaders));

        restClient.post()
                .uri(webhookUrl)
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(parts)
                .retrieve()
                .toBodilessEntity();
    }
}
