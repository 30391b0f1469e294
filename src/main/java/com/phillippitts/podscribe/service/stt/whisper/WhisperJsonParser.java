package com.phillippitts.podscribe.service.stt.whisper;

import com.phillippitts.podscribe.domain.TranscriptSegment;
import com.phillippitts.podscribe.exception.TranscriptionException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the JSON result file written by {@code whisper} and {@code whisper-ctranslate2}.
 *
 * <p>Both tools write the same shape:
 * <pre>
 * {"text": "...", "language": "en", "segments": [{"start": 0.0, "end": 2.5, "text": " Hello"}, ...]}
 * </pre>
 *
 * <p>Unlike stdout scraping, a result file that cannot be parsed is an error: silently returning
 * an empty transcript would mark the episode as processed with nothing to show for it.
 */
final class WhisperJsonParser {

    /**
     * Segments and detected language of one run.
     */
    record ParsedTranscript(List<TranscriptSegment> segments, String language) {}

    private WhisperJsonParser() {}

    static ParsedTranscript parse(String json, String engineName) {
        if (json == null || json.isBlank()) {
            throw new TranscriptionException("Engine wrote an empty result file", engineName);
        }
        try {
            JSONObject obj = new JSONObject(json);
            String language = obj.optString("language", "unknown");
            JSONArray segs = obj.optJSONArray("segments");
            if (segs == null) {
                throw new TranscriptionException("Engine result has no 'segments' array", engineName);
            }
            List<TranscriptSegment> segments = new ArrayList<>(segs.length());
            for (int i = 0; i < segs.length(); i++) {
                JSONObject seg = segs.optJSONObject(i);
                if (seg == null) {
                    continue;
                }
                String text = seg.optString("text", "").strip();
                if (text.isEmpty()) {
                    continue;
                }
                double start = Math.max(0.0, seg.optDouble("start", 0.0));
                double end = Math.max(start, seg.optDouble("end", start));
                segments.add(new TranscriptSegment(start, end, text));
            }
            return new ParsedTranscript(segments, language);
        } catch (JSONException e) {
            throw new TranscriptionException("Engine result is not valid JSON: " + e.getMessage(), engineName, e);
        }
    }
}
