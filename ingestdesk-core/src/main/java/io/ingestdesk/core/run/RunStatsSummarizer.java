package io.ingestdesk.core.run;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Joiner;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.ingestdesk.client.config.Config;

/**
 * Condenses the progress stats of a run into one short line for run lists.
 *
 * Stats have no shared schema. Each job reports whatever it tracks, so the
 * summary is picked by an ordered list of shape detectors where the first
 * match wins, ending with a generic key:value rendering that accepts any
 * object. The result is never longer than {@link #MAX_LENGTH}.
 */
public class RunStatsSummarizer
{
    public static final int MAX_LENGTH = 80;

    private static final int MAX_FALLBACK_PAIRS = 4;
    private static final Set<String> NOISY_KEYS = ImmutableSet.of(
            "raw", "error_trace", "trace", "details", "failed_pages", "last_request");
    private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?\\d{1,18})");
    private static final Joiner SPACE = Joiner.on(' ').skipNulls();

    interface Detector
    {
        Optional<String> detect(ObjectNode stats, String lastRequest);
    }

    private static final List<Detector> DETECTORS = ImmutableList.of(
            RunStatsSummarizer::reason,
            RunStatsSummarizer::error,
            RunStatsSummarizer::retryWait,
            RunStatsSummarizer::chunkedFetch,
            RunStatsSummarizer::supplierStocks,
            RunStatsSummarizer::pagedPhase,
            RunStatsSummarizer::counters,
            RunStatsSummarizer::ok,
            RunStatsSummarizer::scalarPairs);

    private RunStatsSummarizer()
    { }

    public static String summarize(Optional<Config> stats)
    {
        if (!stats.isPresent()) {
            return "-";
        }
        return summarize(stats.get());
    }

    public static String summarize(Config stats)
    {
        ObjectNode object = stats.getInternalObjectNode();
        String lastRequest = lastRequestHint(object);
        for (Detector detector : DETECTORS) {
            Optional<String> summary = detector.detect(object, lastRequest);
            if (summary.isPresent()) {
                return truncate(summary.get());
            }
        }
        return truncate(object.toString());
    }

    // "http:<status>" or "err:<error>" of the last upstream request, or null
    static String lastRequestHint(ObjectNode stats)
    {
        JsonNode lastRequest = stats.get("last_request");
        if (lastRequest == null || !lastRequest.isObject()) {
            return null;
        }
        if (isSet(lastRequest.get("status_code"))) {
            return "http:" + text(lastRequest.get("status_code"));
        }
        if (isTruthy(lastRequest.get("error"))) {
            return "err:" + text(lastRequest.get("error"));
        }
        return null;
    }

    private static Optional<String> reason(ObjectNode stats, String lastRequest)
    {
        if (isTruthy(stats.get("reason"))) {
            return Optional.of("reason:" + text(stats.get("reason")));
        }
        return Optional.absent();
    }

    private static Optional<String> error(ObjectNode stats, String lastRequest)
    {
        JsonNode ok = stats.get("ok");
        if (isTruthy(stats.get("error")) && ok != null && ok.isBoolean() && !ok.booleanValue()) {
            return Optional.of("error:" + text(stats.get("error")));
        }
        return Optional.absent();
    }

    private static Optional<String> retryWait(ObjectNode stats, String lastRequest)
    {
        if (!isPhase(stats, "retry_wait")) {
            return Optional.absent();
        }
        Optional<String> sleep = number(stats.get("sleep_s"));
        return Optional.of(SPACE.join(
                    "retry p:" + page(stats),
                    sleep.isPresent() ? "sleep:" + sleep.get() + "s" : null,
                    lastRequest));
    }

    private static Optional<String> chunkedFetch(ObjectNode stats, String lastRequest)
    {
        if (!isPhase(stats, "stocks_fetch") &&
                !isSet(stats.get("warehouse_id")) &&
                !isSet(stats.get("chunk_index")) &&
                !isSet(stats.get("chunks_total"))) {
            return Optional.absent();
        }
        return Optional.of(SPACE.join(
                    token("wh:", stats.get("warehouse_id")),
                    "chunk:" + textOr(stats.get("chunk_index"), "?") + "/" + textOr(stats.get("chunks_total"), "?"),
                    token("api:", stats.get("api_records")),
                    token("ins:", stats.get("inserted")),
                    token("fail:", stats.get("failed_chunks")),
                    token("empty:", stats.get("empty_chunks"))));
    }

    private static Optional<String> supplierStocks(ObjectNode stats, String lastRequest)
    {
        if (!isPhase(stats, "supplier_stocks")) {
            return Optional.absent();
        }
        return nonEmpty(SPACE.join(
                    token("p:", stats.get("page")),
                    token("recv:", stats.get("received")),
                    token("ins:", stats.get("inserted"))));
    }

    private static Optional<String> pagedPhase(ObjectNode stats, String lastRequest)
    {
        if (!isTruthy(stats.get("phase")) ||
                (!isSet(stats.get("page")) && !isSet(stats.get("total_pages")))) {
            return Optional.absent();
        }
        return Optional.of(SPACE.join(
                    "p:" + page(stats),
                    token("saved:", stats.get("saved")),
                    token("uniq:", stats.get("distinct_nm_id")),
                    lastRequest));
    }

    private static Optional<String> counters(ObjectNode stats, String lastRequest)
    {
        if (!stats.has("inserted") && !stats.has("updated")) {
            return Optional.absent();
        }
        return nonEmpty(SPACE.join(
                    token("ins:", stats.get("inserted")),
                    token("upd:", stats.get("updated")),
                    token("del:", stats.get("deleted"))));
    }

    private static Optional<String> ok(ObjectNode stats, String lastRequest)
    {
        JsonNode ok = stats.get("ok");
        if (ok != null && ok.isBoolean() && ok.booleanValue()) {
            return Optional.of("ok");
        }
        return Optional.absent();
    }

    private static Optional<String> scalarPairs(ObjectNode stats, String lastRequest)
    {
        ImmutableList.Builder<String> pairs = ImmutableList.builder();
        int count = 0;
        Iterator<Map.Entry<String, JsonNode>> fields = stats.fields();
        while (fields.hasNext() && count < MAX_FALLBACK_PAIRS) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (NOISY_KEYS.contains(field.getKey()) || !isSet(value) || value.isContainerNode()) {
                continue;
            }
            pairs.add(field.getKey() + ":" + text(value));
            count++;
        }
        return nonEmpty(SPACE.join(pairs.build()));
    }

    private static String page(ObjectNode stats)
    {
        return textOr(stats.get("page"), "?") + "/" + textOr(stats.get("total_pages"), "?");
    }

    private static boolean isPhase(ObjectNode stats, String phase)
    {
        JsonNode node = stats.get("phase");
        return node != null && node.isTextual() && node.textValue().equals(phase);
    }

    private static String token(String prefix, JsonNode value)
    {
        return isSet(value) ? prefix + text(value) : null;
    }

    private static String textOr(JsonNode value, String defaultText)
    {
        return isSet(value) ? text(value) : defaultText;
    }

    private static Optional<String> number(JsonNode value)
    {
        if (!isSet(value)) {
            return Optional.absent();
        }
        if (value.isNumber()) {
            return Optional.of(value.asText());
        }
        if (value.isTextual()) {
            Matcher m = LEADING_INTEGER.matcher(value.textValue());
            if (m.find()) {
                return Optional.of(Long.toString(Long.parseLong(m.group(1))));
            }
        }
        return Optional.absent();
    }

    private static Optional<String> nonEmpty(String summary)
    {
        return summary.isEmpty() ? Optional.absent() : Optional.of(summary);
    }

    private static boolean isSet(JsonNode value)
    {
        return value != null && !value.isNull();
    }

    private static boolean isTruthy(JsonNode value)
    {
        if (!isSet(value)) {
            return false;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.doubleValue() != 0.0;
        }
        if (value.isTextual()) {
            return !value.textValue().isEmpty();
        }
        return true;
    }

    private static String text(JsonNode value)
    {
        return value.isValueNode() ? value.asText() : value.toString();
    }

    private static String truncate(String summary)
    {
        if (summary.length() <= MAX_LENGTH) {
            return summary;
        }
        return summary.substring(0, MAX_LENGTH);
    }
}
