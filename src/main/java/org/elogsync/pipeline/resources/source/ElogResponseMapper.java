package org.elogsync.pipeline.resources.source;

import com.fasterxml.jackson.databind.JsonNode;
import org.elogsync.pipeline.api.contracts.DetectorStatus;
import org.elogsync.pipeline.api.contracts.ExperimentRecord;
import org.elogsync.pipeline.api.contracts.LogbookEntry;
import org.elogsync.pipeline.api.contracts.QuestionnaireField;
import org.elogsync.pipeline.api.contracts.RunRecord;
import org.elogsync.pipeline.api.contracts.WorkflowDefinition;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts elog web-service responses into store rows.
 */
final class ElogResponseMapper {

    static final String DETECTOR_PREFIX = "DAQ Detectors/";
    static final String EVENTS_PARAM = "DAQ Detector Totals/Events";
    static final String DAMAGED_PARAM = "DAQ Detector Totals/Damaged";
    static final String DROPPED_PARAM = "N dropped Shots";

    private static final Pattern CONTACT_INFO = Pattern.compile("(.*?)\\s*\\((.*?)\\)");
    private static final Pattern LCLS_RUN = Pattern.compile("(\\d{2})$");
    private static final Pattern RUN_NUMBER = Pattern.compile("\\d{1,9}");

    private ElogResponseMapper() {
    }

    // --- info ---

    static ExperimentRecord toExperiment(String experimentId, JsonNode info) {
        if (info == null || info.isNull() || info.isMissingNode() || info.isEmpty()) {
            return ExperimentRecord.idOnly(experimentId);
        }
        String[] contact = parseContactInfo(text(info, "contact_info"));
        JsonNode params = info.path("params");
        return new ExperimentRecord(
            experimentId,
            text(info, "name"),
            text(info, "instrument"),
            text(info, "start_time"),
            text(info, "end_time"),
            contact[0],
            contact[1],
            text(info, "leader_account"),
            text(info, "description"),
            text(params, "slack_channels"),
            text(params, "analysis_queues"),
            text(params, "PNR"));
    }

    /**
     * Splits {@code "Jane Doe (jane@example.org)"} into name and e-mail. Without parentheses the
     * whole string is the name.
     *
     * @return Two-element array {name, email}; elements may be null
     */
    static String[] parseContactInfo(String contactInfo) {
        if (contactInfo == null || contactInfo.isBlank()) {
            return new String[]{null, null};
        }
        Matcher m = CONTACT_INFO.matcher(contactInfo);
        if (m.find()) {
            return new String[]{m.group(1).strip(), m.group(2).strip()};
        }
        return new String[]{contactInfo.strip(), null};
    }

    static Optional<String> lclsRun(String experimentId) {
        Matcher m = LCLS_RUN.matcher(experimentId);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    // --- logbook ---

    /**
     * Converts raw elog entries. Entries are ordered by insert time; entries without an explicit
     * run number inherit the run of the latest run boundary at or before their insert time.
     */
    static List<LogbookEntry> toLogbook(String experimentId, JsonNode rawEntries) {
        List<JsonNode> sorted = new ArrayList<>();
        rawEntries.forEach(sorted::add);
        sorted.sort(Comparator.comparing(ElogResponseMapper::insertTime));

        TreeMap<String, Integer> boundaries = runBoundaries(sorted);
        List<String> boundaryTimes = new ArrayList<>(boundaries.keySet());
        List<Integer> boundaryRuns = new ArrayList<>(boundaries.values());

        List<LogbookEntry> result = new ArrayList<>(sorted.size());
        int index = 0;
        for (JsonNode entry : sorted) {
            Integer runNumber = integer(entry.get("run_num"));
            if (runNumber == null) {
                runNumber = inferRun(insertTime(entry), boundaryTimes, boundaryRuns);
            }
            String logId = text(entry, "_id");
            if (logId == null || logId.isBlank()) {
                logId = experimentId + ":" + index;
            }
            result.add(new LogbookEntry(
                logId,
                runNumber,
                text(entry, "insert_time"),
                text(entry, "content"),
                joinTags(entry.get("tags")),
                text(entry, "author")));
            index++;
        }
        return result;
    }

    private static TreeMap<String, Integer> runBoundaries(List<JsonNode> sortedEntries) {
        TreeMap<String, Integer> boundaries = new TreeMap<>();
        for (JsonNode entry : sortedEntries) {
            String timestamp = insertTime(entry);
            Integer explicit = integer(entry.get("run_num"));
            if (explicit != null) {
                boundaries.put(timestamp, explicit);
                continue;
            }
            String content = Optional.ofNullable(text(entry, "content")).orElse("").toLowerCase();
            if (content.contains("run number") && content.contains("running")) {
                String[] words = content.split(":", -1)[0].trim().split("\\s+");
                for (int i = 0; i + 1 < words.length; i++) {
                    if (words[i].equals("number")) {
                        if (RUN_NUMBER.matcher(words[i + 1]).matches()) {
                            boundaries.put(timestamp, Integer.parseInt(words[i + 1]));
                        }
                        break;
                    }
                }
            }
        }
        return boundaries;
    }

    private static Integer inferRun(String timestamp, List<String> boundaryTimes, List<Integer> boundaryRuns) {
        Integer inferred = null;
        for (int i = 0; i < boundaryTimes.size(); i++) {
            String boundary = boundaryTimes.get(i);
            int cmp = timestamp.compareTo(boundary);
            if (cmp < 0) {
                if (i > 0) {
                    inferred = boundaryRuns.get(i - 1);
                }
                break;
            } else if (i == boundaryTimes.size() - 1 || cmp == 0) {
                inferred = boundaryRuns.get(i);
            }
        }
        return inferred;
    }

    private static String insertTime(JsonNode entry) {
        String t = text(entry, "insert_time");
        return t != null ? t : "";
    }

    private static String joinTags(JsonNode tags) {
        if (tags == null || !tags.isArray() || tags.isEmpty()) {
            return null;
        }
        List<String> values = new ArrayList<>();
        tags.forEach(t -> values.add(t.asText()));
        return String.join(",", values);
    }

    // --- runs and files ---

    /**
     * Builds run rows from the per-run detail documents, in run order.
     *
     * @param details Run number to the {@code value} of the run detail response
     */
    static List<RunRecord> toRuns(Map<Integer, JsonNode> details) {
        List<RunRecord> runs = new ArrayList<>(details.size());
        for (Map.Entry<Integer, JsonNode> e : new TreeMap<>(details).entrySet()) {
            JsonNode detail = e.getValue();
            JsonNode params = detail.path("params");
            runs.add(new RunRecord(
                e.getKey(),
                formatTime(text(detail, "begin_time")),
                formatTime(text(detail, "end_time")),
                number(params.get(EVENTS_PARAM)),
                number(params.get(DAMAGED_PARAM)),
                number(params.get(DROPPED_PARAM)),
                text(params, "Prod_start"),
                text(params, "Prod_end"),
                null,
                null));
        }
        return runs;
    }

    /**
     * Builds one status per run and detector across the union of detector keys seen in any run:
     * {@code Checked} if the run reports a truthy value for the detector, {@code Unchecked} otherwise.
     */
    static List<DetectorStatus> toDetectorStatus(Map<Integer, JsonNode> details) {
        TreeSet<String> detectorKeys = new TreeSet<>();
        details.values().forEach(d -> d.path("params").fieldNames().forEachRemaining(k -> {
            if (k.startsWith(DETECTOR_PREFIX)) {
                detectorKeys.add(k);
            }
        }));
        List<DetectorStatus> statuses = new ArrayList<>();
        for (Map.Entry<Integer, JsonNode> e : new TreeMap<>(details).entrySet()) {
            JsonNode params = e.getValue().path("params");
            for (String key : detectorKeys) {
                String status = isTruthy(params.get(key)) ? DetectorStatus.CHECKED : DetectorStatus.UNCHECKED;
                statuses.add(new DetectorStatus(e.getKey(), key, status));
            }
        }
        return statuses;
    }

    /**
     * Adds file counts and total sizes per run. Runs that only appear in the file list get a row
     * of their own.
     */
    static List<RunRecord> mergeFiles(List<RunRecord> runs, JsonNode files) {
        Map<Integer, long[]> perRun = new TreeMap<>();
        for (JsonNode file : files) {
            Integer run = integer(file.get("run_num"));
            if (run == null) {
                continue;
            }
            Long size = number(file.get("size"));
            long[] agg = perRun.computeIfAbsent(run, r -> new long[2]);
            agg[0]++;
            agg[1] += size != null ? size : 0L;
        }
        if (perRun.isEmpty()) {
            return runs;
        }
        Map<Integer, RunRecord> merged = new LinkedHashMap<>();
        runs.forEach(r -> merged.put(r.runNumber(), r));
        perRun.forEach((run, agg) -> merged.merge(run,
            new RunRecord(run, null, null, null, null, null, null, null, agg[0], agg[1]),
            (existing, filesOnly) -> existing.withFiles(agg[0], agg[1])));
        List<RunRecord> result = new ArrayList<>(merged.values());
        result.sort(Comparator.comparingInt(RunRecord::runNumber));
        return result;
    }

    /**
     * Normalizes {@code 2024-01-15T10:00:00+00:00} to {@code 2024-01-15 10:00:00}.
     */
    static String formatTime(String time) {
        if (time == null || time.isEmpty()) {
            return null;
        }
        String normalized = time.replace('T', ' ');
        int plus = normalized.indexOf('+');
        return plus >= 0 ? normalized.substring(0, plus) : normalized;
    }

    // --- questionnaire ---

    static List<QuestionnaireField> toQuestionnaire(String proposal, JsonNode document) {
        List<QuestionnaireField> fields = new ArrayList<>();
        if (document == null || !document.isObject()) {
            return fields;
        }
        Iterator<Map.Entry<String, JsonNode>> categories = document.fields();
        while (categories.hasNext()) {
            Map.Entry<String, JsonNode> category = categories.next();
            if (!category.getValue().isArray()) {
                continue;
            }
            for (JsonNode field : category.getValue()) {
                if (!field.isObject()) {
                    continue;
                }
                String fieldId = text(field, "id");
                if (fieldId == null || fieldId.isEmpty()) {
                    continue;
                }
                fields.add(new QuestionnaireField(
                    proposal,
                    category.getKey(),
                    fieldId,
                    fieldId.replace(category.getKey() + "-", ""),
                    text(field, "val"),
                    text(field, "modified_time"),
                    text(field, "modified_uid")));
            }
        }
        return fields;
    }

    // --- workflows ---

    static List<WorkflowDefinition> toWorkflows(JsonNode workflows) {
        List<WorkflowDefinition> result = new ArrayList<>();
        Map<String, Integer> seenKeys = new HashMap<>();
        int index = 0;
        for (JsonNode w : workflows) {
            String key = Optional.ofNullable(text(w, "_id")).orElse(text(w, "name"));
            if (key == null || key.isBlank()) {
                key = "workflow-" + index;
            }
            int seen = seenKeys.merge(key, 1, Integer::sum);
            if (seen > 1) {
                key = key + "#" + seen;
            }
            JsonNode parameters = w.get("parameters");
            result.add(new WorkflowDefinition(
                key,
                text(w, "name"),
                text(w, "executable"),
                text(w, "trigger"),
                text(w, "location"),
                parameters == null || parameters.isNull() ? null : parameters.toString(),
                text(w, "run_param_name"),
                text(w, "run_param_value"),
                text(w, "run_as_user")));
            index++;
        }
        return result;
    }

    // --- JSON helpers ---

    static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    static Integer integer(JsonNode value) {
        Long n = number(value);
        return n != null ? Math.toIntExact(n) : null;
    }

    static Long number(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asLong();
        }
        if (value.isTextual()) {
            try {
                return Long.parseLong(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static boolean isTruthy(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return false;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isNumber()) {
            return value.asDouble() != 0.0;
        }
        if (value.isTextual()) {
            return !value.asText().isEmpty();
        }
        return !value.isEmpty();
    }
}
