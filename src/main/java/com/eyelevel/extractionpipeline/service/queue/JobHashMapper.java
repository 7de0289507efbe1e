package com.eyelevel.extractionpipeline.service.queue;

import com.eyelevel.extractionpipeline.common.json.JsonParser;
import com.eyelevel.extractionpipeline.common.json.JsonSerializer;
import com.eyelevel.extractionpipeline.model.Job;
import com.eyelevel.extractionpipeline.model.JobStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts between {@link Job} snapshots and the flat string fields stored per job. Absent values are
 * omitted from the hash rather than written as empty strings.
 */
@Component
@RequiredArgsConstructor
public class JobHashMapper {

    public static final String ID = "id";
    public static final String FILE_REFERENCE = "file_reference";
    public static final String SESSION_ID = "session_id";
    public static final String CONFIG = "config";
    public static final String STATUS = "status";
    public static final String CREATED_AT = "created_at";
    public static final String STARTED_AT = "started_at";
    public static final String COMPLETED_AT = "completed_at";
    public static final String PROGRESS = "progress";
    public static final String PROGRESS_MESSAGE = "progress_message";
    public static final String ERROR_MESSAGE = "error_message";
    public static final String RESULT = "result";
    /**
     * Identifies the last status write so a retried write can recognise that it already landed.
     */
    public static final String WRITE_TOKEN = "write_token";

    private final JsonSerializer jsonSerializer;
    private final JsonParser jsonParser;

    public Map<String, String> toFields(Job job) {
        Map<String, String> fields = new LinkedHashMap<>();
        putIfPresent(fields, ID, job.getId());
        putIfPresent(fields, FILE_REFERENCE, job.getFileReference());
        putIfPresent(fields, SESSION_ID, job.getSessionId());
        fields.put(CONFIG, toJson(job.getConfig()));
        putIfPresent(fields, STATUS, job.getStatus() != null ? job.getStatus().value() : null);
        putIfPresent(fields, CREATED_AT, formatTime(job.getCreatedAt()));
        putIfPresent(fields, STARTED_AT, formatTime(job.getStartedAt()));
        putIfPresent(fields, COMPLETED_AT, formatTime(job.getCompletedAt()));
        fields.put(PROGRESS, String.valueOf(job.getProgress()));
        putIfPresent(fields, PROGRESS_MESSAGE, job.getProgressMessage());
        putIfPresent(fields, ERROR_MESSAGE, job.getErrorMessage());
        fields.put(RESULT, toJson(job.getResult()));
        return fields;
    }

    public Job fromFields(Map<String, String> fields) {
        return Job.builder()
                  .id(fields.get(ID))
                  .fileReference(fields.get(FILE_REFERENCE))
                  .sessionId(fields.get(SESSION_ID))
                  .config(jsonParser.parseMap(fields.get(CONFIG)))
                  .status(JobStatus.fromValue(fields.get(STATUS)))
                  .createdAt(parseTime(fields.get(CREATED_AT)))
                  .startedAt(parseTime(fields.get(STARTED_AT)))
                  .completedAt(parseTime(fields.get(COMPLETED_AT)))
                  .progress(StringUtils.hasText(fields.get(PROGRESS)) ? Integer.parseInt(fields.get(PROGRESS)) : 0)
                  .progressMessage(fields.get(PROGRESS_MESSAGE))
                  .errorMessage(fields.get(ERROR_MESSAGE))
                  .result(jsonParser.parseMap(fields.get(RESULT)))
                  .build();
    }

    public String toJson(Map<String, Object> payload) {
        return jsonSerializer.serialize(payload != null ? payload : Map.of());
    }

    public static String formatTime(LocalDateTime time) {
        return time != null ? time.toString() : null;
    }

    public static LocalDateTime parseTime(String value) {
        return StringUtils.hasText(value) ? LocalDateTime.parse(value) : null;
    }

    private static void putIfPresent(Map<String, String> fields, String name, String value) {
        if (value != null) {
            fields.put(name, value);
        }
    }
}
