package com.eyelevel.extractionpipeline.service.export;

import com.eyelevel.extractionpipeline.config.PipelineConfig;
import com.eyelevel.extractionpipeline.dto.session.RecordData;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Writes record sets to CSV. Sets larger than the batch threshold are streamed in fixed-size batches,
 * flushing and reporting progress after each one and checking for cancellation in between.
 */
@Slf4j
@Component
public class CsvArtifactWriter {

    private final CsvMapper csvMapper = new CsvMapper();
    private final PipelineConfig pipelineConfig;

    public CsvArtifactWriter(PipelineConfig pipelineConfig) {
        this.pipelineConfig = pipelineConfig;
    }

    /**
     * @param columns   Field name to header label, in output order. When empty, the ordered union of the
     *                  records' field names is used as both.
     * @param cancelled Polled before every batch.
     *
     * @return the number of records written.
     *
     * @throws CancellationException if {@code cancelled} turns true before all batches are written.
     */
    public int write(Path target, List<RecordData> records, Map<String, String> columns,
                     BatchProgressCallback callback, BooleanSupplier cancelled) throws IOException {
        Map<String, String> layout = columns == null || columns.isEmpty() ? deriveColumns(records) : columns;
        List<String> fields = new ArrayList<>(layout.keySet());
        CsvSchema.Builder builder = CsvSchema.builder().setUseHeader(true);
        layout.values().forEach(builder::addColumn);
        CsvSchema schema = builder.build();

        int total = records.size();
        PipelineConfig.Export config = pipelineConfig.getExport();
        int batchSize = total > config.getBatchThreshold() ? Math.max(1, config.getBatchSize()) : Math.max(1, total);

        int written = 0;
        try (BufferedWriter out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             SequenceWriter rows = csvMapper.writer(schema).writeValues(out)) {
            while (written < total) {
                if (cancelled.getAsBoolean()) {
                    throw new CancellationException("Export cancelled after " + written + " record(s)");
                }
                int end = Math.min(total, written + batchSize);
                for (RecordData record : records.subList(written, end)) {
                    rows.write(toRow(record, fields));
                }
                rows.flush();
                written = end;
                callback.onBatchWritten(written, total);
            }
        }
        log.debug("Wrote {} record(s) to {}", written, target);
        return written;
    }

    private static Map<String, String> deriveColumns(List<RecordData> records) {
        Map<String, String> columns = new LinkedHashMap<>();
        for (RecordData record : records) {
            record.fieldValues().keySet().forEach(field -> columns.putIfAbsent(field, field));
        }
        return columns;
    }

    private static List<String> toRow(RecordData record, List<String> fields) {
        List<String> row = new ArrayList<>(fields.size());
        for (String field : fields) {
            Object value = record.fieldValues().get(field);
            row.add(value == null ? "" : String.valueOf(value));
        }
        return row;
    }
}
