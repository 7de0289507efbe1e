package com.eyelevel.extractionpipeline.service.export;

import com.eyelevel.extractionpipeline.config.PipelineConfig;
import com.eyelevel.extractionpipeline.dto.export.DownloadInfo;
import com.eyelevel.extractionpipeline.dto.export.DownloadResult;
import com.eyelevel.extractionpipeline.dto.export.StorageStats;
import com.eyelevel.extractionpipeline.dto.session.RecordData;
import com.eyelevel.extractionpipeline.exception.apiclient.BadRequestException;
import com.eyelevel.extractionpipeline.exception.apiclient.NotFoundException;
import com.eyelevel.extractionpipeline.model.CompressionType;
import com.eyelevel.extractionpipeline.model.ExportJob;
import com.eyelevel.extractionpipeline.model.ExportStatus;
import com.eyelevel.extractionpipeline.model.ExtractedRecord;
import com.eyelevel.extractionpipeline.model.ProcessingSession;
import com.eyelevel.extractionpipeline.service.session.SessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExportServiceTest {

    @TempDir
    Path tempDir;

    private PipelineConfig config;
    private ArtifactStorage artifactStorage;
    private ExportJobRegistry exportJobRegistry;
    private CsvArtifactWriter csvArtifactWriter;
    private CompressionService compressionService;
    private DownloadLinkService downloadLinkService;
    private SessionService sessionService;
    private ExportService exportService;

    @BeforeEach
    void setUp() {
        config = new PipelineConfig();
        config.getExport().setBaseDir(tempDir.toString());
        artifactStorage = new ArtifactStorage(config);
        artifactStorage.init();
        exportJobRegistry = new ExportJobRegistry();
        csvArtifactWriter = spy(new CsvArtifactWriter(config));
        compressionService = spy(new CompressionService());
        downloadLinkService = new DownloadLinkService(config);
        sessionService = mock(SessionService.class);
        exportService = serviceWith(new SimpleAsyncTaskExecutor("export-test-"));
    }

    private ExportService serviceWith(AsyncTaskExecutor executor) {
        return new ExportService(exportJobRegistry, csvArtifactWriter, compressionService, downloadLinkService,
                                 artifactStorage, sessionService, executor, config);
    }

    private static List<RecordData> records(int count) {
        return IntStream.range(0, count)
                        .mapToObj(i -> new RecordData(Map.of("id", i, "vendor", "Acme"), Map.of(), i % 10 == 0))
                        .toList();
    }

    private ExportJob awaitTerminal(String jobId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        ExportJob job = exportService.getStatus(jobId).orElseThrow();
        while (!job.getStatus().isTerminal() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            job = exportService.getStatus(jobId).orElseThrow();
        }
        return job;
    }

    private long filesUnder(String dir) throws IOException {
        try (Stream<Path> files = Files.list(tempDir.resolve(dir))) {
            return files.count();
        }
    }

    @Test
    @DisplayName("a synchronous export of a large set completes with a download link")
    void synchronousLargeExport() throws IOException {
        // when
        String jobId = exportService.createExport("s1", records(12_000), "march report", CompressionType.NONE, true);

        // then
        ExportJob job = exportService.getStatus(jobId).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(ExportStatus.COMPLETED);
        assertThat(job.getProcessedRecords()).isEqualTo(12_000);
        assertThat(job.getProgressPercentage()).isEqualTo(100.0);
        assertThat(job.getDownloadToken()).isNotNull();
        assertThat(job.getArtifactPath().getFileName().toString()).startsWith("march_report_s1_" + jobId);
        assertThat(Files.readAllLines(job.getArtifactPath())).hasSize(12_001);
        assertThat(job.getSizeBytes()).isEqualTo(Files.size(job.getArtifactPath()));
    }

    @Test
    @DisplayName("download info describes a completed export and the token serves the file")
    void downloadInfoAndDownload() {
        // given
        String jobId = exportService.createExport("s1", records(3), "small", CompressionType.NONE, true);

        // when
        DownloadInfo info = exportService.getDownloadInfo(jobId).orElseThrow();
        DownloadResult result = exportService.download(info.token());

        // then
        assertThat(info.downloadUrl()).endsWith("/api/v1/downloads/" + info.token());
        assertThat(info.remainingDownloads()).isEqualTo(10);
        assertThat(info.filename()).endsWith(".csv");
        assertThat(result.authorized()).isTrue();
        assertThat(result.path()).isRegularFile();
        assertThat(exportService.getDownloadInfo(jobId).orElseThrow().remainingDownloads()).isEqualTo(9);
    }

    @Test
    @DisplayName("gzip exports produce a compressed artifact holding the same CSV")
    void gzipExport() throws IOException {
        // given
        String jobId = exportService.createExport("s1", records(500), "gz", CompressionType.GZIP, true);
        ExportJob job = exportService.getStatus(jobId).orElseThrow();

        // then
        assertThat(job.getStatus()).isEqualTo(ExportStatus.COMPLETED);
        assertThat(job.getFinalArtifactPath().toString()).endsWith(".csv.gz");
        assertThat(job.getCompressedSizeBytes()).isPositive().isLessThan(job.getSizeBytes());
        assertThat(job.getCompressionRatio()).isPositive();
        try (InputStream in = new GZIPInputStream(Files.newInputStream(job.getCompressedPath()))) {
            String csv = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            assertThat(csv).isEqualTo(Files.readString(job.getArtifactPath()));
        }
        assertThat(exportService.getDownloadInfo(jobId).orElseThrow().compressionType())
                .isEqualTo(CompressionType.GZIP);
    }

    @Test
    @DisplayName("zip exports contain one CSV entry named after the export")
    void zipExport() throws IOException {
        String jobId = exportService.createExport("s1", records(10), "ledger", CompressionType.ZIP, true);
        ExportJob job = exportService.getStatus(jobId).orElseThrow();

        try (ZipInputStream zip = new ZipInputStream(Files.newInputStream(job.getCompressedPath()))) {
            ZipEntry entry = zip.getNextEntry();
            assertThat(entry).isNotNull();
            assertThat(entry.getName()).isEqualTo("ledger.csv");
            assertThat(zip.getNextEntry()).isNull();
        }
    }

    @Test
    @DisplayName("concurrent exports complete independently with distinct artifacts")
    void concurrentExports() throws InterruptedException {
        // when
        String first = exportService.createExport("s1", records(6_000), "one", CompressionType.NONE, false);
        String second = exportService.createExport("s2", records(7_000), "two", CompressionType.GZIP, false);

        // then
        ExportJob one = awaitTerminal(first);
        ExportJob two = awaitTerminal(second);
        assertThat(one.getStatus()).isEqualTo(ExportStatus.COMPLETED);
        assertThat(two.getStatus()).isEqualTo(ExportStatus.COMPLETED);
        assertThat(one.getProcessedRecords()).isEqualTo(6_000);
        assertThat(two.getProcessedRecords()).isEqualTo(7_000);
        assertThat(one.getFinalArtifactPath()).isNotEqualTo(two.getFinalArtifactPath());
        assertThat(one.getDownloadToken()).isNotEqualTo(two.getDownloadToken());
    }

    @Test
    @DisplayName("an export cancelled before it starts never writes a file")
    void cancelBeforeStart() throws IOException {
        // given
        AsyncTaskExecutor executor = mock(AsyncTaskExecutor.class);
        ExportService service = serviceWith(executor);
        String jobId = service.createExport("s1", records(10), "queued", CompressionType.NONE, false);
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(executor).execute(task.capture());

        // when
        boolean cancelled = service.cancel(jobId);
        task.getValue().run();

        // then
        ExportJob job = service.getStatus(jobId).orElseThrow();
        assertThat(cancelled).isTrue();
        assertThat(job.getStatus()).isEqualTo(ExportStatus.CANCELLED);
        assertThat(job.getErrorMessage()).isEqualTo("Export cancelled by user");
        assertThat(job.getCompletedAt()).isNotNull();
        assertThat(filesUnder("raw")).isZero();
        assertThat(service.cancel(jobId)).isFalse();
    }

    @Test
    @DisplayName("an export cancelled while writing is discarded without a download link")
    void cancelDuringGeneration() throws IOException {
        // given
        doAnswer(invocation -> {
            String jobId = exportJobRegistry.snapshots(job -> true).get(0).getJobId();
            exportService.cancel(jobId);
            return invocation.callRealMethod();
        }).when(csvArtifactWriter).write(any(), anyList(), anyMap(), any(), any());

        // when
        String jobId = exportService.createExport("s1", records(100), "busy", CompressionType.NONE, true);

        // then
        ExportJob job = exportService.getStatus(jobId).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(ExportStatus.CANCELLED);
        assertThat(job.getDownloadToken()).isNull();
        assertThat(job.getArtifactPath()).isNull();
        assertThat(exportService.getDownloadInfo(jobId)).isEmpty();
        assertThat(filesUnder("raw")).isZero();
    }

    @Test
    @DisplayName("a failure while compressing fails the export and removes partial files")
    void compressionFailure() throws IOException {
        // given
        doThrow(new IOException("disk full")).when(compressionService)
                                            .compress(any(), any(), eq(CompressionType.GZIP), anyString());

        // when
        String jobId = exportService.createExport("s1", records(20), "broken", CompressionType.GZIP, true);

        // then
        ExportJob job = exportService.getStatus(jobId).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(ExportStatus.FAILED);
        assertThat(job.getErrorMessage()).isEqualTo("disk full");
        assertThat(job.getDownloadToken()).isNull();
        assertThat(filesUnder("raw")).isZero();
        assertThat(filesUnder("compressed")).isZero();
        assertThat(exportService.cancel(jobId)).isFalse();
    }

    @Test
    @DisplayName("invalid export requests are rejected")
    void validation() {
        assertThatThrownBy(() -> exportService.createExport("", records(1), "x", CompressionType.NONE, true))
                .isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> exportService.createExport("s1", records(1), " ", CompressionType.NONE, true))
                .isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> exportService.createExport("s1", null, "x", CompressionType.NONE, true))
                .isInstanceOf(BadRequestException.class);
    }

    @Test
    @DisplayName("session exports use the session's column mappings as the header")
    void sessionExportUsesColumnMappings() throws IOException {
        // given
        ProcessingSession session = new ProcessingSession();
        session.setSessionId("s1");
        Map<String, Object> mappings = new LinkedHashMap<>();
        mappings.put("total", "Total");
        mappings.put("vendor", "Vendor_Name");
        session.setColumnMappings(mappings);
        ExtractedRecord record = new ExtractedRecord();
        record.setFieldValues(Map.of("vendor", "Acme", "total", "120.00", "ignored", "x"));
        record.setFlagged(true);
        when(sessionService.getSession("s1")).thenReturn(Optional.of(session));
        when(sessionService.getRecords("s1", true)).thenReturn(List.of(record));

        // when
        String jobId = exportService.createExportForSession("s1", "review", CompressionType.NONE, true, true);

        // then
        ExportJob job = exportService.getStatus(jobId).orElseThrow();
        assertThat(Files.readAllLines(job.getArtifactPath())).containsExactly("Total,Vendor_Name", "120.00,Acme");
    }

    @Test
    @DisplayName("exporting an unknown session fails")
    void sessionExportUnknownSession() {
        when(sessionService.getSession("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> exportService.createExportForSession("missing", "x", CompressionType.NONE, false,
                                                                      true))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("exports are listed per session, newest first")
    void listForSession() throws InterruptedException {
        String older = exportService.createExport("s1", records(1), "a", CompressionType.NONE, true);
        Thread.sleep(5);
        String newer = exportService.createExport("s1", records(1), "b", CompressionType.NONE, true);
        exportService.createExport("s2", records(1), "c", CompressionType.NONE, true);

        assertThat(exportService.listForSession("s1")).extracting(ExportJob::getJobId).containsExactly(newer, older);
    }

    @Test
    @DisplayName("cleanup removes expired exports with their files and links")
    void cleanupExpired() throws IOException {
        // given
        String jobId = exportService.createExport("s1", records(5), "old", CompressionType.GZIP, true);
        String token = exportService.getStatus(jobId).orElseThrow().getDownloadToken();
        config.getExport().setRetentionHours(0);

        // when
        int removed = exportService.cleanupExpired();

        // then
        assertThat(removed).isEqualTo(1);
        assertThat(exportService.getStatus(jobId)).isEmpty();
        assertThat(downloadLinkService.find(token)).isEmpty();
        assertThat(filesUnder("raw")).isZero();
        assertThat(filesUnder("compressed")).isZero();
    }

    @Test
    @DisplayName("storage stats count artifacts and tracked exports")
    void storageStats() {
        exportService.createExport("s1", records(5), "stats", CompressionType.ZIP, true);

        StorageStats stats = exportService.storageStats();

        assertThat(stats.fileCount()).isEqualTo(2);
        assertThat(stats.activeJobs()).isEqualTo(1);
        assertThat(stats.totalSizeBytes()).isPositive();
        assertThat(stats.baseDirectory()).isEqualTo(tempDir.toAbsolutePath().toString());
    }
}
