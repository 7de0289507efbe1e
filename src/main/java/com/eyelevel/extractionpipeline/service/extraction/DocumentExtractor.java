package com.eyelevel.extractionpipeline.service.extraction;

import com.eyelevel.extractionpipeline.exception.ExtractionException;

import java.nio.file.Path;
import java.util.Map;

/**
 * Turns a stored document into structured records. Implementations are supplied by the deployment
 * (PDF, DOCX, OCR and so on); the pipeline treats them as a black box.
 */
public interface DocumentExtractor {

    /**
     * @param file   The uploaded document.
     * @param config Opaque processing options taken from the job.
     *
     * @throws ExtractionException if the document cannot be processed.
     */
    ExtractionResult extract(Path file, Map<String, Object> config) throws ExtractionException;
}
