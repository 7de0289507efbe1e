package com.eyelevel.extractionpipeline.dto.session;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

@Data
public class StoreRecordsRequest {

    @NotNull(message = "The 'records' field is required.")
    private List<RecordData> records;
}
