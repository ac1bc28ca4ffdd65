package com.eyelevel.tableingestor.dto.ingestion;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@Schema(description = "Identifies a newly uploaded object to ingest.")
public class UploadEventRequest {

    @NotBlank(message = "The 'bucket' field cannot be empty.")
    @Schema(description = "Bucket holding the object.", example = "uploads")
    private String bucket;

    @NotBlank(message = "The 'key' field cannot be empty.")
    @Schema(description = "Object key.", example = "incoming/sales_2024.csv")
    private String key;
}
