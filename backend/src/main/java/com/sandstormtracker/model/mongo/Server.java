package com.sandstormtracker.model.mongo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

// ========== Server Entity ==========
@Document(collection = "servers")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Server {
    @Id
    private String id;

    @Indexed(unique = true)
    private String externalId; // log filename stem

    private String name;
    private String logPath;

    private LocalDateTime logFileCreationTime;
    private Long offset;        // resume position for reading
    private Long appliedOffset; // end of the last line applied to match state

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
