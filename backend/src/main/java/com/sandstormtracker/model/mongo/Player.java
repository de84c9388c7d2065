package com.sandstormtracker.model.mongo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

// ========== Player Entity ==========
@Document(collection = "players")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Player {
    @Id
    private String id;

    @Indexed(unique = true)
    private String platformId;

    @Indexed
    private String name;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
