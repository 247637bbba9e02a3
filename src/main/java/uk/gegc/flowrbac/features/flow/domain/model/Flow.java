package uk.gegc.flowrbac.features.flow.domain.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@Table(name = "flows", indexes = @Index(name = "idx_flow_folder", columnList = "folder_id"))
public class Flow {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "flow_id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "user_id")
    private UUID userId;

    /**
     * Parent project; null for a standalone flow.
     */
    @Column(name = "folder_id")
    private UUID folderId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
