package com.t2aassist.model.reference;

import jakarta.persistence.*;
import lombok.*;

/**
 * Co-occurrence harvested from PMSI frequency data, after validation.
 */
@Entity
@Table(name = "observed_association", indexes = {
    @Index(name = "idx_observed_assoc_code", columnList = "code")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObservedAssociation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 13)
    private String code;

    @Column(name = "associated_code", nullable = false, length = 13)
    private String associatedCode;

    @Column(name = "support_count", nullable = false)
    @Builder.Default
    private Integer supportCount = 1;

    // Position in the source listing, 1 = most frequent
    @Column(name = "rank_position")
    private Integer rankPosition;
}
