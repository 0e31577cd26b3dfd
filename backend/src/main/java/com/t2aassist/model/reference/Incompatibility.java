package com.t2aassist.model.reference;

import jakarta.persistence.*;
import lombok.*;

/**
 * Pair of codes that cannot be billed together on one claim.
 */
@Entity
@Table(name = "incompatibility", indexes = {
    @Index(name = "idx_incompatibility_code", columnList = "code")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Incompatibility {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 13)
    private String code;

    @Column(name = "incompatible_code", nullable = false, length = 13)
    private String incompatibleCode;
}
