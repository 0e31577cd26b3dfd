package com.t2aassist.model.reference;

import com.t2aassist.model.enums.AssociationKind;
import jakarta.persistence.*;
import lombok.*;

/**
 * Association sanctioned by the ATIH reference (complementary gesture or anesthesia).
 */
@Entity
@Table(name = "official_association", indexes = {
    @Index(name = "idx_official_assoc_code", columnList = "code")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OfficialAssociation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 13)
    private String code;

    @Column(name = "associated_code", nullable = false, length = 13)
    private String associatedCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "association_type", nullable = false, length = 40)
    private AssociationKind associationType;

    @Column(length = 10)
    private String activity;
}
