package com.t2aassist.model.reference;

import com.t2aassist.model.enums.CodeStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

/**
 * CCAM procedure code as written by the ingestion pipeline.
 * Read-only for this application.
 */
@Entity
@Table(name = "ccam_code", indexes = {
    @Index(name = "idx_ccam_code_chapter", columnList = "chapter_num"),
    @Index(name = "idx_ccam_code_status", columnList = "status")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CcamCode {

    @Id
    @Column(length = 13)
    private String code;

    @Column(nullable = false, length = 1000)
    private String label;

    @Column(length = 4000)
    private String description;

    @Column(name = "icr_public")
    private Double icrPublic;

    @Column(name = "icr_private")
    private Double icrPrivate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private CodeStatus status = CodeStatus.ACTIVE;

    @Column(name = "chapter_num", length = 20)
    private String chapterNum;

    @Column(name = "chapter_title", length = 500)
    private String chapterTitle;

    @Column(name = "paragraph_title", length = 500)
    private String paragraphTitle;

    @Column(length = 10)
    private String activity;

    @Column(length = 10)
    private String classant;

    @Column(name = "coding_instruction", length = 4000)
    private String codingInstruction;

    @Column(name = "date_end")
    private LocalDate dateEnd;
}
