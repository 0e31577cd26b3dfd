package com.t2aassist.engine.catalog;

import com.t2aassist.model.enums.CodeStatus;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Immutable view of a CCAM code held by a {@link CodeCatalog}.
 *
 * @param id          stable identifier, upper case
 * @param label       display label
 * @param description descriptive text indexed together with the label
 * @param workValue   ICR work-value unit, never negative
 * @param region      chapter tag used for region comparison, may be null
 */
public record CatalogCode(
    String id,
    String label,
    String description,
    double workValue,
    CodeStatus status,
    String region,
    String regionTitle,
    String paragraphTitle,
    Double privateWorkValue,
    String activity,
    String classant,
    String codingInstruction,
    LocalDate dateEnd
) {

    public CatalogCode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        id = CodeCatalog.normalizeId(id);
        if (workValue < 0 || Double.isNaN(workValue)) {
            throw new IllegalArgumentException("Work value must be non-negative for " + id + ": " + workValue);
        }
        label = label == null ? "" : label;
        description = description == null ? "" : description;
    }

    /**
     * Minimal code, as used by tests and by callers that only need the planning attributes.
     */
    public static CatalogCode of(String id, String label, double workValue, CodeStatus status, String region) {
        return new CatalogCode(id, label, "", workValue, status, region,
            null, null, null, null, null, null, null);
    }

    public boolean isActive() {
        return status == CodeStatus.ACTIVE;
    }

    public boolean sharesRegionWith(CatalogCode other) {
        return region != null && !region.isBlank() && region.equals(other.region);
    }
}
