package com.donorid.dto.response;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for one row of the annotated output table. Unknown features are null.
 */
public record HospitalizationOutcomeDto(
    String hospitalizationId,
    List<String> sourceHospitalizationIds,
    String patientId,
    String calcState,
    String clifState,
    Map<String, Boolean> flags,
    LocalDateTime deathDttm,
    Double ageYears,
    String locationAtDeath,
    boolean everIcu,
    Double maxCreatinine,
    Double maxBilirubinTotal,
    Double maxAst,
    Double maxAlt,
    Double bmi,
    boolean imvWithinLookback,
    boolean positiveBloodCulture,
    boolean crrtDuringStay,
    LocalDateTime firstVitalDttm,
    LocalDateTime lastVitalDttm
) {}
