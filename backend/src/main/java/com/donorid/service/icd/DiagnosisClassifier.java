package com.donorid.service.icd;

import com.donorid.model.enums.DiagnosisCategory;

import java.util.Set;

/**
 * Maps a diagnosis code to the categories it belongs to.
 */
public interface DiagnosisClassifier {

    /**
     * @param code raw ICD-10 code in any punctuation or case
     * @return matched categories, empty when none match
     */
    Set<DiagnosisCategory> classify(String code);

    /**
     * Version of the reference table backing this classifier.
     */
    String getVersion();
}
