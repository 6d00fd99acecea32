package org.neurobagel.api.core.pojo;

/**
 * One subject-level match as returned by the graph store: a subject's session path together with
 * one image modality acquired in it.
 *
 * @param dataset     dataset IRI
 * @param datasetName human-readable dataset label
 * @param subjectId   subject label within the dataset
 * @param subjectPath file path of the matching session
 * @param imageModal  modality IRI
 * @param numSessions number of imaging sessions of the subject, null if the store did not report it
 */
public record SubjectRow(String dataset, String datasetName, String subjectId, String subjectPath,
    String imageModal, Integer numSessions) {
}
