package org.neurobagel.api.core.pojo;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-dataset summary of the subjects matching a search.
 */
public record DatasetMatch(
    @JsonProperty("dataset") String dataset,
    @JsonProperty("dataset_name") String datasetName,
    @JsonProperty("num_matching_subjects") int numMatchingSubjects,
    @JsonProperty("subject_file_paths") List<String> subjectFilePaths,
    @JsonProperty("image_modals") List<String> imageModals) {

  public DatasetMatch {
    subjectFilePaths = List.copyOf(subjectFilePaths);
    imageModals = List.copyOf(imageModals);
  }
}
