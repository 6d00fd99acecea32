package org.neurobagel.api.core.service.result;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Component;

import org.neurobagel.api.core.pojo.DatasetMatch;
import org.neurobagel.api.core.pojo.SubjectRow;
import lombok.extern.slf4j.Slf4j;

/**
 * Groups subject-level rows into one {@link DatasetMatch} per dataset.
 *
 * <p>Datasets appear in the order the store first returned them. Each row counts as one matching subject
 * entry, exactly as the store returned it; rows are not de-duplicated again here. Modalities are
 * de-duplicated in first-seen order. Datasets without rows never appear.</p>
 */
@Slf4j
@Component
public class ResultAggregator {

  public List<DatasetMatch> aggregate(List<SubjectRow> rows) {
    log.debug("aggregate.enter; got {} rows", rows.size());
    Map<String, DatasetGroup> groups = new LinkedHashMap<>();
    for (SubjectRow row : rows) {
      groups.computeIfAbsent(row.dataset(), ds -> new DatasetGroup(ds, row.datasetName())).add(row);
    }
    List<DatasetMatch> matches = groups.values().stream().map(DatasetGroup::toMatch).toList();
    log.debug("aggregate.exit; returning {} datasets", matches.size());
    return matches;
  }

  private static final class DatasetGroup {

    private final String dataset;
    private final String datasetName;
    private final List<String> paths = new ArrayList<>();
    private final Set<String> modals = new LinkedHashSet<>();

    private DatasetGroup(String dataset, String datasetName) {
      this.dataset = dataset;
      this.datasetName = datasetName;
    }

    private void add(SubjectRow row) {
      paths.add(row.subjectPath());
      if (row.imageModal() != null) {
        modals.add(row.imageModal());
      }
    }

    private DatasetMatch toMatch() {
      return new DatasetMatch(dataset, datasetName, paths.size(), paths, new ArrayList<>(modals));
    }
  }
}
