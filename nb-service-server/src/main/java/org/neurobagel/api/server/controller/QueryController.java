package org.neurobagel.api.server.controller;

import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import org.neurobagel.api.core.pojo.DatasetMatch;
import org.neurobagel.api.core.pojo.SearchParameters;
import org.neurobagel.api.server.service.QueryService;
import lombok.extern.slf4j.Slf4j;

/**
 * REST endpoint searching subjects by phenotypic and imaging criteria. Every parameter is optional;
 * an absent parameter leaves its criterion unconstrained.
 */
@Slf4j
@RestController
@RequestMapping("/query")
public class QueryController {

  @Autowired
  private QueryService queryService;

  @GetMapping({"", "/"})
  public ResponseEntity<List<DatasetMatch>> query(
      @RequestParam(name = "min_age", required = false) String minAge,
      @RequestParam(name = "max_age", required = false) String maxAge,
      @RequestParam(name = "sex", required = false) String sex,
      @RequestParam(name = "diagnosis", required = false) String diagnosis,
      @RequestParam(name = "is_control", required = false) String isControl,
      @RequestParam(name = "min_num_sessions", required = false) String minNumSessions,
      @RequestParam(name = "assessment", required = false) String assessment,
      @RequestParam(name = "image_modal", required = false) String imageModal) {
    SearchParameters params = SearchParameters.builder()
        .minAge(minAge)
        .maxAge(maxAge)
        .sex(sex)
        .diagnosis(diagnosis)
        .isControl(isControl)
        .minNumSessions(minNumSessions)
        .assessment(assessment)
        .imageModal(imageModal)
        .build();
    log.debug("query.enter; got params: {}", params);
    List<DatasetMatch> result = queryService.search(params);
    log.debug("query.exit; returning {} datasets", result.size());
    return ResponseEntity.ok(result);
  }
}
