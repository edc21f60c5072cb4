package com.acme.triage.domain;

import java.util.List;

/** Named entities the classifier picked out of the message. */
public record DetectedEntities(
    List<String> courseCodes,
    List<String> companyNames,
    List<String> eventNames,
    List<String> professorNames,
    List<String> amounts,
    List<String> locations,
    List<String> phoneNumbers,
    List<String> urls) {

  private static final DetectedEntities NONE =
      new DetectedEntities(null, null, null, null, null, null, null, null);

  public DetectedEntities {
    courseCodes = copy(courseCodes);
    companyNames = copy(companyNames);
    eventNames = copy(eventNames);
    professorNames = copy(professorNames);
    amounts = copy(amounts);
    locations = copy(locations);
    phoneNumbers = copy(phoneNumbers);
    urls = copy(urls);
  }

  public static DetectedEntities none() {
    return NONE;
  }

  private static List<String> copy(List<String> values) {
    return values == null ? List.of() : List.copyOf(values);
  }
}
