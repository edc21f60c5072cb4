package com.acme.triage.domain;

import java.time.LocalDate;

public record ActionItem(String description, LocalDate deadline, boolean completed) {}
