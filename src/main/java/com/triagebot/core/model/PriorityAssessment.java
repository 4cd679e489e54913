package com.triagebot.core.model;

import java.io.Serializable;

public record PriorityAssessment(
    Priority priority,
    Complexity complexity
) implements Serializable {}
