package com.github.salilvnair.formflow.engine.model;

import java.util.Map;

public record SessionSnapshot(Map<String, String> finalData, int fieldsCollected) {
}
