package com.forecastmonitor.model;

import java.util.UUID;

public record ForecastRef(UUID id, String title, String modelName) {}
