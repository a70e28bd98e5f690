package com.ospicorp.enginecalibration.calibration.model;

public record FittedColumn(String column, CalibrationModel model, FitQuality quality) {}
