package com.ospicorp.enginecalibration.calibration.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.ospicorp.enginecalibration.calibration.exception.ModelSerializationException;
import com.ospicorp.enginecalibration.calibration.model.CalibrationModel;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link CalibrationModel}s as flat JSON records so a fit can be reused
 * without the data it came from:
 * <pre>
 * {"degree":2,"coefficients":[...],"domain_min":7.72,"domain_max":18.37,
 *  "window_min":-1.0,"window_max":1.0}
 * </pre>
 */
public class CalibrationModelCodec {

  private final ObjectReader reader;
  private final ObjectWriter writer;

  public CalibrationModelCodec(ObjectMapper objectMapper, boolean prettyPrint) {
    this.reader = objectMapper.readerFor(CalibrationModel.class)
        .with(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
        .with(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
        .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    ObjectWriter base = objectMapper.writerFor(CalibrationModel.class);
    this.writer = prettyPrint ? base.withDefaultPrettyPrinter() : base;
  }

  public String toJson(CalibrationModel model) {
    try {
      return writer.writeValueAsString(model);
    } catch (JsonProcessingException ex) {
      throw new ModelSerializationException("Failed to serialize calibration model", ex);
    }
  }

  /**
   * @throws ModelSerializationException if the text is not a valid model record
   */
  public CalibrationModel fromJson(String json) {
    try {
      CalibrationModel model = reader.readValue(json);
      if (model == null) {
        throw new ModelSerializationException("Calibration model record is empty");
      }
      return model;
    } catch (JsonProcessingException ex) {
      throw new ModelSerializationException(
          "Invalid calibration model record: " + ex.getOriginalMessage(), ex);
    }
  }

  public void write(CalibrationModel model, Path path) throws IOException {
    Files.writeString(path, toJson(model), StandardCharsets.UTF_8);
  }

  public CalibrationModel read(Path path) throws IOException {
    return fromJson(Files.readString(path, StandardCharsets.UTF_8));
  }
}
