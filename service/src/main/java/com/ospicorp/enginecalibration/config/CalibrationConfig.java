package com.ospicorp.enginecalibration.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.enginecalibration.calibration.io.CalibrationModelCodec;
import com.ospicorp.enginecalibration.calibration.io.DataTableCsvWriter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CalibrationConfig {

  @Bean
  CalibrationModelCodec calibrationModelCodec(ObjectMapper objectMapper,
      @Value("${calibration.codec.pretty-print:true}") boolean prettyPrint) {
    return new CalibrationModelCodec(objectMapper, prettyPrint);
  }

  @Bean
  DataTableCsvWriter dataTableCsvWriter() {
    return new DataTableCsvWriter();
  }
}
