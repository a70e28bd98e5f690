package com.ospicorp.enginecalibration;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.enginecalibration.calibration.io.CalibrationModelCodec;
import com.ospicorp.enginecalibration.calibration.io.DataTableCsvWriter;
import com.ospicorp.enginecalibration.calibration.service.CalibrationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest
class CalibrationApplicationSmokeTest {

  @Autowired
  private ApplicationContext context;

  @Autowired
  private CalibrationService calibrationService;

  @Test
  void contextLoads() {
    assertThat(context).isNotNull();
    assertThat(context.getBean(CalibrationModelCodec.class)).isNotNull();
    assertThat(context.getBean(DataTableCsvWriter.class)).isNotNull();
  }

  @Test
  void applicationPropertiesAreApplied() {
    assertThat(calibrationService.selectionThreshold()).isEqualTo(0.01);
    assertThat(calibrationService.predictedColumn()).isEqualTo("TSFC (cruise, predicted)");
    assertThat(calibrationService.extrapolatedColumn()).isEqualTo("Extrapolated");
  }
}
