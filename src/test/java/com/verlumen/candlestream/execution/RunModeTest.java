package com.verlumen.candlestream.execution;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.inject.Guice;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RunModeTest {
  @Test
  public void fromString_ignoresCaseAndWhitespace() {
    assertThat(RunMode.fromString("dry")).isEqualTo(RunMode.DRY);
    assertThat(RunMode.fromString(" Wet ")).isEqualTo(RunMode.WET);
  }

  @Test
  public void fromString_unknownMode_throws() {
    assertThrows(IllegalArgumentException.class, () -> RunMode.fromString("damp"));
  }

  @Test
  public void executionModule_bindsRunMode() {
    // Act
    RunMode bound =
        Guice.createInjector(ExecutionModule.create(RunMode.WET)).getInstance(RunMode.class);

    // Assert
    assertThat(bound).isEqualTo(RunMode.WET);
  }
}
